package beamline.config;

import beamline.domain.beam.Probe;
import beamline.physics.geometry.Vec3;
import lombok.Builder;
import lombok.With;

/**
 * Un objeto de valor inmutable con todos los parámetros necesarios para construir
 * el modelo del haz de un experimento.
 * <p>
 * Lo consume {@link beamline.factory.BeamFactory#fromConfig(BeamConfig)}. Si
 * {@code polychromatic} es {@code true}, el campo {@code wavelength} se ignora.
 *
 * @param polychromatic          Si el haz no tiene una longitud de onda fija.
 * @param probe                  Tipo de radiación.
 * @param direction              Dirección muestra → fuente (no nula; se normaliza al construir el haz).
 * @param wavelength             Longitud de onda en Å (solo haces monocromáticos).
 * @param divergence             Divergencia del haz en radianes.
 * @param sigmaDivergence        Desviación estándar de la divergencia en radianes.
 * @param polarizationNormal     Normal al plano de polarización.
 * @param polarizationFraction   Fracción de polarización (0..1).
 * @param flux                   Flujo del haz.
 * @param transmission           Transmisión (0..1).
 * @param sampleToSourceDistance Distancia muestra-fuente en mm.
 */
@Builder
@With
public record BeamConfig(
        boolean polychromatic,
        Probe probe,

        // --- Geometría ---
        Vec3 direction,
        double wavelength,
        double divergence,
        double sigmaDivergence,

        // --- Polarización ---
        Vec3 polarizationNormal,
        double polarizationFraction,

        // --- Intensidad ---
        double flux,
        double transmission,

        double sampleToSourceDistance
) {
    /**
     * Haz de rayos X de 1 Å a lo largo de +z, con los valores por defecto del modelo.
     */
    public static BeamConfig getDefaultBeam() {
        return BeamConfig.builder()
                .polychromatic(false)
                .probe(Probe.XRAY)
                .direction(Vec3.UNIT_Z)
                .wavelength(1.0)
                .divergence(0.0)
                .sigmaDivergence(0.0)
                .polarizationNormal(Vec3.UNIT_Y)
                .polarizationFraction(0.999)
                .flux(0.0)
                .transmission(1.0)
                .sampleToSourceDistance(0.0)
                .build();
    }
}
