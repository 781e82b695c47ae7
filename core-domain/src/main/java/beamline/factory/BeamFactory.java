package beamline.factory;

import beamline.config.BeamConfig;
import beamline.domain.beam.BeamModel;
import beamline.domain.beam.MonochromaticBeam;
import beamline.domain.beam.PolychromaticBeam;
import beamline.physics.geometry.Vec3;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Fábrica de modelos de haz para los lectores de formatos de imagen y las etapas de calibración.
 * <p>
 * Cubre los casos habituales: haz simple a lo largo de +z, haz con dirección explícita,
 * haz con polarización, haz policromático y construcción completa desde {@link BeamConfig}.
 */
@Slf4j
public final class BeamFactory {

    private BeamFactory() {
    }

    /**
     * Haz monocromático con dirección muestra → fuente (0,0,1) y el resto de valores por defecto.
     *
     * @param wavelength Longitud de onda en Å (> 0).
     */
    public static MonochromaticBeam simple(double wavelength) {
        return simpleDirectional(Vec3.UNIT_Z, wavelength);
    }

    /**
     * @param sampleToSource Dirección muestra → fuente (no nula).
     * @param wavelength     Longitud de onda en Å (> 0).
     */
    public static MonochromaticBeam simpleDirectional(Vec3 sampleToSource, double wavelength) {
        requirePositiveWavelength(wavelength);
        MonochromaticBeam beam = new MonochromaticBeam(sampleToSource, wavelength);
        log.debug("Haz simple creado: λ={} Å, dirección={}", wavelength, beam.getSampleToSourceDirection());
        return beam;
    }

    /**
     * Haz monocromático con polarización explícita.
     *
     * @param sampleToSource       Dirección muestra → fuente (no nula).
     * @param polarizationFraction Fracción de polarización.
     * @param polarizationNormal   Normal al plano de polarización (no nula).
     * @param wavelength           Longitud de onda en Å (> 0).
     */
    public static MonochromaticBeam complex(Vec3 sampleToSource,
                                            double polarizationFraction,
                                            Vec3 polarizationNormal,
                                            double wavelength) {
        MonochromaticBeam beam = simpleDirectional(sampleToSource, wavelength);
        beam.setPolarizationNormal(polarizationNormal);
        beam.setPolarizationFraction(polarizationFraction);
        return beam;
    }

    /**
     * @param sampleToSource         Dirección muestra → fuente (no nula).
     * @param sampleToSourceDistance Distancia muestra-fuente en mm ({@code >= 0}).
     */
    public static PolychromaticBeam polychromatic(Vec3 sampleToSource, double sampleToSourceDistance) {
        PolychromaticBeam beam = new PolychromaticBeam(sampleToSource, sampleToSourceDistance);
        log.debug("Haz policromático creado: dirección={}, distancia={} mm",
                beam.getSampleToSourceDirection(), sampleToSourceDistance);
        return beam;
    }

    /**
     * Construye la variante indicada por {@code config.polychromatic()} aplicando todos los campos.
     *
     * @param config Configuración del haz (no nula).
     * @return un {@link PolychromaticBeam} o un {@link MonochromaticBeam}.
     */
    public static BeamModel fromConfig(BeamConfig config) {
        Objects.requireNonNull(config, "La configuración del haz no puede ser nula.");
        BeamModel beam;
        if (config.polychromatic()) {
            beam = new PolychromaticBeam(
                    config.direction(),
                    config.divergence(),
                    config.sigmaDivergence(),
                    config.polarizationNormal(),
                    config.polarizationFraction(),
                    config.flux(),
                    config.transmission(),
                    config.probe(),
                    config.sampleToSourceDistance());
        } else {
            requirePositiveWavelength(config.wavelength());
            beam = new MonochromaticBeam(
                    config.direction(),
                    config.wavelength(),
                    config.divergence(),
                    config.sigmaDivergence(),
                    config.polarizationNormal(),
                    config.polarizationFraction(),
                    config.flux(),
                    config.transmission(),
                    config.probe(),
                    config.sampleToSourceDistance());
        }
        log.debug("Haz creado desde configuración ({}): sonda={}",
                beam.hasFixedWavelength() ? "monocromático" : "policromático", beam.getProbeName());
        return beam;
    }

    /**
     * Copia del haz con un modelo variable por punto de escaneo. El original no se modifica.
     *
     * @param beam           Haz estático de referencia.
     * @param s0AtScanPoints Vector de onda por punto de escaneo.
     */
    public static MonochromaticBeam withScanVaryingS0(MonochromaticBeam beam, List<Vec3> s0AtScanPoints) {
        MonochromaticBeam copy = beam.copy();
        copy.setS0AtScanPoints(s0AtScanPoints);
        return copy;
    }

    private static void requirePositiveWavelength(double wavelength) {
        if (!(wavelength > 0.0)) {
            throw new IllegalArgumentException("La longitud de onda debe ser positiva: " + wavelength);
        }
    }
}
