package beamline.domain.beam;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Tolerancias para las comparaciones de similitud entre haces.
 * <p>
 * Cada campo que el llamador no fije en el builder queda en {@link #DEFAULT_TOLERANCE}.
 * Los ángulos (dirección y normal de polarización) se expresan en radianes.
 */
@Value
@Builder(toBuilder = true)
@With
public class BeamTolerance {

    public static final double DEFAULT_TOLERANCE = 1.0e-6;

    @Builder.Default
    double wavelength = DEFAULT_TOLERANCE;
    @Builder.Default
    double direction = DEFAULT_TOLERANCE;
    @Builder.Default
    double polarizationNormal = DEFAULT_TOLERANCE;
    @Builder.Default
    double polarizationFraction = DEFAULT_TOLERANCE;
    @Builder.Default
    double divergence = DEFAULT_TOLERANCE;
    @Builder.Default
    double sigmaDivergence = DEFAULT_TOLERANCE;
    @Builder.Default
    double flux = DEFAULT_TOLERANCE;
    @Builder.Default
    double transmission = DEFAULT_TOLERANCE;
    @Builder.Default
    double sampleToSourceDistance = DEFAULT_TOLERANCE;

    /**
     * @return tolerancias por defecto (1e-6) en todos los campos.
     */
    public static BeamTolerance defaults() {
        return BeamTolerance.builder().build();
    }

    /**
     * Tolerancias para la sobrecarga "núcleo" de la similitud: las cuatro dadas y las
     * extendidas por defecto.
     */
    public static BeamTolerance ofCore(double wavelength,
                                       double direction,
                                       double polarizationNormal,
                                       double polarizationFraction) {
        return BeamTolerance.builder()
                .wavelength(wavelength)
                .direction(direction)
                .polarizationNormal(polarizationNormal)
                .polarizationFraction(polarizationFraction)
                .build();
    }
}
