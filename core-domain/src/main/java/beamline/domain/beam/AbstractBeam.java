package beamline.domain.beam;

import beamline.physics.geometry.AngleSafe;
import beamline.physics.geometry.Vec3;
import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * Estado y reglas comunes a las dos variantes de {@link BeamModel}.
 * <p>
 * Centraliza la normalización de la dirección, la validación de la distancia y las
 * comparaciones por tolerancia de los campos que ambas variantes comparten. Cada
 * variante añade encima la comparación de lo que solo ella soporta.
 */
@Getter
abstract sealed class AbstractBeam permits MonochromaticBeam, PolychromaticBeam {

    /** Tolerancia fija de la igualdad estricta. */
    static final double EQUALITY_EPSILON = 1.0e-6;

    static final Vec3 DEFAULT_DIRECTION = Vec3.UNIT_Z;
    static final Vec3 DEFAULT_POLARIZATION_NORMAL = Vec3.UNIT_Y;

    private Vec3 sampleToSourceDirection;
    @Setter
    private double divergence;
    @Setter
    private double sigmaDivergence;
    private Vec3 polarizationNormal;
    @Setter
    private double polarizationFraction;
    @Setter
    private double flux;
    @Setter
    private double transmission;
    private Probe probe;
    private double sampleToSourceDistance;

    AbstractBeam(Vec3 direction,
                 double divergence,
                 double sigmaDivergence,
                 Vec3 polarizationNormal,
                 double polarizationFraction,
                 double flux,
                 double transmission,
                 Probe probe,
                 double sampleToSourceDistance) {
        setDirection(direction);
        setPolarizationNormal(polarizationNormal);
        setProbe(probe);
        setSampleToSourceDistance(sampleToSourceDistance);
        this.divergence = divergence;
        this.sigmaDivergence = sigmaDivergence;
        this.polarizationFraction = polarizationFraction;
        this.flux = flux;
        this.transmission = transmission;
    }

    AbstractBeam(AbstractBeam source) {
        this.sampleToSourceDirection = source.sampleToSourceDirection;
        this.divergence = source.divergence;
        this.sigmaDivergence = source.sigmaDivergence;
        this.polarizationNormal = source.polarizationNormal;
        this.polarizationFraction = source.polarizationFraction;
        this.flux = source.flux;
        this.transmission = source.transmission;
        this.probe = source.probe;
        this.sampleToSourceDistance = source.sampleToSourceDistance;
    }

    public abstract boolean hasFixedWavelength();

    public abstract double getWavelength();

    // --- Setters con invariantes ---

    public final void setDirection(Vec3 direction) {
        this.sampleToSourceDirection = requireNonZero(direction, "La dirección del haz").normalize();
    }

    public final Vec3 getUnitS0() {
        return sampleToSourceDirection.negate();
    }

    public final void setUnitS0(Vec3 unitS0) {
        this.sampleToSourceDirection = requireNonZero(unitS0, "El vector unitario s0").normalize().negate();
    }

    /**
     * La normal se guarda tal cual (sin normalizar); en las comparaciones solo cuenta su dirección.
     */
    public final void setPolarizationNormal(Vec3 polarizationNormal) {
        this.polarizationNormal = requireNonZero(polarizationNormal, "La normal de polarización");
    }

    public final void setProbe(Probe probe) {
        this.probe = Objects.requireNonNull(probe, "La sonda no puede ser nula.");
    }

    public final void setSampleToSourceDistance(double sampleToSourceDistance) {
        // !(d >= 0) descarta también NaN
        if (!(sampleToSourceDistance >= 0.0)) {
            throw new IllegalArgumentException(
                    "La distancia muestra-fuente debe ser >= 0 mm: " + sampleToSourceDistance);
        }
        this.sampleToSourceDistance = sampleToSourceDistance;
    }

    public String getProbeName() {
        return probe.getNexusName();
    }

    public void rotateAroundOrigin(Vec3 axis, double angle) {
        requireNonZero(axis, "El eje de rotación");
        this.sampleToSourceDirection = sampleToSourceDirection.rotateAroundOrigin(axis, angle);
        this.polarizationNormal = polarizationNormal.rotateAroundOrigin(axis, angle);
    }

    // --- Comparaciones de campos compartidos ---

    /**
     * Igualdad estricta (épsilon fijo) de todos los campos comunes, sonda incluida.
     */
    final boolean sharedFieldsEqual(AbstractBeam other) {
        return angleWithin(sampleToSourceDirection, other.sampleToSourceDirection, EQUALITY_EPSILON)
                && within(divergence, other.divergence, EQUALITY_EPSILON)
                && within(sigmaDivergence, other.sigmaDivergence, EQUALITY_EPSILON)
                && angleWithin(polarizationNormal, other.polarizationNormal, EQUALITY_EPSILON)
                && within(polarizationFraction, other.polarizationFraction, EQUALITY_EPSILON)
                && within(flux, other.flux, EQUALITY_EPSILON)
                && within(transmission, other.transmission, EQUALITY_EPSILON)
                && within(sampleToSourceDistance, other.sampleToSourceDistance, EQUALITY_EPSILON)
                && probe == other.probe;
    }

    /**
     * Campos comunes del nivel "núcleo": dirección, normal y fracción de polarización, sonda.
     */
    final boolean coreFieldsSimilar(AbstractBeam other, BeamTolerance tolerance) {
        return angleWithin(sampleToSourceDirection, other.sampleToSourceDirection, tolerance.getDirection())
                && angleWithin(polarizationNormal, other.polarizationNormal, tolerance.getPolarizationNormal())
                && within(polarizationFraction, other.polarizationFraction, tolerance.getPolarizationFraction())
                && probe == other.probe;
    }

    /**
     * Campos comunes del nivel "extendido" (además de los del núcleo).
     */
    final boolean extendedFieldsSimilar(AbstractBeam other, BeamTolerance tolerance) {
        return within(divergence, other.divergence, tolerance.getDivergence())
                && within(sigmaDivergence, other.sigmaDivergence, tolerance.getSigmaDivergence())
                && within(flux, other.flux, tolerance.getFlux())
                && within(transmission, other.transmission, tolerance.getTransmission())
                && within(sampleToSourceDistance, other.sampleToSourceDistance,
                tolerance.getSampleToSourceDistance());
    }

    static boolean within(double a, double b, double tolerance) {
        return Math.abs(a - b) <= tolerance;
    }

    static boolean angleWithin(Vec3 a, Vec3 b, double tolerance) {
        return Math.abs(AngleSafe.angle(a, b)) <= tolerance;
    }

    static Vec3 requireNonZero(Vec3 vector, String what) {
        Objects.requireNonNull(vector, what + " no puede ser nula.");
        if (vector.length() == 0.0) {
            throw new IllegalArgumentException(what + " no puede tener longitud cero.");
        }
        return vector;
    }

    @Override
    public int hashCode() {
        // Coherente con equals(): dos haces "iguales" comparten variante y sonda.
        return Objects.hash(getClass(), probe);
    }

    // --- Volcado de diagnóstico ---

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(256).append("Beam:\n");
        appendLine(sb, "probe", getProbeName());
        if (hasFixedWavelength()) {
            appendLine(sb, "wavelength", getWavelength());
        }
        appendLine(sb, "sample to source direction", sampleToSourceDirection);
        appendLine(sb, "divergence", divergence);
        appendLine(sb, "sigma divergence", sigmaDivergence);
        appendLine(sb, "polarization normal", polarizationNormal);
        appendLine(sb, "polarization fraction", polarizationFraction);
        appendLine(sb, "flux", flux);
        appendLine(sb, "transmission", transmission);
        appendLine(sb, "sample to source distance", sampleToSourceDistance);
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String key, Object value) {
        sb.append("    ").append(key).append(": ").append(value).append('\n');
    }
}
