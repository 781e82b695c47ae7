package beamline.domain.beam;

import beamline.physics.geometry.Vec3;

import java.util.List;

/**
 * Haz policromático (p. ej. Laue o tiempo de vuelo): no tiene una longitud de onda fija.
 * <p>
 * Longitud de onda, vector de onda y modelo por punto de escaneo no existen para esta
 * variante: cualquier llamada a esas operaciones lanza {@link UnsupportedOperationException}
 * en lugar de devolver un valor centinela. {@link #getUnitS0()} y {@link #setUnitS0(Vec3)}
 * sí están disponibles, porque solo dependen de la dirección.
 * <p>
 * <b>Fracción de polarización por defecto:</b> 0.5 en los constructores sin argumentos,
 * solo dirección y dirección+divergencia, pero 0.999 en el de dirección+distancia.
 * Ambos valores se conservan tal cual.
 */
public final class PolychromaticBeam extends AbstractBeam implements BeamModel {

    static final double DEFAULT_POLARIZATION_FRACTION = 0.5;
    static final double DISTANCE_PROFILE_POLARIZATION_FRACTION = 0.999;

    private static final String NO_WAVELENGTH = "PolychromaticBeam no tiene una longitud de onda fija.";
    private static final String NO_S0 = "PolychromaticBeam no tiene un s0 fijo.";

    public PolychromaticBeam() {
        this(DEFAULT_DIRECTION);
    }

    /**
     * @param direction Dirección muestra → fuente (no nula).
     */
    public PolychromaticBeam(Vec3 direction) {
        this(direction, 0.0, 0.0);
    }

    /**
     * @param direction              Dirección muestra → fuente (no nula).
     * @param sampleToSourceDistance Distancia muestra-fuente en mm ({@code >= 0}).
     */
    public PolychromaticBeam(Vec3 direction, double sampleToSourceDistance) {
        this(direction, 0.0, 0.0, DEFAULT_POLARIZATION_NORMAL, DISTANCE_PROFILE_POLARIZATION_FRACTION,
                0.0, 1.0, Probe.XRAY, sampleToSourceDistance);
    }

    /**
     * @param direction       Dirección muestra → fuente (no nula).
     * @param divergence      Divergencia del haz (rad).
     * @param sigmaDivergence Desviación estándar de la divergencia (rad).
     */
    public PolychromaticBeam(Vec3 direction, double divergence, double sigmaDivergence) {
        this(direction, divergence, sigmaDivergence, DEFAULT_POLARIZATION_NORMAL,
                DEFAULT_POLARIZATION_FRACTION, 0.0, 1.0, Probe.XRAY);
    }

    public PolychromaticBeam(Vec3 direction,
                             double divergence,
                             double sigmaDivergence,
                             Vec3 polarizationNormal,
                             double polarizationFraction,
                             double flux,
                             double transmission,
                             Probe probe) {
        this(direction, divergence, sigmaDivergence, polarizationNormal, polarizationFraction,
                flux, transmission, probe, 0.0);
    }

    public PolychromaticBeam(Vec3 direction,
                             double divergence,
                             double sigmaDivergence,
                             Vec3 polarizationNormal,
                             double polarizationFraction,
                             double flux,
                             double transmission,
                             Probe probe,
                             double sampleToSourceDistance) {
        super(direction, divergence, sigmaDivergence, polarizationNormal, polarizationFraction,
                flux, transmission, probe, sampleToSourceDistance);
    }

    private PolychromaticBeam(PolychromaticBeam source) {
        super(source);
    }

    @Override
    public boolean hasFixedWavelength() {
        return false;
    }

    // --- Operaciones no soportadas ---

    @Override
    public double getWavelength() {
        throw new UnsupportedOperationException(NO_WAVELENGTH);
    }

    @Override
    public void setWavelength(double wavelength) {
        throw new UnsupportedOperationException(NO_WAVELENGTH);
    }

    @Override
    public Vec3 getS0() {
        throw new UnsupportedOperationException(NO_S0);
    }

    @Override
    public void setS0(Vec3 s0) {
        throw new UnsupportedOperationException(NO_S0);
    }

    @Override
    public int getNumScanPoints() {
        throw new UnsupportedOperationException(NO_S0);
    }

    @Override
    public List<Vec3> getS0AtScanPoints() {
        throw new UnsupportedOperationException(NO_S0);
    }

    @Override
    public void setS0AtScanPoints(List<Vec3> s0AtScanPoints) {
        throw new UnsupportedOperationException(NO_S0);
    }

    @Override
    public Vec3 getS0AtScanPoint(int index) {
        throw new UnsupportedOperationException(NO_S0);
    }

    @Override
    public void resetScanPoints() {
        throw new UnsupportedOperationException(NO_S0);
    }

    // --- Comparación (solo campos soportados) ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolychromaticBeam other)) return false;
        return sharedFieldsEqual(other);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    /**
     * La tolerancia de longitud de onda se ignora; los campos extendidos usan 1e-6.
     */
    @Override
    public boolean isSimilarTo(BeamModel other,
                               double wavelengthTolerance,
                               double directionTolerance,
                               double polarizationNormalTolerance,
                               double polarizationFractionTolerance) {
        return isSimilarTo(other, BeamTolerance.ofCore(wavelengthTolerance, directionTolerance,
                polarizationNormalTolerance, polarizationFractionTolerance));
    }

    @Override
    public boolean isSimilarTo(BeamModel other, BeamTolerance tolerance) {
        if (!(other instanceof PolychromaticBeam that)) return false;
        return coreFieldsSimilar(that, tolerance) && extendedFieldsSimilar(that, tolerance);
    }

    @Override
    public PolychromaticBeam copy() {
        return new PolychromaticBeam(this);
    }
}
