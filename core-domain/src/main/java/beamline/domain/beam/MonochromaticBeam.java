package beamline.domain.beam;

import beamline.physics.geometry.Vec3;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Haz de longitud de onda única.
 * <p>
 * La dirección y la longitud de onda son la representación primaria; el vector de onda
 * {@code s0 = -direction / wavelength} se deriva de ellas y puede fijarse en sentido inverso
 * con {@link #setS0(Vec3)}. Opcionalmente guarda un {@code s0} por punto de escaneo para
 * experimentos en los que el haz deriva a lo largo de la rotación.
 * <p>
 * Valores por defecto: dirección (0,0,1), longitud de onda 0 (sin fijar), divergencia 0,
 * normal de polarización (0,1,0), fracción 0.999, flujo 0, transmisión 1, rayos X, distancia 0.
 */
@Slf4j
public final class MonochromaticBeam extends AbstractBeam implements BeamModel {

    static final double DEFAULT_POLARIZATION_FRACTION = 0.999;

    private double wavelength;
    private List<Vec3> s0AtScanPoints = List.of();

    public MonochromaticBeam() {
        this(DEFAULT_DIRECTION, 0.0, 0.0, 0.0);
    }

    /**
     * @param s0 Vector de onda incidente (no nulo).
     */
    public MonochromaticBeam(Vec3 s0) {
        this(s0, 0.0, 0.0);
    }

    /**
     * @param direction  Dirección muestra → fuente (no nula).
     * @param wavelength Longitud de onda en Å.
     */
    public MonochromaticBeam(Vec3 direction, double wavelength) {
        this(direction, wavelength, 0.0, 0.0);
    }

    /**
     * @param s0              Vector de onda incidente (no nulo).
     * @param divergence      Divergencia del haz (rad).
     * @param sigmaDivergence Desviación estándar de la divergencia (rad).
     */
    public MonochromaticBeam(Vec3 s0, double divergence, double sigmaDivergence) {
        this(directionOf(s0), wavelengthOf(s0), divergence, sigmaDivergence);
    }

    public MonochromaticBeam(Vec3 direction,
                             double wavelength,
                             double divergence,
                             double sigmaDivergence) {
        this(direction, wavelength, divergence, sigmaDivergence,
                DEFAULT_POLARIZATION_NORMAL, DEFAULT_POLARIZATION_FRACTION, 0.0, 1.0, Probe.XRAY);
    }

    public MonochromaticBeam(Vec3 direction,
                             double wavelength,
                             double divergence,
                             double sigmaDivergence,
                             Vec3 polarizationNormal,
                             double polarizationFraction,
                             double flux,
                             double transmission,
                             Probe probe) {
        this(direction, wavelength, divergence, sigmaDivergence, polarizationNormal,
                polarizationFraction, flux, transmission, probe, 0.0);
    }

    /**
     * Constructor completo; todos los demás acaban aquí.
     *
     * @param direction              Dirección muestra → fuente (no nula, se normaliza).
     * @param wavelength             Longitud de onda en Å.
     * @param divergence             Divergencia del haz (rad).
     * @param sigmaDivergence        Desviación estándar de la divergencia (rad).
     * @param polarizationNormal     Normal al plano de polarización (no nula).
     * @param polarizationFraction   Fracción de polarización.
     * @param flux                   Flujo del haz.
     * @param transmission           Transmisión del haz.
     * @param probe                  Tipo de sonda.
     * @param sampleToSourceDistance Distancia muestra-fuente en mm ({@code >= 0}).
     */
    public MonochromaticBeam(Vec3 direction,
                             double wavelength,
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
        this.wavelength = wavelength;
    }

    private MonochromaticBeam(MonochromaticBeam source) {
        super(source);
        this.wavelength = source.wavelength;
        this.s0AtScanPoints = source.s0AtScanPoints;
    }

    @Override
    public boolean hasFixedWavelength() {
        return true;
    }

    @Override
    public double getWavelength() {
        return wavelength;
    }

    @Override
    public void setWavelength(double wavelength) {
        this.wavelength = wavelength;
    }

    /**
     * @throws IllegalStateException si la longitud de onda aún no se ha fijado (vale 0).
     */
    @Override
    public Vec3 getS0() {
        if (wavelength == 0.0) {
            throw new IllegalStateException("No se puede calcular s0: la longitud de onda es 0.");
        }
        return getSampleToSourceDirection().negate().mul(1.0 / wavelength);
    }

    @Override
    public void setS0(Vec3 s0) {
        Vec3 direction = directionOf(s0);
        setDirection(direction);
        this.wavelength = wavelengthOf(s0);
    }

    // --- Modelo variable por punto de escaneo ---

    @Override
    public int getNumScanPoints() {
        return s0AtScanPoints.size();
    }

    @Override
    public List<Vec3> getS0AtScanPoints() {
        return s0AtScanPoints;
    }

    @Override
    public void setS0AtScanPoints(List<Vec3> s0AtScanPoints) {
        Objects.requireNonNull(s0AtScanPoints, "La lista de s0 por punto de escaneo no puede ser nula.");
        this.s0AtScanPoints = List.copyOf(s0AtScanPoints);
        log.debug("Modelo variable por escaneo sustituido: {} puntos", this.s0AtScanPoints.size());
    }

    @Override
    public Vec3 getS0AtScanPoint(int index) {
        if (index < 0 || index >= s0AtScanPoints.size()) {
            throw new IndexOutOfBoundsException(String.format(
                    "Punto de escaneo %d fuera de rango (el haz tiene %d).", index, s0AtScanPoints.size()));
        }
        return s0AtScanPoints.get(index);
    }

    @Override
    public void resetScanPoints() {
        if (!s0AtScanPoints.isEmpty()) {
            log.debug("Descartando modelo variable por escaneo ({} puntos)", s0AtScanPoints.size());
        }
        this.s0AtScanPoints = List.of();
    }

    // --- Comparación ---

    /**
     * Igualdad estricta con épsilon fijo de 1e-6.
     * <p>
     * Si cualquiera de los dos haces tiene modelo por escaneo, ambos deben tener el mismo
     * número de puntos y cada par de {@code s0} debe diferir, sumando el valor absoluto de
     * cada componente, como mucho en el épsilon.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MonochromaticBeam other)) return false;

        if (!s0AtScanPoints.isEmpty() || !other.s0AtScanPoints.isEmpty()) {
            if (s0AtScanPoints.size() != other.s0AtScanPoints.size()) {
                return false;
            }
            for (int i = 0; i < s0AtScanPoints.size(); i++) {
                Vec3 a = s0AtScanPoints.get(i);
                Vec3 b = other.s0AtScanPoints.get(i);
                double l1 = Math.abs(a.x() - b.x()) + Math.abs(a.y() - b.y()) + Math.abs(a.z() - b.z());
                if (l1 > EQUALITY_EPSILON) {
                    return false;
                }
            }
        }

        return within(wavelength, other.wavelength, EQUALITY_EPSILON) && sharedFieldsEqual(other);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    @Override
    public boolean isSimilarTo(BeamModel other,
                               double wavelengthTolerance,
                               double directionTolerance,
                               double polarizationNormalTolerance,
                               double polarizationFractionTolerance) {
        if (!(other instanceof MonochromaticBeam that)) return false;
        BeamTolerance tolerance = BeamTolerance.ofCore(wavelengthTolerance, directionTolerance,
                polarizationNormalTolerance, polarizationFractionTolerance);
        return scanPointsSimilar(that, tolerance)
                && within(wavelength, that.wavelength, tolerance.getWavelength())
                && coreFieldsSimilar(that, tolerance);
    }

    @Override
    public boolean isSimilarTo(BeamModel other, BeamTolerance tolerance) {
        if (!(other instanceof MonochromaticBeam that)) return false;
        return scanPointsSimilar(that, tolerance)
                && within(wavelength, that.wavelength, tolerance.getWavelength())
                && coreFieldsSimilar(that, tolerance)
                && extendedFieldsSimilar(that, tolerance);
    }

    /**
     * Compara punto a punto la dirección y la longitud de onda derivadas de cada {@code s0}.
     * Los puntos de longitud cero se aceptan sin validar al fijarlos, así que aquí se tratan aparte.
     */
    private boolean scanPointsSimilar(MonochromaticBeam other, BeamTolerance tolerance) {
        if (s0AtScanPoints.size() != other.s0AtScanPoints.size()) {
            return false;
        }
        for (int i = 0; i < s0AtScanPoints.size(); i++) {
            Vec3 a = s0AtScanPoints.get(i);
            Vec3 b = other.s0AtScanPoints.get(i);
            boolean aZero = a.length() == 0.0;
            boolean bZero = b.length() == 0.0;
            if (aZero || bZero) {
                // Un s0 nulo no tiene dirección: solo es similar a otro s0 nulo
                if (aZero && bZero) {
                    continue;
                }
                return false;
            }
            if (!angleWithin(a, b, tolerance.getDirection())) {
                return false;
            }
            if (!within(1.0 / a.length(), 1.0 / b.length(), tolerance.getWavelength())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public MonochromaticBeam copy() {
        return new MonochromaticBeam(this);
    }

    private static Vec3 directionOf(Vec3 s0) {
        return requireNonZero(s0, "El vector s0").normalize().negate();
    }

    private static double wavelengthOf(Vec3 s0) {
        return 1.0 / requireNonZero(s0, "El vector s0").length();
    }
}
