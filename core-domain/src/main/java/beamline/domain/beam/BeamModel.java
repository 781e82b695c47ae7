package beamline.domain.beam;

import beamline.physics.geometry.Vec3;

import java.util.List;

/**
 * Modelo del haz incidente de un experimento de difracción.
 * <p>
 * Solo existen dos variantes, incompatibles entre sí:
 * <ul>
 * <li>{@link MonochromaticBeam}: longitud de onda única, vector de onda {@code s0} y modelo
 * opcional variable por punto de escaneo.</li>
 * <li>{@link PolychromaticBeam}: sin longitud de onda fija. Toda operación de longitud de onda,
 * {@code s0} o puntos de escaneo lanza {@link UnsupportedOperationException}.</li>
 * </ul>
 * Antes de usar esas operaciones sobre un haz de tipo desconocido, consultar
 * {@link #hasFixedWavelength()}.
 * <p>
 * Convenciones: la dirección almacenada va de la muestra a la fuente y es siempre unitaria;
 * {@code s0 = -direction / wavelength} (Å⁻¹); los ángulos van en radianes y las distancias en mm.
 * <p>
 * Las instancias son mutables y no están sincronizadas: la etapa de calibración que las
 * modifica debe tener acceso exclusivo. Para compartir un estado congelado usar {@link #copy()}.
 */
public sealed interface BeamModel permits MonochromaticBeam, PolychromaticBeam {

    // --- Dirección ---

    Vec3 getSampleToSourceDirection();

    /**
     * Fija la dirección muestra → fuente.
     *
     * @param direction Vector no nulo; se almacena normalizado.
     * @throws IllegalArgumentException si el vector tiene longitud cero.
     */
    void setDirection(Vec3 direction);

    // --- Longitud de onda y vector de onda ---

    /**
     * @return {@code true} si el haz tiene una longitud de onda (y por tanto un {@code s0}) definida.
     */
    boolean hasFixedWavelength();

    double getWavelength();

    void setWavelength(double wavelength);

    /**
     * @return el vector de onda {@code -direction / wavelength}.
     */
    Vec3 getS0();

    /**
     * Fija dirección y longitud de onda a partir del vector de onda.
     *
     * @param s0 Vector no nulo: {@code direction = -unit(s0)}, {@code wavelength = 1/|s0|}.
     */
    void setS0(Vec3 s0);

    /**
     * @return el vector unitario fuente → muestra ({@code -direction}).
     */
    Vec3 getUnitS0();

    /**
     * Fija solo la dirección a partir de un {@code s0} (de cualquier longitud).
     * <p>
     * A diferencia de {@link #setS0(Vec3)} no toca la longitud de onda: una recalibración
     * de dirección no debe alterar la energía del haz.
     */
    void setUnitS0(Vec3 unitS0);

    // --- Divergencia ---

    double getDivergence();

    void setDivergence(double divergence);

    double getSigmaDivergence();

    void setSigmaDivergence(double sigmaDivergence);

    // --- Polarización ---

    Vec3 getPolarizationNormal();

    void setPolarizationNormal(Vec3 polarizationNormal);

    double getPolarizationFraction();

    void setPolarizationFraction(double polarizationFraction);

    // --- Flujo ---

    double getFlux();

    void setFlux(double flux);

    double getTransmission();

    void setTransmission(double transmission);

    // --- Sonda ---

    Probe getProbe();

    void setProbe(Probe probe);

    /**
     * @return el nombre NeXus de la sonda ("x-ray", "electron" o "neutron").
     */
    default String getProbeName() {
        return getProbe().getNexusName();
    }

    /**
     * @see Probe#fromName(String)
     */
    static Probe getProbeFromName(String name) {
        return Probe.fromName(name);
    }

    // --- Distancia muestra-fuente ---

    double getSampleToSourceDistance();

    /**
     * @param sampleToSourceDistance Distancia en mm ({@code >= 0}).
     * @throws IllegalArgumentException si la distancia es negativa.
     */
    void setSampleToSourceDistance(double sampleToSourceDistance);

    // --- Modelo variable por punto de escaneo ---

    int getNumScanPoints();

    List<Vec3> getS0AtScanPoints();

    /**
     * Sustituye por completo la lista de vectores de onda por punto de escaneo.
     */
    void setS0AtScanPoints(List<Vec3> s0AtScanPoints);

    /**
     * @throws IndexOutOfBoundsException si {@code index} no es menor que el número de puntos.
     */
    Vec3 getS0AtScanPoint(int index);

    /**
     * Vuelve al modelo estático (sin puntos de escaneo).
     */
    void resetScanPoints();

    // --- Geometría ---

    /**
     * Rota dirección y normal de polarización alrededor de un eje que pasa por el origen.
     *
     * @param axis  Eje de rotación (no nulo).
     * @param angle Ángulo en radianes.
     */
    void rotateAroundOrigin(Vec3 axis, double angle);

    // --- Comparación ---

    /**
     * Similitud usando solo los campos "núcleo": longitud de onda, dirección, normal y
     * fracción de polarización (más la sonda, que debe coincidir exactamente).
     */
    boolean isSimilarTo(BeamModel other,
                        double wavelengthTolerance,
                        double directionTolerance,
                        double polarizationNormalTolerance,
                        double polarizationFractionTolerance);

    /**
     * Similitud extendida: campos núcleo más divergencia, su desviación, flujo,
     * transmisión y distancia muestra-fuente.
     */
    boolean isSimilarTo(BeamModel other, BeamTolerance tolerance);

    default boolean isSimilarTo(BeamModel other,
                                double wavelengthTolerance,
                                double directionTolerance,
                                double polarizationNormalTolerance,
                                double polarizationFractionTolerance,
                                double divergenceTolerance,
                                double sigmaDivergenceTolerance,
                                double fluxTolerance,
                                double transmissionTolerance,
                                double sampleToSourceDistanceTolerance) {
        return isSimilarTo(other, BeamTolerance.builder()
                .wavelength(wavelengthTolerance)
                .direction(directionTolerance)
                .polarizationNormal(polarizationNormalTolerance)
                .polarizationFraction(polarizationFractionTolerance)
                .divergence(divergenceTolerance)
                .sigmaDivergence(sigmaDivergenceTolerance)
                .flux(fluxTolerance)
                .transmission(transmissionTolerance)
                .sampleToSourceDistance(sampleToSourceDistanceTolerance)
                .build());
    }

    /**
     * @return una copia independiente; modificar la copia no afecta al original.
     */
    BeamModel copy();
}
