package beamline.physics.geometry;

/**
 * Cálculo robusto del ángulo entre dos vectores.
 * <p>
 * Con vectores (casi) paralelos o antiparalelos el producto escalar de los unitarios
 * puede salirse ligeramente de [-1, 1] por redondeo, y {@code Math.acos} devolvería NaN.
 * Aquí el coseno se satura antes de invertirlo.
 */
public final class AngleSafe {

    private AngleSafe() {
    }

    /**
     * Ángulo entre {@code a} y {@code b}.
     *
     * @param a primer vector (no nulo).
     * @param b segundo vector (no nulo).
     * @return el ángulo en radianes, en [0, π].
     * @throws IllegalArgumentException si alguno de los vectores tiene longitud cero.
     */
    public static double angle(Vec3 a, Vec3 b) {
        double cos = a.normalize().dot(b.normalize());
        cos = Math.max(-1.0, Math.min(1.0, cos));
        return Math.acos(cos);
    }
}
