package beamline.physics.geometry;

/**
 * Vector 3D inmutable con las operaciones mínimas que necesita el modelo del haz.
 * <p>
 * Es un objeto de valor: todas las operaciones devuelven un vector nuevo y nunca
 * modifican el receptor, por lo que puede compartirse libremente entre modelos.
 *
 * @param x componente X
 * @param y componente Y
 * @param z componente Z
 */
public record Vec3(double x, double y, double z) {

    public static final Vec3 ZERO = new Vec3(0.0, 0.0, 0.0);
    public static final Vec3 UNIT_X = new Vec3(1.0, 0.0, 0.0);
    public static final Vec3 UNIT_Y = new Vec3(0.0, 1.0, 0.0);
    public static final Vec3 UNIT_Z = new Vec3(0.0, 0.0, 1.0);

    public Vec3 add(Vec3 o) {
        return new Vec3(x + o.x, y + o.y, z + o.z);
    }

    public Vec3 sub(Vec3 o) {
        return new Vec3(x - o.x, y - o.y, z - o.z);
    }

    public Vec3 mul(double s) {
        return new Vec3(x * s, y * s, z * s);
    }

    public Vec3 negate() {
        return new Vec3(-x, -y, -z);
    }

    public double dot(Vec3 o) {
        return x * o.x + y * o.y + z * o.z;
    }

    public Vec3 cross(Vec3 o) {
        return new Vec3(
                y * o.z - z * o.y,
                z * o.x - x * o.z,
                x * o.y - y * o.x);
    }

    /**
     * @return la norma euclídea del vector, sin desbordamiento ni subdesbordamiento intermedio.
     */
    public double length() {
        return Math.hypot(Math.hypot(x, y), z);
    }

    /**
     * Devuelve el vector unitario con la misma dirección.
     *
     * @return el vector normalizado.
     * @throws IllegalArgumentException si el vector tiene longitud cero.
     */
    public Vec3 normalize() {
        double max = Math.max(Math.abs(x), Math.max(Math.abs(y), Math.abs(z)));
        if (max == 0.0) {
            throw new IllegalArgumentException("No se puede normalizar un vector de longitud cero.");
        }
        // Se escala primero por la mayor componente: la norma queda en [1, √3]
        Vec3 scaled = new Vec3(x / max, y / max, z / max);
        double len = scaled.length();
        return new Vec3(scaled.x / len, scaled.y / len, scaled.z / len);
    }

    /**
     * Rota el vector alrededor de un eje que pasa por el origen (fórmula de Rodrigues).
     * <p>
     * El ángulo sigue la regla de la mano derecha respecto al eje. La norma del vector
     * se conserva, de modo que un vector unitario sigue siéndolo tras la rotación.
     *
     * @param axis  Eje de rotación. No tiene por qué ser unitario, pero sí no nulo.
     * @param angle Ángulo en radianes.
     * @return el vector rotado.
     */
    public Vec3 rotateAroundOrigin(Vec3 axis, double angle) {
        Vec3 u = axis.normalize();
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        return this.mul(cos)
                .add(u.cross(this).mul(sin))
                .add(u.mul(u.dot(this) * (1.0 - cos)));
    }

    @Override
    public String toString() {
        return "{" + x + "," + y + "," + z + "}";
    }
}
