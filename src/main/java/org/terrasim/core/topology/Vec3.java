package org.terrasim.core.topology;

/**
 * Неизменяемый 3D-вектор (координаты на единичной сфере и оси вращения).
 */
public final class Vec3 {

    public static final Vec3 UNIT_Z = new Vec3(0.0, 0.0, 1.0);

    public final double x;
    public final double y;
    public final double z;

    public Vec3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public Vec3 add(Vec3 o) {
        return new Vec3(x + o.x, y + o.y, z + o.z);
    }

    public Vec3 sub(Vec3 o) {
        return new Vec3(x - o.x, y - o.y, z - o.z);
    }

    public Vec3 scale(double k) {
        return new Vec3(x * k, y * k, z * k);
    }

    public double dot(Vec3 o) {
        return x * o.x + y * o.y + z * o.z;
    }

    public Vec3 cross(Vec3 o) {
        return new Vec3(
                y * o.z - z * o.y,
                z * o.x - x * o.z,
                x * o.y - y * o.x
        );
    }

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /** Проекция на единичную сферу. */
    public Vec3 normalize() {
        double len = length();
        if (len == 0.0 || Double.isNaN(len)) {
            throw new IllegalStateException("Cannot normalize zero-length vector");
        }
        return new Vec3(x / len, y / len, z / len);
    }

    public double distance(Vec3 o) {
        double dx = x - o.x;
        double dy = y - o.y;
        double dz = z - o.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Vec3)) return false;
        Vec3 o = (Vec3) obj;
        return Double.compare(x, o.x) == 0
                && Double.compare(y, o.y) == 0
                && Double.compare(z, o.z) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(x);
        h = 31 * h + Double.hashCode(y);
        h = 31 * h + Double.hashCode(z);
        return h;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "(%.6f, %.6f, %.6f)", x, y, z);
    }
}
