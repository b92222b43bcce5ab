package org.planet.core.geometry;

/**
 * Unit quaternion for axis orientation. Only the operations the surface geometry needs.
 */
public final class Quaternion {

    public static final Quaternion IDENTITY = new Quaternion(0, 0, 0, 1);

    public final double x;
    public final double y;
    public final double z;
    public final double w;

    public Quaternion(double x, double y, double z, double w) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.w = w;
    }

    /** Rotation about the Y axis (yaw only). */
    public static Quaternion fromYaw(double yaw) {
        double h = yaw * 0.5;
        return new Quaternion(0, Math.sin(h), 0, Math.cos(h));
    }

    public static Quaternion fromAxisAngle(Vector3 axis, double angle) {
        Vector3 a = axis.normalize();
        double h = angle * 0.5;
        double s = Math.sin(h);
        return new Quaternion(a.x * s, a.y * s, a.z * s, Math.cos(h));
    }

    public Quaternion conjugate() {
        return new Quaternion(-x, -y, -z, w);
    }

    public Quaternion inverse() {
        double n = x * x + y * y + z * z + w * w;
        if (n < 1e-300) return IDENTITY;
        return new Quaternion(-x / n, -y / n, -z / n, w / n);
    }

    /** Hamilton product this * o. */
    public Quaternion multiply(Quaternion o) {
        return new Quaternion(
                w * o.x + x * o.w + y * o.z - z * o.y,
                w * o.y - x * o.z + y * o.w + z * o.x,
                w * o.z + x * o.y - y * o.x + z * o.w,
                w * o.w - x * o.x - y * o.y - z * o.z
        );
    }

    /** Rotates v by this quaternion (q v q*). */
    public Vector3 rotate(Vector3 v) {
        // t = 2 * cross(q.xyz, v); v' = v + w*t + cross(q.xyz, t)
        double tx = 2 * (y * v.z - z * v.y);
        double ty = 2 * (z * v.x - x * v.z);
        double tz = 2 * (x * v.y - y * v.x);
        return new Vector3(
                v.x + w * tx + (y * tz - z * ty),
                v.y + w * ty + (z * tx - x * tz),
                v.z + w * tz + (x * ty - y * tx)
        );
    }

    @Override
    public String toString() {
        return "Quaternion(" + x + ", " + y + ", " + z + ", " + w + ")";
    }
}
