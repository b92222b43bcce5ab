package org.planet.core.geometry;

/**
 * Latitude/longitude to direction conversions for a rotated planet axis.
 * Latitudes and longitudes are radians; longitude is kept in (-pi, pi].
 */
public final class SurfaceGeometry {

    public static final double HALF_PI = Math.PI / 2;
    public static final double TWO_PI = Math.PI * 2;

    /** One arc-second, radians. */
    public static final double ARC_SECOND = Math.PI / 180.0 / 3600.0;

    private final double radius;
    private final Vector3 axis;
    private final Quaternion axisRotation;
    // inverse of axisRotation, cached because every latLonToVector uses it
    private final Quaternion axisRotationInverse;

    public SurfaceGeometry(double radius, double angleOfRotation, double axialPrecession) {
        this.radius = radius;

        Quaternion precessionQ = Quaternion.fromYaw(axialPrecession);
        Vector3 precessionVector = precessionQ.rotate(Vector3.UNIT_X);
        Quaternion q = Quaternion.fromAxisAngle(precessionVector, angleOfRotation);

        this.axis = q.rotate(Vector3.UNIT_Y).normalize();
        this.axisRotation = q.conjugate();
        this.axisRotationInverse = axisRotation.inverse();
    }

    public double radius() {
        return radius;
    }

    /** Rotation axis as a unit vector (north). */
    public Vector3 axis() {
        return axis;
    }

    public Quaternion axisRotation() {
        return axisRotation;
    }

    public Vector3 latLonToVector(double latitude, double longitude) {
        double cosLat = Math.cos(latitude);
        Vector3 v = new Vector3(
                cosLat * Math.sin(longitude),
                Math.sin(latitude),
                cosLat * Math.cos(longitude)
        );
        return axisRotationInverse.rotate(v).normalize();
    }

    public double vectorToLatitude(Vector3 v) {
        return HALF_PI - axis.angleTo(v);
    }

    public double vectorToLongitude(Vector3 v) {
        Vector3 u = axisRotation.rotate(v);
        if (Math.abs(u.x) < 1e-15 && Math.abs(u.z) < 1e-15) {
            return 0.0;
        }
        return Math.atan2(u.x, u.z);
    }

    /** {lat, lon} of a direction. */
    public double[] vectorToLatLon(Vector3 v) {
        return new double[]{vectorToLatitude(v), vectorToLongitude(v)};
    }

    /** Surface distance in meters; atan2 form is stable for near and antipodal points. */
    public double greatCircleDistance(Vector3 a, Vector3 b) {
        return radius * a.angleTo(b);
    }

    public double greatCircleDistance(double lat1, double lon1, double lat2, double lon2) {
        return greatCircleDistance(latLonToVector(lat1, lon1), latLonToVector(lat2, lon2));
    }

    /** Rotates a surface position about the planet axis (e.g. for elapsed rotation). */
    public Vector3 rotateAboutAxis(Vector3 position, double angle) {
        return Quaternion.fromAxisAngle(axis, angle).rotate(position);
    }

    /**
     * Moves a coordinate north by delta radians (negative = south), crossing the pole
     * onto the opposite meridian when it overshoots. Returns {lat, lon}.
     */
    public static double[] offsetNorth(double latitude, double longitude, double delta) {
        double lat = latitude + delta;
        double lon = longitude;
        if (lat > HALF_PI) {
            lat = Math.PI - lat;
            lon = normalizeLongitude(lon + Math.PI);
        } else if (lat < -HALF_PI) {
            lat = -Math.PI - lat;
            lon = normalizeLongitude(lon + Math.PI);
        }
        return new double[]{lat, lon};
    }

    /** Moves a coordinate east by delta radians (negative = west), wrapping at the antimeridian. */
    public static double[] offsetEast(double latitude, double longitude, double delta) {
        return new double[]{latitude, normalizeLongitude(longitude + delta)};
    }

    public static double normalizeLongitude(double lon) {
        double l = lon % TWO_PI;
        if (l > Math.PI) l -= TWO_PI;
        if (l <= -Math.PI) l += TWO_PI;
        return l;
    }

    /** Reflects a latitude that went past a pole back into [-pi/2, pi/2]. */
    public static double reflectLatitude(double lat) {
        if (lat > HALF_PI) return Math.PI - lat;
        if (lat < -HALF_PI) return -lat - Math.PI;
        return lat;
    }
}
