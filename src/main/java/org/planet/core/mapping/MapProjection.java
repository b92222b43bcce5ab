package org.planet.core.mapping;

import org.planet.core.geometry.SurfaceGeometry;

import java.util.Objects;

/**
 * Cell index to coordinate mapping for one map run. The grid is {@code 2R x R}
 * cells; row 0 is the northern edge, column 0 the western edge.
 */
public final class MapProjection {

    private final ProjectionType type;
    private final MapRegion region;
    private final int resolution;
    private final int width;
    private final int height;

    private final double northLat;
    private final double southLat;
    private final double sinNorth;
    private final double sinSouth;
    private final double westLon;
    private final double lonSpan;

    public MapProjection(ProjectionType type, MapRegion region, int resolution) {
        if (type == null) throw new IllegalArgumentException("Projection type is required");
        if (region == null) throw new IllegalArgumentException("Map region is required");
        if (resolution <= 0) {
            throw new IllegalArgumentException("Resolution must be positive: " + resolution);
        }
        if (resolution > 1 << 14) {
            throw new IllegalArgumentException("Resolution too large: " + resolution);
        }
        if (type == ProjectionType.CYLINDRICAL_EQUAL_AREA && resolution % 2 != 0) {
            throw new IllegalArgumentException("Equal-area map height must be even: " + resolution);
        }
        this.type = type;
        this.region = region;
        this.resolution = resolution;
        this.width = resolution * 2;
        this.height = resolution;

        this.northLat = region.northLatitude();
        this.southLat = region.southLatitude();
        this.sinNorth = Math.sin(northLat);
        this.sinSouth = Math.sin(southLat);
        this.westLon = region.westLongitude();
        this.lonSpan = region.longitudeSpan();
    }

    public static MapProjection full(ProjectionType type, int resolution) {
        return new MapProjection(type, MapRegion.FULL, resolution);
    }

    public ProjectionType type() { return type; }
    public MapRegion region() { return region; }
    public int resolution() { return resolution; }
    public int width() { return width; }
    public int height() { return height; }
    public int cellCount() { return width * height; }

    /** Latitude of the centre of row y. */
    public double latitudeOf(int y) {
        return rowEdgeLatitude(y + 0.5);
    }

    /** Longitude of the centre of column x, in (-pi, pi]. */
    public double longitudeOf(int x) {
        return SurfaceGeometry.normalizeLongitude(westLon + (x + 0.5) * lonSpan / width);
    }

    /**
     * Latitude at a fractional row position (0 = north edge, height = south edge).
     */
    double rowEdgeLatitude(double row) {
        double t = row / height;
        if (type == ProjectionType.CYLINDRICAL_EQUAL_AREA) {
            double s = sinNorth - t * (sinNorth - sinSouth);
            return Math.asin(Math.max(-1.0, Math.min(1.0, s)));
        }
        return northLat - t * (northLat - southLat);
    }

    /** Row containing a latitude, clamped to the grid. */
    public int rowOf(double latitude) {
        double t;
        if (type == ProjectionType.CYLINDRICAL_EQUAL_AREA) {
            double d = sinNorth - sinSouth;
            t = d == 0 ? 0 : (sinNorth - Math.sin(latitude)) / d;
        } else {
            double d = northLat - southLat;
            t = d == 0 ? 0 : (northLat - latitude) / d;
        }
        return clamp((int) Math.floor(t * height), 0, height - 1);
    }

    /** Column containing a longitude, clamped to the nearer edge when outside a region. */
    public int columnOf(double longitude) {
        double dl = (longitude - westLon) % SurfaceGeometry.TWO_PI;
        if (dl < 0) dl += SurfaceGeometry.TWO_PI;
        if (dl > lonSpan) {
            return (dl - lonSpan) < (SurfaceGeometry.TWO_PI - dl) ? width - 1 : 0;
        }
        return clamp((int) Math.floor(dl / lonSpan * width), 0, width - 1);
    }

    /** {x, y} of the cell containing a coordinate. */
    public int[] cellOf(double latitude, double longitude) {
        return new int[]{columnOf(longitude), rowOf(latitude)};
    }

    /** True when the western and eastern edges meet, so column neighbours wrap around. */
    public boolean wrapsLongitude() {
        return Math.abs(lonSpan - SurfaceGeometry.TWO_PI) < 1e-9;
    }

    /** Physical area of one cell of row y on a sphere of the given radius, m^2. */
    public double cellArea(int y, double radius) {
        double top = rowEdgeLatitude(y);
        double bottom = rowEdgeLatitude(y + 1);
        double dLon = lonSpan / width;
        return radius * radius * Math.abs(Math.sin(top) - Math.sin(bottom)) * dLon;
    }

    public double totalArea(double radius) {
        double sum = 0;
        for (int y = 0; y < height; y++) {
            sum += cellArea(y, radius) * width;
        }
        return sum;
    }

    private static int clamp(int v, int lo, int hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MapProjection)) return false;
        MapProjection that = (MapProjection) o;
        return resolution == that.resolution && type == that.type && region.equals(that.region);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, region, resolution);
    }

    @Override
    public String toString() {
        return type + " " + width + "x" + height + " " + region;
    }
}
