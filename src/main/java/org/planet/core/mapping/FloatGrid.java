package org.planet.core.mapping;

import java.util.Arrays;

/**
 * Row-major float raster. Writable while a map run fills it, read-only after {@link #freeze()}.
 */
public final class FloatGrid {

    private final int width;
    private final int height;
    private final float[] data;
    private volatile boolean frozen;

    public FloatGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.data = new float[width * height];
    }

    /** Copies {@code values}; the length must be {@code width * height}. */
    public static FloatGrid of(int width, int height, float[] values) {
        FloatGrid g = new FloatGrid(width, height);
        if (values.length != g.data.length) {
            throw new IllegalArgumentException("Expected " + g.data.length + " values, got " + values.length);
        }
        System.arraycopy(values, 0, g.data, 0, values.length);
        return g;
    }

    public int width() { return width; }
    public int height() { return height; }

    public float get(int x, int y) {
        return data[index(x, y)];
    }

    public void set(int x, int y, double value) {
        if (frozen) throw new IllegalStateException("Grid is frozen");
        data[index(x, y)] = (float) value;
    }

    public void add(int x, int y, double value) {
        if (frozen) throw new IllegalStateException("Grid is frozen");
        data[index(x, y)] += (float) value;
    }

    public FloatGrid freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public float[] toArray() {
        return data.clone();
    }

    public double min() {
        double m = Double.POSITIVE_INFINITY;
        for (float v : data) m = Math.min(m, v);
        return m;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (float v : data) m = Math.max(m, v);
        return m;
    }

    public double mean() {
        double sum = 0;
        for (float v : data) sum += v;
        return sum / data.length;
    }

    /** Index of the first NaN or infinite value, -1 if all finite. */
    public int firstNonFinite() {
        for (int i = 0; i < data.length; i++) {
            if (!Float.isFinite(data[i])) return i;
        }
        return -1;
    }

    private int index(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Cell (" + x + "," + y + ") outside " + width + "x" + height);
        }
        return y * width + x;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FloatGrid)) return false;
        FloatGrid that = (FloatGrid) o;
        return width == that.width && height == that.height && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }
}
