package org.planet.core.mapping;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Row-major raster of enum values, stored as ordinals.
 */
public final class EnumGrid<E extends Enum<E>> {

    private final Class<E> type;
    private final E[] constants;
    private final int width;
    private final int height;
    private final byte[] data;
    private volatile boolean frozen;

    public EnumGrid(Class<E> type, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid size must be positive: " + width + "x" + height);
        }
        this.type = type;
        this.constants = type.getEnumConstants();
        if (constants.length > 127) {
            throw new IllegalArgumentException("Too many constants in " + type.getSimpleName());
        }
        this.width = width;
        this.height = height;
        this.data = new byte[width * height];
    }

    public static <E extends Enum<E>> EnumGrid<E> ofOrdinals(Class<E> type, int width, int height, byte[] ordinals) {
        EnumGrid<E> g = new EnumGrid<>(type, width, height);
        if (ordinals.length != g.data.length) {
            throw new IllegalArgumentException("Expected " + g.data.length + " values, got " + ordinals.length);
        }
        for (byte b : ordinals) {
            if (b < 0 || b >= g.constants.length) {
                throw new IllegalArgumentException("Ordinal " + b + " out of range for " + type.getSimpleName());
            }
        }
        System.arraycopy(ordinals, 0, g.data, 0, ordinals.length);
        return g;
    }

    public Class<E> type() { return type; }
    public int width() { return width; }
    public int height() { return height; }

    public E get(int x, int y) {
        return constants[data[index(x, y)]];
    }

    public void set(int x, int y, E value) {
        if (frozen) throw new IllegalStateException("Grid is frozen");
        data[index(x, y)] = (byte) value.ordinal();
    }

    public EnumGrid<E> freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public byte[] toOrdinals() {
        return data.clone();
    }

    public int count(E value) {
        int n = 0;
        byte o = (byte) value.ordinal();
        for (byte b : data) if (b == o) n++;
        return n;
    }

    public Map<E, Integer> histogram() {
        Map<E, Integer> out = new EnumMap<>(type);
        for (byte b : data) out.merge(constants[b], 1, Integer::sum);
        return out;
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
        if (!(o instanceof EnumGrid)) return false;
        EnumGrid<?> that = (EnumGrid<?>) o;
        return type == that.type && width == that.width && height == that.height && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(data);
    }
}
