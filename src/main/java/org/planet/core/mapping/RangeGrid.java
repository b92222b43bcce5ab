package org.planet.core.mapping;

import org.planet.core.climate.TemperatureRange;

import java.util.Objects;

/**
 * Temperature range per cell as three parallel grids (K).
 */
public final class RangeGrid {

    private final FloatGrid min;
    private final FloatGrid average;
    private final FloatGrid max;

    public RangeGrid(int width, int height) {
        this(new FloatGrid(width, height), new FloatGrid(width, height), new FloatGrid(width, height));
    }

    public RangeGrid(FloatGrid min, FloatGrid average, FloatGrid max) {
        if (min.width() != average.width() || min.width() != max.width()
                || min.height() != average.height() || min.height() != max.height()) {
            throw new IllegalArgumentException("Range component grids differ in size");
        }
        this.min = min;
        this.average = average;
        this.max = max;
    }

    public int width() { return min.width(); }
    public int height() { return min.height(); }

    public TemperatureRange get(int x, int y) {
        return new TemperatureRange(min.get(x, y), average.get(x, y), max.get(x, y));
    }

    public void set(int x, int y, TemperatureRange range) {
        min.set(x, y, range.min());
        average.set(x, y, range.average());
        max.set(x, y, range.max());
    }

    public FloatGrid min() { return min; }
    public FloatGrid average() { return average; }
    public FloatGrid max() { return max; }

    public RangeGrid freeze() {
        min.freeze();
        average.freeze();
        max.freeze();
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeGrid)) return false;
        RangeGrid that = (RangeGrid) o;
        return min.equals(that.min) && average.equals(that.average) && max.equals(that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, average, max);
    }
}
