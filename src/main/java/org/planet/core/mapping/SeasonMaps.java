package org.planet.core.mapping;

import java.util.Objects;

/**
 * Precipitation and snowfall of one season (mm). Season {@code index} starts at
 * {@code index / count} of the year, counted from the winter solstice.
 */
public final class SeasonMaps {

    private final int index;
    private final int count;
    private final FloatGrid precipitation;
    private final FloatGrid snowfall;

    public SeasonMaps(int index, int count, FloatGrid precipitation, FloatGrid snowfall) {
        if (count <= 0 || index < 0 || index >= count) {
            throw new IllegalArgumentException("Season " + index + " of " + count);
        }
        this.index = index;
        this.count = count;
        this.precipitation = precipitation;
        this.snowfall = snowfall;
    }

    public int index() { return index; }
    public int count() { return count; }

    public double startOfYear() {
        return index / (double) count;
    }

    public double proportionOfYear() {
        return 1.0 / count;
    }

    public FloatGrid precipitation() { return precipitation; }
    public FloatGrid snowfall() { return snowfall; }

    public SeasonMaps freeze() {
        precipitation.freeze();
        if (snowfall != null) snowfall.freeze();
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeasonMaps)) return false;
        SeasonMaps that = (SeasonMaps) o;
        return index == that.index && count == that.count
                && precipitation.equals(that.precipitation)
                && Objects.equals(snowfall, that.snowfall);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, count, precipitation, snowfall);
    }
}
