package org.planet.core.mapping;

import org.planet.core.climate.CoverRange;

import java.util.Objects;

/**
 * Sea-ice or snow-cover window per cell, as proportions of the year.
 */
public final class CoverGrid {

    private final FloatGrid start;
    private final FloatGrid end;

    public CoverGrid(int width, int height) {
        this(new FloatGrid(width, height), new FloatGrid(width, height));
    }

    public CoverGrid(FloatGrid start, FloatGrid end) {
        if (start.width() != end.width() || start.height() != end.height()) {
            throw new IllegalArgumentException("Cover component grids differ in size");
        }
        this.start = start;
        this.end = end;
    }

    public int width() { return start.width(); }
    public int height() { return start.height(); }

    public CoverRange get(int x, int y) {
        return new CoverRange(start.get(x, y), end.get(x, y));
    }

    public void set(int x, int y, CoverRange range) {
        start.set(x, y, range.start());
        end.set(x, y, range.end());
    }

    public FloatGrid start() { return start; }
    public FloatGrid end() { return end; }

    public CoverGrid freeze() {
        start.freeze();
        end.freeze();
        return this;
    }

    /** Cells with any cover during the year. */
    public int coveredCells() {
        int n = 0;
        for (int y = 0; y < height(); y++) {
            for (int x = 0; x < width(); x++) {
                if (!get(x, y).isNone()) n++;
            }
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoverGrid)) return false;
        CoverGrid that = (CoverGrid) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }
}
