package org.planet.core.climate;

/**
 * Part of the year a cell is covered (by sea ice or snow), as proportions of the year
 * measured from the winter solstice. {@code start > end} means the window wraps over
 * the end of the year.
 */
public record CoverRange(double start, double end) {

    public static final CoverRange NONE = new CoverRange(0, 0);
    public static final CoverRange FULL_YEAR = new CoverRange(0, 1);

    public boolean isNone() {
        return start == 0 && end == 0;
    }

    public boolean isFullYear() {
        return start == 0 && end == 1;
    }

    /** Covered fraction of the year. */
    public double proportion() {
        if (isFullYear()) return 1.0;
        return start <= end ? end - start : (1 - start) + end;
    }
}
