package org.planet.core.mapping;

/**
 * Nearest-neighbour re-projection between two grids. Each destination cell is
 * inverse-mapped to (lat, lon) and then to the source cell containing it; the
 * lookup table is built once and shared by every layer. Every returned grid is frozen.
 */
public final class GridResampler {

    private final MapProjection source;
    private final MapProjection target;
    private final int[] sourceIndex;

    public GridResampler(MapProjection source, MapProjection target) {
        this.source = source;
        this.target = target;
        this.sourceIndex = new int[target.cellCount()];

        int[] rows = new int[target.height()];
        for (int y = 0; y < target.height(); y++) {
            rows[y] = source.rowOf(target.latitudeOf(y));
        }
        int[] cols = new int[target.width()];
        for (int x = 0; x < target.width(); x++) {
            cols[x] = source.columnOf(target.longitudeOf(x));
        }
        for (int y = 0; y < target.height(); y++) {
            for (int x = 0; x < target.width(); x++) {
                sourceIndex[y * target.width() + x] = rows[y] * source.width() + cols[x];
            }
        }
    }

    public MapProjection source() { return source; }
    public MapProjection target() { return target; }

    /** {x, y} in the source grid for a destination cell. */
    public int[] sourceCell(int x, int y) {
        int i = sourceIndex[y * target.width() + x];
        return new int[]{i % source.width(), i / source.width()};
    }

    public FloatGrid resample(FloatGrid grid) {
        if (grid == null) return null;
        check(grid.width(), grid.height());
        float[] src = grid.toArray();
        float[] out = new float[sourceIndex.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = src[sourceIndex[i]];
        }
        return FloatGrid.of(target.width(), target.height(), out).freeze();
    }

    public <E extends Enum<E>> EnumGrid<E> resample(EnumGrid<E> grid) {
        if (grid == null) return null;
        check(grid.width(), grid.height());
        byte[] src = grid.toOrdinals();
        byte[] out = new byte[sourceIndex.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = src[sourceIndex[i]];
        }
        return EnumGrid.ofOrdinals(grid.type(), target.width(), target.height(), out).freeze();
    }

    public RangeGrid resample(RangeGrid grid) {
        if (grid == null) return null;
        return new RangeGrid(resample(grid.min()), resample(grid.average()), resample(grid.max())).freeze();
    }

    public CoverGrid resample(CoverGrid grid) {
        if (grid == null) return null;
        return new CoverGrid(resample(grid.start()), resample(grid.end())).freeze();
    }

    private void check(int width, int height) {
        if (width != source.width() || height != source.height()) {
            throw new IllegalArgumentException("Grid " + width + "x" + height
                    + " does not match source projection " + source);
        }
    }
}
