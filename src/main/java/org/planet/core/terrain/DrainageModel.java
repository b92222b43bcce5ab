package org.planet.core.terrain;

import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.HydrologyMaps;
import org.planet.core.mapping.MapProjection;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Routes annual precipitation downhill over an elevation grid.
 * <p>
 * Every land cell drains to its lowest strictly lower neighbour (8-neighbourhood,
 * longitude wraps on full-globe maps); ocean cells and land depressions drain to
 * themselves. Runoff of a cell is {@code precipitation(m) * area / year} and is passed
 * on to every cell downstream. A depression that receives flow fills up to the level
 * of the lowest cell of its basin that borders another basin.
 */
public class DrainageModel {

    /** Julian year, s. */
    public static final double SECONDS_PER_YEAR = 31_557_600.0;

    private final MapProjection projection;
    private final double radius;

    public DrainageModel(MapProjection projection, double radius) {
        this.projection = projection;
        this.radius = radius;
    }

    /**
     * @param elevation           normalized elevation, multiplied by {@code maxElevation} for meters
     * @param hydrosphere         false when there is no ocean; then only depressions are sinks
     * @param annualPrecipitation mm per year
     */
    public HydrologyMaps compute(FloatGrid elevation, double maxElevation, boolean hydrosphere,
                                 FloatGrid annualPrecipitation) {
        int w = projection.width();
        int h = projection.height();
        int n = w * h;
        check(elevation);
        check(annualPrecipitation);

        double[] meters = new double[n];
        boolean[] ocean = new boolean[n];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                meters[i] = elevation.get(x, y) * maxElevation;
                ocean[i] = hydrosphere && meters[i] <= 0;
            }
        }

        int[] drain = new int[n];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                drain[i] = ocean[i] ? i : lowestNeighbour(meters, x, y, w, h);
            }
        }

        // сверху вниз: к моменту обработки клетки весь приток в неё уже собран
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> -meters[i]).thenComparingInt(i -> i));

        double[] inflow = new double[n];
        for (int i : order) {
            if (drain[i] == i) continue;
            int y = i / w;
            double runoff = Math.max(0.0, annualPrecipitation.get(i % w, y)) * 0.001
                    * projection.cellArea(y, radius) / SECONDS_PER_YEAR;
            inflow[drain[i]] += inflow[i] + runoff;
        }

        int[] sink = new int[n];
        for (int k = n - 1; k >= 0; k--) {
            int i = order[k];
            sink[i] = drain[i] == i ? i : sink[drain[i]];
        }

        double[] spill = new double[n];
        Arrays.fill(spill, Double.POSITIVE_INFINITY);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (bordersOtherBasin(sink, x, y, w, h)) {
                    spill[sink[i]] = Math.min(spill[sink[i]], meters[i]);
                }
            }
        }

        FloatGrid depth = new FloatGrid(w, h);
        FloatGrid flow = new FloatGrid(w, h);
        double maxFlow = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                flow.set(x, y, inflow[i]);
                maxFlow = Math.max(maxFlow, inflow[i]);

                int s = sink[i];
                boolean lake = !ocean[s] && inflow[s] > 0 && spill[s] < Double.POSITIVE_INFINITY;
                if (lake && !ocean[i]) {
                    depth.set(x, y, Math.max(0.0, spill[s] - meters[i]));
                }
            }
        }
        return new HydrologyMaps(depth, flow, maxFlow);
    }

    private int lowestNeighbour(double[] meters, int x, int y, int w, int h) {
        int best = y * w + x;
        for (int dy = -1; dy <= 1; dy++) {
            int ny = y + dy;
            if (ny < 0 || ny >= h) continue;
            for (int dx = -1; dx <= 1; dx++) {
                int nx = neighbourColumn(x + dx, w);
                if (nx < 0) continue;
                int j = ny * w + nx;
                if (meters[j] < meters[best]) best = j;
            }
        }
        return best;
    }

    private boolean bordersOtherBasin(int[] sink, int x, int y, int w, int h) {
        int s = sink[y * w + x];
        for (int dy = -1; dy <= 1; dy++) {
            int ny = y + dy;
            if (ny < 0 || ny >= h) continue;
            for (int dx = -1; dx <= 1; dx++) {
                int nx = neighbourColumn(x + dx, w);
                if (nx < 0) continue;
                if (sink[ny * w + nx] != s) return true;
            }
        }
        return false;
    }

    /** -1 when the column lies outside a map that does not wrap. */
    private int neighbourColumn(int x, int w) {
        if (x >= 0 && x < w) return x;
        return projection.wrapsLongitude() ? (x + w) % w : -1;
    }

    private void check(FloatGrid grid) {
        if (grid.width() != projection.width() || grid.height() != projection.height()) {
            throw new IllegalArgumentException("Grid " + grid.width() + "x" + grid.height()
                    + " does not match " + projection);
        }
    }
}
