package org.planet.core.generation;

import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Row loop of the grid passes. Each row writes only its own cells, so rows can run
 * on the common pool without coordination.
 */
public final class Parallel {

    private Parallel() {}

    public static void forEachIndex(int n, boolean parallel, IntConsumer action) {
        if (parallel) {
            IntStream.range(0, n).parallel().forEach(action);
        } else {
            for (int i = 0; i < n; i++) action.accept(i);
        }
    }

    public static void forEachRow(WorldContext ctx, IntConsumer action) {
        forEachIndex(ctx.projection.height(), ctx.settings.parallel, action);
    }
}
