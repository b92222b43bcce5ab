package org.planet.core.mapping;

import java.util.Objects;

/**
 * Surface water derived from elevation and annual precipitation: lake depth (m) and
 * the flow entering each cell from upstream (m^3/s).
 */
public final class HydrologyMaps {

    private final FloatGrid depth;
    private final FloatGrid flow;
    private final double maxFlow;

    public HydrologyMaps(FloatGrid depth, FloatGrid flow, double maxFlow) {
        if (depth.width() != flow.width() || depth.height() != flow.height()) {
            throw new IllegalArgumentException("Hydrology grids differ in size");
        }
        this.depth = depth;
        this.flow = flow;
        this.maxFlow = maxFlow;
    }

    public FloatGrid depth() { return depth; }
    public FloatGrid flow() { return flow; }
    public double maxFlow() { return maxFlow; }

    public HydrologyMaps freeze() {
        depth.freeze();
        flow.freeze();
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HydrologyMaps)) return false;
        HydrologyMaps that = (HydrologyMaps) o;
        return Double.compare(maxFlow, that.maxFlow) == 0
                && depth.equals(that.depth)
                && flow.equals(that.flow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(depth, flow, maxFlow);
    }
}
