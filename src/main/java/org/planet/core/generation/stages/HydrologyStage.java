package org.planet.core.generation.stages;

import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.terrain.DrainageModel;

/**
 * Lake depth and river flow from the elevation grid and annual precipitation.
 */
public class HydrologyStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.HYDROLOGY;
    }

    @Override
    public String name() {
        return "Hydrology";
    }

    @Override
    public void apply(WorldContext ctx) {
        DrainageModel drainage = new DrainageModel(ctx.projection, ctx.planet.radius());
        ctx.hydrology = drainage.compute(ctx.elevation, ctx.planet.maxElevation(),
                ctx.planet.hasHydrosphere(), ctx.totalPrecipitation);
    }
}
