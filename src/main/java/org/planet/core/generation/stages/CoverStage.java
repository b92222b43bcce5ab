package org.planet.core.generation.stages;

import org.planet.core.climate.CoverRanges;
import org.planet.core.climate.TemperatureRange;
import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.mapping.CoverGrid;

/**
 * Sea-ice and snow-cover windows per cell.
 */
public class CoverStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.COVER;
    }

    @Override
    public String name() {
        return "Sea ice & snow cover";
    }

    @Override
    public void apply(WorldContext ctx) {
        int w = ctx.width();
        CoverGrid seaIce = new CoverGrid(w, ctx.height());
        CoverGrid snowCover = new CoverGrid(w, ctx.height());
        boolean hydrosphere = ctx.planet.hasHydrosphere();

        Parallel.forEachRow(ctx, y -> {
            double lat = ctx.projection.latitudeOf(y);
            for (int x = 0; x < w; x++) {
                TemperatureRange range = ctx.temperature.get(x, y);
                double elevation = ctx.elevationMetersAt(x, y);
                seaIce.set(x, y, CoverRanges.seaIce(range, lat, elevation, hydrosphere));
                snowCover.set(x, y, CoverRanges.snowCover(range, lat, elevation, ctx.humidity.get(x, y), hydrosphere));
            }
        });
        ctx.seaIce = seaIce;
        ctx.snowCover = snowCover;
    }
}
