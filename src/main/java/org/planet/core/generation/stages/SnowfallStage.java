package org.planet.core.generation.stages;

import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.mapping.FloatGrid;

/**
 * Snowfall per season: the season's precipitation times the snow ratio where the
 * season temperature is at or below freezing.
 */
public class SnowfallStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.SNOWFALL;
    }

    @Override
    public String name() {
        return "Snowfall";
    }

    @Override
    public void apply(WorldContext ctx) {
        int seasons = ctx.seasonCount();
        FloatGrid[] grids = new FloatGrid[seasons];
        for (int i = 0; i < seasons; i++) grids[i] = ctx.newGrid();
        ctx.seasonSnowfall = grids;
        if (seasons == 0) {
            return;
        }

        int w = ctx.width();
        Parallel.forEachRow(ctx, y -> {
            for (int x = 0; x < w; x++) {
                for (int i = 0; i < seasons; i++) {
                    double t = ctx.seasonTemperatureAt(x, y, i);
                    grids[i].set(x, y, ctx.precipitationModel
                            .snowFrom(ctx.seasonPrecipitation[i].get(x, y), t));
                }
            }
        });
    }
}
