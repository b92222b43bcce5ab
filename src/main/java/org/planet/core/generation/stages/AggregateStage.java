package org.planet.core.generation.stages;

import org.planet.core.climate.TemperatureRange;
import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.ValueRange;

/**
 * Annual totals and the plain mean over the season grids (seasons are equal-length),
 * plus planet-wide temperature and precipitation summaries.
 */
public class AggregateStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.AGGREGATE;
    }

    @Override
    public String name() {
        return "Aggregate";
    }

    @Override
    public void apply(WorldContext ctx) {
        int seasons = ctx.seasonCount();
        FloatGrid total = ctx.newGrid();
        FloatGrid average = ctx.newGrid();
        FloatGrid snow = ctx.newGrid();
        int w = ctx.width();

        Parallel.forEachRow(ctx, y -> {
            for (int x = 0; x < w; x++) {
                double p = 0;
                double s = 0;
                for (int i = 0; i < seasons; i++) {
                    p += ctx.seasonPrecipitation[i].get(x, y);
                    if (ctx.seasonSnowfall != null) {
                        s += ctx.seasonSnowfall[i].get(x, y);
                    }
                }
                total.set(x, y, p);
                average.set(x, y, seasons == 0 ? 0.0 : p / seasons);
                snow.set(x, y, s);
            }
        });
        ctx.totalPrecipitation = total;
        ctx.averagePrecipitation = average;
        ctx.totalSnowfall = snow;

        ctx.overallTemperature = new TemperatureRange(
                ctx.temperature.min().min(),
                ctx.temperature.average().mean(),
                ctx.temperature.max().max());
        ctx.totalPrecipitationRange = ValueRange.of(total);
        ctx.totalSnowfallRange = ValueRange.of(snow);

        double peak = 0;
        for (int i = 0; i < seasons; i++) {
            peak = Math.max(peak, ctx.seasonPrecipitation[i].max());
        }
        ctx.maxPrecipitation = peak;
    }
}
