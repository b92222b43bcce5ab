package org.planet.core.generation.stages;

import org.planet.core.climate.SolsticeTemperature;
import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.RangeGrid;

/**
 * Solstice temperatures per cell, lapse-adjusted for the cell's elevation, and the
 * yearly range they span.
 */
public class TemperatureStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.TEMPERATURE;
    }

    @Override
    public String name() {
        return "Temperature";
    }

    @Override
    public void apply(WorldContext ctx) {
        RangeGrid grid = new RangeGrid(ctx.width(), ctx.height());
        FloatGrid winter = ctx.newGrid();
        FloatGrid summer = ctx.newGrid();
        int w = ctx.width();
        Parallel.forEachRow(ctx, y -> {
            double lat = ctx.projection.latitudeOf(y);
            for (int x = 0; x < w; x++) {
                SolsticeTemperature t = ctx.temperatureModel.solsticeTemperatureAt(lat, ctx.elevationMetersAt(x, y));
                winter.set(x, y, t.winter());
                summer.set(x, y, t.summer());
                grid.set(x, y, t.range());
            }
        });
        ctx.temperature = grid;
        ctx.winterTemperature = winter;
        ctx.summerTemperature = summer;
    }
}
