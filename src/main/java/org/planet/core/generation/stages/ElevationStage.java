package org.planet.core.generation.stages;

import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.mapping.FloatGrid;

public class ElevationStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.ELEVATION;
    }

    @Override
    public String name() {
        return "Elevation";
    }

    @Override
    public void apply(WorldContext ctx) {
        FloatGrid grid = ctx.newGrid();
        int w = ctx.width();
        Parallel.forEachRow(ctx, y -> {
            double lat = ctx.projection.latitudeOf(y);
            for (int x = 0; x < w; x++) {
                grid.set(x, y, ctx.elevationModel.normalizedElevationAt(lat, ctx.projection.longitudeOf(x)));
            }
        });
        ctx.elevation = grid;

        // сводка по рельефу нужна и без климатических стадий
        double sum = 0;
        int land = 0;
        for (int y = 0; y < ctx.height(); y++) {
            for (int x = 0; x < w; x++) {
                sum += ctx.elevationMetersAt(x, y);
                if (ctx.isLand(x, y)) land++;
            }
        }
        ctx.averageElevation = sum / ctx.projection.cellCount();
        ctx.landCellCount = land;
    }
}
