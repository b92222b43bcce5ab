package org.planet.core.generation.stages;

import org.planet.core.climate.TemperatureModel;
import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.geometry.SurfaceGeometry;
import org.planet.core.geometry.Vector3;
import org.planet.core.mapping.FloatGrid;

/**
 * One precipitation grid per season. Season i starts {@code i/N} of the year after the
 * northern winter solstice and is sampled there: sun position and temperature both
 * come from that point of the orbit.
 */
public class PrecipitationStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.PRECIPITATION;
    }

    @Override
    public String name() {
        return "Precipitation";
    }

    @Override
    public void apply(WorldContext ctx) {
        int seasons = ctx.seasonCount();
        FloatGrid[] grids = new FloatGrid[seasons];
        for (int i = 0; i < seasons; i++) grids[i] = ctx.newGrid();
        ctx.seasonPrecipitation = grids;
        if (seasons == 0) {
            return;
        }
        if (ctx.precipitationModel == null) {
            throw new IllegalStateException("No precipitation model for planet " + ctx.planet.id());
        }

        TemperatureModel tm = ctx.temperatureModel;
        double[] anomalies = new double[seasons];
        for (int i = 0; i < seasons; i++) {
            anomalies[i] = tm.seasonTrueAnomaly(i, seasons);
        }
        double proportion = 1.0 / seasons;
        SurfaceGeometry geometry = ctx.planet.geometry();
        int w = ctx.width();

        Parallel.forEachRow(ctx, y -> {
            double lat = ctx.projection.latitudeOf(y);
            double[] seasonalLat = new double[seasons];
            for (int i = 0; i < seasons; i++) {
                seasonalLat[i] = tm.seasonalLatitudeAt(lat, anomalies[i]);
            }
            for (int x = 0; x < w; x++) {
                Vector3 position = geometry.latLonToVector(lat, ctx.projection.longitudeOf(x));
                for (int i = 0; i < seasons; i++) {
                    double t = ctx.seasonTemperatureAt(x, y, i);
                    grids[i].set(x, y, ctx.precipitationModel
                            .precipitationAt(position, seasonalLat[i], t, proportion)
                            .precipitation());
                }
            }
        });
    }
}
