package org.planet.core.generation.stages;

import org.planet.core.climate.BiomeType;
import org.planet.core.climate.Classification;
import org.planet.core.climate.ClimateClassifier;
import org.planet.core.climate.ClimateType;
import org.planet.core.climate.EcologyType;
import org.planet.core.climate.HumidityType;
import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.mapping.EnumGrid;

/**
 * Humidity, climate, ecology and biome per cell from the annual temperature range,
 * annual precipitation and elevation.
 */
public class ClassificationStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.CLASSIFICATION;
    }

    @Override
    public String name() {
        return "Classification";
    }

    @Override
    public void apply(WorldContext ctx) {
        int w = ctx.width();
        int h = ctx.height();
        EnumGrid<HumidityType> humidity = new EnumGrid<>(HumidityType.class, w, h);
        EnumGrid<ClimateType> climate = new EnumGrid<>(ClimateType.class, w, h);
        EnumGrid<EcologyType> ecology = new EnumGrid<>(EcologyType.class, w, h);
        EnumGrid<BiomeType> biome = new EnumGrid<>(BiomeType.class, w, h);
        boolean hydrosphere = ctx.planet.hasHydrosphere();

        Parallel.forEachRow(ctx, y -> {
            for (int x = 0; x < w; x++) {
                Classification c = ClimateClassifier.classify(
                        ctx.temperature.get(x, y),
                        ctx.totalPrecipitation.get(x, y),
                        ctx.elevationMetersAt(x, y),
                        hydrosphere);
                humidity.set(x, y, c.humidity());
                climate.set(x, y, c.climate());
                ecology.set(x, y, c.ecology());
                biome.set(x, y, c.biome());
            }
        });
        ctx.humidity = humidity;
        ctx.climate = climate;
        ctx.ecology = ecology;
        ctx.biome = biome;

        // planet as a whole, read as land
        ctx.overallClassification = ClimateClassifier.classify(
                ctx.overallTemperature.average(),
                ctx.totalPrecipitationRange.average(),
                1.0,
                false);
    }
}
