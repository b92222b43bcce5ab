package org.planet.core.generation;

import org.planet.core.climate.HadleyCache;
import org.planet.core.generation.stages.AggregateStage;
import org.planet.core.generation.stages.ClassificationStage;
import org.planet.core.generation.stages.CoverStage;
import org.planet.core.generation.stages.ElevationStage;
import org.planet.core.generation.stages.HydrologyStage;
import org.planet.core.generation.stages.PrecipitationStage;
import org.planet.core.generation.stages.ResourceStage;
import org.planet.core.generation.stages.SnowfallStage;
import org.planet.core.generation.stages.TemperatureStage;
import org.planet.core.mapping.SeasonMaps;
import org.planet.core.mapping.SurfaceMaps;
import org.planet.core.model.Planet;
import org.planet.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.List;

public class GenerationPipeline {

    private final List<GenerationStage> stages;
    private final StageProfile profile;
    private final boolean enableValidation;
    private final StageListener listener;
    private final HadleyCache hadley;

    /**
     * Полный конструктор. Кэш Хэдли можно разделять между запусками и планетами.
     */
    public GenerationPipeline(StageProfile profile,
                              boolean enableValidation,
                              StageListener listener,
                              HadleyCache hadley) {
        this(defaultStages(), profile, enableValidation, listener, hadley);
    }

    /**
     * Удобный конструктор по умолчанию:
     * - все стадии
     * - валидации включены
     * - вывод в консоль
     */
    public GenerationPipeline() {
        this(StageProfile.full(), true, new ConsoleStageListener(),
                new HadleyCache(PlanetTuning.climateTuning().hadleyCacheSize()));
    }

    GenerationPipeline(List<GenerationStage> stages,
                       StageProfile profile,
                       boolean enableValidation,
                       StageListener listener,
                       HadleyCache hadley) {
        this.stages = stages;
        this.profile = profile;
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();
        this.hadley = hadley;
    }

    // Фиксируем порядок стадий
    static List<GenerationStage> defaultStages() {
        List<GenerationStage> list = new ArrayList<>();
        list.add(new ElevationStage());
        list.add(new TemperatureStage());
        list.add(new PrecipitationStage());
        list.add(new SnowfallStage());
        list.add(new AggregateStage());
        list.add(new HydrologyStage());
        list.add(new ClassificationStage());
        list.add(new CoverStage());
        list.add(new ResourceStage());
        return list;
    }

    public StageProfile profile() {
        return profile;
    }

    public HadleyCache hadleyCache() {
        return hadley;
    }

    public SurfaceMaps run(Planet planet, GeneratorSettings settings) {
        // всё невалидное отбрасываем до первой стадии
        settings.validate(planet, profile.isEnabled(StageId.PRECIPITATION));
        WorldContext ctx = new WorldContext(planet, settings, hadley, PlanetTuning.climateTuning());

        for (GenerationStage stage : stages) {
            if (!profile.isEnabled(stage.id())) {
                System.out.println("[STAGE SKIP]  " + stage.id() + " - " + stage.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name());

            try {
                stage.apply(ctx);

                if (enableValidation && settings.validation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (RuntimeException e) {
                throw new RuntimeException("Generation failed at stage: " + stage.id() + " - " + stage.name()
                        + " (resolution=" + settings.resolution
                        + ", seasons=" + settings.seasons
                        + ", seed=" + planet.seed(0) + ")", e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed);
            }
        }

        SurfaceMaps maps = toSurfaceMaps(ctx);
        WorldStats stats = WorldStats.compute(maps);
        WorldStatsReport.print(stats);
        return maps;
    }

    private void runValidation(StageId id, WorldContext ctx) {
        switch (id) {
            case ELEVATION -> Validation.afterElevation(ctx);
            case TEMPERATURE -> Validation.afterTemperature(ctx);
            case PRECIPITATION -> Validation.afterPrecipitation(ctx);
            case SNOWFALL -> Validation.afterSnowfall(ctx);
            case AGGREGATE -> Validation.afterAggregate(ctx);
            case HYDROLOGY -> Validation.afterHydrology(ctx);
            case CLASSIFICATION -> Validation.afterClassification(ctx);
            case COVER -> Validation.afterCover(ctx);
            case RESOURCES -> Validation.afterResources(ctx);
        }
    }

    static SurfaceMaps toSurfaceMaps(WorldContext ctx) {
        int seasons = ctx.seasonPrecipitation == null ? 0 : ctx.seasonPrecipitation.length;
        SurfaceMaps.Builder b = SurfaceMaps.builder()
                .planetId(ctx.planet.id())
                .projection(ctx.projection)
                .seasonCount(seasons)
                .maxElevation(ctx.planet.maxElevation())
                .seaLevel(ctx.planet.seaLevel())
                .hydrosphere(ctx.planet.hasHydrosphere())
                .elevation(ctx.elevation)
                .averageElevation(ctx.averageElevation)
                .landCellCount(ctx.landCellCount)
                .temperature(ctx.temperature)
                .winterTemperature(ctx.winterTemperature)
                .summerTemperature(ctx.summerTemperature)
                .hydrology(ctx.hydrology)
                .totalPrecipitation(ctx.totalPrecipitation)
                .averagePrecipitation(ctx.averagePrecipitation)
                .totalSnowfall(ctx.totalSnowfall)
                .overallTemperature(ctx.overallTemperature)
                .totalPrecipitationRange(ctx.totalPrecipitationRange)
                .totalSnowfallRange(ctx.totalSnowfallRange)
                .maxPrecipitation(ctx.maxPrecipitation)
                .humidity(ctx.humidity)
                .climate(ctx.climate)
                .ecology(ctx.ecology)
                .biome(ctx.biome)
                .overallClassification(ctx.overallClassification)
                .seaIce(ctx.seaIce)
                .snowCover(ctx.snowCover);
        for (int i = 0; i < seasons; i++) {
            b.season(new SeasonMaps(i, seasons, ctx.seasonPrecipitation[i],
                    ctx.seasonSnowfall == null ? null : ctx.seasonSnowfall[i]));
        }
        ctx.resources.forEach(b::resource);
        return b.build();
    }
}
