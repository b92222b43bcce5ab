package org.planet.core.generation;

import org.planet.core.climate.Classification;
import org.planet.core.climate.BiomeType;
import org.planet.core.climate.ClimateType;
import org.planet.core.climate.EcologyType;
import org.planet.core.climate.HadleyCache;
import org.planet.core.climate.HumidityType;
import org.planet.core.climate.OrbitalDeclination;
import org.planet.core.climate.PrecipitationModel;
import org.planet.core.climate.StellarBlackbody;
import org.planet.core.climate.TemperatureModel;
import org.planet.core.climate.TemperatureRange;
import org.planet.core.mapping.CoverGrid;
import org.planet.core.mapping.EnumGrid;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.HydrologyMaps;
import org.planet.core.mapping.MapProjection;
import org.planet.core.mapping.RangeGrid;
import org.planet.core.mapping.ValueRange;
import org.planet.core.model.Planet;
import org.planet.core.model.config.GeneratorSettings;
import org.planet.core.terrain.ElevationModel;

import java.util.Map;
import java.util.TreeMap;

/**
 * Контекст одного запуска построения карт (один запуск = один контекст).
 * Модели создаются здесь один раз; сетки заполняют стадии по порядку.
 */
public class WorldContext {

    public final Planet planet;
    public final GeneratorSettings settings;
    public final MapProjection projection;
    public final PlanetTuning.ClimateTuning tuning;

    public final ElevationModel elevationModel;
    public final TemperatureModel temperatureModel;
    /** null when the planet has no atmosphere. */
    public final PrecipitationModel precipitationModel;

    // ELEVATION
    public FloatGrid elevation;
    public double averageElevation;
    public int landCellCount;

    // TEMPERATURE
    public RangeGrid temperature;
    public FloatGrid winterTemperature;
    public FloatGrid summerTemperature;

    // PRECIPITATION / SNOWFALL, indexed by season
    public FloatGrid[] seasonPrecipitation;
    public FloatGrid[] seasonSnowfall;

    // AGGREGATE
    public FloatGrid totalPrecipitation;
    public FloatGrid averagePrecipitation;
    public FloatGrid totalSnowfall;
    public TemperatureRange overallTemperature;
    public ValueRange totalPrecipitationRange;
    public ValueRange totalSnowfallRange;
    public double maxPrecipitation;

    // HYDROLOGY
    public HydrologyMaps hydrology;

    // CLASSIFICATION
    public EnumGrid<HumidityType> humidity;
    public EnumGrid<ClimateType> climate;
    public EnumGrid<EcologyType> ecology;
    public EnumGrid<BiomeType> biome;
    public Classification overallClassification;

    // COVER
    public CoverGrid seaIce;
    public CoverGrid snowCover;

    // RESOURCES
    public final Map<String, FloatGrid> resources = new TreeMap<>();

    public WorldContext(Planet planet, GeneratorSettings settings, HadleyCache hadley, PlanetTuning.ClimateTuning tuning) {
        this.planet = planet;
        this.settings = settings;
        this.projection = settings.toProjection();
        this.tuning = tuning;

        this.elevationModel = new ElevationModel(planet, tuning.elevationMultiplier());
        this.temperatureModel = new TemperatureModel(planet,
                new StellarBlackbody(planet),
                new OrbitalDeclination(planet),
                tuning.polarCosLatitude(),
                tuning.insolationCosine());
        this.precipitationModel = planet.hasAtmosphere()
                ? new PrecipitationModel(planet, hadley, tuning.itczMaxBoost())
                : null;
    }

    public int width() {
        return projection.width();
    }

    public int height() {
        return projection.height();
    }

    public int seasonCount() {
        return settings.seasons;
    }

    /** Meters above sea level, from the stored normalized grid. */
    public double elevationMetersAt(int x, int y) {
        return elevation.get(x, y) * planet.maxElevation();
    }

    public boolean isLand(int x, int y) {
        return !planet.hasHydrosphere() || elevationMetersAt(x, y) > 0;
    }

    /** Season {@code index} temperature at a cell, interpolated between the solstice grids. */
    public double seasonTemperatureAt(int x, int y, int index) {
        return TemperatureModel.seasonTemperature(winterTemperature.get(x, y), summerTemperature.get(x, y),
                index, seasonCount());
    }

    public FloatGrid newGrid() {
        return new FloatGrid(width(), height());
    }
}
