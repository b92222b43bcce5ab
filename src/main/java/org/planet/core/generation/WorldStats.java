package org.planet.core.generation;

import org.planet.core.climate.BiomeType;
import org.planet.core.climate.ClimateType;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.SurfaceMaps;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

public class WorldStats {

    public String planetId;
    public String projection;
    public int cellCount;
    public int seasons;

    // elevation, m
    public double elevationMin;
    public double elevationMax;
    public double elevationAvg;
    public int landCells;
    public double landFraction;

    // temperature, K
    public boolean hasTemperature;
    public double tempMin;
    public double tempMax;
    public double tempAvg;

    // precipitation / snowfall, mm per year
    public boolean hasPrecipitation;
    public double precipMin;
    public double precipMax;
    public double precipAvg;
    public double snowMax;
    public double snowAvg;
    public double seasonPeak;

    // hydrology
    public boolean hasHydrology;
    public double maxFlow;
    public int lakeCells;

    public int seaIceCells;
    public int snowCoverCells;

    public final Map<ClimateType, Integer> climateCounts = new EnumMap<>(ClimateType.class);
    public final Map<BiomeType, Integer> biomeCounts = new EnumMap<>(BiomeType.class);
    public final Map<String, Double> resourceAvg = new TreeMap<>();

    public static WorldStats compute(SurfaceMaps maps) {
        WorldStats s = new WorldStats();
        s.planetId = maps.planetId();
        s.projection = maps.projection().toString();
        s.cellCount = maps.projection().cellCount();
        s.seasons = maps.seasonCount();

        s.elevationMin = maps.elevation().min() * maps.maxElevation();
        s.elevationMax = maps.elevation().max() * maps.maxElevation();
        s.elevationAvg = maps.averageElevation();
        s.landCells = maps.landCellCount();
        s.landFraction = maps.landFraction();

        if (maps.temperature() != null) {
            s.hasTemperature = true;
            s.tempMin = maps.temperature().min().min();
            s.tempMax = maps.temperature().max().max();
            s.tempAvg = maps.temperature().average().mean();
        }

        if (maps.totalPrecipitation() != null) {
            s.hasPrecipitation = true;
            s.precipMin = maps.totalPrecipitationRange().min();
            s.precipMax = maps.totalPrecipitationRange().max();
            s.precipAvg = maps.totalPrecipitationRange().average();
            s.snowMax = maps.totalSnowfallRange().max();
            s.snowAvg = maps.totalSnowfallRange().average();
            s.seasonPeak = maps.maxPrecipitation();
        }

        if (maps.hydrology() != null) {
            s.hasHydrology = true;
            s.maxFlow = maps.hydrology().maxFlow();
            FloatGrid depth = maps.hydrology().depth();
            for (int y = 0; y < depth.height(); y++) {
                for (int x = 0; x < depth.width(); x++) {
                    if (depth.get(x, y) > 0) s.lakeCells++;
                }
            }
        }

        if (maps.seaIce() != null) {
            s.seaIceCells = maps.seaIce().coveredCells();
            s.snowCoverCells = maps.snowCover().coveredCells();
        }
        if (maps.climate() != null) {
            s.climateCounts.putAll(maps.climate().histogram());
            s.biomeCounts.putAll(maps.biome().histogram());
        }
        maps.resources().forEach((name, grid) -> s.resourceAvg.put(name, grid.mean()));
        return s;
    }
}
