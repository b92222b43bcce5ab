package org.planet.core.mapping;

/**
 * Re-projects a whole {@link SurfaceMaps} bundle. Planet-wide summaries (overall
 * temperature, precipitation ranges, overall classification) carry over; the
 * land cell count and average elevation are recounted on the new grid.
 */
public final class SurfaceMapResampler {

    private SurfaceMapResampler() {}

    public static SurfaceMaps resample(SurfaceMaps maps, MapProjection target) {
        GridResampler r = new GridResampler(maps.projection(), target);

        SurfaceMaps.Builder b = SurfaceMaps.builder()
                .planetId(maps.planetId())
                .projection(target)
                .seasonCount(maps.seasonCount())
                .maxElevation(maps.maxElevation())
                .seaLevel(maps.seaLevel())
                .hydrosphere(maps.hasHydrosphere())
                .temperature(r.resample(maps.temperature()))
                .winterTemperature(r.resample(maps.winterTemperature()))
                .summerTemperature(r.resample(maps.summerTemperature()))
                .totalPrecipitation(r.resample(maps.totalPrecipitation()))
                .averagePrecipitation(r.resample(maps.averagePrecipitation()))
                .totalSnowfall(r.resample(maps.totalSnowfall()))
                .humidity(r.resample(maps.humidity()))
                .climate(r.resample(maps.climate()))
                .ecology(r.resample(maps.ecology()))
                .biome(r.resample(maps.biome()))
                .seaIce(r.resample(maps.seaIce()))
                .snowCover(r.resample(maps.snowCover()))
                .overallTemperature(maps.overallTemperature())
                .totalPrecipitationRange(maps.totalPrecipitationRange())
                .totalSnowfallRange(maps.totalSnowfallRange())
                .overallClassification(maps.overallClassification())
                .maxPrecipitation(maps.maxPrecipitation());

        for (SeasonMaps s : maps.seasons()) {
            b.season(new SeasonMaps(s.index(), s.count(),
                    r.resample(s.precipitation()), r.resample(s.snowfall())));
        }
        if (maps.hydrology() != null) {
            HydrologyMaps h = maps.hydrology();
            b.hydrology(new HydrologyMaps(r.resample(h.depth()), r.resample(h.flow()), h.maxFlow()));
        }
        maps.resources().forEach((name, grid) -> b.resource(name, r.resample(grid)));

        FloatGrid elevation = r.resample(maps.elevation());
        int land = 0;
        double sum = 0;
        for (int y = 0; y < target.height(); y++) {
            for (int x = 0; x < target.width(); x++) {
                double meters = elevation.get(x, y) * maps.maxElevation();
                sum += meters;
                if (!maps.hasHydrosphere() || meters > 0) land++;
            }
        }
        return b.elevation(elevation)
                .landCellCount(land)
                .averageElevation(sum / target.cellCount())
                .build();
    }
}
