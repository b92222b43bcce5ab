package org.planet.core.generation;

import org.junit.jupiter.api.Test;
import org.planet.core.climate.ClimateConstants;
import org.planet.core.climate.HadleyCache;
import org.planet.core.climate.TemperatureModel;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.HydrologyMaps;
import org.planet.core.mapping.MapProjection;
import org.planet.core.mapping.ProjectionType;
import org.planet.core.mapping.SeasonMaps;
import org.planet.core.mapping.SurfaceMaps;
import org.planet.core.model.Planet;
import org.planet.core.model.config.GeneratorSettings;
import org.planet.core.model.config.PlanetParams;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationPipelineTest {

    private static Planet earth() {
        return new PlanetParams().id("test-earth").seeds(101, 202, 303, 404, 505).build();
    }

    private static GenerationPipeline pipeline(StageProfile profile) {
        return new GenerationPipeline(profile, true, StageListener.SILENT, new HadleyCache());
    }

    private static GeneratorSettings settings(int resolution, int seasons) {
        return new GeneratorSettings(resolution, seasons).parallel(false);
    }

    @Test
    void sameInputsGiveIdenticalMaps() {
        Planet p = earth();
        SurfaceMaps a = pipeline(StageProfile.full()).run(p, settings(16, 4));
        SurfaceMaps b = pipeline(StageProfile.full()).run(p, settings(16, 4));
        assertEquals(a, b);

        SurfaceMaps parallel = pipeline(StageProfile.full()).run(p, settings(16, 4).parallel(true));
        assertEquals(a, parallel);
    }

    @Test
    void fullRunFillsEveryLayer() {
        SurfaceMaps m = pipeline(StageProfile.full()).run(earth(), settings(16, 4));
        assertEquals(32, m.width());
        assertEquals(16, m.height());
        assertEquals(4, m.seasons().size());
        assertNotNull(m.temperature());
        assertNotNull(m.winterTemperature());
        assertNotNull(m.hydrology());
        assertNotNull(m.biome());
        assertNotNull(m.seaIce());
        assertNotNull(m.snowCover());
        assertNotNull(m.overallClassification());
        assertEquals(GeneratorSettings.defaultResources().size(), m.resources().size());
        assertTrue(m.elevation().isFrozen());
        assertTrue(m.elevation().min() >= -1 && m.elevation().max() <= 1);
    }

    @Test
    void seasonsSplitTheYearAndSumToTotal() {
        SurfaceMaps m = pipeline(StageProfile.climateOnly()).run(earth(), settings(16, 3));
        double proportions = 0;
        for (SeasonMaps s : m.seasons()) {
            proportions += s.proportionOfYear();
            assertEquals(s.index() / 3.0, s.startOfYear(), 1e-12);
        }
        assertEquals(1.0, proportions, 1e-12);

        FloatGrid total = m.totalPrecipitation();
        FloatGrid avg = m.averagePrecipitation();
        for (int y = 0; y < m.height(); y++) {
            for (int x = 0; x < m.width(); x++) {
                double sum = 0;
                for (SeasonMaps s : m.seasons()) sum += s.precipitation().get(x, y);
                assertEquals(sum, total.get(x, y), 1e-3 + Math.abs(sum) * 1e-5);
                assertEquals(total.get(x, y), avg.get(x, y) * 3, 1e-3 + Math.abs(sum) * 1e-5);
                assertTrue(total.get(x, y) >= 0);
            }
        }
        assertTrue(m.maxPrecipitation() >= 0);
    }

    @Test
    void snowFallsOnlyInFreezingSeasons() {
        SurfaceMaps m = pipeline(StageProfile.climateOnly()).run(earth(), settings(16, 4));
        for (SeasonMaps s : m.seasons()) {
            for (int y = 0; y < m.height(); y++) {
                for (int x = 0; x < m.width(); x++) {
                    float snow = s.snowfall().get(x, y);
                    assertTrue(snow >= 0);
                    if (snow > 0) {
                        double t = m.seasonTemperatureAt(x, y, s.index());
                        assertTrue(t <= ClimateConstants.FREEZING_POINT,
                                "snow at (" + x + "," + y + ") season " + s.index() + " T=" + t);
                        assertTrue(s.precipitation().get(x, y) >= snow);
                    }
                }
            }
        }
    }

    @Test
    void seasonTemperatureFollowsTheSunInBothHemispheres() {
        Planet p = earth();
        SurfaceMaps m = pipeline(StageProfile.climateOnly()).run(p, settings(16, 4));
        TemperatureModel model = new TemperatureModel(p);
        MapProjection proj = m.projection();

        int north = proj.rowOf(Math.toRadians(45));
        int south = proj.rowOf(Math.toRadians(-45));
        for (int y : new int[]{north, south}) {
            double lat = proj.latitudeOf(y);
            for (int x = 0; x < m.width(); x += 5) {
                double meters = m.elevationMetersAt(x, y);
                // сезоны 0 и 2 из 4 приходятся точно на солнцестояния
                for (int season : new int[]{0, 2}) {
                    double anomaly = model.seasonTrueAnomaly(season, 4);
                    double expected = model.temperatureAt(anomaly, lat, meters);
                    assertEquals(expected, m.seasonTemperatureAt(x, y, season), 1e-2,
                            "lat=" + Math.toDegrees(lat) + " season " + season);
                }
            }
        }

        // на уровне моря: летом северного полушария север теплее, юг холоднее
        double northWinter = model.temperatureAt(model.seasonTrueAnomaly(0, 4), proj.latitudeOf(north), 0);
        double northSummer = model.temperatureAt(model.seasonTrueAnomaly(2, 4), proj.latitudeOf(north), 0);
        double southWinter = model.temperatureAt(model.seasonTrueAnomaly(0, 4), proj.latitudeOf(south), 0);
        double southSummer = model.temperatureAt(model.seasonTrueAnomaly(2, 4), proj.latitudeOf(south), 0);
        assertTrue(northSummer > northWinter);
        assertTrue(southWinter > southSummer);
    }

    @Test
    void hydrologyRoutesPrecipitationDownhill() {
        SurfaceMaps m = pipeline(StageProfile.climateOnly()).run(earth(), settings(16, 4));
        HydrologyMaps h = m.hydrology();
        assertNotNull(h);
        assertTrue(h.flow().isFrozen());
        assertTrue(h.depth().min() >= 0);
        assertTrue(h.flow().min() >= 0);
        assertEquals(h.flow().max(), h.maxFlow(), 1e-6 * Math.max(1.0, h.maxFlow()));
        for (int y = 0; y < m.height(); y++) {
            for (int x = 0; x < m.width(); x++) {
                if (!m.isLand(x, y)) {
                    assertEquals(0.0, h.depth().get(x, y));
                }
            }
        }

        SurfaceMaps terrain = pipeline(StageProfile.terrainOnly()).run(earth(), settings(16, 0));
        assertNull(terrain.hydrology());
    }

    @Test
    void noHydrosphereMeansAllLand() {
        Planet dry = new PlanetParams().seeds(1, 2, 3, 4, 5).hydrosphereProportion(0).build();
        SurfaceMaps m = pipeline(StageProfile.climateOnly()).run(dry, settings(16, 2));
        assertEquals(m.width() * m.height(), m.landCellCount());
        assertEquals(1.0, m.landFraction(), 1e-9);
        assertEquals(0, m.biome().count(org.planet.core.climate.BiomeType.SEA));
    }

    @Test
    void landFractionAgreesAcrossProjections() {
        Planet p = earth();
        SurfaceMaps eq = pipeline(StageProfile.terrainOnly()).run(p, settings(48, 0));
        SurfaceMaps ea = pipeline(StageProfile.terrainOnly())
                .run(p, settings(48, 0).projection(ProjectionType.CYLINDRICAL_EQUAL_AREA));
        assertEquals(eq.landFraction(), ea.landFraction(), 0.05);
    }

    @Test
    void terrainOnlyLeavesClimateEmpty() {
        SurfaceMaps m = pipeline(StageProfile.terrainOnly()).run(earth(), settings(16, 4));
        assertNull(m.temperature());
        assertNull(m.biome());
        assertTrue(m.seasons().isEmpty());
        assertTrue(m.resources().isEmpty());
    }

    @Test
    void zeroSeasonsGiveZeroPrecipitation() {
        SurfaceMaps m = pipeline(StageProfile.climateOnly()).run(earth(), settings(16, 0));
        assertEquals(0, m.seasonCount());
        assertEquals(0.0, m.totalPrecipitation().max());
        assertEquals(0.0, m.maxPrecipitation());
    }

    @Test
    void invalidSettingsAreRejectedBeforeAnyStage() {
        Planet airless = new PlanetParams().seeds(1, 2, 3).atmosphere(null).build();
        RecordingListener rec = new RecordingListener();
        GenerationPipeline pipe = new GenerationPipeline(StageProfile.climateOnly(), true, rec, new HadleyCache());
        assertThrows(IllegalArgumentException.class, () -> pipe.run(airless, settings(16, 4)));
        assertThrows(IllegalArgumentException.class, () -> pipe.run(earth(), settings(0, 4)));
        assertThrows(IllegalArgumentException.class, () -> pipe.run(earth(), settings(16, -1)));
        assertThrows(IllegalArgumentException.class,
                () -> pipe.run(earth(), settings(15, 4).projection(ProjectionType.CYLINDRICAL_EQUAL_AREA)));
        assertTrue(rec.events.isEmpty());

        // без атмосферы, но и без сезонов
        assertDoesNotThrow(() -> pipeline(StageProfile.climateOnly()).run(airless, settings(16, 0)));
    }

    @Test
    void failingStageIsReportedWithContext() {
        List<GenerationStage> stages = new ArrayList<>();
        stages.add(new GenerationStage() {
            @Override public StageId id() { return StageId.ELEVATION; }
            @Override public String name() { return "Broken"; }
            @Override public void apply(WorldContext ctx) { throw new IllegalStateException("boom"); }
        });
        GenerationPipeline pipe = new GenerationPipeline(stages, StageProfile.terrainOnly(), true,
                StageListener.SILENT, new HadleyCache());

        RuntimeException e = assertThrows(RuntimeException.class, () -> pipe.run(earth(), settings(16, 2)));
        assertTrue(e.getMessage().contains("ELEVATION - Broken"), e.getMessage());
        assertTrue(e.getMessage().contains("resolution=16"));
        assertTrue(e.getMessage().contains("seasons=2"));
        assertTrue(e.getMessage().contains("seed=101"));
        assertEquals("boom", e.getCause().getMessage());
    }

    @Test
    void listenerSeesEnabledStagesInOrder() {
        RecordingListener rec = new RecordingListener();
        new GenerationPipeline(StageProfile.withResources(), true, rec, new HadleyCache())
                .run(earth(), settings(16, 0));
        assertEquals(List.of("start ELEVATION", "end ELEVATION", "start RESOURCES", "end RESOURCES"), rec.events);
    }

    @Test
    void profilesCheckDependencies() {
        assertThrows(IllegalArgumentException.class, () -> StageProfile.of(StageId.TEMPERATURE));
        assertThrows(IllegalArgumentException.class,
                () -> StageProfile.of(StageId.ELEVATION, StageId.TEMPERATURE, StageId.CLASSIFICATION));
        assertTrue(StageProfile.full().isEnabled(StageId.RESOURCES));
        assertFalse(StageProfile.climateOnly().isEnabled(StageId.RESOURCES));
        assertEquals(1, StageProfile.terrainOnly().enabled().size());
        assertThrows(IllegalArgumentException.class, () -> StageProfile.of(StageId.ELEVATION, StageId.HYDROLOGY));
        assertTrue(StageProfile.climateOnly().isEnabled(StageId.HYDROLOGY));
    }

    private static final class RecordingListener implements StageListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onStageStart(StageId id, String name) {
            events.add("start " + id);
        }

        @Override
        public void onStageEnd(StageId id, String name, long elapsedMs) {
            events.add("end " + id);
        }
    }
}
