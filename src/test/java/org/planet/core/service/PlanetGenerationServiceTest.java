package org.planet.core.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.planet.core.climate.HadleyCache;
import org.planet.core.generation.GenerationPipeline;
import org.planet.core.generation.StageListener;
import org.planet.core.generation.StageProfile;
import org.planet.core.io.MapFormatException;
import org.planet.core.io.PlanetSerializer;
import org.planet.core.mapping.MapProjection;
import org.planet.core.mapping.ProjectionType;
import org.planet.core.mapping.SurfaceMaps;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;
import org.planet.core.model.config.GeneratorSettings;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PlanetGenerationServiceTest {

    private final PlanetGenerationService service = new PlanetGenerationService(
            new GenerationPipeline(StageProfile.climateOnly(), true, StageListener.SILENT, new HadleyCache()));

    @Test
    void saveAndLoadPlanetAndMaps(@TempDir Path dir) throws Exception {
        Planet planet = service.generatePlanet(PlanetKind.ROCKY, 42);
        int seasons = planet.hasAtmosphere() ? 2 : 0;
        SurfaceMaps maps = service.generateSurfaceMaps(planet, new GeneratorSettings(8, seasons).parallel(false));

        Path planetFile = dir.resolve("nested/planet.json");
        Path mapsFile = dir.resolve("nested/maps.json");
        service.savePlanet(planet, planetFile);
        service.saveMaps(maps, mapsFile);

        Planet loaded = service.loadPlanet(planetFile);
        assertEquals(PlanetSerializer.toJson(planet), PlanetSerializer.toJson(loaded));
        assertEquals(maps, service.loadMaps(mapsFile));
    }

    @Test
    void corruptFileFailsWithFormatError(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("maps.json");
        Files.writeString(file, "{\"sv\":99}", StandardCharsets.UTF_8);
        assertThrows(MapFormatException.class, () -> service.loadMaps(file));
    }

    @Test
    void resampleChangesOnlyTheGrid() {
        Planet planet = service.generatePlanet(PlanetKind.ICY, 3);
        SurfaceMaps maps = service.generateSurfaceMaps(planet, new GeneratorSettings(8, 2).parallel(false));
        MapProjection target = MapProjection.full(ProjectionType.CYLINDRICAL_EQUAL_AREA, 12);
        SurfaceMaps out = service.resample(maps, target);
        assertEquals(24, out.width());
        assertEquals(maps.seasonCount(), out.seasonCount());
        assertEquals(maps.overallClassification(), out.overallClassification());
    }
}
