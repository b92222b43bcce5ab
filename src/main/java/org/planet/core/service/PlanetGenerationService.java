package org.planet.core.service;

import org.planet.core.generation.GenerationPipeline;
import org.planet.core.generation.PlanetFactory;
import org.planet.core.io.PlanetSerializer;
import org.planet.core.io.SurfaceMapsSerializer;
import org.planet.core.mapping.MapProjection;
import org.planet.core.mapping.SurfaceMapResampler;
import org.planet.core.mapping.SurfaceMaps;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;
import org.planet.core.model.config.GeneratorSettings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class PlanetGenerationService {

    private final GenerationPipeline pipeline;

    public PlanetGenerationService(GenerationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public PlanetGenerationService() {
        this(new GenerationPipeline());
    }

    public Planet generatePlanet(PlanetKind kind, long seed) {
        return PlanetFactory.generate(kind, seed);
    }

    // каждый запуск строит свои сетки, общий только кэш Хэдли
    public SurfaceMaps generateSurfaceMaps(Planet planet, GeneratorSettings settings) {
        return pipeline.run(planet, settings);
    }

    public SurfaceMaps resample(SurfaceMaps maps, MapProjection target) {
        return SurfaceMapResampler.resample(maps, target);
    }

    public void savePlanet(Planet planet, Path file) throws IOException {
        write(file, PlanetSerializer.toJson(planet));
    }

    public Planet loadPlanet(Path file) throws IOException {
        return PlanetSerializer.fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    public void saveMaps(SurfaceMaps maps, Path file) throws IOException {
        write(file, SurfaceMapsSerializer.toJson(maps));
    }

    public SurfaceMaps loadMaps(Path file) throws IOException {
        return SurfaceMapsSerializer.fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    private static void write(Path file, String json) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, json, StandardCharsets.UTF_8);
    }
}
