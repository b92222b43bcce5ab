package org.planet.app;

import org.planet.core.generation.GenerationPipeline;
import org.planet.core.io.MapImageEncoder;
import org.planet.core.io.RasterSink;
import org.planet.core.mapping.ProjectionType;
import org.planet.core.mapping.SurfaceMaps;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;
import org.planet.core.model.config.GeneratorSettings;
import org.planet.core.service.PlanetGenerationService;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Пакетный запуск: одна планета -> JSON планеты, JSON карт и (опционально) PNG слоёв.
 * Аргументы вида key=value, иначе системные свойства с теми же ключами.
 */
public class BatchMain {

    public static void main(String[] args) throws IOException {
        Map<String, String> opts = parseArgs(args);

        long seed = Long.parseLong(option(opts, "planet.seed", "1"));
        PlanetKind kind = PlanetKind.parse(option(opts, "planet.kind", "ROCKY"));
        int resolution = Integer.parseInt(option(opts, "planet.resolution", "90"));
        int seasons = Integer.parseInt(option(opts, "planet.seasons", "4"));
        ProjectionType projection = ProjectionType.parse(option(opts, "planet.projection", "EQUIRECTANGULAR"));
        Path outDir = Paths.get(option(opts, "planet.out", "out"));
        boolean png = Boolean.parseBoolean(option(opts, "planet.png", "true"));

        PlanetGenerationService service = new PlanetGenerationService(new GenerationPipeline());
        Planet planet = service.generatePlanet(kind, seed);
        System.out.println("[BATCH] planet=" + planet.id() + " kind=" + kind + " seed=" + seed);

        if (!planet.hasAtmosphere() && seasons > 0) {
            System.out.println("[WARN] " + planet.id() + " has no atmosphere, seasons forced to 0");
            seasons = 0;
        }

        GeneratorSettings settings = new GeneratorSettings(resolution, seasons).projection(projection);
        long start = System.currentTimeMillis();
        SurfaceMaps maps = service.generateSurfaceMaps(planet, settings);

        Path planetFile = outDir.resolve(planet.id() + ".planet.json");
        Path mapsFile = outDir.resolve(planet.id() + ".maps.json");
        service.savePlanet(planet, planetFile);
        service.saveMaps(maps, mapsFile);
        System.out.println("[BATCH] saved " + planetFile + " and " + mapsFile);

        if (png) {
            new MapImageEncoder().encodeAll(maps, pngSink(outDir, planet.id()));
        }
        System.out.println("[BATCH] done in " + (System.currentTimeMillis() - start) + " ms");
    }

    static RasterSink pngSink(Path outDir, String prefix) {
        return (layer, width, height, argb) -> {
            BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
            img.setRGB(0, 0, width, height, argb, 0, width);
            Files.createDirectories(outDir);
            Path file = outDir.resolve(prefix + "." + layer + ".png");
            if (!ImageIO.write(img, "png", file.toFile())) {
                throw new IOException("No PNG writer available for " + file);
            }
            System.out.println("[BATCH] wrote " + file);
        };
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String token : args) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value argument: " + token);
            }
            out.put(token.substring(0, eq).trim(), token.substring(eq + 1));
        }
        return out;
    }

    static String option(Map<String, String> opts, String key, String fallback) {
        return pick(opts.get(key), pick(System.getProperty(key), fallback));
    }

    private static String pick(String candidate, String fallback) {
        if (candidate == null) return fallback;
        String trimmed = candidate.trim();
        return trimmed.isEmpty() ? fallback : trimmed;
    }
}
