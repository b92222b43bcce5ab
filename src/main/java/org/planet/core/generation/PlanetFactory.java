package org.planet.core.generation;

import org.planet.core.model.Atmosphere;
import org.planet.core.model.Orbit;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;
import org.planet.core.model.config.PlanetParams;

import java.util.Random;

/**
 * Random planets from a single seed. The same (kind, seed) pair always produces the
 * same planet, including its five noise seeds.
 */
public class PlanetFactory {

    public static final double AU = 1.495_978_707e11;
    public static final double SOLAR_LUMINOSITY = 3.828e26;
    public static final int NOISE_SEEDS = 5;

    private final Random random;
    private final long seed;

    public PlanetFactory(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public static Planet generate(PlanetKind kind, long seed) {
        return new PlanetFactory(seed).generate(kind);
    }

    /**
     * Основной вход
     */
    public Planet generate(PlanetKind kind) {
        PlanetParams p = new PlanetParams()
                .id(kind.name().toLowerCase() + "-" + Long.toHexString(seed))
                .kind(kind);

        p.radius(between(kind.radiusMin, kind.radiusMax));
        p.massFromDensity(between(kind.densityMin, kind.densityMax));
        p.albedo(albedo(kind));
        p.rotationalPeriod(rotationalPeriod(kind));
        // наклон оси: в основном небольшой, изредка "лежачий"
        p.angleOfRotation(Math.min(Math.PI, Math.abs(random.nextGaussian()) * 0.35));
        p.axialPrecession(random.nextDouble() * Math.PI * 2);
        p.orbit(orbit(kind));
        p.starLuminosity(SOLAR_LUMINOSITY);
        p.stellarDistance(p.orbit.averageDistance());

        double g = Planet.GRAVITATIONAL_CONSTANT * p.mass / (p.radius * p.radius);
        p.atmosphere(kind.typicallyHasAtmosphere ? atmosphere(kind, p.radius, g) : null);

        double hydrosphere = hydrosphere(kind);
        p.hydrosphereProportion(hydrosphere);
        p.normalizedSeaLevel((hydrosphere - 0.5) * 0.2);
        p.maxElevationFactor(maxElevationFactor());

        int[] seeds = new int[NOISE_SEEDS];
        for (int i = 0; i < seeds.length; i++) seeds[i] = random.nextInt();
        p.seeds(seeds);

        return p.build();
    }

    /** Average of five uniform samples in [0.5, 1.5]: mostly near 1, rarely at the ends. */
    double maxElevationFactor() {
        double sum = 0;
        for (int i = 0; i < 5; i++) sum += 0.5 + random.nextDouble();
        return sum / 5;
    }

    private double albedo(PlanetKind kind) {
        return switch (kind) {
            case ROCKY -> between(0.10, 0.45);
            case ICY -> between(0.50, 0.85);
            case GAS_GIANT -> between(0.30, 0.55);
            case COMET -> between(0.02, 0.10);
        };
    }

    private double rotationalPeriod(PlanetKind kind) {
        return switch (kind) {
            case ROCKY -> between(28_800, 360_000);
            case ICY -> between(36_000, 720_000);
            case GAS_GIANT -> between(25_000, 60_000);
            case COMET -> between(3_600, 200_000);
        };
    }

    private Orbit orbit(PlanetKind kind) {
        double inclination = random.nextGaussian() * 0.03;
        return switch (kind) {
            case ROCKY -> new Orbit(between(0.6, 1.8) * AU, between(0, 0.1), inclination);
            case ICY -> new Orbit(between(2.5, 12) * AU, between(0, 0.15), inclination);
            case GAS_GIANT -> new Orbit(between(3, 30) * AU, between(0, 0.1), inclination);
            case COMET -> new Orbit(between(5, 50) * AU, between(0.5, 0.95), random.nextGaussian() * 0.5);
        };
    }

    private Atmosphere atmosphere(PlanetKind kind, double radius, double gravity) {
        double earthArea = 4 * Math.PI * 6.371e6 * 6.371e6;
        double area = 4 * Math.PI * radius * radius;
        // масса атмосферы относительно земной, на единицу площади
        double column = switch (kind) {
            case GAS_GIANT -> between(1e3, 1e4);
            case ICY -> between(0.01, 1.5);
            default -> between(0.05, 3.0);
        };
        double mass = Atmosphere.earthLike().mass() * area / earthArea * column;
        double scaleHeight = 8_500 * 9.807 / Math.max(0.1, gravity);
        double greenhouse = 1 + between(0.0, 0.6) * Math.min(1.0, column);
        double averagePrecip = kind == PlanetKind.ICY ? between(50, 400) : between(200, 2_000);
        return new Atmosphere(
                mass,
                scaleHeight,
                greenhouse,
                averagePrecip,
                averagePrecip * between(2, 4),
                Atmosphere.DEFAULT_SNOW_TO_RAIN_RATIO,
                kind == PlanetKind.ICY ? 0.0 : between(0.0, 0.01),
                scaleHeight * 12
        );
    }

    private double hydrosphere(PlanetKind kind) {
        return switch (kind) {
            case ROCKY -> random.nextDouble() < 0.2 ? 0.0 : between(0.1, 0.95);
            case ICY -> between(0.6, 1.0);
            case GAS_GIANT, COMET -> 0.0;
        };
    }

    private double between(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
