package org.planet.core.model.config;

import org.planet.core.model.Atmosphere;
import org.planet.core.model.Orbit;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;

import java.util.Arrays;

/**
 * Mutable planet description. Fill the fields (directly or through the fluent setters),
 * then call {@link #build()} to get an immutable {@link Planet}.
 */
public class PlanetParams {

    public String id;
    public PlanetKind kind = PlanetKind.ROCKY;

    // --- Физика ---
    public double radius = 6.371e6;        // m
    public double mass = 5.972e24;         // kg
    public double albedo = 0.3;

    // --- Вращение ---
    public double rotationalPeriod = 86_400; // s
    public double angleOfRotation = Math.toRadians(23.44);
    public double axialPrecession;

    // --- Орбита и звезда ---
    public Orbit orbit = new Orbit(1.496e11, 0.0167, 0.0);
    public double starLuminosity = 3.828e26;  // W
    /** Distance to the star when there is no orbit, m. */
    public double stellarDistance = 1.496e11;

    // --- Атмосфера ---
    public Atmosphere atmosphere = Atmosphere.earthLike();

    // --- Поверхность ---
    public boolean flatSurface;
    /** Multiplier on the gravity-derived max elevation (1 = none). */
    public double maxElevationFactor = 1.0;
    public double normalizedSeaLevel;
    /** Fraction of the surface the hydrosphere would cover; 0 = no hydrosphere. */
    public double hydrosphereProportion = 0.7;

    /** Three to five noise seeds, fixed for the life of the planet. */
    public int[] seeds = {1, 2, 3, 4, 5};

    public PlanetParams id(String v) { this.id = v; return this; }
    public PlanetParams kind(PlanetKind v) { this.kind = v; return this; }
    public PlanetParams radius(double v) { this.radius = v; return this; }
    public PlanetParams mass(double v) { this.mass = v; return this; }
    public PlanetParams albedo(double v) { this.albedo = v; return this; }
    public PlanetParams rotationalPeriod(double v) { this.rotationalPeriod = v; return this; }
    public PlanetParams angleOfRotation(double v) { this.angleOfRotation = v; return this; }
    public PlanetParams axialPrecession(double v) { this.axialPrecession = v; return this; }
    public PlanetParams orbit(Orbit v) { this.orbit = v; return this; }
    public PlanetParams starLuminosity(double v) { this.starLuminosity = v; return this; }
    public PlanetParams stellarDistance(double v) { this.stellarDistance = v; return this; }
    public PlanetParams atmosphere(Atmosphere v) { this.atmosphere = v; return this; }
    public PlanetParams flatSurface(boolean v) { this.flatSurface = v; return this; }
    public PlanetParams maxElevationFactor(double v) { this.maxElevationFactor = v; return this; }
    public PlanetParams normalizedSeaLevel(double v) { this.normalizedSeaLevel = v; return this; }
    public PlanetParams hydrosphereProportion(double v) { this.hydrosphereProportion = v; return this; }
    public PlanetParams seeds(int... v) { this.seeds = v; return this; }

    /**
     * Sets the sea level in meters; the normalized value is recomputed against the
     * max elevation these params would produce.
     */
    public PlanetParams seaLevel(double meters) {
        double maxElevation = Planet.computeMaxElevation(this);
        this.normalizedSeaLevel = maxElevation < Planet.ELEVATION_EPSILON ? 0.0 : meters / maxElevation;
        return this;
    }

    /** Density-based mass for the current radius. */
    public PlanetParams massFromDensity(double density) {
        this.mass = 4.0 / 3.0 * Math.PI * radius * radius * radius * density;
        return this;
    }

    public void validate() {
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new IllegalArgumentException("radius must be > 0: " + radius);
        }
        if (!(mass > 0) || Double.isInfinite(mass)) {
            throw new IllegalArgumentException("mass must be > 0: " + mass);
        }
        if (albedo < 0 || albedo > 1) {
            throw new IllegalArgumentException("albedo must be in [0,1]: " + albedo);
        }
        if (!(rotationalPeriod > 0)) {
            throw new IllegalArgumentException("rotationalPeriod must be > 0: " + rotationalPeriod);
        }
        if (!(starLuminosity >= 0)) {
            throw new IllegalArgumentException("starLuminosity must be >= 0: " + starLuminosity);
        }
        if (orbit == null && !(stellarDistance > 0)) {
            throw new IllegalArgumentException("stellarDistance must be > 0 when there is no orbit: " + stellarDistance);
        }
        if (!(maxElevationFactor >= 0)) {
            throw new IllegalArgumentException("maxElevationFactor must be >= 0: " + maxElevationFactor);
        }
        if (normalizedSeaLevel < -1 || normalizedSeaLevel > 1) {
            throw new IllegalArgumentException("normalizedSeaLevel must be in [-1,1]: " + normalizedSeaLevel);
        }
        if (hydrosphereProportion < 0 || hydrosphereProportion > 1) {
            throw new IllegalArgumentException("hydrosphereProportion must be in [0,1]: " + hydrosphereProportion);
        }
        if (seeds == null || seeds.length < 3 || seeds.length > 5) {
            throw new IllegalArgumentException("Expected 3..5 noise seeds, got "
                    + (seeds == null ? "null" : Arrays.toString(seeds)));
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
    }

    public Planet build() {
        validate();
        return new Planet(this);
    }

    /** Copy of an existing planet's parameters, for tweaking and rebuilding. */
    public static PlanetParams from(Planet p) {
        PlanetParams c = new PlanetParams();
        c.id = p.id();
        c.kind = p.kind();
        c.radius = p.radius();
        c.mass = p.mass();
        c.albedo = p.albedo();
        c.rotationalPeriod = p.rotationalPeriod();
        c.angleOfRotation = p.angleOfRotation();
        c.axialPrecession = p.axialPrecession();
        c.orbit = p.orbit();
        c.starLuminosity = p.starLuminosity();
        c.stellarDistance = p.stellarDistance();
        c.atmosphere = p.atmosphere();
        c.flatSurface = p.hasFlatSurface();
        c.maxElevationFactor = p.maxElevationFactor();
        c.normalizedSeaLevel = p.normalizedSeaLevel();
        c.hydrosphereProportion = p.hydrosphereProportion();
        c.seeds = p.seeds();
        return c;
    }
}
