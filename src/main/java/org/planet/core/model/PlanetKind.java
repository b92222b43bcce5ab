package org.planet.core.model;

/**
 * Closed set of body kinds. Each carries only what actually differs between them;
 * generation code reads these values instead of overriding behaviour per kind.
 */
public enum PlanetKind {

    //          densityMin densityMax radiusMin  radiusMax  maxSat ringChance core  mantle crust flat   atmosphere
    ROCKY(      3750,      5500,      2.0e6,     1.2e7,     5,     0.10,      0.15, 0.80,  0.05, false, true),
    ICY(        1000,      2500,      1.0e6,     6.0e6,     5,     0.05,      0.20, 0.65,  0.15, false, true),
    GAS_GIANT(  600,       1600,      2.4e7,     7.5e7,     20,    0.90,      0.10, 0.80,  0.10, true,  true),
    COMET(      300,       700,       1.0e3,     2.0e4,     0,     0.00,      0.00, 0.20,  0.80, true,  false);

    /** kg/m^3 */
    public final double densityMin;
    public final double densityMax;
    /** meters */
    public final double radiusMin;
    public final double radiusMax;
    public final int maxSatellites;
    public final double ringChance;
    public final double coreProportion;
    public final double mantleProportion;
    public final double crustProportion;
    /** No solid relief: max elevation is always 0. */
    public final boolean flatSurface;
    public final boolean typicallyHasAtmosphere;

    PlanetKind(double densityMin, double densityMax,
               double radiusMin, double radiusMax,
               int maxSatellites, double ringChance,
               double coreProportion, double mantleProportion, double crustProportion,
               boolean flatSurface, boolean typicallyHasAtmosphere) {
        this.densityMin = densityMin;
        this.densityMax = densityMax;
        this.radiusMin = radiusMin;
        this.radiusMax = radiusMax;
        this.maxSatellites = maxSatellites;
        this.ringChance = ringChance;
        this.coreProportion = coreProportion;
        this.mantleProportion = mantleProportion;
        this.crustProportion = crustProportion;
        this.flatSurface = flatSurface;
        this.typicallyHasAtmosphere = typicallyHasAtmosphere;
    }

    public static PlanetKind parse(String s) {
        if (s == null || s.isBlank()) return ROCKY;
        return PlanetKind.valueOf(s.trim().toUpperCase().replace('-', '_'));
    }
}
