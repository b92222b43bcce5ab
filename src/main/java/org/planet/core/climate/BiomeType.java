package org.planet.core.climate;

public enum BiomeType {
    NONE,
    POLAR,
    TUNDRA,
    LICHEN_WOODLAND,
    CONIFEROUS_FOREST,
    MIXED_FOREST,
    STEPPE,
    COLD_DESERT,
    DECIDUOUS_FOREST,
    SHRUBLAND,
    HOT_DESERT,
    SAVANNA,
    MONSOON_FOREST,
    RAIN_FOREST,
    SEA,
    SEA_ICE
}
