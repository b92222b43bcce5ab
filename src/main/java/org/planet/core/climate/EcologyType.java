package org.planet.core.climate;

public enum EcologyType {
    NONE,
    DESERT,
    ICE,
    DRY_TUNDRA,
    MOIST_TUNDRA,
    WET_TUNDRA,
    RAIN_TUNDRA,
    DESERT_SCRUB,
    DRY_SCRUB,
    STEPPE,
    THORN_SCRUB,
    THORN_WOODLAND,
    VERY_DRY_FOREST,
    DRY_FOREST,
    MOIST_FOREST,
    WET_FOREST,
    RAIN_FOREST,
    SEA,
    SEA_ICE
}
