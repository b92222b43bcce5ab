package org.planet.core.climate;

/** Temperature zones, coldest first. */
public enum ClimateType {
    NONE,
    POLAR,
    SUBPOLAR,
    BOREAL,
    COOL_TEMPERATE,
    WARM_TEMPERATE,
    SUBTROPICAL,
    TROPICAL,
    SUPERTROPICAL
}
