package org.planet.core.climate;

/** Annual precipitation bands, driest first. */
public enum HumidityType {
    NONE,
    SUPERARID,
    PERARID,
    ARID,
    SEMIARID,
    SUBHUMID,
    HUMID,
    PERHUMID,
    SUPERHUMID;

    public boolean atMost(HumidityType other) {
        return compareTo(other) <= 0;
    }
}
