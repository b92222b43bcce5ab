package org.planet.core.generation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Grid passes in execution order.
 */
public enum StageId {
    ELEVATION,
    TEMPERATURE,
    PRECIPITATION,
    SNOWFALL,
    AGGREGATE,
    HYDROLOGY,
    CLASSIFICATION,
    COVER,
    RESOURCES;

    /** Stages whose output this one reads. */
    public Set<StageId> requires() {
        return switch (this) {
            case ELEVATION, RESOURCES -> EnumSet.noneOf(StageId.class);
            case TEMPERATURE -> EnumSet.of(ELEVATION);
            case PRECIPITATION -> EnumSet.of(ELEVATION, TEMPERATURE);
            case SNOWFALL -> EnumSet.of(TEMPERATURE, PRECIPITATION);
            case AGGREGATE -> EnumSet.of(ELEVATION, TEMPERATURE, PRECIPITATION);
            case HYDROLOGY -> EnumSet.of(ELEVATION, AGGREGATE);
            case CLASSIFICATION -> EnumSet.of(ELEVATION, TEMPERATURE, AGGREGATE);
            case COVER -> EnumSet.of(ELEVATION, TEMPERATURE, CLASSIFICATION);
        };
    }
}
