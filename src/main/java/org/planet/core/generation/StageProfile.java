package org.planet.core.generation;

import java.util.EnumSet;
import java.util.Set;

public class StageProfile {
    private final Set<StageId> enabled;

    private StageProfile(Set<StageId> enabled) {
        this.enabled = enabled;
        for (StageId id : enabled) {
            for (StageId dep : id.requires()) {
                if (!enabled.contains(dep)) {
                    throw new IllegalArgumentException("Stage " + id + " requires " + dep + " in the same profile");
                }
            }
        }
    }

    public boolean isEnabled(StageId id) {
        return enabled.contains(id);
    }

    public Set<StageId> enabled() {
        return EnumSet.copyOf(enabled);
    }

    public static StageProfile of(StageId first, StageId... rest) {
        return new StageProfile(EnumSet.of(first, rest));
    }

    // всё, включая ресурсы
    public static StageProfile full() {
        return new StageProfile(EnumSet.allOf(StageId.class));
    }

    // климат без ресурсных слоёв
    public static StageProfile climateOnly() {
        return new StageProfile(EnumSet.complementOf(EnumSet.of(StageId.RESOURCES)));
    }

    // только рельеф
    public static StageProfile terrainOnly() {
        return new StageProfile(EnumSet.of(StageId.ELEVATION));
    }

    public static StageProfile withResources() {
        return new StageProfile(EnumSet.of(StageId.ELEVATION, StageId.RESOURCES));
    }

    @Override
    public String toString() {
        return enabled.toString();
    }
}
