package org.planet.core.model.config;

import org.planet.core.generation.PlanetTuning;
import org.planet.core.mapping.MapProjection;
import org.planet.core.mapping.MapRegion;
import org.planet.core.mapping.ProjectionType;
import org.planet.core.model.Planet;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one surface-map run.
 */
public class GeneratorSettings {

    public static final int MAX_SEASONS = 366;

    /** Map height in cells; width is twice this. */
    public int resolution = 90;

    public ProjectionType projection = ProjectionType.EQUIRECTANGULAR;
    public MapRegion region = MapRegion.FULL;

    // 0 = no precipitation pass
    public int seasons = 4;

    // per-row parallelism of the grid passes
    public boolean parallel = true;

    // post-stage invariant checks
    public boolean validation = true;

    public final List<ResourceLayer> resources = new ArrayList<>();

    public GeneratorSettings() {
        this.parallel = PlanetTuning.bprop("planet.maps.parallel", true);
    }

    public GeneratorSettings(int resolution, int seasons) {
        this();
        this.resolution = resolution;
        this.seasons = seasons;
    }

    public GeneratorSettings resolution(int v) { this.resolution = v; return this; }
    public GeneratorSettings projection(ProjectionType v) { this.projection = v; return this; }
    public GeneratorSettings region(MapRegion v) { this.region = v; return this; }
    public GeneratorSettings seasons(int v) { this.seasons = v; return this; }
    public GeneratorSettings parallel(boolean v) { this.parallel = v; return this; }
    public GeneratorSettings validation(boolean v) { this.validation = v; return this; }
    public GeneratorSettings resource(ResourceLayer v) { this.resources.add(v); return this; }

    /** Builds the projection; rejects a bad resolution or an odd equal-area height. */
    public MapProjection toProjection() {
        return new MapProjection(projection, region, resolution);
    }

    /**
     * Rejects settings that cannot produce a map for this planet. Runs before any
     * grid is allocated.
     */
    public void validate(Planet planet, boolean precipitationRequested) {
        if (resolution <= 0) {
            throw new IllegalArgumentException("Resolution must be positive: " + resolution);
        }
        if (seasons < 0 || seasons > MAX_SEASONS) {
            throw new IllegalArgumentException("Season count must be in [0," + MAX_SEASONS + "]: " + seasons);
        }
        if (precipitationRequested && seasons > 0 && !planet.hasAtmosphere()) {
            throw new IllegalArgumentException("Precipitation for " + seasons + " seasons requested but planet "
                    + planet.id() + " has no atmosphere");
        }
        toProjection();
    }

    /** Layers rasterized when none are configured. */
    public static List<ResourceLayer> defaultResources() {
        return List.of(
                new ResourceLayer("iron", 0.40, false, false),
                new ResourceLayer("coal", 0.30, false, true),
                new ResourceLayer("copper", 0.20, true, true),
                new ResourceLayer("gold", 0.05, true, true),
                new ResourceLayer("uranium", 0.02, true, false)
        );
    }

    @Override
    public String toString() {
        return "resolution=" + resolution + ", projection=" + projection + ", seasons=" + seasons;
    }
}
