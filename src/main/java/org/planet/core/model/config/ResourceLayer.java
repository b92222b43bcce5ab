package org.planet.core.model.config;

/**
 * One resource richness layer to rasterize.
 *
 * @param proportion share of the surface where the resource is present, [0,1]
 * @param vein       narrow rigid veins instead of broad deposits
 * @param perturbed  domain-warped noise for irregular edges
 */
public record ResourceLayer(String name, double proportion, boolean vein, boolean perturbed) {

    public ResourceLayer {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name is required");
        }
        if (proportion < 0 || proportion > 1) {
            throw new IllegalArgumentException("Resource proportion must be in [0,1]: " + name + "=" + proportion);
        }
    }

    /** Seed for this layer: derived from the planet's first seed and the layer name. */
    public int seedFor(int planetSeed) {
        return planetSeed * 31 + name.hashCode();
    }
}
