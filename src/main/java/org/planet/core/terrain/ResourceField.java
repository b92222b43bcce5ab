package org.planet.core.terrain;

import org.planet.core.geometry.Vector3;
import org.planet.core.noise.FractalType;
import org.planet.core.noise.NoiseField;

/**
 * Richness of one surface resource. Deposits use billow noise, veins use ridged noise.
 * Richness is 0 where the resource is absent and grows towards 1 in rich areas.
 */
public final class ResourceField {

    private final String name;
    private final int seed;
    private final double proportion;
    private final boolean vein;
    private final boolean perturbed;
    private final NoiseField noise;

    public ResourceField(String name, int seed, double proportion, boolean vein, boolean perturbed) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name is required");
        }
        if (proportion < 0 || proportion > 1) {
            throw new IllegalArgumentException("Resource proportion must be in [0,1]: " + proportion);
        }
        this.name = name;
        this.seed = seed;
        this.proportion = proportion;
        this.vein = vein;
        this.perturbed = perturbed;

        NoiseField.Builder b = NoiseField.builder(seed)
                .frequency(10)
                .gain(0.75)
                .lacunarity(3)
                .octaves(3)
                .fractal(vein ? FractalType.RIGID_MULTI : FractalType.BILLOW);
        if (perturbed) {
            b.perturb(20);
        }
        this.noise = b.build();
    }

    public double richnessAt(Vector3 position) {
        double v = noise.sample(position.x, position.y, position.z);
        if (vein) {
            v = 1 - v;
        }
        double p = proportion - 0.5;
        return Math.max(0.0, (v + p) / (1 + p));
    }

    public String name() { return name; }
    public int seed() { return seed; }
    public double proportion() { return proportion; }
    public boolean isVein() { return vein; }
    public boolean isPerturbed() { return perturbed; }
}
