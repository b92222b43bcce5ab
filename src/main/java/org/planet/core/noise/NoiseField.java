package org.planet.core.noise;

/**
 * Deterministic fractal noise over 3D points. Same seed and coordinates always give
 * the same value; the result stays finite and roughly within [-1, 1].
 *
 * Instances are immutable and thread-safe.
 */
public final class NoiseField {

    public static final double DEFAULT_FREQUENCY = 0.01;
    public static final double DEFAULT_LACUNARITY = 2.0;
    public static final double DEFAULT_GAIN = 0.5;

    private final int seed;
    private final double frequency;
    private final int octaves;
    private final double lacunarity;
    private final double gain;
    private final FractalType fractalType;
    private final double perturbAmplitude;

    private final SimplexNoise[] layers;
    private final SimplexNoise perturbNoise;
    private final double fractalBounding;

    private NoiseField(Builder b) {
        if (b.octaves < 1) {
            throw new IllegalArgumentException("octaves must be >= 1: " + b.octaves);
        }
        this.seed = b.seed;
        this.frequency = b.frequency;
        this.octaves = b.fractalType == FractalType.NONE ? 1 : b.octaves;
        this.lacunarity = b.lacunarity;
        this.gain = b.gain;
        this.fractalType = b.fractalType;
        this.perturbAmplitude = b.perturbAmplitude;

        this.layers = new SimplexNoise[this.octaves];
        for (int i = 0; i < this.octaves; i++) {
            layers[i] = new SimplexNoise(mix(seed, i));
        }
        this.perturbNoise = perturbAmplitude > 0 ? new SimplexNoise(mix(seed, 1_000)) : null;

        double amp = gain;
        double ampFractal = 1.0;
        for (int i = 1; i < this.octaves; i++) {
            ampFractal += amp;
            amp *= gain;
        }
        this.fractalBounding = 1.0 / ampFractal;
    }

    public static Builder builder(int seed) {
        return new Builder(seed);
    }

    /** Single-octave simplex at the default frequency. */
    public static NoiseField simplex(int seed) {
        return builder(seed).fractal(FractalType.NONE).build();
    }

    /** fBm simplex with the given octave count at the default frequency. */
    public static NoiseField fractal(int seed, int octaves) {
        return builder(seed).octaves(octaves).build();
    }

    private static long mix(long seed, int salt) {
        long h = seed * 0x9E3779B97F4A7C15L + salt * 0xC2B2AE3D27D4EB4FL;
        h ^= (h >>> 31);
        return h;
    }

    public double sample(double x, double y, double z) {
        x *= frequency;
        y *= frequency;
        z *= frequency;

        if (perturbNoise != null) {
            // gradient perturbation: warp the domain before sampling
            double px = perturbNoise.noise(x, y, z);
            double py = perturbNoise.noise(x + 31.7, y + 47.3, z + 11.9);
            double pz = perturbNoise.noise(x + 73.1, y + 13.7, z + 59.3);
            double a = perturbAmplitude * frequency;
            x += px * a;
            y += py * a;
            z += pz * a;
        }

        return switch (fractalType) {
            case NONE -> layers[0].noise(x, y, z);
            case FBM -> fbm(x, y, z);
            case BILLOW -> billow(x, y, z);
            case RIGID_MULTI -> rigidMulti(x, y, z);
        };
    }

    private double fbm(double x, double y, double z) {
        double sum = layers[0].noise(x, y, z);
        double amp = 1.0;
        for (int i = 1; i < octaves; i++) {
            x *= lacunarity;
            y *= lacunarity;
            z *= lacunarity;
            amp *= gain;
            sum += layers[i].noise(x, y, z) * amp;
        }
        return sum * fractalBounding;
    }

    private double billow(double x, double y, double z) {
        double sum = Math.abs(layers[0].noise(x, y, z)) * 2 - 1;
        double amp = 1.0;
        for (int i = 1; i < octaves; i++) {
            x *= lacunarity;
            y *= lacunarity;
            z *= lacunarity;
            amp *= gain;
            sum += (Math.abs(layers[i].noise(x, y, z)) * 2 - 1) * amp;
        }
        return sum * fractalBounding;
    }

    private double rigidMulti(double x, double y, double z) {
        double sum = 1 - Math.abs(layers[0].noise(x, y, z));
        double amp = 1.0;
        for (int i = 1; i < octaves; i++) {
            x *= lacunarity;
            y *= lacunarity;
            z *= lacunarity;
            amp *= gain;
            sum -= (1 - Math.abs(layers[i].noise(x, y, z))) * amp;
        }
        return sum;
    }

    public int seed() { return seed; }
    public double frequency() { return frequency; }
    public int octaves() { return octaves; }
    public FractalType fractalType() { return fractalType; }

    public static final class Builder {
        private final int seed;
        private double frequency = DEFAULT_FREQUENCY;
        private int octaves = 3;
        private double lacunarity = DEFAULT_LACUNARITY;
        private double gain = DEFAULT_GAIN;
        private FractalType fractalType = FractalType.FBM;
        private double perturbAmplitude;

        private Builder(int seed) {
            this.seed = seed;
        }

        public Builder frequency(double v) { this.frequency = v; return this; }
        public Builder octaves(int v) { this.octaves = v; return this; }
        public Builder lacunarity(double v) { this.lacunarity = v; return this; }
        public Builder gain(double v) { this.gain = v; return this; }
        public Builder fractal(FractalType v) { this.fractalType = v; return this; }
        public Builder perturb(double amplitude) { this.perturbAmplitude = amplitude; return this; }

        public NoiseField build() {
            return new NoiseField(this);
        }
    }
}
