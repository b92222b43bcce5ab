package org.planet.core.climate;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * Memoized Hadley-cell humidity curve, keyed by rounded absolute latitude.
 * The curve has no planet-specific inputs, so one cache can serve any number of
 * planets and threads; a racing miss just computes the same value twice.
 */
public class HadleyCache {

    public static final long DEFAULT_MAX_SIZE = 4_096;

    /** Latitudes within this of the equator share the equatorial value. */
    public static final double EQUATORIAL_OFFSET = Math.PI / 36;

    private final Cache<Double, Double> cache;

    public HadleyCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public HadleyCache(long maxSize) {
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxSize)
                .build();
    }

    /** Rounded |latitude| minus the equatorial offset, never negative. */
    public static double roundedAbsLatitude(double seasonalLatitude) {
        double v = Math.max(0.0, Math.abs(seasonalLatitude) - EQUATORIAL_OFFSET);
        return Math.round(v * 1000.0) / 1000.0;
    }

    /**
     * Wet near the equator, dry around 15-30 degrees, wet again in the temperate band,
     * dry towards the poles.
     */
    public static double hadleyValue(double roundedAbsLatitude) {
        double l = roundedAbsLatitude;
        return Math.cos(1.25 * Math.PI * l + Math.PI)
                + Math.max(0.0, 1 / (1.5 * (l + 0.05)) - 2.5);
    }

    public double valueAt(double roundedAbsLatitude) {
        return cache.asMap().computeIfAbsent(roundedAbsLatitude, HadleyCache::hadleyValue);
    }

    public long size() {
        return cache.size();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
