package org.planet.core.noise;

public enum FractalType {
    /** Plain single-octave simplex. */
    NONE,
    /** Fractional Brownian motion: signed octaves summed. */
    FBM,
    /** Absolute-valued octaves, puffy look. */
    BILLOW,
    /** Inverted absolute octaves, sharp ridges (veins, mountain chains). */
    RIGID_MULTI
}
