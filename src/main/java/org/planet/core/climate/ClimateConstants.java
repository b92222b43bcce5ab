package org.planet.core.climate;

public final class ClimateConstants {

    private ClimateConstants() {}

    /** Fresh water melting point, K. */
    public static final double FREEZING_POINT = 273.15;
    /** Salt water melting point, K. */
    public static final double SALT_WATER_MELTING_POINT = 271.2;
    /** Below this humidity is cut off entirely, K. */
    public static final double LOW_TEMPERATURE = FREEZING_POINT - 16;

    /** Stefan-Boltzmann constant, W m^-2 K^-4. */
    public static final double STEFAN_BOLTZMANN = 5.670_374_419e-8;
    /** Specific heat of dry air, J kg^-1 K^-1. */
    public static final double CP_DRY_AIR = 1004.6;
    /** Specific gas constant of dry air, J kg^-1 K^-1. */
    public static final double R_SPECIFIC_DRY_AIR = 287.058;
    /** Specific gas constant of water vapor, J kg^-1 K^-1. */
    public static final double R_SPECIFIC_WATER = 461.52;
    /** Heat of vaporization of water, J kg^-1. */
    public static final double DELTA_HVAP_WATER = 2.501e6;
}
