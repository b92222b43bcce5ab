package org.planet.core.climate;

/**
 * Threshold tables from (average temperature, annual precipitation, elevation) to
 * climate, humidity, ecology and biome. Pure functions, no state.
 */
public final class ClimateClassifier {

    private ClimateClassifier() {}

    public static ClimateType climateOf(double averageTemperature) {
        double t = averageTemperature - ClimateConstants.FREEZING_POINT;
        if (t <= 1.5) return ClimateType.POLAR;
        if (t <= 3) return ClimateType.SUBPOLAR;
        if (t <= 6) return ClimateType.BOREAL;
        if (t <= 12) return ClimateType.COOL_TEMPERATE;
        if (t <= 18) return ClimateType.WARM_TEMPERATE;
        if (t <= 24) return ClimateType.SUBTROPICAL;
        if (t <= 68) return ClimateType.TROPICAL;
        return ClimateType.SUPERTROPICAL;
    }

    /** @param annualPrecipitation mm per year */
    public static HumidityType humidityOf(double annualPrecipitation) {
        if (annualPrecipitation < 125) return HumidityType.SUPERARID;
        if (annualPrecipitation < 250) return HumidityType.PERARID;
        if (annualPrecipitation < 500) return HumidityType.ARID;
        if (annualPrecipitation < 1000) return HumidityType.SEMIARID;
        if (annualPrecipitation < 2000) return HumidityType.SUBHUMID;
        if (annualPrecipitation < 4000) return HumidityType.HUMID;
        if (annualPrecipitation < 8000) return HumidityType.PERHUMID;
        return HumidityType.SUPERHUMID;
    }

    /** Land ecology. Elevation <= 0 yields {@link EcologyType#SEA}. */
    public static EcologyType ecologyOf(ClimateType climate, HumidityType humidity, double elevation) {
        if (elevation <= 0) {
            return EcologyType.SEA;
        }
        return switch (climate) {
            case POLAR -> humidity.atMost(HumidityType.PERARID) ? EcologyType.DESERT : EcologyType.ICE;
            case SUBPOLAR -> switch (humidity) {
                case NONE, SUPERARID -> EcologyType.DRY_TUNDRA;
                case PERARID -> EcologyType.MOIST_TUNDRA;
                case ARID -> EcologyType.WET_TUNDRA;
                default -> EcologyType.RAIN_TUNDRA;
            };
            case BOREAL -> switch (humidity) {
                case NONE, SUPERARID -> EcologyType.DESERT;
                case PERARID -> EcologyType.DRY_SCRUB;
                case ARID -> EcologyType.MOIST_FOREST;
                case SEMIARID -> EcologyType.WET_FOREST;
                default -> EcologyType.RAIN_FOREST;
            };
            case COOL_TEMPERATE -> switch (humidity) {
                case NONE, SUPERARID -> EcologyType.DESERT;
                case PERARID -> EcologyType.DESERT_SCRUB;
                case ARID -> EcologyType.STEPPE;
                case SEMIARID -> EcologyType.MOIST_FOREST;
                case SUBHUMID -> EcologyType.WET_FOREST;
                default -> EcologyType.RAIN_FOREST;
            };
            case WARM_TEMPERATE -> switch (humidity) {
                case NONE, SUPERARID -> EcologyType.DESERT;
                case PERARID -> EcologyType.DESERT_SCRUB;
                case ARID -> EcologyType.THORN_SCRUB;
                case SEMIARID -> EcologyType.DRY_FOREST;
                case SUBHUMID -> EcologyType.MOIST_FOREST;
                case HUMID -> EcologyType.WET_FOREST;
                default -> EcologyType.RAIN_FOREST;
            };
            case SUBTROPICAL -> switch (humidity) {
                case NONE, SUPERARID -> EcologyType.DESERT;
                case PERARID -> EcologyType.DESERT_SCRUB;
                case ARID -> EcologyType.THORN_WOODLAND;
                case SEMIARID -> EcologyType.DRY_FOREST;
                case SUBHUMID -> EcologyType.MOIST_FOREST;
                case HUMID -> EcologyType.WET_FOREST;
                default -> EcologyType.RAIN_FOREST;
            };
            case TROPICAL -> switch (humidity) {
                case NONE, SUPERARID -> EcologyType.DESERT;
                case PERARID -> EcologyType.DESERT_SCRUB;
                case ARID -> EcologyType.THORN_WOODLAND;
                case SEMIARID -> EcologyType.VERY_DRY_FOREST;
                case SUBHUMID -> EcologyType.DRY_FOREST;
                case HUMID -> EcologyType.MOIST_FOREST;
                case PERHUMID -> EcologyType.WET_FOREST;
                default -> EcologyType.RAIN_FOREST;
            };
            default -> EcologyType.DESERT;
        };
    }

    /** Land biome. Elevation <= 0 yields {@link BiomeType#SEA}. */
    public static BiomeType biomeOf(ClimateType climate, HumidityType humidity, double elevation) {
        if (elevation <= 0) {
            return BiomeType.SEA;
        }
        return switch (climate) {
            case POLAR -> BiomeType.POLAR;
            case SUBPOLAR -> BiomeType.TUNDRA;
            case BOREAL -> humidity.atMost(HumidityType.PERARID)
                    ? BiomeType.LICHEN_WOODLAND
                    : BiomeType.CONIFEROUS_FOREST;
            case COOL_TEMPERATE -> {
                if (humidity.atMost(HumidityType.PERARID)) yield BiomeType.COLD_DESERT;
                if (humidity == HumidityType.ARID) yield BiomeType.STEPPE;
                yield BiomeType.MIXED_FOREST;
            }
            case WARM_TEMPERATE -> {
                if (humidity.atMost(HumidityType.PERARID)) yield BiomeType.HOT_DESERT;
                if (humidity.atMost(HumidityType.SEMIARID)) yield BiomeType.SHRUBLAND;
                yield BiomeType.DECIDUOUS_FOREST;
            }
            case SUBTROPICAL -> {
                if (humidity.atMost(HumidityType.PERARID)) yield BiomeType.HOT_DESERT;
                if (humidity == HumidityType.ARID) yield BiomeType.SAVANNA;
                if (humidity.atMost(HumidityType.SUBHUMID)) yield BiomeType.MONSOON_FOREST;
                yield BiomeType.RAIN_FOREST;
            }
            case TROPICAL -> {
                if (humidity.atMost(HumidityType.PERARID)) yield BiomeType.HOT_DESERT;
                if (humidity.atMost(HumidityType.SEMIARID)) yield BiomeType.SAVANNA;
                if (humidity == HumidityType.SUBHUMID) yield BiomeType.MONSOON_FOREST;
                yield BiomeType.RAIN_FOREST;
            }
            default -> BiomeType.HOT_DESERT;
        };
    }

    /**
     * Full classification of one cell.
     *
     * @param averageTemperature  K
     * @param annualPrecipitation mm per year
     * @param elevation           m relative to sea level
     * @param hasHydrosphere      without a hydrosphere every cell is treated as land
     */
    public static Classification classify(double averageTemperature,
                                          double annualPrecipitation,
                                          double elevation,
                                          boolean hasHydrosphere) {
        ClimateType climate = climateOf(averageTemperature);
        HumidityType humidity = humidityOf(annualPrecipitation);

        if (hasHydrosphere && elevation <= 0) {
            boolean frozen = averageTemperature <= ClimateConstants.SALT_WATER_MELTING_POINT;
            return new Classification(climate, humidity,
                    frozen ? EcologyType.SEA_ICE : EcologyType.SEA,
                    frozen ? BiomeType.SEA_ICE : BiomeType.SEA);
        }

        // dry basins below datum still count as land
        double landElevation = Math.max(elevation, Double.MIN_VALUE);
        return new Classification(climate, humidity,
                ecologyOf(climate, humidity, landElevation),
                biomeOf(climate, humidity, landElevation));
    }

    public static Classification classify(TemperatureRange range, double annualPrecipitation,
                                          double elevation, boolean hasHydrosphere) {
        return classify(range.average(), annualPrecipitation, elevation, hasHydrosphere);
    }
}
