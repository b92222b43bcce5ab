package org.planet.core.climate;

public record Classification(ClimateType climate, HumidityType humidity, EcologyType ecology, BiomeType biome) {

    public static final Classification NONE =
            new Classification(ClimateType.NONE, HumidityType.NONE, EcologyType.NONE, BiomeType.NONE);
}
