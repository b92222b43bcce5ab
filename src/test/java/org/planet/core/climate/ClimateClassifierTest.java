package org.planet.core.climate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClimateClassifierTest {

    private static final double F = ClimateConstants.FREEZING_POINT;

    @Test
    void climateBands() {
        assertEquals(ClimateType.POLAR, ClimateClassifier.climateOf(F));
        assertEquals(ClimateType.SUBPOLAR, ClimateClassifier.climateOf(F + 2));
        assertEquals(ClimateType.BOREAL, ClimateClassifier.climateOf(F + 5));
        assertEquals(ClimateType.COOL_TEMPERATE, ClimateClassifier.climateOf(F + 10));
        assertEquals(ClimateType.WARM_TEMPERATE, ClimateClassifier.climateOf(F + 15));
        assertEquals(ClimateType.SUBTROPICAL, ClimateClassifier.climateOf(F + 20));
        assertEquals(ClimateType.TROPICAL, ClimateClassifier.climateOf(F + 30));
        assertEquals(ClimateType.SUPERTROPICAL, ClimateClassifier.climateOf(F + 100));
    }

    @Test
    void humidityBands() {
        assertEquals(HumidityType.SUPERARID, ClimateClassifier.humidityOf(0));
        assertEquals(HumidityType.PERARID, ClimateClassifier.humidityOf(125));
        assertEquals(HumidityType.ARID, ClimateClassifier.humidityOf(300));
        assertEquals(HumidityType.SEMIARID, ClimateClassifier.humidityOf(999));
        assertEquals(HumidityType.SUBHUMID, ClimateClassifier.humidityOf(1500));
        assertEquals(HumidityType.HUMID, ClimateClassifier.humidityOf(3000));
        assertEquals(HumidityType.PERHUMID, ClimateClassifier.humidityOf(4000));
        assertEquals(HumidityType.SUPERHUMID, ClimateClassifier.humidityOf(9000));
    }

    @Test
    void oceanCellsAreSeaOrSeaIce() {
        Classification warm = ClimateClassifier.classify(290, 1000, -10, true);
        assertEquals(BiomeType.SEA, warm.biome());
        assertEquals(EcologyType.SEA, warm.ecology());
        Classification frozen = ClimateClassifier.classify(260, 100, -10, true);
        assertEquals(BiomeType.SEA_ICE, frozen.biome());
        assertEquals(EcologyType.SEA_ICE, frozen.ecology());
    }

    @Test
    void belowDatumWithoutHydrosphereIsLand() {
        Classification c = ClimateClassifier.classify(F + 30, 3000, -50, false);
        assertEquals(BiomeType.RAIN_FOREST, c.biome());
        assertEquals(EcologyType.MOIST_FOREST, c.ecology());
    }

    @Test
    void landBiomes() {
        assertEquals(BiomeType.HOT_DESERT, ClimateClassifier.classify(F + 20, 100, 10, true).biome());
        assertEquals(BiomeType.SAVANNA, ClimateClassifier.classify(F + 20, 300, 10, true).biome());
        assertEquals(BiomeType.CONIFEROUS_FOREST, ClimateClassifier.classify(F + 5, 800, 10, true).biome());
        assertEquals(BiomeType.LICHEN_WOODLAND, ClimateClassifier.classify(F + 5, 200, 10, true).biome());
        assertEquals(BiomeType.STEPPE, ClimateClassifier.classify(F + 10, 300, 10, true).biome());
        assertEquals(BiomeType.POLAR, ClimateClassifier.classify(F - 20, 300, 10, true).biome());
        assertEquals(EcologyType.DESERT, ClimateClassifier.classify(F - 20, 100, 10, true).ecology());
        assertEquals(EcologyType.ICE, ClimateClassifier.classify(F - 20, 300, 10, true).ecology());
    }
}
