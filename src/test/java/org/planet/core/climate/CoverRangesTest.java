package org.planet.core.climate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoverRangesTest {

    private static final double MELT = ClimateConstants.SALT_WATER_MELTING_POINT;

    @Test
    void neverFreezingAndAlwaysFrozen() {
        assertEquals(CoverRange.NONE, CoverRanges.seaIce(TemperatureRange.of(MELT + 1, MELT + 20), 0.5, -10, true));
        assertEquals(CoverRange.FULL_YEAR, CoverRanges.seaIce(TemperatureRange.of(MELT - 30, MELT - 1), 0.5, -10, true));
    }

    @Test
    void freezingHalfTheYearStaysCovered() {
        assertEquals(CoverRange.FULL_YEAR, CoverRanges.seaIce(TemperatureRange.of(MELT - 10, MELT + 10), 0.5, -10, true));
    }

    @Test
    void northernSeaIceWindow() {
        CoverRange r = CoverRanges.seaIce(TemperatureRange.of(MELT - 5, MELT + 25), 0.8, -10, true);
        assertEquals(1 - 1.0 / 12, r.start(), 1e-9);
        assertEquals(1.0 / 6, r.end(), 1e-9);
    }

    @Test
    void southernWindowIsShiftedHalfAYear() {
        CoverRange r = CoverRanges.seaIce(TemperatureRange.of(MELT - 5, MELT + 25), -0.8, -10, true);
        assertEquals(0.5 - 1.0 / 12, r.start(), 1e-9);
        assertEquals(0.5 + 1.0 / 6, r.end(), 1e-9);
    }

    @Test
    void snowMeltsEarlierThanIce() {
        CoverRange r = CoverRanges.snowCover(TemperatureRange.of(MELT - 5, MELT + 25), 0.8, 100, HumidityType.HUMID, true);
        assertEquals(1.0 / 8, r.end(), 1e-9);
    }

    @Test
    void noCoverWhereItCannotForm() {
        TemperatureRange cold = TemperatureRange.of(MELT - 30, MELT - 1);
        assertEquals(CoverRange.NONE, CoverRanges.seaIce(cold, 0.5, 100, true));
        assertEquals(CoverRange.NONE, CoverRanges.seaIce(cold, 0.5, -10, false));
        assertEquals(CoverRange.NONE, CoverRanges.snowCover(cold, 0.5, -10, HumidityType.HUMID, true));
        assertEquals(CoverRange.NONE, CoverRanges.snowCover(cold, 0.5, 100, HumidityType.PERARID, true));
        assertEquals(CoverRange.FULL_YEAR, CoverRanges.snowCover(cold, 0.5, -10, HumidityType.HUMID, false));
    }
}
