package org.planet.core.mapping;

import org.junit.jupiter.api.Test;
import org.planet.core.climate.BiomeType;
import org.planet.core.climate.CoverRange;
import org.planet.core.climate.TemperatureRange;

import static org.junit.jupiter.api.Assertions.*;

class GridsTest {

    @Test
    void frozenFloatGridRejectsWrites() {
        FloatGrid g = new FloatGrid(4, 2);
        g.set(1, 1, 2.5);
        g.add(1, 1, 0.5);
        assertEquals(3.0f, g.get(1, 1));
        g.freeze();
        assertTrue(g.isFrozen());
        assertThrows(IllegalStateException.class, () -> g.set(0, 0, 1));
        assertThrows(IllegalStateException.class, () -> g.add(0, 0, 1));
    }

    @Test
    void floatGridBoundsAndStats() {
        FloatGrid g = FloatGrid.of(2, 2, new float[]{1, 2, 3, 6});
        assertEquals(1.0, g.min());
        assertEquals(6.0, g.max());
        assertEquals(3.0, g.mean());
        assertEquals(-1, g.firstNonFinite());
        assertThrows(IndexOutOfBoundsException.class, () -> g.get(2, 0));
        assertThrows(IllegalArgumentException.class, () -> FloatGrid.of(2, 2, new float[3]));
        assertThrows(IllegalArgumentException.class, () -> new FloatGrid(0, 2));

        g.set(1, 0, Float.NaN);
        assertEquals(1, g.firstNonFinite());
    }

    @Test
    void toArrayIsACopy() {
        FloatGrid g = new FloatGrid(2, 1);
        float[] a = g.toArray();
        a[0] = 9;
        assertEquals(0.0f, g.get(0, 0));
    }

    @Test
    void enumGridCountsAndValidatesOrdinals() {
        EnumGrid<BiomeType> g = new EnumGrid<>(BiomeType.class, 3, 1);
        g.set(0, 0, BiomeType.SEA);
        g.set(1, 0, BiomeType.SEA);
        g.set(2, 0, BiomeType.TUNDRA);
        assertEquals(2, g.count(BiomeType.SEA));
        assertEquals(Integer.valueOf(1), g.histogram().get(BiomeType.TUNDRA));

        EnumGrid<BiomeType> copy = EnumGrid.ofOrdinals(BiomeType.class, 3, 1, g.toOrdinals());
        assertEquals(g, copy);
        assertThrows(IllegalArgumentException.class,
                () -> EnumGrid.ofOrdinals(BiomeType.class, 1, 1, new byte[]{(byte) 100}));
        g.freeze();
        assertThrows(IllegalStateException.class, () -> g.set(0, 0, BiomeType.POLAR));
    }

    @Test
    void rangeAndCoverGridsRoundTripCells() {
        RangeGrid t = new RangeGrid(2, 2);
        TemperatureRange r = new TemperatureRange(250, 270, 290);
        t.set(1, 0, r);
        assertEquals(r, t.get(1, 0));

        CoverGrid c = new CoverGrid(2, 2);
        c.set(0, 1, new CoverRange(0.75, 0.25));
        assertEquals(new CoverRange(0.75, 0.25), c.get(0, 1));
        assertEquals(1, c.coveredCells());
    }

    @Test
    void seasonAccounting() {
        SeasonMaps s = new SeasonMaps(2, 4, new FloatGrid(1, 1), null);
        assertEquals(0.5, s.startOfYear());
        assertEquals(0.25, s.proportionOfYear());
        assertThrows(IllegalArgumentException.class, () -> new SeasonMaps(4, 4, new FloatGrid(1, 1), null));
    }
}
