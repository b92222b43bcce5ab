package org.planet.core.mapping;

import org.junit.jupiter.api.Test;
import org.planet.core.climate.BiomeType;

import static org.junit.jupiter.api.Assertions.*;

class GridResamplerTest {

    private static FloatGrid ramp(MapProjection p) {
        FloatGrid g = new FloatGrid(p.width(), p.height());
        for (int y = 0; y < p.height(); y++) {
            for (int x = 0; x < p.width(); x++) {
                g.set(x, y, y * 1000 + x);
            }
        }
        return g;
    }

    @Test
    void sameProjectionIsIdentity() {
        MapProjection p = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 12);
        FloatGrid g = ramp(p);
        assertEquals(g, new GridResampler(p, p).resample(g));
    }

    @Test
    void doublingResolutionRepeatsEachCell() {
        MapProjection src = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 8);
        MapProjection dst = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 16);
        GridResampler r = new GridResampler(src, dst);
        FloatGrid out = r.resample(ramp(src));
        for (int y = 0; y < dst.height(); y++) {
            for (int x = 0; x < dst.width(); x++) {
                assertEquals((y / 2) * 1000 + x / 2, out.get(x, y), 1e-3);
                assertArrayEquals(new int[]{x / 2, y / 2}, r.sourceCell(x, y));
            }
        }
    }

    @Test
    void enumLayersAndNullsFollowTheSameTable() {
        MapProjection src = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 4);
        MapProjection dst = MapProjection.full(ProjectionType.CYLINDRICAL_EQUAL_AREA, 8);
        EnumGrid<BiomeType> biome = new EnumGrid<>(BiomeType.class, src.width(), src.height());
        biome.set(0, 0, BiomeType.POLAR);
        GridResampler r = new GridResampler(src, dst);
        EnumGrid<BiomeType> out = r.resample(biome);
        assertEquals(BiomeType.POLAR, out.get(0, 0));
        assertEquals(dst.width(), out.width());
        assertNull(r.resample((FloatGrid) null));
        assertNull(r.resample((CoverGrid) null));
    }

    @Test
    void resampledLayersAreReadOnly() {
        MapProjection src = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 4);
        MapProjection dst = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 8);
        GridResampler r = new GridResampler(src, dst);

        FloatGrid out = r.resample(ramp(src));
        assertTrue(out.isFrozen());
        assertThrows(IllegalStateException.class, () -> out.set(0, 0, 1.0));

        EnumGrid<BiomeType> biome = r.resample(new EnumGrid<>(BiomeType.class, src.width(), src.height()));
        assertThrows(IllegalStateException.class, () -> biome.set(0, 0, BiomeType.POLAR));

        RangeGrid range = r.resample(new RangeGrid(src.width(), src.height()));
        assertTrue(range.min().isFrozen());
        assertTrue(range.max().isFrozen());

        CoverGrid cover = r.resample(new CoverGrid(src.width(), src.height()));
        assertTrue(cover.start().isFrozen());
        assertTrue(cover.end().isFrozen());
    }

    @Test
    void mismatchedGridIsRejected() {
        MapProjection src = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 4);
        GridResampler r = new GridResampler(src, src);
        assertThrows(IllegalArgumentException.class, () -> r.resample(new FloatGrid(3, 3)));
    }

    @Test
    void bundleResampleRecountsLand() {
        MapProjection src = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 8);
        FloatGrid elevation = new FloatGrid(src.width(), src.height());
        int land = 0;
        for (int y = 0; y < src.height(); y++) {
            for (int x = 0; x < src.width(); x++) {
                double v = ((x + y) % 3 == 0) ? 0.4 : -0.2;
                elevation.set(x, y, v);
                if (v > 0) land++;
            }
        }
        SurfaceMaps maps = SurfaceMaps.builder()
                .planetId("p")
                .projection(src)
                .maxElevation(1000)
                .hydrosphere(true)
                .elevation(elevation)
                .landCellCount(land)
                .averageElevation(elevation.mean() * 1000)
                .maxPrecipitation(42)
                .build();

        MapProjection dst = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 16);
        SurfaceMaps out = SurfaceMapResampler.resample(maps, dst);
        assertEquals(dst, out.projection());
        assertEquals(land * 4, out.landCellCount());
        assertEquals(maps.averageElevation(), out.averageElevation(), 1e-3);
        assertEquals(42, out.maxPrecipitation());
        assertEquals(maps.landFraction(), out.landFraction(), 1e-9);
        assertTrue(out.elevation().isFrozen());
    }
}
