package org.planet.core.mapping;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MapProjectionTest {

    private static final double R = 6.371e6;

    @Test
    void totalAreaIsSphereAreaInBothProjections() {
        double sphere = 4 * Math.PI * R * R;
        for (ProjectionType t : ProjectionType.values()) {
            MapProjection p = MapProjection.full(t, 32);
            assertEquals(sphere, p.totalArea(R), sphere * 1e-9, t.name());
        }
    }

    @Test
    void equalAreaRowsHaveEqualCells() {
        MapProjection p = MapProjection.full(ProjectionType.CYLINDRICAL_EQUAL_AREA, 16);
        double first = p.cellArea(0, R);
        for (int y = 1; y < p.height(); y++) {
            assertEquals(first, p.cellArea(y, R), first * 1e-9);
        }
        MapProjection eq = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 16);
        assertTrue(eq.cellArea(0, R) < eq.cellArea(8, R));
    }

    @Test
    void gridIsTwoByOne() {
        MapProjection p = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 10);
        assertEquals(20, p.width());
        assertEquals(10, p.height());
        assertEquals(200, p.cellCount());
    }

    @Test
    void cellCentres() {
        MapProjection p = MapProjection.full(ProjectionType.EQUIRECTANGULAR, 4);
        assertEquals(3 * Math.PI / 8, p.latitudeOf(0), 1e-12);
        assertEquals(-3 * Math.PI / 8, p.latitudeOf(3), 1e-12);
        assertEquals(-Math.PI + Math.PI / 8, p.longitudeOf(0), 1e-12);
    }

    @Test
    void cellLookupInvertsCentres() {
        for (ProjectionType t : ProjectionType.values()) {
            MapProjection p = MapProjection.full(t, 24);
            for (int y = 0; y < p.height(); y++) {
                assertEquals(y, p.rowOf(p.latitudeOf(y)));
            }
            for (int x = 0; x < p.width(); x++) {
                assertEquals(x, p.columnOf(p.longitudeOf(x)));
            }
        }
    }

    @Test
    void invalidResolutionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> MapProjection.full(ProjectionType.EQUIRECTANGULAR, 0));
        assertThrows(IllegalArgumentException.class, () -> MapProjection.full(ProjectionType.EQUIRECTANGULAR, -4));
        assertThrows(IllegalArgumentException.class, () -> MapProjection.full(ProjectionType.CYLINDRICAL_EQUAL_AREA, 15));
        assertDoesNotThrow(() -> MapProjection.full(ProjectionType.EQUIRECTANGULAR, 15));
    }

    @Test
    void regionBoundsAndEdgeClamp() {
        MapRegion r = new MapRegion(0.5, 0.3, 0.4);
        assertEquals(0.5, r.northLatitude(), 1e-12);
        assertEquals(0.1, r.southLatitude(), 1e-12);
        assertEquals(0.1, r.westLongitude(), 1e-12);
        assertFalse(r.isFullPlanet());

        MapProjection p = new MapProjection(ProjectionType.EQUIRECTANGULAR, r, 8);
        assertEquals(p.width() - 1, p.columnOf(1.5));
        assertEquals(0, p.columnOf(-0.5));
        assertEquals(0, p.rowOf(1.0));
        assertEquals(p.height() - 1, p.rowOf(-1.0));
    }

    @Test
    void regionMayNotCrossPole() {
        assertThrows(IllegalArgumentException.class, () -> new MapRegion(0, 1.4, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new MapRegion(0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new MapRegion(0, 0, 4));
    }

    @Test
    void projectionNamesParse() {
        assertEquals(ProjectionType.CYLINDRICAL_EQUAL_AREA, ProjectionType.parse("equal-area"));
        assertEquals(ProjectionType.EQUIRECTANGULAR, ProjectionType.parse(" "));
        assertEquals(ProjectionType.CYLINDRICAL_EQUAL_AREA, ProjectionType.parse("cylindrical_equal_area"));
    }
}
