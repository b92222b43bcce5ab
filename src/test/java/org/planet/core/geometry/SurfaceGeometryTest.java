package org.planet.core.geometry;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SurfaceGeometryTest {

    @Test
    void latLonRoundTripOnTiltedPlanet() {
        SurfaceGeometry g = new SurfaceGeometry(6.371e6, Math.toRadians(23.44), Math.toRadians(40));
        Random rnd = new Random(42);
        for (int i = 0; i < 10_000; i++) {
            // у самых полюсов долгота вырождается
            double lat = (rnd.nextDouble() * 2 - 1) * 1.55;
            double lon = (rnd.nextDouble() * 2 - 1) * Math.PI * 0.999;
            Vector3 v = g.latLonToVector(lat, lon);
            assertEquals(1.0, v.length(), 1e-9);
            double[] back = g.vectorToLatLon(v);
            assertEquals(lat, back[0], 1e-6, "lat at i=" + i);
            assertEquals(lon, back[1], 1e-6, "lon at i=" + i);
        }
    }

    @Test
    void northPoleIsRotationAxis() {
        SurfaceGeometry g = new SurfaceGeometry(1.0, 0.4, 1.1);
        Vector3 pole = g.latLonToVector(Math.PI / 2, 0);
        assertEquals(0.0, pole.angleTo(g.axis()), 1e-9);
    }

    @Test
    void greatCircleDistanceQuarterAndAntipode() {
        double r = 1000.0;
        SurfaceGeometry g = new SurfaceGeometry(r, 0, 0);
        assertEquals(Math.PI / 2 * r, g.greatCircleDistance(0, 0, 0, Math.PI / 2), 1e-6);
        assertEquals(Math.PI * r, g.greatCircleDistance(0, 0, 0, Math.PI), 1e-6);
        assertEquals(0.0, g.greatCircleDistance(0.3, 0.2, 0.3, 0.2), 1e-9);
    }

    @Test
    void offsetNorthCrossesPole() {
        double[] c = SurfaceGeometry.offsetNorth(Math.PI / 2 - 0.1, 0.5, 0.3);
        assertEquals(Math.PI / 2 - 0.2, c[0], 1e-12);
        assertEquals(SurfaceGeometry.normalizeLongitude(0.5 + Math.PI), c[1], 1e-12);
    }

    @Test
    void normalizeLongitudeStaysInHalfOpenRange() {
        assertEquals(Math.PI, SurfaceGeometry.normalizeLongitude(-Math.PI), 1e-12);
        assertEquals(0.5, SurfaceGeometry.normalizeLongitude(0.5 + 4 * Math.PI), 1e-9);
        assertEquals(-0.5, SurfaceGeometry.normalizeLongitude(-0.5 - 2 * Math.PI), 1e-9);
    }
}
