package org.planet.core.generation;

import org.junit.jupiter.api.Test;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;

import static org.junit.jupiter.api.Assertions.*;

class PlanetFactoryTest {

    @Test
    void sameSeedSamePlanet() {
        for (PlanetKind kind : PlanetKind.values()) {
            Planet a = PlanetFactory.generate(kind, 1234L);
            Planet b = PlanetFactory.generate(kind, 1234L);
            assertEquals(a.id(), b.id());
            assertEquals(a.radius(), b.radius());
            assertEquals(a.mass(), b.mass());
            assertEquals(a.axialTilt(), b.axialTilt());
            assertArrayEquals(a.seeds(), b.seeds());
            assertEquals(PlanetFactory.NOISE_SEEDS, a.seedCount());
        }
        assertNotEquals(PlanetFactory.generate(PlanetKind.ROCKY, 1).radius(),
                PlanetFactory.generate(PlanetKind.ROCKY, 2).radius());
    }

    @Test
    void kindRangesAreRespected() {
        for (long seed = 0; seed < 50; seed++) {
            Planet p = PlanetFactory.generate(PlanetKind.ROCKY, seed);
            assertTrue(p.radius() >= PlanetKind.ROCKY.radiusMin && p.radius() <= PlanetKind.ROCKY.radiusMax);
            double density = p.density();
            assertTrue(density >= PlanetKind.ROCKY.densityMin - 1e-6 && density <= PlanetKind.ROCKY.densityMax + 1e-6);
            assertTrue(p.maxElevationFactor() >= 0.5 && p.maxElevationFactor() <= 1.5);
        }
    }

    @Test
    void gasGiantsAndCometsAreFlat() {
        assertEquals(0.0, PlanetFactory.generate(PlanetKind.GAS_GIANT, 7).maxElevation());
        Planet comet = PlanetFactory.generate(PlanetKind.COMET, 7);
        assertEquals(0.0, comet.maxElevation());
        assertFalse(comet.hasAtmosphere());
    }

    @Test
    void idCarriesKindAndSeed() {
        assertEquals("icy-ff", PlanetFactory.generate(PlanetKind.ICY, 255).id());
    }

    @Test
    void elevationFactorAveragesFiveDraws() {
        PlanetFactory f = new PlanetFactory(99);
        for (int i = 0; i < 200; i++) {
            double v = f.maxElevationFactor();
            assertTrue(v >= 0.5 && v <= 1.5, "v=" + v);
        }
    }
}
