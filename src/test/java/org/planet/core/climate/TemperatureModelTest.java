package org.planet.core.climate;

import org.junit.jupiter.api.Test;
import org.planet.core.model.Atmosphere;
import org.planet.core.model.Planet;
import org.planet.core.model.config.PlanetParams;

import static org.junit.jupiter.api.Assertions.*;

class TemperatureModelTest {

    private static Planet earth() {
        return new PlanetParams().seeds(1, 2, 3, 4, 5).build();
    }

    @Test
    void earthLikeSurfaceIsPlausible() {
        TemperatureModel m = new TemperatureModel(earth());
        double avg = m.averageSurfaceTemperature();
        assertTrue(avg > 150 && avg < 400, "avg=" + avg);
        assertTrue(m.insolationFactorPolar() < m.insolationFactorEquatorial());
        assertTrue(m.minSurfaceTemperature() <= m.averagePolarSurfaceTemperature());
        assertTrue(m.maxSurfaceTemperature() >= avg);
    }

    @Test
    void polesAreColderThanEquator() {
        TemperatureModel m = new TemperatureModel(earth());
        TemperatureRange equator = m.temperatureRangeAt(0, 0);
        TemperatureRange pole = m.temperatureRangeAt(Math.toRadians(89), 0);
        assertTrue(pole.average() < equator.average());
        assertTrue(equator.min() <= equator.average() && equator.average() <= equator.max());
    }

    @Test
    void elevationCoolsUntilAtmosphereTop() {
        Planet p = earth();
        TemperatureModel m = new TemperatureModel(p);
        double surface = 288;
        assertEquals(surface, m.temperatureAtElevation(surface, -200));
        assertTrue(m.temperatureAtElevation(surface, 1000) < surface);
        assertEquals(m.averageBlackbodyTemperature(),
                m.temperatureAtElevation(surface, p.atmosphere().atmosphericHeight()));
    }

    @Test
    void dryAtmosphereUsesDryLapseRate() {
        Atmosphere dry = new Atmosphere(5.15e18, 8500, 1.2, 990, 2500, 13, 0.0, 100_000);
        Planet p = new PlanetParams().atmosphere(dry).build();
        TemperatureModel m = new TemperatureModel(p);
        assertEquals(p.surfaceGravity() / ClimateConstants.CP_DRY_AIR, m.lapseRate(280), 1e-12);
        assertEquals(m.lapseRateDry(), m.lapseRate(200), 1e-12);
    }

    @Test
    void moistLapseRateIsBelowDry() {
        TemperatureModel m = new TemperatureModel(earth());
        assertTrue(m.lapseRate(290) < m.lapseRateDry());
    }

    @Test
    void massLessAtmosphereIsPureBlackbody() {
        Atmosphere thin = new Atmosphere(0, 8500, 1.0, 0, 0, 13, 0, 100_000);
        TemperatureModel m = new TemperatureModel(new PlanetParams().atmosphere(thin).build());
        assertEquals(1.0, m.insolationFactorEquatorial());
        assertEquals(1.0, m.insolationFactorPolar());
        assertEquals(0.0, m.greenhouseEffect());
    }

    @Test
    void noAtmosphereIgnoresElevation() {
        TemperatureModel m = new TemperatureModel(new PlanetParams().atmosphere(null).build());
        assertEquals(250.0, m.temperatureAtElevation(250.0, 5000));
        assertEquals(1.0, m.insolationFactorEquatorial());
    }

    @Test
    void seasonsStartAtTheWinterSolstice() {
        assertEquals(200.0, TemperatureModel.seasonTemperature(200, 300, 0, 4), 1e-9);
        assertEquals(250.0, TemperatureModel.seasonTemperature(200, 300, 1, 4), 1e-9);
        assertEquals(300.0, TemperatureModel.seasonTemperature(200, 300, 2, 4), 1e-9);
        assertEquals(250.0, TemperatureModel.seasonTemperature(200, 300, 3, 4), 1e-9);
        assertEquals(200.0, TemperatureModel.seasonTemperature(200, 300, 0, 1), 1e-9);
        // южная точка: зимой северного полушария теплее
        assertEquals(290.0, TemperatureModel.seasonTemperature(290, 260, 0, 2), 1e-9);
        assertEquals(260.0, TemperatureModel.seasonTemperature(290, 260, 1, 2), 1e-9);
        assertEquals(0.0, TemperatureModel.proportionOfSummer(0), 1e-12);
        assertEquals(1.0, TemperatureModel.proportionOfSummer(0.5), 1e-12);

        Planet p = earth();
        TemperatureModel m = new TemperatureModel(p);
        assertEquals(p.winterSolsticeTrueAnomaly(), m.seasonTrueAnomaly(0, 4), 1e-12);
        double summer = m.seasonTrueAnomaly(2, 4);
        assertEquals(1.0, Math.cos(summer - p.summerSolsticeTrueAnomaly()), 1e-12);
    }

    @Test
    void summerHemisphereIsWarmerAtItsSolstice() {
        Planet p = earth();
        TemperatureModel m = new TemperatureModel(p);
        double winter = p.winterSolsticeTrueAnomaly();
        double summer = p.summerSolsticeTrueAnomaly();
        double north = Math.toRadians(45);

        double nw = m.surfaceTemperatureAt(winter, m.seasonalLatitudeAt(north, winter));
        double ns = m.surfaceTemperatureAt(summer, m.seasonalLatitudeAt(north, summer));
        assertTrue(ns > nw, "45N winter=" + nw + " summer=" + ns);

        double sw = m.surfaceTemperatureAt(winter, m.seasonalLatitudeAt(-north, winter));
        double ss = m.surfaceTemperatureAt(summer, m.seasonalLatitudeAt(-north, summer));
        assertTrue(sw > ss, "45S winter=" + sw + " summer=" + ss);

        SolsticeTemperature n = m.solsticeTemperatureAt(north, 0);
        assertEquals(nw, n.winter(), 1e-9);
        assertEquals(ns, n.summer(), 1e-9);
        assertEquals(TemperatureRange.of(nw, ns), m.temperatureRangeAt(north, 0));
    }

    @Test
    void positiveDeclinationBringsNorthernLatitudesUnderTheSun() {
        double tilt = Math.toRadians(23.4);
        assertEquals(Math.toRadians(45) - tilt, TemperatureModel.seasonalLatitude(Math.toRadians(45), tilt), 1e-12);
        assertEquals(0.0, TemperatureModel.seasonalLatitude(tilt, tilt), 1e-12);
        // за полюсом широта отражается обратно
        assertEquals(Math.toRadians(80), TemperatureModel.seasonalLatitude(Math.toRadians(80), Math.toRadians(-20)), 1e-9);
    }

    @Test
    void insolationWeightFollowsLatitudeCosine() {
        TemperatureModel m = new TemperatureModel(earth());
        assertEquals(TemperatureModel.DEFAULT_INSOLATION_COSINE, m.insolationCosine());
        assertEquals(m.insolationFactorEquatorial(), m.insolationFactor(0), 1e-12);
        double lat = Math.toRadians(60);
        double expected = m.insolationFactorPolar()
                + (m.insolationFactorEquatorial() - m.insolationFactorPolar()) * Math.cos(lat * 0.8);
        assertEquals(expected, m.insolationFactor(lat), 1e-12);
        assertEquals(m.insolationFactor(lat), m.insolationFactor(-lat), 1e-12);
    }

    @Test
    void declinationPeaksAtSolstices() {
        Planet p = earth();
        OrbitalDeclination d = new OrbitalDeclination(p);
        assertEquals(p.axialTilt(), d.declinationAt(p.summerSolsticeTrueAnomaly()), 1e-9);
        assertEquals(-p.axialTilt(), d.declinationAt(p.winterSolsticeTrueAnomaly()), 1e-9);
    }

    @Test
    void blackbodyFollowsInverseSquareRoot() {
        StellarBlackbody b = new StellarBlackbody(earth());
        double near = b.temperatureAtDistance(1e11);
        double far = b.temperatureAtDistance(4e11);
        assertEquals(near / 2, far, 1e-9);
        assertEquals(0.0, b.temperatureAtDistance(0));
        assertTrue(b.periapsisTemperature() >= b.apoapsisTemperature());
    }
}
