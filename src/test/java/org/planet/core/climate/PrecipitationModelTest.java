package org.planet.core.climate;

import org.junit.jupiter.api.Test;
import org.planet.core.geometry.Vector3;
import org.planet.core.model.Planet;
import org.planet.core.model.config.PlanetParams;

import static org.junit.jupiter.api.Assertions.*;

class PrecipitationModelTest {

    private final Planet planet = new PlanetParams().seeds(3, 1, 4, 1, 5).build();
    private final PrecipitationModel model = new PrecipitationModel(planet, new HadleyCache());

    @Test
    void precipitationIsNonNegativeAndSnowOnlyWhenFreezing() {
        for (int lat = -85; lat <= 85; lat += 5) {
            for (int lon = -180; lon < 180; lon += 20) {
                double la = Math.toRadians(lat);
                Vector3 v = planet.geometry().latLonToVector(la, Math.toRadians(lon));
                for (double t : new double[]{240, 262, 270, 273.15, 280, 300}) {
                    Precipitation p = model.precipitationAt(v, la, t, 0.25);
                    assertTrue(p.precipitation() >= 0, "precip at " + lat + "," + lon);
                    assertTrue(p.snow() >= 0);
                    if (t > ClimateConstants.FREEZING_POINT) {
                        assertEquals(0.0, p.snow());
                    }
                }
            }
        }
    }

    @Test
    void tooColdForAnyPrecipitation() {
        Vector3 v = planet.geometry().latLonToVector(0.2, 0.3);
        assertEquals(Precipitation.NONE, model.precipitationAt(v, 0.2, ClimateConstants.LOW_TEMPERATURE - 1, 0.5));
        assertEquals(0.0, model.relativeHumidityAt(v, 0.2, ClimateConstants.LOW_TEMPERATURE));
    }

    @Test
    void snowUsesRatio() {
        double ratio = planet.atmosphere().snowToRainRatio();
        assertEquals(10 * ratio, model.snowFrom(10, 260), 1e-9);
        assertEquals(10 * ratio, model.snowFrom(10, ClimateConstants.FREEZING_POINT), 1e-9);
        assertEquals(0.0, model.snowFrom(10, 274));
    }

    @Test
    void requiresAtmosphereAndSaneBoost() {
        Planet airless = new PlanetParams().atmosphere(null).build();
        assertThrows(IllegalArgumentException.class, () -> new PrecipitationModel(airless, new HadleyCache()));
        assertThrows(IllegalArgumentException.class, () -> new PrecipitationModel(planet, new HadleyCache(), 0.5));
    }

    @Test
    void missingSeedsAreDerivedFromFirst() {
        Planet three = new PlanetParams().seeds(10, 20, 30).build();
        assertEquals(10 * 31 + 4 * 7_919, PrecipitationModel.precipitationSeed(three, 4));
        assertEquals(5, PrecipitationModel.precipitationSeed(planet, 4));
    }

    @Test
    void sameInputsSameOutput() {
        PrecipitationModel other = new PrecipitationModel(planet, new HadleyCache());
        Vector3 v = planet.geometry().latLonToVector(0.7, -1.1);
        assertEquals(model.precipitationAt(v, 0.7, 285, 0.25), other.precipitationAt(v, 0.7, 285, 0.25));
    }
}
