package org.planet.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.planet.core.model.Atmosphere;
import org.planet.core.model.Orbit;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;
import org.planet.core.model.config.PlanetParams;

import java.io.IOException;

import static org.planet.core.io.JsonFields.bool;
import static org.planet.core.io.JsonFields.dbl;
import static org.planet.core.io.JsonFields.integer;
import static org.planet.core.io.JsonFields.node;
import static org.planet.core.io.JsonFields.object;
import static org.planet.core.io.JsonFields.text;

/**
 * Planet parameters as JSON, tagged with a {@code kind} discriminator. Only the
 * creation parameters are stored; derived values (gravity, max elevation, solstices)
 * are recomputed on load, so a loaded planet generates the same maps.
 */
public class PlanetSerializer {

    public static final int SCHEMA_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String toJson(Planet planet) throws JsonProcessingException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("sv", SCHEMA_VERSION);
        root.put("kind", planet.kind().name());
        root.put("id", planet.id());
        root.put("radius", planet.radius());
        root.put("mass", planet.mass());
        root.put("albedo", planet.albedo());
        root.put("rotationalPeriod", planet.rotationalPeriod());
        root.put("angleOfRotation", planet.angleOfRotation());
        root.put("axialPrecession", planet.axialPrecession());
        root.put("starLuminosity", planet.starLuminosity());
        root.put("stellarDistance", planet.stellarDistance());
        root.put("flatSurface", planet.hasFlatSurface());
        root.put("maxElevationFactor", planet.maxElevationFactor());
        root.put("normalizedSeaLevel", planet.normalizedSeaLevel());
        root.put("hydrosphere", planet.hydrosphereProportion());

        ArrayNode seeds = root.putArray("seeds");
        for (int s : planet.seeds()) seeds.add(s);

        if (planet.hasOrbit()) {
            Orbit o = planet.orbit();
            ObjectNode orbit = root.putObject("orbit");
            orbit.put("a", o.semiMajorAxis());
            orbit.put("e", o.eccentricity());
            orbit.put("i", o.inclination());
        }
        if (planet.hasAtmosphere()) {
            Atmosphere a = planet.atmosphere();
            ObjectNode atm = root.putObject("atmosphere");
            atm.put("mass", a.mass());
            atm.put("scaleHeight", a.scaleHeight());
            atm.put("greenhouseFactor", a.greenhouseFactor());
            atm.put("averagePrecipitation", a.averagePrecipitation());
            atm.put("maxPrecipitation", a.maxPrecipitation());
            atm.put("snowToRainRatio", a.snowToRainRatio());
            atm.put("waterVaporRatio", a.waterVaporRatio());
            atm.put("atmosphericHeight", a.atmosphericHeight());
        }
        return MAPPER.writeValueAsString(root);
    }

    public static Planet fromJson(String json) throws IOException {
        return fromJson(json, null);
    }

    /**
     * @param expectedKind when not null, a document tagged with another kind is rejected
     */
    public static Planet fromJson(String json, PlanetKind expectedKind) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new MapFormatException("Planet document must be a JSON object");
        }
        int version = integer(root, "sv");
        if (version != SCHEMA_VERSION) {
            throw new MapFormatException("Unsupported planet schema version " + version);
        }
        String tag = text(root, "kind");
        PlanetKind kind;
        try {
            kind = PlanetKind.valueOf(tag);
        } catch (IllegalArgumentException e) {
            throw new MapFormatException("Unknown planet kind '" + tag + "'", e);
        }
        if (expectedKind != null && kind != expectedKind) {
            throw new MapFormatException("Expected a " + expectedKind + " planet but document is " + kind);
        }

        PlanetParams p = new PlanetParams()
                .kind(kind)
                .id(text(root, "id"))
                .radius(dbl(root, "radius"))
                .mass(dbl(root, "mass"))
                .albedo(dbl(root, "albedo"))
                .rotationalPeriod(dbl(root, "rotationalPeriod"))
                .angleOfRotation(dbl(root, "angleOfRotation"))
                .axialPrecession(dbl(root, "axialPrecession"))
                .starLuminosity(dbl(root, "starLuminosity"))
                .stellarDistance(dbl(root, "stellarDistance"))
                .flatSurface(bool(root, "flatSurface"))
                .maxElevationFactor(dbl(root, "maxElevationFactor"))
                .normalizedSeaLevel(dbl(root, "normalizedSeaLevel"))
                .hydrosphereProportion(dbl(root, "hydrosphere"));

        JsonNode seedsNode = node(root, "seeds");
        if (!seedsNode.isArray()) throw new MapFormatException("Field 'seeds' must be an array");
        int[] seeds = new int[seedsNode.size()];
        for (int i = 0; i < seeds.length; i++) {
            JsonNode s = seedsNode.get(i);
            if (!s.isIntegralNumber() || !s.canConvertToInt()) {
                throw new MapFormatException("Seed " + i + " is not an int");
            }
            seeds[i] = s.intValue();
        }
        p.seeds(seeds);

        try {
            if (root.has("orbit")) {
                JsonNode o = object(root, "orbit");
                p.orbit(new Orbit(dbl(o, "a"), dbl(o, "e"), dbl(o, "i")));
            } else {
                p.orbit(null);
            }
            if (root.has("atmosphere")) {
                JsonNode a = object(root, "atmosphere");
                p.atmosphere(new Atmosphere(
                        dbl(a, "mass"),
                        dbl(a, "scaleHeight"),
                        dbl(a, "greenhouseFactor"),
                        dbl(a, "averagePrecipitation"),
                        dbl(a, "maxPrecipitation"),
                        dbl(a, "snowToRainRatio"),
                        dbl(a, "waterVaporRatio"),
                        dbl(a, "atmosphericHeight")));
            } else {
                p.atmosphere(null);
            }
            return p.build();
        } catch (IllegalArgumentException e) {
            throw new MapFormatException("Invalid planet parameters: " + e.getMessage(), e);
        }
    }
}
