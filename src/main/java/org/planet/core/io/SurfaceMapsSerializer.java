package org.planet.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.planet.core.climate.BiomeType;
import org.planet.core.climate.Classification;
import org.planet.core.climate.ClimateType;
import org.planet.core.climate.EcologyType;
import org.planet.core.climate.HumidityType;
import org.planet.core.climate.TemperatureRange;
import org.planet.core.mapping.CoverGrid;
import org.planet.core.mapping.EnumGrid;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.HydrologyMaps;
import org.planet.core.mapping.MapProjection;
import org.planet.core.mapping.MapRegion;
import org.planet.core.mapping.ProjectionType;
import org.planet.core.mapping.RangeGrid;
import org.planet.core.mapping.SeasonMaps;
import org.planet.core.mapping.SurfaceMaps;
import org.planet.core.mapping.ValueRange;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.Map;

import static org.planet.core.io.JsonFields.binary;
import static org.planet.core.io.JsonFields.bool;
import static org.planet.core.io.JsonFields.dbl;
import static org.planet.core.io.JsonFields.enumValue;
import static org.planet.core.io.JsonFields.integer;
import static org.planet.core.io.JsonFields.node;
import static org.planet.core.io.JsonFields.object;
import static org.planet.core.io.JsonFields.text;

/**
 * Canonical JSON form of a {@link SurfaceMaps} bundle. Grids are base64 payloads of
 * big-endian IEEE-754 floats (enum grids: one ordinal byte per cell), so values
 * survive a round trip bit for bit and re-serializing a parsed document gives the
 * same text.
 * Short-key schema:
 * sv = schemaVersion
 * gv = generatorVersion
 * p  = planet meta (id, me = max elevation, sl = sea level, hy = hydrosphere)
 * m  = projection (pt, cm, cp, rg, r)
 * n  = season count
 * e  = normalized elevation
 * t  = temperature range {mn, av, mx, wi = winter solstice, su = summer solstice}
 * ss = seasons [{i, p, sn}]
 * tp / ap / ts = total precipitation / average precipitation / total snowfall
 * hd = hydrology {d = lake depth, f = flow, mf = max flow}
 * hu / cl / ec / bi = humidity / climate / ecology / biome ordinals
 * si / sc = sea ice / snow cover {s, e}
 * rs = resources {name: grid}
 * sm = summaries
 * Absent layers are omitted.
 */
public class SurfaceMapsSerializer {

    public static final int SCHEMA_VERSION = 1;
    public static final String GENERATOR_VERSION = "planet-surface-maps/1";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String toJson(SurfaceMaps maps) throws JsonProcessingException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("sv", SCHEMA_VERSION);
        root.put("gv", GENERATOR_VERSION);

        ObjectNode meta = root.putObject("p");
        if (maps.planetId() != null) meta.put("id", maps.planetId());
        meta.put("me", maps.maxElevation());
        meta.put("sl", maps.seaLevel());
        meta.put("hy", maps.hasHydrosphere());

        MapProjection projection = maps.projection();
        ObjectNode m = root.putObject("m");
        m.put("pt", projection.type().name());
        m.put("cm", projection.region().centralMeridian());
        m.put("cp", projection.region().centralParallel());
        m.put("rg", projection.region().range());
        m.put("r", projection.resolution());

        root.put("n", maps.seasonCount());
        root.put("e", floats(maps.elevation()));

        if (maps.temperature() != null) {
            ObjectNode t = root.putObject("t");
            t.put("mn", floats(maps.temperature().min()));
            t.put("av", floats(maps.temperature().average()));
            t.put("mx", floats(maps.temperature().max()));
            putFloats(t, "wi", maps.winterTemperature());
            putFloats(t, "su", maps.summerTemperature());
        }

        if (!maps.seasons().isEmpty()) {
            ArrayNode seasons = root.putArray("ss");
            for (SeasonMaps s : maps.seasons()) {
                ObjectNode sn = seasons.addObject();
                sn.put("i", s.index());
                sn.put("p", floats(s.precipitation()));
                if (s.snowfall() != null) sn.put("sn", floats(s.snowfall()));
            }
        }

        putFloats(root, "tp", maps.totalPrecipitation());
        putFloats(root, "ap", maps.averagePrecipitation());
        putFloats(root, "ts", maps.totalSnowfall());
        if (maps.hydrology() != null) {
            ObjectNode hd = root.putObject("hd");
            hd.put("d", floats(maps.hydrology().depth()));
            hd.put("f", floats(maps.hydrology().flow()));
            hd.put("mf", maps.hydrology().maxFlow());
        }
        putOrdinals(root, "hu", maps.humidity());
        putOrdinals(root, "cl", maps.climate());
        putOrdinals(root, "ec", maps.ecology());
        putOrdinals(root, "bi", maps.biome());
        putCover(root, "si", maps.seaIce());
        putCover(root, "sc", maps.snowCover());

        if (!maps.resources().isEmpty()) {
            ObjectNode rs = root.putObject("rs");
            for (Map.Entry<String, FloatGrid> e : maps.resources().entrySet()) {
                rs.put(e.getKey(), floats(e.getValue()));
            }
        }

        ObjectNode sm = root.putObject("sm");
        sm.put("ae", maps.averageElevation());
        sm.put("lc", maps.landCellCount());
        sm.put("mp", maps.maxPrecipitation());
        if (maps.overallTemperature() != null) {
            TemperatureRange r = maps.overallTemperature();
            sm.putArray("ot").add(r.min()).add(r.average()).add(r.max());
        }
        putRange(sm, "pr", maps.totalPrecipitationRange());
        putRange(sm, "sr", maps.totalSnowfallRange());
        if (maps.overallClassification() != null) {
            Classification c = maps.overallClassification();
            ObjectNode oc = sm.putObject("oc");
            oc.put("c", c.climate().name());
            oc.put("h", c.humidity().name());
            oc.put("e", c.ecology().name());
            oc.put("b", c.biome().name());
        }

        return MAPPER.writeValueAsString(root);
    }

    public static SurfaceMaps fromJson(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new MapFormatException("Surface maps document must be a JSON object");
        }
        int version = integer(root, "sv");
        if (version != SCHEMA_VERSION) {
            throw new MapFormatException("Unsupported surface maps schema version " + version
                    + " (expected " + SCHEMA_VERSION + ")");
        }
        try {
            return read(root);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new MapFormatException("Corrupt surface maps: " + e.getMessage(), e);
        }
    }

    private static SurfaceMaps read(JsonNode root) throws MapFormatException {
        JsonNode meta = object(root, "p");
        JsonNode m = object(root, "m");
        MapProjection projection = new MapProjection(
                enumValue(ProjectionType.class, m, "pt"),
                new MapRegion(dbl(m, "cm"), dbl(m, "cp"), dbl(m, "rg")),
                integer(m, "r"));
        int w = projection.width();
        int h = projection.height();
        int seasonCount = integer(root, "n");

        SurfaceMaps.Builder b = SurfaceMaps.builder()
                .planetId(meta.has("id") ? text(meta, "id") : null)
                .projection(projection)
                .seasonCount(seasonCount)
                .maxElevation(dbl(meta, "me"))
                .seaLevel(dbl(meta, "sl"))
                .hydrosphere(bool(meta, "hy"))
                .elevation(readFloats(root, "e", w, h));

        if (root.has("t")) {
            JsonNode t = object(root, "t");
            b.temperature(new RangeGrid(readFloats(t, "mn", w, h), readFloats(t, "av", w, h), readFloats(t, "mx", w, h)));
            if (t.has("wi")) b.winterTemperature(readFloats(t, "wi", w, h));
            if (t.has("su")) b.summerTemperature(readFloats(t, "su", w, h));
        }

        if (root.has("ss")) {
            JsonNode seasons = node(root, "ss");
            if (!seasons.isArray() || seasons.size() != seasonCount) {
                throw new MapFormatException("Expected " + seasonCount + " seasons");
            }
            for (int i = 0; i < seasons.size(); i++) {
                JsonNode sn = seasons.get(i);
                if (integer(sn, "i") != i) {
                    throw new MapFormatException("Season " + i + " stored out of order");
                }
                b.season(new SeasonMaps(i, seasonCount, readFloats(sn, "p", w, h),
                        sn.has("sn") ? readFloats(sn, "sn", w, h) : null));
            }
        }

        if (root.has("tp")) b.totalPrecipitation(readFloats(root, "tp", w, h));
        if (root.has("ap")) b.averagePrecipitation(readFloats(root, "ap", w, h));
        if (root.has("ts")) b.totalSnowfall(readFloats(root, "ts", w, h));
        if (root.has("hd")) {
            JsonNode hd = object(root, "hd");
            b.hydrology(new HydrologyMaps(readFloats(hd, "d", w, h), readFloats(hd, "f", w, h), dbl(hd, "mf")));
        }
        if (root.has("hu")) b.humidity(readOrdinals(HumidityType.class, root, "hu", w, h));
        if (root.has("cl")) b.climate(readOrdinals(ClimateType.class, root, "cl", w, h));
        if (root.has("ec")) b.ecology(readOrdinals(EcologyType.class, root, "ec", w, h));
        if (root.has("bi")) b.biome(readOrdinals(BiomeType.class, root, "bi", w, h));
        if (root.has("si")) b.seaIce(readCover(root, "si", w, h));
        if (root.has("sc")) b.snowCover(readCover(root, "sc", w, h));

        if (root.has("rs")) {
            JsonNode rs = object(root, "rs");
            Iterator<String> names = rs.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                b.resource(name, readFloats(rs, name, w, h));
            }
        }

        JsonNode sm = object(root, "sm");
        b.averageElevation(dbl(sm, "ae"))
                .landCellCount(integer(sm, "lc"))
                .maxPrecipitation(dbl(sm, "mp"));
        if (sm.has("ot")) {
            double[] v = triple(sm, "ot");
            b.overallTemperature(new TemperatureRange(v[0], v[1], v[2]));
        }
        if (sm.has("pr")) {
            double[] v = triple(sm, "pr");
            b.totalPrecipitationRange(new ValueRange(v[0], v[1], v[2]));
        }
        if (sm.has("sr")) {
            double[] v = triple(sm, "sr");
            b.totalSnowfallRange(new ValueRange(v[0], v[1], v[2]));
        }
        if (sm.has("oc")) {
            JsonNode oc = object(sm, "oc");
            b.overallClassification(new Classification(
                    enumValue(ClimateType.class, oc, "c"),
                    enumValue(HumidityType.class, oc, "h"),
                    enumValue(EcologyType.class, oc, "e"),
                    enumValue(BiomeType.class, oc, "b")));
        }
        return b.build();
    }

    static byte[] floats(FloatGrid grid) {
        float[] values = grid.toArray();
        ByteBuffer buf = ByteBuffer.allocate(values.length * Float.BYTES);
        for (float v : values) buf.putFloat(v);
        return buf.array();
    }

    private static FloatGrid readFloats(JsonNode parent, String key, int w, int h) throws MapFormatException {
        byte[] bytes = binary(parent, key);
        if (bytes.length != w * h * Float.BYTES) {
            throw new MapFormatException("Grid '" + key + "' has " + bytes.length + " bytes, expected "
                    + (w * h * Float.BYTES));
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        float[] values = new float[w * h];
        for (int i = 0; i < values.length; i++) values[i] = buf.getFloat();
        return FloatGrid.of(w, h, values);
    }

    private static <E extends Enum<E>> EnumGrid<E> readOrdinals(Class<E> type, JsonNode parent, String key,
                                                               int w, int h) throws MapFormatException {
        byte[] bytes = binary(parent, key);
        if (bytes.length != w * h) {
            throw new MapFormatException("Grid '" + key + "' has " + bytes.length + " cells, expected " + (w * h));
        }
        return EnumGrid.ofOrdinals(type, w, h, bytes);
    }

    private static CoverGrid readCover(JsonNode parent, String key, int w, int h) throws MapFormatException {
        JsonNode c = object(parent, key);
        return new CoverGrid(readFloats(c, "s", w, h), readFloats(c, "e", w, h));
    }

    private static double[] triple(JsonNode parent, String key) throws MapFormatException {
        JsonNode a = node(parent, key);
        if (!a.isArray() || a.size() != 3) {
            throw new MapFormatException("Field '" + key + "' must be [min, average, max]");
        }
        double[] out = new double[3];
        for (int i = 0; i < 3; i++) {
            if (!a.get(i).isNumber()) throw new MapFormatException("Field '" + key + "' has a non-number");
            out[i] = a.get(i).doubleValue();
        }
        return out;
    }

    private static void putFloats(ObjectNode parent, String key, FloatGrid grid) {
        if (grid != null) parent.put(key, floats(grid));
    }

    private static void putOrdinals(ObjectNode parent, String key, EnumGrid<?> grid) {
        if (grid != null) parent.put(key, grid.toOrdinals());
    }

    private static void putCover(ObjectNode parent, String key, CoverGrid grid) {
        if (grid == null) return;
        ObjectNode c = parent.putObject(key);
        c.put("s", floats(grid.start()));
        c.put("e", floats(grid.end()));
    }

    private static void putRange(ObjectNode parent, String key, ValueRange range) {
        if (range == null) return;
        parent.putArray(key).add(range.min()).add(range.average()).add(range.max());
    }
}
