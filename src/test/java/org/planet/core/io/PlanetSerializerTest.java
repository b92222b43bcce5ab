package org.planet.core.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.planet.core.generation.PlanetFactory;
import org.planet.core.model.Planet;
import org.planet.core.model.PlanetKind;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class PlanetSerializerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void everyKindRoundTrips() throws IOException {
        for (PlanetKind kind : PlanetKind.values()) {
            Planet p = PlanetFactory.generate(kind, 77);
            String json = PlanetSerializer.toJson(p);
            Planet back = PlanetSerializer.fromJson(json, kind);
            assertEquals(json, PlanetSerializer.toJson(back));
            assertEquals(p.kind(), back.kind());
            assertEquals(p.maxElevation(), back.maxElevation());
            assertEquals(p.hasAtmosphere(), back.hasAtmosphere());
            assertArrayEquals(p.seeds(), back.seeds());
        }
    }

    @Test
    void mismatchedKindIsRejected() throws IOException {
        String json = PlanetSerializer.toJson(PlanetFactory.generate(PlanetKind.ROCKY, 1));
        assertThrows(MapFormatException.class, () -> PlanetSerializer.fromJson(json, PlanetKind.ICY));
    }

    @Test
    void unknownKindIsRejected() throws IOException {
        ObjectNode root = tree(PlanetKind.ICY);
        root.put("kind", "PULSAR");
        assertThrows(MapFormatException.class, () -> PlanetSerializer.fromJson(mapper.writeValueAsString(root)));
    }

    @Test
    void wrongVersionOrMissingFieldIsRejected() throws IOException {
        ObjectNode v2 = tree(PlanetKind.ROCKY);
        v2.put("sv", 2);
        assertThrows(MapFormatException.class, () -> PlanetSerializer.fromJson(mapper.writeValueAsString(v2)));

        ObjectNode noRadius = tree(PlanetKind.ROCKY);
        noRadius.remove("radius");
        assertThrows(MapFormatException.class, () -> PlanetSerializer.fromJson(mapper.writeValueAsString(noRadius)));
    }

    @Test
    void invalidParametersAreRejected() throws IOException {
        ObjectNode negative = tree(PlanetKind.ROCKY);
        negative.put("radius", -5.0);
        assertThrows(MapFormatException.class, () -> PlanetSerializer.fromJson(mapper.writeValueAsString(negative)));

        ObjectNode twoSeeds = tree(PlanetKind.ROCKY);
        twoSeeds.putArray("seeds").add(1).add(2);
        assertThrows(MapFormatException.class, () -> PlanetSerializer.fromJson(mapper.writeValueAsString(twoSeeds)));
    }

    private ObjectNode tree(PlanetKind kind) throws IOException {
        return (ObjectNode) mapper.readTree(PlanetSerializer.toJson(PlanetFactory.generate(kind, 5)));
    }
}
