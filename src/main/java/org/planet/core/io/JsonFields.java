package org.planet.core.io;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Strict field access for the stored formats: every lookup either finds the right
 * node type or fails the whole read.
 */
final class JsonFields {

    private JsonFields() {}

    static JsonNode node(JsonNode parent, String key) throws MapFormatException {
        JsonNode n = parent.get(key);
        if (n == null || n.isNull()) {
            throw new MapFormatException("Missing field '" + key + "'");
        }
        return n;
    }

    static JsonNode object(JsonNode parent, String key) throws MapFormatException {
        JsonNode n = node(parent, key);
        if (!n.isObject()) throw new MapFormatException("Field '" + key + "' is not an object");
        return n;
    }

    static double dbl(JsonNode parent, String key) throws MapFormatException {
        JsonNode n = node(parent, key);
        if (!n.isNumber()) throw new MapFormatException("Field '" + key + "' is not a number");
        return n.doubleValue();
    }

    static int integer(JsonNode parent, String key) throws MapFormatException {
        JsonNode n = node(parent, key);
        if (!n.canConvertToInt() || !n.isIntegralNumber()) {
            throw new MapFormatException("Field '" + key + "' is not an integer");
        }
        return n.intValue();
    }

    static boolean bool(JsonNode parent, String key) throws MapFormatException {
        JsonNode n = node(parent, key);
        if (!n.isBoolean()) throw new MapFormatException("Field '" + key + "' is not a boolean");
        return n.booleanValue();
    }

    static String text(JsonNode parent, String key) throws MapFormatException {
        JsonNode n = node(parent, key);
        if (!n.isTextual()) throw new MapFormatException("Field '" + key + "' is not a string");
        return n.textValue();
    }

    static byte[] binary(JsonNode parent, String key) throws MapFormatException {
        JsonNode n = node(parent, key);
        try {
            byte[] b = n.binaryValue();
            if (b == null) throw new MapFormatException("Field '" + key + "' is not base64 data");
            return b;
        } catch (MapFormatException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new MapFormatException("Field '" + key + "' is not valid base64", e);
        }
    }

    static <E extends Enum<E>> E enumValue(Class<E> type, JsonNode parent, String key) throws MapFormatException {
        String name = text(parent, key);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new MapFormatException("Unknown " + type.getSimpleName() + " '" + name + "' in field '" + key + "'", e);
        }
    }
}
