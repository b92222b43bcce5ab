package org.planet.core.io;

import java.io.IOException;

/**
 * Stored document cannot be turned back into a planet or a map bundle: a field is
 * missing, the schema version or kind tag is unknown, or a payload is corrupt.
 */
public class MapFormatException extends IOException {

    public MapFormatException(String message) {
        super(message);
    }

    public MapFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
