package org.planet.app;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchMainTest {

    @Test
    void argumentsWinOverDefaults() {
        Map<String, String> opts = BatchMain.parseArgs(new String[]{"planet.seed=17", "planet.kind= icy ", "planet.out="});
        assertEquals("17", BatchMain.option(opts, "planet.seed", "1"));
        assertEquals("icy", BatchMain.option(opts, "planet.kind", "ROCKY"));
        assertEquals("out", BatchMain.option(opts, "planet.out", "out"));
        assertEquals("90", BatchMain.option(opts, "planet.resolution.unset", "90"));
    }

    @Test
    void malformedArgumentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> BatchMain.parseArgs(new String[]{"seed"}));
        assertThrows(IllegalArgumentException.class, () -> BatchMain.parseArgs(new String[]{"=3"}));
    }
}
