package org.planet.core.io;

import java.io.IOException;

/**
 * Приёмник растров: получает готовые ARGB-пиксели слоя (строка за строкой, север сверху).
 */
public interface RasterSink {

    void write(String layer, int width, int height, int[] argb) throws IOException;
}
