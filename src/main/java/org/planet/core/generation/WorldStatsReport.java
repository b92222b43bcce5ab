package org.planet.core.generation;

import java.util.Comparator;
import java.util.Map;

public class WorldStatsReport {

    public static void print(WorldStats s) {
        System.out.println();
        System.out.println("========= WORLD STATS =========");
        System.out.println("Planet: " + s.planetId);
        System.out.println("Map: " + s.projection + ", cells=" + s.cellCount + ", seasons=" + s.seasons);

        System.out.println();
        System.out.println("Elevation (m): min=" + fmt(s.elevationMin) + " max=" + fmt(s.elevationMax)
                + " avg=" + fmt(s.elevationAvg));
        System.out.println("Land: cells=" + s.landCells + " area=" + fmt(s.landFraction * 100) + "%");

        if (s.hasTemperature) {
            System.out.println("Temperature (K): min=" + fmt(s.tempMin) + " max=" + fmt(s.tempMax)
                    + " avg=" + fmt(s.tempAvg));
        }
        if (s.hasPrecipitation) {
            System.out.println("Precip (mm/yr): min=" + fmt(s.precipMin) + " max=" + fmt(s.precipMax)
                    + " avg=" + fmt(s.precipAvg) + " season peak=" + fmt(s.seasonPeak));
            System.out.println("Snow (mm/yr):   max=" + fmt(s.snowMax) + " avg=" + fmt(s.snowAvg));
        }
        if (s.hasHydrology) {
            System.out.println("Hydrology: max flow=" + fmt(s.maxFlow) + " m3/s, lake cells=" + s.lakeCells);
        }
        if (s.seaIceCells > 0 || s.snowCoverCells > 0) {
            System.out.println("Cover: sea ice cells=" + s.seaIceCells + " snow cells=" + s.snowCoverCells);
        }

        if (!s.climateCounts.isEmpty()) {
            System.out.println();
            System.out.println("Climate zones:");
            printCounts(s.climateCounts);
            System.out.println("Biomes (top):");
            printCounts(s.biomeCounts);
        }

        if (!s.resourceAvg.isEmpty()) {
            System.out.println();
            System.out.println("Resources (mean richness):");
            s.resourceAvg.forEach((k, v) -> System.out.println("  " + pad(k) + " : " + fmt(v)));
        }
        System.out.println("================================");
        System.out.println();
    }

    private static <K> void printCounts(Map<K, Integer> counts) {
        counts.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.reverseOrder()))
                .limit(12)
                .forEach(e -> System.out.println("  " + pad(String.valueOf(e.getKey())) + " : " + e.getValue()));
    }

    private static String fmt(double v) {
        return String.format(java.util.Locale.US, "%.3f", v);
    }

    private static String pad(String name) {
        return String.format("%-18s", name);
    }
}
