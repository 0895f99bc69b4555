package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.model.Category;
import org.terrain.core.model.LayerKind;

import java.util.Locale;
import java.util.Map;

public class TerrainStatsReport {

    private static final Logger LOGGER = LoggerFactory.getLogger(TerrainStatsReport.class);

    public static void print(TerrainStats s) {
        if (!LOGGER.isInfoEnabled()) return;
        LOGGER.info("========= TERRAIN STATS =========");
        LOGGER.info("Seed: {}  Dimension: {}x{}", s.seed, s.dimension, s.dimension);
        LOGGER.info("Elevation: min={} max={} avg={}", fmt(s.elevationMin), fmt(s.elevationMax), fmt(s.elevationAvg));

        for (Map.Entry<LayerKind, Map<Category, Integer>> layer : s.categoryCounts.entrySet()) {
            StringBuilder sb = new StringBuilder();
            for (Map.Entry<Category, Integer> e : layer.getValue().entrySet()) {
                if (sb.length() > 0) sb.append(", ");
                sb.append(e.getKey().name()).append('=').append(e.getValue());
            }
            LOGGER.info("{} : {}", pad(layer.getKey()), sb);
        }

        LOGGER.info("Tiles : {}", s.tileCounts);
        LOGGER.info("Rivers: {} (ends {}), longest={}", s.riverCount, s.riverEnds, s.longestRiver);
        LOGGER.info("Cities: {}  Roads: {}", s.cityCount, s.roadCount);
        if (s.warningCount > 0) {
            LOGGER.info("Recovered placement failures: {}", s.warningCount);
        }
        LOGGER.info("=================================");
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    private static String pad(Object o) {
        String s = String.valueOf(o);
        if (s.length() >= 6) return s;
        return s + " ".repeat(6 - s.length());
    }
}
