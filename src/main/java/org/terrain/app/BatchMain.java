package org.terrain.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.generation.GenerationPipeline;
import org.terrain.core.generation.LoggingStageListener;
import org.terrain.core.generation.StageProfile;
import org.terrain.core.io.TerrainSerializer;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.config.GeneratorSettings;
import org.terrain.core.service.TerrainGenerationService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/**
 * Generates a range of seeds into one JSON file each.
 *
 * <pre>
 * BatchMain [fromSeed] [toSeed] [--dim N] [--profile name] [--out-dir dir] [--batch-log file] [--seed-only]
 * </pre>
 */
public class BatchMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchMain.class);

    public static void main(String[] args) throws IOException {
        long from = 1;
        long to = 10;
        List<String> positional = TerrainMain.collectPositionalArgs(args);
        if (positional.size() >= 1) from = Long.parseLong(positional.get(0));
        if (positional.size() >= 2) to = Long.parseLong(positional.get(1));

        int dimension = Integer.parseInt(TerrainMain.pick(TerrainMain.findOptionValue(args, "--dim"), "64"));
        String profileName = TerrainMain.pick(TerrainMain.findOptionValue(args, "--profile"), "full");
        Path outDir = Paths.get(TerrainMain.pick(TerrainMain.findOptionValue(args, "--out-dir"), "terrains"));
        Path batchLog = Paths.get(TerrainMain.pick(TerrainMain.findOptionValue(args, "--batch-log"),
                outDir.resolve("batch_generation.log").toString()));
        TerrainSerializer.Mode mode = TerrainMain.hasFlag(args, "--seed-only")
                ? TerrainSerializer.Mode.SEED_ONLY
                : TerrainSerializer.Mode.MATERIALIZED;

        Files.createDirectories(outDir);
        GeneratorSettings settings = GeneratorSettings.fromEnvironment();
        TerrainGenerationService service = new TerrainGenerationService(new GenerationPipeline(
                StageProfile.byName(profileName), true, new LoggingStageListener()));

        long batchStartMs = System.currentTimeMillis();
        int ok = 0;
        int fail = 0;
        appendBatchLog(batchLog, "[BATCH_START] from=" + from + " to=" + to
                + " dim=" + dimension + " profile=" + profileName + " mode=" + mode);
        for (long seed = from; seed <= to; seed++) {
            long startMs = System.currentTimeMillis();
            try {
                Terrain terrain = service.generate(seed, dimension, settings);
                String json = service.encode(terrain, mode);
                Path file = outDir.resolve("terrain_" + seed + "_" + dimension + ".json");
                Files.writeString(file, json, StandardCharsets.UTF_8);
                ok++;
                appendBatchLog(batchLog, "[TERRAIN_OK] seed=" + seed
                        + " warnings=" + terrain.warnings().size()
                        + " bytes=" + json.length()
                        + " durMs=" + (System.currentTimeMillis() - startMs));
            } catch (Exception ex) {
                fail++;
                LOGGER.error("Failed to generate/save terrain seed={}", seed, ex);
                appendBatchLog(batchLog, "[TERRAIN_FAIL] seed=" + seed
                        + " durMs=" + (System.currentTimeMillis() - startMs)
                        + " msg=" + sanitizeLogMessage(ex.getMessage()));
            }
        }
        appendBatchLog(batchLog, "[BATCH_DONE] from=" + from
                + " to=" + to
                + " ok=" + ok
                + " fail=" + fail
                + " durMs=" + (System.currentTimeMillis() - batchStartMs));
    }

    private static synchronized void appendBatchLog(Path file, String line) {
        String msg = Instant.now() + " " + line + System.lineSeparator();
        try {
            Files.writeString(file, msg, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // the batch log must not stop the run
            LOGGER.warn("Cannot append to batch log {}: {}", file, e.getMessage());
        }
    }

    static String sanitizeLogMessage(String s) {
        if (s == null) return "";
        return s.replace('\n', ' ').replace('\r', ' ').trim();
    }
}
