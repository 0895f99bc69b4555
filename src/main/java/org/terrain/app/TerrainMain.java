package org.terrain.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.generation.GenerationPipeline;
import org.terrain.core.generation.LoggingStageListener;
import org.terrain.core.generation.StageProfile;
import org.terrain.core.io.TerrainSerializer;
import org.terrain.core.io.TerrainTextDump;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.config.GeneratorSettings;
import org.terrain.core.service.TerrainGenerationService;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates one terrain.
 *
 * <pre>
 * TerrainMain [seed] [dimension] [--profile full|landforms|height] [--out file.json]
 *             [--materialized] [--verify] [--dump]
 * </pre>
 * Without --out the JSON goes to stdout. --dump prints the text dump instead of JSON.
 */
public class TerrainMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(TerrainMain.class);

    public static void main(String[] args) throws Exception {
        List<String> positional = collectPositionalArgs(args);
        long seed = positional.size() >= 1 ? Long.parseLong(positional.get(0)) : 42L;
        int dimension = positional.size() >= 2 ? Integer.parseInt(positional.get(1)) : 64;

        String profileName = pick(findOptionValue(args, "--profile"), "full");
        GeneratorSettings settings = GeneratorSettings.fromEnvironment();
        GenerationPipeline pipeline = new GenerationPipeline(
                StageProfile.byName(profileName), true, new LoggingStageListener());
        TerrainGenerationService service = new TerrainGenerationService(pipeline);

        Terrain terrain = hasFlag(args, "--verify")
                ? service.generateVerified(seed, dimension, settings)
                : service.generate(seed, dimension, settings);
        for (String w : terrain.warnings()) {
            LOGGER.warn("[WARN] {}", w);
        }

        String out;
        if (hasFlag(args, "--dump")) {
            out = TerrainTextDump.dump(terrain);
        } else {
            TerrainSerializer.Mode mode = hasFlag(args, "--materialized")
                    ? TerrainSerializer.Mode.MATERIALIZED
                    : TerrainSerializer.Mode.SEED_ONLY;
            out = service.encode(terrain, mode);
        }

        String outFile = findOptionValue(args, "--out");
        if (outFile == null) {
            System.out.println(out);
            return;
        }
        Path path = Paths.get(outFile);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, out, StandardCharsets.UTF_8);
        LOGGER.info("Terrain seed={} dim={} written to {}", seed, dimension, path.toAbsolutePath());
    }

    static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    static boolean hasFlag(String[] args, String flag) {
        for (String a : args) {
            if (flag.equals(a)) return true;
        }
        return false;
    }

    static List<String> collectPositionalArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (isOptionWithValue(token)) {
                i++;
                continue;
            }
            if (token.startsWith("--")) {
                continue;
            }
            out.add(token);
        }
        return out;
    }

    private static boolean isOptionWithValue(String token) {
        return "--profile".equals(token)
                || "--out".equals(token)
                || "--out-dir".equals(token)
                || "--dim".equals(token)
                || "--batch-log".equals(token);
    }

    static String pick(String candidate, String fallback) {
        if (candidate == null) return fallback;
        String trimmed = candidate.trim();
        return trimmed.isEmpty() ? fallback : trimmed;
    }
}
