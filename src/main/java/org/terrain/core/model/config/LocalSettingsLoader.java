package org.terrain.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Reads generator overrides from {@code local/terrain.local.properties} (keys {@code terrain.<field>}).
 * The path can be replaced with {@code -Dterrain.config.path} or {@code TERRAIN_CONFIG_PATH}.
 */
public final class LocalSettingsLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "terrain.local.properties");

    private LocalSettingsLoader() {
    }

    public static void apply(GeneratorSettings settings) {
        Path path = resolvePath();
        if (!Files.exists(path)) {
            return;
        }
        apply(settings, path);
    }

    public static void apply(GeneratorSettings settings, Path path) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local terrain config: " + path.toAbsolutePath(), e);
        }
        settings.applyOverrides(key -> props.getProperty("terrain." + key));
    }

    static Path resolvePath() {
        String override = pick(
                System.getProperty("terrain.config.path"),
                System.getenv("TERRAIN_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
