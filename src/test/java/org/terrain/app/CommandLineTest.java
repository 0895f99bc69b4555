package org.terrain.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineTest {

    @Test
    void positionalArgsSkipOptionValues() {
        String[] args = {"--profile", "landforms", "7", "--verify", "32", "--out", "x.json"};
        assertEquals(List.of("7", "32"), TerrainMain.collectPositionalArgs(args));
        assertEquals("landforms", TerrainMain.findOptionValue(args, "--profile"));
        assertNull(TerrainMain.findOptionValue(args, "--dim"));
        assertTrue(TerrainMain.hasFlag(args, "--verify"));
        assertFalse(TerrainMain.hasFlag(args, "--dump"));
    }

    @Test
    void pickFallsBackOnBlank() {
        assertEquals("full", TerrainMain.pick(null, "full"));
        assertEquals("full", TerrainMain.pick("  ", "full"));
        assertEquals("height", TerrainMain.pick(" height ", "full"));
    }

    @Test
    void sanitizeKeepsLogOnOneLine() {
        assertEquals("a b", BatchMain.sanitizeLogMessage("a\nb\r"));
        assertEquals("", BatchMain.sanitizeLogMessage(null));
    }

    @Test
    void batchWritesOneFilePerSeed(@TempDir Path dir) throws Exception {
        BatchMain.main(new String[]{"3", "4", "--dim", "8", "--out-dir", dir.toString(), "--seed-only"});

        assertTrue(Files.exists(dir.resolve("terrain_3_8.json")));
        assertTrue(Files.exists(dir.resolve("terrain_4_8.json")));
        String log = Files.readString(dir.resolve("batch_generation.log"), StandardCharsets.UTF_8);
        assertTrue(log.contains("[BATCH_START]"));
        assertTrue(log.contains("ok=2 fail=0"));
    }

    @Test
    void singleRunWritesDumpToFile(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("sub").resolve("t.txt");
        TerrainMain.main(new String[]{"5", "8", "--dump", "--out", out.toString()});

        String text = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(text.startsWith("seed 5\ndim 8\nheightmap\n"));
    }
}
