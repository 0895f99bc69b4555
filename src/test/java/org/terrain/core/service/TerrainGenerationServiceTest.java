package org.terrain.core.service;

import org.junit.jupiter.api.Test;
import org.terrain.core.generation.GenerationPipeline;
import org.terrain.core.generation.NonDeterminismException;
import org.terrain.core.io.TerrainSerializer;
import org.terrain.core.io.TerrainTextDump;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.config.GeneratorSettings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TerrainGenerationServiceTest {

    private final TerrainGenerationService service = new TerrainGenerationService(new GenerationPipeline());

    @Test
    void verifiedGenerationMatchesPlainGeneration() {
        Terrain verified = service.generateVerified(21, 24, GeneratorSettings.defaults());
        Terrain plain = service.generate(21, 24, GeneratorSettings.defaults());
        assertEquals(TerrainTextDump.dump(plain), TerrainTextDump.dump(verified));
    }

    @Test
    void differingRunsAreReported() {
        Terrain a = service.generate(1, 12, GeneratorSettings.defaults());
        Terrain b = service.generate(2, 12, GeneratorSettings.defaults());
        NonDeterminismException e = assertThrows(NonDeterminismException.class,
                () -> TerrainGenerationService.verifySame(a, b));
        assertTrue(e.getMessage().contains("seed=1"));
    }

    @Test
    void encodeDecode() throws Exception {
        Terrain t = service.generate(6, 12, GeneratorSettings.defaults());
        Terrain back = service.decode(service.encode(t, TerrainSerializer.Mode.MATERIALIZED));
        assertEquals(TerrainTextDump.dump(t), TerrainTextDump.dump(back));
    }
}
