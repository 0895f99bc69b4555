package org.terrain.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.terrain.core.generation.GenerationPipeline;
import org.terrain.core.generation.NonDeterminismException;
import org.terrain.core.io.TerrainSerializer;
import org.terrain.core.io.TerrainTextDump;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.config.GeneratorSettings;

public class TerrainGenerationService {

    private final GenerationPipeline pipeline;

    public TerrainGenerationService(GenerationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Terrain generate(long seed, int dimension, GeneratorSettings settings) {
        return pipeline.run(seed, dimension, settings);
    }

    /**
     * Generates twice and fails with {@link NonDeterminismException} unless both runs agree on every value.
     */
    public Terrain generateVerified(long seed, int dimension, GeneratorSettings settings) {
        Terrain first = pipeline.run(seed, dimension, settings);
        Terrain second = pipeline.run(seed, dimension, settings);
        verifySame(first, second);
        return first;
    }

    static void verifySame(Terrain first, Terrain second) {
        String a = TerrainTextDump.dump(first);
        String b = TerrainTextDump.dump(second);
        if (a.equals(b)) {
            return;
        }
        String[] la = a.split("\n", -1);
        String[] lb = b.split("\n", -1);
        int n = Math.min(la.length, lb.length);
        int line = 0;
        while (line < n && la[line].equals(lb[line])) line++;
        throw new NonDeterminismException(first.seed(), first.dimension(),
                "runs differ at dump line " + (line + 1));
    }

    public String encode(Terrain terrain, TerrainSerializer.Mode mode) throws JsonProcessingException {
        return TerrainSerializer.toJson(terrain, mode);
    }

    public Terrain decode(String json) throws JsonProcessingException {
        return TerrainSerializer.fromJson(json);
    }
}
