package org.terrain.core.generation.stages;

import org.terrain.core.generation.BiomeGenerator;
import org.terrain.core.generation.GenerationStage;
import org.terrain.core.generation.StageId;
import org.terrain.core.generation.TerrainContext;

public class BiomeStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.BIOMES;
    }

    @Override
    public String name() {
        return "Biomes";
    }

    @Override
    public void apply(TerrainContext ctx) {
        ctx.buildLayer(new BiomeGenerator(ctx.settings));
    }
}
