package org.terrain.core.generation.stages;

import org.terrain.core.generation.GenerationStage;
import org.terrain.core.generation.HeightMapGenerator;
import org.terrain.core.generation.StageId;
import org.terrain.core.generation.TerrainContext;


public class HeightMapStage implements GenerationStage {

    @Override
    public String name() {
        return "HeightMap";
    }

    @Override
    public void apply(TerrainContext ctx) {
        // first consumer of ctx.random, every later draw depends on this one
        ctx.heightMap = new HeightMapGenerator(ctx.settings).generate(ctx.dimension, ctx.random);
    }

    @Override
    public StageId id() {
        return StageId.HEIGHTMAP;
    }

}
