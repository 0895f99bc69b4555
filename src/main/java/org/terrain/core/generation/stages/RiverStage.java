package org.terrain.core.generation.stages;

import org.terrain.core.generation.RiverGenerator;
import org.terrain.core.generation.GenerationStage;
import org.terrain.core.generation.StageId;
import org.terrain.core.generation.TerrainContext;

public class RiverStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.RIVERS;
    }

    @Override
    public String name() {
        return "Rivers";
    }

    @Override
    public void apply(TerrainContext ctx) {
        ctx.buildLayer(new RiverGenerator(ctx.settings));
    }
}
