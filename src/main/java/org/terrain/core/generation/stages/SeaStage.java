package org.terrain.core.generation.stages;

import org.terrain.core.generation.SeaGenerator;
import org.terrain.core.generation.GenerationStage;
import org.terrain.core.generation.StageId;
import org.terrain.core.generation.TerrainContext;

public class SeaStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.SEA;
    }

    @Override
    public String name() {
        return "Sea";
    }

    @Override
    public void apply(TerrainContext ctx) {
        ctx.buildLayer(new SeaGenerator(ctx.settings));
    }
}
