package org.terrain.core.generation.stages;

import org.terrain.core.generation.RoadGenerator;
import org.terrain.core.generation.GenerationStage;
import org.terrain.core.generation.StageId;
import org.terrain.core.generation.TerrainContext;

public class RoadStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.ROADS;
    }

    @Override
    public String name() {
        return "Roads";
    }

    @Override
    public void apply(TerrainContext ctx) {
        ctx.buildLayer(new RoadGenerator(ctx.settings));
    }
}
