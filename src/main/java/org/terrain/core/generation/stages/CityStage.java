package org.terrain.core.generation.stages;

import org.terrain.core.generation.CityGenerator;
import org.terrain.core.generation.GenerationStage;
import org.terrain.core.generation.StageId;
import org.terrain.core.generation.TerrainContext;

public class CityStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.CITIES;
    }

    @Override
    public String name() {
        return "Cities";
    }

    @Override
    public void apply(TerrainContext ctx) {
        ctx.buildLayer(new CityGenerator(ctx.settings));
    }
}
