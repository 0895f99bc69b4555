package org.terrain.core.generation;

public interface GenerationStage {
    StageId id();
    String name();
    void apply(TerrainContext ctx);
}
