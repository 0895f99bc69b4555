package org.terrain.core.generation;

import org.terrain.core.model.LayerKind;

public enum StageId {
    HEIGHTMAP(null),
    SEA(LayerKind.SEA),
    RIVERS(LayerKind.RIVER),
    BIOMES(LayerKind.BIOME),
    CITIES(LayerKind.CITY),
    ROADS(LayerKind.ROAD);

    private final LayerKind layer;

    StageId(LayerKind layer) {
        this.layer = layer;
    }

    /** Layer produced by this stage, null for the heightmap. */
    public LayerKind layer() {
        return layer;
    }
}
