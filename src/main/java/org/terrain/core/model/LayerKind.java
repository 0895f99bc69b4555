package org.terrain.core.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Terrain layer variants, declared in generation order: every kind only depends on kinds declared before it.
 */
public enum LayerKind {
    SEA,
    RIVER,
    BIOME,
    CITY,
    ROAD;

    private static final List<LayerKind> DRAW_ORDER = List.of(SEA, RIVER, BIOME, ROAD, CITY);

    /** Layers that must be generated before this one. */
    public Set<LayerKind> requires() {
        return switch (this) {
            case SEA -> EnumSet.noneOf(LayerKind.class);
            case RIVER -> EnumSet.of(SEA);
            case BIOME -> EnumSet.of(SEA, RIVER);
            case CITY -> EnumSet.of(SEA, RIVER, BIOME);
            case ROAD -> EnumSet.of(SEA, RIVER, BIOME, CITY);
        };
    }

    /** Category of every cell in a layer that placed nothing. */
    public Category emptyCategory() {
        return switch (this) {
            case SEA -> SeaCategory.LAND;
            case RIVER -> RiverCategory.DRY;
            case BIOME -> BiomeCategory.PLAINS;
            case CITY -> CityCategory.NONE;
            case ROAD -> RoadCategory.NONE;
        };
    }

    public Category[] categories() {
        return switch (this) {
            case SEA -> SeaCategory.values();
            case RIVER -> RiverCategory.values();
            case BIOME -> BiomeCategory.values();
            case CITY -> CityCategory.values();
            case ROAD -> RoadCategory.values();
        };
    }

    public Category categoryOf(int code) {
        for (Category c : categories()) {
            if (c.code() == code) return c;
        }
        throw new IllegalArgumentException("Unknown " + this + " category code: " + code);
    }

    /** Order in which a renderer stacks the layers. */
    public static List<LayerKind> drawOrder() {
        return DRAW_ORDER;
    }
}
