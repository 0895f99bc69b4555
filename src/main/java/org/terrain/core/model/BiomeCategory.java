package org.terrain.core.model;

public enum BiomeCategory implements Category {
    WATER(0),
    BEACH(1),
    PLAINS(2),
    FOREST(3),
    DESERT(4),
    HILLS(5),
    MOUNTAIN(6);

    private final int code;

    BiomeCategory(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
