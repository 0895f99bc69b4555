package org.terrain.core.model;

public enum SeaCategory implements Category {
    LAND(0),
    WATER(1);

    private final int code;

    SeaCategory(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
