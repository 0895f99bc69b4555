package org.terrain.core.model;

public enum RiverCategory implements Category {
    DRY(0),
    WATER(1);

    private final int code;

    RiverCategory(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
