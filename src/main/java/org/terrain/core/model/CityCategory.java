package org.terrain.core.model;

public enum CityCategory implements Category {
    NONE(0),
    CITY(1);

    private final int code;

    CityCategory(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
