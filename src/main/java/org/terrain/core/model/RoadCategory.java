package org.terrain.core.model;

public enum RoadCategory implements Category {
    NONE(0),
    ROAD(1),
    /** Road cell laid over a straight river run. */
    BRIDGE(2);

    private final int code;

    RoadCategory(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }

    public boolean isRoad() {
        return this != NONE;
    }
}
