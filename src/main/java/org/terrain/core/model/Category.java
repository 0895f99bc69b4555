package org.terrain.core.model;

/**
 * Cell membership value of one terrain layer. Implemented by the per-layer enums.
 */
public interface Category {

    /** Stable numeric code used by the persisted map format. */
    int code();

    String name();
}
