package org.terrain.core.model;

/** Why a traced path stopped. */
public enum PathEnd {
    /** Last cell touches sea water. */
    SEA,
    /** Last cell lies on the map border. */
    MAP_EDGE,
    /** No strictly lower edge neighbor. */
    LOCAL_MINIMUM,
    /** Road reached the destination city. */
    DESTINATION
}
