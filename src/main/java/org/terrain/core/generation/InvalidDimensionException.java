package org.terrain.core.generation;

public class InvalidDimensionException extends IllegalArgumentException {

    public InvalidDimensionException(int dimension, int max) {
        super("Invalid terrain dimension " + dimension + ", expected 1.." + max);
    }
}
