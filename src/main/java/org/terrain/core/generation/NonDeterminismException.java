package org.terrain.core.generation;

/**
 * Two runs with identical inputs produced different maps.
 */
public class NonDeterminismException extends IllegalStateException {

    public NonDeterminismException(long seed, int dimension, String detail) {
        super("Generation is not reproducible for seed=" + seed + " dimension=" + dimension + ": " + detail);
    }
}
