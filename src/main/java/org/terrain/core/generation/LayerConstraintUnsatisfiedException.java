package org.terrain.core.generation;

import org.terrain.core.model.LayerKind;

/**
 * A layer could not meet its placement rule. The pipeline recovers by installing an empty layer.
 */
public class LayerConstraintUnsatisfiedException extends RuntimeException {

    private final LayerKind kind;

    public LayerConstraintUnsatisfiedException(LayerKind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public LayerKind kind() {
        return kind;
    }
}
