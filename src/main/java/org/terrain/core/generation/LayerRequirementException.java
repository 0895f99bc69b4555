package org.terrain.core.generation;

import org.terrain.core.model.LayerKind;

public class LayerRequirementException extends IllegalStateException {

    public LayerRequirementException(LayerKind kind, LayerKind missing) {
        super("Requirement " + missing + " not satisfied for layer " + kind);
    }
}
