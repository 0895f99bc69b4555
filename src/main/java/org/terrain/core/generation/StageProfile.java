package org.terrain.core.generation;

import org.terrain.core.model.LayerKind;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which layers a pipeline run generates. The heightmap is always built.
 */
public class StageProfile {
    private final EnumSet<LayerKind> enabled;

    private StageProfile(EnumSet<LayerKind> enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled(StageId id) {
        return id.layer() == null || enabled.contains(id.layer());
    }

    public boolean isEnabled(LayerKind kind) {
        return enabled.contains(kind);
    }

    public Set<LayerKind> layers() {
        return EnumSet.copyOf(enabled);
    }

    /**
     * Fails when an enabled layer needs a layer the profile leaves out.
     */
    public void checkRequirements() {
        for (LayerKind kind : enabled) {
            for (LayerKind req : kind.requires()) {
                if (!enabled.contains(req)) {
                    throw new LayerRequirementException(kind, req);
                }
            }
        }
    }

    public static StageProfile full() {
        return new StageProfile(EnumSet.allOf(LayerKind.class));
    }

    // Natural features only, no settlements
    public static StageProfile landforms() {
        return new StageProfile(EnumSet.of(LayerKind.SEA, LayerKind.RIVER, LayerKind.BIOME));
    }

    public static StageProfile heightOnly() {
        return new StageProfile(EnumSet.noneOf(LayerKind.class));
    }

    public static StageProfile of(Collection<LayerKind> kinds) {
        EnumSet<LayerKind> set = EnumSet.noneOf(LayerKind.class);
        set.addAll(kinds);
        return new StageProfile(set);
    }

    public static StageProfile byName(String name) {
        return switch (name.trim().toLowerCase()) {
            case "full" -> full();
            case "landforms" -> landforms();
            case "height", "heightonly" -> heightOnly();
            default -> throw new IllegalArgumentException("Unknown stage profile: " + name);
        };
    }
}
