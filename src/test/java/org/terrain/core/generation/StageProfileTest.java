package org.terrain.core.generation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.terrain.core.model.LayerKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageProfileTest {

    @Test
    void heightmapStageIsAlwaysOn() {
        assertTrue(StageProfile.heightOnly().isEnabled(StageId.HEIGHTMAP));
        assertFalse(StageProfile.heightOnly().isEnabled(StageId.SEA));
    }

    @Test
    void namedProfiles() {
        assertEquals(EnumSet.allOf(LayerKind.class), StageProfile.byName("full").layers());
        assertEquals(EnumSet.of(LayerKind.SEA, LayerKind.RIVER, LayerKind.BIOME),
                StageProfile.byName(" Landforms ").layers());
        assertTrue(StageProfile.byName("height").layers().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> StageProfile.byName("cities"));
    }

    @Test
    void requirementsFollowLayerDependencies() {
        assertDoesNotThrow(() -> StageProfile.full().checkRequirements());
        assertDoesNotThrow(() -> StageProfile.of(List.of(LayerKind.SEA)).checkRequirements());
        LayerRequirementException e = assertThrows(LayerRequirementException.class,
                () -> StageProfile.of(List.of(LayerKind.SEA, LayerKind.BIOME)).checkRequirements());
        assertTrue(e.getMessage().contains("RIVER"));
    }

    @ParameterizedTest
    @EnumSource(LayerKind.class)
    void eachLayerRunsWithItsPrerequisites(LayerKind kind) {
        Set<LayerKind> kinds = EnumSet.copyOf(kind.requires());
        kinds.add(kind);
        StageProfile profile = StageProfile.of(kinds);
        assertDoesNotThrow(profile::checkRequirements);
        for (LayerKind other : LayerKind.values()) {
            assertEquals(kinds.contains(other), profile.layers().contains(other));
        }
    }
}
