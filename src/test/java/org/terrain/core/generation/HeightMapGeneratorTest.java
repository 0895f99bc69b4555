package org.terrain.core.generation;

import org.junit.jupiter.api.Test;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.config.GeneratorSettings;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HeightMapGeneratorTest {

    private final HeightMapGenerator generator = new HeightMapGenerator(GeneratorSettings.defaults());

    @Test
    void workingSizeIsSmallestPowerOfTwoPlusOne() {
        assertEquals(2, HeightMapGenerator.workingSize(1));
        assertEquals(2, HeightMapGenerator.workingSize(2));
        assertEquals(3, HeightMapGenerator.workingSize(3));
        assertEquals(5, HeightMapGenerator.workingSize(4));
        assertEquals(17, HeightMapGenerator.workingSize(16));
        assertEquals(17, HeightMapGenerator.workingSize(17));
        assertEquals(33, HeightMapGenerator.workingSize(18));
    }

    @Test
    void valuesAreStretchedToUnitRange() {
        for (int dim : new int[]{2, 5, 16, 40}) {
            HeightMap h = generator.generate(dim, RandomSource.seed(dim));
            assertEquals(dim, h.dimension());
            assertEquals(0f, h.min());
            assertEquals(1f, h.max());
        }
    }

    @Test
    void singleCellIsFlat() {
        HeightMap h = generator.generate(1, RandomSource.seed(0));
        assertEquals(0f, h.elevation(0, 0));
    }

    @Test
    void sameRandomSequenceSameField() {
        float[] a = generator.generate(33, RandomSource.seed(77)).toArray();
        float[] b = generator.generate(33, RandomSource.seed(77)).toArray();
        assertArrayEquals(a, b);
    }

    @Test
    void consumesRandomnessOnlyFromTheGivenSource() {
        RandomSource r = RandomSource.seed(3);
        generator.generate(17, r);
        // 4 corners, then one square and four diamond draws per sub-square over 1 + 4 + 16 + 64 sub-squares
        assertEquals(4 + 5 * (1 + 4 + 16 + 64), r.draws());
    }
}
