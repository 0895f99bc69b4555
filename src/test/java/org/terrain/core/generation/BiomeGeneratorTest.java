package org.terrain.core.generation;

import org.junit.jupiter.api.Test;
import org.terrain.core.model.BiomeCategory;
import org.terrain.core.model.Category;
import org.terrain.core.model.Grid;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.RiverCategory;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BiomeGeneratorTest {

    private final GeneratorSettings settings = GeneratorSettings.defaults();
    private final BiomeGenerator generator = new BiomeGenerator(settings);

    @Test
    void classificationOrder() {
        assertEquals(BiomeCategory.WATER, generator.classify(0.95, true, true, 0));
        assertEquals(BiomeCategory.MOUNTAIN, generator.classify(settings.mountainLevel, false, true, 0));
        assertEquals(BiomeCategory.HILLS, generator.classify(settings.mountainLevel - settings.biomeBand, false, true, 1));
        assertEquals(BiomeCategory.BEACH, generator.classify(0.4, false, true, 1));
        assertEquals(BiomeCategory.FOREST, generator.classify(0.4, false, false, settings.forestWaterReach));
        assertEquals(BiomeCategory.PLAINS, generator.classify(settings.plainsCeiling, false, false, 3));
        assertEquals(BiomeCategory.DESERT, generator.classify(0.6, false, false, GridSegments.FAR));
    }

    @Test
    void riverBanksGrowForestAndSmallPatchesRevertToPlains() {
        int dim = 12;
        HeightMap h = TerrainFixtures.heightMap(dim, (x, y) -> 0.5);
        TerrainLayer sea = TerrainFixtures.layer(LayerKind.SEA, dim, (x, y) -> SeaCategory.LAND);
        // long river along row 8, and one isolated wet cell far away
        TerrainLayer river = TerrainFixtures.layer(LayerKind.RIVER, dim,
                (x, y) -> (y == 8) || (x == 11 && y == 0) ? RiverCategory.WATER : RiverCategory.DRY);

        TerrainLayer biome = generator.generate(h, Map.of(LayerKind.SEA, sea, LayerKind.RIVER, river),
                RandomSource.seed(1));

        assertEquals(BiomeCategory.WATER, biome.category(3, 8));
        assertEquals(BiomeCategory.FOREST, biome.category(3, 7));
        assertEquals(BiomeCategory.FOREST, biome.category(3, 10));
        assertEquals(BiomeCategory.PLAINS, biome.category(3, 5));
        assertEquals(BiomeCategory.PLAINS, biome.category(3, 11));
        assertEquals(BiomeCategory.WATER, biome.category(11, 0));
        // forest around the lone wet cell: 5 cells within reach 2, below minimum size
        assertEquals(BiomeCategory.PLAINS, biome.category(10, 0));
        assertEquals(BiomeCategory.PLAINS, biome.category(11, 1));
    }

    @Test
    void forestBanksOneCellWideRevertToPlains() {
        GeneratorSettings narrow = GeneratorSettings.defaults();
        narrow.forestWaterReach = 1;
        int dim = 12;
        HeightMap h = TerrainFixtures.heightMap(dim, (x, y) -> 0.5);
        TerrainLayer sea = TerrainFixtures.layer(LayerKind.SEA, dim, (x, y) -> SeaCategory.LAND);
        TerrainLayer river = TerrainFixtures.layer(LayerKind.RIVER, dim,
                (x, y) -> y == 8 ? RiverCategory.WATER : RiverCategory.DRY);

        TerrainLayer biome = new BiomeGenerator(narrow).generate(h,
                Map.of(LayerKind.SEA, sea, LayerKind.RIVER, river), RandomSource.seed(1));

        assertEquals(0, biome.categories().count(BiomeCategory.FOREST));
        assertEquals(dim, biome.categories().count(BiomeCategory.WATER));
        assertEquals(BiomeCategory.PLAINS, biome.category(4, 7));
        assertEquals(BiomeCategory.PLAINS, biome.category(4, 9));
    }

    @Test
    void generatedPatchesRespectMinimumSize() {
        for (long seed = 0; seed < 10; seed++) {
            Terrain t = Terrain.generate(seed, 33);
            Grid<Category> g = t.layer(LayerKind.BIOME).categories();
            for (BiomeCategory b : new BiomeCategory[]{BiomeCategory.FOREST, BiomeCategory.DESERT}) {
                for (int[] patch : GridSegments.components(33, i -> g.get(i) == b)) {
                    assertTrue(patch.length >= settings.minBiomeSize, "seed " + seed + ": small " + b + " patch");
                }
            }
            Grid<Category> copy = g.copy();
            assertEquals(0, GridSegments.removeSlivers(copy,
                    c -> c == BiomeCategory.FOREST || c == BiomeCategory.DESERT, BiomeCategory.PLAINS),
                    "seed " + seed + ": one cell wide forest or desert left");
        }
    }
}
