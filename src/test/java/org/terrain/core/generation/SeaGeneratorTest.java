package org.terrain.core.generation;

import org.junit.jupiter.api.Test;
import org.terrain.core.model.Category;
import org.terrain.core.model.Grid;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeaGeneratorTest {

    private final SeaGenerator generator = new SeaGenerator(GeneratorSettings.defaults());

    @Test
    void onlyLargeBorderConnectedLowlandBecomesSea() {
        HeightMap h = TerrainFixtures.heightMap(8, (x, y) -> {
            if (x <= 2) return 0.1;                        // open coast, 24 cells
            if (x == 5 && (y == 3 || y == 4)) return 0.1;  // enclosed basin
            if (x == 7 && y == 7) return 0.1;              // single low corner
            return 0.6;
        });

        TerrainLayer sea = generator.generate(h, Map.of(), RandomSource.seed(1));

        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                SeaCategory expected = x <= 2 ? SeaCategory.WATER : SeaCategory.LAND;
                assertEquals(expected, sea.category(x, y), "(" + x + ", " + y + ")");
            }
        }
    }

    @Test
    void landStripOneCellWideBetweenSeasIsFlooded() {
        HeightMap strip = TerrainFixtures.heightMap(8, (x, y) -> x == 3 ? 0.6 : 0.1);
        assertEquals(64, generator.generate(strip, Map.of(), RandomSource.seed(1)).categories().count(SeaCategory.WATER));

        HeightMap isthmus = TerrainFixtures.heightMap(8, (x, y) -> x == 3 || x == 4 ? 0.6 : 0.1);
        TerrainLayer sea = generator.generate(isthmus, Map.of(), RandomSource.seed(1));
        assertEquals(16, sea.categories().count(SeaCategory.LAND));
        assertEquals(SeaCategory.LAND, sea.category(3, 0));
    }

    @Test
    void seaLevelIsInclusive() {
        GeneratorSettings s = GeneratorSettings.defaults();
        s.seaLevel = 0.5;
        s.minSeaSize = 1;
        HeightMap h = TerrainFixtures.heightMap(4, (x, y) -> x == 0 ? 0.5 : 0.75);
        TerrainLayer sea = new SeaGenerator(s).generate(h, Map.of(), RandomSource.seed(1));
        assertEquals(4, sea.categories().count(SeaCategory.WATER));
    }

    @Test
    void noLowlandNoSea() {
        HeightMap h = TerrainFixtures.heightMap(6, (x, y) -> 0.9);
        TerrainLayer sea = generator.generate(h, Map.of(), RandomSource.seed(1));
        assertEquals(36, sea.categories().count(SeaCategory.LAND));
    }

    @Test
    void generatedSeaAlwaysReachesTheBorder() {
        for (long seed = 0; seed < 20; seed++) {
            HeightMap h = new HeightMapGenerator(GeneratorSettings.defaults()).generate(33, RandomSource.seed(seed));
            TerrainLayer sea = generator.generate(h, Map.of(), RandomSource.seed(seed));
            Grid<Category> g = sea.categories();
            for (int[] body : GridSegments.components(33, i -> g.get(i) == SeaCategory.WATER)) {
                boolean open = false;
                for (int c : body) {
                    open |= GridSegments.isBorder(33, c % 33, c / 33);
                }
                assertTrue(open, "seed " + seed + ": enclosed sea body");
                assertTrue(body.length >= GeneratorSettings.defaults().minSeaSize);
            }
        }
    }

    @Test
    void kindIsSea() {
        assertEquals(LayerKind.SEA, generator.kind());
    }
}
