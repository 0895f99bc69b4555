package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.model.BiomeCategory;
import org.terrain.core.model.Category;
import org.terrain.core.model.Grid;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.RiverCategory;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.List;
import java.util.Map;

/**
 * Assigns a biome per cell from elevation and distance to water. Uses no randomness.
 *
 * Forest and desert come in patches: patches below {@code minBiomeSize} and patch cells only one
 * cell wide fall back to plains.
 */
public class BiomeGenerator implements LayerGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BiomeGenerator.class);

    private final GeneratorSettings settings;

    public BiomeGenerator(GeneratorSettings settings) {
        this.settings = settings;
    }

    @Override
    public LayerKind kind() {
        return LayerKind.BIOME;
    }

    @Override
    public TerrainLayer generate(HeightMap heightMap, Map<LayerKind, TerrainLayer> priorLayers, RandomSource random) {
        int dim = heightMap.dimension();
        Grid<Category> sea = priorLayers.get(LayerKind.SEA).categories();
        Grid<Category> river = priorLayers.get(LayerKind.RIVER).categories();

        int[] waterDist = GridSegments.distanceFrom(dim,
                i -> sea.get(i) == SeaCategory.WATER || river.get(i) == RiverCategory.WATER);

        Grid<Category> grid = new Grid<>(dim);
        for (int y = 0; y < dim; y++) {
            for (int x = 0; x < dim; x++) {
                int i = y * dim + x;
                boolean water = sea.get(i) == SeaCategory.WATER || river.get(i) == RiverCategory.WATER;
                grid.set(i, classify(heightMap.elevation(x, y), water,
                        GridSegments.touches8(sea, x, y, SeaCategory.WATER), waterDist[i]));
            }
        }

        // dropping slivers can leave a patch undersized, so both passes repeat until stable
        int reverted = 0;
        int slivers = 0;
        int dropped;
        do {
            reverted += revertSmallPatches(grid, BiomeCategory.FOREST) + revertSmallPatches(grid, BiomeCategory.DESERT);
            dropped = GridSegments.removeSlivers(grid, BiomeGenerator::isPatchBiome, BiomeCategory.PLAINS);
            slivers += dropped;
        } while (dropped > 0);
        LOGGER.debug("Biomes: {} cells of undersized forest/desert and {} sliver cells reverted to plains",
                reverted, slivers);
        return new TerrainLayer(LayerKind.BIOME, grid);
    }

    BiomeCategory classify(double elevation, boolean water, boolean coastal, int waterDistance) {
        if (water) return BiomeCategory.WATER;
        if (elevation >= settings.mountainLevel) return BiomeCategory.MOUNTAIN;
        if (elevation >= settings.mountainLevel - settings.biomeBand) return BiomeCategory.HILLS;
        if (coastal) return BiomeCategory.BEACH;
        if (waterDistance <= settings.forestWaterReach) return BiomeCategory.FOREST;
        if (elevation <= settings.plainsCeiling) return BiomeCategory.PLAINS;
        return BiomeCategory.DESERT;
    }

    private static boolean isPatchBiome(Category c) {
        return c == BiomeCategory.FOREST || c == BiomeCategory.DESERT;
    }

    private int revertSmallPatches(Grid<Category> grid, BiomeCategory biome) {
        int dim = grid.dimension();
        List<int[]> patches = GridSegments.components(dim, i -> grid.get(i) == biome);
        int reverted = 0;
        for (int[] patch : patches) {
            if (patch.length >= settings.minBiomeSize) continue;
            for (int c : patch) {
                grid.set(c, BiomeCategory.PLAINS);
            }
            reverted += patch.length;
        }
        return reverted;
    }
}
