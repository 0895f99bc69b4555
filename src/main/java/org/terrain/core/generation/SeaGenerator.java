package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.model.Category;
import org.terrain.core.model.Grid;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.Map;

/**
 * Sea = low cells (at or below sea level) connected to the map border through other low cells.
 * Enclosed basins stay land, and so do border-connected bodies smaller than {@code minSeaSize}.
 * Land strips one cell wide between two stretches of sea are flooded.
 */
public class SeaGenerator implements LayerGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SeaGenerator.class);

    private final GeneratorSettings settings;

    public SeaGenerator(GeneratorSettings settings) {
        this.settings = settings;
    }

    @Override
    public LayerKind kind() {
        return LayerKind.SEA;
    }

    @Override
    public TerrainLayer generate(HeightMap heightMap, Map<LayerKind, TerrainLayer> priorLayers, RandomSource random) {
        int dim = heightMap.dimension();
        int n = dim * dim;
        boolean[] low = new boolean[n];
        for (int i = 0; i < n; i++) {
            low[i] = heightMap.elevation(i % dim, i / dim) <= settings.seaLevel;
        }

        Grid<Category> grid = Grid.filled(dim, SeaCategory.LAND);
        boolean[] visited = new boolean[n];
        int bodies = 0;
        int dropped = 0;
        for (int y = 0; y < dim; y++) {
            for (int x = 0; x < dim; x++) {
                if (!GridSegments.isBorder(dim, x, y)) continue;
                int i = y * dim + x;
                if (!low[i] || visited[i]) continue;
                int[] body = GridSegments.flood(dim, i, c -> low[c], visited);
                if (body.length < settings.minSeaSize) {
                    dropped++;
                    continue;
                }
                bodies++;
                for (int c : body) {
                    grid.set(c, SeaCategory.WATER);
                }
            }
        }
        int flooded = GridSegments.removeSlivers(grid, c -> c == SeaCategory.LAND, SeaCategory.WATER);
        LOGGER.debug("Sea: {} bodies, {} below minimum size, {} land slivers flooded, {} water cells",
                bodies, dropped, flooded, grid.count(SeaCategory.WATER));
        return new TerrainLayer(LayerKind.SEA, grid);
    }
}
