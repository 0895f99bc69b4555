package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.model.Category;
import org.terrain.core.model.Direction;
import org.terrain.core.model.Grid;
import org.terrain.core.model.GridPath;
import org.terrain.core.model.GridPoint;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.PathEnd;
import org.terrain.core.model.RiverCategory;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rivers run from randomly picked mountain cells down the steepest edge neighbor until they touch
 * the sea, reach the map border or get stuck in a local minimum.
 *
 * Only strictly lower neighbors are followed, so a path can never revisit a cell.
 * Equal drops go to the first neighbor in N, E, S, W order.
 */
public class RiverGenerator implements LayerGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RiverGenerator.class);

    private final GeneratorSettings settings;

    public RiverGenerator(GeneratorSettings settings) {
        this.settings = settings;
    }

    @Override
    public LayerKind kind() {
        return LayerKind.RIVER;
    }

    @Override
    public TerrainLayer generate(HeightMap heightMap, Map<LayerKind, TerrainLayer> priorLayers, RandomSource random) {
        int dim = heightMap.dimension();
        Grid<Category> sea = priorLayers.get(LayerKind.SEA).categories();

        List<GridPoint> mountains = new ArrayList<>();
        for (int y = 0; y < dim; y++) {
            for (int x = 0; x < dim; x++) {
                if (heightMap.elevation(x, y) >= settings.mountainLevel && sea.get(x, y) != SeaCategory.WATER) {
                    mountains.add(new GridPoint(x, y));
                }
            }
        }
        if (mountains.isEmpty()) {
            throw new LayerConstraintUnsatisfiedException(LayerKind.RIVER,
                    "no mountain cells for river sources");
        }

        int sources = sourceCount(mountains.size());
        random.shuffle(mountains);

        Grid<Category> grid = Grid.filled(dim, RiverCategory.DRY);
        List<GridPath> paths = new ArrayList<>();
        for (GridPoint src : mountains.subList(0, sources)) {
            if (grid.get(src.x(), src.y()) == RiverCategory.WATER) {
                LOGGER.debug("River source ({}, {}) already on a river, skipped", src.x(), src.y());
                continue;
            }
            GridPath path = trace(src, heightMap, sea);
            for (GridPoint p : path.cells()) {
                grid.set(p.x(), p.y(), RiverCategory.WATER);
            }
            paths.add(path);
            LOGGER.debug("River from ({}, {}) length={} end={}", src.x(), src.y(), path.length(), path.end());
        }
        return new TerrainLayer(LayerKind.RIVER, grid, paths, List.of());
    }

    int sourceCount(int mountainCells) {
        int n = (int) (mountainCells * settings.riverDensity);
        if (n < settings.minRiverSources) {
            n = Math.min(mountainCells, settings.minRiverSources);
        }
        return Math.min(n, settings.maxRiverSources);
    }

    GridPath trace(GridPoint source, HeightMap heightMap, Grid<Category> sea) {
        int dim = heightMap.dimension();
        List<GridPoint> cells = new ArrayList<>();
        GridPoint cur = source;
        while (true) {
            cells.add(cur);
            if (GridSegments.touches4(sea, cur.x(), cur.y(), SeaCategory.WATER)) {
                return new GridPath(cells, PathEnd.SEA);
            }
            if (GridSegments.isBorder(dim, cur.x(), cur.y())) {
                return new GridPath(cells, PathEnd.MAP_EDGE);
            }
            GridPoint next = steepestDescent(cur, heightMap);
            if (next == null) {
                return new GridPath(cells, PathEnd.LOCAL_MINIMUM);
            }
            cur = next;
        }
    }

    /** Lowest strictly-lower edge neighbor, null at a local minimum. */
    static GridPoint steepestDescent(GridPoint p, HeightMap heightMap) {
        double here = heightMap.elevation(p);
        GridPoint best = null;
        double bestDrop = 0.0;
        for (Direction d : Direction.values()) {
            GridPoint n = p.step(d);
            if (!heightMap.inBounds(n.x(), n.y())) continue;
            double drop = here - heightMap.elevation(n);
            if (drop > bestDrop) {
                bestDrop = drop;
                best = n;
            }
        }
        return best;
    }
}
