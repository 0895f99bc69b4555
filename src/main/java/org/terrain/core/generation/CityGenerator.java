package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.model.BiomeCategory;
import org.terrain.core.model.Category;
import org.terrain.core.model.CityCategory;
import org.terrain.core.model.Grid;
import org.terrain.core.model.GridPoint;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.RiverCategory;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Places cities on flat, habitable land. Cells next to a river or the coast are weighted up,
 * desert is weighted down. Sites keep a minimum distance from each other.
 */
public class CityGenerator implements LayerGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CityGenerator.class);

    // candidate weights in tenths
    private static final int BASE_WEIGHT = 10;
    private static final int RIVER_BONUS = 30;
    private static final int COAST_BONUS = 30;
    private static final int DESERT_MALUS = 9;

    private final GeneratorSettings settings;

    public CityGenerator(GeneratorSettings settings) {
        this.settings = settings;
    }

    @Override
    public LayerKind kind() {
        return LayerKind.CITY;
    }

    @Override
    public TerrainLayer generate(HeightMap heightMap, Map<LayerKind, TerrainLayer> priorLayers, RandomSource random) {
        int dim = heightMap.dimension();
        Grid<Category> sea = priorLayers.get(LayerKind.SEA).categories();
        Grid<Category> river = priorLayers.get(LayerKind.RIVER).categories();
        Grid<Category> biome = priorLayers.get(LayerKind.BIOME).categories();

        int[] landMass = landMassSizes(sea);
        List<GridPoint> candidates = new ArrayList<>();
        List<Integer> weights = new ArrayList<>();
        int[] candidateAt = new int[dim * dim];
        Arrays.fill(candidateAt, -1);
        for (int y = 0; y < dim; y++) {
            for (int x = 0; x < dim; x++) {
                int i = y * dim + x;
                if (!isHabitable(heightMap, sea, river, biome, x, y)) continue;
                if (landMass[i] < settings.minPopSupportSize) continue;
                candidateAt[i] = candidates.size();
                candidates.add(new GridPoint(x, y));
                weights.add(weight(sea, river, biome, x, y));
            }
        }
        if (candidates.isEmpty()) {
            throw new LayerConstraintUnsatisfiedException(LayerKind.CITY, "no habitable cell for a city");
        }

        int target = Math.min(candidates.size(),
                Math.max(settings.minCities, (int) (candidates.size() * settings.cityDensity)));
        int minDistance = minDistance(dim);

        WeightTree tree = new WeightTree(weights);
        List<GridPoint> sites = new ArrayList<>();
        while (sites.size() < target && tree.total() > 0) {
            int pick = tree.find((long) (random.nextDouble() * tree.total()));
            GridPoint site = candidates.get(pick);
            sites.add(site);
            dropCandidatesNear(site, minDistance, dim, candidateAt, tree);
        }
        if (sites.size() < target) {
            LOGGER.debug("Cities: placed {} of {} (min distance {})", sites.size(), target, minDistance);
        }

        Grid<Category> grid = Grid.filled(dim, CityCategory.NONE);
        for (GridPoint s : sites) {
            grid.set(s.x(), s.y(), CityCategory.CITY);
        }
        return new TerrainLayer(LayerKind.CITY, grid, List.of(), sites);
    }

    /** Candidates this close (euclidean, inclusive) to an accepted city are dropped. */
    int minDistance(int dimension) {
        int d = dimension / settings.cityClosenessFactor;
        return Math.max(settings.minCityDistance, Math.min(settings.maxCityDisallowRadius, d));
    }

    private boolean isHabitable(HeightMap heightMap, Grid<Category> sea, Grid<Category> river,
                                Grid<Category> biome, int x, int y) {
        if (sea.get(x, y) == SeaCategory.WATER || river.get(x, y) == RiverCategory.WATER) return false;
        Category b = biome.get(x, y);
        if (b == BiomeCategory.FOREST || b == BiomeCategory.MOUNTAIN || b == BiomeCategory.WATER) return false;
        return heightMap.gradient(x, y).magnitude() <= settings.maxCitySlope;
    }

    private int weight(Grid<Category> sea, Grid<Category> river, Grid<Category> biome, int x, int y) {
        int w = BASE_WEIGHT;
        if (GridSegments.touches8(river, x, y, RiverCategory.WATER)) w += RIVER_BONUS;
        if (GridSegments.touches8(sea, x, y, SeaCategory.WATER)) w += COAST_BONUS;
        if (biome.get(x, y) == BiomeCategory.DESERT) w -= DESERT_MALUS;
        return w;
    }

    private static int[] landMassSizes(Grid<Category> sea) {
        int dim = sea.dimension();
        int[] sizes = new int[dim * dim];
        for (int[] mass : GridSegments.components(dim, i -> sea.get(i) != SeaCategory.WATER)) {
            for (int c : mass) {
                sizes[c] = mass.length;
            }
        }
        return sizes;
    }

    /** Removes every candidate within {@code minDistance} of {@code site}, the site included. */
    private static void dropCandidatesNear(GridPoint site, int minDistance, int dim, int[] candidateAt,
                                           WeightTree tree) {
        for (int y = Math.max(0, site.y() - minDistance); y <= Math.min(dim - 1, site.y() + minDistance); y++) {
            for (int x = Math.max(0, site.x() - minDistance); x <= Math.min(dim - 1, site.x() + minDistance); x++) {
                int c = candidateAt[y * dim + x];
                if (c < 0) continue;
                if (site.distanceTo(new GridPoint(x, y)) > minDistance) continue;
                tree.clear(c);
                candidateAt[y * dim + x] = -1;
            }
        }
    }

    /**
     * Fenwick tree over the candidate weights: weighted picks and removals in log time.
     */
    static final class WeightTree {
        private final long[] tree;
        private final long[] weights;
        private long total;

        WeightTree(List<Integer> weights) {
            int n = weights.size();
            this.tree = new long[n + 1];
            this.weights = new long[n];
            for (int i = 0; i < n; i++) {
                add(i, weights.get(i));
            }
        }

        long total() {
            return total;
        }

        void clear(int index) {
            add(index, -weights[index]);
        }

        /** Index of the candidate whose weight interval holds {@code r}, 0 <= r < total. */
        int find(long r) {
            int pos = 0;
            long rest = r;
            for (int step = Integer.highestOneBit(weights.length); step > 0; step >>= 1) {
                int next = pos + step;
                if (next <= weights.length && tree[next] <= rest) {
                    pos = next;
                    rest -= tree[next];
                }
            }
            return pos;
        }

        private void add(int index, long delta) {
            weights[index] += delta;
            total += delta;
            for (int i = index + 1; i < tree.length; i += i & -i) {
                tree[i] += delta;
            }
        }
    }
}
