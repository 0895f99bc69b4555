package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.model.BiomeCategory;
import org.terrain.core.model.Category;
import org.terrain.core.model.Direction;
import org.terrain.core.model.Grid;
import org.terrain.core.model.GridPath;
import org.terrain.core.model.GridPoint;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.PathEnd;
import org.terrain.core.model.RiverCategory;
import org.terrain.core.model.RoadCategory;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Connects random pairs of cities with least-cost roads.
 *
 * Movement cost per cell comes from the biome, plus a penalty for elevation change; cells that
 * already carry a road are cheap. Sea is impassable. A river can only be crossed by a bridge,
 * straight across a straight stretch of it.
 */
public class RoadGenerator implements LayerGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoadGenerator.class);

    private final GeneratorSettings settings;

    public RoadGenerator(GeneratorSettings settings) {
        this.settings = settings;
    }

    @Override
    public LayerKind kind() {
        return LayerKind.ROAD;
    }

    @Override
    public TerrainLayer generate(HeightMap heightMap, Map<LayerKind, TerrainLayer> priorLayers, RandomSource random) {
        int dim = heightMap.dimension();
        List<GridPoint> cities = priorLayers.get(LayerKind.CITY).sites();
        if (cities.size() < 2) {
            throw new LayerConstraintUnsatisfiedException(LayerKind.ROAD,
                    "need at least 2 cities for a road, have " + cities.size());
        }

        CostField field = new CostField(heightMap,
                priorLayers.get(LayerKind.SEA).categories(),
                priorLayers.get(LayerKind.RIVER).categories(),
                priorLayers.get(LayerKind.BIOME).categories());

        Grid<Category> grid = Grid.filled(dim, RoadCategory.NONE);
        List<GridPath> roads = new ArrayList<>();
        int wanted = cities.size() / 2;
        for (int r = 0; r < wanted; r++) {
            int a = random.nextInt(0, cities.size());
            int b = random.nextInt(0, cities.size() - 1);
            if (b >= a) b++;
            GridPoint from = cities.get(a);
            GridPoint to = cities.get(b);

            GridPath road = field.cheapestPath(from, to, grid);
            if (road == null) {
                LOGGER.debug("No road possible between ({}, {}) and ({}, {})", from.x(), from.y(), to.x(), to.y());
                continue;
            }
            for (GridPoint p : road.cells()) {
                boolean onRiver = field.river.get(p.x(), p.y()) == RiverCategory.WATER;
                grid.set(p.x(), p.y(), onRiver ? RoadCategory.BRIDGE : RoadCategory.ROAD);
            }
            roads.add(road);
        }
        if (roads.isEmpty()) {
            throw new LayerConstraintUnsatisfiedException(LayerKind.ROAD, "no pair of cities could be connected");
        }
        LOGGER.debug("Roads: {} of {} built, {} bridge cells", roads.size(), wanted, grid.count(RoadCategory.BRIDGE));
        return new TerrainLayer(LayerKind.ROAD, grid, roads, List.of());
    }

    /** Movement rules over the finished natural layers. */
    final class CostField {
        private final HeightMap heightMap;
        private final Grid<Category> sea;
        private final Grid<Category> river;
        private final Grid<Category> biome;
        private final int dim;

        CostField(HeightMap heightMap, Grid<Category> sea, Grid<Category> river, Grid<Category> biome) {
            this.heightMap = heightMap;
            this.sea = sea;
            this.river = river;
            this.biome = biome;
            this.dim = heightMap.dimension();
        }

        /** Cost of entering a cell, infinite for sea. */
        double cellCost(int x, int y) {
            if (sea.get(x, y) == SeaCategory.WATER) return Double.POSITIVE_INFINITY;
            if (river.get(x, y) == RiverCategory.WATER) return settings.mpBridge;
            Category b = biome.get(x, y);
            double penalty = 0.0;
            if (b == BiomeCategory.DESERT) penalty = settings.mpPenaltyDesert;
            else if (b == BiomeCategory.FOREST) penalty = settings.mpPenaltyForest;
            else if (b == BiomeCategory.HILLS) penalty = settings.mpPenaltyHills;
            else if (b == BiomeCategory.MOUNTAIN) penalty = settings.mpPenaltyMountain;
            return settings.mpBase + penalty;
        }

        /**
         * Axis a bridge over this river cell must follow: horizontal (E) for a north-south run,
         * vertical (N) for an east-west run, null where the river bends, forks or ends.
         */
        Direction bridgeAxis(int x, int y) {
            boolean n = isRiver(x, y - 1);
            boolean e = isRiver(x + 1, y);
            boolean s = isRiver(x, y + 1);
            boolean w = isRiver(x - 1, y);
            if (n && s && !e && !w) return Direction.E;
            if (e && w && !n && !s) return Direction.N;
            return null;
        }

        boolean canMove(int fx, int fy, Direction d) {
            int tx = fx + d.dx;
            int ty = fy + d.dy;
            if (!heightMap.inBounds(tx, ty)) return false;
            if (sea.get(tx, ty) == SeaCategory.WATER) return false;
            if (isRiver(fx, fy) && !alongAxis(bridgeAxis(fx, fy), d)) return false;
            return !isRiver(tx, ty) || alongAxis(bridgeAxis(tx, ty), d);
        }

        double stepCost(int fx, int fy, int tx, int ty, Grid<Category> roads) {
            if (((RoadCategory) roads.get(tx, ty)).isRoad()) {
                return settings.mpRoad;
            }
            double climb = Math.abs((double) heightMap.elevation(tx, ty) - (double) heightMap.elevation(fx, fy));
            return cellCost(tx, ty) + climb * 255.0 * settings.mpPenaltyElevation;
        }

        /** Dijkstra from {@code from} to {@code to}; null when unreachable. */
        GridPath cheapestPath(GridPoint from, GridPoint to, Grid<Category> roads) {
            int n = dim * dim;
            double[] dist = new double[n];
            int[] prev = new int[n];
            Arrays.fill(dist, Double.POSITIVE_INFINITY);
            Arrays.fill(prev, -1);
            int start = from.y() * dim + from.x();
            int end = to.y() * dim + to.x();

            PriorityQueue<Node> open = new PriorityQueue<>(
                    Comparator.comparingDouble(Node::dist).thenComparingInt(Node::index));
            dist[start] = 0.0;
            open.add(new Node(0.0, start));
            while (!open.isEmpty()) {
                Node cur = open.poll();
                if (cur.dist() > dist[cur.index()]) continue;
                if (cur.index() == end) break;
                int x = cur.index() % dim;
                int y = cur.index() / dim;
                for (Direction d : Direction.values()) {
                    if (!canMove(x, y, d)) continue;
                    int nx = x + d.dx;
                    int ny = y + d.dy;
                    int ni = ny * dim + nx;
                    double nd = cur.dist() + stepCost(x, y, nx, ny, roads);
                    if (nd < dist[ni]) {
                        dist[ni] = nd;
                        prev[ni] = cur.index();
                        open.add(new Node(nd, ni));
                    }
                }
            }
            if (dist[end] == Double.POSITIVE_INFINITY) {
                return null;
            }
            List<GridPoint> cells = new ArrayList<>();
            for (int c = end; c != -1; c = prev[c]) {
                cells.add(new GridPoint(c % dim, c / dim));
            }
            Collections.reverse(cells);
            return new GridPath(cells, PathEnd.DESTINATION);
        }

        private boolean isRiver(int x, int y) {
            return river.inBounds(x, y) && river.get(x, y) == RiverCategory.WATER;
        }

        private boolean alongAxis(Direction axis, Direction d) {
            return axis != null && (d == axis || d == axis.opposite());
        }
    }

    private record Node(double dist, int index) {
    }
}
