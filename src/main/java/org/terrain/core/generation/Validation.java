package org.terrain.core.generation;

import org.terrain.core.model.Category;
import org.terrain.core.model.Grid;
import org.terrain.core.model.GridPath;
import org.terrain.core.model.GridPoint;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.RiverCategory;
import org.terrain.core.model.RoadCategory;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Post-stage checks. A failure means a generator bug, never bad input, so they all throw
 * {@link IllegalStateException}. Fallback (empty) layers only get the completeness check.
 */
public final class Validation {

    private Validation() {}

    public static void afterHeightMap(TerrainContext ctx) {
        HeightMap h = ctx.heightMap();
        if (h.dimension() != ctx.dimension) {
            throw new IllegalStateException("HeightMap dimension " + h.dimension() + " != " + ctx.dimension);
        }
    }

    public static void afterLayer(TerrainContext ctx, LayerKind kind) {
        TerrainLayer layer = ctx.layer(kind);
        if (!layer.categories().isComplete() || !layer.tiles().isComplete()) {
            throw new IllegalStateException("Layer " + kind + " has cells without category or tile");
        }
        if (layer.isEmpty()) {
            return;
        }
        switch (kind) {
            case SEA -> afterSea(ctx, layer);
            case RIVER -> afterRiver(ctx, layer);
            case CITY -> afterCity(ctx, layer);
            case ROAD -> afterRoad(ctx, layer);
            case BIOME -> {
                // no structural rule beyond completeness
            }
        }
    }

    static void afterSea(TerrainContext ctx, TerrainLayer sea) {
        int dim = ctx.dimension;
        Grid<Category> g = sea.categories();
        for (int[] body : GridSegments.components(dim, i -> g.get(i) == SeaCategory.WATER)) {
            boolean open = false;
            for (int c : body) {
                if (GridSegments.isBorder(dim, c % dim, c / dim)) {
                    open = true;
                    break;
                }
            }
            if (!open) {
                int c = body[0];
                throw new IllegalStateException("Sea body at (" + (c % dim) + ", " + (c / dim)
                        + ") is not connected to the map border");
            }
        }
    }

    static void afterRiver(TerrainContext ctx, TerrainLayer river) {
        HeightMap h = ctx.heightMap();
        Grid<Category> sea = ctx.layer(LayerKind.SEA).categories();
        for (GridPath path : river.paths()) {
            Set<GridPoint> seen = new HashSet<>();
            GridPoint prev = null;
            for (GridPoint p : path.cells()) {
                if (!seen.add(p)) {
                    throw new IllegalStateException("River revisits (" + p.x() + ", " + p.y() + ")");
                }
                if (river.category(p.x(), p.y()) != RiverCategory.WATER) {
                    throw new IllegalStateException("River path cell (" + p.x() + ", " + p.y() + ") not marked water");
                }
                if (prev != null) {
                    if (!prev.isAdjacent4(p)) {
                        throw new IllegalStateException("River jumps from " + prev + " to " + p);
                    }
                    if (h.elevation(p) >= h.elevation(prev)) {
                        throw new IllegalStateException("River climbs from " + prev + " to " + p);
                    }
                }
                prev = p;
            }
            GridPoint last = path.last();
            boolean ok = switch (path.end()) {
                case SEA -> GridSegments.touches4(sea, last.x(), last.y(), SeaCategory.WATER);
                case MAP_EDGE -> GridSegments.isBorder(ctx.dimension, last.x(), last.y());
                case LOCAL_MINIMUM -> RiverGenerator.steepestDescent(last, h) == null;
                case DESTINATION -> false;
            };
            if (!ok) {
                throw new IllegalStateException("River ending at " + last + " does not satisfy end " + path.end());
            }
        }
    }

    static void afterCity(TerrainContext ctx, TerrainLayer city) {
        int minDistance = new CityGenerator(ctx.settings).minDistance(ctx.dimension);
        List<GridPoint> sites = city.sites();
        for (int i = 0; i < sites.size(); i++) {
            for (int j = i + 1; j < sites.size(); j++) {
                if (sites.get(i).distanceTo(sites.get(j)) <= minDistance) {
                    throw new IllegalStateException("Cities " + sites.get(i) + " and " + sites.get(j)
                            + " closer than " + minDistance);
                }
            }
        }
        Grid<Category> sea = ctx.layer(LayerKind.SEA).categories();
        for (GridPoint s : sites) {
            if (sea.get(s.x(), s.y()) == SeaCategory.WATER) {
                throw new IllegalStateException("City placed in the sea at " + s);
            }
        }
    }

    static void afterRoad(TerrainContext ctx, TerrainLayer road) {
        Set<GridPoint> cities = new HashSet<>(ctx.layer(LayerKind.CITY).sites());
        Grid<Category> sea = ctx.layer(LayerKind.SEA).categories();
        for (GridPath path : road.paths()) {
            if (!cities.contains(path.start()) || !cities.contains(path.last())) {
                throw new IllegalStateException("Road from " + path.start() + " to " + path.last()
                        + " does not join two cities");
            }
            GridPoint prev = null;
            for (GridPoint p : path.cells()) {
                if (sea.get(p.x(), p.y()) == SeaCategory.WATER) {
                    throw new IllegalStateException("Road enters the sea at " + p);
                }
                if (!((RoadCategory) road.category(p.x(), p.y())).isRoad()) {
                    throw new IllegalStateException("Road cell " + p + " not marked");
                }
                if (prev != null && !prev.isAdjacent4(p)) {
                    throw new IllegalStateException("Road jumps from " + prev + " to " + p);
                }
                prev = p;
            }
        }
    }
}
