package org.terrain.core.model;

import org.terrain.core.tiling.TileNormalizer;

import java.util.List;

/**
 * One categorical layer of the terrain plus its tile codes.
 *
 * A layer is built with its category grid, then {@link #normalize()} derives the tile grid and freezes both.
 * River and road layers also keep their traced paths, the city layer its sites.
 */
public final class TerrainLayer {

    private final LayerKind kind;
    private final Grid<Category> categories;
    private final List<GridPath> paths;
    private final List<GridPoint> sites;
    private final boolean empty;
    private Grid<TileCode> tiles;

    public TerrainLayer(LayerKind kind, Grid<Category> categories, List<GridPath> paths, List<GridPoint> sites) {
        this(kind, categories, paths, sites, false);
    }

    private TerrainLayer(LayerKind kind, Grid<Category> categories, List<GridPath> paths, List<GridPoint> sites,
                         boolean empty) {
        this.kind = kind;
        this.categories = categories;
        this.paths = List.copyOf(paths);
        this.sites = List.copyOf(sites);
        this.empty = empty;
    }

    public TerrainLayer(LayerKind kind, Grid<Category> categories) {
        this(kind, categories, List.of(), List.of());
    }

    /** Fallback layer used when the layer's placement rule could not be met. */
    public static TerrainLayer empty(LayerKind kind, int dimension) {
        return new TerrainLayer(kind, Grid.filled(dimension, kind.emptyCategory()), List.of(), List.of(), true);
    }

    /** Rebuilds a layer from stored grids. */
    public static TerrainLayer restore(LayerKind kind, Grid<Category> categories, Grid<TileCode> tiles,
                                       List<GridPath> paths, List<GridPoint> sites, boolean empty) {
        TerrainLayer layer = new TerrainLayer(kind, categories, paths, sites, empty);
        if (!tiles.equals(TileNormalizer.normalize(categories))) {
            throw new IllegalArgumentException("Stored tile codes do not match categories of layer " + kind);
        }
        layer.tiles = tiles.copy().freeze();
        categories.freeze();
        return layer;
    }

    /** Derives tile codes from the current categories; the layer is read-only afterwards. */
    public void normalize() {
        if (!categories.isComplete()) {
            throw new IllegalStateException("Layer " + kind + " has cells without a category");
        }
        tiles = TileNormalizer.normalize(categories).freeze();
        categories.freeze();
    }

    public boolean isNormalized() {
        return tiles != null;
    }

    public LayerKind kind() {
        return kind;
    }

    public int dimension() {
        return categories.dimension();
    }

    public Grid<Category> categories() {
        return categories;
    }

    public Category category(int x, int y) {
        return categories.get(x, y);
    }

    public Grid<TileCode> tiles() {
        if (tiles == null) {
            throw new IllegalStateException("Layer " + kind + " is not normalized");
        }
        return tiles;
    }

    public TileCode tileCode(int x, int y) {
        return tiles().get(x, y);
    }

    public List<GridPath> paths() {
        return paths;
    }

    public List<GridPoint> sites() {
        return sites;
    }

    /** True for a fallback layer produced after a placement failure. */
    public boolean isEmpty() {
        return empty;
    }
}
