package org.terrain.core.model;

import org.terrain.core.generation.GenerationPipeline;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A finished map: the heightmap and its layers, read-only.
 *
 * Instances come out of one complete generation pass (or a restore of a stored one); a new pass
 * produces a new instance, nothing is regenerated in place.
 */
public final class Terrain {

    private final long seed;
    private final int dimension;
    private final GeneratorSettings settings;
    private final HeightMap heightMap;
    private final Map<LayerKind, TerrainLayer> layers;
    private final List<String> warnings;

    public Terrain(long seed, int dimension, GeneratorSettings settings, HeightMap heightMap,
                   Map<LayerKind, TerrainLayer> layers, List<String> warnings) {
        if (heightMap.dimension() != dimension) {
            throw new IllegalArgumentException("HeightMap dimension " + heightMap.dimension()
                    + " does not match terrain dimension " + dimension);
        }
        Map<LayerKind, TerrainLayer> copy = new EnumMap<>(LayerKind.class);
        for (Map.Entry<LayerKind, TerrainLayer> e : layers.entrySet()) {
            TerrainLayer layer = e.getValue();
            if (layer.kind() != e.getKey()) {
                throw new IllegalArgumentException("Layer " + layer.kind() + " stored under " + e.getKey());
            }
            if (layer.dimension() != dimension) {
                throw new IllegalArgumentException("Layer " + layer.kind() + " has dimension " + layer.dimension());
            }
            if (!layer.isNormalized()) {
                throw new IllegalArgumentException("Layer " + layer.kind() + " is not normalized");
            }
            copy.put(e.getKey(), layer);
        }
        this.seed = seed;
        this.dimension = dimension;
        this.settings = settings.copy();
        this.heightMap = heightMap;
        this.layers = Collections.unmodifiableMap(copy);
        this.warnings = List.copyOf(warnings);
    }

    /** Runs the full pipeline with default settings. */
    public static Terrain generate(long seed, int dimension) {
        return new GenerationPipeline().run(seed, dimension, GeneratorSettings.defaults());
    }

    public long seed() {
        return seed;
    }

    public int dimension() {
        return dimension;
    }

    /** Copy of the settings the map was generated with. */
    public GeneratorSettings settings() {
        return settings.copy();
    }

    public HeightMap heightmap() {
        return heightMap;
    }

    public boolean hasLayer(LayerKind kind) {
        return layers.containsKey(kind);
    }

    public TerrainLayer layer(LayerKind kind) {
        TerrainLayer layer = layers.get(kind);
        if (layer == null) {
            throw new IllegalArgumentException("Layer of kind " + kind + " not generated");
        }
        return layer;
    }

    /** Layers in generation order. */
    public List<TerrainLayer> layers() {
        return new ArrayList<>(layers.values());
    }

    public List<TerrainLayer> layersInDrawOrder() {
        List<TerrainLayer> out = new ArrayList<>();
        for (LayerKind kind : LayerKind.drawOrder()) {
            TerrainLayer layer = layers.get(kind);
            if (layer != null) out.add(layer);
        }
        return out;
    }

    /** Placement failures recovered during generation. */
    public List<String> warnings() {
        return warnings;
    }

    public float elevation(int x, int y) {
        return heightMap.elevation(x, y);
    }

    public Category category(LayerKind kind, int x, int y) {
        return layer(kind).category(x, y);
    }

    public TileCode tileCode(LayerKind kind, int x, int y) {
        return layer(kind).tileCode(x, y);
    }
}
