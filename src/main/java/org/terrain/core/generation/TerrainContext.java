package org.terrain.core.generation;

import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * State of one generation run (one run = one context). Stages read earlier results from here
 * and publish their own; nothing in it escapes before the run completes.
 */
public class TerrainContext {

    public final long seed;
    public final int dimension;
    public final GeneratorSettings settings;

    /** The only source of randomness for the run. */
    public final RandomSource random;

    /** Set by the heightmap stage. */
    public HeightMap heightMap;

    private final Map<LayerKind, TerrainLayer> layers = new EnumMap<>(LayerKind.class);
    private final List<String> warnings = new ArrayList<>();

    public TerrainContext(long seed, int dimension, GeneratorSettings settings) {
        this.seed = seed;
        this.dimension = dimension;
        this.settings = settings;
        this.random = RandomSource.seed(seed);
    }

    public HeightMap heightMap() {
        if (heightMap == null) {
            throw new IllegalStateException("HeightMap has not been generated yet");
        }
        return heightMap;
    }

    /** Layers generated so far, read-only. */
    public Map<LayerKind, TerrainLayer> layers() {
        return Collections.unmodifiableMap(layers);
    }

    public TerrainLayer layer(LayerKind kind) {
        TerrainLayer layer = layers.get(kind);
        if (layer == null) {
            throw new IllegalStateException("Layer " + kind + " has not been generated yet");
        }
        return layer;
    }

    public void putLayer(TerrainLayer layer) {
        if (!layer.isNormalized()) {
            throw new IllegalStateException("Layer " + layer.kind() + " must be normalized before it is published");
        }
        if (layer.dimension() != dimension) {
            throw new IllegalStateException("Layer " + layer.kind() + " has dimension " + layer.dimension()
                    + ", terrain has " + dimension);
        }
        layers.put(layer.kind(), layer);
    }

    /**
     * Runs a layer generator after checking its requirements and publishes the normalized result.
     */
    public TerrainLayer buildLayer(LayerGenerator generator) {
        LayerKind kind = generator.kind();
        for (LayerKind req : kind.requires()) {
            if (!layers.containsKey(req)) {
                throw new LayerRequirementException(kind, req);
            }
        }
        TerrainLayer layer = generator.generate(heightMap(), layers(), random);
        layer.normalize();
        putLayer(layer);
        return layer;
    }

    public void installEmptyLayer(LayerKind kind, String reason) {
        TerrainLayer layer = TerrainLayer.empty(kind, dimension);
        layer.normalize();
        putLayer(layer);
        warnings.add(reason);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public Terrain toTerrain() {
        return new Terrain(seed, dimension, settings, heightMap(), layers, warnings);
    }
}
