package org.terrain.core.generation;

import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.TerrainLayer;

import java.util.Map;

/**
 * Builds the category grid of one layer from the heightmap and the layers generated before it.
 * The returned layer is not normalized yet.
 */
public interface LayerGenerator {

    LayerKind kind();

    TerrainLayer generate(HeightMap heightMap, Map<LayerKind, TerrainLayer> priorLayers, RandomSource random);
}
