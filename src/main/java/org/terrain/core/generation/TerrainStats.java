package org.terrain.core.generation;

import org.terrain.core.model.Category;
import org.terrain.core.model.GridPath;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.PathEnd;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.TileCode;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class TerrainStats {

    public long seed;
    public int dimension;

    // elevation
    public float elevationMin;
    public float elevationMax;
    public double elevationAvg;

    // category histogram per layer, in category declaration order
    public final Map<LayerKind, Map<Category, Integer>> categoryCounts = new EnumMap<>(LayerKind.class);

    // tile codes over all layers, in TileCode declaration order
    public final Map<TileCode, Integer> tileCounts = new EnumMap<>(TileCode.class);

    // rivers
    public int riverCount;
    public final Map<PathEnd, Integer> riverEnds = new EnumMap<>(PathEnd.class);
    public int longestRiver;

    public int cityCount;
    public int roadCount;

    public int warningCount;

    public static TerrainStats compute(Terrain terrain) {
        TerrainStats s = new TerrainStats();
        s.seed = terrain.seed();
        s.dimension = terrain.dimension();

        HeightMap h = terrain.heightmap();
        s.elevationMin = h.min();
        s.elevationMax = h.max();
        s.elevationAvg = h.average();

        for (TerrainLayer layer : terrain.layers()) {
            Map<Category, Integer> counts = new LinkedHashMap<>();
            for (Category c : layer.kind().categories()) {
                counts.put(c, layer.categories().count(c));
            }
            s.categoryCounts.put(layer.kind(), counts);
            for (TileCode t : TileCode.values()) {
                int n = layer.tiles().count(t);
                if (n > 0) s.tileCounts.merge(t, n, Integer::sum);
            }
        }

        if (terrain.hasLayer(LayerKind.RIVER)) {
            for (GridPath p : terrain.layer(LayerKind.RIVER).paths()) {
                s.riverCount++;
                s.riverEnds.merge(p.end(), 1, Integer::sum);
                s.longestRiver = Math.max(s.longestRiver, p.length());
            }
        }
        if (terrain.hasLayer(LayerKind.CITY)) {
            s.cityCount = terrain.layer(LayerKind.CITY).sites().size();
        }
        if (terrain.hasLayer(LayerKind.ROAD)) {
            s.roadCount = terrain.layer(LayerKind.ROAD).paths().size();
        }
        s.warningCount = terrain.warnings().size();
        return s;
    }
}
