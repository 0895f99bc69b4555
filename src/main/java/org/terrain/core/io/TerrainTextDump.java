package org.terrain.core.io;

import org.terrain.core.model.GridPath;
import org.terrain.core.model.GridPoint;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.TerrainLayer;

import java.util.Locale;

/**
 * Plain-text rendering of every generated value. Two terrains are identical exactly when their
 * dumps are equal, which makes the dump the reference form for reproducibility checks.
 *
 * Heightmap cells are written as raw float bits in hex, so no value is lost to formatting.
 */
public final class TerrainTextDump {

    private TerrainTextDump() {}

    public static String dump(Terrain terrain) {
        StringBuilder sb = new StringBuilder();
        int dim = terrain.dimension();
        sb.append("seed ").append(terrain.seed()).append('\n');
        sb.append("dim ").append(dim).append('\n');

        sb.append("heightmap\n");
        HeightMap h = terrain.heightmap();
        for (int y = 0; y < dim; y++) {
            for (int x = 0; x < dim; x++) {
                if (x > 0) sb.append(' ');
                sb.append(String.format(Locale.ROOT, "%08x", Float.floatToIntBits(h.elevation(x, y))));
            }
            sb.append('\n');
        }

        for (TerrainLayer layer : terrain.layers()) {
            sb.append("layer ").append(layer.kind()).append(layer.isEmpty() ? " empty" : "").append('\n');
            sb.append("categories\n");
            for (int y = 0; y < dim; y++) {
                for (int x = 0; x < dim; x++) {
                    if (x > 0) sb.append(' ');
                    sb.append(layer.category(x, y).code());
                }
                sb.append('\n');
            }
            sb.append("tiles\n");
            for (int y = 0; y < dim; y++) {
                for (int x = 0; x < dim; x++) {
                    if (x > 0) sb.append(' ');
                    sb.append(String.format(Locale.ROOT, "%2d", layer.tileCode(x, y).id()));
                }
                sb.append('\n');
            }
            for (GridPath p : layer.paths()) {
                sb.append("path ").append(p.end());
                for (GridPoint c : p.cells()) {
                    sb.append(' ').append(c.x()).append(',').append(c.y());
                }
                sb.append('\n');
            }
            for (GridPoint s : layer.sites()) {
                sb.append("site ").append(s.x()).append(',').append(s.y()).append('\n');
            }
        }

        for (String w : terrain.warnings()) {
            sb.append("warning ").append(w).append('\n');
        }
        return sb.toString();
    }
}
