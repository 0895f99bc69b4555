package org.terrain.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.terrain.core.generation.GenerationPipeline;
import org.terrain.core.generation.StageListener;
import org.terrain.core.generation.StageProfile;
import org.terrain.core.model.Category;
import org.terrain.core.model.Grid;
import org.terrain.core.model.GridPath;
import org.terrain.core.model.GridPoint;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.PathEnd;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.TileCode;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compact JSON form of a terrain.
 * Short-key schema:
 * sv   = schema version
 * seed, dim
 * mode = SEED_ONLY | MATERIALIZED
 * cfg  = generator settings
 * k    = generated layer kinds, in generation order
 *
 * MATERIALIZED adds:
 * hb = heightmap as float bits, row-major
 * l  = layers, each {k, e (empty), c (category codes), t (tile ids), p (paths), s (sites)}
 * w  = warnings
 *
 * path item format: [endOrdinal, x0, y0, x1, y1, ...]
 * sites format: [x0, y0, x1, y1, ...]
 *
 * A SEED_ONLY document is turned back into a terrain by regenerating it.
 */
public class TerrainSerializer {

    public static final int SCHEMA_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public enum Mode {
        SEED_ONLY,
        MATERIALIZED
    }

    public static String toJson(Terrain terrain, Mode mode) throws JsonProcessingException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("sv", SCHEMA_VERSION);
        root.put("seed", terrain.seed());
        root.put("dim", terrain.dimension());
        root.put("mode", mode.name());
        root.set("cfg", MAPPER.valueToTree(terrain.settings()));

        ArrayNode kinds = root.putArray("k");
        for (TerrainLayer layer : terrain.layers()) {
            kinds.add(layer.kind().name());
        }
        if (mode == Mode.SEED_ONLY) {
            return MAPPER.writeValueAsString(root);
        }

        ArrayNode hb = root.putArray("hb");
        for (float v : terrain.heightmap().toArray()) {
            hb.add(Float.floatToIntBits(v));
        }

        ArrayNode layers = root.putArray("l");
        for (TerrainLayer layer : terrain.layers()) {
            layers.add(writeLayer(layer));
        }

        ArrayNode warnings = root.putArray("w");
        for (String w : terrain.warnings()) warnings.add(w);

        return MAPPER.writeValueAsString(root);
    }

    public static Terrain fromJson(String json) throws JsonProcessingException {
        return fromJson(json, null);
    }

    /**
     * @param listener receives stage events when a SEED_ONLY document is regenerated; may be null
     */
    public static Terrain fromJson(String json, StageListener listener) throws JsonProcessingException {
        JsonNode root = MAPPER.readTree(json);
        int sv = root.path("sv").asInt(-1);
        if (sv != SCHEMA_VERSION) {
            throw new IllegalArgumentException("Unsupported terrain schema version: " + sv);
        }
        long seed = required(root, "seed").asLong();
        int dim = required(root, "dim").asInt();
        Mode mode = Mode.valueOf(required(root, "mode").asText());
        GeneratorSettings settings = root.has("cfg")
                ? MAPPER.treeToValue(root.get("cfg"), GeneratorSettings.class)
                : GeneratorSettings.defaults();

        List<LayerKind> kinds = new ArrayList<>();
        for (JsonNode k : required(root, "k")) {
            kinds.add(LayerKind.valueOf(k.asText()));
        }

        if (mode == Mode.SEED_ONLY) {
            return new GenerationPipeline(StageProfile.of(kinds), true, listener).run(seed, dim, settings);
        }

        JsonNode hb = required(root, "hb");
        if (hb.size() != dim * dim) {
            throw new IllegalArgumentException("Heightmap has " + hb.size() + " cells, expected " + dim * dim);
        }
        float[] values = new float[dim * dim];
        for (int i = 0; i < values.length; i++) {
            values[i] = Float.intBitsToFloat(hb.get(i).asInt());
        }
        HeightMap heightMap = new HeightMap(dim, values);

        Map<LayerKind, TerrainLayer> layers = new EnumMap<>(LayerKind.class);
        for (JsonNode node : required(root, "l")) {
            TerrainLayer layer = readLayer(node, dim);
            layers.put(layer.kind(), layer);
        }
        if (!layers.keySet().containsAll(kinds) || layers.size() != kinds.size()) {
            throw new IllegalArgumentException("Stored layers " + layers.keySet() + " do not match kinds " + kinds);
        }

        List<String> warnings = new ArrayList<>();
        for (JsonNode w : root.path("w")) warnings.add(w.asText());

        return new Terrain(seed, dim, settings, heightMap, layers, warnings);
    }

    private static ObjectNode writeLayer(TerrainLayer layer) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("k", layer.kind().name());
        node.put("e", layer.isEmpty());

        ArrayNode codes = node.putArray("c");
        ArrayNode tiles = node.putArray("t");
        Grid<Category> categories = layer.categories();
        Grid<TileCode> tileGrid = layer.tiles();
        for (int i = 0; i < categories.size(); i++) {
            codes.add(categories.get(i).code());
            tiles.add(tileGrid.get(i).id());
        }

        ArrayNode paths = node.putArray("p");
        for (GridPath path : layer.paths()) {
            ArrayNode p = MAPPER.createArrayNode();
            p.add(path.end().ordinal());
            for (GridPoint c : path.cells()) {
                p.add(c.x());
                p.add(c.y());
            }
            paths.add(p);
        }

        ArrayNode sites = node.putArray("s");
        for (GridPoint s : layer.sites()) {
            sites.add(s.x());
            sites.add(s.y());
        }
        return node;
    }

    private static TerrainLayer readLayer(JsonNode node, int dim) {
        LayerKind kind = LayerKind.valueOf(required(node, "k").asText());
        JsonNode codes = required(node, "c");
        JsonNode tileIds = required(node, "t");
        if (codes.size() != dim * dim || tileIds.size() != dim * dim) {
            throw new IllegalArgumentException("Layer " + kind + " does not cover " + dim + "x" + dim + " cells");
        }
        Grid<Category> categories = new Grid<>(dim);
        Grid<TileCode> tiles = new Grid<>(dim);
        for (int i = 0; i < dim * dim; i++) {
            categories.set(i, kind.categoryOf(codes.get(i).asInt()));
            tiles.set(i, TileCode.fromId(tileIds.get(i).asInt()));
        }

        List<GridPath> paths = new ArrayList<>();
        for (JsonNode p : node.path("p")) {
            PathEnd end = PathEnd.values()[p.get(0).asInt()];
            List<GridPoint> cells = new ArrayList<>();
            for (int i = 1; i + 1 < p.size(); i += 2) {
                cells.add(new GridPoint(p.get(i).asInt(), p.get(i + 1).asInt()));
            }
            paths.add(new GridPath(cells, end));
        }

        List<GridPoint> sites = new ArrayList<>();
        JsonNode s = node.path("s");
        for (int i = 0; i + 1 < s.size(); i += 2) {
            sites.add(new GridPoint(s.get(i).asInt(), s.get(i + 1).asInt()));
        }
        return TerrainLayer.restore(kind, categories, tiles, paths, sites, node.path("e").asBoolean(false));
    }

    private static JsonNode required(JsonNode node, String key) {
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) {
            throw new IllegalArgumentException("Missing field '" + key + "' in terrain document");
        }
        return v;
    }
}
