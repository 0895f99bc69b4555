package org.terrain.core.model;

/**
 * Tile shapes of the autotiling tile set. {@link #id()} is the tile index in that set;
 * rotated variants of one shape are consecutive.
 *
 * Edges and convex corners are named after the side(s) facing a different category.
 * Concave corners are named after the filled corner of the tile: CONCAVE_NE is the cell whose
 * SW diagonal neighbor differs, CONCAVE_NW the one whose SE diagonal differs, and so on.
 */
public enum TileCode {
    SOLID(2),

    CONCAVE_NE(11),
    CONCAVE_SE(12),
    CONCAVE_SW(13),
    CONCAVE_NW(14),

    CONVEX_NE(15),
    CONVEX_SE(16),
    CONVEX_SW(17),
    CONVEX_NW(18),

    EDGE_N(19),
    EDGE_E(20),
    EDGE_S(21),
    EDGE_W(22);

    private final int id;

    TileCode(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static TileCode fromId(int id) {
        for (TileCode t : values()) {
            if (t.id == id) return t;
        }
        throw new IllegalArgumentException("Unknown tile id: " + id);
    }
}
