package org.terrain.core.tiling;

import org.terrain.core.model.Direction;
import org.terrain.core.model.Grid;
import org.terrain.core.model.TileCode;

import java.util.Objects;

/**
 * Maps each cell's same/different neighbor pattern to a tile shape of the fixed tile set.
 *
 * The four edge neighbors form a mask with one bit per {@link Direction} set when that neighbor
 * holds a different category. Out-of-bounds neighbors count as different.
 *
 * <pre>
 * mask  differing   tile
 *  0    -           SOLID, or a concave corner when a diagonal differs (checked NE, SE, SW, NW)
 *  1    N           EDGE_N
 *  2    E           EDGE_E
 *  3    N E         CONVEX_NE
 *  4    S           EDGE_S
 *  5    N S         EDGE_N      opposite pair, N before S
 *  6    E S         CONVEX_SE
 *  7    N E S       CONVEX_NE   N/S pair resolved to N, plus E
 *  8    W           EDGE_W
 *  9    N W         CONVEX_NW
 * 10    E W         EDGE_E      opposite pair, E before W
 * 11    N E W       CONVEX_NE   E/W pair resolved to E, plus N
 * 12    S W         CONVEX_SW
 * 13    N S W       CONVEX_NW   N/S pair resolved to N, plus W
 * 14    E S W       CONVEX_SE   E/W pair resolved to E, plus S
 * 15    N E S W     SOLID       isolated cell
 * </pre>
 */
public final class TileNormalizer {

    private static final TileCode[] TABLE = {
            TileCode.SOLID,
            TileCode.EDGE_N,
            TileCode.EDGE_E,
            TileCode.CONVEX_NE,
            TileCode.EDGE_S,
            TileCode.EDGE_N,
            TileCode.CONVEX_SE,
            TileCode.CONVEX_NE,
            TileCode.EDGE_W,
            TileCode.CONVEX_NW,
            TileCode.EDGE_E,
            TileCode.CONVEX_NE,
            TileCode.CONVEX_SW,
            TileCode.CONVEX_NW,
            TileCode.CONVEX_SE,
            TileCode.SOLID
    };

    // NE, SE, SW, NW
    private static final int[][] DIAGONALS = {{1, -1}, {1, 1}, {-1, 1}, {-1, -1}};
    // a concave tile is named after the solid corner, opposite the differing diagonal
    private static final TileCode[] CONCAVE = {
            TileCode.CONCAVE_SW, TileCode.CONCAVE_NW, TileCode.CONCAVE_NE, TileCode.CONCAVE_SE
    };

    private TileNormalizer() {}

    public static <T> Grid<TileCode> normalize(Grid<T> categories) {
        int dim = categories.dimension();
        Grid<TileCode> out = new Grid<>(dim);
        for (int y = 0; y < dim; y++) {
            for (int x = 0; x < dim; x++) {
                out.set(x, y, classify(categories, x, y));
            }
        }
        return out;
    }

    public static <T> TileCode classify(Grid<T> categories, int x, int y) {
        int mask = differMask(categories, x, y);
        if (mask != 0) {
            return forMask(mask);
        }
        T own = categories.get(x, y);
        for (int i = 0; i < DIAGONALS.length; i++) {
            // both straight neighbors share here, so the diagonal is in bounds
            T diag = categories.get(x + DIAGONALS[i][0], y + DIAGONALS[i][1]);
            if (!Objects.equals(own, diag)) {
                return CONCAVE[i];
            }
        }
        return TileCode.SOLID;
    }

    /** Tile for a 4-bit differ mask, see the class table. */
    public static TileCode forMask(int mask) {
        if (mask < 0 || mask >= TABLE.length) {
            throw new IllegalArgumentException("Neighbor mask out of range: " + mask);
        }
        return TABLE[mask];
    }

    public static <T> int differMask(Grid<T> categories, int x, int y) {
        T own = categories.get(x, y);
        int mask = 0;
        for (Direction d : Direction.values()) {
            int nx = x + d.dx;
            int ny = y + d.dy;
            if (!categories.inBounds(nx, ny) || !Objects.equals(own, categories.get(nx, ny))) {
                mask |= d.bit;
            }
        }
        return mask;
    }
}
