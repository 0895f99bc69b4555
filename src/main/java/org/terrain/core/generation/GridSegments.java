package org.terrain.core.generation;

import org.terrain.core.model.Direction;
import org.terrain.core.model.Grid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * Worklist-based helpers over 4-connected grid cells (cell index = y * dimension + x).
 */
public final class GridSegments {

    public static final int FAR = Integer.MAX_VALUE;

    private GridSegments() {}

    /**
     * Connected components of the cells matching {@code member}, in scan order of their first cell.
     * Each component lists its cell indices in breadth-first order.
     */
    public static List<int[]> components(int dimension, IntPredicate member) {
        int n = dimension * dimension;
        boolean[] visited = new boolean[n];
        List<int[]> comps = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (visited[i] || !member.test(i)) continue;
            comps.add(flood(dimension, i, member, visited));
        }
        return comps;
    }

    /** Component containing {@code start}; marks its cells in {@code visited}. */
    public static int[] flood(int dimension, int start, IntPredicate member, boolean[] visited) {
        List<Integer> comp = new ArrayList<>();
        Deque<Integer> q = new ArrayDeque<>();
        q.add(start);
        visited[start] = true;
        while (!q.isEmpty()) {
            int cur = q.poll();
            comp.add(cur);
            int x = cur % dimension;
            int y = cur / dimension;
            for (Direction d : Direction.values()) {
                int nx = x + d.dx;
                int ny = y + d.dy;
                if (nx < 0 || ny < 0 || nx >= dimension || ny >= dimension) continue;
                int ni = ny * dimension + nx;
                if (visited[ni] || !member.test(ni)) continue;
                visited[ni] = true;
                q.add(ni);
            }
        }
        int[] out = new int[comp.size()];
        for (int i = 0; i < out.length; i++) out[i] = comp.get(i);
        return out;
    }

    /**
     * Edge-step distance from every cell to the nearest source cell, {@link #FAR} when unreachable.
     */
    public static int[] distanceFrom(int dimension, IntPredicate source) {
        int n = dimension * dimension;
        int[] dist = new int[n];
        Arrays.fill(dist, FAR);
        Deque<Integer> q = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (source.test(i)) {
                dist[i] = 0;
                q.add(i);
            }
        }
        while (!q.isEmpty()) {
            int cur = q.poll();
            int x = cur % dimension;
            int y = cur / dimension;
            for (Direction d : Direction.values()) {
                int nx = x + d.dx;
                int ny = y + d.dy;
                if (nx < 0 || ny < 0 || nx >= dimension || ny >= dimension) continue;
                int ni = ny * dimension + nx;
                if (dist[ni] != FAR) continue;
                dist[ni] = dist[cur] + 1;
                q.add(ni);
            }
        }
        return dist;
    }

    /** True when any in-bounds neighbor, diagonals included, matches. */
    public static <T> boolean touches8(Grid<T> grid, int x, int y, T value) {
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if (dx == 0 && dy == 0) continue;
                int nx = x + dx;
                int ny = y + dy;
                if (grid.inBounds(nx, ny) && value.equals(grid.get(nx, ny))) return true;
            }
        }
        return false;
    }

    /** True when any in-bounds edge neighbor matches. */
    public static <T> boolean touches4(Grid<T> grid, int x, int y, T value) {
        for (Direction d : Direction.values()) {
            int nx = x + d.dx;
            int ny = y + d.dy;
            if (grid.inBounds(nx, ny) && value.equals(grid.get(nx, ny))) return true;
        }
        return false;
    }

    /**
     * Replaces width-1 runs of {@code solid} cells by {@code fill} until none are left, and returns the
     * number of cells replaced. A solid cell is a sliver when its N and S neighbors are both not solid,
     * or its E and W neighbors are. Each pass looks at the grid as it was before the pass.
     * Out-of-bounds neighbors continue the cell, so the map border never makes a sliver.
     */
    public static <T> int removeSlivers(Grid<T> grid, Predicate<T> solid, T fill) {
        int dim = grid.dimension();
        int removed = 0;
        while (true) {
            List<Integer> slivers = new ArrayList<>();
            for (int y = 0; y < dim; y++) {
                for (int x = 0; x < dim; x++) {
                    if (!solid.test(grid.get(x, y))) continue;
                    boolean openNs = !solidOrOutside(grid, solid, x, y - 1) && !solidOrOutside(grid, solid, x, y + 1);
                    boolean openEw = !solidOrOutside(grid, solid, x + 1, y) && !solidOrOutside(grid, solid, x - 1, y);
                    if (openNs || openEw) {
                        slivers.add(y * dim + x);
                    }
                }
            }
            if (slivers.isEmpty()) {
                return removed;
            }
            for (int i : slivers) {
                grid.set(i, fill);
            }
            removed += slivers.size();
        }
    }

    private static <T> boolean solidOrOutside(Grid<T> grid, Predicate<T> solid, int x, int y) {
        return !grid.inBounds(x, y) || solid.test(grid.get(x, y));
    }

    public static boolean isBorder(int dimension, int x, int y) {
        return x == 0 || y == 0 || x == dimension - 1 || y == dimension - 1;
    }
}
