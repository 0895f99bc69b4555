package org.terrain.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Elevation field normalized to [0, 1]. Immutable.
 */
public final class HeightMap {

    private static final int[][] OFFSETS_8 = {
            {0, -1}, {1, -1}, {1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}
    };

    private final int dimension;
    private final float[] values;

    public HeightMap(int dimension, float[] values) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("HeightMap dimension must be positive: " + dimension);
        }
        if (values.length != dimension * dimension) {
            throw new IllegalArgumentException("Expected " + (dimension * dimension) + " values, got " + values.length);
        }
        for (int i = 0; i < values.length; i++) {
            float v = values[i];
            if (Float.isNaN(v) || Float.isInfinite(v) || v < 0f || v > 1f) {
                throw new IllegalArgumentException("Elevation out of range at index " + i + ": " + v);
            }
        }
        this.dimension = dimension;
        this.values = values.clone();
    }

    public int dimension() {
        return dimension;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < dimension && y < dimension;
    }

    public float elevation(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside heightmap of dimension " + dimension);
        }
        return values[y * dimension + x];
    }

    public float elevation(GridPoint p) {
        return elevation(p.x(), p.y());
    }

    /** Strictly above the threshold. */
    public boolean isAbove(int x, int y, double threshold) {
        return elevation(x, y) > threshold;
    }

    /**
     * Finite-difference slope. Central difference inside the map, one-sided on the border,
     * zero along an axis with no neighbor at all.
     */
    public Gradient gradient(int x, int y) {
        return new Gradient(diff(x, y, 1, 0), diff(x, y, 0, 1));
    }

    private double diff(int x, int y, int ax, int ay) {
        boolean hasNext = inBounds(x + ax, y + ay);
        boolean hasPrev = inBounds(x - ax, y - ay);
        if (hasNext && hasPrev) {
            return ((double) elevation(x + ax, y + ay) - (double) elevation(x - ax, y - ay)) / 2.0;
        }
        if (hasNext) {
            return (double) elevation(x + ax, y + ay) - (double) elevation(x, y);
        }
        if (hasPrev) {
            return (double) elevation(x, y) - (double) elevation(x - ax, y - ay);
        }
        return 0.0;
    }

    /** In-bounds edge neighbors in N, E, S, W order. */
    public List<GridPoint> neighbors4(int x, int y) {
        List<GridPoint> out = new ArrayList<>(4);
        for (Direction d : Direction.values()) {
            int nx = x + d.dx;
            int ny = y + d.dy;
            if (inBounds(nx, ny)) out.add(new GridPoint(nx, ny));
        }
        return out;
    }

    /** In-bounds neighbors clockwise from north: N, NE, E, SE, S, SW, W, NW. */
    public List<GridPoint> neighbors8(int x, int y) {
        List<GridPoint> out = new ArrayList<>(8);
        for (int[] o : OFFSETS_8) {
            int nx = x + o[0];
            int ny = y + o[1];
            if (inBounds(nx, ny)) out.add(new GridPoint(nx, ny));
        }
        return out;
    }

    public float min() {
        float m = Float.MAX_VALUE;
        for (float v : values) m = Math.min(m, v);
        return m;
    }

    public float max() {
        float m = -Float.MAX_VALUE;
        for (float v : values) m = Math.max(m, v);
        return m;
    }

    public double average() {
        double sum = 0.0;
        for (float v : values) sum += v;
        return sum / values.length;
    }

    public float[] toArray() {
        return values.clone();
    }

    public record Gradient(double dx, double dy) {
        public double magnitude() {
            return Math.sqrt(dx * dx + dy * dy);
        }
    }
}
