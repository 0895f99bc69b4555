package org.terrain.core.generation;

import org.terrain.core.model.HeightMap;
import org.terrain.core.model.config.GeneratorSettings;

/**
 * Diamond-square heightmap.
 *
 * Works on the smallest (2^n + 1) square that covers the requested dimension with integer levels
 * 0..255, crops it, and stretches the cropped levels to [0, 1].
 */
public class HeightMapGenerator {

    private static final int INITIAL_MIN = 0x40;
    private static final int INITIAL_MAX = 0xBF;
    private static final int MAX_LEVEL = 255;

    private final GeneratorSettings settings;

    public HeightMapGenerator(GeneratorSettings settings) {
        this.settings = settings;
    }

    public HeightMap generate(int dimension, RandomSource random) {
        int size = workingSize(dimension);
        int[] t = new int[size * size];

        int last = size - 1;
        set(t, size, 0, 0, random.nextInt(INITIAL_MIN, INITIAL_MAX + 1));
        set(t, size, 0, last, random.nextInt(INITIAL_MIN, INITIAL_MAX + 1));
        set(t, size, last, 0, random.nextInt(INITIAL_MIN, INITIAL_MAX + 1));
        set(t, size, last, last, random.nextInt(INITIAL_MIN, INITIAL_MAX + 1));

        int squareDim = size;
        int range = settings.perturbRange;
        while (squareDim > 2) {
            for (int y = 0; y < last; y += squareDim - 1) {
                for (int x = 0; x < last; x += squareDim - 1) {
                    squareStep(t, size, x, y, squareDim, range, random);
                    diamondSteps(t, size, x, y, squareDim, range, random);
                }
            }
            squareDim = squareDim / 2 + 1;
            range -= (int) (range * settings.perturbDecrease);
        }

        return new HeightMap(dimension, stretch(t, size, dimension));
    }

    /** Smallest 2^n + 1 that is at least {@code dimension}. */
    static int workingSize(int dimension) {
        int size = 2;
        while (size < dimension) {
            size = (size - 1) * 2 + 1;
        }
        return size;
    }

    private void squareStep(int[] t, int size, int x, int y, int squareDim, int range, RandomSource random) {
        int far = squareDim - 1;
        int sum = get(t, size, x, y) + get(t, size, x + far, y)
                + get(t, size, x, y + far) + get(t, size, x + far, y + far);
        int mid = far / 2;
        setPerturbed(t, size, x + mid, y + mid, sum / 4, range, random);
    }

    private void diamondSteps(int[] t, int size, int x, int y, int squareDim, int range, RandomSource random) {
        int far = squareDim - 1;
        int mid = far / 2;
        diamond(t, size, x + mid, y, mid, range, random);
        diamond(t, size, x + far, y + mid, mid, range, random);
        diamond(t, size, x + mid, y + far, mid, range, random);
        diamond(t, size, x, y + mid, mid, range, random);
    }

    // (cx, cy) is the diamond center; corners outside the square are skipped
    private void diamond(int[] t, int size, int cx, int cy, int half, int range, RandomSource random) {
        int[][] corners = {{cx, cy - half}, {cx + half, cy}, {cx, cy + half}, {cx - half, cy}};
        int sum = 0;
        int count = 0;
        for (int[] c : corners) {
            if (c[0] < 0 || c[1] < 0 || c[0] >= size || c[1] >= size) continue;
            sum += get(t, size, c[0], c[1]);
            count++;
        }
        setPerturbed(t, size, cx, cy, sum / count, range, random);
    }

    private void setPerturbed(int[] t, int size, int x, int y, int avg, int range, RandomSource random) {
        int half = range / 2;
        int v = avg + random.nextInt(-half, half + 1);
        set(t, size, x, y, Math.max(0, Math.min(MAX_LEVEL, v)));
    }

    private float[] stretch(int[] t, int size, int dimension) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int y = 0; y < dimension; y++) {
            for (int x = 0; x < dimension; x++) {
                int v = get(t, size, x, y);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        float[] out = new float[dimension * dimension];
        int span = max - min;
        if (span == 0) {
            return out;
        }
        for (int y = 0; y < dimension; y++) {
            for (int x = 0; x < dimension; x++) {
                out[y * dimension + x] = (float) (get(t, size, x, y) - min) / (float) span;
            }
        }
        return out;
    }

    private static int get(int[] t, int size, int x, int y) {
        return t[y * size + x];
    }

    private static void set(int[] t, int size, int x, int y, int v) {
        t[y * size + x] = v;
    }
}
