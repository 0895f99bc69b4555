package org.terrain.core.generation;

import java.util.List;
import java.util.Random;

/**
 * Seeded random draws for one generation run. Every stochastic decision of the pipeline goes
 * through the single instance owned by the run, so a seed reproduces the same map on any JVM.
 */
public final class RandomSource {

    private final long seed;
    private final Random random;
    private long draws;

    private RandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public static RandomSource seed(long seed) {
        return new RandomSource(seed);
    }

    public long seed() {
        return seed;
    }

    /** Uniform in [0, 1). */
    public float nextFloat() {
        draws++;
        return random.nextFloat();
    }

    /** Uniform in [0, 1). */
    public double nextDouble() {
        draws++;
        return random.nextDouble();
    }

    /** Uniform in [low, high). */
    public int nextInt(int low, int high) {
        if (high <= low) {
            throw new IllegalArgumentException("Empty range [" + low + ", " + high + ")");
        }
        draws++;
        return low + random.nextInt(high - low);
    }

    /** Fisher-Yates shuffle driven by this source. */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = nextInt(0, i + 1);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }

    /** Number of values drawn so far. */
    public long draws() {
        return draws;
    }
}
