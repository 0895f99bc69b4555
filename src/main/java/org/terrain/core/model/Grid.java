package org.terrain.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dense square grid of cell values addressed by (x, y), 0 <= x, y < dimension.
 *
 * Row-major storage: index = y * dimension + x, y grows southward.
 * A grid can be frozen once its owning stage is done; after that every write fails.
 */
public final class Grid<T> {

    private final int dimension;
    private final List<T> cells;
    private boolean frozen;

    public Grid(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Grid dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.cells = new ArrayList<>(Collections.nCopies(dimension * dimension, null));
    }

    public static <T> Grid<T> filled(int dimension, T value) {
        Grid<T> g = new Grid<>(dimension);
        Collections.fill(g.cells, value);
        return g;
    }

    public int dimension() {
        return dimension;
    }

    public int size() {
        return cells.size();
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < dimension && y < dimension;
    }

    public int index(int x, int y) {
        checkBounds(x, y);
        return y * dimension + x;
    }

    public T get(int x, int y) {
        return cells.get(index(x, y));
    }

    public T get(int index) {
        return cells.get(index);
    }

    public void set(int x, int y, T value) {
        set(index(x, y), value);
    }

    public void set(int index, T value) {
        if (frozen) {
            throw new IllegalStateException("Grid is frozen");
        }
        cells.set(index, value);
    }

    public void fill(T value) {
        if (frozen) {
            throw new IllegalStateException("Grid is frozen");
        }
        Collections.fill(cells, value);
    }

    /** True when every cell holds a value. */
    public boolean isComplete() {
        return !cells.contains(null);
    }

    public int count(T value) {
        int n = 0;
        for (T c : cells) {
            if (Objects.equals(c, value)) n++;
        }
        return n;
    }

    public Grid<T> freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Unfrozen copy with the same values. */
    public Grid<T> copy() {
        Grid<T> g = new Grid<>(dimension);
        for (int i = 0; i < cells.size(); i++) {
            g.cells.set(i, cells.get(i));
        }
        return g;
    }

    private void checkBounds(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside grid of dimension " + dimension);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid)) return false;
        Grid<?> other = (Grid<?>) o;
        return dimension == other.dimension && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * dimension + cells.hashCode();
    }
}
