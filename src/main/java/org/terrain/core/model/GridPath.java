package org.terrain.core.model;

import java.util.List;

/**
 * Ordered cells of a river or road, first cell is the start.
 */
public record GridPath(List<GridPoint> cells, PathEnd end) {

    public GridPath {
        if (cells == null || cells.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one cell");
        }
        cells = List.copyOf(cells);
    }

    public GridPoint start() {
        return cells.get(0);
    }

    public GridPoint last() {
        return cells.get(cells.size() - 1);
    }

    public int length() {
        return cells.size();
    }
}
