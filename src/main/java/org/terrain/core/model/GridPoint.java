package org.terrain.core.model;

public record GridPoint(int x, int y) {

    public GridPoint step(Direction d) {
        return new GridPoint(x + d.dx, y + d.dy);
    }

    public double distanceTo(GridPoint other) {
        int dx = x - other.x;
        int dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public boolean isAdjacent4(GridPoint other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y) == 1;
    }
}
