package org.terrain.core.model;

/**
 * Compass directions on the grid. North is y - 1.
 * Declaration order N, E, S, W is the fixed neighbor priority used wherever ties are broken.
 */
public enum Direction {
    N(0, -1, 1),
    E(1, 0, 2),
    S(0, 1, 4),
    W(-1, 0, 8);

    public final int dx;
    public final int dy;
    /** Bit of this direction in a 4-neighbor mask. */
    public final int bit;

    Direction(int dx, int dy, int bit) {
        this.dx = dx;
        this.dy = dy;
        this.bit = bit;
    }

    public Direction opposite() {
        return switch (this) {
            case N -> S;
            case E -> W;
            case S -> N;
            case W -> E;
        };
    }

    public boolean isVertical() {
        return this == N || this == S;
    }
}
