package com.caseclosed.agent;

/**
 * The four headings of a light cycle. y grows downward, so UP decreases y.
 */
enum Direction {
    UP(0, -1),
    DOWN(0, 1),
    LEFT(-1, 0),
    RIGHT(1, 0);

    final int dx, dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    Direction reverse() {
        switch (this) {
            case UP: return DOWN;
            case DOWN: return UP;
            case LEFT: return RIGHT;
            default: return LEFT;
        }
    }

    /**
     * Heading of a single wrapped step from {@code from} to {@code to}, or null
     * if the two cells are not neighbours on a {@code w} x {@code h} torus.
     */
    static Direction between(Point from, Point to, int w, int h) {
        for (Direction d : values()) {
            if (from.step(d, w, h).equals(to.wrap(w, h))) return d;
        }
        return null;
    }
}
