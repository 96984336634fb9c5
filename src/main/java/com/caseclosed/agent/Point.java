package com.caseclosed.agent;

import java.util.Objects;

/**
 * A board cell. Coordinates are stored as given; callers wrap them against the
 * board size with {@link #wrap(int, int)}.
 */
final class Point {
    final int x, y;

    Point(int x, int y) { this.x = x; this.y = y; }

    Point step(Direction d) { return new Point(x + d.dx, y + d.dy); }

    Point wrap(int w, int h) {
        return new Point(Math.floorMod(x, w), Math.floorMod(y, h));
    }

    Point step(Direction d, int w, int h) { return step(d).wrap(w, h); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point p = (Point) o;
        return x == p.x && y == p.y;
    }

    @Override public int hashCode() { return Objects.hash(x, y); }

    @Override public String toString() { return "(" + x + "," + y + ")"; }
}
