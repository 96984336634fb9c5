package com.caseclosed.agent;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.Set;

/**
 * Reachable-area estimate: how many free cells a cycle could still visit from
 * a given cell. This is the only non-constant-time primitive of a decision.
 */
final class FloodFill {

    private FloodFill() {}

    /**
     * Counts the cells reachable from {@code start} over the 4-neighbourhood of
     * a wrapped {@code W} x {@code H} board without entering {@code occupied}.
     * Returns 0 when {@code start} is itself occupied.
     */
    static int area(Point start, Set<Point> occupied, int W, int H) {
        boolean[][] v = new boolean[W][H];
        Queue<Point> q = new ArrayDeque<>();
        Point s = start.wrap(W, H);
        if (occupied.contains(s)) return 0;
        q.add(s);
        v[s.x][s.y] = true;

        int count = 0;
        while (!q.isEmpty()) {
            Point p = q.poll();
            count++;
            for (Direction d : Direction.values()) {
                Point n = p.step(d, W, H);
                if (!v[n.x][n.y] && !occupied.contains(n)) {
                    v[n.x][n.y] = true;
                    q.add(n);
                }
            }
        }
        return count;
    }
}
