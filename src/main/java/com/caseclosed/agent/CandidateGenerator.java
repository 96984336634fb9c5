package com.caseclosed.agent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates the non-reversing steps from the head and scores each with the
 * flood-fill area left behind it.
 */
final class CandidateGenerator {

    private CandidateGenerator() {}

    /** A possible next step and the space it leaves us. */
    static final class Candidate {
        final int score;
        final Direction direction;
        final Point target;

        Candidate(int score, Direction direction, Point target) {
            this.score = score;
            this.direction = direction;
            this.target = target;
        }

        @Override public String toString() { return direction + "=" + score; }
    }

    /**
     * @param excludedRow row kept out of the flood fill so that space along the
     *                    escape corridor does not attract open play
     */
    static List<Candidate> generate(Point head, Direction heading, Set<Point> occupied,
                                    int excludedRow, int W, int H) {
        Set<Point> blocked = withRow(occupied, excludedRow, W);

        List<Candidate> out = new ArrayList<>(3);
        Direction reverse = heading.reverse();
        for (Direction d : Direction.values()) {
            if (d == reverse) continue;
            Point next = head.step(d, W, H);
            if (next.equals(head)) continue;
            out.add(new Candidate(FloodFill.area(next, blocked, W, H), d, next));
        }
        return out;
    }

    /** Scores a single step on the same scale as {@link #generate}. */
    static Candidate score(Direction d, Point target, Set<Point> occupied, int excludedRow, int W, int H) {
        return new Candidate(FloodFill.area(target, withRow(occupied, excludedRow, W), W, H), d, target);
    }

    private static Set<Point> withRow(Set<Point> occupied, int row, int W) {
        Set<Point> blocked = new HashSet<>(occupied);
        for (int x = 0; x < W; x++) blocked.add(new Point(x, row));
        return blocked;
    }
}
