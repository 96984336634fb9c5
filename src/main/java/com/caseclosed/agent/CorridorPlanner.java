package com.caseclosed.agent;

import java.util.Set;

/**
 * Escape route for {@link MatchSession.Phase#PANIC} and the sideways sweep used afterwards.
 *
 * <p>The safe row lies half a board away from the row the cycle started on;
 * the exit column is the starting column. The cycle first drops onto the row,
 * then runs along it to the exit column.</p>
 */
final class CorridorPlanner {

    private CorridorPlanner() {}

    static int corridorRow(Point origin, int H) {
        return Math.floorMod(origin.y + H / 2, H);
    }

    /**
     * Next escape step, or null once the head sits on the safe row at the exit
     * column.
     */
    static Direction escapeStep(Point head, int corridorRow, int exitColumn) {
        if (head.y != corridorRow) return head.y < corridorRow ? Direction.DOWN : Direction.UP;
        if (head.x != exitColumn) return head.x < exitColumn ? Direction.RIGHT : Direction.LEFT;
        return null;
    }

    /**
     * True when the opponent sits on the safe row between us and the exit.
     * The opponent's column counts when it is past ours and up to and including
     * the exit column. Only checked while we have not reached the row yet.
     */
    static boolean isInfiltrated(Point head, Point oppHead, int corridorRow, int exitColumn) {
        if (head.y == corridorRow || oppHead.y != corridorRow) return false;
        if (head.x < exitColumn) return head.x < oppHead.x && oppHead.x <= exitColumn;
        if (head.x > exitColumn) return exitColumn <= oppHead.x && oppHead.x < head.x;
        return false;
    }

    /**
     * Sweep step: sideways along {@code escapeBias} (neutral means right), then
     * up, then down. Null when none of them is safe.
     */
    static Direction fillStep(Board board, Point head, Set<Point> occupied, int escapeBias, int W, int H) {
        Direction sideways = escapeBias < 0 ? Direction.LEFT : Direction.RIGHT;
        for (Direction d : new Direction[]{sideways, Direction.UP, Direction.DOWN}) {
            if (!CollisionChecker.isSuicidal(board, head, head.step(d, W, H), occupied)) return d;
        }
        return null;
    }
}
