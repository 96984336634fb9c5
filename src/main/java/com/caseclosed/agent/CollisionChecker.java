package com.caseclosed.agent;

import java.util.Set;

/**
 * Decides whether stepping onto a cell kills the cycle. The board and the
 * trail set must both call a cell free before it counts as safe, so a board
 * that lags behind the trails cannot lure us into a trail.
 */
final class CollisionChecker {

    private CollisionChecker() {}

    /**
     * @param board            authoritative classification, may be null
     * @param head             current head; not consulted
     * @param target           cell we would move onto
     * @param explicitOccupied union of both trails
     */
    static boolean isSuicidal(Board board, Point head, Point target, Set<Point> explicitOccupied) {
        Board.CellState state = board == null ? Board.CellState.UNKNOWN : board.cellState(target);
        if (state == Board.CellState.UNKNOWN) {
            state = explicitOccupied.contains(target) ? Board.CellState.OCCUPIED : Board.CellState.EMPTY;
        }
        if (state != Board.CellState.EMPTY) return true;
        return explicitOccupied.contains(target);
    }
}
