package com.caseclosed.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CollisionCheckerTest {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Point HEAD = new Point(1, 1);

    @Test
    void trailCellIsFatalEvenWhenTheBoardSaysEmpty() {
        Board stale = Board.empty(5, 5, Collections.emptyList());
        Set<Point> trails = cells(new Point(2, 1), new Point(3, 3));
        for (Point p : trails) {
            assertTrue(CollisionChecker.isSuicidal(stale, HEAD, p, trails));
            assertTrue(CollisionChecker.isSuicidal(null, HEAD, p, trails));
        }
    }

    @Test
    void occupiedBoardCellIsFatalWithoutATrail() {
        Board board = Board.empty(5, 5, Arrays.asList(new Point(2, 1)));
        assertTrue(CollisionChecker.isSuicidal(board, HEAD, new Point(2, 1), cells()));
        assertFalse(CollisionChecker.isSuicidal(board, HEAD, new Point(1, 2), cells()));
    }

    @Test
    void unknownCellFallsBackToTrailMembership() {
        ArrayNode grid = JSON.createArrayNode();
        grid.addArray().add(0).add("?");
        grid.addArray().add(0).addNull();
        Board board = Board.parse(grid);

        assertFalse(CollisionChecker.isSuicidal(board, HEAD, new Point(1, 0), cells()));
        assertTrue(CollisionChecker.isSuicidal(board, HEAD, new Point(1, 1), cells(new Point(1, 1))));
    }

    @Test
    void headItselfIsNotConsulted() {
        Board board = Board.empty(5, 5, Arrays.asList(HEAD));
        assertFalse(CollisionChecker.isSuicidal(board, HEAD, new Point(1, 2), cells(HEAD)));
    }

    private static Set<Point> cells(Point... ps) {
        return new HashSet<>(Arrays.asList(ps));
    }
}
