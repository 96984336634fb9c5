package com.caseclosed.agent;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FloodFillTest {

    @Test
    void emptyBoardCountsEveryCellButTheTrail() {
        Set<Point> occupied = cells(new Point(5, 5));
        for (Direction d : Direction.values()) {
            Point start = new Point(5, 5).step(d, 10, 10);
            assertEquals(99, FloodFill.area(start, occupied, 10, 10));
        }
    }

    @Test
    void startingOnAnOccupiedCellLeavesNoSpace() {
        assertEquals(0, FloodFill.area(new Point(3, 3), cells(new Point(3, 3)), 10, 10));
    }

    @Test
    void wrapsAcrossEdges() {
        // A full column wall still leaves a connected cylinder on a torus.
        Set<Point> wall = new HashSet<>();
        for (int y = 0; y < 6; y++) wall.add(new Point(2, y));
        assertEquals(30, FloodFill.area(new Point(0, 0), wall, 6, 6));
        assertEquals(30, FloodFill.area(new Point(5, 5), wall, 6, 6));
        assertEquals(30, FloodFill.area(new Point(-1, 6), wall, 6, 6));
    }

    @Test
    void enclosedPocketIsCountedAlone() {
        Set<Point> ring = new HashSet<>();
        for (int x = 2; x <= 4; x++) {
            ring.add(new Point(x, 2));
            ring.add(new Point(x, 4));
        }
        ring.add(new Point(2, 3));
        ring.add(new Point(4, 3));
        assertEquals(1, FloodFill.area(new Point(3, 3), ring, 8, 8));
        assertEquals(64 - 9, FloodFill.area(new Point(0, 0), ring, 8, 8));
    }

    @Test
    void neverGrowsWhenMoreCellsAreOccupied() {
        Set<Point> occupied = new HashSet<>();
        Point start = new Point(0, 0);
        int previous = FloodFill.area(start, occupied, 7, 5);
        for (int i = 1; i < 35; i++) {
            occupied.add(new Point((i * 3) % 7, (i * 2) % 5));
            int now = FloodFill.area(start, occupied, 7, 5);
            assertTrue(now <= previous, "area grew from " + previous + " to " + now);
            previous = now;
        }
    }

    private static Set<Point> cells(Point... ps) {
        return new HashSet<>(Arrays.asList(ps));
    }
}
