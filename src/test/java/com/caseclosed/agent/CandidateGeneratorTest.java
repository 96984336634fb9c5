package com.caseclosed.agent;

import com.caseclosed.agent.CandidateGenerator.Candidate;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CandidateGeneratorTest {

    @Test
    void neverOffersTheReverseOrTheHead() {
        Point head = new Point(4, 4);
        for (Direction heading : Direction.values()) {
            List<Candidate> out = CandidateGenerator.generate(head, heading, cells(head), 0, 9, 9);
            EnumSet<Direction> seen = EnumSet.noneOf(Direction.class);
            for (Candidate c : out) {
                assertNotEquals(heading.reverse(), c.direction);
                assertNotEquals(head, c.target);
                seen.add(c.direction);
            }
            assertEquals(EnumSet.complementOf(EnumSet.of(heading.reverse())), seen);
        }
    }

    @Test
    void corridorRowIsLeftOutOfTheScore() {
        Point head = new Point(5, 5);
        List<Candidate> out = CandidateGenerator.generate(head, Direction.RIGHT, cells(head), 0, 10, 10);
        assertEquals(3, out.size());
        for (Candidate c : out) assertEquals(89, c.score);
    }

    @Test
    void oneWideBoardDropsStepsThatWrapOntoTheHead() {
        Point head = new Point(0, 2);
        List<Candidate> out = CandidateGenerator.generate(head, Direction.UP, cells(head), 4, 1, 5);
        assertEquals(1, out.size());
        assertEquals(Direction.UP, out.get(0).direction);
        assertEquals(new Point(0, 1), out.get(0).target);
    }

    @Test
    void singleCellBoardHasNoCandidates() {
        Point head = new Point(0, 0);
        assertTrue(CandidateGenerator.generate(head, Direction.UP, cells(head), 0, 1, 1).isEmpty());
    }

    private static Set<Point> cells(Point... ps) {
        return new HashSet<>(Arrays.asList(ps));
    }
}
