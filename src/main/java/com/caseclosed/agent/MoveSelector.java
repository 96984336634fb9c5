package com.caseclosed.agent;

import com.caseclosed.agent.CandidateGenerator.Candidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Final pick among candidates: most space first, never refusing to answer.
 */
final class MoveSelector {

    private MoveSelector() {}

    /**
     * Highest-scoring candidate that is not suicidal. If every candidate is
     * fatal the highest-scoring one is returned anyway. Ties keep the
     * generator's order.
     *
     * @param candidates non-empty
     */
    static Candidate bestNonSuicidal(Board board, Point head, Set<Point> occupied, List<Candidate> candidates) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt((Candidate c) -> c.score).reversed());
        for (Candidate c : sorted) {
            if (!CollisionChecker.isSuicidal(board, head, c.target, occupied)) return c;
        }
        return sorted.get(0);
    }

    static boolean shouldBoost(AgentConfig config, AgentState me, Candidate chosen) {
        return config.boostEnabled && me.boostsRemaining > 0 && chosen.score > config.boostThreshold;
    }
}
