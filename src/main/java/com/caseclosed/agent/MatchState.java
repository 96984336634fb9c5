package com.caseclosed.agent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Everything the game master tells us about the match: the board, both agents
 * and the turn counter. Not thread-safe; {@link AgentService} guards it.
 */
final class MatchState {
    static final int DEFAULT_WIDTH = 20;
    static final int DEFAULT_HEIGHT = 18;
    static final int DEFAULT_BOOSTS = 3;

    Board board;
    final AgentState agent1, agent2;
    int turn;

    MatchState(Board board, AgentState agent1, AgentState agent2) {
        this.board = board;
        this.agent1 = agent1;
        this.agent2 = agent2;
    }

    /** Layout used until the first sync arrives. */
    static MatchState initial() {
        List<Point> t1 = Arrays.asList(new Point(1, 2), new Point(2, 2));
        List<Point> t2 = Arrays.asList(new Point(17, 15), new Point(16, 15));
        List<Point> all = new ArrayList<>(t1);
        all.addAll(t2);
        return new MatchState(
                Board.empty(DEFAULT_WIDTH, DEFAULT_HEIGHT, all),
                new AgentState(t1, Direction.RIGHT, DEFAULT_BOOSTS),
                new AgentState(t2, Direction.LEFT, DEFAULT_BOOSTS));
    }

    AgentState agent(int player) { return player == 2 ? agent2 : agent1; }

    AgentState opponentOf(int player) { return player == 2 ? agent1 : agent2; }

    /** Applies the fields the sync carries; the rest keep their values. */
    void apply(StateSync s) {
        if (s.board != null) board = s.board;
        int W = board.width(), H = board.height();
        if (s.agent1Trail != null) agent1.replaceTrail(wrapAll(s.agent1Trail, W, H), W, H);
        if (s.agent2Trail != null) agent2.replaceTrail(wrapAll(s.agent2Trail, W, H), W, H);
        if (s.agent1Length != null) agent1.length = s.agent1Length;
        if (s.agent2Length != null) agent2.length = s.agent2Length;
        if (s.agent1Alive != null) agent1.alive = s.agent1Alive;
        if (s.agent2Alive != null) agent2.alive = s.agent2Alive;
        if (s.agent1Boosts != null) agent1.boostsRemaining = s.agent1Boosts;
        if (s.agent2Boosts != null) agent2.boostsRemaining = s.agent2Boosts;
        if (s.turnCount != null) turn = s.turnCount;
    }

    private static List<Point> wrapAll(List<Point> cells, int W, int H) {
        List<Point> out = new ArrayList<>(cells.size());
        for (Point p : cells) out.add(p.wrap(W, H));
        return out;
    }
}
