package com.caseclosed.agent;

import com.caseclosed.agent.CandidateGenerator.Candidate;
import com.caseclosed.agent.MatchSession.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the next move for one player from the current match state and that
 * player's session. Holds no state of its own; the session to keep comes
 * back inside the {@link Decision}.
 */
final class DecisionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(DecisionEngine.class);

    private final AgentConfig config;

    /** The answer to one move query plus the session to keep for the next one. */
    static final class Decision {
        final Direction direction;
        final boolean boost;
        final int score;
        final MatchSession session;

        Decision(Direction direction, boolean boost, int score, MatchSession session) {
            this.direction = direction;
            this.boost = boost;
            this.score = score;
            this.session = session;
        }

        /** Wire form, e.g. {@code UP} or {@code LEFT:BOOST}. */
        String move() {
            return boost ? direction.name() + ":BOOST" : direction.name();
        }
    }

    DecisionEngine(AgentConfig config) {
        this.config = config;
    }

    Decision decide(MatchState state, int player, MatchSession session) {
        AgentState me = state.agent(player);
        AgentState opp = state.opponentOf(player);
        Board board = state.board;
        int W = board.width(), H = board.height();

        if (!me.hasTrail()) {
            LOG.warn("T{} p{} no trail yet, keeping {}", state.turn, player, me.heading());
            return new Decision(me.heading(), false, 0, session);
        }

        Point head = me.head();
        Point origin = me.origin();
        Point oppHead = opp.alive && opp.hasTrail() ? opp.head() : null;

        Set<Point> occupied = new HashSet<>(me.trail());
        occupied.addAll(opp.trail());

        int row = session.hasCorridor() ? session.corridorRow : CorridorPlanner.corridorRow(origin, H);
        List<Candidate> candidates = CandidateGenerator.generate(head, me.heading(), occupied, row, W, H);
        if (candidates.isEmpty()) {
            LOG.warn("T{} p{} no candidates, keeping {}", state.turn, player, me.heading());
            return new Decision(me.heading(), false, 0, session);
        }

        MatchSession next = session;

        // Panic trigger
        if (next.phase == Phase.OPEN_PLAY && oppHead != null
                && Math.abs(head.x - oppHead.x) <= config.panicThreshold) {
            next = next.enterPanic(CorridorPlanner.corridorRow(origin, H), origin.x);
            LOG.info("T{} p{} opponent at {} -> PANIC ({})", state.turn, player, oppHead, next);
        }

        if (next.phase == Phase.PANIC && oppHead != null
                && CorridorPlanner.isInfiltrated(head, oppHead, next.corridorRow, next.exitColumn)) {
            next = next.enterFill();
            LOG.info("T{} p{} corridor infiltrated at {} -> POST_ESCAPE_FILL", state.turn, player, oppHead);
        }

        Candidate chosen = null;
        switch (next.phase) {
            case PANIC: {
                Direction step = CorridorPlanner.escapeStep(head, next.corridorRow, next.exitColumn);
                if (step == null) {
                    next = next.enterFill();
                    LOG.info("T{} p{} reached exit {} -> POST_ESCAPE_FILL", state.turn, player, head);
                } else {
                    if (step.dx != 0) next = next.withEscapeBias(step.dx);
                    chosen = safeStep(board, head, step, occupied, candidates, row, W, H);
                }
                break;
            }
            case POST_ESCAPE_FILL: {
                Direction step = CorridorPlanner.fillStep(board, head, occupied, next.escapeBias, W, H);
                if (step != null) chosen = safeStep(board, head, step, occupied, candidates, row, W, H);
                break;
            }
            default:
                break;
        }
        if (chosen == null) chosen = MoveSelector.bestNonSuicidal(board, head, occupied, candidates);

        boolean boost = MoveSelector.shouldBoost(config, me, chosen);
        Decision decision = new Decision(chosen.direction, boost, chosen.score, next);
        LOG.info("T{} p{} {} -> {} [{}]", state.turn, player, next.phase, decision.move(), candidates);
        return decision;
    }

    /** The candidate for {@code step}, or null if that step is fatal. */
    private static Candidate safeStep(Board board, Point head, Direction step, Set<Point> occupied,
                                      List<Candidate> candidates, int row, int W, int H) {
        Point target = head.step(step, W, H);
        if (CollisionChecker.isSuicidal(board, head, target, occupied)) return null;
        for (Candidate c : candidates) {
            if (c.direction == step) return c;
        }
        return CandidateGenerator.score(step, target, occupied, row, W, H);
    }
}
