package com.caseclosed.agent;

import com.caseclosed.agent.DecisionEngine.Decision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The agent's three operations (state sync, move query, match end) on top of
 * one lock-guarded match state. Payloads come in as raw JSON strings; answers
 * go out as maps ready for serialization.
 */
public class AgentService {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Logger LOG = LoggerFactory.getLogger(AgentService.class);

    private final AgentConfig config;
    private final DecisionEngine engine;
    private final ReentrantLock lock = new ReentrantLock();
    private final MatchState state = MatchState.initial();
    private final Map<Integer, MatchSession> sessions = new HashMap<>();

    AgentService(AgentConfig config) {
        this.config = config;
        this.engine = new DecisionEngine(config);
        resetSessions();
    }

    Map<String, String> info() {
        Map<String, String> r = new HashMap<>();
        r.put("participant", config.participant);
        r.put("agent_name", config.agentName);
        return r;
    }

    /**
     * @throws InvalidStateException if the body is empty or malformed; nothing
     *                               is applied in that case
     */
    Map<String, String> receiveState(String body) {
        StateSync sync = StateSync.parse(readJson(body));
        lock.lock();
        try {
            state.apply(sync);
            LOG.debug("state synced, turn {}", state.turn);
        } finally {
            lock.unlock();
        }
        return status("state received");
    }

    Map<String, String> move(int player) {
        int p = player == 2 ? 2 : 1;
        Decision decision;
        lock.lock();
        try {
            decision = engine.decide(state, p, sessions.get(p));
            sessions.put(p, decision.session);
        } finally {
            lock.unlock();
        }
        Map<String, String> res = new HashMap<>();
        res.put("move", decision.move());
        return res;
    }

    /**
     * Applies an optional final sync, then starts every player over in open
     * play. The reset happens even when the final sync is malformed.
     *
     * @throws InvalidStateException after the reset, if the final sync was rejected
     */
    Map<String, String> end(String body) {
        StateSync sync = null;
        InvalidStateException rejected = null;
        if (body != null && !body.trim().isEmpty()) {
            try {
                sync = StateSync.parse(readJson(body));
            } catch (InvalidStateException e) {
                rejected = e;
            }
        }
        lock.lock();
        try {
            if (sync != null) state.apply(sync);
            resetSessions();
            LOG.info("match ended at turn {}, sessions reset", state.turn);
        } finally {
            lock.unlock();
        }
        if (rejected != null) throw rejected;
        return status("acknowledged");
    }

    MatchSession session(int player) {
        lock.lock();
        try {
            return sessions.get(player == 2 ? 2 : 1);
        } finally {
            lock.unlock();
        }
    }

    /** Player number from the query string; anything but 2 means player 1. */
    static int playerNumber(String raw) {
        if (raw == null) return 1;
        try {
            return Integer.parseInt(raw.trim()) == 2 ? 2 : 1;
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private void resetSessions() {
        sessions.put(1, MatchSession.fresh());
        sessions.put(2, MatchSession.fresh());
    }

    private static JsonNode readJson(String body) {
        if (body == null || body.trim().isEmpty()) throw new InvalidStateException("no json body");
        try {
            return JSON.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidStateException("body is not valid json: " + e.getOriginalMessage());
        }
    }

    private static Map<String, String> status(String s) {
        Map<String, String> r = new HashMap<>();
        r.put("status", s);
        return r;
    }
}
