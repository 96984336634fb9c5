package com.caseclosed.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A validated state sync. Every field is optional; a null field leaves the
 * matching part of {@link MatchState} untouched.
 */
final class StateSync {
    Board board;
    List<Point> agent1Trail, agent2Trail;
    Integer agent1Length, agent2Length;
    Boolean agent1Alive, agent2Alive;
    Integer agent1Boosts, agent2Boosts;
    Integer turnCount;

    /**
     * Validates the whole payload up front so that a bad key rejects the sync
     * before anything is applied. Unknown keys are ignored.
     *
     * @throws InvalidStateException on an empty payload or a mistyped known key
     */
    static StateSync parse(JsonNode root) {
        if (root == null || !root.isObject() || root.size() == 0) {
            throw new InvalidStateException("no json body");
        }
        StateSync s = new StateSync();
        if (root.has("board")) s.board = Board.parse(root.get("board"));
        s.agent1Trail = trail(root, "agent1_trail");
        s.agent2Trail = trail(root, "agent2_trail");
        s.agent1Length = integer(root, "agent1_length");
        s.agent2Length = integer(root, "agent2_length");
        s.agent1Alive = bool(root, "agent1_alive");
        s.agent2Alive = bool(root, "agent2_alive");
        s.agent1Boosts = integer(root, "agent1_boosts");
        s.agent2Boosts = integer(root, "agent2_boosts");
        s.turnCount = integer(root, "turn_count");
        return s;
    }

    private static List<Point> trail(JsonNode root, String key) {
        if (!root.has(key)) return null;
        JsonNode node = root.get(key);
        if (!node.isArray()) throw new InvalidStateException(key + " must be a list of [x, y] pairs");
        List<Point> cells = new ArrayList<>();
        for (JsonNode c : node) {
            if (!c.isArray() || c.size() != 2 || !c.get(0).isIntegralNumber() || !c.get(1).isIntegralNumber()) {
                throw new InvalidStateException(key + " has a malformed cell: " + c);
            }
            cells.add(new Point(c.get(0).asInt(), c.get(1).asInt()));
        }
        return cells;
    }

    private static Integer integer(JsonNode root, String key) {
        if (!root.has(key)) return null;
        JsonNode v = root.get(key);
        if (v.isIntegralNumber()) return v.asInt();
        if (v.isTextual()) {
            try {
                return Integer.parseInt(v.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidStateException(key + " is not an integer: " + v);
            }
        }
        throw new InvalidStateException(key + " is not an integer: " + v);
    }

    private static Boolean bool(JsonNode root, String key) {
        if (!root.has(key)) return null;
        JsonNode v = root.get(key);
        if (v.isBoolean()) return v.asBoolean();
        if (v.isIntegralNumber()) return v.asInt() != 0;
        throw new InvalidStateException(key + " is not a boolean: " + v);
    }
}
