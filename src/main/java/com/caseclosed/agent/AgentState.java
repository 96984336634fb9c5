package com.caseclosed.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One light cycle: its trail (head last, origin first), heading and counters.
 */
final class AgentState {
    private List<Point> trail;
    private Direction heading;
    boolean alive = true;
    int length;
    int boostsRemaining;

    AgentState(List<Point> trail, Direction heading, int boostsRemaining) {
        this.trail = new ArrayList<>(trail);
        this.heading = heading;
        this.length = trail.size();
        this.boostsRemaining = boostsRemaining;
    }

    List<Point> trail() { return Collections.unmodifiableList(trail); }

    boolean hasTrail() { return !trail.isEmpty(); }

    Point head() { return trail.isEmpty() ? null : trail.get(trail.size() - 1); }

    Point origin() { return trail.isEmpty() ? null : trail.get(0); }

    Direction heading() { return heading; }

    /**
     * Replaces the trail. The heading follows the last step when it is a
     * single wrapped move; otherwise the previous heading stays.
     */
    void replaceTrail(List<Point> cells, int W, int H) {
        trail = new ArrayList<>(cells);
        if (trail.size() >= 2) {
            Direction d = Direction.between(trail.get(trail.size() - 2), head(), W, H);
            if (d != null) heading = d;
        }
    }
}
