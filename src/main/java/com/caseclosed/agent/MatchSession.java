package com.caseclosed.agent;

/**
 * Per-player strategy state that survives between turns of one match. Immutable:
 * the engine returns the next session with every {@link Decision}.
 */
final class MatchSession {

    /**
     * Strategic phase of one player within a match. Phases only move forward;
     * a match reset is the only way back to {@link #OPEN_PLAY}.
     */
    enum Phase {
        /** Maximise reachable space. */
        OPEN_PLAY,
        /** Opponent is close: run for the safe row, then along it to the exit column. */
        PANIC,
        /** Escape done or corridor lost: sweep sideways along the escape bias. */
        POST_ESCAPE_FILL
    }

    static final int NO_ROW = -1;

    final Phase phase;
    final int escapeBias;   // +1 right, -1 left, 0 neutral
    final int corridorRow;  // NO_ROW until PANIC is entered
    final int exitColumn;

    private MatchSession(Phase phase, int escapeBias, int corridorRow, int exitColumn) {
        this.phase = phase;
        this.escapeBias = escapeBias;
        this.corridorRow = corridorRow;
        this.exitColumn = exitColumn;
    }

    static MatchSession fresh() {
        return new MatchSession(Phase.OPEN_PLAY, 0, NO_ROW, 0);
    }

    boolean hasCorridor() { return corridorRow != NO_ROW; }

    MatchSession enterPanic(int corridorRow, int exitColumn) {
        return new MatchSession(Phase.PANIC, escapeBias, corridorRow, exitColumn);
    }

    MatchSession withEscapeBias(int bias) {
        return new MatchSession(phase, bias, corridorRow, exitColumn);
    }

    MatchSession enterFill() {
        return new MatchSession(Phase.POST_ESCAPE_FILL, escapeBias, corridorRow, exitColumn);
    }

    @Override public String toString() {
        return phase + (hasCorridor() ? " row=" + corridorRow + " exit=" + exitColumn : "") + " bias=" + escapeBias;
    }
}
