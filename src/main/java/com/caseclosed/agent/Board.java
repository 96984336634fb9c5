package com.caseclosed.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;

/**
 * Read-only, per-turn view of the toroidal board. Lookups wrap, so the board
 * has no edges. A sync replaces the whole board.
 */
final class Board {

    enum CellState { EMPTY, OCCUPIED, UNKNOWN }

    private final int W, H;
    private final CellState[][] cells; // [x][y]

    private Board(int W, int H, CellState[][] cells) {
        this.W = W;
        this.H = H;
        this.cells = cells;
    }

    static Board empty(int W, int H, Collection<Point> occupied) {
        CellState[][] c = new CellState[W][H];
        for (int x = 0; x < W; x++) {
            for (int y = 0; y < H; y++) c[x][y] = CellState.EMPTY;
        }
        for (Point p : occupied) {
            Point w = p.wrap(W, H);
            c[w.x][w.y] = CellState.OCCUPIED;
        }
        return new Board(W, H, c);
    }

    /**
     * Builds a board from the game master's row-major grid ({@code grid[y][x]}).
     * {@code 0} is empty, any other integer is occupied. Anything else, including
     * cells missing from a short row, is {@link CellState#UNKNOWN}.
     *
     * @throws InvalidStateException if the grid is not a non-empty list of rows
     */
    static Board parse(JsonNode grid) {
        if (grid == null || !grid.isArray() || grid.size() == 0) {
            throw new InvalidStateException("board must be a non-empty list of rows");
        }
        int H = grid.size();
        int W = 0;
        for (JsonNode row : grid) {
            if (!row.isArray()) throw new InvalidStateException("board row is not a list");
            W = Math.max(W, row.size());
        }
        if (W == 0) throw new InvalidStateException("board rows are empty");

        CellState[][] c = new CellState[W][H];
        for (int y = 0; y < H; y++) {
            JsonNode row = grid.get(y);
            for (int x = 0; x < W; x++) {
                JsonNode v = row.get(x);
                if (v == null || !v.isIntegralNumber()) c[x][y] = CellState.UNKNOWN;
                else c[x][y] = v.asInt() == 0 ? CellState.EMPTY : CellState.OCCUPIED;
            }
        }
        return new Board(W, H, c);
    }

    int width() { return W; }

    int height() { return H; }

    CellState cellState(Point p) {
        Point w = p.wrap(W, H);
        return cells[w.x][w.y];
    }
}
