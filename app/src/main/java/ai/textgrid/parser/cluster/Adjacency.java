package ai.textgrid.parser.cluster;

import ai.textgrid.parser.surface.CellPosition;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule deciding which filled cells join the same cluster.
 *
 * <p>Under {@link #ORTHOGONAL} a cluster whose R1C2 and R2C1 are both empty is a lone corner cell, so
 * signatures with an isolated R1C1 (the KeyValue key 9 among them) never occur. Use {@link #DIAGONAL}
 * or {@link #PROXIMITY} for layouts joined only across corners or gaps.
 */
public enum Adjacency {
    /** Up, down, left and right only. */
    ORTHOGONAL(1, false),
    /** The eight surrounding cells. */
    DIAGONAL(1, true),
    /** Any cell within a Chebyshev distance of two, tolerating one empty cell in between. */
    PROXIMITY(2, true);

    private final int reach;
    private final boolean includesDiagonals;

    Adjacency(int reach, boolean includesDiagonals) {
        this.reach = reach;
        this.includesDiagonals = includesDiagonals;
    }

    public static Adjacency from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ORTHOGONAL;
        }
        for (Adjacency adjacency : values()) {
            if (adjacency.name().equalsIgnoreCase(raw.trim())) {
                return adjacency;
            }
        }
        throw new IllegalArgumentException("Unsupported adjacency: " + raw);
    }

    public boolean adjacent(CellPosition a, CellPosition b) {
        int rowDistance = Math.abs(a.row() - b.row());
        int colDistance = Math.abs(a.col() - b.col());
        if (rowDistance == 0 && colDistance == 0) {
            return false;
        }
        if (!includesDiagonals) {
            return rowDistance + colDistance == 1;
        }
        return Math.max(rowDistance, colDistance) <= reach;
    }

    /**
     * Neighbouring coordinates of the position that fall on the 1-indexed grid.
     */
    public List<CellPosition> neighbours(CellPosition position) {
        List<CellPosition> result = new ArrayList<>();
        for (int dr = -reach; dr <= reach; dr++) {
            for (int dc = -reach; dc <= reach; dc++) {
                int row = position.row() + dr;
                int col = position.col() + dc;
                if (row < 1 || col < 1) {
                    continue;
                }
                CellPosition candidate = new CellPosition(row, col);
                if (adjacent(position, candidate)) {
                    result.add(candidate);
                }
            }
        }
        return result;
    }
}
