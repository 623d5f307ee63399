package ai.textgrid.parser.surface;

import java.util.Comparator;

/**
 * A 1-indexed (row, column) coordinate on a grid surface.
 */
public record CellPosition(int row, int col) implements Comparable<CellPosition> {

    /** Row-major order: top to bottom, then left to right. */
    public static final Comparator<CellPosition> READING_ORDER =
            Comparator.comparingInt(CellPosition::row).thenComparingInt(CellPosition::col);

    /** Column-major order: left to right, then top to bottom. */
    public static final Comparator<CellPosition> COLUMN_ORDER =
            Comparator.comparingInt(CellPosition::col).thenComparingInt(CellPosition::row);

    public CellPosition {
        if (row < 1 || col < 1) {
            throw new IllegalArgumentException("Cell positions are 1-indexed, got R" + row + "C" + col);
        }
    }

    public static CellPosition of(int row, int col) {
        return new CellPosition(row, col);
    }

    public CellPosition offset(int rowDelta, int colDelta) {
        return new CellPosition(row + rowDelta, col + colDelta);
    }

    @Override
    public int compareTo(CellPosition other) {
        return READING_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "R" + row + "C" + col;
    }
}
