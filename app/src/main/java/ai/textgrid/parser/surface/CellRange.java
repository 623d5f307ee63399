package ai.textgrid.parser.surface;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Inclusive rectangle of cells described by its top/bottom rows and left/right columns.
 */
public record CellRange(int topRow, int bottomRow, int leftCol, int rightCol) {

    public CellRange {
        if (topRow < 1 || leftCol < 1) {
            throw new IllegalArgumentException("Cell ranges are 1-indexed");
        }
        if (bottomRow < topRow || rightCol < leftCol) {
            throw new IllegalArgumentException("Invalid cell range boundaries: rows " + topRow + "-" + bottomRow
                    + ", cols " + leftCol + "-" + rightCol);
        }
    }

    public static CellRange of(CellPosition position) {
        return new CellRange(position.row(), position.row(), position.col(), position.col());
    }

    /**
     * Returns the tight box around the given positions.
     */
    public static CellRange enclosing(Collection<CellPosition> positions) {
        Objects.requireNonNull(positions, "positions");
        if (positions.isEmpty()) {
            throw new IllegalArgumentException("Cannot enclose an empty set of positions");
        }
        int top = Integer.MAX_VALUE;
        int bottom = Integer.MIN_VALUE;
        int left = Integer.MAX_VALUE;
        int right = Integer.MIN_VALUE;
        for (CellPosition position : positions) {
            top = Math.min(top, position.row());
            bottom = Math.max(bottom, position.row());
            left = Math.min(left, position.col());
            right = Math.max(right, position.col());
        }
        return new CellRange(top, bottom, left, right);
    }

    /**
     * Builds a range from possibly inverted or out-of-grid edges, returning empty when nothing remains.
     */
    public static Optional<CellRange> clipped(int topRow, int bottomRow, int leftCol, int rightCol) {
        int top = Math.max(1, topRow);
        int left = Math.max(1, leftCol);
        if (bottomRow < top || rightCol < left) {
            return Optional.empty();
        }
        return Optional.of(new CellRange(top, bottomRow, left, rightCol));
    }

    public int height() {
        return bottomRow - topRow + 1;
    }

    public int width() {
        return rightCol - leftCol + 1;
    }

    public int area() {
        return height() * width();
    }

    public CellPosition topLeft() {
        return new CellPosition(topRow, leftCol);
    }

    public boolean contains(int row, int col) {
        return row >= topRow && row <= bottomRow && col >= leftCol && col <= rightCol;
    }

    public boolean contains(CellPosition position) {
        return contains(position.row(), position.col());
    }

    public boolean overlaps(CellRange other) {
        return !(topRow > other.bottomRow || other.topRow > bottomRow
                || leftCol > other.rightCol || other.leftCol > rightCol);
    }

    public Optional<CellRange> intersect(CellRange other) {
        return clipped(Math.max(topRow, other.topRow), Math.min(bottomRow, other.bottomRow),
                Math.max(leftCol, other.leftCol), Math.min(rightCol, other.rightCol));
    }

    @Override
    public String toString() {
        return "R" + topRow + "C" + leftCol + ":R" + bottomRow + "C" + rightCol;
    }
}
