package ai.textgrid.parser.surface;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a sparse grid of text cells.
 *
 * <p>Implementations return an empty string for unfilled cells and for coordinates outside the grid.
 * A cell whose content is blank counts as unfilled.
 */
public interface GridSurface {

    String getCellContent(int row, int col);

    int rowCount();

    int columnCount();

    default String getCellContent(CellPosition position) {
        return getCellContent(position.row(), position.col());
    }

    default boolean isFilled(int row, int col) {
        String content = getCellContent(row, col);
        return content != null && !content.isBlank();
    }

    default boolean isFilled(CellPosition position) {
        return isFilled(position.row(), position.col());
    }

    /**
     * Rectangle the surface may hold filled cells in.
     */
    default CellRange bounds() {
        return new CellRange(1, Math.max(1, rowCount()), 1, Math.max(1, columnCount()));
    }

    /**
     * Filled positions in reading order. The default scans {@link #bounds()} cell by cell.
     */
    default List<CellPosition> filledPositions() {
        if (rowCount() < 1 || columnCount() < 1) {
            return List.of();
        }
        CellRange bounds = bounds();
        List<CellPosition> filled = new ArrayList<>();
        for (int row = bounds.topRow(); row <= bounds.bottomRow(); row++) {
            for (int col = bounds.leftCol(); col <= bounds.rightCol(); col++) {
                if (isFilled(row, col)) {
                    filled.add(new CellPosition(row, col));
                }
            }
        }
        return filled;
    }
}
