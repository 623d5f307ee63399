package ai.textgrid.parser.surface;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a grid holding only its non-empty cells.
 */
public final class SparseGridSurface implements GridSurface {

    private final int rowCount;
    private final int columnCount;
    private final NavigableMap<CellPosition, String> cells;
    private final List<CellPosition> filledPositions;

    private SparseGridSurface(int rowCount, int columnCount, NavigableMap<CellPosition, String> cells) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.cells = Collections.unmodifiableNavigableMap(cells);
        this.filledPositions = cells.entrySet().stream()
                .filter(entry -> !entry.getValue().isBlank())
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableList());
    }

    public static Builder builder(int rowCount, int columnCount) {
        return new Builder(rowCount, columnCount);
    }

    /**
     * Creates a surface from row-ordered cell values; the grid is sized to the longest row.
     */
    public static SparseGridSurface fromRows(List<List<String>> rows) {
        Objects.requireNonNull(rows, "rows");
        int width = rows.stream().mapToInt(List::size).max().orElse(0);
        Builder builder = builder(rows.size(), width);
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                builder.set(r + 1, c + 1, row.get(c));
            }
        }
        return builder.build();
    }

    @Override
    public String getCellContent(int row, int col) {
        if (row < 1 || col < 1 || row > rowCount || col > columnCount) {
            return "";
        }
        return cells.getOrDefault(new CellPosition(row, col), "");
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public int columnCount() {
        return columnCount;
    }

    @Override
    public List<CellPosition> filledPositions() {
        return filledPositions;
    }

    public int filledCount() {
        return filledPositions.size();
    }

    public static final class Builder {

        private final int rowCount;
        private final int columnCount;
        private final NavigableMap<CellPosition, String> cells = new TreeMap<>();

        private Builder(int rowCount, int columnCount) {
            if (rowCount < 0 || columnCount < 0) {
                throw new IllegalArgumentException("Grid dimensions must not be negative");
            }
            this.rowCount = rowCount;
            this.columnCount = columnCount;
        }

        public Builder set(int row, int col, String content) {
            if (row < 1 || col < 1 || row > rowCount || col > columnCount) {
                throw new IllegalArgumentException("R" + row + "C" + col + " is outside the "
                        + rowCount + "x" + columnCount + " grid");
            }
            CellPosition position = new CellPosition(row, col);
            if (content == null || content.isEmpty()) {
                cells.remove(position);
            } else {
                cells.put(position, content);
            }
            return this;
        }

        public SparseGridSurface build() {
            return new SparseGridSurface(rowCount, columnCount, new TreeMap<>(cells));
        }
    }
}
