package ai.textgrid.parser.surface;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds surfaces from rows written as {@code "a|b||c"}; empty segments are empty cells.
 */
public final class TestGrids {

    private TestGrids() {
    }

    public static SparseGridSurface grid(String... rows) {
        List<List<String>> cells = new ArrayList<>();
        for (String row : rows) {
            cells.add(Arrays.asList(row.split("\\|", -1)));
        }
        return SparseGridSurface.fromRows(cells);
    }

    public static CellPosition at(int row, int col) {
        return new CellPosition(row, col);
    }
}
