package ai.textgrid.parser.surface;

import static ai.textgrid.parser.surface.TestGrids.at;
import static ai.textgrid.parser.surface.TestGrids.grid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SparseGridSurfaceTest {

    @Test
    void treatsBlankAndOutOfGridCellsAsUnfilled() {
        SparseGridSurface surface = grid("a|  |b", "|c");

        assertThat(surface.rowCount()).isEqualTo(2);
        assertThat(surface.columnCount()).isEqualTo(3);
        assertThat(surface.getCellContent(1, 3)).isEqualTo("b");
        assertThat(surface.isFilled(1, 2)).isFalse();
        assertThat(surface.getCellContent(5, 5)).isEmpty();
        assertThat(surface.getCellContent(0, 1)).isEmpty();
        assertThat(surface.filledPositions()).containsExactly(at(1, 1), at(1, 3), at(2, 2));
        assertThat(surface.filledCount()).isEqualTo(3);
    }

    @Test
    void keepsLeadingWhitespaceInContent() {
        SparseGridSurface surface = grid("    indented");

        assertThat(surface.getCellContent(at(1, 1))).isEqualTo("    indented");
    }

    @Test
    void builderRejectsCellsOutsideGrid() {
        SparseGridSurface.Builder builder = SparseGridSurface.builder(2, 2);

        assertThatThrownBy(() -> builder.set(3, 1, "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void regionSurfaceHidesCellsOutsideRegion() {
        SparseGridSurface surface = grid("a|b|c", "d|e|f", "g|h|i");
        RegionSurface region = new RegionSurface(surface, new CellRange(2, 3, 2, 3));

        assertThat(region.getCellContent(2, 2)).isEqualTo("e");
        assertThat(region.getCellContent(1, 1)).isEmpty();
        assertThat(region.isFilled(2, 1)).isFalse();
        assertThat(region.bounds()).isEqualTo(new CellRange(2, 3, 2, 3));
        assertThat(region.filledPositions()).containsExactly(at(2, 2), at(2, 3), at(3, 2), at(3, 3));
    }
}
