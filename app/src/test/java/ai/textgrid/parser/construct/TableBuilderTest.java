package ai.textgrid.parser.construct;

import static ai.textgrid.parser.surface.TestGrids.at;
import static ai.textgrid.parser.surface.TestGrids.grid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.cluster.Adjacency;
import org.junit.jupiter.api.Test;

class TableBuilderTest {

    @Test
    void firstRowAndColumnAreHeaders() {
        Construct construct = ConstructFixtures.buildSingle(grid(
                "Name|Age|City",
                "Alice|30|NYC",
                "Bob|25|LA"), Adjacency.ORTHOGONAL);

        assertThat(construct).isInstanceOf(TableConstruct.class);
        TableConstruct table = (TableConstruct) construct;
        assertThat(table.type()).isEqualTo(ConstructType.TABLE);
        assertThat(table.id()).isEqualTo("table@R1C1");
        assertThat(table.signature().key()).isEqualTo(15);
        assertThat(table.headerCells()).extracting(RoleCell::content)
                .containsExactly("Name", "Age", "City", "Alice", "Bob");
        assertThat(table.bodyCells()).extracting(RoleCell::content)
                .containsExactly("30", "NYC", "25", "LA");
        assertThat(table.entities()).extracting(TableEntity::row).containsExactly(2, 3);
        assertThat(table.attributes())
                .extracting(TableAttribute::col, TableAttribute::name, attribute -> attribute.bodyCells().size())
                .containsExactly(tuple(1, "Name", 0), tuple(2, "Age", 2), tuple(3, "City", 2));
        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.columnCount()).isEqualTo(3);
        assertThat(table.cellAt(at(2, 3))).get().extracting(RoleCell::content).isEqualTo("NYC");
        assertThat(table.rowCells(3)).extracting(RoleCell::content).containsExactly("Bob", "25", "LA");
        assertThat(table.columnCells(2)).extracting(RoleCell::role)
                .containsExactly(CellRole.HEADER, CellRole.BODY, CellRole.BODY);
    }

    @Test
    void trimsCellContent() {
        TableConstruct table = (TableConstruct) ConstructFixtures.buildSingle(grid(
                " a |b",
                "c| d "), Adjacency.ORTHOGONAL);

        assertThat(table.cells()).extracting(RoleCell::content).containsExactly("a", "b", "c", "d");
    }
}
