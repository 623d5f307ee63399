package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Signature;
import ai.textgrid.parser.surface.CellRange;
import java.util.List;
import java.util.Objects;

/**
 * Fully headed grid: first row and first column are headers, the rest is body.
 */
public record TableConstruct(String id,
                             CellRange bounds,
                             Signature signature,
                             double confidence,
                             List<RoleCell> cells,
                             List<TableEntity> entities,
                             List<TableAttribute> attributes) implements Construct {

    public TableConstruct {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(signature, "signature");
        cells = List.copyOf(cells);
        entities = List.copyOf(entities);
        attributes = List.copyOf(attributes);
    }

    @Override
    public ConstructType type() {
        return ConstructType.TABLE;
    }

    @Override
    public <R> R accept(ConstructVisitor<R> visitor) {
        return visitor.visitTable(this);
    }

    public List<RoleCell> headerCells() {
        return cellsWithRole(CellRole.HEADER);
    }

    public List<RoleCell> bodyCells() {
        return cellsWithRole(CellRole.BODY);
    }

    public List<RoleCell> rowCells(int row) {
        return cells.stream().filter(cell -> cell.row() == row).toList();
    }

    public List<RoleCell> columnCells(int col) {
        return cells.stream().filter(cell -> cell.col() == col).toList();
    }

    public int rowCount() {
        return bounds.height();
    }

    public int columnCount() {
        return bounds.width();
    }
}
