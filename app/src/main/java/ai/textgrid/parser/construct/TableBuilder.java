package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.GridSurface;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds tables: the first row and the first column are headers.
 */
public class TableBuilder {

    public TableConstruct build(CellCluster cluster, GridSurface surface, Classification classification) {
        int top = cluster.topRow();
        int left = cluster.leftCol();
        List<RoleCell> cells = new ArrayList<>();
        for (CellPosition position : cluster.points()) {
            CellRole role = position.row() == top || position.col() == left ? CellRole.HEADER : CellRole.BODY;
            cells.add(new RoleCell(position, surface.getCellContent(position).trim(), role));
        }

        List<TableEntity> entities = new ArrayList<>();
        for (int row = top + 1; row <= cluster.bottomRow(); row++) {
            int current = row;
            List<RoleCell> rowCells = cells.stream().filter(cell -> cell.row() == current).toList();
            entities.add(new TableEntity(entities.size(), row, rowCells));
        }

        List<TableAttribute> attributes = new ArrayList<>();
        for (int col = left; col <= cluster.rightCol(); col++) {
            int current = col;
            List<RoleCell> column = cells.stream().filter(cell -> cell.col() == current).toList();
            attributes.add(new TableAttribute(attributes.size(), col,
                    column.stream().filter(cell -> cell.role() == CellRole.HEADER).findFirst(),
                    column.stream().filter(cell -> cell.role() == CellRole.BODY).toList()));
        }

        return new TableConstruct(Construct.idFor(ConstructType.TABLE, cluster.bounds()), cluster.bounds(),
                classification.signature(), classification.confidence(), cells, entities, attributes);
    }
}
