package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Orientation;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.GridSurface;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds lists: the first cell along the line is the header, the rest are items.
 */
public class ListBuilder {

    public ListConstruct build(CellCluster cluster, GridSurface surface, Classification classification) {
        Orientation orientation = classification.orientationOrDefault();
        List<CellPosition> ordered = new ArrayList<>(cluster.points());
        ordered.sort(orientation.isTransposed() ? CellPosition.READING_ORDER : CellPosition.COLUMN_ORDER);

        List<RoleCell> cells = new ArrayList<>();
        for (CellPosition position : ordered) {
            CellRole role = cells.isEmpty() ? CellRole.HEADER : CellRole.ITEM;
            cells.add(new RoleCell(position, surface.getCellContent(position).trim(), role));
        }
        if (cells.isEmpty()) {
            throw new IllegalArgumentException("cannot build a list from an empty cluster");
        }

        return new ListConstruct(Construct.idFor(ConstructType.LIST, cluster.bounds()), cluster.bounds(),
                classification.signature(), classification.confidence(), orientation, cells,
                cells.get(0), cells.subList(1, cells.size()));
    }
}
