package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Orientation;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.GridSurface;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds key-value blocks.
 *
 * <p>Vertical: the corner is the main header, keys sit in the second column and values to their right.
 * Horizontal is the transpose: keys in the second row, values below. Cells in neither band are dropped.
 */
public class KeyValueBuilder {

    public KeyValueConstruct build(CellCluster cluster, GridSurface surface, Classification classification) {
        Orientation orientation = classification.orientationOrDefault();
        int top = cluster.topRow();
        int left = cluster.leftCol();
        List<RoleCell> cells = new ArrayList<>();
        RoleCell mainHeader = null;
        for (CellPosition position : cluster.points()) {
            int along = orientation.isTransposed() ? position.col() - left : position.row() - top;
            int across = orientation.isTransposed() ? position.row() - top : position.col() - left;
            CellRole role;
            if (along == 0 && across == 0) {
                role = CellRole.MAIN_HEADER;
            } else if (along > 0 && across == 1) {
                role = CellRole.KEY;
            } else if (along > 0 && across > 1) {
                role = CellRole.VALUE;
            } else {
                continue;
            }
            RoleCell cell = new RoleCell(position, surface.getCellContent(position).trim(), role);
            if (role == CellRole.MAIN_HEADER) {
                mainHeader = cell;
            }
            cells.add(cell);
        }

        List<KeyValuePair> pairs = new ArrayList<>();
        for (RoleCell key : cells) {
            if (key.role() != CellRole.KEY) {
                continue;
            }
            List<RoleCell> values = cells.stream()
                    .filter(cell -> cell.role() == CellRole.VALUE)
                    .filter(cell -> orientation.isTransposed() ? cell.col() == key.col() : cell.row() == key.row())
                    .sorted((a, b) -> orientation.isTransposed()
                            ? Integer.compare(a.row(), b.row())
                            : Integer.compare(a.col(), b.col()))
                    .toList();
            pairs.add(new KeyValuePair(key, values));
        }
        if (orientation.isTransposed()) {
            pairs.sort((a, b) -> Integer.compare(a.key().col(), b.key().col()));
        }

        return new KeyValueConstruct(Construct.idFor(ConstructType.KEY_VALUE, cluster.bounds()), cluster.bounds(),
                classification.signature(), classification.confidence(), orientation, cells,
                Optional.ofNullable(mainHeader), pairs);
    }
}
