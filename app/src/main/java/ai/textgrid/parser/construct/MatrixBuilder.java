package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.GridSurface;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds matrices: primary headers run along the first row, secondary headers down the first column.
 */
public class MatrixBuilder {

    public MatrixConstruct build(CellCluster cluster, GridSurface surface, Classification classification) {
        int top = cluster.topRow();
        int left = cluster.leftCol();
        List<RoleCell> cells = new ArrayList<>();
        for (CellPosition position : cluster.points()) {
            if (position.row() == top && position.col() == left) {
                continue;
            }
            CellRole role;
            if (position.row() == top) {
                role = CellRole.PRIMARY_HEADER;
            } else if (position.col() == left) {
                role = CellRole.SECONDARY_HEADER;
            } else {
                role = CellRole.BODY;
            }
            cells.add(new RoleCell(position, surface.getCellContent(position).trim(), role));
        }

        List<MatrixEntity> primary = new ArrayList<>();
        for (RoleCell header : cells) {
            if (header.role() != CellRole.PRIMARY_HEADER) {
                continue;
            }
            List<RoleCell> body = cells.stream()
                    .filter(cell -> cell.role() == CellRole.BODY && cell.col() == header.col())
                    .toList();
            primary.add(new MatrixEntity(header.col() - left, header, body));
        }

        List<MatrixEntity> secondary = new ArrayList<>();
        for (RoleCell header : cells) {
            if (header.role() != CellRole.SECONDARY_HEADER) {
                continue;
            }
            List<RoleCell> body = cells.stream()
                    .filter(cell -> cell.role() == CellRole.BODY && cell.row() == header.row())
                    .toList();
            secondary.add(new MatrixEntity(header.row() - top, header, body));
        }

        return new MatrixConstruct(Construct.idFor(ConstructType.MATRIX, cluster.bounds()), cluster.bounds(),
                classification.signature(), classification.confidence(), cells, primary, secondary);
    }
}
