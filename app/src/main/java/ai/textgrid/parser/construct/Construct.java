package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Signature;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.CellRange;
import java.util.List;
import java.util.Optional;

/**
 * A recognized structure. The five variants are matched exhaustively through {@link ConstructVisitor}.
 */
public sealed interface Construct
        permits TableConstruct, MatrixConstruct, KeyValueConstruct, ListConstruct, TreeConstruct {

    String id();

    ConstructType type();

    CellRange bounds();

    Signature signature();

    double confidence();

    /**
     * Cells of the construct with their roles, in the order the builder visited them.
     */
    List<RoleCell> cells();

    <R> R accept(ConstructVisitor<R> visitor);

    default List<RoleCell> cellsWithRole(CellRole role) {
        return cells().stream().filter(cell -> cell.role() == role).toList();
    }

    default Optional<RoleCell> cellAt(CellPosition position) {
        return cells().stream().filter(cell -> cell.position().equals(position)).findFirst();
    }

    static String idFor(ConstructType type, CellRange bounds) {
        return type.label() + "@" + bounds.topLeft();
    }
}
