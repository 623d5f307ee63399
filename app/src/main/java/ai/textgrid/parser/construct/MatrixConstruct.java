package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Signature;
import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.CellRange;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cross-tabulation with an empty corner: column headers along the top, row headers down the left.
 */
public record MatrixConstruct(String id,
                              CellRange bounds,
                              Signature signature,
                              double confidence,
                              List<RoleCell> cells,
                              List<MatrixEntity> primaryEntities,
                              List<MatrixEntity> secondaryEntities) implements Construct {

    public MatrixConstruct {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(signature, "signature");
        cells = List.copyOf(cells);
        primaryEntities = List.copyOf(primaryEntities);
        secondaryEntities = List.copyOf(secondaryEntities);
    }

    @Override
    public ConstructType type() {
        return ConstructType.MATRIX;
    }

    @Override
    public <R> R accept(ConstructVisitor<R> visitor) {
        return visitor.visitMatrix(this);
    }

    public CellPosition emptyCorner() {
        return bounds.topLeft();
    }

    public List<RoleCell> primaryHeaders() {
        return cellsWithRole(CellRole.PRIMARY_HEADER);
    }

    public List<RoleCell> secondaryHeaders() {
        return cellsWithRole(CellRole.SECONDARY_HEADER);
    }

    public List<RoleCell> bodyCells() {
        return cellsWithRole(CellRole.BODY);
    }

    /**
     * Body cell where a primary (column) entity meets a secondary (row) entity.
     */
    public Optional<RoleCell> intersection(MatrixEntity primary, MatrixEntity secondary) {
        CellPosition position = new CellPosition(secondary.header().row(), primary.header().col());
        return cellAt(position).filter(cell -> cell.role() == CellRole.BODY);
    }

    /**
     * Body cell addressed by 0-based indices into {@link #primaryEntities()} and {@link #secondaryEntities()}.
     */
    public Optional<RoleCell> intersection(int primaryIndex, int secondaryIndex) {
        if (primaryIndex < 0 || primaryIndex >= primaryEntities.size()
                || secondaryIndex < 0 || secondaryIndex >= secondaryEntities.size()) {
            return Optional.empty();
        }
        return intersection(primaryEntities.get(primaryIndex), secondaryEntities.get(secondaryIndex));
    }

    /**
     * Body cell addressed by header contents.
     */
    public Optional<RoleCell> intersection(String primaryHeader, String secondaryHeader) {
        Optional<MatrixEntity> primary = primaryEntities.stream()
                .filter(entity -> entity.name().equals(primaryHeader)).findFirst();
        Optional<MatrixEntity> secondary = secondaryEntities.stream()
                .filter(entity -> entity.name().equals(secondaryHeader)).findFirst();
        if (primary.isEmpty() || secondary.isEmpty()) {
            return Optional.empty();
        }
        return intersection(primary.get(), secondary.get());
    }

    public boolean isSquare() {
        return primaryEntities.size() == secondaryEntities.size();
    }
}
