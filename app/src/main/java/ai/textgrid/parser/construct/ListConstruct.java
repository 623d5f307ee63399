package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.classify.Orientation;
import ai.textgrid.parser.classify.Signature;
import ai.textgrid.parser.surface.CellRange;
import java.util.List;
import java.util.Objects;

/**
 * A single line of cells: the first is the header, the rest are items.
 */
public record ListConstruct(String id,
                            CellRange bounds,
                            Signature signature,
                            double confidence,
                            Orientation orientation,
                            List<RoleCell> cells,
                            RoleCell header,
                            List<RoleCell> items) implements Construct {

    public ListConstruct {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(header, "header");
        cells = List.copyOf(cells);
        items = List.copyOf(items);
    }

    @Override
    public ConstructType type() {
        return ConstructType.LIST;
    }

    @Override
    public <R> R accept(ConstructVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    public List<String> itemTexts() {
        return items.stream().map(RoleCell::content).toList();
    }
}
