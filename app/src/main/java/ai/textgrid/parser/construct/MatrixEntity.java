package ai.textgrid.parser.construct;

import java.util.List;
import java.util.Objects;

/**
 * A matrix column (primary) or row (secondary) headed by one header cell.
 *
 * @param offset distance of the column or row from the matrix corner, starting at 1
 */
public record MatrixEntity(int offset, RoleCell header, List<RoleCell> bodyCells) {

    public MatrixEntity {
        Objects.requireNonNull(header, "header");
        bodyCells = List.copyOf(Objects.requireNonNull(bodyCells, "bodyCells"));
    }

    public String name() {
        return header.content();
    }
}
