package ai.textgrid.parser.construct;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One column of a table: its header cell and the body cells below it.
 */
public record TableAttribute(int index, int col, Optional<RoleCell> header, List<RoleCell> bodyCells) {

    public TableAttribute {
        header = header == null ? Optional.empty() : header;
        bodyCells = List.copyOf(Objects.requireNonNull(bodyCells, "bodyCells"));
    }

    public String name() {
        return header.map(RoleCell::content).orElse("");
    }
}
