package ai.textgrid.parser.construct;

import ai.textgrid.parser.surface.CellPosition;
import java.util.Objects;

/**
 * A filled cell with its trimmed content and the role it was assigned.
 */
public record RoleCell(CellPosition position, String content, CellRole role) {

    public RoleCell {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public int row() {
        return position.row();
    }

    public int col() {
        return position.col();
    }
}
