package ai.textgrid.parser.construct;

import ai.textgrid.parser.surface.CellPosition;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * One node of a tree, addressed by its index in {@link TreeConstruct#elements()}.
 *
 * @param rawContent cell content as read from the surface, leading whitespace included
 * @param content trimmed content
 * @param parentIndex index of the parent element, empty for roots
 * @param childIndices indices of the direct children in extraction order
 */
public record TreeElement(int index,
                          CellPosition position,
                          String rawContent,
                          String content,
                          int level,
                          ElementRole role,
                          OptionalInt parentIndex,
                          List<Integer> childIndices) {

    public TreeElement {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(role, "role");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative");
        }
        rawContent = rawContent == null ? "" : rawContent;
        content = content == null ? "" : content;
        parentIndex = parentIndex == null ? OptionalInt.empty() : parentIndex;
        childIndices = List.copyOf(Objects.requireNonNull(childIndices, "childIndices"));
    }

    public boolean isRoot() {
        return parentIndex.isEmpty();
    }

    public boolean hasChildren() {
        return !childIndices.isEmpty();
    }

    RoleCell toRoleCell() {
        return new RoleCell(position, content, role.cellRole());
    }
}
