package ai.textgrid.parser.construct;

/**
 * Role of an element inside a tree.
 *
 * <p>{@code CHILD} is only assigned while the tree is being linked; a finished tree holds anchors,
 * parents (elements that own children) and leaves.
 */
public enum ElementRole {
    ANCHOR,
    PARENT,
    CHILD,
    LEAF;

    CellRole cellRole() {
        return switch (this) {
            case ANCHOR -> CellRole.ANCHOR;
            case PARENT -> CellRole.PARENT;
            case CHILD -> CellRole.CHILD;
            case LEAF -> CellRole.LEAF;
        };
    }
}
