package ai.textgrid.parser.construct;

/**
 * Structural role a cell plays inside its construct.
 */
public enum CellRole {
    HEADER,
    BODY,
    PRIMARY_HEADER,
    SECONDARY_HEADER,
    MAIN_HEADER,
    KEY,
    VALUE,
    ITEM,
    ANCHOR,
    PARENT,
    CHILD,
    LEAF
}
