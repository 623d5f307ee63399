package ai.textgrid.parser.construct;

/**
 * Outcome of parsing the region a tree parent owns.
 */
public enum DomainStatus {
    /** A construct was found inside the region. */
    NESTED_CONSTRUCT,
    /** The region held enough cells but none of its clusters classified. */
    NO_CONSTRUCT,
    /** Fewer filled cells than the nested-parse threshold. */
    TOO_SMALL,
    /** Clipping left no rectangle to parse. */
    EMPTY,
    /** Nested parsing stopped at the configured maximum depth. */
    DEPTH_LIMIT_EXCEEDED
}
