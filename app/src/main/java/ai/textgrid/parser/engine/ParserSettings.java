package ai.textgrid.parser.engine;

import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.construct.TreeBuilder;
import ai.textgrid.parser.domain.TreeDomainResolver;
import java.util.Objects;

/**
 * Tuning knobs of the detection pipeline.
 */
public record ParserSettings(Adjacency adjacency, int maxNestingDepth, int nestedMinCells, int indentWidth) {

    public ParserSettings {
        Objects.requireNonNull(adjacency, "adjacency");
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth must not be negative");
        }
        if (nestedMinCells < 1) {
            throw new IllegalArgumentException("nestedMinCells must be positive");
        }
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive");
        }
    }

    /**
     * Orthogonal adjacency, depth 32, nested domains of at least 4 cells, indent width 2.
     * See {@link Adjacency} for the layouts that need a wider adjacency.
     */
    public static ParserSettings defaults() {
        return new ParserSettings(Adjacency.ORTHOGONAL, TreeDomainResolver.DEFAULT_MAX_NESTING_DEPTH,
                TreeDomainResolver.DEFAULT_NESTED_MIN_CELLS, TreeBuilder.DEFAULT_INDENT_WIDTH);
    }

    public ParserSettings withAdjacency(Adjacency value) {
        return new ParserSettings(value, maxNestingDepth, nestedMinCells, indentWidth);
    }

    public ParserSettings withMaxNestingDepth(int value) {
        return new ParserSettings(adjacency, value, nestedMinCells, indentWidth);
    }

    public ParserSettings withNestedMinCells(int value) {
        return new ParserSettings(adjacency, maxNestingDepth, value, indentWidth);
    }
}
