package ai.textgrid.parser.config;

import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.engine.ParserSettings;
import ai.textgrid.parser.io.GridFormat;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Path input,
        GridFormat format,
        Adjacency adjacency,
        int maxNestingDepth,
        int nestedMinCells,
        int indentWidth,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(adjacency, "adjacency");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth must be greater than or equal to zero");
        }
        if (nestedMinCells < 1) {
            throw new IllegalArgumentException("nestedMinCells must be at least 1");
        }
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be at least 1");
        }
    }

    public ParserSettings parserSettings() {
        return new ParserSettings(adjacency, maxNestingDepth, nestedMinCells, indentWidth);
    }
}
