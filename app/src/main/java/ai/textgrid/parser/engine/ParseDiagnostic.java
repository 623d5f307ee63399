package ai.textgrid.parser.engine;

import ai.textgrid.parser.surface.CellRange;
import java.util.Objects;

/**
 * Non-fatal problem recorded while parsing.
 *
 * @param depth nesting depth at which the problem occurred, 0 for the top-level surface
 */
public record ParseDiagnostic(Kind kind, String message, CellRange range, int depth) {

    public enum Kind {
        MALFORMED_CLUSTER,
        DEPTH_LIMIT_EXCEEDED
    }

    public ParseDiagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(range, "range");
        message = message == null ? "" : message;
    }

    @Override
    public String toString() {
        return kind + " at " + range + " (depth " + depth + "): " + message;
    }
}
