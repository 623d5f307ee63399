package ai.textgrid.parser.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Delimited text formats a grid can be read from.
 */
public enum GridFormat {
    TSV('\t'),
    CSV(',');

    private final char delimiter;

    GridFormat(char delimiter) {
        this.delimiter = delimiter;
    }

    public char delimiter() {
        return delimiter;
    }

    public static GridFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Grid format must be provided");
        }
        return GridFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Format implied by a file extension, TSV when the extension is missing or unknown.
     */
    public static GridFormat fromFileName(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") ? CSV : TSV;
    }
}
