package ai.textgrid.parser.io;

import ai.textgrid.parser.surface.SparseGridSurface;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a grid from TSV or CSV text.
 *
 * <p>Fields may be wrapped in double quotes, in which case they can contain the delimiter, line
 * breaks and doubled quotes. Unquoted fields are kept verbatim, leading spaces included, since
 * indentation carries tree levels. Rows may have different lengths.
 */
public class GridFileReader {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLUMNS = 16_384;

    private static final Logger LOGGER = LoggerFactory.getLogger(GridFileReader.class);

    public SparseGridSurface read(Path path) {
        return read(path, GridFormat.fromFileName(path));
    }

    public SparseGridSurface read(Path path, GridFormat format) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(format, "format");
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read grid file " + path, ex);
        }
        SparseGridSurface surface = parse(text, format);
        LOGGER.info("Loaded {} grid {} ({} rows x {} columns, {} filled cells)",
                format, path, surface.rowCount(), surface.columnCount(), surface.filledCount());
        return surface;
    }

    public SparseGridSurface parse(String text, GridFormat format) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(format, "format");
        return SparseGridSurface.fromRows(split(stripBom(text), format.delimiter()));
    }

    private List<List<String>> split(String text, char delimiter) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStarted = false;
        int line = 1;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i += 2;
                        continue;
                    }
                    quoted = false;
                } else {
                    if (ch == '\n') {
                        line++;
                    }
                    field.append(ch);
                }
                i++;
                continue;
            }
            if (ch == '"' && !fieldStarted && field.isEmpty()) {
                quoted = true;
                fieldStarted = true;
            } else if (ch == delimiter) {
                addField(row, field);
                fieldStarted = false;
            } else if (ch == '\r' || ch == '\n') {
                addField(row, field);
                fieldStarted = false;
                addRow(rows, row);
                row = new ArrayList<>();
                if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                line++;
            } else {
                field.append(ch);
                fieldStarted = true;
            }
            i++;
        }
        if (quoted) {
            throw new GridFormatException("Unterminated quoted field starting before line " + line);
        }
        if (fieldStarted || !field.isEmpty() || !row.isEmpty()) {
            addField(row, field);
            addRow(rows, row);
        }
        return rows;
    }

    private void addField(List<String> row, StringBuilder field) {
        if (row.size() >= MAX_COLUMNS) {
            throw new GridFormatException("Row has more than " + MAX_COLUMNS + " columns");
        }
        row.add(field.toString());
        field.setLength(0);
    }

    private void addRow(List<List<String>> rows, List<String> row) {
        if (rows.size() >= MAX_ROWS) {
            throw new GridFormatException("Grid has more than " + MAX_ROWS + " rows");
        }
        rows.add(row);
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }
}
