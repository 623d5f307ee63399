package ai.textgrid.parser.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.textgrid.parser.surface.SparseGridSurface;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GridFileReaderTest {

    private final GridFileReader reader = new GridFileReader();

    @Test
    void readsTsvKeepingIndentation(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("tree.tsv");
        Files.writeString(file, "Root\t\n  Child\tvalue\n", StandardCharsets.UTF_8);

        SparseGridSurface surface = reader.read(file);

        assertThat(surface.rowCount()).isEqualTo(2);
        assertThat(surface.columnCount()).isEqualTo(2);
        assertThat(surface.getCellContent(2, 1)).isEqualTo("  Child");
        assertThat(surface.getCellContent(2, 2)).isEqualTo("value");
        assertThat(surface.isFilled(1, 2)).isFalse();
    }

    @Test
    void readsQuotedCsvFields(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("data.csv");
        Files.writeString(file, "name,quote\r\n\"Smith, Ann\",\"She said \"\"hi\"\"\"\r\nBob,\"two\nlines\"", StandardCharsets.UTF_8);

        SparseGridSurface surface = reader.read(file);

        assertThat(surface.rowCount()).isEqualTo(3);
        assertThat(surface.getCellContent(2, 1)).isEqualTo("Smith, Ann");
        assertThat(surface.getCellContent(2, 2)).isEqualTo("She said \"hi\"");
        assertThat(surface.getCellContent(3, 2)).isEqualTo("two\nlines");
    }

    @Test
    void explicitFormatOverridesExtension() {
        SparseGridSurface surface = reader.parse("a,b\tc", GridFormat.TSV);

        assertThat(surface.getCellContent(1, 1)).isEqualTo("a,b");
        assertThat(surface.getCellContent(1, 2)).isEqualTo("c");
    }

    @Test
    void raggedRowsArePadded() {
        SparseGridSurface surface = reader.parse("a\nb,c,d\n", GridFormat.CSV);

        assertThat(surface.columnCount()).isEqualTo(3);
        assertThat(surface.getCellContent(1, 3)).isEmpty();
    }

    @Test
    void stripsByteOrderMark() {
        SparseGridSurface surface = reader.parse("\uFEFFhead,x", GridFormat.CSV);

        assertThat(surface.getCellContent(1, 1)).isEqualTo("head");
    }

    @Test
    void rejectsUnterminatedQuote() {
        assertThatThrownBy(() -> reader.parse("a,\"open\nb", GridFormat.CSV))
                .isInstanceOf(GridFormatException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    void wrapsMissingFile(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("missing.tsv");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.tsv");
    }

    @Test
    void infersFormatFromFileName() {
        assertThat(GridFormat.fromFileName(Path.of("sheet.CSV"))).isEqualTo(GridFormat.CSV);
        assertThat(GridFormat.fromFileName(Path.of("sheet.txt"))).isEqualTo(GridFormat.TSV);
        assertThat(GridFormat.from("csv")).isEqualTo(GridFormat.CSV);
    }
}
