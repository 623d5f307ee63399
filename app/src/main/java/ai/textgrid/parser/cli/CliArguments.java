package ai.textgrid.parser.cli;

import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.config.LogFormat;
import ai.textgrid.parser.io.GridFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "textgrid-parser", mixinStandardHelpOptions = true, version = "textgrid-parser 0.1.0",
        description = "Detects tables, matrices, key-value blocks, lists and trees in a TSV or CSV grid")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "Grid file to parse (TSV or CSV)")
    private Path input;

    @CommandLine.Option(names = "--format", converter = GridFormatConverter.class, description = "Input format: tsv or csv (default: from file extension)")
    private GridFormat format;

    @CommandLine.Option(names = "--adjacency", converter = AdjacencyConverter.class, description = "Cell connectivity: orthogonal, diagonal or proximity")
    private Adjacency adjacency;

    @CommandLine.Option(names = "--max-depth", paramLabel = "N", description = "Maximum tree domain nesting depth")
    private Integer maxDepth;

    @CommandLine.Option(names = "--nested-min-cells", paramLabel = "N", description = "Minimum filled cells for a tree domain to be parsed")
    private Integer nestedMinCells;

    @CommandLine.Option(names = "--indent-width", paramLabel = "N", description = "Leading spaces per tree level")
    private Integer indentWidth;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public GridFormat format() {
        return format;
    }

    public Adjacency adjacency() {
        return adjacency;
    }

    public Integer maxDepth() {
        return maxDepth;
    }

    public Integer nestedMinCells() {
        return nestedMinCells;
    }

    public Integer indentWidth() {
        return indentWidth;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
