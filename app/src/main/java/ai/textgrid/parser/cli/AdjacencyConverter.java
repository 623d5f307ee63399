package ai.textgrid.parser.cli;

import ai.textgrid.parser.cluster.Adjacency;
import picocli.CommandLine;

/**
 * Parses the {@code --adjacency} option.
 */
public class AdjacencyConverter implements CommandLine.ITypeConverter<Adjacency> {
    @Override
    public Adjacency convert(String value) {
        return Adjacency.from(value);
    }
}
