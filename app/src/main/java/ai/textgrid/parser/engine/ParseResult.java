package ai.textgrid.parser.engine;

import ai.textgrid.parser.classify.ConstructType;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.construct.Construct;
import java.util.List;
import java.util.Objects;

/**
 * Everything one parse of a surface produced.
 *
 * @param constructs top-level constructs in cluster order; nested constructs hang off tree domains
 * @param clusters every top-level cluster found
 * @param unclassified clusters that produced no construct
 * @param diagnostics problems recorded at any depth
 */
public record ParseResult(List<Construct> constructs,
                          List<CellCluster> clusters,
                          List<CellCluster> unclassified,
                          List<ParseDiagnostic> diagnostics) {

    public ParseResult {
        constructs = List.copyOf(Objects.requireNonNull(constructs, "constructs"));
        clusters = List.copyOf(Objects.requireNonNull(clusters, "clusters"));
        unclassified = List.copyOf(Objects.requireNonNull(unclassified, "unclassified"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public <T extends Construct> List<T> constructsOf(Class<T> type) {
        return constructs.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public long count(ConstructType type) {
        return constructs.stream().filter(construct -> construct.type() == type).count();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
