package ai.textgrid.parser.classify;

import ai.textgrid.parser.cluster.CellCluster;
import java.util.Optional;

/**
 * Receives a trace of every classification decision.
 */
@FunctionalInterface
public interface ClassificationListener {

    ClassificationListener NONE = (cluster, signature, classification) -> {
    };

    void onClassified(CellCluster cluster, Signature signature, Optional<Classification> classification);
}
