package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ConstructClassifier;
import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.cluster.ClusterFinder;
import ai.textgrid.parser.surface.GridSurface;

final class ConstructFixtures {

    private ConstructFixtures() {
    }

    static Construct buildSingle(GridSurface surface, Adjacency adjacency) {
        CellCluster cluster = new ClusterFinder(adjacency).findClusters(surface).get(0);
        Classification classification = new ConstructClassifier(adjacency).classify(cluster, surface)
                .orElseThrow(() -> new AssertionError("cluster " + cluster + " did not classify"));
        return new ConstructBuilder().build(cluster, surface, classification);
    }
}
