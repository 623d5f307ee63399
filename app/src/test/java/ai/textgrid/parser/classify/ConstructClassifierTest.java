package ai.textgrid.parser.classify;

import static ai.textgrid.parser.surface.TestGrids.at;
import static ai.textgrid.parser.surface.TestGrids.grid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.cluster.ClusterFinder;
import ai.textgrid.parser.cluster.MalformedClusterException;
import ai.textgrid.parser.surface.CellRange;
import ai.textgrid.parser.surface.SparseGridSurface;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConstructClassifierTest {

    @Test
    void lookupCoversEveryBinaryKey() {
        Set<Integer> constructKeys = Set.of(7, 9, 10, 11, 12, 13, 15);
        for (int key = 0; key < 16; key++) {
            Optional<Classification> classification = ConstructClassifier.lookup(Signature.binary(key));
            assertThat(classification.isPresent()).as("key %d", key).isEqualTo(constructKeys.contains(key));
        }
        assertThat(ConstructClassifier.lookup(Signature.binary(7))).get()
                .extracting(Classification::constructType).isEqualTo(ConstructType.MATRIX);
        assertThat(ConstructClassifier.lookup(Signature.binary(9))).get()
                .extracting(Classification::constructType, Classification::orientation)
                .containsExactly(ConstructType.KEY_VALUE, Optional.of(Orientation.VERTICAL));
        assertThat(ConstructClassifier.lookup(Signature.binary(11))).get()
                .extracting(Classification::constructType, Classification::orientation, Classification::hasChildHeader)
                .containsExactly(ConstructType.TREE, Optional.of(Orientation.VERTICAL), true);
        assertThat(ConstructClassifier.lookup(Signature.binary(12))).get()
                .extracting(Classification::orientation, Classification::hasChildHeader)
                .containsExactly(Optional.of(Orientation.HORIZONTAL), false);
        assertThat(ConstructClassifier.lookup(Signature.binary(15))).get()
                .extracting(Classification::constructType, Classification::confidence)
                .containsExactly(ConstructType.TABLE, 1.0);
    }

    @Test
    void lookupHandlesSentinels() {
        assertThat(ConstructClassifier.lookup(Signature.SINGLE_CELL)).isEmpty();
        assertThat(ConstructClassifier.lookup(Signature.VERTICAL_LIST)).get()
                .extracting(Classification::constructType, Classification::orientation)
                .containsExactly(ConstructType.LIST, Optional.of(Orientation.VERTICAL));
        assertThat(ConstructClassifier.lookup(Signature.HORIZONTAL_LIST)).get()
                .extracting(Classification::orientation)
                .isEqualTo(Optional.of(Orientation.HORIZONTAL));
    }

    @Test
    void computesSignatureFromCornerQuadrant() {
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a|b", "c|d")).hasToString("15");
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "|b", "c|d")).hasToString("7");
        assertThat(signatureOf(Adjacency.DIAGONAL, "a|", "|d")).hasToString("9");
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a|", "b|", "c|d")).hasToString("10");
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a|", "b|c")).hasToString("11");
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a|b|c", "||d")).hasToString("12");
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a|b", "|c")).hasToString("13");
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a|b", "c|")).hasToString("14");
        assertThat(signatureOf(Adjacency.DIAGONAL, "|b", "c|")).hasToString("6");
        assertThat(signatureOf(Adjacency.PROXIMITY, "a||", "", "||b")).hasToString("8");
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a")).isEqualTo(Signature.SINGLE_CELL);
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a", "b", "c")).isEqualTo(Signature.VERTICAL_LIST);
        assertThat(signatureOf(Adjacency.ORTHOGONAL, "a|b|c")).isEqualTo(Signature.HORIZONTAL_LIST);
    }

    @Test
    void classificationIsDeterministic() {
        SparseGridSurface surface = grid("Name|Age", "Ann|30");
        CellCluster cluster = new ClusterFinder().findClusters(surface).get(0);
        ConstructClassifier classifier = new ConstructClassifier();

        assertThat(classifier.classify(cluster, surface)).isEqualTo(classifier.classify(cluster, surface));
    }

    @Test
    void notifiesListenerWithSignature() {
        SparseGridSurface surface = grid("x");
        List<Signature> seen = new ArrayList<>();
        ConstructClassifier classifier = new ConstructClassifier(Adjacency.ORTHOGONAL,
                (cluster, signature, classification) -> seen.add(signature));

        Optional<Classification> classification = classifier.classify(
                new ClusterFinder().findClusters(surface).get(0), surface);

        assertThat(classification).isEmpty();
        assertThat(seen).containsExactly(Signature.SINGLE_CELL);
    }

    @Test
    void rejectsClusterWhosePointIsEmptyOnSurface() {
        SparseGridSurface surface = grid("a|");
        CellCluster cluster = CellCluster.of(List.of(at(1, 1), at(1, 2)));

        assertThatThrownBy(() -> new ConstructClassifier().classify(cluster, surface))
                .isInstanceOf(MalformedClusterException.class)
                .hasMessageContaining("R1C2");
    }

    @Test
    void rejectsClusterWithLooseBounds() {
        SparseGridSurface surface = grid("a|b");
        CellCluster cluster = new CellCluster(new CellRange(1, 2, 1, 2), List.of(at(1, 1), at(1, 2)));

        assertThatThrownBy(() -> new ConstructClassifier().classify(cluster, surface))
                .isInstanceOf(MalformedClusterException.class);
    }

    @Test
    void signatureDescribesPattern() {
        Signature signature = Signature.binary(true, false, true, true);

        assertThat(signature.key()).isEqualTo(11);
        assertThat(signature.pattern()).isEqualTo("10\n11");
        assertThat(signature.description()).isEqualTo("Tree (Regular, with Header)");
        assertThat(Signature.VERTICAL_LIST.code()).isEqualTo("VL");
    }

    private static Signature signatureOf(Adjacency adjacency, String... rows) {
        SparseGridSurface surface = grid(rows);
        List<CellCluster> clusters = new ClusterFinder(adjacency).findClusters(surface);
        assertThat(clusters).hasSize(1);
        return new ConstructClassifier(adjacency).computeSignature(clusters.get(0));
    }
}
