package ai.textgrid.parser.cluster;

import static ai.textgrid.parser.surface.TestGrids.at;
import static ai.textgrid.parser.surface.TestGrids.grid;
import static org.assertj.core.api.Assertions.assertThat;

import ai.textgrid.parser.surface.CellPosition;
import ai.textgrid.parser.surface.CellRange;
import ai.textgrid.parser.surface.SparseGridSurface;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ClusterFinderTest {

    @Test
    void returnsNothingForEmptySurface() {
        assertThat(new ClusterFinder().findClusters(grid("|", "|"))).isEmpty();
    }

    @Test
    void partitionsFilledCellsIntoDisjointClusters() {
        SparseGridSurface surface = grid(
                "a|b||x",
                "c|||y",
                "",
                "|z|z|");

        List<CellCluster> clusters = new ClusterFinder().findClusters(surface);

        assertThat(clusters).extracting(CellCluster::bounds).containsExactly(
                new CellRange(1, 2, 1, 2),
                new CellRange(1, 2, 4, 4),
                new CellRange(4, 4, 2, 3));
        Set<CellPosition> covered = new HashSet<>();
        int total = 0;
        for (CellCluster cluster : clusters) {
            covered.addAll(cluster.points());
            total += cluster.size();
            assertThat(cluster.bounds()).isEqualTo(CellRange.enclosing(cluster.points()));
        }
        assertThat(total).isEqualTo(covered.size());
        assertThat(covered).containsExactlyInAnyOrderElementsOf(surface.filledPositions());
    }

    @Test
    void diagonalNeighboursStaySeparateUnderOrthogonalAdjacency() {
        SparseGridSurface surface = grid("a|", "|b");

        assertThat(new ClusterFinder().findClusters(surface)).hasSize(2);
        assertThat(new ClusterFinder(Adjacency.DIAGONAL).findClusters(surface))
                .singleElement()
                .extracting(CellCluster::points)
                .isEqualTo(List.of(at(1, 1), at(2, 2)));
    }

    @Test
    void proximityBridgesSingleEmptyCell() {
        SparseGridSurface surface = grid("a||b", "", "|||c");

        assertThat(new ClusterFinder(Adjacency.DIAGONAL).findClusters(surface)).hasSize(3);
        assertThat(new ClusterFinder(Adjacency.PROXIMITY).findClusters(surface)).hasSize(1);
    }

    @Test
    void whitespaceOnlyCellsDoNotJoinClusters() {
        SparseGridSurface surface = grid("a| |b");

        assertThat(new ClusterFinder().findClusters(surface)).hasSize(2);
    }
}
