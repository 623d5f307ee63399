package ai.textgrid.parser.cluster;

import static ai.textgrid.parser.surface.TestGrids.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.textgrid.parser.surface.CellRange;
import java.util.List;
import org.junit.jupiter.api.Test;

class CellClusterTest {

    @Test
    void addressesCellsRelativeToCorner() {
        CellCluster cluster = CellCluster.of(List.of(at(3, 3), at(3, 4), at(4, 4)));

        assertThat(cluster.hasPointAt(1, 1)).isTrue();
        assertThat(cluster.hasPointAt(1, 2)).isTrue();
        assertThat(cluster.hasPointAt(2, 1)).isFalse();
        assertThat(cluster.hasPointAt(2, 2)).isTrue();
        assertThat(cluster.emptyPositions()).containsExactly(at(4, 3));
    }

    @Test
    void rejectsBoundsThatDoNotMatchPoints() {
        CellCluster cluster = new CellCluster(new CellRange(1, 3, 1, 3), List.of(at(1, 1), at(1, 2)));

        assertThatThrownBy(() -> cluster.verifyWellFormed(Adjacency.ORTHOGONAL))
                .isInstanceOf(MalformedClusterException.class)
                .hasMessageContaining("do not match");
    }

    @Test
    void rejectsDisconnectedPoints() {
        CellCluster cluster = CellCluster.of(List.of(at(1, 1), at(2, 2)));

        assertThatThrownBy(() -> cluster.verifyWellFormed(Adjacency.ORTHOGONAL))
                .isInstanceOf(MalformedClusterException.class)
                .hasMessageContaining("not connected");
        cluster.verifyWellFormed(Adjacency.DIAGONAL);
    }

    @Test
    void rejectsEmptyCluster() {
        CellCluster cluster = new CellCluster(new CellRange(1, 1, 1, 1), List.of());

        assertThatThrownBy(() -> cluster.verifyWellFormed(Adjacency.ORTHOGONAL))
                .isInstanceOf(MalformedClusterException.class);
    }

    @Test
    void parsesAdjacencyNames() {
        assertThat(Adjacency.from("diagonal")).isEqualTo(Adjacency.DIAGONAL);
        assertThat(Adjacency.from(" Proximity ")).isEqualTo(Adjacency.PROXIMITY);
        assertThat(Adjacency.from("")).isEqualTo(Adjacency.ORTHOGONAL);
        assertThatThrownBy(() -> Adjacency.from("hex")).isInstanceOf(IllegalArgumentException.class);
    }
}
