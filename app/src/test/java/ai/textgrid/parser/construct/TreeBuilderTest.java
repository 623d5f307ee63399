package ai.textgrid.parser.construct;

import static ai.textgrid.parser.surface.TestGrids.at;
import static ai.textgrid.parser.surface.TestGrids.grid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ConstructClassifier;
import ai.textgrid.parser.classify.Orientation;
import ai.textgrid.parser.cluster.Adjacency;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.cluster.ClusterFinder;
import ai.textgrid.parser.surface.SparseGridSurface;
import org.junit.jupiter.api.Test;

class TreeBuilderTest {

    @Test
    void linksChildrenToNearestShallowerElement() {
        TreeConstruct tree = (TreeConstruct) ConstructFixtures.buildSingle(grid(
                "Root|",
                "Parent1|",
                "|Child1",
                "|Child2",
                "Parent2|"), Adjacency.DIAGONAL);

        assertThat(tree.signature().key()).isEqualTo(10);
        assertThat(tree.orientation()).isEqualTo(Orientation.VERTICAL);
        assertThat(tree.hasChildHeader()).isFalse();
        assertThat(tree.elements())
                .extracting(TreeElement::content, TreeElement::level, TreeElement::role)
                .containsExactly(
                        tuple("Root", 0, ElementRole.ANCHOR),
                        tuple("Parent1", 0, ElementRole.PARENT),
                        tuple("Child1", 1, ElementRole.LEAF),
                        tuple("Child2", 1, ElementRole.LEAF),
                        tuple("Parent2", 0, ElementRole.LEAF));
        TreeElement parent1 = tree.element(1);
        assertThat(tree.children(parent1)).extracting(TreeElement::content).containsExactly("Child1", "Child2");
        assertThat(tree.roots()).extracting(TreeElement::content).containsExactly("Root", "Parent1", "Parent2");
        assertThat(tree.parent(tree.element(3))).contains(parent1);
        assertThat(tree.domains()).isEmpty();
    }

    @Test
    void leadingSpacesRaiseTheLevel() {
        TreeConstruct tree = (TreeConstruct) ConstructFixtures.buildSingle(grid(
                "Menu|",
                "File|",
                "  Open|",
                "  Save|",
                "Edit|Undo"), Adjacency.ORTHOGONAL);

        assertThat(tree.elements())
                .extracting(TreeElement::rawContent, TreeElement::content, TreeElement::level)
                .containsExactly(
                        tuple("Menu", "Menu", 0),
                        tuple("File", "File", 0),
                        tuple("  Open", "Open", 1),
                        tuple("  Save", "Save", 1),
                        tuple("Edit", "Edit", 0),
                        tuple("Undo", "Undo", 1));
        assertThat(tree.parents()).extracting(TreeElement::content).containsExactly("File", "Edit");
        assertThat(tree.leaves()).extracting(TreeElement::content).containsExactly("Menu", "Open", "Save", "Undo");
    }

    @Test
    void indentWidthScalesIndentation() {
        SparseGridSurface surface = grid(
                "Menu|",
                "File|",
                "  Open|",
                "    Recent|x");
        CellCluster cluster = new ClusterFinder().findClusters(surface).get(0);
        Classification classification = new ConstructClassifier().classify(cluster, surface).orElseThrow();

        TreeConstruct tree = new TreeBuilder(4).build(cluster, surface, classification);

        assertThat(tree.elements())
                .extracting(TreeElement::content, TreeElement::level)
                .containsExactly(
                        tuple("Menu", 0),
                        tuple("File", 0),
                        tuple("Open", 0),
                        tuple("Recent", 1),
                        tuple("x", 1));
        assertThat(tree.children(tree.element(2))).extracting(TreeElement::content).containsExactly("Recent", "x");
    }

    @Test
    void deepChildIsPromotedWhenItGainsChildren() {
        TreeConstruct tree = (TreeConstruct) ConstructFixtures.buildSingle(grid(
                "A|||",
                "B|||",
                "|C||",
                "||D|",
                "|||E"), Adjacency.DIAGONAL);

        TreeElement b = tree.element(1);
        TreeElement d = tree.element(3);
        TreeElement e = tree.element(4);
        assertThat(d.level()).isEqualTo(2);
        assertThat(d.role()).isEqualTo(ElementRole.PARENT);
        assertThat(e.role()).isEqualTo(ElementRole.LEAF);
        assertThat(tree.maxDepth()).isEqualTo(3);
        assertThat(tree.maxLevel()).isEqualTo(3);
        assertThat(tree.height(tree.element(2))).isEqualTo(2);
        assertThat(tree.path(e)).extracting(TreeElement::content).containsExactly("B", "C", "D", "E");
        assertThat(tree.ancestors(e)).extracting(TreeElement::content).containsExactly("D", "C", "B");
        assertThat(tree.descendants(b)).extracting(TreeElement::content).containsExactly("C", "D", "E");
        assertThat(tree.siblings(b)).extracting(TreeElement::content).containsExactly("A");
        assertThat(tree.elementsAtLevel(0)).extracting(TreeElement::content).containsExactly("A", "B");
        assertThat(tree.elementAt(at(4, 3))).contains(d);
        assertThat(tree.anchor()).get().extracting(TreeElement::content).isEqualTo("A");
    }

    @Test
    void levelsIncreaseAlongEveryEdge() {
        TreeConstruct tree = (TreeConstruct) ConstructFixtures.buildSingle(grid(
                "A|||",
                "B|||",
                "|C||",
                "||D|",
                "|E||",
                "F|||"), Adjacency.DIAGONAL);

        for (TreeElement element : tree.elements()) {
            tree.parent(element).ifPresent(parent -> assertThat(parent.level()).isLessThan(element.level()));
        }
        assertThat(tree.children(tree.element(1))).extracting(TreeElement::content).containsExactly("C", "E");
    }

    @Test
    void horizontalTreeReadsColumnByColumn() {
        TreeConstruct tree = (TreeConstruct) ConstructFixtures.buildSingle(grid(
                "A|B|",
                "||C"), Adjacency.DIAGONAL);

        assertThat(tree.signature().key()).isEqualTo(12);
        assertThat(tree.orientation()).isEqualTo(Orientation.HORIZONTAL);
        assertThat(tree.elements())
                .extracting(TreeElement::content, TreeElement::level, TreeElement::role)
                .containsExactly(
                        tuple("A", 0, ElementRole.ANCHOR),
                        tuple("B", 0, ElementRole.PARENT),
                        tuple("C", 1, ElementRole.LEAF));
    }

    @Test
    void childHeaderFlagComesFromClassification() {
        TreeConstruct tree = (TreeConstruct) ConstructFixtures.buildSingle(grid(
                "Root|",
                "Group|Header"), Adjacency.ORTHOGONAL);

        assertThat(tree.hasChildHeader()).isTrue();
        assertThat(tree.children(tree.element(1))).extracting(TreeElement::content).containsExactly("Header");
        assertThat(tree.cells()).extracting(RoleCell::role)
                .containsExactly(CellRole.ANCHOR, CellRole.PARENT, CellRole.LEAF);
    }
}
