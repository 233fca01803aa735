package im.arun.taxonomy.tree;

import im.arun.taxonomy.model.HierarchyEntry;
import im.arun.taxonomy.model.TaxonomyRow;
import im.arun.taxonomy.transform.HierarchyBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static im.arun.taxonomy.TaxonomyFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeMaterializerTest {

    private final TreeMaterializer materializer = new TreeMaterializer();

    private TaxonomyTree materialize(TaxonomyRow... rows) {
        List<HierarchyEntry> entries = new HierarchyBuilder(5).build(List.of(rows)).getEntries();
        return materializer.materialize(entries);
    }

    @Test
    @DisplayName("Builds two roots with A owning B and C")
    void testForestShape() {
        TaxonomyTree tree = materialize(
            row(2, 0, "A", "A"),
            row(3, 1, "B", "B"),
            row(4, 1, "C", "C"),
            row(5, 0, "D", "D"));

        assertThat(tree.getRoots()).extracting(TaxonomyNode::getConceptName).containsExactly("A", "D");
        assertThat(tree.getRoots().get(0).getChildren())
            .extracting(TaxonomyNode::getConceptName).containsExactly("B", "C");
        assertThat(tree.getRoots().get(1).getChildren()).isEmpty();
        assertThat(tree.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Children are owned by the tree and cannot be edited from outside")
    void testChildrenAreReadOnly() {
        TaxonomyTree tree = materialize(row(2, 0, "A", "A"), row(3, 1, "B", "B"));

        assertThatThrownBy(() -> tree.getRoots().get(0).getChildren().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> tree.getRoots().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Nested
    @DisplayName("Full paths")
    class FullPaths {

        @Test
        @DisplayName("Siblings in one group share a single group prefix")
        void testSiblingsShareGroupPrefix() {
            TaxonomyTree tree = materialize(
                row(2, 0, "ifrs:Alpha", "Alpha", "100000", "G1"),
                row(3, 0, "ifrs:Beta", "Beta", "100000", "G1"));

            assertThat(tree.getRoots()).extracting(TaxonomyNode::getFullPath)
                .containsExactly("G1 > Alpha", "G1 > Beta");
        }

        @Test
        @DisplayName("Children of a group node do not repeat the group name")
        void testNestedSameGroup() {
            TaxonomyTree tree = materialize(
                row(2, 0, "ifrs:Parent", "Parent", "100000", "G1"),
                row(3, 1, "ifrs:Alpha", "Alpha", "100000", "G1"),
                row(4, 1, "ifrs:Beta", "Beta", "100000", "G1"));

            TaxonomyNode parent = tree.getRoots().get(0);
            assertThat(parent.getFullPath()).isEqualTo("G1 > Parent");
            assertThat(parent.getChildren()).extracting(TaxonomyNode::getFullPath)
                .containsExactly("G1 > Alpha", "G1 > Beta")
                .doesNotContain("G1 > G1 > Beta");
        }

        @Test
        @DisplayName("A row of another group extends its parent's path")
        void testCrossGroupChild() {
            TaxonomyTree tree = materialize(
                row(2, 0, "ifrs:Parent", "Parent", "100000", "G1"),
                row(3, 1, "ifrs:Child", "Child", "200000", "G2"));

            assertThat(tree.getRoots().get(0).getChildren().get(0).getFullPath())
                .isEqualTo("G1 > Parent > Child");
        }

        @Test
        @DisplayName("A group name that is a text prefix of the parent path restarts the path at the group")
        void testPrefixTieBreak() {
            TaxonomyTree tree = materialize(
                row(2, 0, "ifrs:NonCurrent", "Total", "300000", "Assets Non-current"),
                row(3, 1, "ifrs:Cash", "Cash", "310000", "Assets"));

            assertThat(tree.getRoots().get(0).getChildren().get(0).getFullPath())
                .isEqualTo("Assets > Cash");
        }

        @Test
        @DisplayName("Falls back to the group code when the name is blank")
        void testGroupCodeFallback() {
            TaxonomyTree tree = materialize(row(2, 0, "ifrs:Alpha", "Alpha", "100000", ""));

            assertThat(tree.getRoots().get(0).getFullPath()).isEqualTo("100000 > Alpha");
        }

        @Test
        @DisplayName("An empty label leaves the path at the base segment")
        void testEmptyLabel() {
            TaxonomyTree tree = materialize(row(2, 0, "ifrs:Abstract", "", "100000", "G1"));

            assertThat(tree.getRoots().get(0).getFullPath()).isEqualTo("G1");
        }

        @Test
        @DisplayName("Rows without a group use the label alone")
        void testNoGroup() {
            TaxonomyTree tree = materialize(row(2, 0, "A", "Alpha"), row(3, 1, "B", "Beta"));

            assertThat(tree.getRoots().get(0).getFullPath()).isEqualTo("Alpha");
            assertThat(tree.getRoots().get(0).getChildren().get(0).getFullPath()).isEqualTo("Beta");
        }
    }

    @Test
    @DisplayName("Nodes carry every descriptive field of their row")
    void testNodeFields() {
        TaxonomyRow source = row(7, 0, "ifrs:Assets", "Assets", "210000", "Position").toBuilder()
            .preferredLabel(" Assets ")
            .attributes(Map.of("Standard label", "Assets"))
            .build();

        TaxonomyNode node = materialize(source).getRoots().get(0);

        assertThat(node.getExcelRow()).isEqualTo(7);
        assertThat(node.getPreferredLabel()).isEqualTo(" Assets ");
        assertThat(node.getLabel()).isEqualTo("Assets");
        assertThat(node.getType()).isEqualTo("X");
        assertThat(node.getGroupCode()).isEqualTo("210000");
        assertThat(node.getAttributes()).containsEntry("Standard label", "Assets");
    }
}
