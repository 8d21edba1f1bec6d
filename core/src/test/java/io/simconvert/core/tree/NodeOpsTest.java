package io.simconvert.core.tree;

import static org.assertj.core.api.Assertions.assertThat;

import io.simconvert.core.model.Node;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link NodeOps}. */
@DisplayName("NodeOps")
class NodeOpsTest {

    private static Node node(String tag, Node... children) {
        Node node = new Node(tag);
        for (Node child : children) {
            node.addChild(child);
        }
        return node;
    }

    private static List<String> tags(Node parent) {
        return parent.children().stream().map(Node::tag).toList();
    }

    @Nested
    @DisplayName("findAllDescendants")
    class FindAllDescendants {

        @Test
        void returnsMatchesInDocumentOrderIncludingRoot() {
            Node inner = node("Zone", Node.leaf("Name", "inner"));
            Node outer = node("Zone", Node.leaf("Name", "outer"), node("Folder", inner));
            Node root = node("Zone", outer, node("Zone", Node.leaf("Name", "last")));

            List<Node> zones = NodeOps.findAllDescendants(root, "Zone");

            assertThat(zones).hasSize(4);
            assertThat(zones.get(0)).isSameAs(root);
            assertThat(zones.get(1)).isSameAs(outer);
            assertThat(zones.get(2)).isSameAs(inner);
            assertThat(zones.get(3).childText("Name")).contains("last");
        }

        @Test
        void emptyWhenNothingMatches() {
            assertThat(NodeOps.findAllDescendants(node("Simulation", node("Clock")), "Zone"))
                    .isEmpty();
        }

        @Test
        void resultIsASnapshot() {
            Node root = node("Simulation", node("Apex"), node("Apex"));

            for (Node apex : NodeOps.findAllDescendants(root, "Apex")) {
                apex.detach();
            }

            assertThat(root.hasChildren()).isFalse();
        }

        @Test
        void findAllWithPredicate() {
            Node root = node("Simulation", node("NonStructuralN"), node("Leaf", node("NonStructural")));

            assertThat(NodeOps.findAll(root, n -> n.tag().startsWith("NonStructural")))
                    .extracting(Node::tag)
                    .containsExactly("NonStructuralN", "NonStructural");
        }
    }

    @Nested
    @DisplayName("Renaming")
    class Renaming {

        @Test
        void renameTagKeepsContent() {
            Node apex = node("Apex", Node.leaf("Name", "Apex"));
            apex.setAttribute("id", "1");

            NodeOps.renameTag(apex, "ApexStandard");

            assertThat(apex.tag()).isEqualTo("ApexStandard");
            assertThat(apex.attribute("id")).isEqualTo("1");
            assertThat(apex.childText("Name")).contains("Apex");
        }

        @Test
        void renameChildrenOnlyTouchesDirectChildren() {
            Node series = node("Series", Node.leaf("Title", "a"), node("X", Node.leaf("Title", "nested")));

            NodeOps.renameChildren(series, "Title", "Name");

            assertThat(tags(series)).containsExactly("Name", "X");
            assertThat(series.child(1).child(0).tag()).isEqualTo("Title");
        }

        @Test
        void renameAttributeKeepsPosition() {
            Node node = new Node("A");
            node.setAttribute("first", "1");
            node.setAttribute("old", "2");
            node.setAttribute("last", "3");

            NodeOps.renameAttribute(node, "old", "renamed");

            assertThat(node.attributes().keySet()).containsExactly("first", "renamed", "last");
            assertThat(node.attribute("renamed")).isEqualTo("2");
        }

        @Test
        void renameAttributeOverwritesExistingTarget() {
            Node node = new Node("A");
            node.setAttribute("new", "stale");
            node.setAttribute("old", "fresh");

            NodeOps.renameAttribute(node, "old", "new");

            assertThat(node.attributes()).containsExactly(Map.entry("new", "fresh"));
        }

        @Test
        void renameAbsentAttributeIsNoOp() {
            Node node = new Node("A");
            node.setAttribute("a", "1");

            NodeOps.renameAttribute(node, "missing", "b");

            assertThat(node.attributes()).containsExactly(Map.entry("a", "1"));
        }
    }

    @Nested
    @DisplayName("wrapChildrenAsStructuredChild")
    class Wrap {

        @Test
        void wrapperTakesPositionOfFirstMatch() {
            Node root = node("Root", Node.leaf("Name", "Root"), Node.leaf("PartitionFraction", "0.5"), node("Depth"));

            Optional<Node> wrapper =
                    NodeOps.wrapChildrenAsStructuredChild(root, c -> c.is("PartitionFraction"), "Demand");

            assertThat(wrapper).isPresent();
            assertThat(tags(root)).containsExactly("Name", "Demand", "Depth");
            assertThat(tags(wrapper.get())).containsExactly("PartitionFraction");
            assertThat(wrapper.get().parent()).isSameAs(root);
        }

        @Test
        void groupedChildrenKeepRelativeOrder() {
            Node parent = node("P", Node.leaf("A", "1"), node("Keep"), Node.leaf("A", "2"));

            Node wrapper = NodeOps.wrapChildrenAsStructuredChild(parent, c -> c.is("A"), "Group")
                    .orElseThrow();

            assertThat(tags(parent)).containsExactly("Group", "Keep");
            assertThat(wrapper.children()).extracting(Node::text).containsExactly("1", "2");
        }

        @Test
        void noMatchLeavesTreeAlone() {
            Node parent = node("P", node("A"));
            Node before = parent.deepCopy();

            assertThat(NodeOps.wrapChildrenAsStructuredChild(parent, c -> c.is("Z"), "Group"))
                    .isEmpty();
            assertThat(parent).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("flattenChild")
    class Flatten {

        @Test
        void promotesFieldsAtGroupPosition() {
            Node series = node(
                    "Series",
                    Node.leaf("Name", "S"),
                    node("X", Node.leaf("TableName", "Report"), Node.leaf("FieldName", "Clock.Today")),
                    Node.leaf("Type", "Scatter"));

            NodeOps.flattenChild(series, "X", Map.of("FieldName", "XFieldName"));

            assertThat(tags(series)).containsExactly("Name", "TableName", "XFieldName", "Type");
            assertThat(series.childText("XFieldName")).contains("Clock.Today");
        }

        @Test
        void fieldAlreadyPresentIsDropped() {
            Node series = node(
                    "Series",
                    node("X", Node.leaf("TableName", "First"), Node.leaf("FieldName", "a")),
                    node("Y", Node.leaf("TableName", "Second"), Node.leaf("FieldName", "b")));

            NodeOps.flattenChild(series, "X", Map.of("FieldName", "XFieldName"));
            NodeOps.flattenChild(series, "Y", Map.of("FieldName", "YFieldName"));

            assertThat(tags(series)).containsExactly("TableName", "XFieldName", "YFieldName");
            assertThat(series.childText("TableName")).contains("First");
        }

        @Test
        void absentGroupIsNoOp() {
            Node series = node("Series", Node.leaf("XFieldName", "a"));
            Node before = series.deepCopy();

            NodeOps.flattenChild(series, "X", Map.of("FieldName", "XFieldName"));

            assertThat(series).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("convertTextChildrenToRecords")
    class Records {

        @Test
        void replacesTextChildrenInOrder() {
            Node cultivar = node(
                    "Cultivar", Node.leaf("Name", "Hartog"), Node.leaf("Alias", "H1"), Node.leaf("Alias", "H2"));

            List<Node> records = NodeOps.convertTextChildrenToRecords(cultivar, "Alias", "Alias", "Name");

            assertThat(records).hasSize(2);
            assertThat(tags(cultivar)).containsExactly("Name", "Alias", "Alias");
            assertThat(cultivar.child(1).childText("Name")).contains("H1");
            assertThat(cultivar.child(2).childText("Name")).contains("H2");
            assertThat(cultivar.child(1).hasText()).isFalse();
        }

        @Test
        void structuredChildrenAreLeftAlone() {
            Node cultivar = node("Cultivar", node("Alias", Node.leaf("Name", "done")));
            Node before = cultivar.deepCopy();

            assertThat(NodeOps.convertTextChildrenToRecords(cultivar, "Alias", "Alias", "Name"))
                    .isEmpty();
            assertThat(cultivar).isEqualTo(before);
        }

        @Test
        void emptyTextBecomesEmptyField() {
            Node cultivar = node("Cultivar", new Node("Alias"));

            NodeOps.convertTextChildrenToRecords(cultivar, "Alias", "Alias", "Name");

            assertThat(cultivar.child(0).childText("Name")).contains("");
        }
    }

    @Nested
    @DisplayName("Insertion")
    class Insertion {

        @Test
        void insertAfterLastAnchor() {
            Node organ = node("GenericOrgan", Node.leaf("Name", "Stem"), node("Constant"), node("Constant"), node("Live"));

            NodeOps.insertSiblingDefault(organ, "Constant", node("New"));

            assertThat(tags(organ)).containsExactly("Name", "Constant", "Constant", "New", "Live");
        }

        @Test
        void appendWhenAnchorMissing() {
            Node organ = node("GenericOrgan", node("Live"));

            NodeOps.insertSiblingDefault(organ, "Constant", node("New"));

            assertThat(tags(organ)).containsExactly("Live", "New");
        }

        @Test
        void ensureChildAddsNamedChildOnce() {
            Node zone = node("Zone", Node.leaf("Name", "Field"));

            assertThat(NodeOps.ensureChild(zone, "SoluteManager")).isTrue();
            assertThat(NodeOps.ensureChild(zone, "SoluteManager")).isFalse();

            assertThat(zone.children("SoluteManager")).hasSize(1);
            assertThat(zone.firstChild("SoluteManager").orElseThrow().childText("Name"))
                    .contains("SoluteManager");
        }

        @Test
        void setChildTextCreatesOrUpdates() {
            Node zone = node("Zone");

            NodeOps.setChildText(zone, "Area", "1");
            NodeOps.setChildText(zone, "Area", "2.5");

            assertThat(zone.children("Area")).hasSize(1);
            assertThat(zone.childText("Area")).contains("2.5");
        }
    }

    @Nested
    @DisplayName("Removal and replacement")
    class Removal {

        @Test
        void deleteNodeDetaches() {
            Node child = node("Apex");
            Node root = node("Simulation", child);

            NodeOps.deleteNode(child);

            assertThat(root.hasChildren()).isFalse();
            assertThat(child.parent()).isNull();
        }

        @Test
        void deleteChildrenCountsRemoved() {
            Node root = node("Simulation", node("A"), node("B"), node("A"));

            assertThat(NodeOps.deleteChildren(root, "A")).isEqualTo(2);
            assertThat(tags(root)).containsExactly("B");
        }

        @Test
        void spliceReplaceKeepsPosition() {
            Node apex = node("Apex");
            Node root = node("Plant", node("Leaf"), apex, node("Stem"));

            assertThat(NodeOps.spliceReplace(apex, node("ApexStandard"))).isTrue();

            assertThat(tags(root)).containsExactly("Leaf", "ApexStandard", "Stem");
        }

        @Test
        void spliceReplaceOnRootIsNoOp() {
            Node root = node("Apex");

            assertThat(NodeOps.spliceReplace(root, node("ApexStandard"))).isFalse();
            assertThat(root.tag()).isEqualTo("Apex");
        }
    }
}
