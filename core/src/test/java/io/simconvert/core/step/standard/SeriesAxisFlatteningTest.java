package io.simconvert.core.step.standard;

import static org.assertj.core.api.Assertions.assertThat;

import io.simconvert.core.model.Node;
import org.junit.jupiter.api.Test;

/** Tests for {@link SeriesAxisFlattening}. */
class SeriesAxisFlatteningTest {

    private final SeriesAxisFlattening step = new SeriesAxisFlattening();

    private static Node axis(String tag, String table, String field) {
        Node axis = new Node(tag);
        axis.addChild(Node.leaf("TableName", table));
        axis.addChild(Node.leaf("FieldName", field));
        return axis;
    }

    @Test
    void axesBecomeFlatFields() {
        Node root = new Node("Simulation");
        Node series = root.addChild(new Node("Graph")).addChild(new Node("Series"));
        series.addChild(Node.leaf("Title", "Yield"));
        series.addChild(axis("X", "HarvestReport", "Maize.Population"));
        series.addChild(axis("Y", "HarvestReport", "GrainWt"));

        step.apply(root);

        assertThat(series.children())
                .extracting(Node::tag)
                .containsExactly("Name", "TableName", "XFieldName", "YFieldName");
        assertThat(series.childText("Name")).contains("Yield");
        assertThat(series.childText("XFieldName")).contains("Maize.Population");
        assertThat(series.childText("YFieldName")).contains("GrainWt");
    }

    @Test
    void xyPairsOutsideSeriesAreUntouched() {
        Node root = new Node("Simulation");
        Node pairs = root.addChild(new Node("XYPairs"));
        pairs.addChild(new Node("X")).addChild(Node.leaf("double", "0.5"));
        Node before = root.deepCopy();

        step.apply(root);

        assertThat(root).isEqualTo(before);
    }
}
