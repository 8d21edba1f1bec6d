package io.simconvert.core.step.standard;

import static org.assertj.core.api.Assertions.assertThat;

import io.simconvert.core.model.Node;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link OrganConstantUnification}. */
class OrganConstantUnificationTest {

    private Node root;
    private Node organ;

    @BeforeEach
    void setUp() {
        root = new Node("Simulation");
        organ = root.addChild(new Node("GenericOrgan"));
        organ.addChild(Node.leaf("Name", "Stem"));
    }

    private static String constantName(Node node) {
        return node.childText("Name").orElse(null);
    }

    @Test
    void bareOrganGetsDefaultsAfterName() {
        organ.addChild(new Node("Live"));

        new OrganConstantUnification().apply(root);

        assertThat(organ.children())
                .extracting(Node::tag)
                .containsExactly("Name", "Constant", "Constant", "Constant", "Constant", "VariableReference", "Live");
        assertThat(organ.children("Constant"))
                .extracting(OrganConstantUnificationTest::constantName)
                .containsExactly(
                        "NRetranslocationFactor", "NitrogenDemandSwitch", "DMReallocationFactor", "DMRetranslocationFactor");
        assertThat(organ.children("Constant"))
                .extracting(c -> c.childText("FixedValue").orElseThrow())
                .containsExactly("0.0", "1.0", "0.0", "0.0");
        Node reference = organ.firstChild("VariableReference").orElseThrow();
        assertThat(reference.childText("Name")).contains("CriticalNConc");
        assertThat(reference.childText("VariableName")).contains("[Stem].MinimumNConc.Value()");
    }

    @Test
    void legacyElementsAreReplacedInPlaceKeepingValue() {
        Node legacy = organ.addChild(new Node("DMRetranslocationFactor"));
        legacy.addChild(Node.leaf("Value", "0.5"));
        organ.addChild(Node.leaf("NitrogenDemandSwitch", "0.8"));

        new OrganConstantUnification().apply(root);

        List<Node> constants = organ.children("Constant");
        assertThat(constants)
                .extracting(OrganConstantUnificationTest::constantName)
                .containsExactly(
                        "NRetranslocationFactor", "DMRetranslocationFactor", "NitrogenDemandSwitch", "DMReallocationFactor");
        assertThat(organ.child(2).childText("FixedValue")).contains("0.5");
        assertThat(organ.child(3).childText("FixedValue")).contains("0.8");
        assertThat(constants).hasSize(4);
        assertThat(organ.firstChild("DMRetranslocationFactor")).isEmpty();
    }

    @Test
    void existingConstantsAreNotDuplicated() {
        Node existing = organ.addChild(new Node("Constant"));
        existing.addChild(Node.leaf("Name", "NitrogenDemandSwitch"));
        existing.addChild(Node.leaf("FixedValue", "0.25"));

        new OrganConstantUnification().apply(root);
        new OrganConstantUnification().apply(root);

        assertThat(organ.children("Constant")).hasSize(4);
        assertThat(existing.childText("FixedValue")).contains("0.25");
        assertThat(organ.children("VariableReference")).hasSize(1);
    }

    @Test
    void existingCriticalConcentrationIsKept() {
        Node critical = organ.addChild(new Node("Constant"));
        critical.addChild(Node.leaf("Name", "CriticalNConc"));

        new OrganConstantUnification().apply(root);

        assertThat(organ.children("VariableReference")).isEmpty();
    }
}
