package io.simconvert.core.step.standard;

import static org.assertj.core.api.Assertions.assertThat;

import io.simconvert.core.model.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link SoilWaterSumAggregation}. */
class SoilWaterSumAggregationTest {

    private Node root;

    @BeforeEach
    void setUp() {
        root = new Node("Simulation");
    }

    private Node manager(String code) {
        Node manager = root.addChild(new Node("Manager"));
        return manager.addChild(Node.cdataLeaf("Code", code));
    }

    private Node reportVariable(String expression) {
        Node report = root.addChild(new Node("Report"));
        return report.addChild(new Node("VariableNames")).addChild(Node.leaf("string", expression));
    }

    @Test
    void scriptReadsAreSummedAndDirectiveAdded() {
        Node code = manager("using System;\nusing Models.Core;\nclass Script {\n  bool wet = Soil.SoilWater.ESW > MinESW;\n}\n");

        new SoilWaterSumAggregation().apply(root);

        assertThat(code.text())
                .isEqualTo("using System;\nusing Models.Core;\nusing APSIM.Shared.Utilities;\nclass Script {\n"
                        + "  bool wet = MathUtilities.Sum(Soil.SoilWater.ESW) > MinESW;\n}\n");
        assertThat(code.isCData()).isTrue();
    }

    @Test
    void scriptWithoutSoilWaterIsUntouched() {
        String body = "using System;\nclass Script { double x = Soil.SoilWater.ESWTotal; }";
        Node code = manager(body);

        new SoilWaterSumAggregation().apply(root);

        assertThat(code.text()).isEqualTo(body);
    }

    @Test
    void reportVariablesAreSummed() {
        Node plain = reportVariable("[MySoil].SoilWater.ESW");
        Node aliased = reportVariable("[MySoil].SoilWater.ESW as esw");
        Node other = reportVariable("[Clock].Today");

        new SoilWaterSumAggregation().apply(root);

        assertThat(plain.text()).isEqualTo("sum([MySoil].SoilWater.ESW)");
        assertThat(aliased.text()).isEqualTo("sum([MySoil].SoilWater.ESW) as esw");
        assertThat(other.text()).isEqualTo("[Clock].Today");
    }

    @Test
    void runningTwiceDoesNotDoubleWrap() {
        Node code = manager("using System;\nvar x = Soil.SoilWater.ESW;");
        Node variable = reportVariable("[MySoil].SoilWater.ESW");

        new SoilWaterSumAggregation().apply(root);
        String once = code.text();
        new SoilWaterSumAggregation().apply(root);

        assertThat(code.text()).isEqualTo(once);
        assertThat(variable.text()).isEqualTo("sum([MySoil].SoilWater.ESW)");
    }
}
