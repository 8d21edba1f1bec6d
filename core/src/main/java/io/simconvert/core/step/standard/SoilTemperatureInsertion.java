package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;

/** Version 4 to 5: every {@code Soil} carries a {@code CERESSoilTemperature} model. */
public final class SoilTemperatureInsertion implements ConversionStep {

    @Override
    public void apply(Node root) {
        for (Node soil : NodeOps.findAllDescendants(root, "Soil")) {
            NodeOps.ensureChild(soil, "CERESSoilTemperature");
        }
    }
}
