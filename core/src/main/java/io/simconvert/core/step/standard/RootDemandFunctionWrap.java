package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;

/**
 * Version 8 to 9: a root organ's {@code PartitionFraction} moves under a
 * {@code PartitionFractionDemandFunction} named {@code DMDemandFunction}, placed where the
 * fraction used to be.
 */
public final class RootDemandFunctionWrap implements ConversionStep {

    static final String DEMAND_FUNCTION_TAG = "PartitionFractionDemandFunction";
    static final String DEMAND_FUNCTION_NAME = "DMDemandFunction";

    @Override
    public void apply(Node root) {
        for (Node organ : NodeOps.findAllDescendants(root, "Root")) {
            NodeOps.wrapChildrenAsStructuredChild(organ, child -> child.is("PartitionFraction"), DEMAND_FUNCTION_TAG)
                    .ifPresent(function -> function.insertChild(0, Node.leaf("Name", DEMAND_FUNCTION_NAME)));
        }
    }
}
