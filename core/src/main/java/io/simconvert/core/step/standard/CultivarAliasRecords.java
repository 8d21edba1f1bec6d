package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;

/**
 * Version 1 to 2: cultivar aliases become records. Each plain {@code <Alias>name</Alias>} under a
 * {@code Cultivar} turns into {@code <Alias><Name>name</Name></Alias>}, keeping alias order.
 */
public final class CultivarAliasRecords implements ConversionStep {

    @Override
    public void apply(Node root) {
        for (Node cultivar : NodeOps.findAllDescendants(root, "Cultivar")) {
            NodeOps.convertTextChildrenToRecords(cultivar, "Alias", "Alias", "Name");
        }
    }
}
