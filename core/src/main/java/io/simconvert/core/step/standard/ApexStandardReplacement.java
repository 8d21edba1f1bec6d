package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;
import java.util.ArrayList;

/**
 * Version 7 to 8: the {@code Apex} model was replaced by {@code ApexStandard}. Each occurrence is
 * spliced out for a new {@code ApexStandard} element carrying the same attributes and children.
 */
public final class ApexStandardReplacement implements ConversionStep {

    @Override
    public void apply(Node root) {
        for (Node apex : NodeOps.findAllDescendants(root, "Apex")) {
            if (apex.parent() == null) {
                continue;
            }
            Node standard = new Node("ApexStandard");
            standard.replaceAttributes(apex.attributes());
            standard.setText(apex.text());
            for (Node child : new ArrayList<>(apex.children())) {
                standard.addChild(child);
            }
            NodeOps.spliceReplace(apex, standard);
        }
    }
}
