package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;
import java.util.List;

/** Version 3 to 4: every zone, rectangular or not, carries a {@code SoluteManager}. */
public final class SoluteManagerInsertion implements ConversionStep {

    static final List<String> ZONE_TAGS = List.of("Zone", "RectangularZone");

    @Override
    public void apply(Node root) {
        for (String zoneTag : ZONE_TAGS) {
            for (Node zone : NodeOps.findAllDescendants(root, zoneTag)) {
                NodeOps.ensureChild(zone, "SoluteManager");
            }
        }
    }
}
