package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version 2 to 3: every zone must have a positive area. A {@code Zone} whose {@code Area} is not
 * a number, or is zero or negative, gets an area of {@code 1}. Zones without an {@code Area}
 * element are left alone.
 */
public final class ZoneAreaRepair implements ConversionStep {

    private static final Logger LOG = LoggerFactory.getLogger(ZoneAreaRepair.class);

    static final String DEFAULT_AREA = "1";

    @Override
    public void apply(Node root) {
        for (Node zone : NodeOps.findAllDescendants(root, "Zone")) {
            Optional<Node> area = zone.firstChild("Area");
            if (area.isEmpty() || isPositive(area.get().text())) {
                continue;
            }
            LOG.debug("Zone area '{}' is not positive, resetting to {}", area.get().text(), DEFAULT_AREA);
            area.get().setText(DEFAULT_AREA);
        }
    }

    private static boolean isPositive(String text) {
        if (text == null) {
            return false;
        }
        try {
            double value = Double.parseDouble(text.trim());
            return value > 0 && !Double.isNaN(value);
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
