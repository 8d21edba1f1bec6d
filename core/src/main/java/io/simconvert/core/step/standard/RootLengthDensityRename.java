package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;
import java.util.Set;

/**
 * Version 5 to 6: interpolation functions that read root length density through one of its
 * legacy spellings now read {@code [Root].LengthDensity}.
 */
public final class RootLengthDensityRename implements ConversionStep {

    static final String CURRENT = "[Root].LengthDensity";

    static final Set<String> LEGACY = Set.of("[Root].RootLengthDensity", "[Root].LengthDenisty", "Root.LengthDensity");

    @Override
    public void apply(Node root) {
        for (Node property : NodeOps.findAllDescendants(root, ReferenceSites.X_PROPERTY)) {
            String text = property.text();
            if (text != null && LEGACY.contains(text.trim())) {
                property.setText(CURRENT);
            }
        }
    }
}
