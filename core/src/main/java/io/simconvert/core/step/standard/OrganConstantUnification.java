package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Version 9 to 10: generic organs describe their physiological constants uniformly.
 *
 * <p>
 * For every {@code GenericOrgan}:
 * <ul>
 * <li>each legacy per-constant element (e.g. {@code <NRetranslocationFactor><Value>0.5</Value>
 * </NRetranslocationFactor>}) is replaced in place by
 * {@code <Constant><Name>NRetranslocationFactor</Name><FixedValue>0.5</FixedValue></Constant>};
 * <li>constants the organ lacks altogether are added with their defaults, after the organ's last
 * {@code Constant} (or its {@code Name});
 * <li>a {@code VariableReference} named {@code CriticalNConc} pointing at
 * {@code [organ].MinimumNConc.Value()} is added when the organ has none.
 * </ul>
 */
public final class OrganConstantUnification implements ConversionStep {

    static final String ORGAN = "GenericOrgan";
    static final String CONSTANT = "Constant";
    static final String CRITICAL_N_CONC = "CriticalNConc";

    /** Constants in insertion order with their default fixed values. */
    static final Map<String, String> DEFAULT_CONSTANTS = defaults();

    private static Map<String, String> defaults() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("NRetranslocationFactor", "0.0");
        defaults.put("NitrogenDemandSwitch", "1.0");
        defaults.put("DMReallocationFactor", "0.0");
        defaults.put("DMRetranslocationFactor", "0.0");
        return Collections.unmodifiableMap(defaults);
    }

    @Override
    public void apply(Node root) {
        for (Node organ : NodeOps.findAllDescendants(root, ORGAN)) {
            migrateOrgan(organ);
        }
    }

    private static void migrateOrgan(Node organ) {
        for (Map.Entry<String, String> constant : DEFAULT_CONSTANTS.entrySet()) {
            String name = constant.getKey();
            Optional<Node> legacy = organ.firstChild(name);
            if (legacy.isPresent()) {
                String value = legacyValue(legacy.get()).orElse(constant.getValue());
                NodeOps.spliceReplace(legacy.get(), constant(name, value));
            } else if (findNamed(organ, CONSTANT, name).isEmpty()) {
                String anchor = organ.firstChild(CONSTANT).isPresent() ? CONSTANT : "Name";
                NodeOps.insertSiblingDefault(organ, anchor, constant(name, constant.getValue()));
            }
        }

        if (findNamed(organ, null, CRITICAL_N_CONC).isEmpty()) {
            String organName = organ.childText("Name").orElse(ORGAN);
            Node reference = new Node(ReferenceSites.VARIABLE_REFERENCE);
            reference.addChild(Node.leaf("Name", CRITICAL_N_CONC));
            reference.addChild(Node.leaf(ReferenceSites.VARIABLE_NAME, "[" + organName + "].MinimumNConc.Value()"));
            NodeOps.insertSiblingDefault(organ, CONSTANT, reference);
        }
    }

    /** A legacy constant holds its number in a {@code Value} child or directly as text. */
    private static Optional<String> legacyValue(Node legacy) {
        Optional<String> value = legacy.childText("Value");
        if (value.isPresent()) {
            return value;
        }
        String text = legacy.text();
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }

    /** Finds a direct child with the given tag (any tag when null) whose {@code Name} matches. */
    private static Optional<Node> findNamed(Node organ, String tag, String name) {
        for (Node child : organ.children()) {
            if ((tag == null || child.is(tag)) && name.equals(child.childText("Name").orElse(null))) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    private static Node constant(String name, String fixedValue) {
        Node constant = new Node(CONSTANT);
        constant.addChild(Node.leaf("Name", name));
        constant.addChild(Node.leaf("FixedValue", fixedValue));
        return constant;
    }
}
