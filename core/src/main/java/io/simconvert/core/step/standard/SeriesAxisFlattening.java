package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.tree.NodeOps;
import java.util.Map;

/**
 * Version 0 to 1: graph series stop grouping their axes.
 *
 * <p>
 * Every {@code Series}, at any depth, has its {@code X} and {@code Y} groups flattened in place:
 * the shared {@code TableName} is promoted once and each group's {@code FieldName} becomes
 * {@code XFieldName} / {@code YFieldName}. A legacy {@code Title} is renamed to {@code Name}.
 *
 * <pre>
 * &lt;Series&gt;&lt;X&gt;&lt;TableName&gt;T&lt;/TableName&gt;&lt;FieldName&gt;a&lt;/FieldName&gt;&lt;/X&gt;&lt;Y&gt;...&lt;/Y&gt;&lt;/Series&gt;
 *   becomes
 * &lt;Series&gt;&lt;TableName&gt;T&lt;/TableName&gt;&lt;XFieldName&gt;a&lt;/XFieldName&gt;&lt;YFieldName&gt;b&lt;/YFieldName&gt;&lt;/Series&gt;
 * </pre>
 */
public final class SeriesAxisFlattening implements ConversionStep {

    @Override
    public void apply(Node root) {
        for (Node series : NodeOps.findAllDescendants(root, ReferenceSites.SERIES)) {
            NodeOps.renameChildren(series, "Title", "Name");
            NodeOps.flattenChild(series, "X", Map.of("FieldName", "XFieldName"));
            NodeOps.flattenChild(series, "Y", Map.of("FieldName", "YFieldName"));
        }
    }
}
