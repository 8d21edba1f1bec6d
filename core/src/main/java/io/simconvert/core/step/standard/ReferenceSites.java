package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.text.TextRewriter;
import io.simconvert.core.tree.NodeOps;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Locates the places in a document where model names appear as text: manager script bodies and
 * the reference expressions held by reports, graph series, interpolation functions and variable
 * references.
 *
 * <p>
 * A rename of a model property has to reach all of these sites in one step, otherwise a report
 * column or a script would silently point at a name that no longer exists.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ReferenceSites {

    static final String MANAGER = "Manager";
    static final String CODE = "Code";
    static final String REPORT = "Report";
    static final String VARIABLE_NAMES = "VariableNames";
    static final String STRING = "string";
    static final String SERIES = "Series";
    static final String X_PROPERTY = "XProperty";
    static final String VARIABLE_REFERENCE = "VariableReference";
    static final String VARIABLE_NAME = "VariableName";

    /** Series children that hold a field reference. */
    static final Set<String> SERIES_FIELDS = Set.of("XFieldName", "YFieldName", "X2FieldName", "Y2FieldName");

    private ReferenceSites() {}

    /** Returns the {@code Code} node of every manager, in document order. */
    public static List<Node> codeBodies(Node root) {
        List<Node> bodies = new ArrayList<>();
        for (Node manager : NodeOps.findAllDescendants(root, MANAGER)) {
            bodies.addAll(manager.children(CODE));
        }
        return bodies;
    }

    /** Returns every report variable expression node, in document order. */
    public static List<Node> reportVariables(Node root) {
        List<Node> variables = new ArrayList<>();
        for (Node report : NodeOps.findAllDescendants(root, REPORT)) {
            for (Node names : report.children(VARIABLE_NAMES)) {
                variables.addAll(names.children(STRING));
            }
        }
        return variables;
    }

    /**
     * Returns every text node holding a single reference expression, in document order: report
     * variables, series field names, {@code XProperty} anywhere and variable-reference targets.
     */
    public static List<Node> referenceExpressions(Node root) {
        return NodeOps.findAll(root, ReferenceSites::isReferenceExpression);
    }

    private static boolean isReferenceExpression(Node node) {
        if (!node.hasText() || node.hasChildren()) {
            return false;
        }
        if (node.is(X_PROPERTY)) {
            return true;
        }
        Node parent = node.parent();
        if (parent == null) {
            return false;
        }
        if (node.is(STRING) && parent.is(VARIABLE_NAMES)) {
            return parent.parent() != null && parent.parent().is(REPORT);
        }
        if (parent.is(SERIES)) {
            return SERIES_FIELDS.contains(node.tag());
        }
        return node.is(VARIABLE_NAME) && parent.is(VARIABLE_REFERENCE);
    }

    /**
     * Applies the rewriter to every site: script bodies via {@link TextRewriter#rewriteCode} and
     * expressions via {@link TextRewriter#rewriteReference}.
     *
     * @return the number of text nodes that changed
     */
    public static int rewriteAll(Node root, TextRewriter rewriter) {
        int changed = 0;
        for (Node code : codeBodies(root)) {
            changed += rewriteText(code, rewriter::rewriteCode);
        }
        for (Node expression : referenceExpressions(root)) {
            changed += rewriteText(expression, rewriter::rewriteReference);
        }
        return changed;
    }

    /**
     * Replaces a node's text with {@code rewrite(text)}; the CDATA flag is kept.
     *
     * @return 1 if the text changed, 0 otherwise
     */
    static int rewriteText(Node node, UnaryOperator<String> rewrite) {
        String before = node.text();
        if (before == null) {
            return 0;
        }
        String after = rewrite.apply(before);
        if (after.equals(before)) {
            return 0;
        }
        node.setText(after);
        return 1;
    }
}
