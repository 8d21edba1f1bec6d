package io.simconvert.core.text;

import java.util.Locale;

/**
 * A model reference expression as written in report variable lists, series field names and
 * function properties, e.g. {@code [Wheat].Leaf.Live.Wt as leafWt}.
 *
 * <p>
 * The expression splits into leading whitespace, the reference itself and a suffix (an
 * {@code as alias} clause plus trailing whitespace). Rewrites only ever touch the reference part.
 *
 * @param leading   whitespace before the reference
 * @param reference the reference path, never null
 * @param suffix    everything after the reference, possibly empty
 */
public record ReferenceExpression(String leading, String reference, String suffix) {

    private static final String ALIAS_KEYWORD = " as ";

    /** Splits an expression into its parts. */
    public static ReferenceExpression parse(String expression) {
        int start = 0;
        while (start < expression.length() && Character.isWhitespace(expression.charAt(start))) {
            start++;
        }
        int end = expression.length();
        int alias = expression.toLowerCase(Locale.ROOT).indexOf(ALIAS_KEYWORD, start);
        if (alias >= 0) {
            end = alias;
        }
        while (end > start && Character.isWhitespace(expression.charAt(end - 1))) {
            end--;
        }
        return new ReferenceExpression(
                expression.substring(0, start), expression.substring(start, end), expression.substring(end));
    }

    /** Returns a copy with a different reference part. */
    public ReferenceExpression withReference(String newReference) {
        return new ReferenceExpression(leading, newReference, suffix);
    }

    /** Returns {@code true} if an {@code as alias} clause follows the reference. */
    public boolean hasAlias() {
        return suffix.toLowerCase(Locale.ROOT).contains(ALIAS_KEYWORD);
    }

    /** Reassembles the expression text. */
    public String render() {
        return leading + reference + suffix;
    }
}
