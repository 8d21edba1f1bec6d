package io.simconvert.core.text;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-aware string rewriting for embedded script bodies and model reference expressions.
 *
 * <p>
 * Rules run in declared order; each rule sees the output of the rules before it. Matching is
 * lexical, not a parse: an identifier inside a string literal or a comment of a script body is
 * renamed like any other occurrence.
 *
 * <p>
 * Besides plain renames, the rewriter can wrap matches in a function call, which covers
 * conversions where a scalar value became a layered one and every read of it now needs an
 * aggregate ({@code [Soil].SoilWater.ESW} becomes {@code sum([Soil].SoilWater.ESW)}).
 *
 * <p>
 * Immutable and thread-safe; every method returns a new string.
 */
public final class TextRewriter {

    private final List<RenameRule> rules;
    private final TokenBoundary boundary;

    /**
     * Creates a rewriter.
     *
     * @param rules    renames, applied in list order
     * @param boundary the token boundary every rename must respect
     */
    public TextRewriter(List<RenameRule> rules, TokenBoundary boundary) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
    }

    /** Creates a rewriter with {@link TokenBoundary#IDENTIFIER} boundaries. */
    public static TextRewriter of(RenameRule... rules) {
        return new TextRewriter(List.of(rules), TokenBoundary.IDENTIFIER);
    }

    public List<RenameRule> rules() {
        return rules;
    }

    public TokenBoundary boundary() {
        return boundary;
    }

    /**
     * Applies every rule across a whole script body.
     *
     * @param code the script text, may be null
     * @return the rewritten text, or null for null input
     */
    public String rewriteCode(String code) {
        if (code == null) {
            return null;
        }
        String result = code;
        for (RenameRule rule : rules) {
            result = replaceTokens(result, rule.from(), rule.to(), boundary);
        }
        return result;
    }

    /**
     * Applies every rule to the reference part of a single expression; an {@code as alias}
     * clause and surrounding whitespace are left untouched.
     *
     * @param expression the expression text, may be null
     * @return the rewritten expression, or null for null input
     */
    public String rewriteReference(String expression) {
        if (expression == null) {
            return null;
        }
        ReferenceExpression parsed = ReferenceExpression.parse(expression);
        String reference = parsed.reference();
        for (RenameRule rule : rules) {
            reference = replaceTokens(reference, rule.from(), rule.to(), boundary);
        }
        return parsed.withReference(reference).render();
    }

    /**
     * Replaces every boundary-respecting occurrence of {@code from} with {@code to}. Replaced text
     * is not scanned again.
     */
    public static String replaceTokens(String text, String from, String to, TokenBoundary boundary) {
        int index = text.indexOf(from);
        if (index < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int copied = 0;
        while (index >= 0) {
            int end = index + from.length();
            if (boundary.accepts(text, index, end)) {
                sb.append(text, copied, index).append(to);
                copied = end;
                index = text.indexOf(from, end);
            } else {
                index = text.indexOf(from, index + 1);
            }
        }
        sb.append(text, copied, text.length());
        return sb.toString();
    }

    /**
     * Wraps every match of {@code pattern} as {@code function(match)}. A match already sitting
     * directly inside {@code function(} is left alone.
     *
     * @param text     the script text, may be null
     * @param pattern  what to wrap
     * @param function the function name, e.g. {@code MathUtilities.Sum}
     * @return the rewritten text, or null for null input
     */
    public static String wrapMatches(String text, Pattern pattern, String function) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        String opener = function + "(";
        StringBuilder sb = new StringBuilder(text.length());
        int copied = 0;
        while (matcher.find()) {
            int start = matcher.start();
            if (start >= opener.length() && text.startsWith(opener, start - opener.length())) {
                continue;
            }
            sb.append(text, copied, start).append(opener).append(matcher.group()).append(')');
            copied = matcher.end();
        }
        sb.append(text, copied, text.length());
        return sb.toString();
    }

    /**
     * Wraps the whole reference part of an expression as {@code function(reference)} when the
     * reference matches {@code pattern} in full. An {@code as alias} clause stays outside the
     * call.
     *
     * @param expression the expression text, may be null
     * @return the rewritten expression, or the input unchanged when the reference does not match
     */
    public static String wrapReference(String expression, Pattern pattern, String function) {
        if (expression == null) {
            return null;
        }
        ReferenceExpression parsed = ReferenceExpression.parse(expression);
        if (!pattern.matcher(parsed.reference()).matches()) {
            return expression;
        }
        return parsed.withReference(function + "(" + parsed.reference() + ")").render();
    }
}
