package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.text.CodeBodies;
import io.simconvert.core.text.TextRewriter;
import java.util.regex.Pattern;

/**
 * Version 6 to 7: extractable soil water ({@code ESW}) became a per-layer array.
 *
 * <p>
 * Scripts that compared it as a scalar now sum it: {@code Soil.SoilWater.ESW} is wrapped as
 * {@code MathUtilities.Sum(Soil.SoilWater.ESW)} and the script gains the
 * {@code using APSIM.Shared.Utilities;} directive. Report columns reading it are wrapped as
 * {@code sum([Soil].SoilWater.ESW)}.
 */
public final class SoilWaterSumAggregation implements ConversionStep {

    /** A dotted or bracketed path whose last segment is {@code ESW}. */
    static final Pattern ESW_REFERENCE = Pattern.compile("[\\w\\[\\]\\.]+\\.ESW(?!\\w)");

    static final String CODE_FUNCTION = "MathUtilities.Sum";
    static final String REPORT_FUNCTION = "sum";
    static final String UTILITIES_DIRECTIVE = "using APSIM.Shared.Utilities;";

    @Override
    public void apply(Node root) {
        for (Node code : ReferenceSites.codeBodies(root)) {
            ReferenceSites.rewriteText(code, text -> {
                String wrapped = TextRewriter.wrapMatches(text, ESW_REFERENCE, CODE_FUNCTION);
                return wrapped.equals(text) ? text : CodeBodies.ensureDirective(wrapped, UTILITIES_DIRECTIVE);
            });
        }
        for (Node variable : ReferenceSites.reportVariables(root)) {
            ReferenceSites.rewriteText(
                    variable, text -> TextRewriter.wrapReference(text, ESW_REFERENCE, REPORT_FUNCTION));
        }
    }
}
