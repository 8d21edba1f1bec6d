package io.simconvert.core.engine;

import io.simconvert.core.model.Document;
import java.util.Objects;

/**
 * Driver configuration. Immutable and thread-safe.
 *
 * @param versionAttribute  name of the root attribute holding the schema version (default:
 *                          {@value Document#DEFAULT_VERSION_ATTRIBUTE})
 * @param stepFailurePolicy what to do after a step throws (default: {@link StepFailurePolicy#SKIP})
 */
public record ConverterConfig(String versionAttribute, StepFailurePolicy stepFailurePolicy) {

    /** Default configuration: {@code Version} attribute, skip failed steps. */
    public static final ConverterConfig DEFAULT =
            new ConverterConfig(Document.DEFAULT_VERSION_ATTRIBUTE, StepFailurePolicy.SKIP);

    public ConverterConfig {
        Objects.requireNonNull(versionAttribute, "versionAttribute must not be null");
        Objects.requireNonNull(stepFailurePolicy, "stepFailurePolicy must not be null");
        if (versionAttribute.isBlank()) {
            throw new IllegalArgumentException("versionAttribute must not be blank");
        }
    }

    /** Returns a copy with a different failure policy. */
    public ConverterConfig withStepFailurePolicy(StepFailurePolicy policy) {
        return new ConverterConfig(versionAttribute, policy);
    }
}
