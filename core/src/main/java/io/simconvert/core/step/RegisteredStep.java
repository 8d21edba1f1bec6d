package io.simconvert.core.step;

import java.util.Objects;

/**
 * A step bound to its source version.
 *
 * @param fromVersion the version the step converts from; it produces {@code fromVersion + 1}
 * @param name        short description used in logs and listener events
 * @param step        the transformation
 */
public record RegisteredStep(int fromVersion, String name, ConversionStep step) {

    public RegisteredStep {
        if (fromVersion < 0) {
            throw new IllegalArgumentException("fromVersion must not be negative, got: " + fromVersion);
        }
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(step, "step must not be null");
    }

    /** The version this step produces. */
    public int toVersion() {
        return fromVersion + 1;
    }
}
