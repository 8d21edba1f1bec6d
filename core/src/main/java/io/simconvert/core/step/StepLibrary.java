package io.simconvert.core.step;

import io.simconvert.core.error.StepLibraryException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable catalog of conversion steps keyed by source version.
 *
 * <p>
 * Keys always form the contiguous range {@code 0 .. latestVersion - 1}, so the driver can walk
 * from any supported version to the latest without gaps. Supporting a new release means
 * registering exactly one more step, keyed by the previous latest version.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable. Built once and shared.
 */
public final class StepLibrary {

    private final List<RegisteredStep> steps;

    private StepLibrary(List<RegisteredStep> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    /**
     * Returns a new {@link Builder}.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** The version every conversion ends at. */
    public int latestVersion() {
        return steps.size();
    }

    /**
     * Looks up the step converting from {@code fromVersion}.
     *
     * @return the step, or empty when {@code fromVersion} is outside {@code 0 .. latestVersion - 1}
     */
    public Optional<RegisteredStep> step(int fromVersion) {
        if (fromVersion < 0 || fromVersion >= steps.size()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(fromVersion));
    }

    /** Returns all steps in ascending source-version order. */
    public List<RegisteredStep> steps() {
        return steps;
    }

    /**
     * Returns the steps needed to bring a document from {@code fromVersion} to the latest, in
     * application order. Empty for versions at or past the latest.
     */
    public List<RegisteredStep> chainFrom(int fromVersion) {
        if (fromVersion >= steps.size()) {
            return List.of();
        }
        return steps.subList(Math.max(0, fromVersion), steps.size());
    }

    /**
     * Builder for a {@link StepLibrary}. Registration order does not matter; {@link #build()}
     * checks that the keys are contiguous from zero.
     */
    public static final class Builder {

        private final TreeMap<Integer, RegisteredStep> steps = new TreeMap<>();

        Builder() {}

        /**
         * Registers the step converting from {@code fromVersion}.
         *
         * @return this builder (fluent)
         * @throws StepLibraryException if the version is negative or already registered
         */
        public Builder register(int fromVersion, String name, ConversionStep step) {
            if (fromVersion < 0) {
                throw new StepLibraryException("Step source version must not be negative, got: " + fromVersion);
            }
            if (steps.containsKey(fromVersion)) {
                throw new StepLibraryException("A step is already registered for version " + fromVersion + " ("
                        + steps.get(fromVersion).name() + ")");
            }
            steps.put(fromVersion, new RegisteredStep(fromVersion, name, step));
            return this;
        }

        /**
         * Builds the immutable library.
         *
         * @throws StepLibraryException if the registered versions leave a gap
         */
        public StepLibrary build() {
            int expected = 0;
            for (Integer version : steps.keySet()) {
                if (version != expected) {
                    throw new StepLibraryException("No step registered for version " + expected
                            + "; steps must cover every version from 0 upwards");
                }
                expected++;
            }
            return new StepLibrary(new ArrayList<>(steps.values()));
        }
    }
}
