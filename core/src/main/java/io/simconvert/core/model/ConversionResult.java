package io.simconvert.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of running a document through the migration driver. Exactly one of four states:
 *
 * <ul>
 * <li>{@link Status#CONVERTED}: at least one step ran and the root now carries the latest
 * version.
 * <li>{@link Status#UP_TO_DATE}: the document was already at the latest version; nothing was
 * touched.
 * <li>{@link Status#UNSUPPORTED_VERSION}: the document is newer than this engine; nothing was
 * touched. The host should warn the user separately.
 * <li>{@link Status#ABORTED}: a step failed under the abort policy; the root is stamped with the
 * last version that was fully reached.
 * </ul>
 */
public final class ConversionResult {

    /** The type of conversion outcome. */
    public enum Status {
        CONVERTED,
        UP_TO_DATE,
        UNSUPPORTED_VERSION,
        ABORTED
    }

    private final Status status;
    private final int fromVersion;
    private final int toVersion;
    private final List<Integer> appliedSteps;
    private final List<Integer> failedSteps;

    private ConversionResult(
            Status status, int fromVersion, int toVersion, List<Integer> appliedSteps, List<Integer> failedSteps) {
        this.status = status;
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
        this.appliedSteps = List.copyOf(appliedSteps);
        this.failedSteps = List.copyOf(failedSteps);
    }

    /** Creates a CONVERTED result. */
    public static ConversionResult converted(
            int fromVersion, int toVersion, List<Integer> appliedSteps, List<Integer> failedSteps) {
        Objects.requireNonNull(appliedSteps, "appliedSteps must not be null");
        Objects.requireNonNull(failedSteps, "failedSteps must not be null");
        return new ConversionResult(Status.CONVERTED, fromVersion, toVersion, appliedSteps, failedSteps);
    }

    /** Creates an UP_TO_DATE result for a document already at {@code version}. */
    public static ConversionResult upToDate(int version) {
        return new ConversionResult(Status.UP_TO_DATE, version, version, List.of(), List.of());
    }

    /** Creates an UNSUPPORTED_VERSION result for a document newer than the engine. */
    public static ConversionResult unsupported(int documentVersion) {
        return new ConversionResult(Status.UNSUPPORTED_VERSION, documentVersion, documentVersion, List.of(), List.of());
    }

    /** Creates an ABORTED result; {@code toVersion} is the last version fully reached. */
    public static ConversionResult aborted(
            int fromVersion, int toVersion, List<Integer> appliedSteps, List<Integer> failedSteps) {
        return new ConversionResult(Status.ABORTED, fromVersion, toVersion, appliedSteps, failedSteps);
    }

    public Status status() {
        return status;
    }

    /** Version read off the document before conversion. */
    public int fromVersion() {
        return fromVersion;
    }

    /** Version stamped on the document after conversion (equal to {@link #fromVersion()} if untouched). */
    public int toVersion() {
        return toVersion;
    }

    /** Source versions of the steps that completed, in application order. */
    public List<Integer> appliedSteps() {
        return appliedSteps;
    }

    /** Source versions of the steps that failed and were rolled back. */
    public List<Integer> failedSteps() {
        return failedSteps;
    }

    /** Returns {@code true} if the document was mutated (including the version stamp). */
    public boolean changed() {
        return switch (status) {
            case CONVERTED -> true;
            case ABORTED -> toVersion != fromVersion;
            case UP_TO_DATE, UNSUPPORTED_VERSION -> false;
        };
    }

    public boolean isConverted() {
        return status == Status.CONVERTED;
    }

    public boolean isUpToDate() {
        return status == Status.UP_TO_DATE;
    }

    public boolean isUnsupported() {
        return status == Status.UNSUPPORTED_VERSION;
    }

    @Override
    public String toString() {
        return switch (status) {
            case CONVERTED -> "ConversionResult[CONVERTED, " + fromVersion + "->" + toVersion
                    + (failedSteps.isEmpty() ? "" : ", failed=" + failedSteps) + "]";
            case UP_TO_DATE -> "ConversionResult[UP_TO_DATE, version=" + fromVersion + "]";
            case UNSUPPORTED_VERSION -> "ConversionResult[UNSUPPORTED_VERSION, version=" + fromVersion + "]";
            case ABORTED -> "ConversionResult[ABORTED, " + fromVersion + "->" + toVersion + ", failed=" + failedSteps
                    + "]";
        };
    }
}
