package io.simconvert.standalone.convert;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What happened to one file.
 *
 * @param file        the file that was processed
 * @param status      outcome category
 * @param fromVersion version read off the document, or {@code -1} if it could not be read
 * @param toVersion   version the document carries afterwards, or {@code -1} if it could not be read
 * @param error       failure detail for {@link Status#FAILED}, otherwise {@code null}
 */
public record FileOutcome(Path file, Status status, int fromVersion, int toVersion, String error) {

    /** Outcome category of a single file. */
    public enum Status {
        /** Steps ran; the file was rewritten unless this was a dry run. */
        CONVERTED,
        UP_TO_DATE,
        /** Written by a newer release; left untouched. */
        UNSUPPORTED,
        /** Could not be read, converted or written back. */
        FAILED
    }

    public FileOutcome {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    static FileOutcome failed(Path file, String error) {
        return new FileOutcome(file, Status.FAILED, -1, -1, error);
    }
}
