package io.simconvert.core.text;

import java.util.Objects;

/**
 * A single whole-token rename, e.g. {@code .NonStructural} to {@code .Storage}.
 *
 * @param from the token sequence to find; must not be empty
 * @param to   the replacement text
 */
public record RenameRule(String from, String to) {

    public RenameRule {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (from.isEmpty()) {
            throw new IllegalArgumentException("from must not be empty");
        }
    }

    /** Shorthand for {@code new RenameRule(from, to)}. */
    public static RenameRule rename(String from, String to) {
        return new RenameRule(from, to);
    }
}
