package io.simconvert.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A simulation document: one root {@link Node} whose integer version marker is carried as an
 * attribute on the root.
 *
 * <p>
 * An absent marker means the oldest known format (version 0). A marker that is not a
 * non-negative integer is read as 0 as well, so a damaged document receives the full chain of
 * conversions rather than none.
 */
public final class Document {

    /** Name of the version marker attribute, stable across all schema versions. */
    public static final String DEFAULT_VERSION_ATTRIBUTE = "Version";

    private final Node root;
    private final String versionAttribute;

    public Document(Node root, String versionAttribute) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.versionAttribute = Objects.requireNonNull(versionAttribute, "versionAttribute must not be null");
    }

    /** Wraps a root using the default {@value #DEFAULT_VERSION_ATTRIBUTE} marker. */
    public static Document of(Node root) {
        return new Document(root, DEFAULT_VERSION_ATTRIBUTE);
    }

    public Node root() {
        return root;
    }

    public String versionAttribute() {
        return versionAttribute;
    }

    /** Returns the raw marker value, or {@code null} when the root carries none. */
    public String rawVersion() {
        return root.attribute(versionAttribute);
    }

    /** Returns the document version, 0 when absent or malformed. */
    public int version() {
        return parseVersion(rawVersion());
    }

    /** Returns {@code true} if the marker is present and is a non-negative integer. */
    public boolean hasWellFormedVersion() {
        String raw = rawVersion();
        return raw != null && parseOrNegative(raw) >= 0;
    }

    /** Writes the version marker onto the root, keeping its attribute position. */
    public void stampVersion(int version) {
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative, got: " + version);
        }
        root.setAttribute(versionAttribute, Integer.toString(version));
    }

    /**
     * Parses a version marker. {@code null}, blank, non-integer and negative values all read as
     * 0. An integer too large for {@code int} reads as {@link Integer#MAX_VALUE}, so it still
     * counts as newer than any supported version.
     */
    public static int parseVersion(String raw) {
        if (raw == null) {
            return 0;
        }
        return Math.max(0, parseOrNegative(raw));
    }

    private static int parseOrNegative(String raw) {
        BigInteger value;
        try {
            value = new BigInteger(raw.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
        if (value.signum() < 0) {
            return -1;
        }
        return value.bitLength() < Integer.SIZE ? value.intValue() : Integer.MAX_VALUE;
    }
}
