package io.simconvert.core.text;

import java.util.Objects;

/**
 * Decides whether a text match sits on token boundaries, so that renaming {@code Foo} leaves
 * {@code FooBar} and {@code MyFoo} intact.
 *
 * <p>
 * A match is rejected when a token character on its edge touches another token character just
 * outside it. Edges made of punctuation ({@code .Foo}, {@code [Foo]}) are not checked on that
 * side, which lets a rule anchor itself to a path separator.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class TokenBoundary {

    /** Letters, digits and underscore form tokens. */
    public static final TokenBoundary IDENTIFIER = new TokenBoundary("identifier", true, "");

    /** Plain substring matching with no boundary check. */
    public static final TokenBoundary NONE = new TokenBoundary("none", false, "");

    private final String name;
    private final boolean enforced;
    private final String extraTokenChars;

    private TokenBoundary(String name, boolean enforced, String extraTokenChars) {
        this.name = name;
        this.enforced = enforced;
        this.extraTokenChars = extraTokenChars;
    }

    /**
     * Returns a boundary that additionally treats the given characters as part of a token (for
     * example {@code "$"} for script dialects that allow it in identifiers).
     */
    public TokenBoundary withExtraTokenChars(String chars) {
        Objects.requireNonNull(chars, "chars must not be null");
        return new TokenBoundary(name + "+" + chars, true, extraTokenChars + chars);
    }

    /** Returns {@code true} if {@code c} is part of a token under this boundary. */
    public boolean isTokenChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || extraTokenChars.indexOf(c) >= 0;
    }

    /** Returns {@code true} if the match {@code text[start, end)} respects this boundary. */
    public boolean accepts(CharSequence text, int start, int end) {
        if (!enforced || start >= end) {
            return true;
        }
        if (start > 0 && isTokenChar(text.charAt(start)) && isTokenChar(text.charAt(start - 1))) {
            return false;
        }
        return end >= text.length() || !isTokenChar(text.charAt(end - 1)) || !isTokenChar(text.charAt(end));
    }

    public boolean isEnforced() {
        return enforced;
    }

    @Override
    public String toString() {
        return "TokenBoundary[" + name + "]";
    }
}
