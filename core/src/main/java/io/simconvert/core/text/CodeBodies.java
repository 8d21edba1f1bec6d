package io.simconvert.core.text;

/**
 * Helpers for embedded script bodies.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class CodeBodies {

    private CodeBodies() {}

    /**
     * Makes sure a script body contains a directive line such as
     * {@code using APSIM.Shared.Utilities;}.
     *
     * <p>
     * The directive goes right after the last line that starts with the same keyword, using the
     * body's own line separator. With no such line it is prepended. A body that already contains
     * the directive is returned unchanged.
     *
     * @param code      the script body, may be null
     * @param directive the full directive line without line separator
     * @return the body with the directive present, or null for null input
     */
    public static String ensureDirective(String code, String directive) {
        if (code == null) {
            return null;
        }
        String wanted = directive.trim();
        String keyword = wanted.split("\\s+", 2)[0] + " ";
        String separator = code.contains("\r\n") ? "\r\n" : "\n";

        int insertAt = -1;
        int lineStart = 0;
        while (lineStart <= code.length()) {
            int lineEnd = code.indexOf('\n', lineStart);
            int contentEnd = lineEnd < 0 ? code.length() : lineEnd;
            String line = code.substring(lineStart, contentEnd).trim();
            if (line.equals(wanted)) {
                return code;
            }
            if (line.startsWith(keyword)) {
                insertAt = lineEnd < 0 ? -2 : lineEnd + 1;
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }

        if (insertAt == -1) {
            return wanted + separator + code;
        }
        if (insertAt == -2) {
            // last directive is the final line and has no terminator
            return code + separator + wanted;
        }
        return code.substring(0, insertAt) + wanted + separator + code.substring(insertAt);
    }
}
