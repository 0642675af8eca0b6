package io.reloop.server.validation;

/// Turns caller-supplied text into something that fits on one log line.
///
/// Task ids, hook ids, notes and summaries reach the log straight from REST
/// requests. Every control character, CR and LF included, and the Unicode line
/// and paragraph separators become `_`. Values longer than {@value #MAX_LENGTH}
/// characters are cut and marked with `...`, so a pasted build log in a summary
/// stays one short line.
///
/// ```
/// LOG.infov("Validated task {0}", LogSanitizer.sanitize(taskId));
/// ```
public final class LogSanitizer {

    static final int MAX_LENGTH = 256;

    private LogSanitizer() {}

    /// Sanitizes a value for logging.
    ///
    /// @param value the value, may be null
    /// @return the single-line value, `"null"` for null input, never null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        int end = Math.min(value.length(), MAX_LENGTH);
        StringBuilder line = new StringBuilder(end + 3);
        for (int i = 0; i < end; i++) {
            char c = value.charAt(i);
            line.append(breaksLine(c) ? '_' : c);
        }
        if (value.length() > MAX_LENGTH) {
            line.append("...");
        }
        return line.toString();
    }

    private static boolean breaksLine(char c) {
        int type = Character.getType(c);
        return Character.isISOControl(c)
                || type == Character.LINE_SEPARATOR
                || type == Character.PARAGRAPH_SEPARATOR;
    }
}
