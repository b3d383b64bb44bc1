package io.mcpstudio.client.util;

/// Strips control characters from strings to prevent log injection.
///
/// Server ids, URLs and remote error messages come from user configuration or from
/// remote servers. Apply this before passing such a value to a logger:
/// ```
/// LOG.infov("Connecting to MCP server {0}", LogSanitizer.sanitize(serverId));
/// ```
public final class LogSanitizer {

    private static final int MAX_LENGTH = 500;

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters from the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }

    /// Sanitizes and shortens a potentially large payload such as a JSON document.
    ///
    /// @param value the payload, may be null
    /// @return sanitized string of at most 500 characters plus an ellipsis
    public static String abbreviate(String value) {
        String sanitized = sanitize(value);
        return sanitized.length() <= MAX_LENGTH
                ? sanitized
                : sanitized.substring(0, MAX_LENGTH) + "...";
    }
}
