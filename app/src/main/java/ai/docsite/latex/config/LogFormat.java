package ai.docsite.latex.config;

import java.util.Locale;

/**
 * Supported log output formats.
 */
public enum LogFormat {
    TEXT,
    JSON;

    /**
     * Parses a format name; blank input selects {@link #TEXT}.
     */
    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (LogFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported log format: " + raw + " (expected text or json)");
    }
}
