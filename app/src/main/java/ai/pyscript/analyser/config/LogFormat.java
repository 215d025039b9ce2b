package ai.pyscript.analyser.config;

import java.util.Locale;

/**
 * Output formats for diagnostics written to stderr.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Log format must be provided");
        }
        for (LogFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported log format: " + raw + " (expected text or json)");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
