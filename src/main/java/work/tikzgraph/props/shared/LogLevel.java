package work.tikzgraph.props.shared;

import java.util.Locale;

/**
 * Threshold for {@link ResolverLog}; {@link #OFF} silences every diagnostic.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "warning":
                return WARN;
            case "none":
            case "quiet":
                return OFF;
            default:
                break;
        }
        for (LogLevel level : values()) {
            if (level.label().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported log level: " + value + " (expected trace, debug, info, warn, error or off)");
    }

    /** Lower-case name used in configuration files and log lines. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * True when a message at {@code level} passes this threshold. {@code OFF} is never emitted.
     */
    public boolean includes(LogLevel level) {
        return level != OFF && level.ordinal() >= ordinal();
    }
}
