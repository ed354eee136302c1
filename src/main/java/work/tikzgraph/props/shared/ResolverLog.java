package work.tikzgraph.props.shared;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Level-gated diagnostics on standard error. Stack traces are printed only when the
 * {@code tikzgraph.debug} system property is set.
 */
public final class ResolverLog {
    private final LogLevel threshold;
    private final PrintStream out;

    public ResolverLog(LogLevel threshold) {
        this(threshold, System.err);
    }

    public ResolverLog(LogLevel threshold, PrintStream out) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.out = Objects.requireNonNull(out, "out");
    }

    public boolean isEnabled(LogLevel level) {
        return threshold.includes(level);
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    public void error(String message, Throwable error) {
        log(LogLevel.ERROR, "%s", message);
        if (error != null && Boolean.getBoolean("tikzgraph.debug")) {
            error.printStackTrace(out);
        }
    }

    public void log(LogLevel level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        out.printf("[%s] %s%n", level.label(), String.format(format, args));
    }
}
