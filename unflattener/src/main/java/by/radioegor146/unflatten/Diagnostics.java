package by.radioegor146.unflatten;

import by.radioegor146.unflatten.DeobfuscatorConfig.Verbosity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Diagnostic stream of a run, gated by the configured {@link Verbosity}.
 */
public final class Diagnostics {

    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private final Verbosity verbosity;

    public Diagnostics(Verbosity verbosity) {
        this.verbosity = verbosity;
    }

    public boolean isEnabled(Verbosity level) {
        return verbosity.includes(level) && logger.isInfoEnabled();
    }

    public void summary(String format, Object... args) {
        if (isEnabled(Verbosity.SUMMARY)) {
            logger.info(format, args);
        }
    }

    public void detail(String format, Object... args) {
        if (isEnabled(Verbosity.DETAIL)) {
            logger.info(format, args);
        }
    }

    /** The text is only produced when full dumps are enabled. */
    public void dump(String title, Supplier<String> text) {
        if (isEnabled(Verbosity.FULL_DUMP)) {
            logger.info("{}\n{}", title, text.get());
        }
    }
}
