package offlinecache.application.cli;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Keeps routine log output off the console so command output stays readable.
 */
public final class LogConfig {
    private LogConfig() {
    }

    public static void init(final boolean verbose) {
        final Level level = verbose ? Level.INFO : Level.WARNING;
        final Logger rootLogger = LogManager.getLogManager().getLogger("");
        rootLogger.setLevel(level);
        for (final Handler handler : rootLogger.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
