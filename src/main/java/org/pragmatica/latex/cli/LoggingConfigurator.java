package org.pragmatica.latex.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Applies runtime logback level changes requested on the command line.
 */
public final class LoggingConfigurator {
    private static final String LIBRARY_LOGGER = "org.pragmatica.latex";

    private LoggingConfigurator() {
    }

    public static void configure(boolean verbose) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Logger logger = context.getLogger(LIBRARY_LOGGER);
        logger.setLevel(verbose ? Level.DEBUG : null);
    }
}
