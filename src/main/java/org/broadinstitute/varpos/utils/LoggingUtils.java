package org.broadinstitute.varpos.utils;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * Logging utilities.
 *
 * All logging in this library goes through log4j, under loggers named after the {@code org.broadinstitute.varpos}
 * classes that own them, so verbosity is controlled on the logger config for that package.
 */
public final class LoggingUtils {

    public static final String ROOT_LOGGER_NAME = "org.broadinstitute.varpos";

    private LoggingUtils(){}

    /**
     * Sets the level of every logger in this library.
     *
     * A logger config for {@link #ROOT_LOGGER_NAME} is added to the active configuration if it has none,
     * so the level never leaks into the root logger of the host application.
     */
    public static void setLoggingLevel(final Level verbosity) {
        Utils.nonNull(verbosity, "verbosity");
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(ROOT_LOGGER_NAME);

        if (loggerConfig.getName().equals(ROOT_LOGGER_NAME)) {
            loggerConfig.setLevel(verbosity);
        } else {
            final LoggerConfig packageConfig = new LoggerConfig(ROOT_LOGGER_NAME, verbosity, true);
            packageConfig.setParent(loggerConfig);
            loggerContextConfig.addLogger(ROOT_LOGGER_NAME, packageConfig);
        }
        loggerContext.updateLoggers();
    }

    /**
     * @return the level currently in effect for the loggers of this library
     */
    public static Level getLoggingLevel() {
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        return loggerContext.getConfiguration().getLoggerConfig(ROOT_LOGGER_NAME).getLevel();
    }
}
