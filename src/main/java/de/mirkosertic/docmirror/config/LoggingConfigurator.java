package de.mirkosertic.docmirror.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches logging to the daemon configuration for long-running scheduled operation.
 * <p>
 * In daemon mode, loads logback-daemon.xml which writes a rolling log file under
 * ~/.docmirror/log. One-shot commands keep the console output of logback.xml.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR = System.getProperty("user.home") + "/.docmirror/log";
    static final String DAEMON_CONFIG = "logback-daemon.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used for the switch to cover all output.
     *
     * @param daemonMode true when running the scheduler
     */
    public static void configure(final boolean daemonMode) {
        if (daemonMode) {
            ensureLogDirectoryExists();
            loadConfiguration(DAEMON_CONFIG);
        }
        // Default mode uses logback.xml which is loaded automatically
    }

    private static void ensureLogDirectoryExists() {
        try {
            final Path logDir = Paths.get(LOG_DIR);
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + LOG_DIR);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            context.putProperty("LOG_DIR", LOG_DIR);

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException | RuntimeException e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
