package de.mirkosertic.gitwebdiff.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.jspecify.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Selects the Logback setup for the server.
 * <p>
 * The default {@code logback.xml} logs to the console. With {@code -Dprofile=quiet} the
 * server loads {@code logback-quiet.xml} instead, which writes a rolling file below
 * {@code ~/.gitwebdiff/log} (or {@code -Dgitwebdiff.log.dir}) and keeps the terminal
 * for the startup lines.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "gitwebdiff.log.dir";
    static final String LOG_FILE_NAME = "gitwebdiff.log";
    private static final String QUIET_CONFIG = "logback-quiet.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything logs.
     *
     * @param quietMode true to log to file only
     * @return the log file in quiet mode, {@code null} when logging to the console
     */
    public static @Nullable Path configure(final boolean quietMode) {
        if (!quietMode) {
            return null;
        }
        final Path logDirectory = logDirectory(System.getProperty(LOG_DIR_PROPERTY));
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }
        loadConfiguration(QUIET_CONFIG, logDirectory);
        return logDirectory.resolve(LOG_FILE_NAME);
    }

    static Path logDirectory(final @Nullable String override) {
        if (override != null && !override.isBlank()) {
            return Path.of(override).toAbsolutePath().normalize();
        }
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void loadConfiguration(final String configFile, final Path logDirectory) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        context.putProperty("LOG_DIR", logDirectory.toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);

        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading " + configFile + ": " + e.getMessage());
        }
    }
}
