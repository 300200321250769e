package de.mirkosertic.codeindex.config;

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
 * Switches Logback to the rolling file setup when the indexer runs as a deployed background process.
 * <p>
 * Development runs keep logback.xml (console), which Logback picks up on its own.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param deployedMode true when started with {@code -Dprofile=deployed}
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists(Paths.get(System.getProperty("user.home"), ".codeindex", "log"));
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    static void ensureLogDirectoryExists(final Path logDir) {
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            // Logging is not available yet
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: " + configFile + " not found on classpath, keeping console logging");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
