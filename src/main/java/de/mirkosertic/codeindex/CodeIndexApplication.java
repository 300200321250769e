package de.mirkosertic.codeindex;

import de.mirkosertic.codeindex.bulk.BulkStartResult;
import de.mirkosertic.codeindex.config.ApplicationConfig;
import de.mirkosertic.codeindex.config.BuildInfo;
import de.mirkosertic.codeindex.config.ConfigurationException;
import de.mirkosertic.codeindex.config.LoggingConfigurator;
import de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;

/**
 * Main entry point. Builds the service, starts watching the configured root and, when the store is
 * empty, runs the initial bulk index. Pass {@code --reindex} to rebuild the store from scratch,
 * which is also the way out of an embedding model change.
 */
public class CodeIndexApplication {

    private static final Logger logger = LoggerFactory.getLogger(CodeIndexApplication.class);

    static final String REINDEX_ARG = "--reindex";

    private final ApplicationConfig config;
    private final boolean forceReindex;
    private CodeIndexService service;

    public CodeIndexApplication(final ApplicationConfig config, final boolean forceReindex) {
        this.config = config;
        this.forceReindex = forceReindex;
    }

    /**
     * Initialize all services.
     */
    public void init() throws IOException {
        logger.info("Initializing code index {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());

        service = CodeIndexService.create(config);
        service.addBulkProgressListener(new NotificationService());

        if (!forceReindex) {
            try {
                service.verifyEmbeddingModel();
            } catch (final EmbeddingModelMismatchException e) {
                service.close();
                throw e;
            }
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Start watching and the initial bulk run, then block until the process is terminated.
     */
    public void start() throws IOException {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        final var watchConfig = config.toWatchConfig();
        if (watchConfig.autoStart()) {
            final boolean watching = service.startWatching();
            logger.info("Live change notifications {}", watching ? "active" : "unavailable");
        }

        if (config.toBulkConfig().enabled() || forceReindex) {
            final BulkStartResult result = service.startBulkIndex(forceReindex);
            logger.info("Bulk index {}: {}", result.outcome(), result.reason());
        }

        try {
            // Keep the application running
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public synchronized void shutdown() {
        if (service != null) {
            service.close();
            service = null;
        }
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            final boolean forceReindex = Arrays.asList(args).contains(REINDEX_ARG);

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Watch root: {}", config.getWatchRoot());
                logger.info("Index path: {}", config.getIndexPath());
            }

            final CodeIndexApplication app = new CodeIndexApplication(config, forceReindex);
            app.init();
            app.start();

        } catch (final ConfigurationException e) {
            System.err.println("Invalid configuration:");
            for (final String problem : e.getProblems()) {
                System.err.println("  - " + problem);
            }
            System.exit(2);
        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start code index: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
