package de.mirkosertic.codeindex.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the code index.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.codeindex/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * The loaded values are raw. {@link #validate()} reports every problem at once, and the typed
 * accessors ({@link #toWatchConfig()} and friends) refuse to hand out settings from an invalid
 * configuration.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_WATCH_ROOT = "CODEINDEX_WATCH_ROOT";
    private static final String ENV_INDEX_PATH = "CODEINDEX_INDEX_PATH";
    private static final String ENV_EMBEDDING_URL = "CODEINDEX_EMBEDDING_URL";
    private static final String CONFIG_DIR = ".codeindex";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Watch settings
    private String watchRoot;
    private boolean watchEnabled = true;
    private boolean autoStart = true;
    private double debounceSeconds = 2.0;
    private int batchSize = 10;
    private int maxQueueSize = 1000;
    private long statsIntervalSeconds = 60;
    private List<String> includePatterns = new ArrayList<>();
    private List<String> excludedDirectories = new ArrayList<>();
    private List<String> excludedFiles = new ArrayList<>();
    private double maxFileSizeMb = 10;
    private long pollIntervalMs = 2000;
    private boolean pollingFallback = true;

    // Vector store
    private String indexPath;
    private long commitIntervalSeconds = 30;

    // Embedding backend
    private String embeddingProvider = "ollama";
    private String embeddingUrl = "http://localhost:11434";
    private String embeddingModel = "nomic-embed-text";
    private int embeddingDimension = 768;
    private long embeddingTimeoutSeconds = 30;
    private int embeddingCacheSize = 1000;

    // Chunking
    private int chunkMaxTokens = 512;
    private int chunkMinTokens = 100;
    private double chunkOverlapRatio = 0.15;

    // Ingest
    private int ingestConcurrency = 2;
    private int ingestMaxAttempts = 5;
    private long backoffBaseMs = 500;
    private long backoffMaxMs = 30000;
    private boolean skipUnchanged = true;

    // Bulk
    private boolean bulkEnabled = true;
    private int bulkBatchSize = 16;
    private String bulkStateFile;

    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.applyDefaults();
        config.determineProfile();

        logger.info("Configuration loaded: watchRoot={}, indexPath={}, embedding={}/{}, deployedMode={}",
                config.watchRoot, config.indexPath, config.embeddingProvider, config.embeddingModel,
                config.deployedMode);

        return config;
    }

    /**
     * Classpath defaults overlaid with the given YAML document. Environment and user file are ignored.
     */
    public static ApplicationConfig fromYaml(final String yamlDocument) {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        final Map<String, Object> overrides = new Yaml().load(yamlDocument);
        if (overrides != null) {
            config.applyYamlConfig(overrides);
        }
        config.applyDefaults();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("codeindex");
        if (root == null) {
            return;
        }

        final Map<String, Object> watch = (Map<String, Object>) root.get("watch");
        if (watch != null) {
            applyWatchConfig(watch);
        }

        final Map<String, Object> index = (Map<String, Object>) root.get("index");
        if (index != null) {
            this.indexPath = stringValue(index, "path", indexPath);
            this.commitIntervalSeconds = longValue(index, "commit-interval-seconds", commitIntervalSeconds);
        }

        final Map<String, Object> embedding = (Map<String, Object>) root.get("embedding");
        if (embedding != null) {
            this.embeddingProvider = stringValue(embedding, "provider", embeddingProvider);
            this.embeddingUrl = stringValue(embedding, "url", embeddingUrl);
            this.embeddingModel = stringValue(embedding, "model", embeddingModel);
            this.embeddingDimension = intValue(embedding, "dimension", embeddingDimension);
            this.embeddingTimeoutSeconds = longValue(embedding, "timeout-seconds", embeddingTimeoutSeconds);
            this.embeddingCacheSize = intValue(embedding, "cache-size", embeddingCacheSize);
        }

        final Map<String, Object> chunking = (Map<String, Object>) root.get("chunking");
        if (chunking != null) {
            this.chunkMaxTokens = intValue(chunking, "max-tokens", chunkMaxTokens);
            this.chunkMinTokens = intValue(chunking, "min-tokens", chunkMinTokens);
            this.chunkOverlapRatio = doubleValue(chunking, "overlap-ratio", chunkOverlapRatio);
        }

        final Map<String, Object> ingest = (Map<String, Object>) root.get("ingest");
        if (ingest != null) {
            this.ingestConcurrency = intValue(ingest, "concurrency", ingestConcurrency);
            this.ingestMaxAttempts = intValue(ingest, "max-attempts", ingestMaxAttempts);
            this.backoffBaseMs = longValue(ingest, "backoff-base-ms", backoffBaseMs);
            this.backoffMaxMs = longValue(ingest, "backoff-max-ms", backoffMaxMs);
            this.skipUnchanged = booleanValue(ingest, "skip-unchanged", skipUnchanged);
        }

        final Map<String, Object> bulk = (Map<String, Object>) root.get("bulk");
        if (bulk != null) {
            this.bulkEnabled = booleanValue(bulk, "enabled", bulkEnabled);
            this.bulkBatchSize = intValue(bulk, "batch-size", bulkBatchSize);
            this.bulkStateFile = stringValue(bulk, "state-file", bulkStateFile);
        }
    }

    private void applyWatchConfig(final Map<String, Object> watch) {
        this.watchRoot = stringValue(watch, "root", watchRoot);
        this.watchEnabled = booleanValue(watch, "enabled", watchEnabled);
        this.autoStart = booleanValue(watch, "auto-start", autoStart);
        this.debounceSeconds = doubleValue(watch, "debounce-seconds", debounceSeconds);
        this.batchSize = intValue(watch, "batch-size", batchSize);
        this.maxQueueSize = intValue(watch, "max-queue-size", maxQueueSize);
        this.statsIntervalSeconds = longValue(watch, "stats-interval-seconds", statsIntervalSeconds);
        this.maxFileSizeMb = doubleValue(watch, "max-file-size-mb", maxFileSizeMb);
        this.pollIntervalMs = longValue(watch, "poll-interval-ms", pollIntervalMs);
        this.pollingFallback = booleanValue(watch, "polling-fallback", pollingFallback);
        this.includePatterns = stringList(watch, "include-patterns", includePatterns);
        this.excludedDirectories = stringList(watch, "excluded-directories", excludedDirectories);
        this.excludedFiles = stringList(watch, "excluded-files", excludedFiles);
    }

    private String stringValue(final Map<String, Object> section, final String key, final String current) {
        final Object value = section.get(key);
        return value != null ? resolveVariables(value.toString()) : current;
    }

    private static int intValue(final Map<String, Object> section, final String key, final int current) {
        final Object value = section.get(key);
        return value instanceof Number number ? number.intValue() : current;
    }

    private static long longValue(final Map<String, Object> section, final String key, final long current) {
        final Object value = section.get(key);
        return value instanceof Number number ? number.longValue() : current;
    }

    private static double doubleValue(final Map<String, Object> section, final String key, final double current) {
        final Object value = section.get(key);
        return value instanceof Number number ? number.doubleValue() : current;
    }

    private static boolean booleanValue(final Map<String, Object> section, final String key, final boolean current) {
        final Object value = section.get(key);
        return value instanceof Boolean bool ? bool : current;
    }

    @SuppressWarnings("unchecked")
    private static List<String> stringList(final Map<String, Object> section, final String key,
                                           final List<String> current) {
        final Object value = section.get(key);
        if (value instanceof List) {
            final List<String> result = new ArrayList<>();
            for (final Object item : (List<Object>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return current;
    }

    private void applyEnvironmentOverrides() {
        final String envRoot = System.getenv(ENV_WATCH_ROOT);
        if (envRoot != null && !envRoot.isBlank()) {
            this.watchRoot = envRoot.trim();
            logger.info("Watch root from environment: {}", this.watchRoot);
        }

        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.isBlank()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        final String envEmbeddingUrl = System.getenv(ENV_EMBEDDING_URL);
        if (envEmbeddingUrl != null && !envEmbeddingUrl.isBlank()) {
            this.embeddingUrl = envEmbeddingUrl.trim();
        }

        final String propRoot = System.getProperty("codeindex.watch.root");
        if (propRoot != null && !propRoot.isEmpty()) {
            this.watchRoot = propRoot;
        }
        final String propIndexPath = System.getProperty("codeindex.index.path");
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    private void applyDefaults() {
        if (indexPath == null || indexPath.isEmpty()) {
            indexPath = getConfigDirectory().resolve("vectorindex").toString();
        }
        if (bulkStateFile == null || bulkStateFile.isEmpty()) {
            bulkStateFile = getConfigDirectory().resolve("bulk-state.yaml").toString();
        }
    }

    private void determineProfile() {
        this.deployedMode = "deployed".equalsIgnoreCase(System.getProperty("profile", "default"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}. Defaults may themselves contain variables.
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        final int start = value.indexOf("${");
        int depth = 0;
        int end = -1;
        for (int i = start; i < value.length(); i++) {
            if (value.startsWith("${", i)) {
                depth++;
                i++;
            } else if (value.charAt(i) == '}') {
                depth--;
                if (depth == 0) {
                    end = i;
                    break;
                }
            }
        }
        if (end < 0) {
            return value;
        }

        final String varExpr = value.substring(start + 2, end);
        final int colon = varExpr.indexOf(':');
        final String varName = colon >= 0 ? varExpr.substring(0, colon) : varExpr;
        final String defaultValue = colon >= 0 ? varExpr.substring(colon + 1) : "";

        // Check environment first, then system properties
        String replacement = System.getenv(varName);
        if (replacement == null || replacement.isEmpty()) {
            replacement = System.getProperty(varName);
        }
        if (replacement == null || replacement.isEmpty()) {
            replacement = resolveVariables(defaultValue);
        }

        return value.substring(0, start) + replacement + resolveVariables(value.substring(end + 1));
    }

    /**
     * Collects every validation problem. An empty list means the configuration is usable.
     */
    public List<String> validate() {
        final List<String> problems = new ArrayList<>();
        if (watchRoot == null || watchRoot.isBlank()) {
            problems.add("watch.root is not set");
        } else if (!Files.isDirectory(Paths.get(watchRoot))) {
            problems.add("watch.root is not a directory: " + watchRoot);
        }
        if (batchSize <= 0) {
            problems.add("watch.batch-size must be > 0, was " + batchSize);
        }
        if (maxQueueSize <= 0) {
            problems.add("watch.max-queue-size must be > 0, was " + maxQueueSize);
        }
        if (maxFileSizeMb <= 0) {
            problems.add("watch.max-file-size-mb must be > 0, was " + maxFileSizeMb);
        }
        if (debounceSeconds < 0) {
            problems.add("watch.debounce-seconds must not be negative, was " + debounceSeconds);
        }
        if (statsIntervalSeconds <= 0) {
            problems.add("watch.stats-interval-seconds must be > 0, was " + statsIntervalSeconds);
        }
        if (pollIntervalMs <= 0) {
            problems.add("watch.poll-interval-ms must be > 0, was " + pollIntervalMs);
        }
        if (includePatterns.isEmpty()) {
            problems.add("watch.include-patterns must not be empty");
        }
        if (!"ollama".equalsIgnoreCase(embeddingProvider) && !"hashing".equalsIgnoreCase(embeddingProvider)) {
            problems.add("embedding.provider must be 'ollama' or 'hashing', was " + embeddingProvider);
        }
        if (embeddingDimension <= 0 || embeddingDimension > 1024) {
            problems.add("embedding.dimension must be in 1..1024, was " + embeddingDimension);
        }
        if (embeddingModel == null || embeddingModel.isBlank()) {
            problems.add("embedding.model is not set");
        }
        if (chunkMaxTokens <= 0) {
            problems.add("chunking.max-tokens must be > 0, was " + chunkMaxTokens);
        }
        if (chunkMinTokens < 0 || chunkMinTokens > chunkMaxTokens) {
            problems.add("chunking.min-tokens must be between 0 and max-tokens, was " + chunkMinTokens);
        }
        if (chunkOverlapRatio < 0 || chunkOverlapRatio >= 1) {
            problems.add("chunking.overlap-ratio must be in [0, 1), was " + chunkOverlapRatio);
        }
        if (ingestConcurrency <= 0) {
            problems.add("ingest.concurrency must be > 0, was " + ingestConcurrency);
        }
        if (ingestMaxAttempts <= 0) {
            problems.add("ingest.max-attempts must be > 0, was " + ingestMaxAttempts);
        }
        if (commitIntervalSeconds < 0) {
            problems.add("index.commit-interval-seconds must not be negative, was " + commitIntervalSeconds);
        }
        if (bulkBatchSize <= 0) {
            problems.add("bulk.batch-size must be > 0, was " + bulkBatchSize);
        }
        return problems;
    }

    /**
     * @throws ConfigurationException if {@link #validate()} reports any problem
     */
    public void requireValid() {
        final List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    public WatchConfig toWatchConfig() {
        requireValid();
        return new WatchConfig(
                Paths.get(watchRoot),
                watchEnabled,
                autoStart,
                includePatterns,
                new LinkedHashSet<>(excludedDirectories),
                excludedFiles,
                (long) (maxFileSizeMb * 1024 * 1024),
                Duration.ofMillis((long) (debounceSeconds * 1000)),
                batchSize,
                maxQueueSize,
                Duration.ofSeconds(statsIntervalSeconds),
                Duration.ofMillis(pollIntervalMs),
                pollingFallback);
    }

    public ChunkingConfig toChunkingConfig() {
        requireValid();
        return new ChunkingConfig(chunkMaxTokens, chunkMinTokens, chunkOverlapRatio);
    }

    public IngestConfig toIngestConfig() {
        requireValid();
        return new IngestConfig(ingestConcurrency, ingestMaxAttempts, Duration.ofMillis(backoffBaseMs),
                Duration.ofMillis(backoffMaxMs), skipUnchanged);
    }

    public EmbeddingConfig toEmbeddingConfig() {
        requireValid();
        return new EmbeddingConfig(embeddingProvider.toLowerCase(), embeddingUrl, embeddingModel,
                embeddingDimension, Duration.ofSeconds(embeddingTimeoutSeconds), embeddingCacheSize);
    }

    public BulkConfig toBulkConfig() {
        requireValid();
        return new BulkConfig(bulkEnabled, bulkBatchSize, Paths.get(bulkStateFile));
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public String getWatchRoot() {
        return watchRoot;
    }

    public String getIndexPath() {
        return indexPath;
    }

    /**
     * Zero disables periodic commits; the store then commits on close only.
     */
    public Duration getCommitInterval() {
        return Duration.ofSeconds(commitIntervalSeconds);
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
