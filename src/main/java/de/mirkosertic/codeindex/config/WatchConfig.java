package de.mirkosertic.codeindex.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable watcher and scheduling settings, built once at startup.
 */
public record WatchConfig(
        Path root,
        boolean enabled,
        boolean autoStart,
        List<String> includePatterns,
        Set<String> excludedDirectories,
        List<String> excludedFiles,
        long maxFileSizeBytes,
        Duration debounce,
        int batchSize,
        int maxQueueSize,
        Duration statsInterval,
        Duration pollInterval,
        boolean pollingFallback
) {

    public WatchConfig {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, was " + batchSize);
        }
        if (maxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("maxFileSizeBytes must be > 0, was " + maxFileSizeBytes);
        }
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be > 0, was " + maxQueueSize);
        }
        root = root.toAbsolutePath().normalize();
        includePatterns = List.copyOf(includePatterns);
        excludedDirectories = Set.copyOf(excludedDirectories);
        excludedFiles = List.copyOf(excludedFiles);
    }

    public static Builder builder(final Path root) {
        return new Builder(root);
    }

    public static final class Builder {

        private final Path root;
        private boolean enabled = true;
        private boolean autoStart = true;
        private List<String> includePatterns = new ArrayList<>(List.of("*.py", "*.java", "*.js", "*.ts", "*.md", "*.txt"));
        private Set<String> excludedDirectories = new LinkedHashSet<>(List.of(".git", "__pycache__", "node_modules", ".venv", "venv"));
        private List<String> excludedFiles = new ArrayList<>(List.of("*.pyc", "*.pyo", "*.log", "*.tmp", "*.swp", "*~"));
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private Duration debounce = Duration.ofSeconds(2);
        private int batchSize = 10;
        private int maxQueueSize = 1000;
        private Duration statsInterval = Duration.ofSeconds(60);
        private Duration pollInterval = Duration.ofSeconds(2);
        private boolean pollingFallback = true;

        private Builder(final Path root) {
            this.root = root;
        }

        public Builder enabled(final boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder autoStart(final boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        public Builder includePatterns(final List<String> includePatterns) {
            this.includePatterns = new ArrayList<>(includePatterns);
            return this;
        }

        public Builder excludedDirectories(final Set<String> excludedDirectories) {
            this.excludedDirectories = new LinkedHashSet<>(excludedDirectories);
            return this;
        }

        public Builder excludedFiles(final List<String> excludedFiles) {
            this.excludedFiles = new ArrayList<>(excludedFiles);
            return this;
        }

        public Builder maxFileSizeBytes(final long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
            return this;
        }

        public Builder debounce(final Duration debounce) {
            this.debounce = debounce;
            return this;
        }

        public Builder batchSize(final int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxQueueSize(final int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder statsInterval(final Duration statsInterval) {
            this.statsInterval = statsInterval;
            return this;
        }

        public Builder pollInterval(final Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder pollingFallback(final boolean pollingFallback) {
            this.pollingFallback = pollingFallback;
            return this;
        }

        public WatchConfig build() {
            return new WatchConfig(root, enabled, autoStart, includePatterns, excludedDirectories, excludedFiles,
                    maxFileSizeBytes, debounce, batchSize, maxQueueSize, statsInterval, pollInterval, pollingFallback);
        }
    }
}
