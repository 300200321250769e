package de.mirkosertic.codeindex.bulk;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists the {@link BulkState} of the last bulk run as YAML.
 */
public class BulkStateStore {

    private static final Logger logger = LoggerFactory.getLogger(BulkStateStore.class);

    private final Path statePath;
    private final Yaml yaml;

    public BulkStateStore(final Path statePath) {
        this.statePath = statePath;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * @return the last saved state, or {@code null} if the file does not exist or cannot be parsed
     */
    public synchronized @Nullable BulkState load() {
        if (!Files.exists(statePath)) {
            logger.debug("Bulk state file does not exist: {}", statePath);
            return null;
        }

        try (final Reader reader = Files.newBufferedReader(statePath)) {
            final Map<String, Object> stateMap = yaml.load(reader);
            if (stateMap == null) {
                logger.debug("Bulk state file is empty: {}", statePath);
                return null;
            }

            final BulkState state = new BulkState(
                    BulkStatus.valueOf((String) stateMap.getOrDefault("status", BulkStatus.IDLE.name())),
                    (Boolean) stateMap.getOrDefault("stopped", Boolean.FALSE),
                    ((Number) stateMap.getOrDefault("startedAtMs", 0L)).longValue(),
                    ((Number) stateMap.getOrDefault("updatedAtMs", 0L)).longValue(),
                    ((Number) stateMap.getOrDefault("totalFiles", 0)).intValue(),
                    ((Number) stateMap.getOrDefault("processedFiles", 0)).intValue(),
                    ((Number) stateMap.getOrDefault("failedFiles", 0)).intValue());
            logger.debug("Loaded bulk state {} from {}", state, statePath);
            return state;
        } catch (final IOException e) {
            logger.error("Failed to load bulk state file: {}", statePath, e);
            return null;
        } catch (final ClassCastException | IllegalArgumentException e) {
            logger.error("Invalid bulk state structure in: {}", statePath, e);
            return null;
        }
    }

    public synchronized void save(final BulkState state) throws IOException {
        final Path parent = statePath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }

        final Map<String, Object> stateMap = new LinkedHashMap<>();
        stateMap.put("status", state.status().name());
        stateMap.put("stopped", state.stopped());
        stateMap.put("startedAtMs", state.startedAtMs());
        stateMap.put("updatedAtMs", state.updatedAtMs());
        stateMap.put("totalFiles", state.totalFiles());
        stateMap.put("processedFiles", state.processedFiles());
        stateMap.put("failedFiles", state.failedFiles());

        try (final Writer writer = Files.newBufferedWriter(statePath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(stateMap, writer);
        }
    }

    public Path getStatePath() {
        return statePath;
    }
}
