package de.mirkosertic.codeindex;

import de.mirkosertic.codeindex.bulk.BulkProgress;
import de.mirkosertic.codeindex.bulk.BulkStartResult;
import de.mirkosertic.codeindex.bulk.BulkStatus;
import de.mirkosertic.codeindex.config.ApplicationConfig;
import de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException;
import de.mirkosertic.codeindex.ingest.BatchResult;
import de.mirkosertic.codeindex.query.SearchResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CodeIndexService Integration Tests")
class CodeIndexServiceIntegrationTest {

    @TempDir
    Path root;

    @TempDir
    Path dataDir;

    private CodeIndexService service;

    @BeforeEach
    void setUp() throws IOException {
        write("src/config_loader.py", "parse configuration file settings from disk");
        write("src/renderer.py", "render html template page output");
        write("README.md", "project overview documentation");
        write("build.log", "parse configuration file settings");
        service = CodeIndexService.create(config(256));
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private ApplicationConfig config(final int dimension) {
        final String yaml = "codeindex:\n"
                + "  watch:\n"
                + "    root: \"" + slashes(root) + "\"\n"
                + "  index:\n"
                + "    path: \"" + slashes(dataDir.resolve("index")) + "\"\n"
                + "    commit-interval-seconds: 0\n"
                + "  embedding:\n"
                + "    provider: hashing\n"
                + "    dimension: " + dimension + "\n"
                + "  chunking:\n"
                + "    max-tokens: 64\n"
                + "    min-tokens: 8\n"
                + "  bulk:\n"
                + "    batch-size: 2\n"
                + "    state-file: \"" + slashes(dataDir.resolve("bulk-state.yaml")) + "\"\n";
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml);
        config.requireValid();
        return config;
    }

    private static String slashes(final Path path) {
        return path.toString().replace('\\', '/');
    }

    private Path write(final String relative, final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private BulkProgress runBulk(final boolean force) throws Exception {
        final BulkStartResult result = service.startBulkIndex(force);
        assertThat(result.isStarted()).isTrue();
        assertThat(service.getBulkIndexer().awaitCompletion(Duration.ofSeconds(30))).isTrue();
        return service.getBulkProgress();
    }

    @Test
    @DisplayName("Should bulk index the tree and answer queries against it")
    void shouldIndexAndSearch() throws Exception {
        // Given
        final BulkProgress progress = runBulk(false);

        // When
        final SearchResponse response = service.search("parse configuration settings", 3, 0.0);

        // Then
        assertThat(progress.status()).isEqualTo(BulkStatus.COMPLETED);
        assertThat(progress.totalFiles()).isEqualTo(3);
        assertThat(progress.processedFiles()).isEqualTo(3);
        assertThat(response.hits()).isNotEmpty();
        assertThat(response.hits().get(0).documentId()).isEqualTo("src/config_loader.py");
        assertThat(response.hits()).extracting(hit -> hit.documentId()).doesNotContain("build.log");
    }

    @Test
    @DisplayName("Should skip a second initial run once the store is populated")
    void shouldSkipWhenPopulated() throws Exception {
        runBulk(false);

        final BulkStartResult second = service.startBulkIndex(false);

        assertThat(second.outcome()).isEqualTo(BulkStartResult.Outcome.SKIPPED);
        assertThat(second.reason()).contains("3 documents");
    }

    @Test
    @DisplayName("A forced run should rebuild the populated store")
    void forcedRunShouldRebuild() throws Exception {
        runBulk(false);
        Files.delete(root.resolve("README.md"));

        final BulkProgress progress = runBulk(true);

        assertThat(progress.processedFiles()).isEqualTo(2);
        assertThat(service.getStats().store().documentCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report statistics across all components")
    void shouldReportStatistics() throws Exception {
        // Given
        runBulk(false);
        service.search("render template", 5, 0.5);
        service.search("render template", 5, 0.5);

        // When
        final IndexingStatus status = service.getStats();

        // Then
        assertThat(status.store().documentCount()).isEqualTo(3);
        assertThat(status.store().chunkCount()).isGreaterThanOrEqualTo(3);
        assertThat(status.embeddingModel()).isEqualTo("hashing-256");
        assertThat(status.storeEmbeddingModel()).isEqualTo("hashing-256");
        assertThat(status.bulk().status()).isEqualTo(BulkStatus.COMPLETED);
        assertThat(status.indexing().filesIndexed()).isEqualTo(3);
        assertThat(status.queryCacheHits()).isEqualTo(1);
        assertThat(status.queryCacheMisses()).isEqualTo(1);
    }

    @Test
    @DisplayName("A manual reindex should pick up edited content")
    void manualReindexShouldPickUpEdits() throws Exception {
        runBulk(false);
        final Path file = write("README.md", "deployment pipeline instructions");

        final BatchResult result = service.reindex(file);
        final SearchResponse response = service.search("deployment pipeline instructions", 1, 0.9);

        assertThat(result.documentsIndexed()).isEqualTo(1);
        assertThat(response.hits()).singleElement().satisfies(hit -> assertThat(hit.documentId()).isEqualTo("README.md"));
    }

    @Test
    @DisplayName("Reopening the store with another embedding model should be refused")
    void shouldDetectModelChangeAfterRestart() throws Exception {
        // Given
        runBulk(false);
        service.close();

        // When
        service = CodeIndexService.create(config(128));

        // Then
        assertThatThrownBy(() -> service.verifyEmbeddingModel())
                .isInstanceOf(EmbeddingModelMismatchException.class)
                .hasMessageContaining("hashing-256")
                .hasMessageContaining("hashing-128");
        assertThatThrownBy(() -> service.search("anything", 3, 0.0))
                .isInstanceOf(EmbeddingModelMismatchException.class);
    }
}
