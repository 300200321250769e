package de.mirkosertic.codeindex.ingest;

import de.mirkosertic.codeindex.document.DocumentIdResolver;
import de.mirkosertic.codeindex.store.VectorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RemovalService Tests")
class RemovalServiceTest {

    @TempDir
    Path root;

    private VectorStore store;

    private IndexingStatsTracker stats;
    private RemovalService service;

    @BeforeEach
    void setUp() {
        store = mock(VectorStore.class);
        stats = new IndexingStatsTracker();
        service = new RemovalService(store, new DocumentIdResolver(root), stats);
    }

    @AfterEach
    void tearDown() {
        stats.shutdown();
    }

    @Test
    @DisplayName("Should remove the chunks of a deleted file")
    void shouldRemoveFile() throws IOException {
        when(store.deleteByDocument("src/app.py")).thenReturn(3L);

        assertThat(service.remove(root.resolve("src/app.py"))).isTrue();
        assertThat(stats.getStatistics().filesRemoved()).isEqualTo(1);
    }

    @Test
    @DisplayName("A removal should wait for a document write in progress")
    void removalShouldWaitForWrite() throws Exception {
        // Given: a pipeline write holds the shared lock
        final DocumentWriteLock writeLock = new DocumentWriteLock();
        final RemovalService locked = new RemovalService(store, new DocumentIdResolver(root), stats, writeLock);
        when(store.deleteByDocument("src/app.py")).thenReturn(1L);
        final CompletableFuture<Boolean> removal;
        writeLock.writing().lock();
        try {
            // When
            removal = CompletableFuture.supplyAsync(() -> locked.remove(root.resolve("src/app.py")));

            // Then
            Thread.sleep(200);
            assertThat(removal).isNotDone();
            verify(store, never()).deleteByDocument("src/app.py");
        } finally {
            writeLock.writing().unlock();
        }
        assertThat(removal.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Removing an unknown path should be a no-op")
    void unknownPathShouldBeNoOp() throws IOException {
        when(store.deleteByDocument("gone.py")).thenReturn(0L);
        when(store.documentIds()).thenReturn(Set.of("other.py"));

        assertThat(service.remove(root.resolve("gone.py"))).isFalse();
        assertThat(service.remove(root.resolve("gone.py"))).isFalse();
        assertThat(stats.getStatistics().filesRemoved()).isZero();
        verify(store, never()).deleteByDocument("other.py");
    }

    @Test
    @DisplayName("Removing a directory should remove every document below it")
    void shouldRemoveDirectoryContents() throws IOException {
        // Given
        when(store.deleteByDocument("src")).thenReturn(0L);
        when(store.documentIds()).thenReturn(Set.of("src/a.py", "src/sub/b.py", "srcfile.py"));

        // When
        final boolean removed = service.remove(root.resolve("src"));

        // Then
        assertThat(removed).isTrue();
        verify(store).deleteByDocument("src/a.py");
        verify(store).deleteByDocument("src/sub/b.py");
        verify(store, never()).deleteByDocument("srcfile.py");
        assertThat(stats.getStatistics().filesRemoved()).isEqualTo(2);
    }

    @Test
    @DisplayName("A store failure should be counted, not thrown")
    void storeFailureShouldBeContained() throws IOException {
        when(store.deleteByDocument("src/app.py")).thenThrow(new IOException("disk full"));

        assertThat(service.remove(root.resolve("src/app.py"))).isFalse();
        assertThat(stats.getStatistics().errors()).isEqualTo(1);
    }
}
