package de.mirkosertic.codeindex.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("PollingChangeSource Tests")
class PollingChangeSourceTest {

    @TempDir
    Path root;

    private FileChangeListener listener;
    private PollingChangeSource source;

    @BeforeEach
    void setUp() {
        listener = mock(FileChangeListener.class);
        source = new PollingChangeSource(Duration.ofMillis(50), dir -> !dir.getFileName().toString().equals("skipped"));
    }

    @AfterEach
    void tearDown() {
        source.close();
    }

    @Test
    @DisplayName("Should report created, modified and deleted files between scans")
    void shouldDiffSnapshots() throws IOException {
        final Path file = Files.writeString(root.resolve("app.py"), "v1");

        // First scan against an empty snapshot sees a creation
        source.poll(root, listener);
        verify(listener).onFileCreated(file);

        clearInvocations(listener);
        Files.writeString(file, "version two");
        source.poll(root, listener);
        verify(listener).onFileModified(file);

        clearInvocations(listener);
        Files.delete(file);
        source.poll(root, listener);
        verify(listener).onFileDeleted(file);
    }

    @Test
    @DisplayName("Should not report anything when nothing changed")
    void shouldStayQuietWithoutChanges() throws IOException {
        Files.writeString(root.resolve("app.py"), "v1");
        source.poll(root, listener);
        clearInvocations(listener);

        source.poll(root, listener);

        verify(listener, never()).onFileCreated(any());
        verify(listener, never()).onFileModified(any());
        verify(listener, never()).onFileDeleted(any());
    }

    @Test
    @DisplayName("Should skip directories rejected by the directory filter")
    void shouldSkipFilteredDirectories() throws IOException {
        Files.createDirectories(root.resolve("skipped"));
        Files.writeString(root.resolve("skipped/hidden.py"), "x");

        source.poll(root, listener);

        verify(listener, never()).onFileCreated(any());
    }

    @Test
    @DisplayName("A subscribed source should pick up new files on its own")
    void subscribedSourceShouldPoll() throws IOException {
        source.subscribe(root, listener);

        final Path file = Files.writeString(root.resolve("new.py"), "x");

        verify(listener, timeout(2000)).onFileCreated(file);
    }
}
