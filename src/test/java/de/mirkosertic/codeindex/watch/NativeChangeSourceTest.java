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

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * Exercises the platform watch service against a real temporary directory.
 */
@DisplayName("NativeChangeSource Tests")
class NativeChangeSourceTest {

    @TempDir
    Path root;

    private FileChangeListener listener;
    private NativeChangeSource source;

    @BeforeEach
    void setUp() throws IOException {
        listener = mock(FileChangeListener.class);
        source = new NativeChangeSource(Duration.ofMillis(100), dir -> true);
        source.subscribe(root, listener);
    }

    @AfterEach
    void tearDown() {
        source.close();
    }

    @Test
    @DisplayName("Should report created and deleted files")
    void shouldReportCreateAndDelete() throws IOException {
        final Path file = Files.writeString(root.resolve("app.py"), "print(1)");
        verify(listener, timeout(10000).atLeastOnce()).onFileCreated(file);

        Files.delete(file);
        verify(listener, timeout(10000)).onFileDeleted(file);
    }

    @Test
    @DisplayName("Should watch directories created after subscribing")
    void shouldRegisterNewDirectories() throws IOException {
        final Path directory = Files.createDirectories(root.resolve("pkg"));
        final Path file = Files.writeString(directory.resolve("mod.py"), "x = 1");

        // Either announced while registering the directory or reported by its new watch key
        verify(listener, timeout(10000).atLeastOnce()).onFileCreated(file);
    }

    @Test
    @DisplayName("Should reject a second subscription")
    void shouldRejectSecondSubscription() {
        assertThatThrownBy(() -> source.subscribe(root, listener))
                .isInstanceOf(IllegalStateException.class);
    }
}
