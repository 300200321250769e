package de.mirkosertic.codeindex.watch;

import de.mirkosertic.codeindex.config.WatchConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChangeFilter Tests")
class ChangeFilterTest {

    @TempDir
    Path root;

    private ChangeFilter filter;

    @BeforeEach
    void setUp() {
        final WatchConfig config = WatchConfig.builder(root)
                .includePatterns(List.of("*.py", "*.md", "docs/*.txt"))
                .excludedDirectories(Set.of(".git", "node_modules"))
                .excludedFiles(List.of("*.pyc", "test_*.py"))
                .maxFileSizeBytes(100)
                .build();
        filter = new ChangeFilter(config);
    }

    private Path write(final String relative, final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Pattern checks")
    class PatternChecks {

        @Test
        @DisplayName("Should watch files matching an include pattern")
        void shouldWatchIncludedFiles() {
            assertThat(filter.shouldWatch(root.resolve("src/app.py"))).isTrue();
            assertThat(filter.shouldWatch(root.resolve("README.md"))).isTrue();
        }

        @Test
        @DisplayName("Should ignore files matching no include pattern")
        void shouldIgnoreNonMatchingFiles() {
            assertThat(filter.shouldWatch(root.resolve("src/App.java"))).isFalse();
            assertThat(filter.shouldWatch(root.resolve("image.png"))).isFalse();
        }

        @Test
        @DisplayName("Should reject files below an excluded directory at any depth")
        void shouldRejectExcludedDirectories() {
            assertThat(filter.shouldWatch(root.resolve("node_modules/pkg/index.py"))).isFalse();
            assertThat(filter.shouldWatch(root.resolve("web/node_modules/lib.py"))).isFalse();
            assertThat(filter.shouldWatch(root.resolve(".git/hooks/pre-commit.py"))).isFalse();
        }

        @Test
        @DisplayName("Excluded file globs should win over include patterns")
        void excludedFilesShouldWinOverIncludes() {
            assertThat(filter.shouldWatch(root.resolve("tests/test_app.py"))).isFalse();
            assertThat(filter.shouldWatch(root.resolve("cache/module.pyc"))).isFalse();
        }

        @Test
        @DisplayName("Patterns with a slash should match the root-relative path")
        void slashPatternsShouldMatchRelativePath() {
            assertThat(filter.shouldWatch(root.resolve("docs/guide.txt"))).isTrue();
            assertThat(filter.shouldWatch(root.resolve("notes.txt"))).isFalse();
        }

        @Test
        @DisplayName("Should not descend into excluded directories")
        void shouldNotDescendIntoExcludedDirectories() {
            assertThat(filter.shouldDescend(root)).isTrue();
            assertThat(filter.shouldDescend(root.resolve("src"))).isTrue();
            assertThat(filter.shouldDescend(root.resolve("node_modules"))).isFalse();
            assertThat(filter.shouldDescend(root.resolve("a/b/.git"))).isFalse();
        }

        @Test
        @DisplayName("Deleted paths inside excluded directories should count as excluded")
        void deletedPathsInExcludedDirectoriesShouldBeExcluded() {
            assertThat(filter.isExcluded(root.resolve("node_modules/gone.py"))).isTrue();
            assertThat(filter.isExcluded(root.resolve("src/gone.py"))).isFalse();
        }
    }

    @Nested
    @DisplayName("File system checks")
    class FileSystemChecks {

        @Test
        @DisplayName("Should include an existing small regular file")
        void shouldIncludeExistingFile() throws IOException {
            final Path file = write("src/app.py", "print('hello')");

            assertThat(filter.shouldInclude(file)).isTrue();
        }

        @Test
        @DisplayName("Should reject files above the size limit")
        void shouldRejectOversizedFiles() throws IOException {
            final Path file = write("src/big.py", "x".repeat(101));

            assertThat(filter.shouldWatch(file)).isTrue();
            assertThat(filter.shouldInclude(file)).isFalse();
        }

        @Test
        @DisplayName("Should reject directories whose name matches an include pattern")
        void shouldRejectDirectories() throws IOException {
            final Path directory = Files.createDirectories(root.resolve("weird.py"));

            assertThat(filter.shouldInclude(directory)).isFalse();
        }

        @Test
        @DisplayName("Should reject files that do not exist")
        void shouldRejectMissingFiles() {
            assertThat(filter.shouldInclude(root.resolve("missing.py"))).isFalse();
        }
    }
}
