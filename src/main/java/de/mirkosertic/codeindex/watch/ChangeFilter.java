package de.mirkosertic.codeindex.watch;

import de.mirkosertic.codeindex.config.WatchConfig;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Set;

/**
 * Decides which paths below the watch root take part in indexing.
 * <p>
 * Evaluation order: excluded directory segment, excluded file glob, include glob, size limit.
 * Globs are matched against the file name, or against the root-relative path when the
 * pattern contains a '/'.
 */
public class ChangeFilter {

    private final Path root;
    private final Set<String> excludedDirectories;
    private final List<Glob> excludedFiles;
    private final List<Glob> includes;
    private final long maxFileSizeBytes;

    public ChangeFilter(final WatchConfig config) {
        this.root = config.root();
        this.excludedDirectories = config.excludedDirectories();
        this.excludedFiles = config.excludedFiles().stream().map(Glob::new).toList();
        this.includes = config.includePatterns().stream().map(Glob::new).toList();
        this.maxFileSizeBytes = config.maxFileSizeBytes();
    }

    /**
     * Pattern checks only, no file system access.
     */
    public boolean shouldWatch(final Path path) {
        if (isExcluded(path)) {
            return false;
        }
        final Path relative = relativize(path);
        for (final Glob include : includes) {
            if (include.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@link #shouldWatch(Path)} plus: the file exists, is a regular file and fits the size limit.
     */
    public boolean shouldInclude(final Path path) {
        if (!shouldWatch(path)) {
            return false;
        }
        try {
            if (!Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
                return false;
            }
            return Files.size(path) <= maxFileSizeBytes;
        } catch (final IOException e) {
            // Vanished between the check and the size lookup
            return false;
        }
    }

    /**
     * True if the path lies in an excluded directory or matches an excluded file glob.
     * Used for deletions, where the path no longer exists and may have been a directory.
     */
    public boolean isExcluded(final Path path) {
        final Path relative = relativize(path);
        for (final Path segment : relative) {
            if (excludedDirectories.contains(segment.toString())) {
                return true;
            }
        }
        for (final Glob excluded : excludedFiles) {
            if (excluded.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a directory should be descended into during crawling or watch registration.
     */
    public boolean shouldDescend(final Path directory) {
        final Path relative = relativize(directory);
        for (final Path segment : relative) {
            if (excludedDirectories.contains(segment.toString())) {
                return false;
            }
        }
        return true;
    }

    public Path getRoot() {
        return root;
    }

    private Path relativize(final Path path) {
        final Path normalized = path.toAbsolutePath().normalize();
        if (normalized.startsWith(root)) {
            return root.relativize(normalized);
        }
        return normalized;
    }

    private static final class Glob {

        private final PathMatcher matcher;
        private final boolean matchFullPath;

        Glob(final String pattern) {
            this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            this.matchFullPath = pattern.contains("/");
        }

        boolean matches(final Path relative) {
            if (matchFullPath) {
                return matcher.matches(relative);
            }
            final Path fileName = relative.getFileName();
            return fileName != null && matcher.matches(fileName);
        }
    }
}
