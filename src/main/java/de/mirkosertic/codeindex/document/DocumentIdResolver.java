package de.mirkosertic.codeindex.document;

import java.nio.file.Path;

/**
 * Document ids are root-relative paths with '/' separators, so they survive moving the whole tree.
 * Paths outside the root keep their absolute form.
 */
public class DocumentIdResolver {

    private final Path root;

    public DocumentIdResolver(final Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public String documentId(final Path path) {
        final Path normalized = path.toAbsolutePath().normalize();
        final Path relative = normalized.startsWith(root) ? root.relativize(normalized) : normalized;
        return relative.toString().replace('\\', '/');
    }

    public Path resolve(final String documentId) {
        return root.resolve(documentId).normalize();
    }

    public Path getRoot() {
        return root;
    }
}
