package de.mirkosertic.codeindex.document;

import java.nio.file.Path;
import java.util.Map;

/**
 * Normalized content of one file for a single indexing pass.
 *
 * @param id          root-relative path, see {@link DocumentIdResolver}
 * @param contentHash SHA-256 of the decoded content, hex encoded
 */
public record SourceDocument(
        String id,
        Path absolutePath,
        String content,
        String language,
        String fileType,
        long size,
        int lineCount,
        String contentHash,
        Map<String, String> metadata
) {

    public SourceDocument {
        metadata = Map.copyOf(metadata);
    }
}
