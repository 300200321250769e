package de.mirkosertic.codeindex.store;

import de.mirkosertic.codeindex.document.Chunk;
import de.mirkosertic.codeindex.document.SourceDocument;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * A chunk together with its embedding, as persisted in the vector store.
 * <p>
 * {@code contentHash} is null for the chunks of a document that was stored incompletely, so the
 * document is not mistaken for an unchanged one on its next change or bulk run.
 */
public record StoredChunk(
        String chunkId,
        String documentId,
        int chunkIndex,
        String sourcePath,
        String text,
        float[] vector,
        @Nullable String contentHash,
        Map<String, String> metadata
) {

    public StoredChunk {
        metadata = Map.copyOf(metadata);
    }

    public static StoredChunk of(final SourceDocument document, final Chunk chunk, final float[] vector) {
        return new StoredChunk(
                chunk.chunkId(),
                document.id(),
                chunk.index(),
                document.absolutePath().toString(),
                chunk.text(),
                vector,
                document.contentHash(),
                chunk.metadata());
    }

    public StoredChunk withoutContentHash() {
        return new StoredChunk(chunkId, documentId, chunkIndex, sourcePath, text, vector, null, metadata);
    }
}
