package de.mirkosertic.codeindex.embedding;

import java.util.ArrayList;
import java.util.List;

public interface EmbeddingBackend {

    /**
     * @throws EmbeddingException classified as transient or fatal
     */
    float[] embed(String text);

    /**
     * Vectors in input order. The default embeds one text at a time.
     */
    default List<float[]> embedBatch(final List<String> texts) {
        final List<float[]> vectors = new ArrayList<>(texts.size());
        for (final String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Identifies the model; vectors are only comparable between equal model ids.
     */
    String modelId();

    int dimension();
}
