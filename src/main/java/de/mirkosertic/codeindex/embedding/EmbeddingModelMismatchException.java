package de.mirkosertic.codeindex.embedding;

/**
 * The vector store was built with a different embedding model than the one configured now.
 * Vectors from different models are not comparable, so this is a configuration error.
 */
public class EmbeddingModelMismatchException extends RuntimeException {

    private final String storeModel;
    private final String backendModel;

    public EmbeddingModelMismatchException(final String storeModel, final String backendModel) {
        super("Vector store was built with embedding model '" + storeModel
                + "' but the configured backend uses '" + backendModel + "'; run a forced bulk index to rebuild");
        this.storeModel = storeModel;
        this.backendModel = backendModel;
    }

    public String getStoreModel() {
        return storeModel;
    }

    public String getBackendModel() {
        return backendModel;
    }
}
