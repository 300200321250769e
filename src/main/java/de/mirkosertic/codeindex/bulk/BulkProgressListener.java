package de.mirkosertic.codeindex.bulk;

@FunctionalInterface
public interface BulkProgressListener {

    void onProgress(BulkProgress progress);
}
