package de.mirkosertic.codeindex.ingest;

@FunctionalInterface
public interface IngestProgressListener {

    void onEvent(ProgressEvent event);
}
