package de.mirkosertic.codeindex.bulk;

/**
 * A file that could not be indexed during a bulk run.
 */
public record BulkError(String file, String error, int batch) {
}
