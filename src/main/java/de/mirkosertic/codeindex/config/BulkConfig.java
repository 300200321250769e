package de.mirkosertic.codeindex.config;

import java.nio.file.Path;

public record BulkConfig(boolean enabled, int batchSize, Path stateFile) {
}
