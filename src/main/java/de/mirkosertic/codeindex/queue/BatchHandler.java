package de.mirkosertic.codeindex.queue;

import java.nio.file.Path;
import java.util.List;

@FunctionalInterface
public interface BatchHandler {

    void handle(List<Path> batch, int batchNumber);
}
