package de.mirkosertic.codeindex.watch;

import java.nio.file.Path;

public interface FileChangeListener {

    void onFileCreated(Path file);

    void onFileModified(Path file);

    /**
     * The path is gone. It may have been a file or a directory.
     */
    void onFileDeleted(Path file);
}
