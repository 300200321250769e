package de.mirkosertic.codeindex.watch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Delivers raw file system changes below a root. Implementations report files only;
 * a rename arrives as a deletion of the old path followed by a creation of the new one.
 */
public interface ChangeSource extends AutoCloseable {

    /**
     * @throws IOException if the underlying notification channel cannot be opened
     */
    void subscribe(Path root, FileChangeListener listener) throws IOException;

    String name();

    /**
     * Stops delivery and joins background threads with a bounded timeout.
     */
    @Override
    void close();
}
