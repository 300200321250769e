package de.mirkosertic.codeindex.watch;

public enum ChangeKind {
    CREATED,
    MODIFIED,
    DELETED
}
