package de.mirkosertic.codeindex.watch;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A change waiting out its debounce window. {@code lastSeen} moves forward with every new event
 * for the same path, {@code firstSeen} stays at the first one.
 */
public record PendingChange(Path path, ChangeKind kind, Instant firstSeen, Instant lastSeen) {

    public static PendingChange first(final Path path, final ChangeKind kind, final Instant now) {
        return new PendingChange(path, kind, now, now);
    }

    public PendingChange refresh(final ChangeKind newKind, final Instant now) {
        // A create followed by modifications is still a create
        final ChangeKind merged = kind == ChangeKind.CREATED ? ChangeKind.CREATED : newKind;
        return new PendingChange(path, merged, firstSeen, now);
    }
}
