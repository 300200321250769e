package de.mirkosertic.codeindex.document;

import de.mirkosertic.codeindex.watch.ChangeFilter;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a file and turns it into a {@link SourceDocument}.
 * <p>
 * Inclusion is checked again because the file may have vanished or grown since it was queued.
 * Content is decoded as UTF-8 with undecodable bytes dropped. Empty files yield no document.
 */
public class DocumentBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DocumentBuilder.class);

    private final ChangeFilter filter;
    private final DocumentIdResolver idResolver;
    private final Clock clock;
    private final Tika tika = new Tika();

    public DocumentBuilder(final ChangeFilter filter, final DocumentIdResolver idResolver, final Clock clock) {
        this.filter = filter;
        this.idResolver = idResolver;
        this.clock = clock;
    }

    public Optional<SourceDocument> build(final Path path) {
        if (!filter.shouldInclude(path)) {
            logger.debug("Skipping {}: no longer eligible", path);
            return Optional.empty();
        }

        final byte[] bytes;
        final Instant modifiedAt;
        try {
            bytes = Files.readAllBytes(path);
            modifiedAt = Files.getLastModifiedTime(path).toInstant();
        } catch (final NoSuchFileException e) {
            logger.debug("Skipping {}: vanished before it could be read", path);
            return Optional.empty();
        } catch (final IOException e) {
            logger.warn("Skipping {}: {}", path, e.getMessage());
            return Optional.empty();
        }

        final String content = decode(bytes);
        if (content.isBlank()) {
            logger.debug("Skipping {}: empty content", path);
            return Optional.empty();
        }

        final String id = idResolver.documentId(path);
        final String fileType = LanguageDetector.fileType(path);
        final String language = LanguageDetector.language(path);
        final Path parent = idResolver.resolve(id).getParent();

        final Map<String, String> metadata = new HashMap<>();
        metadata.put("file_name", path.getFileName().toString());
        metadata.put("file_extension", LanguageDetector.extension(path));
        metadata.put("file_type", fileType);
        metadata.put("language", language);
        metadata.put("mime_type", tika.detect(path.getFileName().toString()));
        metadata.put("size", Long.toString(bytes.length));
        metadata.put("parent_directory", parent != null ? idResolver.documentId(parent) : "");
        metadata.put("modified_at", modifiedAt.toString());
        metadata.put("indexed_at", clock.instant().toString());

        return Optional.of(new SourceDocument(
                id,
                path.toAbsolutePath().normalize(),
                content,
                language,
                fileType,
                bytes.length,
                countLines(content),
                sha256(content),
                metadata));
    }

    static String decode(final byte[] bytes) {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString().replace("\u0000", "");
        } catch (final CharacterCodingException e) {
            // Unreachable with IGNORE, kept for the checked signature
            return new String(bytes, StandardCharsets.UTF_8).replace("\u0000", "");
        }
    }

    static int countLines(final String content) {
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i < content.length() - 1) {
                lines++;
            }
        }
        return lines;
    }

    static String sha256(final String content) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
