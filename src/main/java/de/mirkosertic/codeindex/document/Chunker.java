package de.mirkosertic.codeindex.document;

import de.mirkosertic.codeindex.config.ChunkingConfig;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits document content into overlapping chunks of at most {@code maxTokens} estimated tokens.
 * <p>
 * Tokens are estimated as 1.3 per whitespace separated word. Chunks are word windows; in source
 * files a window that does not reach the end of the content is cut before the last function or
 * class definition it contains, provided the chunk keeps {@code minTokens}, and the next chunk
 * starts at that definition. Other consecutive chunks share roughly
 * {@code overlapRatio * maxTokens} tokens; inside that overlap window the next chunk starts at a
 * definition, sentence or paragraph boundary if there is one. A trailing chunk below
 * {@code minTokens} is merged with the end of its predecessor: it takes the predecessor's last
 * words until it reaches {@code minTokens}, so no chunk grows beyond {@code maxTokens}.
 * <p>
 * Every chunk carries {@code chunk_type} ({@code function}, {@code class} or {@code generic}) and,
 * for definitions, {@code symbol_name}: the first definition starting inside the chunk, or else
 * the nearest one before it.
 */
public class Chunker {

    static final double TOKENS_PER_WORD = 1.3;
    private static final Pattern WORD = Pattern.compile("\\S+");

    static final String GENERIC = "generic";

    private final int maxWords;
    private final int overlapWords;
    private final int minTokens;
    private final int minWords;

    public Chunker(final ChunkingConfig config) {
        this.maxWords = Math.max(1, (int) Math.floor(config.maxTokens() / TOKENS_PER_WORD));
        this.overlapWords = Math.min(maxWords - 1, (int) Math.round(config.overlapRatio() * maxWords));
        this.minTokens = config.minTokens();
        this.minWords = Math.min(maxWords, (int) Math.ceil(config.minTokens() / TOKENS_PER_WORD));
    }

    public static int estimateTokens(final String text) {
        int words = 0;
        final Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words++;
        }
        return estimateTokens(words);
    }

    private static int estimateTokens(final int words) {
        return (int) Math.ceil(words * TOKENS_PER_WORD);
    }

    public List<Chunk> chunk(final SourceDocument document) {
        final String content = document.content();
        final List<int[]> words = findWords(content);
        if (words.isEmpty()) {
            return List.of();
        }

        final List<DefinitionScanner.Definition> definitions = DefinitionScanner.scan(content, document.language());
        final NavigableMap<Integer, DefinitionScanner.Definition> definitionStarts = definitionStarts(words, definitions);

        final List<int[]> windows = new ArrayList<>();
        int start = 0;
        while (true) {
            final int fullEnd = Math.min(words.size(), start + maxWords);
            final int end = fullEnd < words.size() ? cutBeforeDefinition(definitionStarts, start, fullEnd) : fullEnd;
            windows.add(new int[]{start, end});
            if (end == words.size()) {
                break;
            }
            // A chunk cut before a definition is followed by that definition, without overlap
            start = end < fullEnd ? end : nextStart(content, words, definitionStarts, start, end);
        }

        absorbSmallTail(windows);

        final int[] lineStarts = lineStarts(content);
        final List<Chunk> chunks = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            final int[] window = windows.get(i);
            final int startOffset = words.get(window[0])[0];
            final int endOffset = words.get(window[1] - 1)[1];

            final Map<String, String> metadata = new HashMap<>(document.metadata());
            metadata.put("chunk_index", Integer.toString(i));
            metadata.put("chunk_count", Integer.toString(windows.size()));
            final DefinitionScanner.@Nullable Definition definition = definitionFor(definitionStarts, window);
            if (definition != null) {
                metadata.put("chunk_type", definition.type());
                metadata.put("symbol_name", definition.name());
            } else {
                metadata.put("chunk_type", GENERIC);
            }

            chunks.add(new Chunk(
                    Chunk.chunkId(document.id(), i),
                    document.id(),
                    i,
                    content.substring(startOffset, endOffset),
                    estimateTokens(window[1] - window[0]),
                    startOffset,
                    endOffset,
                    lineOf(lineStarts, startOffset),
                    lineOf(lineStarts, endOffset - 1),
                    metadata));
        }
        return chunks;
    }

    /**
     * Maps each definition to the index of its first word.
     */
    private static NavigableMap<Integer, DefinitionScanner.Definition> definitionStarts(
            final List<int[]> words, final List<DefinitionScanner.Definition> definitions) {
        final NavigableMap<Integer, DefinitionScanner.Definition> starts = new TreeMap<>();
        int wordIndex = 0;
        for (final DefinitionScanner.Definition definition : definitions) {
            while (wordIndex < words.size() && words.get(wordIndex)[0] < definition.offset()) {
                wordIndex++;
            }
            if (wordIndex == words.size()) {
                break;
            }
            starts.putIfAbsent(wordIndex, definition);
        }
        return starts;
    }

    private int cutBeforeDefinition(final NavigableMap<Integer, DefinitionScanner.Definition> definitionStarts,
                                    final int start, final int end) {
        final Integer cut = definitionStarts.lowerKey(end);
        if (cut != null && cut - start >= Math.max(1, minWords)) {
            return cut;
        }
        return end;
    }

    private static DefinitionScanner.@Nullable Definition definitionFor(
            final NavigableMap<Integer, DefinitionScanner.Definition> definitionStarts, final int[] window) {
        final Map.Entry<Integer, DefinitionScanner.Definition> inside = definitionStarts.ceilingEntry(window[0]);
        if (inside != null && inside.getKey() < window[1]) {
            return inside.getValue();
        }
        final Map.Entry<Integer, DefinitionScanner.Definition> before = definitionStarts.lowerEntry(window[0]);
        return before != null ? before.getValue() : null;
    }

    /**
     * Start of the chunk after [start, end): the earliest definition, sentence or paragraph
     * boundary inside the trailing overlap window, or the plain overlap position when there is none.
     */
    private int nextStart(final String content, final List<int[]> words,
                          final NavigableMap<Integer, DefinitionScanner.Definition> definitionStarts,
                          final int start, final int end) {
        final int windowStart = Math.max(start + 1, end - overlapWords);
        for (int i = windowStart; i < end; i++) {
            if (definitionStarts.containsKey(i) || isBoundaryBefore(content, words, i)) {
                return i;
            }
        }
        return windowStart;
    }

    private static boolean isBoundaryBefore(final String content, final List<int[]> words, final int wordIndex) {
        final int[] previous = words.get(wordIndex - 1);
        final char last = content.charAt(previous[1] - 1);
        if (last == '.' || last == '!' || last == '?' || last == ';' || last == ':') {
            return true;
        }
        final String gap = content.substring(previous[1], words.get(wordIndex)[0]);
        return gap.indexOf('\n') != gap.lastIndexOf('\n');
    }

    /**
     * A window is only followed by another when the content from its start does not fit into one
     * chunk, so the tail can never be folded into its predecessor whole. It takes the predecessor's
     * last words instead, until it reaches {@code minTokens}.
     */
    private void absorbSmallTail(final List<int[]> windows) {
        if (windows.size() < 2) {
            return;
        }
        final int[] tail = windows.get(windows.size() - 1);
        if (estimateTokens(tail[1] - tail[0]) >= minTokens) {
            return;
        }
        final int[] previous = windows.get(windows.size() - 2);
        tail[0] = Math.max(previous[0] + 1, Math.min(tail[0], tail[1] - minWords));
    }

    private static List<int[]> findWords(final String content) {
        final List<int[]> words = new ArrayList<>();
        final Matcher matcher = WORD.matcher(content);
        while (matcher.find()) {
            words.add(new int[]{matcher.start(), matcher.end()});
        }
        return words;
    }

    private static int[] lineStarts(final String content) {
        final List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int lineOf(final int[] lineStarts, final int offset) {
        final int pos = Arrays.binarySearch(lineStarts, offset);
        return (pos >= 0 ? pos : -pos - 2) + 1;
    }
}
