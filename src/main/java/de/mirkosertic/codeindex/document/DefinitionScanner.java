package de.mirkosertic.codeindex.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line based detection of function and class definitions, used by the {@link Chunker} to place
 * chunk boundaries at the start of a definition. Languages without patterns yield no definitions.
 */
final class DefinitionScanner {

    static final String FUNCTION = "function";
    static final String CLASS = "class";

    /**
     * A definition starting at {@code offset}, the first non-blank character of its line.
     */
    record Definition(int offset, String type, String name) {
    }

    private record Rule(Pattern pattern, String type) {

        static Rule of(final String regex, final String type) {
            return new Rule(Pattern.compile(regex, Pattern.MULTILINE), type);
        }
    }

    private static final List<Rule> SCRIPT_RULES = List.of(
            Rule.of("^[ \\t]*(?:export[ \\t]+)?(?:default[ \\t]+)?(?:async[ \\t]+)?function\\*?[ \\t]+(\\w+)", FUNCTION),
            Rule.of("^[ \\t]*(?:export[ \\t]+)?(?:default[ \\t]+)?(?:abstract[ \\t]+)?class[ \\t]+(\\w+)", CLASS),
            Rule.of("^[ \\t]*(?:export[ \\t]+)?(?:const|let|var)[ \\t]+(\\w+)[ \\t]*=[ \\t]*(?:async[ \\t]*)?\\([^)\\n]*\\)[ \\t]*=>",
                    FUNCTION));

    private static final Map<String, List<Rule>> RULES = Map.of(
            "python", List.of(
                    Rule.of("^[ \\t]*(?:async[ \\t]+)?def[ \\t]+(\\w+)[ \\t]*\\(", FUNCTION),
                    Rule.of("^[ \\t]*class[ \\t]+(\\w+)", CLASS)),
            "javascript", SCRIPT_RULES,
            "typescript", SCRIPT_RULES,
            "java", List.of(
                    Rule.of("^[ \\t]*(?:(?:public|protected|private|static|final|abstract|sealed)[ \\t]+)*"
                            + "(?:class|interface|enum|record)[ \\t]+(\\w+)", CLASS),
                    Rule.of("^[ \\t]*(?:(?:public|protected|private|static|final|abstract|synchronized|default)[ \\t]+)+"
                            + "(?:<[^>\\n]*>[ \\t]+)?(?:[\\w.<>\\[\\], ?]+?[ \\t]+)?(\\w+)[ \\t]*\\(", FUNCTION)),
            "cpp", List.of(
                    Rule.of("^[ \\t]*(?:class|struct)[ \\t]+(\\w+)", CLASS),
                    Rule.of("^(?:[\\w:*&<>]+[ \\t]+)+[*&]?(\\w+)[ \\t]*\\([^;{)]*\\)[ \\t]*(?:const[ \\t]*)?\\{", FUNCTION)));

    private DefinitionScanner() {
    }

    /**
     * @return definitions ordered by offset, at most one per line
     */
    static List<Definition> scan(final String content, final String language) {
        final List<Rule> rules = RULES.get(language);
        if (rules == null) {
            return List.of();
        }
        final List<Definition> found = new ArrayList<>();
        for (final Rule rule : rules) {
            final Matcher matcher = rule.pattern().matcher(content);
            while (matcher.find()) {
                int offset = matcher.start();
                while (Character.isWhitespace(content.charAt(offset))) {
                    offset++;
                }
                found.add(new Definition(offset, rule.type(), matcher.group(1)));
            }
        }
        found.sort(Comparator.comparingInt(Definition::offset));

        final List<Definition> definitions = new ArrayList<>(found.size());
        for (final Definition definition : found) {
            if (definitions.isEmpty() || definitions.get(definitions.size() - 1).offset() != definition.offset()) {
                definitions.add(definition);
            }
        }
        return definitions;
    }
}
