package de.mirkosertic.codeindex.document;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Extension based classification. {@link #fileType(Path)} names the file format, {@link #language(Path)}
 * names the language family used for chunk metadata; .vue components count as javascript there.
 */
public final class LanguageDetector {

    private static final Map<String, String> FILE_TYPES = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("java", "java"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("vue", "vue"),
            Map.entry("c", "cpp"),
            Map.entry("h", "cpp"),
            Map.entry("cc", "cpp"),
            Map.entry("cpp", "cpp"),
            Map.entry("cxx", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("html", "html"),
            Map.entry("css", "css"),
            Map.entry("scss", "css"),
            Map.entry("sass", "css"),
            Map.entry("less", "css"),
            Map.entry("json", "json"),
            Map.entry("yaml", "yaml"),
            Map.entry("yml", "yaml"),
            Map.entry("toml", "toml"),
            Map.entry("xml", "xml"),
            Map.entry("sql", "sql"),
            Map.entry("sh", "shell"),
            Map.entry("bash", "shell"),
            Map.entry("zsh", "shell"),
            Map.entry("fish", "shell"),
            Map.entry("ps1", "powershell"),
            Map.entry("bat", "batch"),
            Map.entry("cmd", "batch"),
            Map.entry("md", "markdown"),
            Map.entry("txt", "text")
    );

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("java", "java"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("vue", "javascript"),
            Map.entry("c", "cpp"),
            Map.entry("h", "cpp"),
            Map.entry("cc", "cpp"),
            Map.entry("cpp", "cpp"),
            Map.entry("cxx", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("md", "markdown")
    );

    private LanguageDetector() {
    }

    public static String extension(final Path path) {
        final Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        final String name = fileName.toString();
        final int lastDot = name.lastIndexOf('.');
        if (lastDot > 0 && lastDot < name.length() - 1) {
            return name.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }

    public static String fileType(final Path path) {
        return FILE_TYPES.getOrDefault(extension(path), "text");
    }

    public static String language(final Path path) {
        return LANGUAGES.getOrDefault(extension(path), "generic");
    }
}
