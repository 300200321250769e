package de.mirkosertic.codeindex.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LanguageDetector Tests")
class LanguageDetectorTest {

    @Test
    @DisplayName("Should classify by extension, case insensitive")
    void shouldClassifyByExtension() {
        assertThat(LanguageDetector.fileType(Path.of("src/Main.JAVA"))).isEqualTo("java");
        assertThat(LanguageDetector.language(Path.of("src/Main.java"))).isEqualTo("java");
        assertThat(LanguageDetector.fileType(Path.of("lib/util.h"))).isEqualTo("cpp");
        assertThat(LanguageDetector.fileType(Path.of("ci.yml"))).isEqualTo("yaml");
    }

    @Test
    @DisplayName("Vue components should be vue files in the javascript family")
    void vueShouldCountAsJavascript() {
        final Path component = Path.of("web/App.vue");

        assertThat(LanguageDetector.fileType(component)).isEqualTo("vue");
        assertThat(LanguageDetector.language(component)).isEqualTo("javascript");
    }

    @Test
    @DisplayName("Formats without a language family should be generic")
    void formatsShouldBeGeneric() {
        assertThat(LanguageDetector.fileType(Path.of("config.toml"))).isEqualTo("toml");
        assertThat(LanguageDetector.language(Path.of("config.toml"))).isEqualTo("generic");
    }

    @Test
    @DisplayName("Unknown or missing extensions should fall back to text and generic")
    void unknownExtensionsShouldFallBack() {
        assertThat(LanguageDetector.extension(Path.of("Makefile"))).isEmpty();
        assertThat(LanguageDetector.extension(Path.of(".gitignore"))).isEmpty();
        assertThat(LanguageDetector.extension(Path.of("name."))).isEmpty();
        assertThat(LanguageDetector.fileType(Path.of("data.bin"))).isEqualTo("text");
        assertThat(LanguageDetector.language(Path.of("Makefile"))).isEqualTo("generic");
    }
}
