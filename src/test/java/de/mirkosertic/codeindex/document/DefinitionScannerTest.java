package de.mirkosertic.codeindex.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("DefinitionScanner Tests")
class DefinitionScannerTest {

    @Test
    @DisplayName("Should find Java types, constructors and methods")
    void shouldScanJava() {
        final String content = """
                package demo;

                public final class Greeter {

                    private final String name;

                    public Greeter(final String name) {
                        this.name = name;
                    }

                    public String greet(final String other) {
                        return "Hello " + other;
                    }

                    static <T> List<T> copy(final List<T> items) {
                        return items;
                    }
                }
                """;

        final List<DefinitionScanner.Definition> definitions = DefinitionScanner.scan(content, "java");

        assertThat(definitions)
                .extracting(DefinitionScanner.Definition::type, DefinitionScanner.Definition::name)
                .containsExactly(
                        tuple("class", "Greeter"),
                        tuple("function", "Greeter"),
                        tuple("function", "greet"),
                        tuple("function", "copy"));
        assertThat(content.substring(definitions.get(2).offset())).startsWith("public String greet");
    }

    @Test
    @DisplayName("Should find JavaScript functions, classes and arrow functions")
    void shouldScanJavaScript() {
        final String content = """
                import x from "y";

                export async function load(path) {
                  return path;
                }

                export default class Store {
                }

                const add = (a, b) => a + b;
                let run = async () => { };
                """;

        assertThat(DefinitionScanner.scan(content, "javascript"))
                .extracting(DefinitionScanner.Definition::type, DefinitionScanner.Definition::name)
                .containsExactly(
                        tuple("function", "load"),
                        tuple("class", "Store"),
                        tuple("function", "add"),
                        tuple("function", "run"));
    }

    @Test
    @DisplayName("Should find C++ structs and function bodies but not declarations")
    void shouldScanCpp() {
        final String content = """
                #include <vector>

                struct Point {
                  int x;
                };

                int add(int a, int b) {
                  return a + b;
                }

                static const char* name(void) {
                  return "x";
                }

                int declared(int a);
                """;

        assertThat(DefinitionScanner.scan(content, "cpp"))
                .extracting(DefinitionScanner.Definition::type, DefinitionScanner.Definition::name)
                .containsExactly(
                        tuple("class", "Point"),
                        tuple("function", "add"),
                        tuple("function", "name"));
    }

    @Test
    @DisplayName("Should find indented Python methods")
    void shouldScanPython() {
        final String content = "class Repo:\n    async def fetch(self):\n        pass\n";

        final List<DefinitionScanner.Definition> definitions = DefinitionScanner.scan(content, "python");

        assertThat(definitions)
                .extracting(DefinitionScanner.Definition::type, DefinitionScanner.Definition::name)
                .containsExactly(tuple("class", "Repo"), tuple("function", "fetch"));
        assertThat(definitions.get(1).offset()).isEqualTo(content.indexOf("async"));
    }

    @Test
    @DisplayName("Should find nothing for languages without definition rules")
    void shouldIgnoreUnknownLanguages() {
        assertThat(DefinitionScanner.scan("def alpha(x):\n  pass", "markdown")).isEmpty();
        assertThat(DefinitionScanner.scan("", "java")).isEmpty();
    }
}
