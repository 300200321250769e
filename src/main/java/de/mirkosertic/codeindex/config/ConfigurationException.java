package de.mirkosertic.codeindex.config;

import java.util.List;

/**
 * Raised when the loaded configuration fails validation. Carries every problem found,
 * not just the first one.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(final List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
