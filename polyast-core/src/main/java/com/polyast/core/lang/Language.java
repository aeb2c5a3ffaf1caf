package com.polyast.core.lang;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages with a normalizer to the generic AST.
 *
 * @since 1.0.0
 */
public enum Language {

    JAVA("java", List.of(".java")),
    JAVASCRIPT("javascript", List.of(".js", ".mjs", ".cjs", ".jsx")),
    PYTHON("python", List.of(".py", ".pyi"));

    private final String id;
    private final List<String> extensions;

    Language(String id, List<String> extensions) {
        this.id = id;
        this.extensions = extensions;
    }

    /**
     * Lowercase identifier used in configuration files and on the command line.
     */
    public String id() {
        return id;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Classifies a file by its extension.
     *
     * @param filename file name or path
     * @return language of the file, empty when the extension is unknown
     */
    public static Optional<Language> ofFilename(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(language -> language.extensions.stream().anyMatch(lower::endsWith))
            .findFirst();
    }

    /**
     * Looks a language up by its {@link #id()}, ignoring case.
     */
    public static Optional<Language> ofId(String id) {
        return Arrays.stream(values())
            .filter(language -> language.id.equalsIgnoreCase(id))
            .findFirst();
    }
}
