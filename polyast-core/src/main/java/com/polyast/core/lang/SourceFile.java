package com.polyast.core.lang;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Source text with the path it was read from.
 *
 * @param path path used in token locations
 * @param content full text of the file
 * @since 1.0.0
 */
public record SourceFile(String path, String content) {

    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static SourceFile of(String path, String content) {
        return new SourceFile(path, content);
    }

    /**
     * Reads a UTF-8 file.
     *
     * @throws IOException if the file cannot be read
     */
    public static SourceFile read(Path path) throws IOException {
        return new SourceFile(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Builds the line index of this file's content.
     */
    public LineIndex lineIndex() {
        return new LineIndex(content);
    }
}
