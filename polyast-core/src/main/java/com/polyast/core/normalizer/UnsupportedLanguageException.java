package com.polyast.core.normalizer;

/**
 * Thrown when no parser or normalizer is available for a file or language.
 *
 * @since 1.0.0
 */
public class UnsupportedLanguageException extends RuntimeException {

    public UnsupportedLanguageException(String message) {
        super(message);
    }

    public UnsupportedLanguageException(String message, Throwable cause) {
        super(message, cause);
    }
}
