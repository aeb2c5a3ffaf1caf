package com.polyast.core.normalizer;

import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;

/**
 * Factory for per-file {@link Normalizer} instances.
 *
 * <p>Providers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.polyast.core.normalizer.NormalizerProvider}
 *
 * @see Normalizers
 * @since 1.0.0
 */
public interface NormalizerProvider {

    /**
     * Returns the language handled by normalizers of this provider.
     *
     * @return source language
     */
    Language language();

    /**
     * Returns human-readable display name for this provider.
     *
     * <p>Used in CLI output and logs (e.g., "Java (JavaParser)").
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Creates a normalizer for one file.
     *
     * @param sourceFile file whose tree will be translated; used for token locations
     * @return fresh normalizer
     */
    Normalizer<?> create(SourceFile sourceFile);
}
