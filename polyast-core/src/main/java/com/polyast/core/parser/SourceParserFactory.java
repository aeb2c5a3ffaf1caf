package com.polyast.core.parser;

import com.polyast.core.config.PolyastConfig;
import com.polyast.core.lang.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for language-specific source parsers.
 *
 * <p>Parser instances are created on demand and cached per language and settings, so
 * a batch run reuses one parser per language.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Optional<SourceParser<?>> parser = SourceParserFactory.forLanguage(Language.JAVA, config);
 * parser.ifPresent(p -> p.parse(source));
 * }</pre>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>This factory is thread-safe. Parser instances are cached in a {@link ConcurrentHashMap};
 * the parsers themselves keep no per-parse state.</p>
 *
 * @see SourceParser
 * @since 1.0.0
 */
public final class SourceParserFactory {

    private static final Logger log = LoggerFactory.getLogger(SourceParserFactory.class);

    // Cache of parser instances (one per language and settings)
    private static final Map<String, SourceParser<?>> parserCache = new ConcurrentHashMap<>();

    private SourceParserFactory() {
        // Utility class - no instantiation
    }

    /**
     * Gets the parser for a language.
     *
     * @param language source language
     * @param config settings for the collaborator parsers
     * @return parser, empty when the language has no in-repo parser
     */
    public static Optional<SourceParser<?>> forLanguage(Language language, PolyastConfig config) {
        return switch (language) {
            case JAVA -> Optional.of(getJavaParser(config.languages().java()));
            case JAVASCRIPT -> Optional.of(getJavaScriptParser(config.languages().javascript()));
            case PYTHON -> Optional.empty();
        };
    }

    /**
     * Gets the JavaParser-backed parser.
     *
     * @return Java parser instance (cached, thread-safe)
     */
    public static JavaSourceParser getJavaParser(PolyastConfig.JavaSettings settings) {
        String key = Language.JAVA.id() + ":" + settings.languageLevel();
        return (JavaSourceParser) parserCache.computeIfAbsent(key, k -> {
            log.info("Java parser initialized (language level {})", settings.languageLevel());
            return new JavaSourceParser(settings);
        });
    }

    /**
     * Gets the Rhino-backed parser.
     *
     * @return JavaScript parser instance (cached, thread-safe)
     */
    public static JavaScriptSourceParser getJavaScriptParser(PolyastConfig.JavaScriptSettings settings) {
        String key = Language.JAVASCRIPT.id() + ":" + settings.languageVersion();
        return (JavaScriptSourceParser) parserCache.computeIfAbsent(key, k -> {
            log.info("JavaScript parser initialized (language version {})", settings.languageVersion());
            return new JavaScriptSourceParser(settings);
        });
    }

    /**
     * Checks if a parser for the given language is available.
     *
     * @param language source language
     * @return true if a parser exists and its dependencies are present
     */
    public static boolean isAvailable(Language language) {
        try {
            return forLanguage(language, PolyastConfig.defaults()).map(SourceParser::isAvailable).orElse(false);
        } catch (RuntimeException e) {
            log.debug("Parser not available for language: {}", language, e);
            return false;
        }
    }

    /**
     * Clears the parser cache (useful for testing).
     */
    public static void clearCache() {
        parserCache.clear();
        log.debug("Source parser cache cleared");
    }
}
