package com.polyast.core.normalizer;

import com.polyast.core.ast.Stmt;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Entry point for translating collaborator trees into the generic AST.
 *
 * <p>Providers are discovered once via {@link ServiceLoader}; the first provider
 * registered for a language wins.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompilationUnit unit = javaParser.parse(sourceFile);
 * List<Stmt> program = Normalizers.normalize(Language.JAVA, unit, sourceFile);
 * }</pre>
 *
 * @see NormalizerProvider
 * @since 1.0.0
 */
public final class Normalizers {

    private static final Logger log = LoggerFactory.getLogger(Normalizers.class);

    private static final Map<Language, NormalizerProvider> PROVIDERS = discoverProviders();

    private Normalizers() {
        // Utility class - no instantiation
    }

    /**
     * Creates the normalizer for one file of the given language.
     *
     * @throws UnsupportedLanguageException if no provider is registered for the language
     */
    public static Normalizer<?> forLanguage(Language language, SourceFile sourceFile) {
        return provider(language)
            .orElseThrow(() -> new UnsupportedLanguageException("No normalizer registered for " + language.id()))
            .create(sourceFile);
    }

    /**
     * Translates a whole collaborator tree.
     *
     * @param language language of the tree
     * @param ast collaborator root node, e.g. a JavaParser {@code CompilationUnit}
     * @param sourceFile file the tree was parsed from
     * @return top-level statements in source order
     * @throws IllegalArgumentException if the tree is not of the language's root type
     * @throws NormalizationException if the tree violates a guarantee of its grammar
     */
    public static List<Stmt> normalize(Language language, Object ast, SourceFile sourceFile) {
        return translate(forLanguage(language, sourceFile), ast);
    }

    public static Optional<NormalizerProvider> provider(Language language) {
        return Optional.ofNullable(PROVIDERS.get(language));
    }

    public static Set<Language> supportedLanguages() {
        return Collections.unmodifiableSet(PROVIDERS.keySet());
    }

    private static <T> List<Stmt> translate(Normalizer<T> normalizer, Object ast) {
        if (!normalizer.astType().isInstance(ast)) {
            throw new IllegalArgumentException("Expected " + normalizer.astType().getName() + " for "
                + normalizer.language().id() + " but got "
                + (ast == null ? "null" : ast.getClass().getName()));
        }
        return normalizer.program(normalizer.astType().cast(ast));
    }

    private static Map<Language, NormalizerProvider> discoverProviders() {
        log.debug("Discovering normalizers via ServiceLoader");
        Map<Language, NormalizerProvider> providers = new EnumMap<>(Language.class);
        for (NormalizerProvider provider : ServiceLoader.load(NormalizerProvider.class)) {
            NormalizerProvider previous = providers.putIfAbsent(provider.language(), provider);
            if (previous != null) {
                log.warn("Ignoring duplicate normalizer for {}: {}", provider.language().id(), provider.getDisplayName());
            }
        }
        log.info("Discovered {} normalizers", providers.size());
        return providers;
    }
}
