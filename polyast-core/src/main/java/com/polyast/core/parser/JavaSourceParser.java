package com.polyast.core.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.polyast.core.config.PolyastConfig;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * Parses Java sources with JavaParser.
 *
 * <p>Token ranges are kept (JavaParser's default) because the normalizer reads
 * keyword and operator tokens from them.
 *
 * @since 1.0.0
 */
public class JavaSourceParser implements SourceParser<CompilationUnit> {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceParser.class);

    private final ParserConfiguration configuration;

    public JavaSourceParser() {
        this(PolyastConfig.JavaSettings.defaults());
    }

    public JavaSourceParser(PolyastConfig.JavaSettings settings) {
        this.configuration = new ParserConfiguration()
            .setLanguageLevel(languageLevel(settings.languageLevel()))
            .setStoreTokens(true);
    }

    @Override
    public CompilationUnit parse(SourceFile source) {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source.content());

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
            log.debug("Failed to parse Java file {}: {}", source.path(), problems);
            throw new ParseException("Failed to parse " + source.path() + ": " + problems);
        }
        return result.getResult().get();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Language language() {
        return Language.JAVA;
    }

    private static LanguageLevel languageLevel(String name) {
        try {
            return LanguageLevel.valueOf(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown Java language level '{}', using JAVA_17", name);
            return LanguageLevel.JAVA_17;
        }
    }
}
