package com.polyast.core.pipeline;

import com.polyast.core.ast.Stmt;
import com.polyast.core.config.PolyastConfig;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.normalizer.Normalizers;
import com.polyast.core.normalizer.UnsupportedLanguageException;
import com.polyast.core.parser.SourceParser;
import com.polyast.core.parser.SourceParserFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Detects the language of a file, parses it with the collaborator parser and
 * translates the result into the generic AST.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NormalizationPipeline pipeline = new NormalizationPipeline(PolyastConfig.defaults());
 * List<Stmt> program = pipeline.normalizeFile(Path.of("src/Main.java"));
 * }</pre>
 *
 * <p>Instances hold no per-file state and may be shared between threads.
 *
 * @since 1.0.0
 */
public class NormalizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(NormalizationPipeline.class);

    private final PolyastConfig config;

    public NormalizationPipeline(PolyastConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public NormalizationPipeline() {
        this(PolyastConfig.defaults());
    }

    /**
     * Normalizes in-memory source text; the language is taken from the path's extension.
     *
     * @param source file to normalize
     * @return top-level statements of the file
     * @throws UnsupportedLanguageException if the language is unknown, disabled or has no parser
     * @throws SourceParser.ParseException if the collaborator rejects the text
     * @throws com.polyast.core.normalizer.NormalizationException if the tree violates a grammar guarantee
     */
    public List<Stmt> normalize(SourceFile source) {
        Language language = detect(source.path());
        SourceParser<?> parser = SourceParserFactory.forLanguage(language, config)
            .orElseThrow(() -> new UnsupportedLanguageException(
                "No parser available for " + language.id() + " (" + source.path() + ")"));

        log.debug("Parsing {} as {}", source.path(), language.id());
        Object ast = parser.parse(source);
        List<Stmt> program = Normalizers.normalize(language, ast, source);
        log.debug("Normalized {}: {} top-level statements", source.path(), program.size());
        return program;
    }

    /**
     * Reads and normalizes a UTF-8 file.
     *
     * @param path file to normalize
     * @return top-level statements of the file
     * @throws UncheckedIOException if the file cannot be read
     */
    public List<Stmt> normalizeFile(Path path) {
        try {
            return normalize(SourceFile.read(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /**
     * Returns true when a file of this name would be parsed and normalized.
     */
    public boolean supports(Path path) {
        return Language.ofFilename(path.getFileName().toString())
            .filter(language -> config.languages().isEnabled(language))
            .map(SourceParserFactory::isAvailable)
            .orElse(false);
    }

    private Language detect(String path) {
        Language language = Language.ofFilename(path)
            .orElseThrow(() -> new UnsupportedLanguageException("Unknown language for " + path));
        if (!config.languages().isEnabled(language)) {
            throw new UnsupportedLanguageException("Language " + language.id() + " is disabled (" + path + ")");
        }
        return language;
    }
}
