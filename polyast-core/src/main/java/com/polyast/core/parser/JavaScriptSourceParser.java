package com.polyast.core.parser;

import com.polyast.core.config.PolyastConfig;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.ErrorCollector;
import org.mozilla.javascript.ast.ParseProblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses JavaScript sources with Mozilla Rhino's IDE-mode parser.
 *
 * <p>The parser is configured to keep comments out of the tree, to record
 * syntax errors instead of throwing on the first one, and to accept ES6 syntax when
 * the configured language version allows it.
 *
 * @since 1.0.0
 */
public class JavaScriptSourceParser implements SourceParser<AstRoot> {

    private static final Logger log = LoggerFactory.getLogger(JavaScriptSourceParser.class);

    private final int languageVersion;

    public JavaScriptSourceParser() {
        this(PolyastConfig.JavaScriptSettings.defaults());
    }

    public JavaScriptSourceParser(PolyastConfig.JavaScriptSettings settings) {
        this.languageVersion = settings.languageVersion();
    }

    @Override
    public AstRoot parse(SourceFile source) {
        CompilerEnvirons environment = new CompilerEnvirons();
        environment.setLanguageVersion(languageVersion);
        environment.setRecordingComments(false);
        environment.setRecordingLocalJsDocComments(false);
        environment.setRecoverFromErrors(true);
        environment.setIdeMode(true);
        environment.setStrictMode(false);
        environment.setReservedKeywordAsIdentifier(true);

        ErrorCollector errors = new ErrorCollector();
        try {
            AstRoot root = new Parser(environment, errors).parse(source.content(), source.path(), 1);
            List<ParseProblem> problems = errors.getErrors().stream()
                .filter(problem -> problem.getType() == ParseProblem.Type.Error)
                .toList();
            if (!problems.isEmpty()) {
                String messages = problems.stream()
                    .map(problem -> problem.getMessage() + " at offset " + problem.getFileOffset())
                    .collect(Collectors.joining("; "));
                log.debug("Failed to parse JavaScript file {}: {}", source.path(), messages);
                throw new ParseException("Failed to parse " + source.path() + ": " + messages);
            }
            return root;
        } catch (EvaluatorException e) {
            log.debug("Rhino rejected {}", source.path(), e);
            throw new ParseException("Failed to parse " + source.path() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Language language() {
        return Language.JAVASCRIPT;
    }
}
