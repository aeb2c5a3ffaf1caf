package com.polyast.core.parser;

import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;

/**
 * Adapter around a third-party parser that turns source text into that parser's own
 * syntax tree. The tree is then handed to the matching
 * {@link com.polyast.core.normalizer.Normalizer}.
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>Java: {@link JavaSourceParser} via JavaParser</li>
 *   <li>JavaScript: {@link JavaScriptSourceParser} via Mozilla Rhino</li>
 * </ul>
 *
 * <p>Python has no in-repo parser; its tree ({@link com.polyast.core.parser.ast.PythonAst})
 * is built by an external front end.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * SourceParser<CompilationUnit> parser = new JavaSourceParser();
 * CompilationUnit unit = parser.parse(SourceFile.of("A.java", "class A {}"));
 * }</pre>
 *
 * @param <T> root node type of the collaborator tree
 * @see SourceParserFactory
 * @since 1.0.0
 */
public interface SourceParser<T> {

    /**
     * Parses a whole file.
     *
     * @param source file to parse
     * @return root of the collaborator tree
     * @throws ParseException if the collaborator rejects the text
     */
    T parse(SourceFile source);

    /**
     * Checks if this parser is available (i.e., required dependencies are present).
     *
     * @return true if parser is available, false otherwise
     */
    boolean isAvailable();

    /**
     * Gets the language this parser supports.
     */
    Language language();

    /**
     * Exception thrown when parsing fails.
     */
    class ParseException extends RuntimeException {
        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }

        public ParseException(String message) {
            super(message);
        }
    }
}
