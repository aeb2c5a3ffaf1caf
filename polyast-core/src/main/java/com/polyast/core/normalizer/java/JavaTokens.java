package com.polyast.core.normalizer.java;

import com.github.javaparser.JavaToken;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;

import java.util.Optional;

/**
 * Navigation over the token list JavaParser stores when
 * {@code ParserConfiguration.setStoreTokens(true)} is set.
 *
 * <p>Tokens form a doubly-linked list; these helpers skip whitespace and comments.
 */
final class JavaTokens {

    private JavaTokens() {
        // Utility class - no instantiation
    }

    static Optional<JavaToken> first(Node node) {
        return node.getTokenRange().map(TokenRange::getBegin).flatMap(JavaTokens::significantFrom);
    }

    static Optional<JavaToken> last(Node node) {
        return node.getTokenRange().map(TokenRange::getEnd).flatMap(JavaTokens::significantBefore);
    }

    /**
     * Returns the first significant token strictly after {@code token}.
     */
    static Optional<JavaToken> next(JavaToken token) {
        return token.getNextToken().flatMap(JavaTokens::significantFrom);
    }

    /**
     * Returns the last significant token strictly before {@code token}.
     */
    static Optional<JavaToken> previous(JavaToken token) {
        return token.getPreviousToken().flatMap(JavaTokens::significantBefore);
    }

    /**
     * Returns the first token after the end of {@code node}.
     */
    static Optional<JavaToken> after(Node node) {
        return last(node).flatMap(JavaTokens::next);
    }

    /**
     * Returns the last token before the start of {@code node}.
     */
    static Optional<JavaToken> before(Node node) {
        return first(node).flatMap(JavaTokens::previous);
    }

    /**
     * Scans forward from {@code token} (inclusive) for a token with the given text.
     */
    static Optional<JavaToken> find(JavaToken token, String text) {
        Optional<JavaToken> current = Optional.of(token);
        while (current.isPresent()) {
            JavaToken candidate = current.get();
            if (candidate.getText().equals(text)) {
                return current;
            }
            current = candidate.getNextToken();
        }
        return Optional.empty();
    }

    /**
     * Finds the first token with the given text inside the range of {@code node}.
     */
    static Optional<JavaToken> find(Node node, String text) {
        if (node.getTokenRange().isEmpty()) {
            return Optional.empty();
        }
        for (JavaToken token : node.getTokenRange().get()) {
            if (token.getText().equals(text)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the bracket closing {@code open} ({@code (}, {@code [} or <code>{</code>).
     */
    static Optional<JavaToken> closing(JavaToken open) {
        String openText = open.getText();
        String closeText = switch (openText) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            default -> throw new IllegalArgumentException("Not an opening bracket: " + openText);
        };
        int depth = 0;
        Optional<JavaToken> current = Optional.of(open);
        while (current.isPresent()) {
            String text = current.get().getText();
            if (text.equals(openText)) {
                depth++;
            } else if (text.equals(closeText) && --depth == 0) {
                return current;
            }
            current = current.get().getNextToken();
        }
        return Optional.empty();
    }

    private static Optional<JavaToken> significantFrom(JavaToken token) {
        Optional<JavaToken> current = Optional.of(token);
        while (current.isPresent() && current.get().getCategory().isWhitespaceOrComment()) {
            current = current.get().getNextToken();
        }
        return current;
    }

    private static Optional<JavaToken> significantBefore(JavaToken token) {
        Optional<JavaToken> current = Optional.of(token);
        while (current.isPresent() && current.get().getCategory().isWhitespaceOrComment()) {
            current = current.get().getPreviousToken();
        }
        return current;
    }
}
