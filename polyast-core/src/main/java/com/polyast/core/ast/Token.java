package com.polyast.core.ast;

import java.util.Objects;

/**
 * Smallest positional unit of the generic AST.
 *
 * <p>A token is in one of three states:
 * <ul>
 *   <li><b>origin</b> - it has a {@link Location} taken from the parsed source</li>
 *   <li><b>fake</b> - it was synthesized by a normalizer and has no position</li>
 *   <li><b>abstract</b> - its position was erased by
 *       {@link com.polyast.core.ast.visitor.AstTraversals#abstractPositionInfo}</li>
 * </ul>
 *
 * <p>Abstract tokens compare equal whenever their text matches, which is what makes
 * position-insensitive equality between two trees possible.
 *
 * @param text token text as it appears in the source, or the label of a fake token
 * @param location source position, {@code null} for fake and abstract tokens
 * @param fake true when the token was synthesized
 * @since 1.0.0
 */
public record Token(String text, Location location, boolean fake) {

    public Token {
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Creates a token located in the source.
     *
     * @param text token text
     * @param location source position
     * @return origin token
     */
    public static Token of(String text, Location location) {
        return new Token(text, Objects.requireNonNull(location, "location must not be null"), false);
    }

    /**
     * Creates a synthesized token with no position.
     *
     * @param label text describing the token, e.g. {@code "in"} for a desugared for-each
     * @return fake token
     */
    public static Token fake(String label) {
        return new Token(label, null, true);
    }

    /**
     * Returns a copy of this token with its position erased. Idempotent.
     *
     * @return abstract (or still fake) token with the same text
     */
    public Token abstracted() {
        return location == null ? this : new Token(text, null, fake);
    }

    public boolean isFake() {
        return fake;
    }

    public boolean isAbstract() {
        return location == null && !fake;
    }

    public boolean isOrigin() {
        return location != null;
    }

    @Override
    public String toString() {
        if (fake) {
            return "fake(" + text + ")";
        }
        return location == null ? text : text + "@" + location;
    }
}
