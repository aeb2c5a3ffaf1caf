package com.polyast.core.ast;

import java.util.Objects;

/**
 * Identifier with its token.
 *
 * @param name identifier text
 * @param token identifier token
 * @since 1.0.0
 */
public record Ident(String name, Token token) {

    public Ident {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(token, "token must not be null");
    }

    /**
     * Creates an identifier whose token is fake and carries the name as label.
     */
    public static Ident fake(String name) {
        return new Ident(name, Token.fake(name));
    }
}
