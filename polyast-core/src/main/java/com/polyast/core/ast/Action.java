package com.polyast.core.ast;

import java.util.Objects;

/**
 * One arm of a {@link Expr.MatchPattern}.
 *
 * @param pattern pattern to match
 * @param body expression evaluated when the pattern matches
 * @since 1.0.0
 */
public record Action(Pattern pattern, Expr body) {

    public Action {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }
}
