package com.polyast.core.ast;

import java.util.Objects;

/**
 * A value enclosed in an opening and a closing token ({@code ()}, {@code []}, {@code {}}).
 *
 * @param open opening token
 * @param value enclosed value
 * @param close closing token
 * @param <T> enclosed value type
 * @since 1.0.0
 */
public record Bracket<T>(Token open, T value, Token close) {

    public Bracket {
        Objects.requireNonNull(open, "open must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(close, "close must not be null");
    }

    /**
     * Brackets a value with fake parenthesis tokens.
     */
    public static <T> Bracket<T> fake(T value) {
        return new Bracket<>(Token.fake("("), value, Token.fake(")"));
    }

    public <R> Bracket<R> withValue(R newValue) {
        return new Bracket<>(open, newValue, close);
    }
}
