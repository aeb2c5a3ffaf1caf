package com.polyast.core.ast;

import java.util.Objects;

/**
 * A value paired with the token it was read from.
 *
 * @param value wrapped value
 * @param token source token
 * @param <T> value type
 * @since 1.0.0
 */
public record Wrap<T>(T value, Token token) {

    public Wrap {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(token, "token must not be null");
    }

    public static <T> Wrap<T> of(T value, Token token) {
        return new Wrap<>(value, token);
    }

    /**
     * Wraps a value in a fake token labelled with its string form.
     */
    public static <T> Wrap<T> fake(T value) {
        return new Wrap<>(value, Token.fake(String.valueOf(value)));
    }

    public <R> Wrap<R> withValue(R newValue) {
        return new Wrap<>(newValue, token);
    }
}
