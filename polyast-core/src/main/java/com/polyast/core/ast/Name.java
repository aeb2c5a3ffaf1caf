package com.polyast.core.ast;

import java.util.Objects;

/**
 * Possibly qualified name: {@code java.util.List<String>} is the identifier {@code List}
 * with qualifier {@code [java, util]} and type argument {@code String}.
 *
 * @param ident last identifier of the name
 * @param info qualifier and type arguments
 * @since 1.0.0
 */
public record Name(Ident ident, NameInfo info) {

    public Name {
        Objects.requireNonNull(ident, "ident must not be null");
        Objects.requireNonNull(info, "info must not be null");
    }

    public static Name of(Ident ident) {
        return new Name(ident, NameInfo.EMPTY);
    }
}
