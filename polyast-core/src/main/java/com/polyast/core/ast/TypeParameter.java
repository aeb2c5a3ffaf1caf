package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Type parameter with its upper bounds, e.g. {@code T extends Comparable<T>}.
 *
 * @param name parameter name
 * @param bounds {@code extends} constraints, empty when unbounded
 * @since 1.0.0
 */
public record TypeParameter(Ident name, List<Type> bounds) {

    public TypeParameter {
        Objects.requireNonNull(name, "name must not be null");
        bounds = List.copyOf(bounds);
    }
}
