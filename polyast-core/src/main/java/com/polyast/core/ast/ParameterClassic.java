package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordinary named parameter.
 *
 * @param name parameter name, absent for unnamed parameters of a signature
 * @param type declared type
 * @param defaultValue default value expression
 * @param attributes modifiers, e.g. {@code final} or {@code Variadic}
 * @param info annotation cell of the parameter binding
 * @since 1.0.0
 */
public record ParameterClassic(
    Optional<Ident> name,
    Optional<Type> type,
    Optional<Expr> defaultValue,
    List<Attribute> attributes,
    IdInfo info
) {

    public ParameterClassic {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(defaultValue, "defaultValue must not be null");
        attributes = List.copyOf(attributes);
        Objects.requireNonNull(info, "info must not be null");
    }
}
