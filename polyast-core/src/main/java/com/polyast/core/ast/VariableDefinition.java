package com.polyast.core.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Variable, field or constant definition.
 *
 * @param initializer initial value
 * @param type declared type
 * @since 1.0.0
 */
public record VariableDefinition(Optional<Expr> initializer, Optional<Type> type) {

    public VariableDefinition {
        Objects.requireNonNull(initializer, "initializer must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
