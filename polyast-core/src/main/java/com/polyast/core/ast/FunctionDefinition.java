package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Function or method signature and body.
 *
 * @param parameters formal parameters
 * @param returnType declared return type
 * @param body function body; an empty {@link Stmt.Block} for abstract methods
 * @since 1.0.0
 */
public record FunctionDefinition(List<Parameter> parameters, Optional<Type> returnType, Stmt body) {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
        Objects.requireNonNull(returnType, "returnType must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }
}
