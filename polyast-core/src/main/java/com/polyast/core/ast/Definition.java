package com.polyast.core.ast;

import java.util.Objects;

/**
 * A named definition: the entity being defined and what kind of thing it is.
 *
 * @param entity name, attributes and type parameters
 * @param kind function, variable, class, type, module, macro, signature or outer declaration
 * @since 1.0.0
 */
public record Definition(Entity entity, DefinitionKind kind) {

    public Definition {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
