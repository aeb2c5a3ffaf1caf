package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Defined name with its attributes and type parameters.
 *
 * @param name defined identifier
 * @param attributes modifiers and annotations
 * @param typeParameters generic type parameters, empty when not generic
 * @param info annotation cell of the defining occurrence
 * @since 1.0.0
 */
public record Entity(Ident name, List<Attribute> attributes, List<TypeParameter> typeParameters, IdInfo info) {

    public Entity {
        Objects.requireNonNull(name, "name must not be null");
        attributes = List.copyOf(attributes);
        typeParameters = List.copyOf(typeParameters);
        Objects.requireNonNull(info, "info must not be null");
    }
}
