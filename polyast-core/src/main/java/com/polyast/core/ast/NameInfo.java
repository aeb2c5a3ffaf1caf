package com.polyast.core.ast;

import java.util.List;
import java.util.Optional;

/**
 * Qualifier and type arguments attached to a {@link Name}.
 *
 * @param qualifier leading parts of a qualified name, in source order
 * @param typeArguments explicit type arguments of the last part
 * @since 1.0.0
 */
public record NameInfo(Optional<List<Ident>> qualifier, Optional<List<TypeArgument>> typeArguments) {

    public static final NameInfo EMPTY = new NameInfo(Optional.empty(), Optional.empty());

    public NameInfo {
        qualifier = qualifier.map(List::copyOf);
        typeArguments = typeArguments.map(List::copyOf);
    }

    public static NameInfo qualified(List<Ident> qualifier) {
        return new NameInfo(Optional.of(qualifier), Optional.empty());
    }
}
