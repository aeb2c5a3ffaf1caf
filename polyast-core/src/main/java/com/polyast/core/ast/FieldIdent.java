package com.polyast.core.ast;

import java.util.Objects;

/**
 * Right-hand side of a {@link Expr.DotAccess}.
 *
 * @since 1.0.0
 */
public sealed interface FieldIdent {

    record FId(Ident ident) implements FieldIdent {
        public FId {
            Objects.requireNonNull(ident, "ident must not be null");
        }
    }

    record FName(Name name) implements FieldIdent {
        public FName {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** Computed member, e.g. PHP {@code $o->$name}. */
    record FDynamic(Expr expr) implements FieldIdent {
        public FDynamic {
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }
}
