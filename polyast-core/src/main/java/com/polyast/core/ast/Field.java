package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Member of a class body or object literal.
 *
 * @since 1.0.0
 */
public sealed interface Field {

    /** Ordinary member; usually a {@link Stmt.DefStmt}. */
    record FieldStmt(Stmt stmt) implements Field {
        public FieldStmt {
            Objects.requireNonNull(stmt, "stmt must not be null");
        }
    }

    /** Member with a computed name, e.g. JavaScript {@code {[key]: value}}. */
    record FieldDynamic(Expr name, List<Attribute> attributes, Expr value) implements Field {
        public FieldDynamic {
            Objects.requireNonNull(name, "name must not be null");
            attributes = List.copyOf(attributes);
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Spread member, e.g. JavaScript {@code {...other}}. */
    record FieldSpread(Token token, Expr expr) implements Field {
        public FieldSpread {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }
}
