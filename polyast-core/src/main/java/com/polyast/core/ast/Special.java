package com.polyast.core.ast;

import java.util.Objects;

/**
 * Built-in identifiers and operators that are represented as callable identifiers
 * through {@link Expr.IdSpecial}. Binary {@code a + b} becomes
 * {@code Call(IdSpecial(Op(PLUS)), [a, b])}.
 *
 * @since 1.0.0
 */
public sealed interface Special {

    /**
     * Argument-less specials.
     */
    enum Builtin implements Special {
        THIS,
        SUPER,
        /** Python {@code self} */
        SELF,
        /** PHP {@code parent} */
        PARENT,
        EVAL,
        TYPEOF,
        INSTANCEOF,
        SIZEOF,
        NEW,
        /** String interpolation */
        CONCAT,
        /** {@code ...x}, {@code *x} */
        SPREAD
    }

    record Op(Operator operator) implements Special {
        public Op {
            Objects.requireNonNull(operator, "operator must not be null");
        }
    }

    record IncrDecr(Kind kind, Fixity fixity) implements Special {
        public IncrDecr {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(fixity, "fixity must not be null");
        }

        public enum Kind { INCR, DECR }

        public enum Fixity { PREFIX, POSTFIX }
    }

    /** String with an encoding prefix, e.g. Python {@code b"..."}. */
    record EncodedString(String prefix) implements Special {
        public EncodedString {
            Objects.requireNonNull(prefix, "prefix must not be null");
        }
    }
}
