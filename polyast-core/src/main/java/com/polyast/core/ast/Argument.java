package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Call argument.
 *
 * @since 1.0.0
 */
public sealed interface Argument {

    record Arg(Expr expr) implements Argument {
        public Arg {
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }

    /** Keyword argument, e.g. Python {@code f(x=1)}. */
    record ArgKwd(Ident name, Expr expr) implements Argument {
        public ArgKwd {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }

    /** Type passed as argument, e.g. the class of a Java {@code new}. */
    record ArgType(Type type) implements Argument {
        public ArgType {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    record ArgOther(OtherArgumentOp op, List<Any> payload) implements Argument {
        public ArgOther {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum OtherArgumentOp {
        /** Python {@code **kwargs} */
        ARG_POW,
        /** Python generator argument {@code f(x for x in y)} */
        ARG_COMP,
        /** Optional argument marker */
        ARG_QUESTION,
        /** Java {@code x instanceof String s}: the binding pattern after the tested value */
        ARG_PATTERN
    }
}
