package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Type argument of a generic type application.
 *
 * @since 1.0.0
 */
public sealed interface TypeArgument {

    record TypeArg(Type type) implements TypeArgument {
        public TypeArg {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    record OtherTypeArg(OtherTypeArgumentOp op, List<Any> payload) implements TypeArgument {
        public OtherTypeArg {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum OtherTypeArgumentOp {
        /** Java wildcard {@code ?}, {@code ? extends T}, {@code ? super T} */
        QUESTION
    }
}
