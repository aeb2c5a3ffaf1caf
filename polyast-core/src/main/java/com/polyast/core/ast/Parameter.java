package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Formal parameter of a function, method or lambda.
 *
 * @since 1.0.0
 */
public sealed interface Parameter {

    record ParamClassic(ParameterClassic parameter) implements Parameter {
        public ParamClassic {
            Objects.requireNonNull(parameter, "parameter must not be null");
        }
    }

    /** Destructuring parameter. */
    record ParamPattern(Pattern pattern) implements Parameter {
        public ParamPattern {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }
    }

    record ParamEllipsis(Token token) implements Parameter {
        public ParamEllipsis {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    record OtherParam(OtherParameterOp op, List<Any> payload) implements Parameter {
        public OtherParam {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum OtherParameterOp {
        /** Python {@code **kwargs} */
        KWD_PARAM,
        /** Python bare {@code *} separating keyword-only parameters */
        SINGLE_STAR_PARAM,
        /** Java explicit receiver parameter {@code Foo this} */
        RECEIVER,
        REF,
        TODO
    }
}
