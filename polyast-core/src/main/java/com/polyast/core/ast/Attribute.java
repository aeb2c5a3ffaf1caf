package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Modifier, keyword attribute or annotation attached to a definition or parameter.
 *
 * @since 1.0.0
 */
public sealed interface Attribute {

    record KeywordAttr(Wrap<KeywordAttribute> keyword) implements Attribute {
        public KeywordAttr {
            Objects.requireNonNull(keyword, "keyword must not be null");
        }

        public static KeywordAttr of(KeywordAttribute keyword, Token token) {
            return new KeywordAttr(new Wrap<>(keyword, token));
        }
    }

    /** Annotation or decorator, e.g. {@code @Override}, {@code @app.route("/")}. */
    record NamedAttr(Token at, Name name, IdInfo info, Bracket<List<Argument>> arguments) implements Attribute {
        public NamedAttr {
            Objects.requireNonNull(at, "at must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(info, "info must not be null");
            Objects.requireNonNull(arguments, "arguments must not be null");
            arguments = arguments.withValue(List.copyOf(arguments.value()));
        }
    }

    record OtherAttribute(OtherAttributeOp op, List<Any> payload) implements Attribute {
        public OtherAttribute {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum KeywordAttribute {
        STATIC,
        VOLATILE,
        EXTERN,
        PUBLIC,
        PRIVATE,
        PROTECTED,
        ABSTRACT,
        FINAL,
        VAR,
        LET,
        MUTABLE,
        CONST,
        GENERATOR,
        ASYNC,
        RECURSIVE,
        MUTUALLY_RECURSIVE,
        CTOR,
        DTOR,
        GETTER,
        SETTER,
        VARIADIC
    }

    enum OtherAttributeOp {
        STRICT_FP,
        TRANSIENT,
        SYNCHRONIZED,
        NATIVE,
        SEALED,
        NON_SEALED,
        /** Java annotation whose name or arguments do not fit {@link NamedAttr} */
        ANNOT_JAVA_OTHER,
        /** Java {@code throws} clause */
        ANNOT_THROW,
        /** Decorator that is not a plain call, e.g. Python {@code @x[0]} */
        EXPR,
        /** Java interface {@code default} method */
        DEFAULT
    }
}
