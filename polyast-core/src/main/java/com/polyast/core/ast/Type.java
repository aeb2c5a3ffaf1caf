package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic type expression.
 *
 * @since 1.0.0
 */
public sealed interface Type {

    /** Primitive type, e.g. {@code int}, {@code void}. */
    record TyBuiltin(Wrap<String> name) implements Type {
        public TyBuiltin {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record TyName(Name name) implements Type {
        public TyName {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record TyNameApply(Name name, List<TypeArgument> arguments) implements Type {
        public TyNameApply {
            Objects.requireNonNull(name, "name must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    /** Type variable, e.g. the {@code T} of {@code List<T>} inside a generic class. */
    record TyVar(Ident ident) implements Type {
        public TyVar {
            Objects.requireNonNull(ident, "ident must not be null");
        }
    }

    record TyFun(List<Type> parameters, Type result) implements Type {
        public TyFun {
            parameters = List.copyOf(parameters);
            Objects.requireNonNull(result, "result must not be null");
        }
    }

    /**
     * Array type; one wrapper per dimension, so {@code int[][]} is
     * {@code TyArray(TyArray(TyBuiltin(int)))}.
     */
    record TyArray(Bracket<Optional<Expr>> size, Type element) implements Type {
        public TyArray {
            Objects.requireNonNull(size, "size must not be null");
            Objects.requireNonNull(element, "element must not be null");
        }
    }

    record TyPointer(Token token, Type target) implements Type {
        public TyPointer {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }
    }

    record TyTuple(Bracket<List<Type>> elements) implements Type {
        public TyTuple {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = elements.withValue(List.copyOf(elements.value()));
        }
    }

    /** Nullable type, e.g. {@code String?}. */
    record TyQuestion(Type type, Token token) implements Type {
        public TyQuestion {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** Intersection type, e.g. {@code A & B}. */
    record TyAnd(Type left, Token token, Type right) implements Type {
        public TyAnd {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /** Union type, e.g. the {@code A | B} of a Java multi-catch. */
    record TyOr(Type left, Token token, Type right) implements Type {
        public TyOr {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record OtherType(OtherTypeOp op, List<Any> payload) implements Type {
        public OtherType {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum OtherTypeOp {
        /** Expression used where a type is expected */
        EXPR,
        /** Argument used where a type is expected */
        ARG,
        STRUCT_NAME,
        UNION_NAME,
        ENUM_NAME,
        /** Java {@code var}: type inferred from the initializer */
        VAR,
        TODO
    }
}
