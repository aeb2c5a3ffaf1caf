package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Body of a type definition.
 *
 * @since 1.0.0
 */
public sealed interface TypeDefinition {

    /** Sum type; a Java enum without members is one {@link OrEnum} per constant. */
    record OrType(List<OrTypeElement> elements) implements TypeDefinition {
        public OrType {
            elements = List.copyOf(elements);
        }
    }

    /** Record/struct type. */
    record AndType(Bracket<List<Field>> fields) implements TypeDefinition {
        public AndType {
            Objects.requireNonNull(fields, "fields must not be null");
            fields = fields.withValue(List.copyOf(fields.value()));
        }
    }

    record AliasType(Type type) implements TypeDefinition {
        public AliasType {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    record NewType(Token token, Type type) implements TypeDefinition {
        public NewType {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** Exception declaration, e.g. OCaml {@code exception E of int}. */
    record ExceptionType(Ident name, List<Type> arguments) implements TypeDefinition {
        public ExceptionType {
            Objects.requireNonNull(name, "name must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    record OtherTypeKind(OtherTypeKindOp op, List<Any> payload) implements TypeDefinition {
        public OtherTypeKind {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    sealed interface OrTypeElement {
        record OrConstructor(Ident name, List<Type> arguments) implements OrTypeElement {
            public OrConstructor {
                Objects.requireNonNull(name, "name must not be null");
                arguments = List.copyOf(arguments);
            }
        }

        record OrEnum(Ident name, Optional<Expr> value) implements OrTypeElement {
            public OrEnum {
                Objects.requireNonNull(name, "name must not be null");
                Objects.requireNonNull(value, "value must not be null");
            }
        }

        record OrUnion(Ident name, Type type) implements OrTypeElement {
            public OrUnion {
                Objects.requireNonNull(name, "name must not be null");
                Objects.requireNonNull(type, "type must not be null");
            }
        }

        record OtherOr(OtherOrTypeElementOp op, List<Any> payload) implements OrTypeElement {
            public OtherOr {
                Objects.requireNonNull(op, "op must not be null");
                payload = List.copyOf(payload);
            }
        }
    }

    enum OtherTypeKindOp {
        /** Java annotation type {@code @interface} */
        ANNOTATION,
        TODO
    }

    enum OtherOrTypeElementOp {
        /** Java enum constant with arguments or a class body */
        ENUM_WITH_ARGUMENTS,
        TODO
    }
}
