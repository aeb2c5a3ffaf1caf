package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic expression.
 *
 * <p>Operators and many built-ins are encoded as calls to an {@link IdSpecial}, so
 * {@code -x} is {@code Call(IdSpecial(Op(MINUS)), [Arg(x)])}. Language features with no
 * dedicated variant go to {@link OtherExpr} with their sub-trees in the payload.
 *
 * @since 1.0.0
 */
public sealed interface Expr {

    record Lit(Literal literal) implements Expr {
        public Lit {
            Objects.requireNonNull(literal, "literal must not be null");
        }
    }

    record Container(ContainerKind kind, Bracket<List<Expr>> elements) implements Expr {
        public Container {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(elements, "elements must not be null");
            elements = elements.withValue(List.copyOf(elements.value()));
        }
    }

    record Tuple(List<Expr> elements) implements Expr {
        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    /** Object literal, e.g. JavaScript {@code {a: 1}}. */
    record RecordLit(Bracket<List<Field>> fields) implements Expr {
        public RecordLit {
            Objects.requireNonNull(fields, "fields must not be null");
            fields = fields.withValue(List.copyOf(fields.value()));
        }
    }

    /** Constructor application of an algebraic data type. */
    record Constructor(Name name, List<Expr> arguments) implements Expr {
        public Constructor {
            Objects.requireNonNull(name, "name must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    /** Anonymous function; introduces a new scope for its parameters. */
    record Lambda(FunctionDefinition function) implements Expr {
        public Lambda {
            Objects.requireNonNull(function, "function must not be null");
        }
    }

    /** Anonymous class, e.g. Java {@code new Runnable() { ... }}. */
    record AnonClass(ClassDefinition classDefinition) implements Expr {
        public AnonClass {
            Objects.requireNonNull(classDefinition, "classDefinition must not be null");
        }
    }

    record Id(Ident ident, IdInfo info) implements Expr {
        public Id {
            Objects.requireNonNull(ident, "ident must not be null");
            Objects.requireNonNull(info, "info must not be null");
        }

        public static Id of(Ident ident) {
            return new Id(ident, IdInfo.empty());
        }
    }

    record IdQualified(Name name, IdInfo info) implements Expr {
        public IdQualified {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(info, "info must not be null");
        }
    }

    record IdSpecial(Wrap<Special> special) implements Expr {
        public IdSpecial {
            Objects.requireNonNull(special, "special must not be null");
        }

        public static IdSpecial of(Special special, Token token) {
            return new IdSpecial(new Wrap<>(special, token));
        }
    }

    record Call(Expr function, Bracket<List<Argument>> arguments) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(arguments, "arguments must not be null");
            arguments = arguments.withValue(List.copyOf(arguments.value()));
        }
    }

    /**
     * Assignment. When the target is an {@link Id} it may introduce a new variable
     * in languages without declarations (Python, JavaScript sloppy mode).
     */
    record Assign(Expr target, Token token, Expr value) implements Expr {
        public Assign {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Compound assignment, e.g. {@code x += 1}. */
    record AssignOp(Expr target, Wrap<Operator> operator, Expr value) implements Expr {
        public AssignOp {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Binding of a pattern, e.g. Python {@code with open(f) as fd}. Introduces new variables. */
    record LetPattern(Pattern pattern, Expr value) implements Expr {
        public LetPattern {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record DotAccess(Expr object, Token dot, FieldIdent field) implements Expr {
        public DotAccess {
            Objects.requireNonNull(object, "object must not be null");
            Objects.requireNonNull(dot, "dot must not be null");
            Objects.requireNonNull(field, "field must not be null");
        }
    }

    record ArrayAccess(Expr array, Expr index) implements Expr {
        public ArrayAccess {
            Objects.requireNonNull(array, "array must not be null");
            Objects.requireNonNull(index, "index must not be null");
        }
    }

    record SliceAccess(Expr array, Optional<Expr> lower, Optional<Expr> upper, Optional<Expr> step)
        implements Expr {
        public SliceAccess {
            Objects.requireNonNull(array, "array must not be null");
            Objects.requireNonNull(lower, "lower must not be null");
            Objects.requireNonNull(upper, "upper must not be null");
            Objects.requireNonNull(step, "step must not be null");
        }
    }

    record Conditional(Expr condition, Expr thenExpr, Expr elseExpr) implements Expr {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenExpr, "thenExpr must not be null");
            Objects.requireNonNull(elseExpr, "elseExpr must not be null");
        }
    }

    record MatchPattern(Expr scrutinee, List<Action> actions) implements Expr {
        public MatchPattern {
            Objects.requireNonNull(scrutinee, "scrutinee must not be null");
            actions = List.copyOf(actions);
        }
    }

    /**
     * @param delegating true for {@code yield*} / {@code yield from}
     */
    record Yield(Token token, Optional<Expr> value, boolean delegating) implements Expr {
        public Yield {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Await(Token token, Expr value) implements Expr {
        public Await {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Cast(Type type, Expr value) implements Expr {
        public Cast {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Comma sequence; evaluates to its last element. */
    record Seq(List<Expr> exprs) implements Expr {
        public Seq {
            exprs = List.copyOf(exprs);
        }
    }

    record Ref(Token token, Expr value) implements Expr {
        public Ref {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record DeRef(Token token, Expr value) implements Expr {
        public DeRef {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** {@code ...}, used both as Python's Ellipsis and as a pattern wildcard. */
    record Ellipsis(Token token) implements Expr {
        public Ellipsis {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** Pattern metavariable constrained by a type, e.g. {@code (int $X)}. */
    record TypedMetavar(Ident ident, Token token, Type type) implements Expr {
        public TypedMetavar {
            Objects.requireNonNull(ident, "ident must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** Pattern disjunction. */
    record DisjExpr(Expr left, Expr right) implements Expr {
        public DisjExpr {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record OtherExpr(OtherExprOp op, List<Any> payload) implements Expr {
        public OtherExpr {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum ContainerKind {
        ARRAY,
        LIST,
        SET,
        DICT
    }

    enum OtherExprOp {
        // JavaScript
        EXPORTS,
        MODULE,
        DEFINE,
        ARGUMENTS,
        NEW_TARGET,
        DELETE,
        VOID,
        YIELD_STAR,
        ENCAPS_NAME,
        REQUIRE,
        USE_STRICT,
        IN,
        /** Function expression with its own name, e.g. {@code var f = function g() {}}; the payload is the definition */
        NAMED_FUNCTION,
        // Python
        NOT_IN,
        INVERT,
        SLICES,
        COMP_FOR_IF,
        COMP_FOR,
        COMP_IF,
        CMP_OPS,
        REPR,
        // Java
        NAME_OR_CLASS_TYPE,
        CLASS_LITERAL,
        NEW_QUALIFIED_CLASS,
        METHOD_REF,
        SWITCH_EXPR,
        QUALIFIED_THIS,
        // any language
        ANNOT,
        TODO
    }
}
