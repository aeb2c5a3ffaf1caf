package com.polyast.core.parser.ast;

import com.polyast.core.ast.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AST node types for Python source code.
 *
 * <p>This class contains the record types a Python front end hands to
 * {@link com.polyast.core.normalizer.python.PythonNormalizer}. The shapes follow the
 * Python grammar closely (statements, expressions, comprehensions, arguments,
 * parameters) and every leaf carries the {@link Token} it was parsed from.
 *
 * <p><b>Supported Python Versions:</b></p>
 * <ul>
 *   <li>Python 2.7 ({@code print} and {@code exec} statements, backquote repr)</li>
 *   <li>Python 3.x (all versions)</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * // x = 1
 * Token x = Token.of("x", new Location("a.py", 1, 1, 0));
 * Statement assign = new PythonAst.Assign(
 *     List.of(new PythonAst.Name(new Identifier("x", x), ExprContext.STORE, Resolution.NOT_RESOLVED)),
 *     eq, new PythonAst.Num(NumKind.INT, "1", one));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class PythonAst {

    private PythonAst() {
        // Utility class - no instantiation
    }

    /**
     * Identifier with the token it was read from.
     *
     * @param value identifier text (e.g., "os")
     * @param token source token
     */
    public record Identifier(String value, Token token) {
        public Identifier {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /**
     * Root of a parsed file.
     *
     * @param body top-level statements in source order
     */
    public record Module(List<Statement> body) {
        public Module {
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    // ==================== Enumerations ====================

    public enum ExprContext { LOAD, STORE, DEL, AUG_LOAD, AUG_STORE, PARAM }

    public enum NumKind { INT, LONG_INT, FLOAT, IMAG }

    public enum BoolOperator { AND, OR }

    public enum BinaryOperator {
        ADD, SUB, MULT, DIV, MOD, POW, FLOOR_DIV, L_SHIFT, R_SHIFT, BIT_OR, BIT_XOR, BIT_AND, MAT_MULT
    }

    public enum UnaryOperator { INVERT, NOT, U_ADD, U_SUB }

    public enum CmpOperator { EQ, NOT_EQ, LT, LT_E, GT, GT_E, IS, IS_NOT, IN, NOT_IN }

    /**
     * Name resolution hint attached by a front end that ran scope analysis.
     */
    public sealed interface Resolution {
        Resolution NOT_RESOLVED = new NotResolved();

        record NotResolved() implements Resolution {}

        record LocalVar() implements Resolution {}

        record Parameter() implements Resolution {}

        record GlobalVar() implements Resolution {}

        record ClassField() implements Resolution {}

        /** {@code import a.b} makes {@code a} refer to module {@code a.b}. */
        record ImportedModule(List<Identifier> dotted) implements Resolution {
            public ImportedModule {
                dotted = List.copyOf(dotted);
            }
        }

        /** {@code from a import b} makes {@code b} refer to entity {@code a.b}. */
        record ImportedEntity(List<Identifier> dotted) implements Resolution {
            public ImportedEntity {
                dotted = List.copyOf(dotted);
            }
        }
    }

    // ==================== Expressions ====================

    public sealed interface Expression {
    }

    public record BoolLit(boolean value, Token token) implements Expression {
        public BoolLit {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    public record NoneLit(Token token) implements Expression {
        public NoneLit {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** The {@code ...} literal. */
    public record EllipsisLit(Token token) implements Expression {
        public EllipsisLit {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /**
     * Numeric literal kept as source text.
     *
     * @param kind literal kind ({@code 1}, {@code 1L}, {@code 1.0}, {@code 1j})
     * @param text literal text
     * @param token source token
     */
    public record Num(NumKind kind, String text, Token token) implements Expression {
        public Num {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    public record Str(String value, Token token) implements Expression {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /**
     * String with a prefix that changes its meaning, e.g. {@code b"bytes"} or {@code r"\d"}.
     */
    public record EncodedStr(String value, Token token, String prefix) implements Expression {
        public EncodedStr {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(prefix, "prefix must not be null");
        }
    }

    /** f-string: literal fragments and interpolated expressions in order. */
    public record InterpolatedString(List<Expression> parts) implements Expression {
        public InterpolatedString {
            parts = List.copyOf(parts);
        }
    }

    /** Annotated expression, {@code x: int} in an assignment target. */
    public record TypedExpr(Expression expr, Expression type) implements Expression {
        public TypedExpr {
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** Pattern metavariable with a type constraint, {@code ($X: int)}. */
    public record TypedMetavar(Identifier name, Token colon, Expression type) implements Expression {
        public TypedMetavar {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(colon, "colon must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** Starred expression, {@code *rest}. */
    public record ExprStar(Expression expr) implements Expression {
        public ExprStar {
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }

    public record Name(Identifier id, ExprContext context, Resolution resolution) implements Expression {
        public Name {
            Objects.requireNonNull(id, "id must not be null");
            context = context != null ? context : ExprContext.LOAD;
            resolution = resolution != null ? resolution : Resolution.NOT_RESOLVED;
        }
    }

    public record TupleExpr(Comprehension<Expression> elements, ExprContext context) implements Expression {
        public TupleExpr {
            Objects.requireNonNull(elements, "elements must not be null");
            context = context != null ? context : ExprContext.LOAD;
        }
    }

    public record ListExpr(Comprehension<Expression> elements, ExprContext context) implements Expression {
        public ListExpr {
            Objects.requireNonNull(elements, "elements must not be null");
            context = context != null ? context : ExprContext.LOAD;
        }
    }

    /**
     * Dictionary or set display, including dict and set comprehensions.
     */
    public record DictOrSet(Comprehension<DictOrSetElement> elements) implements Expression {
        public DictOrSet {
            Objects.requireNonNull(elements, "elements must not be null");
        }
    }

    /**
     * Subscript {@code value[s1, s2]}; a single slice is the common case.
     */
    public record Subscript(Expression value, List<Slice> slices, ExprContext context) implements Expression {
        public Subscript {
            Objects.requireNonNull(value, "value must not be null");
            slices = List.copyOf(slices);
            context = context != null ? context : ExprContext.LOAD;
        }
    }

    public record Attribute(Expression value, Token dot, Identifier attr, ExprContext context) implements Expression {
        public Attribute {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(dot, "dot must not be null");
            Objects.requireNonNull(attr, "attr must not be null");
            context = context != null ? context : ExprContext.LOAD;
        }
    }

    /** {@code a and b and c}: one operator token for the whole chain. */
    public record BoolOp(BoolOperator op, Token token, List<Expression> values) implements Expression {
        public BoolOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(token, "token must not be null");
            values = List.copyOf(values);
        }
    }

    public record BinOp(Expression left, BinaryOperator op, Token token, Expression right) implements Expression {
        public BinOp {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    public record UnaryOp(UnaryOperator op, Token token, Expression operand) implements Expression {
        public UnaryOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /**
     * Comparison chain {@code a < b <= c}: {@code ops} and {@code comparators} have the
     * same length.
     */
    public record Compare(Expression left, List<CompareOp> ops, List<Expression> comparators) implements Expression {
        public Compare {
            Objects.requireNonNull(left, "left must not be null");
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }
    }

    public record CompareOp(CmpOperator op, Token token) {
        public CompareOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    public record Call(Expression func, List<CallArgument> arguments) implements Expression {
        public Call {
            Objects.requireNonNull(func, "func must not be null");
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
        }
    }

    public record Lambda(List<Param> parameters, Expression body) implements Expression {
        public Lambda {
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /** {@code body if test else orElse}. */
    public record IfExp(Expression test, Expression body, Expression orElse) implements Expression {
        public IfExp {
            Objects.requireNonNull(test, "test must not be null");
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(orElse, "orElse must not be null");
        }
    }

    /**
     * {@code yield}, {@code yield x} or {@code yield from xs}.
     */
    public record Yield(Token token, Optional<Expression> value, boolean from) implements Expression {
        public Yield {
            Objects.requireNonNull(token, "token must not be null");
            value = value != null ? value : Optional.empty();
        }
    }

    public record Await(Token token, Expression value) implements Expression {
        public Await {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Python 2 backquote repr, {@code `x`}. */
    public record Repr(Token open, Expression value, Token close) implements Expression {
        public Repr {
            Objects.requireNonNull(open, "open must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(close, "close must not be null");
        }
    }

    // ==================== Displays and comprehensions ====================

    /**
     * Contents of a display: either explicit elements or a comprehension.
     *
     * @param <T> element type
     */
    public sealed interface Comprehension<T> {
    }

    /** Explicit elements between brackets, {@code [a, b]}. */
    public record CompList<T>(Token open, List<T> elements, Token close) implements Comprehension<T> {
        public CompList {
            Objects.requireNonNull(open, "open must not be null");
            elements = List.copyOf(elements);
            Objects.requireNonNull(close, "close must not be null");
        }
    }

    /** Comprehension {@code [element for x in xs if p]}. */
    public record CompForIf<T>(T element, List<ForIf> clauses) implements Comprehension<T> {
        public CompForIf {
            Objects.requireNonNull(element, "element must not be null");
            clauses = List.copyOf(clauses);
        }
    }

    public sealed interface ForIf {
    }

    public record CompFor(Expression target, Expression iter) implements ForIf {
        public CompFor {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(iter, "iter must not be null");
        }
    }

    public record CompIf(Expression test) implements ForIf {
        public CompIf {
            Objects.requireNonNull(test, "test must not be null");
        }
    }

    public sealed interface DictOrSetElement {
    }

    public record KeyVal(Expression key, Expression value) implements DictOrSetElement {
        public KeyVal {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Set element. */
    public record Key(Expression key) implements DictOrSetElement {
        public Key {
            Objects.requireNonNull(key, "key must not be null");
        }
    }

    /** {@code **other} inside a dict display. */
    public record PowInline(Expression value) implements DictOrSetElement {
        public PowInline {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public sealed interface Slice {
    }

    public record Index(Expression value) implements Slice {
        public Index {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** {@code lower:upper:step}, each part optional. */
    public record SliceRange(Optional<Expression> lower, Optional<Expression> upper, Optional<Expression> step)
        implements Slice {
        public SliceRange {
            lower = lower != null ? lower : Optional.empty();
            upper = upper != null ? upper : Optional.empty();
            step = step != null ? step : Optional.empty();
        }
    }

    // ==================== Arguments and parameters ====================

    public sealed interface CallArgument {
    }

    public record Arg(Expression value) implements CallArgument {
        public Arg {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** {@code *args}. */
    public record ArgStar(Expression value) implements CallArgument {
        public ArgStar {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** {@code **kwargs}. */
    public record ArgPow(Expression value) implements CallArgument {
        public ArgPow {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public record ArgKwd(Identifier name, Expression value) implements CallArgument {
        public ArgKwd {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Bare generator argument, {@code sum(x for x in xs)}. */
    public record ArgComp(Expression element, List<ForIf> clauses) implements CallArgument {
        public ArgComp {
            Objects.requireNonNull(element, "element must not be null");
            clauses = List.copyOf(clauses);
        }
    }

    public sealed interface Param {
    }

    /**
     * Regular parameter {@code name: type = default}.
     */
    public record ParamClassic(Identifier name, Optional<Expression> type, Optional<Expression> defaultValue)
        implements Param {
        public ParamClassic {
            Objects.requireNonNull(name, "name must not be null");
            type = type != null ? type : Optional.empty();
            defaultValue = defaultValue != null ? defaultValue : Optional.empty();
        }
    }

    /** {@code *args}. */
    public record ParamStar(Identifier name, Optional<Expression> type) implements Param {
        public ParamStar {
            Objects.requireNonNull(name, "name must not be null");
            type = type != null ? type : Optional.empty();
        }
    }

    /** {@code **kwargs}. */
    public record ParamPow(Identifier name, Optional<Expression> type) implements Param {
        public ParamPow {
            Objects.requireNonNull(name, "name must not be null");
            type = type != null ? type : Optional.empty();
        }
    }

    public record ParamEllipsis(Token token) implements Param {
        public ParamEllipsis {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** Lone {@code *} separating keyword-only parameters. */
    public record ParamSingleStar(Token token) implements Param {
        public ParamSingleStar {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    // ==================== Statements ====================

    public sealed interface Statement {
    }

    /**
     * Represents a Python function definition.
     *
     * <p>Example:
     * <pre>{@code
     * @app.route("/users")
     * def get_users(limit: int = 10) -> list:
     *     return []
     * }</pre>
     *
     * @param name function name
     * @param parameters parameters in declaration order
     * @param returns return annotation
     * @param body function body
     * @param decorators decorator expressions, outermost first
     */
    public record FunctionDef(
        Identifier name,
        List<Param> parameters,
        Optional<Expression> returns,
        List<Statement> body,
        List<Expression> decorators
    ) implements Statement {
        public FunctionDef {
            Objects.requireNonNull(name, "name must not be null");
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            returns = returns != null ? returns : Optional.empty();
            body = body != null ? List.copyOf(body) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
        }
    }

    /**
     * Represents a Python class definition.
     *
     * <p>Example:
     * <pre>{@code
     * @dataclass
     * class User(Base, metaclass=Meta):
     *     name: str
     * }</pre>
     *
     * @param name class name
     * @param bases base classes and keyword arguments such as {@code metaclass=}
     * @param body class body
     * @param decorators decorator expressions
     */
    public record ClassDef(
        Identifier name,
        List<CallArgument> bases,
        List<Statement> body,
        List<Expression> decorators
    ) implements Statement {
        public ClassDef {
            Objects.requireNonNull(name, "name must not be null");
            bases = bases != null ? List.copyOf(bases) : List.of();
            body = body != null ? List.copyOf(body) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
        }
    }

    /** {@code a = b = value}; the grammar guarantees at least one target. */
    public record Assign(List<Expression> targets, Token token, Expression value) implements Statement {
        public Assign {
            targets = List.copyOf(targets);
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public record AugAssign(Expression target, BinaryOperator op, Token token, Expression value) implements Statement {
        public AugAssign {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public record Return(Token token, Optional<Expression> value) implements Statement {
        public Return {
            Objects.requireNonNull(token, "token must not be null");
            value = value != null ? value : Optional.empty();
        }
    }

    public record Delete(Token token, List<Expression> targets) implements Statement {
        public Delete {
            Objects.requireNonNull(token, "token must not be null");
            targets = List.copyOf(targets);
        }
    }

    public record If(Token token, Expression test, List<Statement> body, List<Statement> orElse) implements Statement {
        public If {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(test, "test must not be null");
            body = List.copyOf(body);
            orElse = orElse != null ? List.copyOf(orElse) : List.of();
        }
    }

    public record While(Token token, Expression test, List<Statement> body, List<Statement> orElse)
        implements Statement {
        public While {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(test, "test must not be null");
            body = List.copyOf(body);
            orElse = orElse != null ? List.copyOf(orElse) : List.of();
        }
    }

    public record For(
        Token token,
        Expression target,
        Token in,
        Expression iter,
        List<Statement> body,
        List<Statement> orElse
    ) implements Statement {
        public For {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(in, "in must not be null");
            Objects.requireNonNull(iter, "iter must not be null");
            body = List.copyOf(body);
            orElse = orElse != null ? List.copyOf(orElse) : List.of();
        }
    }

    /** {@code with context as target: body}. */
    public record With(Token token, Expression context, Optional<Expression> target, List<Statement> body)
        implements Statement {
        public With {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(context, "context must not be null");
            target = target != null ? target : Optional.empty();
            body = List.copyOf(body);
        }
    }

    /**
     * {@code raise}, {@code raise exc} or {@code raise exc from cause}. A cause without an
     * exception cannot be parsed.
     */
    public record Raise(Token token, Optional<Expression> exception, Optional<Expression> cause)
        implements Statement {
        public Raise {
            Objects.requireNonNull(token, "token must not be null");
            exception = exception != null ? exception : Optional.empty();
            cause = cause != null ? cause : Optional.empty();
        }
    }

    public record TryExcept(Token token, List<Statement> body, List<ExceptHandler> handlers, List<Statement> orElse)
        implements Statement {
        public TryExcept {
            Objects.requireNonNull(token, "token must not be null");
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orElse = orElse != null ? List.copyOf(orElse) : List.of();
        }
    }

    /**
     * {@code except type as name: body}. A name without a type cannot be parsed.
     */
    public record ExceptHandler(Token token, Optional<Expression> type, Optional<Identifier> name,
                                List<Statement> body) {
        public ExceptHandler {
            Objects.requireNonNull(token, "token must not be null");
            type = type != null ? type : Optional.empty();
            name = name != null ? name : Optional.empty();
            body = List.copyOf(body);
        }
    }

    public record TryFinally(Token token, List<Statement> body, Token finallyToken, List<Statement> finalBody)
        implements Statement {
        public TryFinally {
            Objects.requireNonNull(token, "token must not be null");
            body = List.copyOf(body);
            Objects.requireNonNull(finallyToken, "finallyToken must not be null");
            finalBody = List.copyOf(finalBody);
        }
    }

    public record Assert(Token token, Expression test, Optional<Expression> message) implements Statement {
        public Assert {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(test, "test must not be null");
            message = message != null ? message : Optional.empty();
        }
    }

    /**
     * Module reference in an import. Leading dots make it relative:
     * {@code from ..pkg import x} has two dot tokens (or one {@code ..} token).
     *
     * @param dotted dotted module name, may be empty for {@code from . import x}
     * @param leadingDots relative-import dot tokens, empty for absolute imports
     */
    public record ModulePath(List<Identifier> dotted, List<Token> leadingDots) {
        public ModulePath {
            dotted = List.copyOf(dotted);
            leadingDots = leadingDots != null ? List.copyOf(leadingDots) : List.of();
        }

        public boolean isRelative() {
            return !leadingDots.isEmpty();
        }
    }

    /** {@code import a.b as c}. */
    public record ImportAs(Token token, ModulePath module, Optional<Identifier> alias) implements Statement {
        public ImportAs {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(module, "module must not be null");
            alias = alias != null ? alias : Optional.empty();
        }
    }

    /** {@code from a import *}. */
    public record ImportAll(Token token, ModulePath module, Token star) implements Statement {
        public ImportAll {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(star, "star must not be null");
        }
    }

    /** {@code from a import b as c, d}. */
    public record ImportFrom(Token token, ModulePath module, List<Alias> names) implements Statement {
        public ImportFrom {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(module, "module must not be null");
            names = List.copyOf(names);
        }
    }

    public record Alias(Identifier name, Optional<Identifier> asName) {
        public Alias {
            Objects.requireNonNull(name, "name must not be null");
            asName = asName != null ? asName : Optional.empty();
        }
    }

    public record Global(Token token, List<Identifier> names) implements Statement {
        public Global {
            Objects.requireNonNull(token, "token must not be null");
            names = List.copyOf(names);
        }
    }

    public record NonLocal(Token token, List<Identifier> names) implements Statement {
        public NonLocal {
            Objects.requireNonNull(token, "token must not be null");
            names = List.copyOf(names);
        }
    }

    public record ExprStmt(Expression value) implements Statement {
        public ExprStmt {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** {@code async def}, {@code async for} or {@code async with}. */
    public record Async(Token token, Statement statement) implements Statement {
        public Async {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(statement, "statement must not be null");
        }
    }

    public record Pass(Token token) implements Statement {
        public Pass {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    public record Break(Token token) implements Statement {
        public Break {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    public record Continue(Token token) implements Statement {
        public Continue {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** Python 2 {@code print >>dest, a, b,}. */
    public record Print(Token token, Optional<Expression> destination, List<Expression> values, boolean newline)
        implements Statement {
        public Print {
            Objects.requireNonNull(token, "token must not be null");
            destination = destination != null ? destination : Optional.empty();
            values = List.copyOf(values);
        }
    }

    /** Python 2 {@code exec code in globals, locals}. */
    public record Exec(Token token, Expression code, Optional<Expression> globals, Optional<Expression> locals)
        implements Statement {
        public Exec {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(code, "code must not be null");
            globals = globals != null ? globals : Optional.empty();
            locals = locals != null ? locals : Optional.empty();
        }
    }
}
