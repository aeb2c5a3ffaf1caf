package com.polyast.core.ast;

import com.polyast.core.ast.Attribute.KeywordAttr;
import com.polyast.core.ast.Attribute.KeywordAttribute;
import com.polyast.core.ast.ResolvedName.ResolvedKind;

import java.util.List;
import java.util.Optional;

/**
 * Construction and conversion helpers shared by the language normalizers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Expr sum = AstHelpers.opCall(Operator.PLUS, plusToken, List.of(left, right));
 * Pattern target = AstHelpers.exprToPattern(sum);   // OtherPat(EXPR, [sum])
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AstHelpers {

    /**
     * Name of the synthetic variable that holds a destructuring declaration such as
     * JavaScript {@code var [a, b] = xs}. The variable's initializer is an
     * {@link Expr.Assign} from the pattern to the value.
     */
    public static final String SPECIAL_MULTIVARDEF_PATTERN = "!MultiVarDef!";

    private AstHelpers() {
        // Utility class - no instantiation
    }

    /**
     * Thrown by {@link #patternToExpr} when a pattern has no expression counterpart.
     */
    public static class NotAnExprException extends RuntimeException {
        private final transient Pattern pattern;

        public NotAnExprException(Pattern pattern) {
            super("Pattern has no expression form: " + pattern.getClass().getSimpleName());
            this.pattern = pattern;
        }

        public Pattern pattern() {
            return pattern;
        }
    }

    // ==================== Entities and parameters ====================

    public static Entity basicEntity(Ident name, List<Attribute> attributes) {
        return new Entity(name, attributes, List.of(), IdInfo.empty());
    }

    public static Entity basicEntity(Ident name) {
        return basicEntity(name, List.of());
    }

    /**
     * Builds a classic parameter bound to {@code name}, pre-resolved as a parameter.
     */
    public static ParameterClassic paramOfId(Ident name) {
        return new ParameterClassic(
            Optional.of(name), Optional.empty(), Optional.empty(), List.of(),
            IdInfo.resolvedAs(ResolvedName.unresolved(new ResolvedKind.Param())));
    }

    /**
     * Builds an unnamed parameter of the given type.
     */
    public static ParameterClassic paramOfType(Type type) {
        return new ParameterClassic(Optional.empty(), Optional.of(type), Optional.empty(), List.of(), IdInfo.empty());
    }

    public static Field basicField(Ident name, Optional<Expr> initializer, Optional<Type> type) {
        Definition definition = new Definition(basicEntity(name),
            new DefinitionKind.VarDef(new VariableDefinition(initializer, type)));
        return new Field.FieldStmt(new Stmt.DefStmt(definition));
    }

    // ==================== Expressions ====================

    /**
     * Encodes an operator application as a call to the operator special.
     */
    public static Expr opCall(Operator operator, Token token, List<Expr> operands) {
        return specialCall(new Special.Op(operator), token, operands.stream().map(AstHelpers::arg).toList());
    }

    public static Expr specialCall(Special special, Token token, List<Argument> arguments) {
        return new Expr.Call(Expr.IdSpecial.of(special, token), Bracket.fake(arguments));
    }

    public static Argument arg(Expr expr) {
        return new Argument.Arg(expr);
    }

    public static Expr id(Ident ident) {
        return Expr.Id.of(ident);
    }

    public static Expr stringLiteral(String value, Token token) {
        return new Expr.Lit(new Literal.StringLit(new Wrap<>(value, token)));
    }

    public static boolean isBooleanOperator(Operator operator) {
        return operator.isBoolean();
    }

    // ==================== Conversions ====================

    /**
     * Reinterprets an expression in pattern position, e.g. an assignment target used as
     * a for-each binder or a switch case label.
     *
     * <p>Identifiers, tuples, literals and list containers have direct counterparts;
     * anything else is wrapped in {@code OtherPat(EXPR, [expr])}.
     */
    public static Pattern exprToPattern(Expr expr) {
        if (expr instanceof Expr.Id id) {
            return new Pattern.PatId(id.ident(), id.info());
        }
        if (expr instanceof Expr.Tuple tuple) {
            return new Pattern.PatTuple(tuple.elements().stream().map(AstHelpers::exprToPattern).toList());
        }
        if (expr instanceof Expr.Lit lit) {
            return new Pattern.PatLiteral(lit.literal());
        }
        if (expr instanceof Expr.Container container && container.kind() == Expr.ContainerKind.LIST) {
            Bracket<List<Expr>> elements = container.elements();
            return new Pattern.PatList(elements.withValue(
                elements.value().stream().map(AstHelpers::exprToPattern).toList()));
        }
        return new Pattern.OtherPat(Pattern.OtherPatternOp.EXPR, List.of(Any.of(expr)));
    }

    /**
     * Inverse of {@link #exprToPattern} for the shapes that have an expression form.
     *
     * @throws NotAnExprException for any other pattern
     */
    public static Expr patternToExpr(Pattern pattern) {
        if (pattern instanceof Pattern.PatId patId) {
            return new Expr.Id(patId.ident(), patId.info());
        }
        if (pattern instanceof Pattern.PatTuple tuple) {
            return new Expr.Tuple(tuple.elements().stream().map(AstHelpers::patternToExpr).toList());
        }
        if (pattern instanceof Pattern.PatLiteral literal) {
            return new Expr.Lit(literal.literal());
        }
        if (pattern instanceof Pattern.PatList list) {
            Bracket<List<Pattern>> elements = list.elements();
            return new Expr.Container(Expr.ContainerKind.LIST,
                elements.withValue(elements.value().stream().map(AstHelpers::patternToExpr).toList()));
        }
        if (pattern instanceof Pattern.OtherPat other && other.op() == Pattern.OtherPatternOp.EXPR
            && other.payload().size() == 1 && other.payload().get(0) instanceof Any.AExpr wrapped) {
            return wrapped.expr();
        }
        throw new NotAnExprException(pattern);
    }

    public static Type exprToType(Expr expr) {
        return new Type.OtherType(Type.OtherTypeOp.EXPR, List.of(Any.of(expr)));
    }

    /**
     * Collapses a statement list into one statement: empty becomes an empty block, a
     * singleton is returned as is, anything longer becomes a block.
     */
    public static Stmt stmt1(List<Stmt> stmts) {
        if (stmts.size() == 1) {
            return stmts.get(0);
        }
        return Stmt.Block.of(stmts);
    }

    public static Stmt.LabelIdent optToLabelIdent(Optional<Ident> label) {
        return label.<Stmt.LabelIdent>map(Stmt.LabelIdent.LId::new).orElseGet(Stmt.LabelIdent.LNone::new);
    }

    /**
     * Rewrites {@code var x = e} as the assignment {@code x = e}; a missing initializer
     * assigns a fake {@code null}.
     */
    public static Expr vardefToAssign(Entity entity, VariableDefinition definition) {
        Expr value = definition.initializer()
            .orElseGet(() -> new Expr.Lit(new Literal.NullLit(Token.fake("null"))));
        return new Expr.Assign(new Expr.Id(entity.name(), entity.info()), Token.fake("="), value);
    }

    /**
     * Rewrites {@code function f(...) {...}} as the assignment {@code f = lambda}.
     */
    public static Expr funcdefToLambda(Entity entity, FunctionDefinition function) {
        return new Expr.Assign(new Expr.Id(entity.name(), entity.info()), Token.fake("="),
            new Expr.Lambda(function));
    }

    public static boolean hasKeywordAttr(KeywordAttribute keyword, List<Attribute> attributes) {
        return attributes.stream()
            .anyMatch(attribute -> attribute instanceof KeywordAttr kw && kw.keyword().value() == keyword);
    }
}
