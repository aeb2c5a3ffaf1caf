package com.polyast.core.normalizer.python;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Argument;
import com.polyast.core.ast.AstHelpers;
import com.polyast.core.ast.Attribute;
import com.polyast.core.ast.Attribute.KeywordAttribute;
import com.polyast.core.ast.Bracket;
import com.polyast.core.ast.ClassDefinition;
import com.polyast.core.ast.Definition;
import com.polyast.core.ast.DefinitionKind;
import com.polyast.core.ast.Directive;
import com.polyast.core.ast.Entity;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.Field;
import com.polyast.core.ast.FieldIdent;
import com.polyast.core.ast.FunctionDefinition;
import com.polyast.core.ast.IdInfo;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Literal;
import com.polyast.core.ast.Location;
import com.polyast.core.ast.ModuleName;
import com.polyast.core.ast.Name;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.ParameterClassic;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.ResolvedName;
import com.polyast.core.ast.ResolvedName.ResolvedKind;
import com.polyast.core.ast.Special;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.Type;
import com.polyast.core.ast.Wrap;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.normalizer.AbstractNormalizer;
import com.polyast.core.normalizer.NormalizationException;
import com.polyast.core.normalizer.Normalizer;
import com.polyast.core.normalizer.NormalizerProvider;
import com.polyast.core.parser.ast.PythonAst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Translates {@link PythonAst} trees into the generic AST.
 *
 * <p>Notable encodings:
 * <ul>
 *   <li>operators become calls to {@link Special.Op}; {@code in}, {@code not in} and
 *       {@code ~} have no generic operator and become {@link Expr.OtherExpr}</li>
 *   <li>comparison chains {@code a < b < c} become {@code OtherExpr(CMP_OPS)} holding the
 *       left operand, the operators and the comparators</li>
 *   <li>comprehensions become {@code OtherExpr(COMP_FOR_IF)} inside their container</li>
 *   <li>the {@code else} of {@code for}, {@code while} and {@code try} follows the loop in
 *       a block, wrapped in {@link Stmt.OtherStmtWithStmt}</li>
 *   <li>relative imports become {@link ModuleName.FileName} paths ({@code from ..a import b}
 *       imports from {@code "../a"})</li>
 *   <li>Python 2 {@code print} and {@code exec} become ordinary calls</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PythonNormalizer extends AbstractNormalizer<PythonAst.Module> {

    public PythonNormalizer(SourceFile sourceFile) {
        super(Language.PYTHON, PythonAst.Module.class, sourceFile);
    }

    /**
     * SPI entry for {@link PythonNormalizer}.
     */
    public static class Provider implements NormalizerProvider {

        @Override
        public Language language() {
            return Language.PYTHON;
        }

        @Override
        public String getDisplayName() {
            return "Python";
        }

        @Override
        public Normalizer<?> create(SourceFile sourceFile) {
            return new PythonNormalizer(sourceFile);
        }
    }

    // ==================== Entry points ====================

    @Override
    public List<Stmt> program(PythonAst.Module root) {
        return statements(root.body());
    }

    @Override
    public Any any(Object fragment) {
        if (fragment instanceof PythonAst.Module module) {
            return Any.program(program(module));
        }
        if (fragment instanceof PythonAst.Statement statement) {
            return Any.of(stmt(statement));
        }
        if (fragment instanceof PythonAst.Expression expression) {
            return Any.of(expr(expression));
        }
        if (fragment instanceof PythonAst.DictOrSetElement element) {
            return Any.of(dictOrSetElement(element));
        }
        if (fragment instanceof List<?> list && list.stream().allMatch(PythonAst.Statement.class::isInstance)) {
            List<PythonAst.Statement> statements = list.stream().map(PythonAst.Statement.class::cast).toList();
            return new Any.AStmts(statements(statements));
        }
        throw new IllegalArgumentException("Not a Python AST fragment: "
            + (fragment == null ? "null" : fragment.getClass().getName()));
    }

    // ==================== Names ====================

    private static Ident ident(PythonAst.Identifier identifier) {
        return new Ident(identifier.value(), identifier.token());
    }

    private static List<Ident> dotted(List<PythonAst.Identifier> identifiers) {
        return identifiers.stream().map(PythonNormalizer::ident).toList();
    }

    private static Optional<ResolvedName> resolvedName(PythonAst.Resolution resolution) {
        ResolvedKind kind = null;
        if (resolution instanceof PythonAst.Resolution.LocalVar) {
            kind = new ResolvedKind.Local();
        } else if (resolution instanceof PythonAst.Resolution.Parameter) {
            kind = new ResolvedKind.Param();
        } else if (resolution instanceof PythonAst.Resolution.GlobalVar) {
            kind = new ResolvedKind.Global();
        } else if (resolution instanceof PythonAst.Resolution.ImportedModule module) {
            kind = new ResolvedKind.ImportedModule(new ModuleName.DottedName(dotted(module.dotted())));
        } else if (resolution instanceof PythonAst.Resolution.ImportedEntity entity) {
            kind = new ResolvedKind.ImportedEntity(dotted(entity.dotted()));
        }
        // ClassField and NotResolved carry no resolution
        return Optional.ofNullable(kind).map(ResolvedName::unresolved);
    }

    private ModuleName moduleName(PythonAst.ModulePath path) {
        List<Ident> names = dotted(path.dotted());
        if (!path.isRelative()) {
            if (names.isEmpty()) {
                throw new NormalizationException("Absolute import without a module name", null);
            }
            return new ModuleName.DottedName(names);
        }
        int count = path.leadingDots().stream().mapToInt(dot -> dot.text().length()).sum();
        List<String> parts = new ArrayList<>();
        if (count == 1) {
            parts.add(".");
        } else {
            parts.addAll(Collections.nCopies(Math.max(1, count - 1), ".."));
        }
        names.forEach(name -> parts.add(name.name()));
        return new ModuleName.FileName(Wrap.of(String.join("/", parts), path.leadingDots().get(0)));
    }

    // ==================== Expressions ====================

    Expr expr(PythonAst.Expression expression) {
        if (expression instanceof PythonAst.BoolLit bool) {
            return new Expr.Lit(new Literal.BoolLit(Wrap.of(bool.value(), bool.token())));
        }
        if (expression instanceof PythonAst.NoneLit none) {
            return new Expr.Lit(new Literal.NullLit(none.token()));
        }
        if (expression instanceof PythonAst.EllipsisLit ellipsis) {
            return new Expr.Ellipsis(ellipsis.token());
        }
        if (expression instanceof PythonAst.Num num) {
            return new Expr.Lit(number(num));
        }
        if (expression instanceof PythonAst.Str str) {
            return AstHelpers.stringLiteral(str.value(), str.token());
        }
        if (expression instanceof PythonAst.EncodedStr encoded) {
            return AstHelpers.specialCall(new Special.EncodedString(encoded.prefix()), encoded.token(),
                List.of(AstHelpers.arg(AstHelpers.stringLiteral(encoded.value(), encoded.token()))));
        }
        if (expression instanceof PythonAst.InterpolatedString interpolated) {
            return AstHelpers.specialCall(Special.Builtin.CONCAT, Token.fake("concat"),
                interpolated.parts().stream().map(part -> AstHelpers.arg(expr(part))).toList());
        }
        if (expression instanceof PythonAst.TypedExpr typed) {
            return new Expr.Cast(type(typed.type()), expr(typed.expr()));
        }
        if (expression instanceof PythonAst.TypedMetavar metavar) {
            return new Expr.TypedMetavar(ident(metavar.name()), metavar.colon(), type(metavar.type()));
        }
        if (expression instanceof PythonAst.ExprStar star) {
            return spread(expr(star.expr()));
        }
        if (expression instanceof PythonAst.Name name) {
            IdInfo info = resolvedName(name.resolution()).map(IdInfo::resolvedAs).orElseGet(IdInfo::empty);
            return new Expr.Id(ident(name.id()), info);
        }
        if (expression instanceof PythonAst.TupleExpr tuple) {
            if (tuple.elements() instanceof PythonAst.CompList<PythonAst.Expression> list) {
                return new Expr.Tuple(exprs(list.elements()));
            }
            return new Expr.Tuple(List.of(comprehension((PythonAst.CompForIf<PythonAst.Expression>) tuple.elements())));
        }
        if (expression instanceof PythonAst.ListExpr listExpr) {
            return new Expr.Container(Expr.ContainerKind.LIST, display(listExpr.elements(), this::expr));
        }
        if (expression instanceof PythonAst.DictOrSet dict) {
            return new Expr.Container(Expr.ContainerKind.DICT, display(dict.elements(), this::dictOrSetElement));
        }
        if (expression instanceof PythonAst.Subscript subscript) {
            Expr value = expr(subscript.value());
            if (subscript.slices().size() == 1) {
                return slice(value, subscript.slices().get(0));
            }
            return new Expr.OtherExpr(Expr.OtherExprOp.SLICES,
                subscript.slices().stream().map(slice -> Any.of(slice(value, slice))).toList());
        }
        if (expression instanceof PythonAst.Attribute attribute) {
            return new Expr.DotAccess(expr(attribute.value()), attribute.dot(), new FieldIdent.FId(ident(attribute.attr())));
        }
        if (expression instanceof PythonAst.BoolOp boolOp) {
            Operator operator = boolOp.op() == PythonAst.BoolOperator.AND ? Operator.AND : Operator.OR;
            return AstHelpers.opCall(operator, boolOp.token(), exprs(boolOp.values()));
        }
        if (expression instanceof PythonAst.BinOp binOp) {
            return AstHelpers.opCall(operator(binOp.op()), binOp.token(),
                List.of(expr(binOp.left()), expr(binOp.right())));
        }
        if (expression instanceof PythonAst.UnaryOp unaryOp) {
            return unary(unaryOp);
        }
        if (expression instanceof PythonAst.Compare compare) {
            return compare(compare);
        }
        if (expression instanceof PythonAst.Call call) {
            return new Expr.Call(expr(call.func()),
                Bracket.fake(call.arguments().stream().map(this::argument).toList()));
        }
        if (expression instanceof PythonAst.Lambda lambda) {
            Stmt body = new Stmt.ExprStmt(expr(lambda.body()), Token.fake(""));
            return new Expr.Lambda(new FunctionDefinition(parameters(lambda.parameters()), Optional.empty(), body));
        }
        if (expression instanceof PythonAst.IfExp ifExp) {
            return new Expr.Conditional(expr(ifExp.test()), expr(ifExp.body()), expr(ifExp.orElse()));
        }
        if (expression instanceof PythonAst.Yield yield) {
            return new Expr.Yield(yield.token(), yield.value().map(this::expr), yield.from());
        }
        if (expression instanceof PythonAst.Await await) {
            return new Expr.Await(await.token(), expr(await.value()));
        }
        if (expression instanceof PythonAst.Repr repr) {
            return new Expr.OtherExpr(Expr.OtherExprOp.REPR, List.of(Any.of(expr(repr.value()))));
        }
        throw new IllegalArgumentException("Unknown Python expression: " + expression.getClass().getName());
    }

    private List<Expr> exprs(List<PythonAst.Expression> expressions) {
        return expressions.stream().map(this::expr).toList();
    }

    private static Literal number(PythonAst.Num num) {
        Wrap<String> text = Wrap.of(num.text(), num.token());
        return switch (num.kind()) {
            case INT, LONG_INT -> new Literal.IntLit(text);
            case FLOAT -> new Literal.FloatLit(text);
            case IMAG -> new Literal.ImagLit(text);
        };
    }

    private static Operator operator(PythonAst.BinaryOperator operator) {
        return switch (operator) {
            case ADD -> Operator.PLUS;
            case SUB -> Operator.MINUS;
            case MULT -> Operator.MULT;
            case DIV -> Operator.DIV;
            case MOD -> Operator.MOD;
            case POW -> Operator.POW;
            case FLOOR_DIV -> Operator.FLOOR_DIV;
            case L_SHIFT -> Operator.LSL;
            case R_SHIFT -> Operator.ASR;
            case BIT_OR -> Operator.BIT_OR;
            case BIT_XOR -> Operator.BIT_XOR;
            case BIT_AND -> Operator.BIT_AND;
            case MAT_MULT -> Operator.MAT_MULT;
        };
    }

    private Expr unary(PythonAst.UnaryOp unaryOp) {
        Expr operand = expr(unaryOp.operand());
        return switch (unaryOp.op()) {
            case INVERT -> new Expr.OtherExpr(Expr.OtherExprOp.INVERT, List.of(Any.of(unaryOp.token()), Any.of(operand)));
            case NOT -> AstHelpers.opCall(Operator.NOT, unaryOp.token(), List.of(operand));
            case U_ADD -> AstHelpers.opCall(Operator.PLUS, unaryOp.token(), List.of(operand));
            case U_SUB -> AstHelpers.opCall(Operator.MINUS, unaryOp.token(), List.of(operand));
        };
    }

    /**
     * Returns the generic operator of a comparison, or empty for {@code in} and
     * {@code not in}, which are membership tests rather than operators.
     */
    private static Optional<Operator> comparison(PythonAst.CmpOperator operator) {
        return switch (operator) {
            case EQ -> Optional.of(Operator.EQ);
            case NOT_EQ -> Optional.of(Operator.NOT_EQ);
            case LT -> Optional.of(Operator.LT);
            case LT_E -> Optional.of(Operator.LT_E);
            case GT -> Optional.of(Operator.GT);
            case GT_E -> Optional.of(Operator.GT_E);
            case IS -> Optional.of(Operator.PHYS_EQ);
            case IS_NOT -> Optional.of(Operator.NOT_PHYS_EQ);
            case IN, NOT_IN -> Optional.empty();
        };
    }

    private static Expr.OtherExprOp membership(PythonAst.CmpOperator operator) {
        return operator == PythonAst.CmpOperator.IN ? Expr.OtherExprOp.IN : Expr.OtherExprOp.NOT_IN;
    }

    private Expr compare(PythonAst.Compare compare) {
        Expr left = expr(compare.left());
        List<Expr> comparators = exprs(compare.comparators());
        if (compare.ops().size() != comparators.size() || comparators.isEmpty()) {
            throw new NormalizationException("Comparison with " + compare.ops().size() + " operators and "
                + comparators.size() + " operands", locationOf(compare.left()));
        }
        if (comparators.size() == 1) {
            PythonAst.CompareOp op = compare.ops().get(0);
            Optional<Operator> operator = comparison(op.op());
            if (operator.isPresent()) {
                return AstHelpers.opCall(operator.get(), op.token(), List.of(left, comparators.get(0)));
            }
            return new Expr.OtherExpr(membership(op.op()),
                List.of(Any.of(op.token()), Any.of(left), Any.of(comparators.get(0))));
        }
        List<Any> payload = new ArrayList<>();
        payload.add(Any.of(left));
        for (PythonAst.CompareOp op : compare.ops()) {
            Optional<Operator> operator = comparison(op.op());
            payload.add(Any.of(operator.<Expr>map(o -> Expr.IdSpecial.of(new Special.Op(o), op.token()))
                .orElseGet(() -> new Expr.OtherExpr(membership(op.op()), List.of(Any.of(op.token()))))));
        }
        comparators.forEach(comparator -> payload.add(Any.of(comparator)));
        return new Expr.OtherExpr(Expr.OtherExprOp.CMP_OPS, payload);
    }

    private static Expr spread(Expr value) {
        return AstHelpers.specialCall(Special.Builtin.SPREAD, Token.fake("spread"), List.of(AstHelpers.arg(value)));
    }

    private <T> Bracket<List<Expr>> display(PythonAst.Comprehension<T> elements,
                                            Function<T, Expr> element) {
        if (elements instanceof PythonAst.CompList<T> list) {
            return new Bracket<>(list.open(), list.elements().stream().map(element).toList(), list.close());
        }
        PythonAst.CompForIf<T> comprehension = (PythonAst.CompForIf<T>) elements;
        return Bracket.fake(List.of(comprehension(element.apply(comprehension.element()), comprehension.clauses())));
    }

    private Expr comprehension(PythonAst.CompForIf<PythonAst.Expression> comprehension) {
        return comprehension(expr(comprehension.element()), comprehension.clauses());
    }

    private Expr comprehension(Expr element, List<PythonAst.ForIf> clauses) {
        List<Any> payload = new ArrayList<>();
        payload.add(Any.of(element));
        clauses.forEach(clause -> payload.add(forIf(clause)));
        return new Expr.OtherExpr(Expr.OtherExprOp.COMP_FOR_IF, payload);
    }

    private Any forIf(PythonAst.ForIf clause) {
        if (clause instanceof PythonAst.CompFor compFor) {
            return Any.of(new Expr.OtherExpr(Expr.OtherExprOp.COMP_FOR,
                List.of(Any.of(expr(compFor.target())), Any.of(expr(compFor.iter())))));
        }
        PythonAst.CompIf compIf = (PythonAst.CompIf) clause;
        return Any.of(new Expr.OtherExpr(Expr.OtherExprOp.COMP_IF, List.of(Any.of(expr(compIf.test())))));
    }

    private Expr dictOrSetElement(PythonAst.DictOrSetElement element) {
        if (element instanceof PythonAst.KeyVal keyVal) {
            return new Expr.Tuple(List.of(expr(keyVal.key()), expr(keyVal.value())));
        }
        if (element instanceof PythonAst.Key key) {
            return expr(key.key());
        }
        return spread(expr(((PythonAst.PowInline) element).value()));
    }

    private Expr slice(Expr value, PythonAst.Slice slice) {
        if (slice instanceof PythonAst.Index index) {
            return new Expr.ArrayAccess(value, expr(index.value()));
        }
        PythonAst.SliceRange range = (PythonAst.SliceRange) slice;
        return new Expr.SliceAccess(value, range.lower().map(this::expr), range.upper().map(this::expr),
            range.step().map(this::expr));
    }

    private Argument argument(PythonAst.CallArgument argument) {
        if (argument instanceof PythonAst.Arg arg) {
            return AstHelpers.arg(expr(arg.value()));
        }
        if (argument instanceof PythonAst.ArgStar star) {
            return AstHelpers.arg(spread(expr(star.value())));
        }
        if (argument instanceof PythonAst.ArgPow pow) {
            return new Argument.ArgOther(Argument.OtherArgumentOp.ARG_POW, List.of(Any.of(expr(pow.value()))));
        }
        if (argument instanceof PythonAst.ArgKwd kwd) {
            return new Argument.ArgKwd(ident(kwd.name()), expr(kwd.value()));
        }
        PythonAst.ArgComp comp = (PythonAst.ArgComp) argument;
        List<Any> payload = new ArrayList<>();
        payload.add(Any.of(expr(comp.element())));
        comp.clauses().forEach(clause -> payload.add(forIf(clause)));
        return new Argument.ArgOther(Argument.OtherArgumentOp.ARG_COMP, payload);
    }

    // ==================== Types and parameters ====================

    private Type type(PythonAst.Expression expression) {
        return AstHelpers.exprToType(expr(expression));
    }

    private Type typeParent(PythonAst.CallArgument argument) {
        return new Type.OtherType(Type.OtherTypeOp.ARG, List.of(new Any.AArg(argument(argument))));
    }

    private List<Parameter> parameters(List<PythonAst.Param> parameters) {
        return parameters.stream().map(this::parameter).toList();
    }

    private Parameter parameter(PythonAst.Param parameter) {
        if (parameter instanceof PythonAst.ParamClassic classic) {
            ParameterClassic base = AstHelpers.paramOfId(ident(classic.name()));
            return new Parameter.ParamClassic(new ParameterClassic(base.name(), classic.type().map(this::type),
                classic.defaultValue().map(this::expr), List.of(), base.info()));
        }
        if (parameter instanceof PythonAst.ParamStar star) {
            ParameterClassic base = AstHelpers.paramOfId(ident(star.name()));
            return new Parameter.ParamClassic(new ParameterClassic(base.name(), star.type().map(this::type),
                Optional.empty(), List.of(Attribute.KeywordAttr.of(KeywordAttribute.VARIADIC, Token.fake("..."))),
                base.info()));
        }
        if (parameter instanceof PythonAst.ParamPow pow) {
            List<Any> payload = new ArrayList<>();
            payload.add(Any.of(ident(pow.name())));
            pow.type().ifPresent(type -> payload.add(Any.of(type(type))));
            return new Parameter.OtherParam(Parameter.OtherParameterOp.KWD_PARAM, payload);
        }
        if (parameter instanceof PythonAst.ParamEllipsis ellipsis) {
            return new Parameter.ParamEllipsis(ellipsis.token());
        }
        PythonAst.ParamSingleStar star = (PythonAst.ParamSingleStar) parameter;
        return new Parameter.OtherParam(Parameter.OtherParameterOp.SINGLE_STAR_PARAM, List.of(Any.of(star.token())));
    }

    // ==================== Statements ====================

    private List<Stmt> statements(List<PythonAst.Statement> statements) {
        List<Stmt> result = new ArrayList<>();
        statements.forEach(statement -> result.addAll(stmtAux(statement)));
        return result;
    }

    Stmt stmt(PythonAst.Statement statement) {
        return AstHelpers.stmt1(stmtAux(statement));
    }

    /**
     * Translates a suite. The block is kept even around a single statement, except
     * around a lone identifier statement so that a metavariable body still matches a
     * statement sequence.
     */
    private Stmt body(List<PythonAst.Statement> statements) {
        List<Stmt> stmts = statements(statements);
        if (stmts.size() == 1 && stmts.get(0) instanceof Stmt.ExprStmt exprStmt && exprStmt.expr() instanceof Expr.Id) {
            return exprStmt;
        }
        return Stmt.Block.of(stmts);
    }

    private List<Stmt> stmtAux(PythonAst.Statement statement) {
        if (statement instanceof PythonAst.FunctionDef function) {
            Entity entity = AstHelpers.basicEntity(ident(function.name()), decorators(function.decorators()));
            FunctionDefinition definition = new FunctionDefinition(parameters(function.parameters()),
                function.returns().map(this::type), body(function.body()));
            return List.of(new Stmt.DefStmt(new Definition(entity, new DefinitionKind.FuncDef(definition))));
        }
        if (statement instanceof PythonAst.ClassDef classDef) {
            Entity entity = AstHelpers.basicEntity(ident(classDef.name()), decorators(classDef.decorators()));
            List<Field> fields = statements(classDef.body()).stream().<Field>map(Field.FieldStmt::new).toList();
            ClassDefinition definition = new ClassDefinition(Wrap.fake(ClassDefinition.ClassKind.CLASS),
                classDef.bases().stream().map(this::typeParent).toList(), List.of(), List.of(), Bracket.fake(fields));
            return List.of(new Stmt.DefStmt(new Definition(entity, new DefinitionKind.ClassDef(definition))));
        }
        if (statement instanceof PythonAst.Assign assign) {
            List<Expr> targets = exprs(assign.targets());
            if (targets.isEmpty()) {
                throw new NormalizationException("Assignment without a target", assign.token().location());
            }
            Expr target = targets.size() == 1 ? targets.get(0) : new Expr.Tuple(targets);
            return List.of(exprStmt(new Expr.Assign(target, assign.token(), expr(assign.value()))));
        }
        if (statement instanceof PythonAst.AugAssign augAssign) {
            return List.of(exprStmt(new Expr.AssignOp(expr(augAssign.target()),
                Wrap.of(operator(augAssign.op()), augAssign.token()), expr(augAssign.value()))));
        }
        if (statement instanceof PythonAst.Return ret) {
            return List.of(new Stmt.Return(ret.token(), ret.value().map(this::expr)));
        }
        if (statement instanceof PythonAst.Delete delete) {
            List<Any> payload = new ArrayList<>();
            payload.add(Any.of(delete.token()));
            delete.targets().forEach(target -> payload.add(Any.of(expr(target))));
            return List.of(new Stmt.OtherStmt(Stmt.OtherStmtOp.DELETE, payload));
        }
        if (statement instanceof PythonAst.If ifStmt) {
            Optional<Stmt> orElse = ifStmt.orElse().isEmpty() ? Optional.empty() : Optional.of(body(ifStmt.orElse()));
            return List.of(new Stmt.If(ifStmt.token(), expr(ifStmt.test()), body(ifStmt.body()), orElse));
        }
        if (statement instanceof PythonAst.While whileStmt) {
            Stmt loop = new Stmt.While(whileStmt.token(), expr(whileStmt.test()), body(whileStmt.body()));
            return List.of(withElse(loop, Stmt.OtherStmtWithStmtOp.WHILE_OR_ELSE, whileStmt.orElse()));
        }
        if (statement instanceof PythonAst.For forStmt) {
            Stmt.ForHeader header = new Stmt.ForHeader.ForEach(AstHelpers.exprToPattern(expr(forStmt.target())),
                forStmt.in(), expr(forStmt.iter()));
            Stmt loop = new Stmt.For(forStmt.token(), header, body(forStmt.body()));
            return List.of(withElse(loop, Stmt.OtherStmtWithStmtOp.FOR_OR_ELSE, forStmt.orElse()));
        }
        if (statement instanceof PythonAst.With with) {
            Expr context = expr(with.context());
            Expr value = with.target()
                .<Expr>map(target -> new Expr.LetPattern(AstHelpers.exprToPattern(expr(target)), context))
                .orElse(context);
            return List.of(new Stmt.OtherStmtWithStmt(Stmt.OtherStmtWithStmtOp.WITH, value, body(with.body())));
        }
        if (statement instanceof PythonAst.Raise raise) {
            return List.of(raise(raise));
        }
        if (statement instanceof PythonAst.TryExcept tryExcept) {
            List<Stmt.Catch> catches = tryExcept.handlers().stream().map(this::exceptHandler).toList();
            Stmt tryStmt = new Stmt.Try(tryExcept.token(), body(tryExcept.body()), catches, Optional.empty());
            return List.of(withElse(tryStmt, Stmt.OtherStmtWithStmtOp.TRY_OR_ELSE, tryExcept.orElse()));
        }
        if (statement instanceof PythonAst.TryFinally tryFinally) {
            return List.of(new Stmt.Try(tryFinally.token(), body(tryFinally.body()), List.of(),
                Optional.of(new Stmt.Finally(tryFinally.finallyToken(), body(tryFinally.finalBody())))));
        }
        if (statement instanceof PythonAst.Assert assertStmt) {
            return List.of(new Stmt.Assert(assertStmt.token(), expr(assertStmt.test()),
                assertStmt.message().map(this::expr)));
        }
        if (statement instanceof PythonAst.ImportAs importAs) {
            return List.of(new Stmt.DirectiveStmt(new Directive.ImportAs(importAs.token(),
                moduleName(importAs.module()), importAs.alias().map(PythonNormalizer::ident))));
        }
        if (statement instanceof PythonAst.ImportAll importAll) {
            return List.of(new Stmt.DirectiveStmt(new Directive.ImportAll(importAll.token(),
                moduleName(importAll.module()), importAll.star())));
        }
        if (statement instanceof PythonAst.ImportFrom importFrom) {
            ModuleName module = moduleName(importFrom.module());
            return importFrom.names().stream()
                .<Stmt>map(alias -> new Stmt.DirectiveStmt(new Directive.ImportFrom(importFrom.token(), module,
                    ident(alias.name()), alias.asName().map(PythonNormalizer::ident))))
                .toList();
        }
        if (statement instanceof PythonAst.Global global) {
            return outerDeclarations(global.token(), global.names());
        }
        if (statement instanceof PythonAst.NonLocal nonLocal) {
            return outerDeclarations(nonLocal.token(), nonLocal.names());
        }
        if (statement instanceof PythonAst.ExprStmt exprStmt) {
            return List.of(exprStmt(expr(exprStmt.value())));
        }
        if (statement instanceof PythonAst.Async async) {
            return List.of(async(async));
        }
        if (statement instanceof PythonAst.Pass pass) {
            return List.of(new Stmt.OtherStmt(Stmt.OtherStmtOp.PASS, List.of(Any.of(pass.token()))));
        }
        if (statement instanceof PythonAst.Break breakStmt) {
            return List.of(new Stmt.Break(breakStmt.token(), new Stmt.LabelIdent.LNone()));
        }
        if (statement instanceof PythonAst.Continue continueStmt) {
            return List.of(new Stmt.Continue(continueStmt.token(), new Stmt.LabelIdent.LNone()));
        }
        if (statement instanceof PythonAst.Print print) {
            List<Argument> arguments = new ArrayList<>();
            print.values().forEach(value -> arguments.add(AstHelpers.arg(expr(value))));
            print.destination().ifPresent(destination ->
                arguments.add(new Argument.ArgKwd(Ident.fake("file"), expr(destination))));
            return List.of(exprStmt(builtinCall("print", print.token(), arguments)));
        }
        if (statement instanceof PythonAst.Exec exec) {
            List<Argument> arguments = new ArrayList<>();
            arguments.add(AstHelpers.arg(expr(exec.code())));
            exec.globals().ifPresent(globals -> arguments.add(AstHelpers.arg(expr(globals))));
            exec.locals().ifPresent(locals -> arguments.add(AstHelpers.arg(expr(locals))));
            return List.of(exprStmt(builtinCall("exec", exec.token(), arguments)));
        }
        throw new IllegalArgumentException("Unknown Python statement: " + statement.getClass().getName());
    }

    private static Stmt exprStmt(Expr expr) {
        return new Stmt.ExprStmt(expr, Token.fake(""));
    }

    private static Expr builtinCall(String name, Token token, List<Argument> arguments) {
        return new Expr.Call(Expr.Id.of(new Ident(name, token)), Bracket.fake(arguments));
    }

    private Stmt withElse(Stmt main, Stmt.OtherStmtWithStmtOp op, List<PythonAst.Statement> orElse) {
        if (orElse.isEmpty()) {
            return main;
        }
        Expr elseKeyword = new Expr.Lit(new Literal.UnitLit(Token.fake("else")));
        return Stmt.Block.of(List.of(main, new Stmt.OtherStmtWithStmt(op, elseKeyword, body(orElse))));
    }

    private Stmt raise(PythonAst.Raise raise) {
        if (raise.exception().isEmpty()) {
            if (raise.cause().isPresent()) {
                throw new NormalizationException("raise ... from without an exception", raise.token().location());
            }
            return new Stmt.OtherStmt(Stmt.OtherStmtOp.THROW_NOTHING, List.of(Any.of(raise.token())));
        }
        Expr exception = expr(raise.exception().get());
        if (raise.cause().isEmpty()) {
            return new Stmt.Throw(raise.token(), exception);
        }
        return new Stmt.OtherStmt(Stmt.OtherStmtOp.THROW_FROM,
            List.of(Any.of(raise.token()), Any.of(exception), Any.of(expr(raise.cause().get()))));
    }

    private Stmt.Catch exceptHandler(PythonAst.ExceptHandler handler) {
        Pattern pattern;
        if (handler.type().isPresent()) {
            Pattern type = AstHelpers.exprToPattern(expr(handler.type().get()));
            pattern = handler.name()
                .<Pattern>map(name -> new Pattern.PatAs(type, ident(name), IdInfo.empty()))
                .orElse(type);
        } else if (handler.name().isEmpty()) {
            pattern = new Pattern.PatUnderscore(Token.fake("_"));
        } else {
            throw new NormalizationException("except clause binds a name without a type", handler.token().location());
        }
        return new Stmt.Catch(handler.token(), pattern, body(handler.body()));
    }

    private List<Stmt> outerDeclarations(Token token, List<PythonAst.Identifier> names) {
        return names.stream()
            .<Stmt>map(name -> new Stmt.DefStmt(new Definition(AstHelpers.basicEntity(ident(name)),
                new DefinitionKind.UseOuterDecl(token))))
            .toList();
    }

    private Stmt async(PythonAst.Async async) {
        Stmt inner = stmt(async.statement());
        if (inner instanceof Stmt.DefStmt defStmt) {
            Entity entity = defStmt.definition().entity();
            List<Attribute> attributes = new ArrayList<>();
            attributes.add(Attribute.KeywordAttr.of(KeywordAttribute.ASYNC, async.token()));
            attributes.addAll(entity.attributes());
            Entity asyncEntity = new Entity(entity.name(), attributes, entity.typeParameters(), entity.info());
            return new Stmt.DefStmt(new Definition(asyncEntity, defStmt.definition().kind()));
        }
        return new Stmt.OtherStmtWithStmt(Stmt.OtherStmtWithStmtOp.ASYNC,
            new Expr.Lit(new Literal.UnitLit(async.token())), inner);
    }

    // ==================== Decorators ====================

    private List<Attribute> decorators(List<PythonAst.Expression> decorators) {
        return decorators.stream().map(this::decorator).toList();
    }

    private Attribute decorator(PythonAst.Expression decorator) {
        Expr value = expr(decorator);
        if (value instanceof Expr.Call call && call.function() instanceof Expr.Id id) {
            return new Attribute.NamedAttr(Token.fake("@"), Name.of(id.ident()), id.info(), call.arguments());
        }
        logFallback("attribute", decorator);
        return new Attribute.OtherAttribute(Attribute.OtherAttributeOp.EXPR, List.of(Any.of(value)));
    }

    private static Location locationOf(PythonAst.Expression expression) {
        if (expression instanceof PythonAst.Name name) {
            return name.id().token().location();
        }
        return null;
    }
}
