package com.polyast.core.ast.visitor;

import com.polyast.core.ast.Action;
import com.polyast.core.ast.Any;
import com.polyast.core.ast.Argument;
import com.polyast.core.ast.Attribute;
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
import com.polyast.core.ast.MacroDefinition;
import com.polyast.core.ast.ModuleDefinition;
import com.polyast.core.ast.ModuleName;
import com.polyast.core.ast.Name;
import com.polyast.core.ast.NameInfo;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.ParameterClassic;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.ResolvedName;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.Type;
import com.polyast.core.ast.TypeArgument;
import com.polyast.core.ast.TypeDefinition;
import com.polyast.core.ast.TypeParameter;
import com.polyast.core.ast.VariableDefinition;
import com.polyast.core.ast.Wrap;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Rebuilds the generic AST bottom-up, applying {@link MapperHooks} at every node.
 *
 * <p>{@link IdInfo} cells are rebuilt once per identity: every occurrence of a cell in
 * the input maps to the same new cell, including the tokens held by its type and
 * constant slots. The table lives for one top-level {@link #map(Any)} call.
 */
final class GenericMapper implements Mapper {

    private final MapperHooks hooks;
    private final Map<IdInfo, IdInfo> idInfos = new IdentityHashMap<>();
    private int depth;

    GenericMapper(MapperHooks hooks) {
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
    }

    @Override
    public Any map(Any any) {
        if (depth++ == 0) {
            idInfos.clear();
        }
        try {
            return mapAny(any);
        } finally {
            depth--;
        }
    }

    private Any mapAny(Any any) {
        if (any instanceof Any.AIdent a) {
            return new Any.AIdent(mapIdent(a.ident()));
        } else if (any instanceof Any.AName a) {
            return new Any.AName(mapName(a.name()));
        } else if (any instanceof Any.AEntity a) {
            return new Any.AEntity(mapEntity(a.entity()));
        } else if (any instanceof Any.AExpr a) {
            return new Any.AExpr(mapExpr(a.expr()));
        } else if (any instanceof Any.AStmt a) {
            return new Any.AStmt(mapStmt(a.stmt()));
        } else if (any instanceof Any.AType a) {
            return new Any.AType(mapType(a.type()));
        } else if (any instanceof Any.APattern a) {
            return new Any.APattern(mapPattern(a.pattern()));
        } else if (any instanceof Any.ADef a) {
            return new Any.ADef(mapDefinition(a.definition()));
        } else if (any instanceof Any.ADir a) {
            return new Any.ADir(mapDirective(a.directive()));
        } else if (any instanceof Any.AParam a) {
            return new Any.AParam(mapParameter(a.parameter()));
        } else if (any instanceof Any.AArg a) {
            return new Any.AArg(mapArgument(a.argument()));
        } else if (any instanceof Any.AAttr a) {
            return new Any.AAttr(mapAttribute(a.attribute()));
        } else if (any instanceof Any.ADefKind a) {
            return new Any.ADefKind(mapDefinitionKind(a.kind()));
        } else if (any instanceof Any.ADotted a) {
            return new Any.ADotted(mapDotted(a.dotted()));
        } else if (any instanceof Any.AField a) {
            return new Any.AField(mapField(a.field()));
        } else if (any instanceof Any.AStmts a) {
            return new Any.AStmts(mapStmts(a.stmts()));
        } else if (any instanceof Any.AToken a) {
            return new Any.AToken(mapToken(a.token()));
        } else if (any instanceof Any.AProgram a) {
            return new Any.AProgram(mapStmts(a.stmts()));
        }
        throw new IllegalStateException("Unknown node: " + any.getClass().getName());
    }

    // ==================== Leaves ====================

    @Override
    public Token mapToken(Token token) {
        return hooks.token(token, t -> t, this);
    }

    private Ident mapIdent(Ident ident) {
        return hooks.ident(ident, i -> new Ident(i.name(), mapToken(i.token())), this);
    }

    private List<Ident> mapDotted(List<Ident> dotted) {
        return mapList(dotted, this::mapIdent);
    }

    private Name mapName(Name name) {
        NameInfo info = name.info();
        Optional<List<Ident>> qualifier = info.qualifier().map(this::mapDotted);
        Ident ident = mapIdent(name.ident());
        Optional<List<TypeArgument>> typeArguments =
            info.typeArguments().map(arguments -> mapList(arguments, this::mapTypeArgument));
        return new Name(ident, new NameInfo(qualifier, typeArguments));
    }

    private <T> Wrap<T> mapWrap(Wrap<T> wrap) {
        return new Wrap<>(wrap.value(), mapToken(wrap.token()));
    }

    private <T, R> Bracket<R> mapBracket(Bracket<T> bracket, Function<T, R> inner) {
        Token open = mapToken(bracket.open());
        R value = inner.apply(bracket.value());
        Token close = mapToken(bracket.close());
        return new Bracket<>(open, value, close);
    }

    private static <T> List<T> mapList(List<T> list, Function<T, T> f) {
        return list.stream().map(f).toList();
    }

    private List<Any> mapPayload(List<Any> payload) {
        return mapList(payload, this::mapAny);
    }

    private Literal mapLiteral(Literal literal) {
        if (literal instanceof Literal.BoolLit l) {
            return new Literal.BoolLit(mapWrap(l.value()));
        } else if (literal instanceof Literal.IntLit l) {
            return new Literal.IntLit(mapWrap(l.value()));
        } else if (literal instanceof Literal.FloatLit l) {
            return new Literal.FloatLit(mapWrap(l.value()));
        } else if (literal instanceof Literal.CharLit l) {
            return new Literal.CharLit(mapWrap(l.value()));
        } else if (literal instanceof Literal.StringLit l) {
            return new Literal.StringLit(mapWrap(l.value()));
        } else if (literal instanceof Literal.RegexpLit l) {
            return new Literal.RegexpLit(mapWrap(l.value()));
        } else if (literal instanceof Literal.UnitLit l) {
            return new Literal.UnitLit(mapToken(l.token()));
        } else if (literal instanceof Literal.NullLit l) {
            return new Literal.NullLit(mapToken(l.token()));
        } else if (literal instanceof Literal.UndefinedLit l) {
            return new Literal.UndefinedLit(mapToken(l.token()));
        } else if (literal instanceof Literal.ImagLit l) {
            return new Literal.ImagLit(mapWrap(l.value()));
        }
        throw new IllegalStateException("Unknown literal: " + literal.getClass().getName());
    }

    private ModuleName mapModuleName(ModuleName module) {
        if (module instanceof ModuleName.DottedName dotted) {
            return new ModuleName.DottedName(mapDotted(dotted.parts()));
        }
        ModuleName.FileName file = (ModuleName.FileName) module;
        return new ModuleName.FileName(mapWrap(file.path()));
    }

    private IdInfo mapIdInfo(IdInfo info) {
        IdInfo mapped = idInfos.get(info);
        if (mapped != null) {
            return mapped;
        }
        mapped = new IdInfo();
        idInfos.put(info, mapped);
        mapped.setResolved(info.resolved().map(this::mapResolvedName).orElse(null));
        mapped.setType(info.type().map(this::mapType).orElse(null));
        mapped.setConstLiteral(info.constLiteral().map(this::mapLiteral).orElse(null));
        return mapped;
    }

    private ResolvedName mapResolvedName(ResolvedName resolved) {
        ResolvedName.ResolvedKind kind = resolved.kind();
        if (kind instanceof ResolvedName.ResolvedKind.ImportedEntity entity) {
            kind = new ResolvedName.ResolvedKind.ImportedEntity(mapDotted(entity.dotted()));
        } else if (kind instanceof ResolvedName.ResolvedKind.ImportedModule module) {
            kind = new ResolvedName.ResolvedKind.ImportedModule(mapModuleName(module.module()));
        }
        return new ResolvedName(kind, resolved.sid());
    }

    // ==================== Expressions ====================

    @Override
    public Expr mapExpr(Expr expr) {
        return hooks.expr(expr, this::rebuildExpr, this);
    }

    private List<Expr> mapExprs(List<Expr> exprs) {
        return mapList(exprs, this::mapExpr);
    }

    private Expr rebuildExpr(Expr expr) {
        if (expr instanceof Expr.Lit e) {
            return new Expr.Lit(mapLiteral(e.literal()));
        } else if (expr instanceof Expr.Container e) {
            return new Expr.Container(e.kind(), mapBracket(e.elements(), this::mapExprs));
        } else if (expr instanceof Expr.Tuple e) {
            return new Expr.Tuple(mapExprs(e.elements()));
        } else if (expr instanceof Expr.RecordLit e) {
            return new Expr.RecordLit(mapBracket(e.fields(), fields -> mapList(fields, this::mapField)));
        } else if (expr instanceof Expr.Constructor e) {
            return new Expr.Constructor(mapName(e.name()), mapExprs(e.arguments()));
        } else if (expr instanceof Expr.Lambda e) {
            return new Expr.Lambda(mapFunctionDefinition(e.function()));
        } else if (expr instanceof Expr.AnonClass e) {
            return new Expr.AnonClass(mapClassDefinition(e.classDefinition()));
        } else if (expr instanceof Expr.Id e) {
            return new Expr.Id(mapIdent(e.ident()), mapIdInfo(e.info()));
        } else if (expr instanceof Expr.IdQualified e) {
            return new Expr.IdQualified(mapName(e.name()), mapIdInfo(e.info()));
        } else if (expr instanceof Expr.IdSpecial e) {
            return new Expr.IdSpecial(mapWrap(e.special()));
        } else if (expr instanceof Expr.Call e) {
            Expr function = mapExpr(e.function());
            return new Expr.Call(function, mapBracket(e.arguments(), arguments -> mapList(arguments, this::mapArgument)));
        } else if (expr instanceof Expr.Assign e) {
            Expr target = mapExpr(e.target());
            Token token = mapToken(e.token());
            return new Expr.Assign(target, token, mapExpr(e.value()));
        } else if (expr instanceof Expr.AssignOp e) {
            Expr target = mapExpr(e.target());
            Wrap<Operator> operator = mapWrap(e.operator());
            return new Expr.AssignOp(target, operator, mapExpr(e.value()));
        } else if (expr instanceof Expr.LetPattern e) {
            Pattern pattern = mapPattern(e.pattern());
            return new Expr.LetPattern(pattern, mapExpr(e.value()));
        } else if (expr instanceof Expr.DotAccess e) {
            Expr object = mapExpr(e.object());
            Token dot = mapToken(e.dot());
            return new Expr.DotAccess(object, dot, mapFieldIdent(e.field()));
        } else if (expr instanceof Expr.ArrayAccess e) {
            Expr array = mapExpr(e.array());
            return new Expr.ArrayAccess(array, mapExpr(e.index()));
        } else if (expr instanceof Expr.SliceAccess e) {
            Expr array = mapExpr(e.array());
            Optional<Expr> lower = e.lower().map(this::mapExpr);
            Optional<Expr> upper = e.upper().map(this::mapExpr);
            return new Expr.SliceAccess(array, lower, upper, e.step().map(this::mapExpr));
        } else if (expr instanceof Expr.Conditional e) {
            Expr condition = mapExpr(e.condition());
            Expr thenExpr = mapExpr(e.thenExpr());
            return new Expr.Conditional(condition, thenExpr, mapExpr(e.elseExpr()));
        } else if (expr instanceof Expr.MatchPattern e) {
            Expr scrutinee = mapExpr(e.scrutinee());
            return new Expr.MatchPattern(scrutinee, mapList(e.actions(), this::mapAction));
        } else if (expr instanceof Expr.Yield e) {
            Token token = mapToken(e.token());
            return new Expr.Yield(token, e.value().map(this::mapExpr), e.delegating());
        } else if (expr instanceof Expr.Await e) {
            Token token = mapToken(e.token());
            return new Expr.Await(token, mapExpr(e.value()));
        } else if (expr instanceof Expr.Cast e) {
            Type type = mapType(e.type());
            return new Expr.Cast(type, mapExpr(e.value()));
        } else if (expr instanceof Expr.Seq e) {
            return new Expr.Seq(mapExprs(e.exprs()));
        } else if (expr instanceof Expr.Ref e) {
            Token token = mapToken(e.token());
            return new Expr.Ref(token, mapExpr(e.value()));
        } else if (expr instanceof Expr.DeRef e) {
            Token token = mapToken(e.token());
            return new Expr.DeRef(token, mapExpr(e.value()));
        } else if (expr instanceof Expr.Ellipsis e) {
            return new Expr.Ellipsis(mapToken(e.token()));
        } else if (expr instanceof Expr.TypedMetavar e) {
            Ident ident = mapIdent(e.ident());
            Token token = mapToken(e.token());
            return new Expr.TypedMetavar(ident, token, mapType(e.type()));
        } else if (expr instanceof Expr.DisjExpr e) {
            Expr left = mapExpr(e.left());
            return new Expr.DisjExpr(left, mapExpr(e.right()));
        } else if (expr instanceof Expr.OtherExpr e) {
            return new Expr.OtherExpr(e.op(), mapPayload(e.payload()));
        }
        throw new IllegalStateException("Unknown expression: " + expr.getClass().getName());
    }

    private Action mapAction(Action action) {
        Pattern pattern = mapPattern(action.pattern());
        return new Action(pattern, mapExpr(action.body()));
    }

    private FieldIdent mapFieldIdent(FieldIdent field) {
        if (field instanceof FieldIdent.FId f) {
            return new FieldIdent.FId(mapIdent(f.ident()));
        } else if (field instanceof FieldIdent.FName f) {
            return new FieldIdent.FName(mapName(f.name()));
        }
        return new FieldIdent.FDynamic(mapExpr(((FieldIdent.FDynamic) field).expr()));
    }

    private Argument mapArgument(Argument argument) {
        return hooks.argument(argument, this::rebuildArgument, this);
    }

    private Argument rebuildArgument(Argument argument) {
        if (argument instanceof Argument.Arg a) {
            return new Argument.Arg(mapExpr(a.expr()));
        } else if (argument instanceof Argument.ArgKwd a) {
            Ident name = mapIdent(a.name());
            return new Argument.ArgKwd(name, mapExpr(a.expr()));
        } else if (argument instanceof Argument.ArgType a) {
            return new Argument.ArgType(mapType(a.type()));
        }
        Argument.ArgOther other = (Argument.ArgOther) argument;
        return new Argument.ArgOther(other.op(), mapPayload(other.payload()));
    }

    // ==================== Statements ====================

    @Override
    public Stmt mapStmt(Stmt stmt) {
        return hooks.stmt(stmt, this::rebuildStmt, this);
    }

    private List<Stmt> mapStmts(List<Stmt> stmts) {
        return hooks.stmts(stmts, list -> mapList(list, this::mapStmt), this);
    }

    private Stmt rebuildStmt(Stmt stmt) {
        if (stmt instanceof Stmt.ExprStmt s) {
            Expr expr = mapExpr(s.expr());
            return new Stmt.ExprStmt(expr, mapToken(s.semicolon()));
        } else if (stmt instanceof Stmt.DefStmt s) {
            return new Stmt.DefStmt(mapDefinition(s.definition()));
        } else if (stmt instanceof Stmt.DirectiveStmt s) {
            return new Stmt.DirectiveStmt(mapDirective(s.directive()));
        } else if (stmt instanceof Stmt.Block s) {
            return new Stmt.Block(mapBracket(s.stmts(), this::mapStmts));
        } else if (stmt instanceof Stmt.If s) {
            Token token = mapToken(s.token());
            Expr condition = mapExpr(s.condition());
            Stmt thenStmt = mapStmt(s.thenStmt());
            return new Stmt.If(token, condition, thenStmt, s.elseStmt().map(this::mapStmt));
        } else if (stmt instanceof Stmt.While s) {
            Token token = mapToken(s.token());
            Expr condition = mapExpr(s.condition());
            return new Stmt.While(token, condition, mapStmt(s.body()));
        } else if (stmt instanceof Stmt.DoWhile s) {
            Token token = mapToken(s.token());
            Stmt body = mapStmt(s.body());
            return new Stmt.DoWhile(token, body, mapExpr(s.condition()));
        } else if (stmt instanceof Stmt.For s) {
            Token token = mapToken(s.token());
            Stmt.ForHeader header = mapForHeader(s.header());
            return new Stmt.For(token, header, mapStmt(s.body()));
        } else if (stmt instanceof Stmt.Switch s) {
            Token token = mapToken(s.token());
            Optional<Expr> selector = s.selector().map(this::mapExpr);
            return new Stmt.Switch(token, selector, mapList(s.cases(), this::mapCaseAndBody));
        } else if (stmt instanceof Stmt.Return s) {
            Token token = mapToken(s.token());
            return new Stmt.Return(token, s.value().map(this::mapExpr));
        } else if (stmt instanceof Stmt.Continue s) {
            Token token = mapToken(s.token());
            return new Stmt.Continue(token, mapLabelIdent(s.label()));
        } else if (stmt instanceof Stmt.Break s) {
            Token token = mapToken(s.token());
            return new Stmt.Break(token, mapLabelIdent(s.label()));
        } else if (stmt instanceof Stmt.Label s) {
            Ident label = mapIdent(s.label());
            return new Stmt.Label(label, mapStmt(s.body()));
        } else if (stmt instanceof Stmt.Goto s) {
            Token token = mapToken(s.token());
            return new Stmt.Goto(token, mapIdent(s.label()));
        } else if (stmt instanceof Stmt.Throw s) {
            Token token = mapToken(s.token());
            return new Stmt.Throw(token, mapExpr(s.value()));
        } else if (stmt instanceof Stmt.Try s) {
            Token token = mapToken(s.token());
            Stmt body = mapStmt(s.body());
            List<Stmt.Catch> catches = mapList(s.catches(), this::mapCatch);
            return new Stmt.Try(token, body, catches, s.finallyClause().map(this::mapFinally));
        } else if (stmt instanceof Stmt.Assert s) {
            Token token = mapToken(s.token());
            Expr condition = mapExpr(s.condition());
            return new Stmt.Assert(token, condition, s.message().map(this::mapExpr));
        } else if (stmt instanceof Stmt.DisjStmt s) {
            Stmt left = mapStmt(s.left());
            return new Stmt.DisjStmt(left, mapStmt(s.right()));
        } else if (stmt instanceof Stmt.OtherStmtWithStmt s) {
            Expr expr = mapExpr(s.expr());
            return new Stmt.OtherStmtWithStmt(s.op(), expr, mapStmt(s.body()));
        } else if (stmt instanceof Stmt.OtherStmt s) {
            return new Stmt.OtherStmt(s.op(), mapPayload(s.payload()));
        }
        throw new IllegalStateException("Unknown statement: " + stmt.getClass().getName());
    }

    private Stmt.CaseAndBody mapCaseAndBody(Stmt.CaseAndBody caseAndBody) {
        List<Stmt.Case> cases = mapList(caseAndBody.cases(), this::mapCase);
        return new Stmt.CaseAndBody(cases, mapStmt(caseAndBody.body()));
    }

    private Stmt.Case mapCase(Stmt.Case c) {
        if (c instanceof Stmt.Case.CasePattern p) {
            Token token = mapToken(p.token());
            return new Stmt.Case.CasePattern(token, mapPattern(p.pattern()));
        } else if (c instanceof Stmt.Case.Default d) {
            return new Stmt.Case.Default(mapToken(d.token()));
        }
        Stmt.Case.CaseEqualExpr e = (Stmt.Case.CaseEqualExpr) c;
        Token token = mapToken(e.token());
        return new Stmt.Case.CaseEqualExpr(token, mapExpr(e.expr()));
    }

    private Stmt.Catch mapCatch(Stmt.Catch c) {
        Token token = mapToken(c.token());
        Pattern pattern = mapPattern(c.pattern());
        return new Stmt.Catch(token, pattern, mapStmt(c.body()));
    }

    private Stmt.Finally mapFinally(Stmt.Finally f) {
        Token token = mapToken(f.token());
        return new Stmt.Finally(token, mapStmt(f.body()));
    }

    private Stmt.LabelIdent mapLabelIdent(Stmt.LabelIdent label) {
        if (label instanceof Stmt.LabelIdent.LId l) {
            return new Stmt.LabelIdent.LId(mapIdent(l.label()));
        } else if (label instanceof Stmt.LabelIdent.LInt l) {
            return new Stmt.LabelIdent.LInt(mapWrap(l.depth()));
        } else if (label instanceof Stmt.LabelIdent.LDynamic l) {
            return new Stmt.LabelIdent.LDynamic(mapExpr(l.expr()));
        }
        return label;
    }

    private Stmt.ForHeader mapForHeader(Stmt.ForHeader header) {
        if (header instanceof Stmt.ForHeader.ForClassic h) {
            List<Stmt.ForVarOrExpr> init = mapList(h.init(), this::mapForVarOrExpr);
            Optional<Expr> condition = h.condition().map(this::mapExpr);
            return new Stmt.ForHeader.ForClassic(init, condition, h.next().map(this::mapExpr));
        }
        Stmt.ForHeader.ForEach h = (Stmt.ForHeader.ForEach) header;
        Pattern pattern = mapPattern(h.pattern());
        Token in = mapToken(h.in());
        return new Stmt.ForHeader.ForEach(pattern, in, mapExpr(h.iterable()));
    }

    private Stmt.ForVarOrExpr mapForVarOrExpr(Stmt.ForVarOrExpr init) {
        if (init instanceof Stmt.ForVarOrExpr.ForInitVar v) {
            Entity entity = mapEntity(v.entity());
            return new Stmt.ForVarOrExpr.ForInitVar(entity, mapVariableDefinition(v.definition()));
        }
        return new Stmt.ForVarOrExpr.ForInitExpr(mapExpr(((Stmt.ForVarOrExpr.ForInitExpr) init).expr()));
    }

    // ==================== Patterns ====================

    private Pattern mapPattern(Pattern pattern) {
        return hooks.pattern(pattern, this::rebuildPattern, this);
    }

    private List<Pattern> mapPatterns(List<Pattern> patterns) {
        return mapList(patterns, this::mapPattern);
    }

    private Pattern rebuildPattern(Pattern pattern) {
        if (pattern instanceof Pattern.PatLiteral p) {
            return new Pattern.PatLiteral(mapLiteral(p.literal()));
        } else if (pattern instanceof Pattern.PatConstructor p) {
            Name name = mapName(p.name());
            return new Pattern.PatConstructor(name, mapPatterns(p.arguments()));
        } else if (pattern instanceof Pattern.PatRecord p) {
            return new Pattern.PatRecord(mapBracket(p.fields(), fields -> mapList(fields, f -> {
                Name name = mapName(f.name());
                return new Pattern.FieldPattern(name, mapPattern(f.pattern()));
            })));
        } else if (pattern instanceof Pattern.PatId p) {
            return new Pattern.PatId(mapIdent(p.ident()), mapIdInfo(p.info()));
        } else if (pattern instanceof Pattern.PatTuple p) {
            return new Pattern.PatTuple(mapPatterns(p.elements()));
        } else if (pattern instanceof Pattern.PatList p) {
            return new Pattern.PatList(mapBracket(p.elements(), this::mapPatterns));
        } else if (pattern instanceof Pattern.PatKeyVal p) {
            Pattern key = mapPattern(p.key());
            return new Pattern.PatKeyVal(key, mapPattern(p.value()));
        } else if (pattern instanceof Pattern.PatUnderscore p) {
            return new Pattern.PatUnderscore(mapToken(p.token()));
        } else if (pattern instanceof Pattern.PatDisj p) {
            Pattern left = mapPattern(p.left());
            return new Pattern.PatDisj(left, mapPattern(p.right()));
        } else if (pattern instanceof Pattern.PatTyped p) {
            Pattern inner = mapPattern(p.pattern());
            return new Pattern.PatTyped(inner, mapType(p.type()));
        } else if (pattern instanceof Pattern.PatWhen p) {
            Pattern inner = mapPattern(p.pattern());
            return new Pattern.PatWhen(inner, mapExpr(p.guard()));
        } else if (pattern instanceof Pattern.PatAs p) {
            Pattern inner = mapPattern(p.pattern());
            return new Pattern.PatAs(inner, mapIdent(p.alias()), mapIdInfo(p.info()));
        } else if (pattern instanceof Pattern.PatType p) {
            return new Pattern.PatType(mapType(p.type()));
        } else if (pattern instanceof Pattern.PatVar p) {
            Type type = mapType(p.type());
            return new Pattern.PatVar(type, p.ident().map(this::mapIdent), mapIdInfo(p.info()));
        } else if (pattern instanceof Pattern.DisjPat p) {
            Pattern left = mapPattern(p.left());
            return new Pattern.DisjPat(left, mapPattern(p.right()));
        } else if (pattern instanceof Pattern.OtherPat p) {
            return new Pattern.OtherPat(p.op(), mapPayload(p.payload()));
        }
        throw new IllegalStateException("Unknown pattern: " + pattern.getClass().getName());
    }

    // ==================== Types ====================

    @Override
    public Type mapType(Type type) {
        return hooks.type(type, this::rebuildType, this);
    }

    private Type rebuildType(Type type) {
        if (type instanceof Type.TyBuiltin t) {
            return new Type.TyBuiltin(mapWrap(t.name()));
        } else if (type instanceof Type.TyName t) {
            return new Type.TyName(mapName(t.name()));
        } else if (type instanceof Type.TyNameApply t) {
            Name name = mapName(t.name());
            return new Type.TyNameApply(name, mapList(t.arguments(), this::mapTypeArgument));
        } else if (type instanceof Type.TyVar t) {
            return new Type.TyVar(mapIdent(t.ident()));
        } else if (type instanceof Type.TyFun t) {
            List<Type> parameters = mapList(t.parameters(), this::mapType);
            return new Type.TyFun(parameters, mapType(t.result()));
        } else if (type instanceof Type.TyArray t) {
            Type element = mapType(t.element());
            return new Type.TyArray(mapBracket(t.size(), size -> size.map(this::mapExpr)), element);
        } else if (type instanceof Type.TyPointer t) {
            Token token = mapToken(t.token());
            return new Type.TyPointer(token, mapType(t.target()));
        } else if (type instanceof Type.TyTuple t) {
            return new Type.TyTuple(mapBracket(t.elements(), elements -> mapList(elements, this::mapType)));
        } else if (type instanceof Type.TyQuestion t) {
            Type inner = mapType(t.type());
            return new Type.TyQuestion(inner, mapToken(t.token()));
        } else if (type instanceof Type.TyAnd t) {
            Type left = mapType(t.left());
            Token token = mapToken(t.token());
            return new Type.TyAnd(left, token, mapType(t.right()));
        } else if (type instanceof Type.TyOr t) {
            Type left = mapType(t.left());
            Token token = mapToken(t.token());
            return new Type.TyOr(left, token, mapType(t.right()));
        } else if (type instanceof Type.OtherType t) {
            return new Type.OtherType(t.op(), mapPayload(t.payload()));
        }
        throw new IllegalStateException("Unknown type: " + type.getClass().getName());
    }

    private TypeArgument mapTypeArgument(TypeArgument argument) {
        if (argument instanceof TypeArgument.TypeArg a) {
            return new TypeArgument.TypeArg(mapType(a.type()));
        }
        TypeArgument.OtherTypeArg other = (TypeArgument.OtherTypeArg) argument;
        return new TypeArgument.OtherTypeArg(other.op(), mapPayload(other.payload()));
    }

    private TypeParameter mapTypeParameter(TypeParameter parameter) {
        Ident name = mapIdent(parameter.name());
        return new TypeParameter(name, mapList(parameter.bounds(), this::mapType));
    }

    // ==================== Attributes and parameters ====================

    private Attribute mapAttribute(Attribute attribute) {
        return hooks.attribute(attribute, this::rebuildAttribute, this);
    }

    private Attribute rebuildAttribute(Attribute attribute) {
        if (attribute instanceof Attribute.KeywordAttr a) {
            return new Attribute.KeywordAttr(mapWrap(a.keyword()));
        } else if (attribute instanceof Attribute.NamedAttr a) {
            Token at = mapToken(a.at());
            Name name = mapName(a.name());
            IdInfo info = mapIdInfo(a.info());
            return new Attribute.NamedAttr(at, name, info,
                mapBracket(a.arguments(), arguments -> mapList(arguments, this::mapArgument)));
        }
        Attribute.OtherAttribute other = (Attribute.OtherAttribute) attribute;
        return new Attribute.OtherAttribute(other.op(), mapPayload(other.payload()));
    }

    private Parameter mapParameter(Parameter parameter) {
        return hooks.parameter(parameter, this::rebuildParameter, this);
    }

    private Parameter rebuildParameter(Parameter parameter) {
        if (parameter instanceof Parameter.ParamClassic p) {
            return new Parameter.ParamClassic(mapParameterClassic(p.parameter()));
        } else if (parameter instanceof Parameter.ParamPattern p) {
            return new Parameter.ParamPattern(mapPattern(p.pattern()));
        } else if (parameter instanceof Parameter.ParamEllipsis p) {
            return new Parameter.ParamEllipsis(mapToken(p.token()));
        }
        Parameter.OtherParam other = (Parameter.OtherParam) parameter;
        return new Parameter.OtherParam(other.op(), mapPayload(other.payload()));
    }

    private ParameterClassic mapParameterClassic(ParameterClassic parameter) {
        List<Attribute> attributes = mapList(parameter.attributes(), this::mapAttribute);
        Optional<Type> type = parameter.type().map(this::mapType);
        Optional<Ident> name = parameter.name().map(this::mapIdent);
        Optional<Expr> defaultValue = parameter.defaultValue().map(this::mapExpr);
        return new ParameterClassic(name, type, defaultValue, attributes, mapIdInfo(parameter.info()));
    }

    // ==================== Definitions ====================

    private Definition mapDefinition(Definition definition) {
        return hooks.definition(definition, d -> {
            Entity entity = mapEntity(d.entity());
            return new Definition(entity, mapDefinitionKind(d.kind()));
        }, this);
    }

    private Entity mapEntity(Entity entity) {
        return hooks.entity(entity, e -> {
            List<Attribute> attributes = mapList(e.attributes(), this::mapAttribute);
            Ident name = mapIdent(e.name());
            List<TypeParameter> typeParameters = mapList(e.typeParameters(), this::mapTypeParameter);
            return new Entity(name, attributes, typeParameters, mapIdInfo(e.info()));
        }, this);
    }

    private DefinitionKind mapDefinitionKind(DefinitionKind kind) {
        if (kind instanceof DefinitionKind.FuncDef k) {
            return new DefinitionKind.FuncDef(mapFunctionDefinition(k.function()));
        } else if (kind instanceof DefinitionKind.VarDef k) {
            return new DefinitionKind.VarDef(mapVariableDefinition(k.variable()));
        } else if (kind instanceof DefinitionKind.TypeDef k) {
            return new DefinitionKind.TypeDef(mapTypeDefinition(k.type()));
        } else if (kind instanceof DefinitionKind.ClassDef k) {
            return new DefinitionKind.ClassDef(mapClassDefinition(k.classDefinition()));
        } else if (kind instanceof DefinitionKind.ModuleDef k) {
            return new DefinitionKind.ModuleDef(mapModuleDefinition(k.module()));
        } else if (kind instanceof DefinitionKind.MacroDef k) {
            MacroDefinition macro = k.macro();
            List<Ident> parameters = mapList(macro.parameters(), this::mapIdent);
            return new DefinitionKind.MacroDef(new MacroDefinition(parameters, mapPayload(macro.body())));
        } else if (kind instanceof DefinitionKind.Signature k) {
            return new DefinitionKind.Signature(mapType(k.type()));
        }
        return new DefinitionKind.UseOuterDecl(mapToken(((DefinitionKind.UseOuterDecl) kind).token()));
    }

    private FunctionDefinition mapFunctionDefinition(FunctionDefinition function) {
        return hooks.functionDefinition(function, f -> {
            List<Parameter> parameters = mapList(f.parameters(), this::mapParameter);
            Optional<Type> returnType = f.returnType().map(this::mapType);
            return new FunctionDefinition(parameters, returnType, mapStmt(f.body()));
        }, this);
    }

    private VariableDefinition mapVariableDefinition(VariableDefinition variable) {
        Optional<Type> type = variable.type().map(this::mapType);
        return new VariableDefinition(variable.initializer().map(this::mapExpr), type);
    }

    private ClassDefinition mapClassDefinition(ClassDefinition classDefinition) {
        return hooks.classDefinition(classDefinition, c -> {
            Wrap<ClassDefinition.ClassKind> kind = mapWrap(c.kind());
            List<Type> extendsTypes = mapList(c.extendsTypes(), this::mapType);
            List<Type> implementsTypes = mapList(c.implementsTypes(), this::mapType);
            List<Type> mixins = mapList(c.mixins(), this::mapType);
            return new ClassDefinition(kind, extendsTypes, implementsTypes, mixins,
                mapBracket(c.body(), fields -> mapList(fields, this::mapField)));
        }, this);
    }

    private Field mapField(Field field) {
        if (field instanceof Field.FieldStmt f) {
            return new Field.FieldStmt(mapStmt(f.stmt()));
        } else if (field instanceof Field.FieldDynamic f) {
            List<Attribute> attributes = mapList(f.attributes(), this::mapAttribute);
            Expr name = mapExpr(f.name());
            return new Field.FieldDynamic(name, attributes, mapExpr(f.value()));
        }
        Field.FieldSpread spread = (Field.FieldSpread) field;
        Token token = mapToken(spread.token());
        return new Field.FieldSpread(token, mapExpr(spread.expr()));
    }

    private TypeDefinition mapTypeDefinition(TypeDefinition type) {
        if (type instanceof TypeDefinition.OrType t) {
            return new TypeDefinition.OrType(mapList(t.elements(), this::mapOrTypeElement));
        } else if (type instanceof TypeDefinition.AndType t) {
            return new TypeDefinition.AndType(mapBracket(t.fields(), fields -> mapList(fields, this::mapField)));
        } else if (type instanceof TypeDefinition.AliasType t) {
            return new TypeDefinition.AliasType(mapType(t.type()));
        } else if (type instanceof TypeDefinition.NewType t) {
            Token token = mapToken(t.token());
            return new TypeDefinition.NewType(token, mapType(t.type()));
        } else if (type instanceof TypeDefinition.ExceptionType t) {
            Ident name = mapIdent(t.name());
            return new TypeDefinition.ExceptionType(name, mapList(t.arguments(), this::mapType));
        }
        TypeDefinition.OtherTypeKind other = (TypeDefinition.OtherTypeKind) type;
        return new TypeDefinition.OtherTypeKind(other.op(), mapPayload(other.payload()));
    }

    private TypeDefinition.OrTypeElement mapOrTypeElement(TypeDefinition.OrTypeElement element) {
        if (element instanceof TypeDefinition.OrTypeElement.OrConstructor e) {
            Ident name = mapIdent(e.name());
            return new TypeDefinition.OrTypeElement.OrConstructor(name, mapList(e.arguments(), this::mapType));
        } else if (element instanceof TypeDefinition.OrTypeElement.OrEnum e) {
            Ident name = mapIdent(e.name());
            return new TypeDefinition.OrTypeElement.OrEnum(name, e.value().map(this::mapExpr));
        } else if (element instanceof TypeDefinition.OrTypeElement.OrUnion e) {
            Ident name = mapIdent(e.name());
            return new TypeDefinition.OrTypeElement.OrUnion(name, mapType(e.type()));
        }
        TypeDefinition.OrTypeElement.OtherOr other = (TypeDefinition.OrTypeElement.OtherOr) element;
        return new TypeDefinition.OrTypeElement.OtherOr(other.op(), mapPayload(other.payload()));
    }

    private ModuleDefinition mapModuleDefinition(ModuleDefinition module) {
        if (module instanceof ModuleDefinition.ModuleAlias m) {
            return new ModuleDefinition.ModuleAlias(mapName(m.name()));
        } else if (module instanceof ModuleDefinition.ModuleStruct m) {
            Optional<List<Ident>> name = m.name().map(this::mapDotted);
            return new ModuleDefinition.ModuleStruct(name, mapStmts(m.items()));
        }
        ModuleDefinition.OtherModule other = (ModuleDefinition.OtherModule) module;
        return new ModuleDefinition.OtherModule(other.op(), mapPayload(other.payload()));
    }

    // ==================== Directives ====================

    private Directive mapDirective(Directive directive) {
        return hooks.directive(directive, this::rebuildDirective, this);
    }

    private Directive rebuildDirective(Directive directive) {
        if (directive instanceof Directive.ImportFrom d) {
            Token token = mapToken(d.token());
            ModuleName module = mapModuleName(d.module());
            Ident name = mapIdent(d.name());
            return new Directive.ImportFrom(token, module, name, d.alias().map(this::mapIdent));
        } else if (directive instanceof Directive.ImportAs d) {
            Token token = mapToken(d.token());
            ModuleName module = mapModuleName(d.module());
            return new Directive.ImportAs(token, module, d.alias().map(this::mapIdent));
        } else if (directive instanceof Directive.ImportAll d) {
            Token token = mapToken(d.token());
            ModuleName module = mapModuleName(d.module());
            return new Directive.ImportAll(token, module, mapToken(d.star()));
        } else if (directive instanceof Directive.Package d) {
            Token token = mapToken(d.token());
            return new Directive.Package(token, mapDotted(d.name()));
        } else if (directive instanceof Directive.PackageEnd d) {
            return new Directive.PackageEnd(mapToken(d.token()));
        }
        Directive.OtherDirective other = (Directive.OtherDirective) directive;
        return new Directive.OtherDirective(other.op(), mapPayload(other.payload()));
    }
}
