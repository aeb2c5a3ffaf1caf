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
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Literal;
import com.polyast.core.ast.MacroDefinition;
import com.polyast.core.ast.ModuleDefinition;
import com.polyast.core.ast.ModuleName;
import com.polyast.core.ast.Name;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.ParameterClassic;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.Type;
import com.polyast.core.ast.TypeArgument;
import com.polyast.core.ast.TypeDefinition;
import com.polyast.core.ast.TypeParameter;
import com.polyast.core.ast.VariableDefinition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Walks every node of the generic AST, firing {@link VisitorHooks} pre-order.
 *
 * <p>Children are visited in the order they appear in the record, which follows the
 * source order for nearly every construct. Escape-hatch payloads are walked element by
 * element. {@link com.polyast.core.ast.IdInfo} cells are not traversed.
 */
final class GenericVisitor implements Visitor {

    private final VisitorHooks hooks;

    GenericVisitor(VisitorHooks hooks) {
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
    }

    @Override
    public void visit(Any any) {
        if (any instanceof Any.AIdent a) {
            visitIdent(a.ident());
        } else if (any instanceof Any.AName a) {
            visitName(a.name());
        } else if (any instanceof Any.AEntity a) {
            visitEntity(a.entity());
        } else if (any instanceof Any.AExpr a) {
            visitExpr(a.expr());
        } else if (any instanceof Any.AStmt a) {
            visitStmt(a.stmt());
        } else if (any instanceof Any.AType a) {
            visitType(a.type());
        } else if (any instanceof Any.APattern a) {
            visitPattern(a.pattern());
        } else if (any instanceof Any.ADef a) {
            visitDefinition(a.definition());
        } else if (any instanceof Any.ADir a) {
            visitDirective(a.directive());
        } else if (any instanceof Any.AParam a) {
            visitParameter(a.parameter());
        } else if (any instanceof Any.AArg a) {
            visitArgument(a.argument());
        } else if (any instanceof Any.AAttr a) {
            visitAttribute(a.attribute());
        } else if (any instanceof Any.ADefKind a) {
            visitDefinitionKind(a.kind());
        } else if (any instanceof Any.ADotted a) {
            a.dotted().forEach(this::visitIdent);
        } else if (any instanceof Any.AField a) {
            visitField(a.field());
        } else if (any instanceof Any.AStmts a) {
            visitStmts(a.stmts());
        } else if (any instanceof Any.AToken a) {
            visitToken(a.token());
        } else if (any instanceof Any.AProgram a) {
            visitStmts(a.stmts());
        }
    }

    // ==================== Leaves ====================

    private void visitToken(Token token) {
        hooks.token(token, t -> { }, this);
    }

    private void visitIdent(Ident ident) {
        hooks.ident(ident, i -> visitToken(i.token()), this);
    }

    private void visitName(Name name) {
        name.info().qualifier().ifPresent(qualifier -> qualifier.forEach(this::visitIdent));
        visitIdent(name.ident());
        name.info().typeArguments().ifPresent(arguments -> arguments.forEach(this::visitTypeArgument));
    }

    private void visitDotted(List<Ident> dotted) {
        dotted.forEach(this::visitIdent);
    }

    private <T> void visitBracket(Bracket<T> bracket, Consumer<T> inner) {
        visitToken(bracket.open());
        inner.accept(bracket.value());
        visitToken(bracket.close());
    }

    private <T> void visitOptional(Optional<T> value, Consumer<T> inner) {
        value.ifPresent(inner);
    }

    private void visitLiteral(Literal literal) {
        visitToken(literal.token());
    }

    private void visitModuleName(ModuleName module) {
        if (module instanceof ModuleName.DottedName dotted) {
            visitDotted(dotted.parts());
        } else if (module instanceof ModuleName.FileName file) {
            visitToken(file.path().token());
        }
    }

    private void visitPayload(List<Any> payload) {
        payload.forEach(this::visit);
    }

    // ==================== Expressions ====================

    private void visitExpr(Expr expr) {
        hooks.expr(expr, this::walkExpr, this);
    }

    private void visitExprs(List<Expr> exprs) {
        exprs.forEach(this::visitExpr);
    }

    private void walkExpr(Expr expr) {
        if (expr instanceof Expr.Lit e) {
            visitLiteral(e.literal());
        } else if (expr instanceof Expr.Container e) {
            visitBracket(e.elements(), this::visitExprs);
        } else if (expr instanceof Expr.Tuple e) {
            visitExprs(e.elements());
        } else if (expr instanceof Expr.RecordLit e) {
            visitBracket(e.fields(), fields -> fields.forEach(this::visitField));
        } else if (expr instanceof Expr.Constructor e) {
            visitName(e.name());
            visitExprs(e.arguments());
        } else if (expr instanceof Expr.Lambda e) {
            visitFunctionDefinition(e.function());
        } else if (expr instanceof Expr.AnonClass e) {
            visitClassDefinition(e.classDefinition());
        } else if (expr instanceof Expr.Id e) {
            visitIdent(e.ident());
        } else if (expr instanceof Expr.IdQualified e) {
            visitName(e.name());
        } else if (expr instanceof Expr.IdSpecial e) {
            visitToken(e.special().token());
        } else if (expr instanceof Expr.Call e) {
            visitExpr(e.function());
            visitBracket(e.arguments(), arguments -> arguments.forEach(this::visitArgument));
        } else if (expr instanceof Expr.Assign e) {
            visitExpr(e.target());
            visitToken(e.token());
            visitExpr(e.value());
        } else if (expr instanceof Expr.AssignOp e) {
            visitExpr(e.target());
            visitToken(e.operator().token());
            visitExpr(e.value());
        } else if (expr instanceof Expr.LetPattern e) {
            visitPattern(e.pattern());
            visitExpr(e.value());
        } else if (expr instanceof Expr.DotAccess e) {
            visitExpr(e.object());
            visitToken(e.dot());
            visitFieldIdent(e.field());
        } else if (expr instanceof Expr.ArrayAccess e) {
            visitExpr(e.array());
            visitExpr(e.index());
        } else if (expr instanceof Expr.SliceAccess e) {
            visitExpr(e.array());
            visitOptional(e.lower(), this::visitExpr);
            visitOptional(e.upper(), this::visitExpr);
            visitOptional(e.step(), this::visitExpr);
        } else if (expr instanceof Expr.Conditional e) {
            visitExpr(e.condition());
            visitExpr(e.thenExpr());
            visitExpr(e.elseExpr());
        } else if (expr instanceof Expr.MatchPattern e) {
            visitExpr(e.scrutinee());
            e.actions().forEach(this::visitAction);
        } else if (expr instanceof Expr.Yield e) {
            visitToken(e.token());
            visitOptional(e.value(), this::visitExpr);
        } else if (expr instanceof Expr.Await e) {
            visitToken(e.token());
            visitExpr(e.value());
        } else if (expr instanceof Expr.Cast e) {
            visitType(e.type());
            visitExpr(e.value());
        } else if (expr instanceof Expr.Seq e) {
            visitExprs(e.exprs());
        } else if (expr instanceof Expr.Ref e) {
            visitToken(e.token());
            visitExpr(e.value());
        } else if (expr instanceof Expr.DeRef e) {
            visitToken(e.token());
            visitExpr(e.value());
        } else if (expr instanceof Expr.Ellipsis e) {
            visitToken(e.token());
        } else if (expr instanceof Expr.TypedMetavar e) {
            visitIdent(e.ident());
            visitToken(e.token());
            visitType(e.type());
        } else if (expr instanceof Expr.DisjExpr e) {
            visitExpr(e.left());
            visitExpr(e.right());
        } else if (expr instanceof Expr.OtherExpr e) {
            visitPayload(e.payload());
        }
    }

    private void visitAction(Action action) {
        visitPattern(action.pattern());
        visitExpr(action.body());
    }

    private void visitFieldIdent(FieldIdent field) {
        if (field instanceof FieldIdent.FId f) {
            visitIdent(f.ident());
        } else if (field instanceof FieldIdent.FName f) {
            visitName(f.name());
        } else if (field instanceof FieldIdent.FDynamic f) {
            visitExpr(f.expr());
        }
    }

    private void visitArgument(Argument argument) {
        hooks.argument(argument, this::walkArgument, this);
    }

    private void walkArgument(Argument argument) {
        if (argument instanceof Argument.Arg a) {
            visitExpr(a.expr());
        } else if (argument instanceof Argument.ArgKwd a) {
            visitIdent(a.name());
            visitExpr(a.expr());
        } else if (argument instanceof Argument.ArgType a) {
            visitType(a.type());
        } else if (argument instanceof Argument.ArgOther a) {
            visitPayload(a.payload());
        }
    }

    // ==================== Statements ====================

    private void visitStmt(Stmt stmt) {
        hooks.stmt(stmt, this::walkStmt, this);
    }

    private void visitStmts(List<Stmt> stmts) {
        hooks.stmts(stmts, list -> list.forEach(this::visitStmt), this);
    }

    private void walkStmt(Stmt stmt) {
        if (stmt instanceof Stmt.ExprStmt s) {
            visitExpr(s.expr());
            visitToken(s.semicolon());
        } else if (stmt instanceof Stmt.DefStmt s) {
            visitDefinition(s.definition());
        } else if (stmt instanceof Stmt.DirectiveStmt s) {
            visitDirective(s.directive());
        } else if (stmt instanceof Stmt.Block s) {
            visitBracket(s.stmts(), this::visitStmts);
        } else if (stmt instanceof Stmt.If s) {
            visitToken(s.token());
            visitExpr(s.condition());
            visitStmt(s.thenStmt());
            visitOptional(s.elseStmt(), this::visitStmt);
        } else if (stmt instanceof Stmt.While s) {
            visitToken(s.token());
            visitExpr(s.condition());
            visitStmt(s.body());
        } else if (stmt instanceof Stmt.DoWhile s) {
            visitToken(s.token());
            visitStmt(s.body());
            visitExpr(s.condition());
        } else if (stmt instanceof Stmt.For s) {
            visitToken(s.token());
            visitForHeader(s.header());
            visitStmt(s.body());
        } else if (stmt instanceof Stmt.Switch s) {
            visitToken(s.token());
            visitOptional(s.selector(), this::visitExpr);
            s.cases().forEach(this::visitCaseAndBody);
        } else if (stmt instanceof Stmt.Return s) {
            visitToken(s.token());
            visitOptional(s.value(), this::visitExpr);
        } else if (stmt instanceof Stmt.Continue s) {
            visitToken(s.token());
            visitLabelIdent(s.label());
        } else if (stmt instanceof Stmt.Break s) {
            visitToken(s.token());
            visitLabelIdent(s.label());
        } else if (stmt instanceof Stmt.Label s) {
            visitIdent(s.label());
            visitStmt(s.body());
        } else if (stmt instanceof Stmt.Goto s) {
            visitToken(s.token());
            visitIdent(s.label());
        } else if (stmt instanceof Stmt.Throw s) {
            visitToken(s.token());
            visitExpr(s.value());
        } else if (stmt instanceof Stmt.Try s) {
            visitToken(s.token());
            visitStmt(s.body());
            s.catches().forEach(this::visitCatch);
            visitOptional(s.finallyClause(), this::visitFinally);
        } else if (stmt instanceof Stmt.Assert s) {
            visitToken(s.token());
            visitExpr(s.condition());
            visitOptional(s.message(), this::visitExpr);
        } else if (stmt instanceof Stmt.DisjStmt s) {
            visitStmt(s.left());
            visitStmt(s.right());
        } else if (stmt instanceof Stmt.OtherStmtWithStmt s) {
            visitExpr(s.expr());
            visitStmt(s.body());
        } else if (stmt instanceof Stmt.OtherStmt s) {
            visitPayload(s.payload());
        }
    }

    private void visitCaseAndBody(Stmt.CaseAndBody caseAndBody) {
        caseAndBody.cases().forEach(this::visitCase);
        visitStmt(caseAndBody.body());
    }

    private void visitCase(Stmt.Case c) {
        if (c instanceof Stmt.Case.CasePattern p) {
            visitToken(p.token());
            visitPattern(p.pattern());
        } else if (c instanceof Stmt.Case.Default d) {
            visitToken(d.token());
        } else if (c instanceof Stmt.Case.CaseEqualExpr e) {
            visitToken(e.token());
            visitExpr(e.expr());
        }
    }

    private void visitCatch(Stmt.Catch c) {
        visitToken(c.token());
        visitPattern(c.pattern());
        visitStmt(c.body());
    }

    private void visitFinally(Stmt.Finally f) {
        visitToken(f.token());
        visitStmt(f.body());
    }

    private void visitLabelIdent(Stmt.LabelIdent label) {
        if (label instanceof Stmt.LabelIdent.LId l) {
            visitIdent(l.label());
        } else if (label instanceof Stmt.LabelIdent.LInt l) {
            visitToken(l.depth().token());
        } else if (label instanceof Stmt.LabelIdent.LDynamic l) {
            visitExpr(l.expr());
        }
    }

    private void visitForHeader(Stmt.ForHeader header) {
        if (header instanceof Stmt.ForHeader.ForClassic h) {
            h.init().forEach(this::visitForVarOrExpr);
            visitOptional(h.condition(), this::visitExpr);
            visitOptional(h.next(), this::visitExpr);
        } else if (header instanceof Stmt.ForHeader.ForEach h) {
            visitPattern(h.pattern());
            visitToken(h.in());
            visitExpr(h.iterable());
        }
    }

    private void visitForVarOrExpr(Stmt.ForVarOrExpr init) {
        if (init instanceof Stmt.ForVarOrExpr.ForInitVar v) {
            visitEntity(v.entity());
            visitVariableDefinition(v.definition());
        } else if (init instanceof Stmt.ForVarOrExpr.ForInitExpr e) {
            visitExpr(e.expr());
        }
    }

    // ==================== Patterns ====================

    private void visitPattern(Pattern pattern) {
        hooks.pattern(pattern, this::walkPattern, this);
    }

    private void visitPatterns(List<Pattern> patterns) {
        patterns.forEach(this::visitPattern);
    }

    private void walkPattern(Pattern pattern) {
        if (pattern instanceof Pattern.PatLiteral p) {
            visitLiteral(p.literal());
        } else if (pattern instanceof Pattern.PatConstructor p) {
            visitName(p.name());
            visitPatterns(p.arguments());
        } else if (pattern instanceof Pattern.PatRecord p) {
            visitBracket(p.fields(), fields -> fields.forEach(f -> {
                visitName(f.name());
                visitPattern(f.pattern());
            }));
        } else if (pattern instanceof Pattern.PatId p) {
            visitIdent(p.ident());
        } else if (pattern instanceof Pattern.PatTuple p) {
            visitPatterns(p.elements());
        } else if (pattern instanceof Pattern.PatList p) {
            visitBracket(p.elements(), this::visitPatterns);
        } else if (pattern instanceof Pattern.PatKeyVal p) {
            visitPattern(p.key());
            visitPattern(p.value());
        } else if (pattern instanceof Pattern.PatUnderscore p) {
            visitToken(p.token());
        } else if (pattern instanceof Pattern.PatDisj p) {
            visitPattern(p.left());
            visitPattern(p.right());
        } else if (pattern instanceof Pattern.PatTyped p) {
            visitPattern(p.pattern());
            visitType(p.type());
        } else if (pattern instanceof Pattern.PatWhen p) {
            visitPattern(p.pattern());
            visitExpr(p.guard());
        } else if (pattern instanceof Pattern.PatAs p) {
            visitPattern(p.pattern());
            visitIdent(p.alias());
        } else if (pattern instanceof Pattern.PatType p) {
            visitType(p.type());
        } else if (pattern instanceof Pattern.PatVar p) {
            visitType(p.type());
            visitOptional(p.ident(), this::visitIdent);
        } else if (pattern instanceof Pattern.DisjPat p) {
            visitPattern(p.left());
            visitPattern(p.right());
        } else if (pattern instanceof Pattern.OtherPat p) {
            visitPayload(p.payload());
        }
    }

    // ==================== Types ====================

    private void visitType(Type type) {
        hooks.type(type, this::walkType, this);
    }

    private void walkType(Type type) {
        if (type instanceof Type.TyBuiltin t) {
            visitToken(t.name().token());
        } else if (type instanceof Type.TyName t) {
            visitName(t.name());
        } else if (type instanceof Type.TyNameApply t) {
            visitName(t.name());
            t.arguments().forEach(this::visitTypeArgument);
        } else if (type instanceof Type.TyVar t) {
            visitIdent(t.ident());
        } else if (type instanceof Type.TyFun t) {
            t.parameters().forEach(this::visitType);
            visitType(t.result());
        } else if (type instanceof Type.TyArray t) {
            visitType(t.element());
            visitBracket(t.size(), size -> visitOptional(size, this::visitExpr));
        } else if (type instanceof Type.TyPointer t) {
            visitToken(t.token());
            visitType(t.target());
        } else if (type instanceof Type.TyTuple t) {
            visitBracket(t.elements(), elements -> elements.forEach(this::visitType));
        } else if (type instanceof Type.TyQuestion t) {
            visitType(t.type());
            visitToken(t.token());
        } else if (type instanceof Type.TyAnd t) {
            visitType(t.left());
            visitToken(t.token());
            visitType(t.right());
        } else if (type instanceof Type.TyOr t) {
            visitType(t.left());
            visitToken(t.token());
            visitType(t.right());
        } else if (type instanceof Type.OtherType t) {
            visitPayload(t.payload());
        }
    }

    private void visitTypeArgument(TypeArgument argument) {
        if (argument instanceof TypeArgument.TypeArg a) {
            visitType(a.type());
        } else if (argument instanceof TypeArgument.OtherTypeArg a) {
            visitPayload(a.payload());
        }
    }

    private void visitTypeParameter(TypeParameter parameter) {
        visitIdent(parameter.name());
        parameter.bounds().forEach(this::visitType);
    }

    // ==================== Attributes and parameters ====================

    private void visitAttribute(Attribute attribute) {
        hooks.attribute(attribute, this::walkAttribute, this);
    }

    private void walkAttribute(Attribute attribute) {
        if (attribute instanceof Attribute.KeywordAttr a) {
            visitToken(a.keyword().token());
        } else if (attribute instanceof Attribute.NamedAttr a) {
            visitToken(a.at());
            visitName(a.name());
            visitBracket(a.arguments(), arguments -> arguments.forEach(this::visitArgument));
        } else if (attribute instanceof Attribute.OtherAttribute a) {
            visitPayload(a.payload());
        }
    }

    private void visitParameter(Parameter parameter) {
        hooks.parameter(parameter, this::walkParameter, this);
    }

    private void walkParameter(Parameter parameter) {
        if (parameter instanceof Parameter.ParamClassic p) {
            visitParameterClassic(p.parameter());
        } else if (parameter instanceof Parameter.ParamPattern p) {
            visitPattern(p.pattern());
        } else if (parameter instanceof Parameter.ParamEllipsis p) {
            visitToken(p.token());
        } else if (parameter instanceof Parameter.OtherParam p) {
            visitPayload(p.payload());
        }
    }

    private void visitParameterClassic(ParameterClassic parameter) {
        parameter.attributes().forEach(this::visitAttribute);
        visitOptional(parameter.type(), this::visitType);
        visitOptional(parameter.name(), this::visitIdent);
        visitOptional(parameter.defaultValue(), this::visitExpr);
    }

    // ==================== Definitions ====================

    private void visitDefinition(Definition definition) {
        hooks.definition(definition, d -> {
            visitEntity(d.entity());
            visitDefinitionKind(d.kind());
        }, this);
    }

    private void visitEntity(Entity entity) {
        hooks.entity(entity, e -> {
            e.attributes().forEach(this::visitAttribute);
            visitIdent(e.name());
            e.typeParameters().forEach(this::visitTypeParameter);
        }, this);
    }

    private void visitDefinitionKind(DefinitionKind kind) {
        if (kind instanceof DefinitionKind.FuncDef k) {
            visitFunctionDefinition(k.function());
        } else if (kind instanceof DefinitionKind.VarDef k) {
            visitVariableDefinition(k.variable());
        } else if (kind instanceof DefinitionKind.TypeDef k) {
            visitTypeDefinition(k.type());
        } else if (kind instanceof DefinitionKind.ClassDef k) {
            visitClassDefinition(k.classDefinition());
        } else if (kind instanceof DefinitionKind.ModuleDef k) {
            visitModuleDefinition(k.module());
        } else if (kind instanceof DefinitionKind.MacroDef k) {
            visitMacroDefinition(k.macro());
        } else if (kind instanceof DefinitionKind.Signature k) {
            visitType(k.type());
        } else if (kind instanceof DefinitionKind.UseOuterDecl k) {
            visitToken(k.token());
        }
    }

    private void visitFunctionDefinition(FunctionDefinition function) {
        hooks.functionDefinition(function, f -> {
            f.parameters().forEach(this::visitParameter);
            visitOptional(f.returnType(), this::visitType);
            visitStmt(f.body());
        }, this);
    }

    private void visitVariableDefinition(VariableDefinition variable) {
        visitOptional(variable.type(), this::visitType);
        visitOptional(variable.initializer(), this::visitExpr);
    }

    private void visitClassDefinition(ClassDefinition classDefinition) {
        hooks.classDefinition(classDefinition, c -> {
            visitToken(c.kind().token());
            c.extendsTypes().forEach(this::visitType);
            c.implementsTypes().forEach(this::visitType);
            c.mixins().forEach(this::visitType);
            visitBracket(c.body(), fields -> fields.forEach(this::visitField));
        }, this);
    }

    private void visitField(Field field) {
        if (field instanceof Field.FieldStmt f) {
            visitStmt(f.stmt());
        } else if (field instanceof Field.FieldDynamic f) {
            f.attributes().forEach(this::visitAttribute);
            visitExpr(f.name());
            visitExpr(f.value());
        } else if (field instanceof Field.FieldSpread f) {
            visitToken(f.token());
            visitExpr(f.expr());
        }
    }

    private void visitTypeDefinition(TypeDefinition type) {
        if (type instanceof TypeDefinition.OrType t) {
            t.elements().forEach(this::visitOrTypeElement);
        } else if (type instanceof TypeDefinition.AndType t) {
            visitBracket(t.fields(), fields -> fields.forEach(this::visitField));
        } else if (type instanceof TypeDefinition.AliasType t) {
            visitType(t.type());
        } else if (type instanceof TypeDefinition.NewType t) {
            visitToken(t.token());
            visitType(t.type());
        } else if (type instanceof TypeDefinition.ExceptionType t) {
            visitIdent(t.name());
            t.arguments().forEach(this::visitType);
        } else if (type instanceof TypeDefinition.OtherTypeKind t) {
            visitPayload(t.payload());
        }
    }

    private void visitOrTypeElement(TypeDefinition.OrTypeElement element) {
        if (element instanceof TypeDefinition.OrTypeElement.OrConstructor e) {
            visitIdent(e.name());
            e.arguments().forEach(this::visitType);
        } else if (element instanceof TypeDefinition.OrTypeElement.OrEnum e) {
            visitIdent(e.name());
            visitOptional(e.value(), this::visitExpr);
        } else if (element instanceof TypeDefinition.OrTypeElement.OrUnion e) {
            visitIdent(e.name());
            visitType(e.type());
        } else if (element instanceof TypeDefinition.OrTypeElement.OtherOr e) {
            visitPayload(e.payload());
        }
    }

    private void visitModuleDefinition(ModuleDefinition module) {
        if (module instanceof ModuleDefinition.ModuleAlias m) {
            visitName(m.name());
        } else if (module instanceof ModuleDefinition.ModuleStruct m) {
            visitOptional(m.name(), this::visitDotted);
            visitStmts(m.items());
        } else if (module instanceof ModuleDefinition.OtherModule m) {
            visitPayload(m.payload());
        }
    }

    private void visitMacroDefinition(MacroDefinition macro) {
        macro.parameters().forEach(this::visitIdent);
        visitPayload(macro.body());
    }

    // ==================== Directives ====================

    private void visitDirective(Directive directive) {
        hooks.directive(directive, this::walkDirective, this);
    }

    private void walkDirective(Directive directive) {
        if (directive instanceof Directive.ImportFrom d) {
            visitToken(d.token());
            visitModuleName(d.module());
            visitIdent(d.name());
            visitOptional(d.alias(), this::visitIdent);
        } else if (directive instanceof Directive.ImportAs d) {
            visitToken(d.token());
            visitModuleName(d.module());
            visitOptional(d.alias(), this::visitIdent);
        } else if (directive instanceof Directive.ImportAll d) {
            visitToken(d.token());
            visitModuleName(d.module());
            visitToken(d.star());
        } else if (directive instanceof Directive.Package d) {
            visitToken(d.token());
            visitDotted(d.name());
        } else if (directive instanceof Directive.PackageEnd d) {
            visitToken(d.token());
        } else if (directive instanceof Directive.OtherDirective d) {
            visitPayload(d.payload());
        }
    }
}
