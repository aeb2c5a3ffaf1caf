package com.polyast.core.normalizer.javascript;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Argument;
import com.polyast.core.ast.Attribute;
import com.polyast.core.ast.Definition;
import com.polyast.core.ast.DefinitionKind;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.FieldIdent;
import com.polyast.core.ast.FunctionDefinition;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Literal;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.Special;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.visitor.AstTraversals;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.parser.JavaScriptSourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JavaScriptNormalizer}.
 */
class JavaScriptNormalizerTest {

    private final JavaScriptSourceParser parser = new JavaScriptSourceParser();

    private List<Stmt> normalize(String code) {
        SourceFile source = SourceFile.of("app.js", code);
        return new JavaScriptNormalizer(source).program(parser.parse(source));
    }

    private Expr expression(String code) {
        List<Stmt> program = normalize(code);
        assertThat(program).hasSize(1);
        assertThat(program.get(0)).isInstanceOf(Stmt.ExprStmt.class);
        return ((Stmt.ExprStmt) program.get(0)).expr();
    }

    private static Definition definition(Stmt stmt) {
        assertThat(stmt).isInstanceOf(Stmt.DefStmt.class);
        return ((Stmt.DefStmt) stmt).definition();
    }

    private static Expr initializer(Stmt stmt) {
        return ((DefinitionKind.VarDef) definition(stmt).kind()).variable().initializer().orElseThrow();
    }

    private static Attribute.KeywordAttribute declarationKeyword(Stmt stmt) {
        Attribute attribute = definition(stmt).entity().attributes().get(0);
        return ((Attribute.KeywordAttr) attribute).keyword().value();
    }

    // ==================== Functions ====================

    @Test
    void functionDeclaration_singleStatementBodyIsThatStatement() {
        List<Stmt> program = normalize("function f(a) { return a + 1; }");

        assertThat(program).hasSize(1);
        Definition definition = definition(program.get(0));
        assertThat(definition.entity().name().name()).isEqualTo("f");
        assertThat(definition.entity().name().token().location().offset()).isEqualTo(9);

        FunctionDefinition function = ((DefinitionKind.FuncDef) definition.kind()).function();
        assertThat(function.parameters()).hasSize(1);
        Parameter.ParamClassic parameter = (Parameter.ParamClassic) function.parameters().get(0);
        assertThat(parameter.parameter().name()).get().extracting(Ident::name).isEqualTo("a");

        assertThat(function.body()).isInstanceOf(Stmt.Return.class);
        Expr.Call sum = (Expr.Call) ((Stmt.Return) function.body()).value().orElseThrow();
        assertThat(((Expr.IdSpecial) sum.function()).special().value()).isEqualTo(new Special.Op(Operator.PLUS));
    }

    @Test
    void functionDeclaration_severalStatementsBecomeBlock() {
        List<Stmt> program = normalize("function f() { a(); b(); }");

        FunctionDefinition function = ((DefinitionKind.FuncDef) definition(program.get(0)).kind()).function();

        assertThat(function.body()).isInstanceOf(Stmt.Block.class);
        assertThat(((Stmt.Block) function.body()).stmts().value()).hasSize(2);
    }

    @Test
    void anonymousFunctionExpression_becomesLambda() {
        List<Stmt> program = normalize("var f = function(x) { return x; };");

        assertThat(initializer(program.get(0))).isInstanceOf(Expr.Lambda.class);
    }

    @Test
    void arrowFunction_becomesLambda() {
        List<Stmt> program = normalize("var f = (x) => x * 2;");

        Expr.Lambda lambda = (Expr.Lambda) initializer(program.get(0));

        assertThat(lambda.function().parameters()).hasSize(1);
    }

    @Test
    void namedFunctionExpression_keepsDefinition() {
        List<Stmt> program = normalize("var f = function named() {};");

        Expr value = initializer(program.get(0));
        assertThat(value).isInstanceOf(Expr.OtherExpr.class);
        assertThat(((Expr.OtherExpr) value).op()).isEqualTo(Expr.OtherExprOp.NAMED_FUNCTION);
    }

    // ==================== Declarations ====================

    @Test
    void variableDeclaration_yieldsOneDefinitionPerVariable() {
        List<Stmt> program = normalize("var x = 1, y;");

        assertThat(program).hasSize(2);
        assertThat(definition(program.get(0)).entity().name().name()).isEqualTo("x");
        assertThat(initializer(program.get(0))).isInstanceOf(Expr.Lit.class);
        assertThat(((Expr.Lit) initializer(program.get(0))).literal()).isInstanceOf(Literal.IntLit.class);
        assertThat(((DefinitionKind.VarDef) definition(program.get(1)).kind()).variable().initializer()).isEmpty();
        assertThat(declarationKeyword(program.get(1))).isEqualTo(Attribute.KeywordAttribute.VAR);
    }

    @Test
    void letAndConst_keepTheirKeyword() {
        List<Stmt> program = normalize("let a = 1;\nconst b = 2.5;");

        assertThat(declarationKeyword(program.get(0))).isEqualTo(Attribute.KeywordAttribute.LET);
        assertThat(declarationKeyword(program.get(1))).isEqualTo(Attribute.KeywordAttribute.CONST);
        assertThat(((Expr.Lit) initializer(program.get(1))).literal()).isInstanceOf(Literal.FloatLit.class);
    }

    @Test
    void functionDeclaredInBlock_isDefinition() {
        String code = "if (x) { function g(y) { return y + 1; } }";
        Stmt.If ifStmt = (Stmt.If) normalize(code).get(0);

        Stmt.Block then = (Stmt.Block) ifStmt.thenStmt();
        assertThat(then.stmts().value()).hasSize(1);
        Definition g = definition(then.stmts().value().get(0));
        assertThat(g.entity().name().name()).isEqualTo("g");
        assertThat(g.kind()).isInstanceOf(DefinitionKind.FuncDef.class);
        assertThat(AstTraversals.extractTokens(Any.of(ifStmt))).filteredOn(Token::isOrigin)
            .extracting(Token::text)
            .contains("g", "y", "return", "+", "1");
    }

    @Test
    void functionDeclaredInBareBlock_isDefinition() {
        Stmt.Block block = (Stmt.Block) normalize("{ function h() { return 2; } }").get(0);

        assertThat(block.stmts().value()).hasSize(1);
        assertThat(definition(block.stmts().value().get(0)).entity().name().name()).isEqualTo("h");
    }

    // ==================== Statements ====================

    @Test
    void forIn_becomesForEach() {
        List<Stmt> program = normalize("for (var k in obj) { use(k); }");

        Stmt.For loop = (Stmt.For) program.get(0);
        Stmt.ForHeader.ForEach header = (Stmt.ForHeader.ForEach) loop.header();

        Pattern.OtherPat declared = (Pattern.OtherPat) header.pattern();
        assertThat(declared.op()).isEqualTo(Pattern.OtherPatternOp.DECLARATION);
        assertThat(((Any.AToken) declared.payload().get(0)).token().location().offset()).isEqualTo(5);
        Pattern.PatId binder = (Pattern.PatId) ((Any.APattern) declared.payload().get(1)).pattern();
        assertThat(binder.ident().name()).isEqualTo("k");
        assertThat(header.in().text()).isEqualTo("in");
        assertThat(header.in().isOrigin()).isTrue();
        assertThat(((Expr.Id) header.iterable()).ident().name()).isEqualTo("obj");
    }

    @Test
    void forIn_withoutDeclaration_bindsPlainPattern() {
        Stmt.For loop = (Stmt.For) normalize("for (k in obj) { }").get(0);

        Stmt.ForHeader.ForEach header = (Stmt.ForHeader.ForEach) loop.header();
        assertThat(((Pattern.PatId) header.pattern()).ident().name()).isEqualTo("k");
    }

    @Test
    void forOf_keepsDeclarationKeyword() {
        List<Token> tokens = AstTraversals.extractTokens(Any.program(normalize("for (const v of vs) { }")));

        assertThat(tokens).filteredOn(Token::isOrigin).extracting(Token::text)
            .containsSubsequence("for", "const", "v", "of", "vs");
    }

    @Test
    void classicFor_keepsHeaderParts() {
        List<Stmt> program = normalize("for (var i = 0; i < n; i++) { }");

        Stmt.ForHeader.ForClassic header = (Stmt.ForHeader.ForClassic) ((Stmt.For) program.get(0)).header();

        assertThat(header.init()).hasSize(1);
        assertThat(header.init().get(0)).isInstanceOf(Stmt.ForVarOrExpr.ForInitVar.class);
        assertThat(header.condition()).isPresent();
        assertThat(header.next()).isPresent();
    }

    @Test
    void infiniteFor_hasEmptyHeader() {
        List<Stmt> program = normalize("outer: for (;;) { break outer; }");

        Stmt.Label label = (Stmt.Label) program.get(0);
        assertThat(label.label().name()).isEqualTo("outer");
        Stmt.For loop = (Stmt.For) label.body();
        Stmt.ForHeader.ForClassic header = (Stmt.ForHeader.ForClassic) loop.header();
        assertThat(header.init()).isEmpty();
        assertThat(header.condition()).isEmpty();
        assertThat(header.next()).isEmpty();
        Stmt.Block body = (Stmt.Block) loop.body();
        assertThat(((Stmt.Break) body.stmts().value().get(0)).label()).isInstanceOf(Stmt.LabelIdent.LId.class);
    }

    @Test
    void tryCatchFinally_bindsCatchVariable() {
        List<Stmt> program = normalize("try { a(); } catch (e) { b(e); } finally { c(); }");

        Stmt.Try tryStmt = (Stmt.Try) program.get(0);

        assertThat(tryStmt.token().text()).isEqualTo("try");
        assertThat(tryStmt.catches()).hasSize(1);
        assertThat(((Pattern.PatId) tryStmt.catches().get(0).pattern()).ident().name()).isEqualTo("e");
        Stmt.Finally finallyClause = tryStmt.finallyClause().orElseThrow();
        assertThat(finallyClause.token().text()).isEqualTo("finally");
        assertThat(finallyClause.token().isOrigin()).isTrue();
    }

    @Test
    void switchStatement_usesEqualityCases() {
        List<Stmt> program = normalize("switch (k) { case 1: a(); break; default: b(); }");

        Stmt.Switch switchStmt = (Stmt.Switch) program.get(0);

        assertThat(switchStmt.cases()).hasSize(2);
        assertThat(switchStmt.cases().get(0).cases().get(0)).isInstanceOf(Stmt.Case.CaseEqualExpr.class);
        assertThat(switchStmt.cases().get(0).body()).isInstanceOf(Stmt.Block.class);
        assertThat(switchStmt.cases().get(1).cases().get(0)).isInstanceOf(Stmt.Case.Default.class);
        assertThat(switchStmt.cases().get(1).body()).isInstanceOf(Stmt.ExprStmt.class);
    }

    @Test
    void ifElse_translatesBothBranches() {
        List<Stmt> program = normalize("if (a) b(); else { c(); }");

        Stmt.If ifStmt = (Stmt.If) program.get(0);

        assertThat(ifStmt.token().text()).isEqualTo("if");
        assertThat(ifStmt.thenStmt()).isInstanceOf(Stmt.ExprStmt.class);
        assertThat(ifStmt.elseStmt()).get().isInstanceOf(Stmt.Block.class);
    }

    @Test
    void expressionStatement_keepsSemicolonPosition() {
        List<Stmt> program = normalize("foo();");

        Token semicolon = ((Stmt.ExprStmt) program.get(0)).semicolon();

        assertThat(semicolon.isOrigin()).isTrue();
        assertThat(semicolon.location().offset()).isEqualTo(5);
    }

    @Test
    void emptyStatement_becomesEmptyBlock() {
        List<Stmt> program = normalize(";");

        assertThat(program.get(0)).isInstanceOf(Stmt.Block.class);
        assertThat(((Stmt.Block) program.get(0)).stmts().value()).isEmpty();
    }

    // ==================== Expressions ====================

    @Test
    void moduleIdentifiers_becomeSpecialForms() {
        Expr.Call require = (Expr.Call) expression("require('fs');");
        assertThat(((Expr.OtherExpr) require.function()).op()).isEqualTo(Expr.OtherExprOp.REQUIRE);

        Expr.Assign exportsAssign = (Expr.Assign) expression("module.exports = 1;");
        Expr.DotAccess target = (Expr.DotAccess) exportsAssign.target();
        assertThat(((Expr.OtherExpr) target.object()).op()).isEqualTo(Expr.OtherExprOp.MODULE);
        assertThat(((FieldIdent.FId) target.field()).ident().name()).isEqualTo("exports");
    }

    @Test
    void undefined_isLiteral() {
        Expr.Call comparison = (Expr.Call) expression("x === undefined;");

        assertThat(((Expr.IdSpecial) comparison.function()).special().value())
            .isEqualTo(new Special.Op(Operator.PHYS_EQ));
        Expr right = ((Argument.Arg) comparison.arguments().value().get(1)).expr();
        assertThat(((Expr.Lit) right).literal()).isInstanceOf(Literal.UndefinedLit.class);
    }

    @Test
    void newExpression_callsNewWithTargetFirst() {
        Expr.Call call = (Expr.Call) expression("new Foo(1, 2);");

        assertThat(((Expr.IdSpecial) call.function()).special().value()).isEqualTo(Special.Builtin.NEW);
        assertThat(call.arguments().value()).hasSize(3);
        assertThat(((Expr.Id) ((Argument.Arg) call.arguments().value().get(0)).expr()).ident().name())
            .isEqualTo("Foo");
    }

    @Test
    void callArguments_keepParenthesisTokens() {
        Expr.Call call = (Expr.Call) expression("f(a, b);");

        assertThat(call.arguments().open().text()).isEqualTo("(");
        assertThat(call.arguments().open().location().offset()).isEqualTo(1);
        assertThat(call.arguments().close().location().offset()).isEqualTo(6);
    }

    @Test
    void commaOperator_flattensIntoSequence() {
        Expr seq = expression("a, b, c;");

        assertThat(seq).isInstanceOf(Expr.Seq.class);
        assertThat(((Expr.Seq) seq).exprs()).hasSize(3);
    }

    @Test
    void compoundAssignment_becomesAssignOp() {
        Expr.AssignOp assignment = (Expr.AssignOp) expression("x += 1;");

        assertThat(assignment.operator().value()).isEqualTo(Operator.PLUS);
        assertThat(assignment.operator().token().text()).isEqualTo("+=");
    }

    @Test
    void typeof_isSpecialCall() {
        Expr.Call call = (Expr.Call) expression("typeof x;");

        assertThat(((Expr.IdSpecial) call.function()).special().value()).isEqualTo(Special.Builtin.TYPEOF);
    }

    @Test
    void postfixIncrement_isIncrDecrSpecial() {
        Expr.Call call = (Expr.Call) expression("i++;");

        Expr.IdSpecial special = (Expr.IdSpecial) call.function();
        assertThat(special.special().value()).isEqualTo(new Special.IncrDecr(Special.IncrDecr.Kind.INCR,
            Special.IncrDecr.Fixity.POSTFIX));
        assertThat(special.special().token().location().offset()).isEqualTo(1);
        assertThat(((Expr.Id) ((Argument.Arg) call.arguments().value().get(0)).expr()).ident().name())
            .isEqualTo("i");
    }

    @Test
    void prefixDecrement_isIncrDecrSpecial() {
        Expr.Call call = (Expr.Call) expression("--j;");

        Expr.IdSpecial special = (Expr.IdSpecial) call.function();
        assertThat(special.special().value()).isEqualTo(new Special.IncrDecr(Special.IncrDecr.Kind.DECR,
            Special.IncrDecr.Fixity.PREFIX));
        assertThat(special.special().token().text()).isEqualTo("--");
        assertThat(special.special().token().location().offset()).isZero();
        assertThat(((Expr.Id) ((Argument.Arg) call.arguments().value().get(0)).expr()).ident().name())
            .isEqualTo("j");
    }

    @Test
    void classicForUpdate_isIncrDecrCall() {
        Stmt.For loop = (Stmt.For) normalize("for(var i=0;i<n;i++){}").get(0);

        Stmt.ForHeader.ForClassic header = (Stmt.ForHeader.ForClassic) loop.header();
        Expr.Call next = (Expr.Call) header.next().orElseThrow();
        assertThat(((Expr.IdSpecial) next.function()).special().value())
            .isEqualTo(new Special.IncrDecr(Special.IncrDecr.Kind.INCR, Special.IncrDecr.Fixity.POSTFIX));
        assertThat(((Expr.IdSpecial) next.function()).special().token().location().offset()).isEqualTo(17);
    }

    @Test
    void unsupportedExpression_keepsItsNormalizedChildren() {
        List<Stmt> program = normalize("var ys = [x * 2 for (x in xs)];");

        Expr.OtherExpr comprehension = (Expr.OtherExpr) initializer(program.get(0));
        assertThat(comprehension.op()).isEqualTo(Expr.OtherExprOp.TODO);
        assertThat(comprehension.payload()).isNotEmpty();
        assertThat(AstTraversals.extractTokens(Any.of(comprehension))).filteredOn(Token::isOrigin)
            .extracting(Token::text)
            .contains("x", "*", "2", "xs");
    }

    @Test
    void objectLiteral_becomesRecord() {
        List<Stmt> program = normalize("var o = {a: 1, 'b': 2};");

        Expr.RecordLit record = (Expr.RecordLit) initializer(program.get(0));

        assertThat(record.fields().value()).hasSize(2);
        assertThat(record.fields().open().text()).isEqualTo("{");
    }

    @Test
    void arrayLiteral_becomesArrayContainer() {
        List<Stmt> program = normalize("var xs = [1, 2, 3];");

        Expr.Container container = (Expr.Container) initializer(program.get(0));

        assertThat(container.kind()).isEqualTo(Expr.ContainerKind.ARRAY);
        assertThat(container.elements().value()).hasSize(3);
    }

    @Test
    void propertyAccess_becomesDotAccess() {
        Expr.Call call = (Expr.Call) expression("console.log(x);");

        Expr.DotAccess access = (Expr.DotAccess) call.function();
        assertThat(((Expr.Id) access.object()).ident().name()).isEqualTo("console");
        assertThat(access.dot().location().offset()).isEqualTo(7);
        assertThat(((FieldIdent.FId) access.field()).ident().name()).isEqualTo("log");
    }

    @Test
    void this_isSpecial() {
        Expr.DotAccess access = (Expr.DotAccess) expression("this.x;");

        assertThat(((Expr.IdSpecial) access.object()).special().value()).isEqualTo(Special.Builtin.THIS);
    }

    @Test
    void binaryOperator_unknownToken_isEmpty() {
        assertThat(JavaScriptNormalizer.binaryOperator(org.mozilla.javascript.Token.SHEQ)).contains(Operator.PHYS_EQ);
        assertThat(JavaScriptNormalizer.binaryOperator(org.mozilla.javascript.Token.COMMA)).isEmpty();
    }
}
