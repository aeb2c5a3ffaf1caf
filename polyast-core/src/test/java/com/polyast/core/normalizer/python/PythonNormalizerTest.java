package com.polyast.core.normalizer.python;

import com.polyast.core.ast.Attribute;
import com.polyast.core.ast.Attribute.KeywordAttribute;
import com.polyast.core.ast.DefinitionKind;
import com.polyast.core.ast.Directive;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Location;
import com.polyast.core.ast.ModuleName;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.ResolvedName;
import com.polyast.core.ast.Special;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.normalizer.NormalizationException;
import com.polyast.core.parser.ast.PythonAst;
import com.polyast.core.parser.ast.PythonAst.CmpOperator;
import com.polyast.core.parser.ast.PythonAst.ExprContext;
import com.polyast.core.parser.ast.PythonAst.Identifier;
import com.polyast.core.parser.ast.PythonAst.Resolution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PythonNormalizer}.
 *
 * <p>Trees are built by hand since no Python parser ships with the core module.
 */
class PythonNormalizerTest {

    private PythonNormalizer normalizer;
    private int offset;

    @BeforeEach
    void setUp() {
        normalizer = new PythonNormalizer(SourceFile.of("a.py", ""));
        offset = 0;
    }

    // ==================== Helpers ====================

    private Token tok(String text) {
        Token token = Token.of(text, new Location("a.py", 1, offset + 1, offset));
        offset += text.length() + 1;
        return token;
    }

    private Identifier id(String name) {
        return new Identifier(name, tok(name));
    }

    private PythonAst.Name name(String name, Resolution resolution) {
        return new PythonAst.Name(id(name), ExprContext.LOAD, resolution);
    }

    private PythonAst.Name name(String name) {
        return name(name, Resolution.NOT_RESOLVED);
    }

    private List<Stmt> program(PythonAst.Statement... statements) {
        return normalizer.program(new PythonAst.Module(List.of(statements)));
    }

    private static DefinitionKind.FuncDef funcDef(Stmt stmt) {
        Stmt.DefStmt def = (Stmt.DefStmt) stmt;
        return (DefinitionKind.FuncDef) def.definition().kind();
    }

    // ==================== Definitions ====================

    @Test
    void functionDef_withParameterAndReturn_producesFuncDefInBlock() {
        Identifier f = id("f");
        PythonAst.ParamClassic param = new PythonAst.ParamClassic(id("a"), Optional.empty(), Optional.empty());
        PythonAst.Return ret = new PythonAst.Return(tok("return"), Optional.of(name("a", new Resolution.Parameter())));

        List<Stmt> stmts = program(new PythonAst.FunctionDef(f, List.of(param), Optional.empty(), List.of(ret), List.of()));

        assertThat(stmts).hasSize(1);
        Stmt.DefStmt defStmt = (Stmt.DefStmt) stmts.get(0);
        assertThat(defStmt.definition().entity().name().name()).isEqualTo("f");

        DefinitionKind.FuncDef funcDef = funcDef(defStmt);
        assertThat(funcDef.function().parameters()).singleElement()
            .isInstanceOfSatisfying(Parameter.ParamClassic.class, classic -> {
                assertThat(classic.parameter().name()).map(Ident::name).contains("a");
                assertThat(classic.parameter().info().resolved())
                    .map(ResolvedName::kind)
                    .get()
                    .isInstanceOf(ResolvedName.ResolvedKind.Param.class);
            });

        Stmt.Block body = (Stmt.Block) funcDef.function().body();
        Stmt.Return returned = (Stmt.Return) body.stmts().value().get(0);
        Expr.Id value = (Expr.Id) returned.value().orElseThrow();
        assertThat(value.info().resolved()).map(ResolvedName::kind).get()
            .isInstanceOf(ResolvedName.ResolvedKind.Param.class);
    }

    @Test
    void functionDef_bodyOfLoneIdentifier_isNotWrappedInBlock() {
        PythonAst.FunctionDef function = new PythonAst.FunctionDef(id("f"), List.of(), Optional.empty(),
            List.of(new PythonAst.ExprStmt(name("x"))), List.of());

        Stmt body = funcDef(program(function).get(0)).function().body();

        assertThat(body).isInstanceOf(Stmt.ExprStmt.class);
    }

    @Test
    void asyncDef_putsAsyncAttributeFirst() {
        Token async = tok("async");
        PythonAst.Name decorator = name("cached");
        PythonAst.FunctionDef function = new PythonAst.FunctionDef(id("f"), List.of(), Optional.empty(),
            List.of(new PythonAst.Pass(tok("pass"))), List.of(decorator));

        Stmt.DefStmt def = (Stmt.DefStmt) program(new PythonAst.Async(async, function)).get(0);

        List<Attribute> attributes = def.definition().entity().attributes();
        assertThat(attributes).hasSize(2);
        assertThat(attributes.get(0)).isInstanceOfSatisfying(Attribute.KeywordAttr.class, attr -> {
            assertThat(attr.keyword().value()).isEqualTo(KeywordAttribute.ASYNC);
            assertThat(attr.keyword().token()).isSameAs(async);
        });
        assertThat(attributes.get(1)).isInstanceOf(Attribute.OtherAttribute.class);
    }

    @Test
    void name_withLocalResolution_carriesLocalKind() {
        List<Stmt> stmts = program(new PythonAst.ExprStmt(name("x", new Resolution.LocalVar())));

        Expr.Id id = (Expr.Id) ((Stmt.ExprStmt) stmts.get(0)).expr();
        assertThat(id.info().resolved()).map(ResolvedName::kind).get()
            .isInstanceOf(ResolvedName.ResolvedKind.Local.class);
    }

    @Test
    void name_unresolved_hasEmptyInfo() {
        Expr.Id id = (Expr.Id) ((Stmt.ExprStmt) program(new PythonAst.ExprStmt(name("x"))).get(0)).expr();

        assertThat(id.info().resolved()).isEmpty();
    }

    // ==================== Control flow ====================

    @Test
    void forElse_followsLoopInBlock() {
        PythonAst.For loop = new PythonAst.For(tok("for"), name("x"), tok("in"), name("xs"),
            List.of(new PythonAst.Pass(tok("pass"))),
            List.of(new PythonAst.Pass(tok("pass"))));

        Stmt.Block block = (Stmt.Block) program(loop).get(0);

        List<Stmt> stmts = block.stmts().value();
        assertThat(stmts).hasSize(2);
        Stmt.For forStmt = (Stmt.For) stmts.get(0);
        assertThat(forStmt.header()).isInstanceOfSatisfying(Stmt.ForHeader.ForEach.class, each -> {
            assertThat(each.pattern()).isInstanceOf(Pattern.PatId.class);
            assertThat(each.in().text()).isEqualTo("in");
        });
        assertThat(stmts.get(1)).isInstanceOfSatisfying(Stmt.OtherStmtWithStmt.class, orElse ->
            assertThat(orElse.op()).isEqualTo(Stmt.OtherStmtWithStmtOp.FOR_OR_ELSE));
    }

    @Test
    void forWithoutElse_isPlainLoop() {
        PythonAst.For loop = new PythonAst.For(tok("for"), name("x"), tok("in"), name("xs"),
            List.of(new PythonAst.Pass(tok("pass"))), List.of());

        assertThat(program(loop).get(0)).isInstanceOf(Stmt.For.class);
    }

    @Test
    void raiseFrom_becomesThrowFrom() {
        PythonAst.Raise raise = new PythonAst.Raise(tok("raise"), Optional.of(name("e")), Optional.of(name("c")));

        Stmt stmt = program(raise).get(0);

        assertThat(stmt).isInstanceOfSatisfying(Stmt.OtherStmt.class, other -> {
            assertThat(other.op()).isEqualTo(Stmt.OtherStmtOp.THROW_FROM);
            assertThat(other.payload()).hasSize(3);
        });
    }

    @Test
    void raiseException_becomesThrow() {
        assertThat(program(new PythonAst.Raise(tok("raise"), Optional.of(name("e")), Optional.empty())).get(0))
            .isInstanceOf(Stmt.Throw.class);
    }

    @Test
    void raiseCauseWithoutException_throwsNormalizationException() {
        PythonAst.Raise raise = new PythonAst.Raise(tok("raise"), Optional.empty(), Optional.of(name("c")));

        assertThatThrownBy(() -> program(raise))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("a.py");
    }

    @Test
    void exceptHandler_typeAndName_becomesPatAs() {
        PythonAst.ExceptHandler handler = new PythonAst.ExceptHandler(tok("except"), Optional.of(name("E")),
            Optional.of(id("e")), List.of(new PythonAst.Pass(tok("pass"))));
        PythonAst.TryExcept tryExcept = new PythonAst.TryExcept(tok("try"),
            List.of(new PythonAst.Pass(tok("pass"))), List.of(handler), List.of());

        Stmt.Try tryStmt = (Stmt.Try) program(tryExcept).get(0);

        assertThat(tryStmt.catches()).singleElement().satisfies(c ->
            assertThat(c.pattern()).isInstanceOfSatisfying(Pattern.PatAs.class, as ->
                assertThat(as.alias().name()).isEqualTo("e")));
        assertThat(tryStmt.finallyClause()).isEmpty();
    }

    @Test
    void exceptHandler_bare_becomesUnderscore() {
        PythonAst.ExceptHandler handler = new PythonAst.ExceptHandler(tok("except"), Optional.empty(),
            Optional.empty(), List.of(new PythonAst.Pass(tok("pass"))));
        PythonAst.TryExcept tryExcept = new PythonAst.TryExcept(tok("try"),
            List.of(new PythonAst.Pass(tok("pass"))), List.of(handler), List.of());

        Stmt.Try tryStmt = (Stmt.Try) program(tryExcept).get(0);

        assertThat(tryStmt.catches().get(0).pattern()).isInstanceOf(Pattern.PatUnderscore.class);
    }

    @Test
    void exceptHandler_nameWithoutType_throwsNormalizationException() {
        PythonAst.ExceptHandler handler = new PythonAst.ExceptHandler(tok("except"), Optional.empty(),
            Optional.of(id("e")), List.of(new PythonAst.Pass(tok("pass"))));
        PythonAst.TryExcept tryExcept = new PythonAst.TryExcept(tok("try"),
            List.of(new PythonAst.Pass(tok("pass"))), List.of(handler), List.of());

        assertThatThrownBy(() -> program(tryExcept))
            .isInstanceOfSatisfying(NormalizationException.class, e -> assertThat(e.location()).isPresent());
    }

    @Test
    void tryFinally_carriesFinallyClause() {
        Token finallyToken = tok("finally");
        PythonAst.TryFinally tryFinally = new PythonAst.TryFinally(tok("try"),
            List.of(new PythonAst.Pass(tok("pass"))), finallyToken, List.of(new PythonAst.Pass(tok("pass"))));

        Stmt.Try tryStmt = (Stmt.Try) program(tryFinally).get(0);

        assertThat(tryStmt.catches()).isEmpty();
        assertThat(tryStmt.finallyClause()).get().satisfies(f -> assertThat(f.token()).isSameAs(finallyToken));
    }

    // ==================== Expressions ====================

    @Test
    void compareChain_becomesCmpOps() {
        PythonAst.Compare compare = new PythonAst.Compare(name("a"),
            List.of(new PythonAst.CompareOp(CmpOperator.LT, tok("<")), new PythonAst.CompareOp(CmpOperator.LT, tok("<"))),
            List.of(name("b"), name("c")));

        Expr expr = ((Stmt.ExprStmt) program(new PythonAst.ExprStmt(compare)).get(0)).expr();

        assertThat(expr).isInstanceOfSatisfying(Expr.OtherExpr.class, other -> {
            assertThat(other.op()).isEqualTo(Expr.OtherExprOp.CMP_OPS);
            assertThat(other.payload()).hasSize(5);
        });
    }

    @Test
    void singleComparison_becomesOperatorCall() {
        Token lt = tok("<");
        PythonAst.Compare compare = new PythonAst.Compare(name("a"),
            List.of(new PythonAst.CompareOp(CmpOperator.LT, lt)), List.of(name("b")));

        Expr expr = ((Stmt.ExprStmt) program(new PythonAst.ExprStmt(compare)).get(0)).expr();

        Expr.Call call = (Expr.Call) expr;
        assertThat(call.function()).isInstanceOfSatisfying(Expr.IdSpecial.class, special -> {
            assertThat(special.special().value()).isInstanceOf(Special.Op.class);
            assertThat(special.special().token()).isSameAs(lt);
        });
        assertThat(call.arguments().value()).hasSize(2);
    }

    @Test
    void membershipTest_becomesOtherExprIn() {
        PythonAst.Compare compare = new PythonAst.Compare(name("a"),
            List.of(new PythonAst.CompareOp(CmpOperator.IN, tok("in"))), List.of(name("b")));

        Expr expr = ((Stmt.ExprStmt) program(new PythonAst.ExprStmt(compare)).get(0)).expr();

        assertThat(expr).isInstanceOfSatisfying(Expr.OtherExpr.class, other ->
            assertThat(other.op()).isEqualTo(Expr.OtherExprOp.IN));
    }

    @Test
    void compareWithMismatchedOperands_throwsNormalizationException() {
        PythonAst.Compare compare = new PythonAst.Compare(name("a"),
            List.of(new PythonAst.CompareOp(CmpOperator.LT, tok("<"))), List.of());

        assertThatThrownBy(() -> program(new PythonAst.ExprStmt(compare)))
            .isInstanceOf(NormalizationException.class);
    }

    // ==================== Imports and misc ====================

    @Test
    void importFrom_withTwoNames_producesTwoDirectives() {
        PythonAst.ModulePath module = new PythonAst.ModulePath(List.of(id("os")), List.of());
        PythonAst.ImportFrom importFrom = new PythonAst.ImportFrom(tok("from"), module, List.of(
            new PythonAst.Alias(id("path"), Optional.empty()),
            new PythonAst.Alias(id("sep"), Optional.of(id("s")))));

        List<Stmt> stmts = program(importFrom);

        assertThat(stmts).hasSize(2).allSatisfy(stmt -> assertThat(stmt).isInstanceOf(Stmt.DirectiveStmt.class));
        Directive.ImportFrom second = (Directive.ImportFrom) ((Stmt.DirectiveStmt) stmts.get(1)).directive();
        assertThat(second.name().name()).isEqualTo("sep");
        assertThat(second.alias()).map(Ident::name).contains("s");
        assertThat(second.module()).isInstanceOf(ModuleName.DottedName.class);
    }

    @Test
    void relativeImport_becomesFileName() {
        PythonAst.ModulePath module = new PythonAst.ModulePath(List.of(id("a")), List.of(tok("..")));
        PythonAst.ImportFrom importFrom = new PythonAst.ImportFrom(tok("from"), module,
            List.of(new PythonAst.Alias(id("b"), Optional.empty())));

        Directive.ImportFrom directive = (Directive.ImportFrom) ((Stmt.DirectiveStmt) program(importFrom).get(0)).directive();

        assertThat(directive.module()).isInstanceOfSatisfying(ModuleName.FileName.class, file ->
            assertThat(file.path().value()).isEqualTo("../a"));
    }

    @Test
    void print_becomesCallWithFileKeyword() {
        Token print = tok("print");
        PythonAst.Print stmt = new PythonAst.Print(print, Optional.of(name("out")), List.of(name("x")), true);

        Expr.Call call = (Expr.Call) ((Stmt.ExprStmt) program(stmt).get(0)).expr();

        assertThat(call.function()).isInstanceOfSatisfying(Expr.Id.class, id -> {
            assertThat(id.ident().name()).isEqualTo("print");
            assertThat(id.ident().token()).isSameAs(print);
        });
        assertThat(call.arguments().value()).hasSize(2);
    }

    @Test
    void global_producesOneDeclarationPerName() {
        List<Stmt> stmts = program(new PythonAst.Global(tok("global"), List.of(id("a"), id("b"))));

        assertThat(stmts).hasSize(2).allSatisfy(stmt ->
            assertThat(((Stmt.DefStmt) stmt).definition().kind()).isInstanceOf(DefinitionKind.UseOuterDecl.class));
    }

    @Test
    void any_unknownFragment_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> normalizer.any("not python"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("java.lang.String");
    }
}
