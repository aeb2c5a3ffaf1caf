package com.polyast.core.ast;

import com.polyast.core.ast.Attribute.KeywordAttribute;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AstHelpers}.
 */
class AstHelpersTest {

    private static Ident ident(String name) {
        return Ident.fake(name);
    }

    @Test
    void stmt1_singleStatement_returnsItUnwrapped() {
        Stmt ret = new Stmt.Return(Token.fake("return"), Optional.empty());

        assertThat(AstHelpers.stmt1(List.of(ret))).isSameAs(ret);
    }

    @Test
    void stmt1_severalStatements_returnsBlock() {
        Stmt a = new Stmt.ExprStmt(AstHelpers.id(ident("a")), Token.fake(";"));
        Stmt b = new Stmt.ExprStmt(AstHelpers.id(ident("b")), Token.fake(";"));

        Stmt result = AstHelpers.stmt1(List.of(a, b));

        assertThat(result).isInstanceOf(Stmt.Block.class);
        assertThat(((Stmt.Block) result).stmts().value()).containsExactly(a, b);
    }

    @Test
    void stmt1_emptyList_returnsEmptyBlock() {
        Stmt result = AstHelpers.stmt1(List.of());

        assertThat(result).isInstanceOf(Stmt.Block.class);
        assertThat(((Stmt.Block) result).stmts().value()).isEmpty();
    }

    @Test
    void exprToPattern_identifier_becomesPatIdSharingInfo() {
        Expr.Id id = Expr.Id.of(ident("x"));

        Pattern pattern = AstHelpers.exprToPattern(id);

        assertThat(pattern).isInstanceOf(Pattern.PatId.class);
        assertThat(((Pattern.PatId) pattern).info()).isSameAs(id.info());
    }

    @Test
    void exprToPattern_tuple_convertsElements() {
        Expr tuple = new Expr.Tuple(List.of(AstHelpers.id(ident("a")), AstHelpers.id(ident("b"))));

        Pattern pattern = AstHelpers.exprToPattern(tuple);

        assertThat(pattern).isInstanceOf(Pattern.PatTuple.class);
        assertThat(((Pattern.PatTuple) pattern).elements()).allMatch(Pattern.PatId.class::isInstance);
    }

    @Test
    void exprToPattern_call_isWrappedInOtherPat() {
        Expr call = AstHelpers.opCall(Operator.PLUS, Token.fake("+"),
            List.of(AstHelpers.id(ident("a")), AstHelpers.id(ident("b"))));

        Pattern pattern = AstHelpers.exprToPattern(call);

        assertThat(pattern).isEqualTo(new Pattern.OtherPat(Pattern.OtherPatternOp.EXPR, List.of(Any.of(call))));
        assertThat(AstHelpers.patternToExpr(pattern)).isEqualTo(call);
    }

    @Test
    void patternToExpr_underscore_throwsNotAnExpr() {
        Pattern underscore = new Pattern.PatUnderscore(Token.fake("_"));

        assertThatThrownBy(() -> AstHelpers.patternToExpr(underscore))
            .isInstanceOf(AstHelpers.NotAnExprException.class)
            .hasMessageContaining("PatUnderscore");
    }

    @Test
    void opCall_encodesOperatorAsSpecialCall() {
        Token plus = Token.fake("+");

        Expr call = AstHelpers.opCall(Operator.PLUS, plus, List.of(AstHelpers.id(ident("a"))));

        assertThat(call).isInstanceOf(Expr.Call.class);
        Expr.Call c = (Expr.Call) call;
        assertThat(c.function()).isEqualTo(Expr.IdSpecial.of(new Special.Op(Operator.PLUS), plus));
        assertThat(c.arguments().value()).hasSize(1);
    }

    @Test
    void vardefToAssign_missingInitializer_assignsNull() {
        Entity entity = AstHelpers.basicEntity(ident("x"));

        Expr assign = AstHelpers.vardefToAssign(entity, new VariableDefinition(Optional.empty(), Optional.empty()));

        assertThat(assign).isInstanceOf(Expr.Assign.class);
        Expr.Assign a = (Expr.Assign) assign;
        assertThat(a.value()).isInstanceOf(Expr.Lit.class);
        assertThat(((Expr.Lit) a.value()).literal()).isInstanceOf(Literal.NullLit.class);
    }

    @Test
    void funcdefToLambda_assignsLambda() {
        Entity entity = AstHelpers.basicEntity(ident("f"));
        FunctionDefinition function = new FunctionDefinition(List.of(), Optional.empty(), Stmt.Block.of(List.of()));

        Expr assign = AstHelpers.funcdefToLambda(entity, function);

        assertThat(((Expr.Assign) assign).value()).isEqualTo(new Expr.Lambda(function));
    }

    @Test
    void paramOfId_isResolvedAsParameter() {
        ParameterClassic parameter = AstHelpers.paramOfId(ident("a"));

        assertThat(parameter.name()).contains(ident("a"));
        assertThat(parameter.info().resolved()).isPresent();
    }

    @Test
    void optToLabelIdent_mapsPresenceToVariant() {
        assertThat(AstHelpers.optToLabelIdent(Optional.empty())).isInstanceOf(Stmt.LabelIdent.LNone.class);
        assertThat(AstHelpers.optToLabelIdent(Optional.of(ident("outer")))).isInstanceOf(Stmt.LabelIdent.LId.class);
    }

    @Test
    void hasKeywordAttr_findsKeywordAmongAttributes() {
        List<Attribute> attributes = List.of(
            Attribute.KeywordAttr.of(KeywordAttribute.PUBLIC, Token.fake("public")),
            Attribute.KeywordAttr.of(KeywordAttribute.STATIC, Token.fake("static")));

        assertThat(AstHelpers.hasKeywordAttr(KeywordAttribute.STATIC, attributes)).isTrue();
        assertThat(AstHelpers.hasKeywordAttr(KeywordAttribute.FINAL, attributes)).isFalse();
    }

    @Test
    void isBooleanOperator_distinguishesLogicalOperators() {
        assertThat(AstHelpers.isBooleanOperator(Operator.AND)).isTrue();
        assertThat(AstHelpers.isBooleanOperator(Operator.EQ)).isTrue();
        assertThat(AstHelpers.isBooleanOperator(Operator.PLUS)).isFalse();
    }
}
