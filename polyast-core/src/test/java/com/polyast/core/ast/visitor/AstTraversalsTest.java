package com.polyast.core.ast.visitor;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.AstHelpers;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Location;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AstTraversals}.
 */
class AstTraversalsTest {

    private static Token token(String text, int line, int column) {
        return Token.of(text, new Location("t.js", line, column, 0));
    }

    private static Expr id(String name, int line, int column) {
        return Expr.Id.of(new Ident(name, token(name, line, column)));
    }

    // ==================== extractTokens ====================

    @Test
    void extractTokens_ordersBySourcePosition() {
        // operator token is visited before its operands but lies between them
        Expr sum = AstHelpers.opCall(Operator.PLUS, token("+", 1, 3), List.of(id("a", 1, 1), id("b", 1, 5)));

        List<Token> tokens = AstTraversals.extractTokens(Any.of(sum));

        assertThat(tokens).filteredOn(Token::isOrigin).extracting(Token::text).containsExactly("a", "+", "b");
    }

    @Test
    void extractTokens_keepsEveryOccurrence() {
        Expr sum = AstHelpers.opCall(Operator.PLUS, token("+", 1, 3), List.of(id("a", 1, 1), id("b", 1, 5)));

        List<Token> tokens = AstTraversals.extractTokens(Any.of(sum));

        // two fake brackets plus three origin tokens
        assertThat(tokens).hasSize(5);
        assertThat(tokens).filteredOn(Token::isFake).extracting(Token::text).containsExactly("(", ")");
    }

    @Test
    void extractTokens_fakeTokensFollowPrecedingOriginToken() {
        Stmt first = new Stmt.ExprStmt(id("x", 1, 1), Token.fake(";"));
        Stmt second = new Stmt.ExprStmt(id("y", 2, 1), token(";", 2, 2));

        List<Token> tokens = AstTraversals.extractTokens(Any.program(List.of(second, first)));

        assertThat(tokens).extracting(Token::text).containsExactly("x", ";", "y", ";");
        assertThat(tokens.get(1).isFake()).isTrue();
        assertThat(tokens.get(3).isOrigin()).isTrue();
    }

    @Test
    void extractTokens_withOnlyFakeTokens_keepsTraversalOrder() {
        Stmt stmt = new Stmt.ExprStmt(AstHelpers.id(Ident.fake("a")), Token.fake(";"));

        assertThat(AstTraversals.extractTokens(Any.of(stmt))).extracting(Token::text).containsExactly("a", ";");
    }

    // ==================== range ====================

    @Test
    void range_returnsExtremePositions() {
        Stmt ret = new Stmt.Return(token("return", 1, 1),
            Optional.of(AstHelpers.opCall(Operator.PLUS, token("+", 2, 3), List.of(id("a", 1, 8), id("b", 3, 1)))));

        Optional<List<Token>> range = AstTraversals.range(Any.of(ret));

        assertThat(range).isPresent();
        assertThat(range.get()).extracting(Token::text).containsExactly("return", "b");
    }

    @Test
    void range_withoutPositionedTokens_isEmpty() {
        Stmt stmt = new Stmt.ExprStmt(AstHelpers.id(Ident.fake("a")), Token.fake(";"));

        assertThat(AstTraversals.range(Any.of(stmt))).isEmpty();
    }

    // ==================== abstractPositionInfo ====================

    @Test
    void abstractPositionInfo_makesLayoutIrrelevant() {
        Expr compact = AstHelpers.opCall(Operator.PLUS, token("+", 1, 2), List.of(id("a", 1, 1), id("b", 1, 3)));
        Expr spread = AstHelpers.opCall(Operator.PLUS, token("+", 2, 7), List.of(id("a", 1, 5), id("b", 4, 9)));

        assertThat(Any.of(compact)).isNotEqualTo(Any.of(spread));
        assertThat(AstTraversals.abstractPositionInfo(Any.of(compact)))
            .isEqualTo(AstTraversals.abstractPositionInfo(Any.of(spread)));
    }

    @Test
    void abstractPositionInfo_isIdempotent() {
        Expr expr = AstHelpers.opCall(Operator.MINUS, token("-", 1, 3), List.of(id("a", 1, 1), id("b", 1, 5)));

        Any once = AstTraversals.abstractPositionInfo(Any.of(expr));
        Any twice = AstTraversals.abstractPositionInfo(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void abstractPositionInfo_keepsFakeFlagAndErasesPositions() {
        Expr expr = AstHelpers.opCall(Operator.PLUS, token("+", 1, 3), List.of(id("a", 1, 1), id("b", 1, 5)));

        List<Token> tokens = AstTraversals.extractTokens(AstTraversals.abstractPositionInfo(Any.of(expr)));

        assertThat(tokens).noneMatch(Token::isOrigin);
        assertThat(tokens).filteredOn(Token::isFake).hasSize(2);
        assertThat(tokens).filteredOn(Token::isAbstract).hasSize(3);
    }

    @Test
    void abstractPositionInfo_reachesOtherPayloads() {
        Expr other = new Expr.OtherExpr(Expr.OtherExprOp.TODO, List.of(Any.of(token("debugger", 1, 1))));

        Any abstracted = AstTraversals.abstractPositionInfo(Any.of(other));

        assertThat(AstTraversals.range(abstracted)).isEmpty();
    }
}
