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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Visitors}.
 */
class VisitorsTest {

    private static Token token(String text, int column) {
        return Token.of(text, new Location("t.js", 1, column, column - 1));
    }

    private static Expr id(String name, int column) {
        return Expr.Id.of(new Ident(name, token(name, column)));
    }

    @Test
    void defaultHooks_visitEveryTokenOnce() {
        // return a + b
        Expr sum = AstHelpers.opCall(Operator.PLUS, token("+", 10), List.of(id("a", 8), id("b", 12)));
        Stmt ret = new Stmt.Return(token("return", 1), Optional.of(sum));

        List<Token> tokens = new ArrayList<>();
        Visitors.make(new VisitorHooks() {
            @Override
            public void token(Token token, Consumer<Token> k, Visitor visitor) {
                tokens.add(token);
            }
        }).visit(Any.of(ret));

        // the call brackets are fake parentheses
        assertThat(tokens).extracting(Token::text).containsExactlyInAnyOrder("return", "+", "(", "a", "b", ")");
    }

    @Test
    void otherPayloads_areTraversed() {
        Token hidden = token("hidden", 5);
        Expr inner = id("x", 12);
        Expr other = new Expr.OtherExpr(Expr.OtherExprOp.TODO, List.of(Any.of(hidden), Any.of(inner)));

        List<String> idents = new ArrayList<>();
        List<Token> tokens = new ArrayList<>();
        Visitors.make(new VisitorHooks() {
            @Override
            public void ident(Ident ident, Consumer<Ident> k, Visitor visitor) {
                idents.add(ident.name());
                k.accept(ident);
            }

            @Override
            public void token(Token token, Consumer<Token> k, Visitor visitor) {
                tokens.add(token);
            }
        }).visit(Any.of(other));

        assertThat(idents).containsExactly("x");
        assertThat(tokens).extracting(Token::text).containsExactly("hidden", "x");
    }

    @Test
    void hookNotCallingContinuation_prunesSubtree() {
        Expr call = AstHelpers.opCall(Operator.MINUS, token("-", 3), List.of(id("a", 1), id("b", 5)));
        Stmt stmt = new Stmt.ExprStmt(call, token(";", 6));

        List<Token> tokens = new ArrayList<>();
        Visitors.make(new VisitorHooks() {
            @Override
            public void expr(Expr expr, Consumer<Expr> k, Visitor visitor) {
                // skip every expression
            }

            @Override
            public void token(Token token, Consumer<Token> k, Visitor visitor) {
                tokens.add(token);
            }
        }).visit(Any.of(stmt));

        assertThat(tokens).extracting(Token::text).containsExactly(";");
    }

    @Test
    void exprHook_firesPreOrder() {
        Expr inner = AstHelpers.opCall(Operator.MULT, token("*", 3), List.of(id("a", 1), id("b", 5)));
        Expr outer = AstHelpers.opCall(Operator.PLUS, token("+", 7), List.of(inner, id("c", 9)));

        List<Expr> calls = new ArrayList<>();
        Visitors.make(new VisitorHooks() {
            @Override
            public void expr(Expr expr, Consumer<Expr> k, Visitor visitor) {
                if (expr instanceof Expr.Call) {
                    calls.add(expr);
                }
                k.accept(expr);
            }
        }).visit(Any.of(outer));

        assertThat(calls).containsExactly(outer, inner);
    }
}
