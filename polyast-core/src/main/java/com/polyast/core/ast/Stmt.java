package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic statement.
 *
 * <p>Every statement produced by a normalizer carries at least one token, usually the
 * leading keyword. {@link Block} introduces a new scope.
 *
 * @since 1.0.0
 */
public sealed interface Stmt {

    record ExprStmt(Expr expr, Token semicolon) implements Stmt {
        public ExprStmt {
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(semicolon, "semicolon must not be null");
        }
    }

    record DefStmt(Definition definition) implements Stmt {
        public DefStmt {
            Objects.requireNonNull(definition, "definition must not be null");
        }
    }

    record DirectiveStmt(Directive directive) implements Stmt {
        public DirectiveStmt {
            Objects.requireNonNull(directive, "directive must not be null");
        }
    }

    record Block(Bracket<List<Stmt>> stmts) implements Stmt {
        public Block {
            Objects.requireNonNull(stmts, "stmts must not be null");
            stmts = stmts.withValue(List.copyOf(stmts.value()));
        }

        public static Block of(List<Stmt> stmts) {
            return new Block(Bracket.fake(stmts));
        }
    }

    record If(Token token, Expr condition, Stmt thenStmt, Optional<Stmt> elseStmt) implements Stmt {
        public If {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenStmt, "thenStmt must not be null");
            Objects.requireNonNull(elseStmt, "elseStmt must not be null");
        }
    }

    record While(Token token, Expr condition, Stmt body) implements Stmt {
        public While {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record DoWhile(Token token, Stmt body, Expr condition) implements Stmt {
        public DoWhile {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
        }
    }

    record For(Token token, ForHeader header, Stmt body) implements Stmt {
        public For {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(header, "header must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /**
     * @param selector switched-on value, absent for Go-style condition switches
     */
    record Switch(Token token, Optional<Expr> selector, List<CaseAndBody> cases) implements Stmt {
        public Switch {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(selector, "selector must not be null");
            cases = List.copyOf(cases);
        }
    }

    record Return(Token token, Optional<Expr> value) implements Stmt {
        public Return {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Continue(Token token, LabelIdent label) implements Stmt {
        public Continue {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(label, "label must not be null");
        }
    }

    record Break(Token token, LabelIdent label) implements Stmt {
        public Break {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(label, "label must not be null");
        }
    }

    record Label(Ident label, Stmt body) implements Stmt {
        public Label {
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record Goto(Token token, Ident label) implements Stmt {
        public Goto {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(label, "label must not be null");
        }
    }

    record Throw(Token token, Expr value) implements Stmt {
        public Throw {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Try(Token token, Stmt body, List<Catch> catches, Optional<Finally> finallyClause) implements Stmt {
        public Try {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(body, "body must not be null");
            catches = List.copyOf(catches);
            Objects.requireNonNull(finallyClause, "finallyClause must not be null");
        }
    }

    record Assert(Token token, Expr condition, Optional<Expr> message) implements Stmt {
        public Assert {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /** Pattern disjunction. */
    record DisjStmt(Stmt left, Stmt right) implements Stmt {
        public DisjStmt {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /** Statement construct that wraps exactly one expression and one nested statement. */
    record OtherStmtWithStmt(OtherStmtWithStmtOp op, Expr expr, Stmt body) implements Stmt {
        public OtherStmtWithStmt {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /**
     * Statement construct with no dedicated variant. The payload never holds nested
     * statements; constructs with a body use {@link OtherStmtWithStmt}.
     */
    record OtherStmt(OtherStmtOp op, List<Any> payload) implements Stmt {
        public OtherStmt {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
            for (Any any : payload) {
                if (any instanceof Any.AStmt || any instanceof Any.AStmts || any instanceof Any.AProgram
                    || any instanceof Any.ADef || any instanceof Any.AField) {
                    throw new IllegalArgumentException(
                        "OtherStmt(" + op + ") payload must not contain statements: " + any.getClass().getSimpleName());
                }
            }
        }
    }

    /**
     * Cases sharing one body; several cases fall through to the same statement.
     */
    record CaseAndBody(List<Case> cases, Stmt body) {
        public CaseAndBody {
            cases = List.copyOf(cases);
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    sealed interface Case {
        record CasePattern(Token token, Pattern pattern) implements Case {
            public CasePattern {
                Objects.requireNonNull(token, "token must not be null");
                Objects.requireNonNull(pattern, "pattern must not be null");
            }
        }

        record Default(Token token) implements Case {
            public Default {
                Objects.requireNonNull(token, "token must not be null");
            }
        }

        /** Case whose label is an arbitrary expression compared by equality. */
        record CaseEqualExpr(Token token, Expr expr) implements Case {
            public CaseEqualExpr {
                Objects.requireNonNull(token, "token must not be null");
                Objects.requireNonNull(expr, "expr must not be null");
            }
        }
    }

    /** Introduces new variables bound by its pattern. */
    record Catch(Token token, Pattern pattern, Stmt body) {
        public Catch {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record Finally(Token token, Stmt body) {
        public Finally {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    sealed interface LabelIdent {
        record LNone() implements LabelIdent {}

        record LId(Ident label) implements LabelIdent {
            public LId {
                Objects.requireNonNull(label, "label must not be null");
            }
        }

        /** PHP {@code break 2}. */
        record LInt(Wrap<Integer> depth) implements LabelIdent {
            public LInt {
                Objects.requireNonNull(depth, "depth must not be null");
            }
        }

        record LDynamic(Expr expr) implements LabelIdent {
            public LDynamic {
                Objects.requireNonNull(expr, "expr must not be null");
            }
        }
    }

    sealed interface ForHeader {
        /**
         * {@code for (init; cond; next)}. Absent clauses stay empty, several updates form a
         * {@link Expr.Seq}.
         */
        record ForClassic(List<ForVarOrExpr> init, Optional<Expr> condition, Optional<Expr> next)
            implements ForHeader {
            public ForClassic {
                init = List.copyOf(init);
                Objects.requireNonNull(condition, "condition must not be null");
                Objects.requireNonNull(next, "next must not be null");
            }
        }

        /** {@code for (pattern in iterable)}; introduces the variables bound by the pattern. */
        record ForEach(Pattern pattern, Token in, Expr iterable) implements ForHeader {
            public ForEach {
                Objects.requireNonNull(pattern, "pattern must not be null");
                Objects.requireNonNull(in, "in must not be null");
                Objects.requireNonNull(iterable, "iterable must not be null");
            }
        }
    }

    sealed interface ForVarOrExpr {
        record ForInitVar(Entity entity, VariableDefinition definition) implements ForVarOrExpr {
            public ForInitVar {
                Objects.requireNonNull(entity, "entity must not be null");
                Objects.requireNonNull(definition, "definition must not be null");
            }
        }

        record ForInitExpr(Expr expr) implements ForVarOrExpr {
            public ForInitExpr {
                Objects.requireNonNull(expr, "expr must not be null");
            }
        }
    }

    /**
     * Statement constructs with a nested body. Constructs introduced by a bare keyword
     * ({@code else}, {@code async}) carry that keyword as a unit literal expression.
     */
    enum OtherStmtWithStmtOp {
        /** Python/JavaScript {@code with}; the expression is the context value */
        WITH,
        /** Java {@code synchronized (lock) body}; the expression is the lock */
        SYNC,
        /** {@code else} branch of a Python {@code for}, placed right after the loop */
        FOR_OR_ELSE,
        /** {@code else} branch of a Python {@code while}, placed right after the loop */
        WHILE_OR_ELSE,
        /** {@code else} branch of a Python {@code try}, placed right after the try */
        TRY_OR_ELSE,
        /** Python {@code async for} and {@code async with} */
        ASYNC
    }

    enum OtherStmtOp {
        DELETE,
        THROW_FROM,
        THROW_NOTHING,
        PASS,
        ASM,
        GO,
        DEFER,
        FALLTHROUGH,
        GLOBAL_COMPLEX,
        TODO
    }
}
