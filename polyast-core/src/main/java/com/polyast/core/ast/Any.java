package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Handle on any node of the generic AST.
 *
 * <p>Used as the entry point of {@link com.polyast.core.ast.visitor.Visitor} and
 * {@link com.polyast.core.ast.visitor.Mapper}, and as the element type of every
 * {@code Other*} escape-hatch payload.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Token> tokens = AstTraversals.extractTokens(Any.of(expr));
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface Any {

    static Any of(Expr expr) {
        return new AExpr(expr);
    }

    static Any of(Stmt stmt) {
        return new AStmt(stmt);
    }

    static Any of(Type type) {
        return new AType(type);
    }

    static Any of(Pattern pattern) {
        return new APattern(pattern);
    }

    static Any of(Token token) {
        return new AToken(token);
    }

    static Any of(Ident ident) {
        return new AIdent(ident);
    }

    static Any of(Definition definition) {
        return new ADef(definition);
    }

    static Any of(Directive directive) {
        return new ADir(directive);
    }

    static Any of(Argument argument) {
        return new AArg(argument);
    }

    static Any of(Attribute attribute) {
        return new AAttr(attribute);
    }

    static Any program(List<Stmt> program) {
        return new AProgram(program);
    }

    record AIdent(Ident ident) implements Any {
        public AIdent {
            Objects.requireNonNull(ident, "ident must not be null");
        }
    }

    record AName(Name name) implements Any {
        public AName {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record AEntity(Entity entity) implements Any {
        public AEntity {
            Objects.requireNonNull(entity, "entity must not be null");
        }
    }

    record AExpr(Expr expr) implements Any {
        public AExpr {
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }

    record AStmt(Stmt stmt) implements Any {
        public AStmt {
            Objects.requireNonNull(stmt, "stmt must not be null");
        }
    }

    record AType(Type type) implements Any {
        public AType {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    record APattern(Pattern pattern) implements Any {
        public APattern {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }
    }

    record ADef(Definition definition) implements Any {
        public ADef {
            Objects.requireNonNull(definition, "definition must not be null");
        }
    }

    record ADir(Directive directive) implements Any {
        public ADir {
            Objects.requireNonNull(directive, "directive must not be null");
        }
    }

    record AParam(Parameter parameter) implements Any {
        public AParam {
            Objects.requireNonNull(parameter, "parameter must not be null");
        }
    }

    record AArg(Argument argument) implements Any {
        public AArg {
            Objects.requireNonNull(argument, "argument must not be null");
        }
    }

    record AAttr(Attribute attribute) implements Any {
        public AAttr {
            Objects.requireNonNull(attribute, "attribute must not be null");
        }
    }

    record ADefKind(DefinitionKind kind) implements Any {
        public ADefKind {
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }

    record ADotted(List<Ident> dotted) implements Any {
        public ADotted {
            dotted = List.copyOf(dotted);
        }
    }

    record AField(Field field) implements Any {
        public AField {
            Objects.requireNonNull(field, "field must not be null");
        }
    }

    record AStmts(List<Stmt> stmts) implements Any {
        public AStmts {
            stmts = List.copyOf(stmts);
        }
    }

    record AToken(Token token) implements Any {
        public AToken {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    record AProgram(List<Stmt> stmts) implements Any {
        public AProgram {
            stmts = List.copyOf(stmts);
        }
    }
}
