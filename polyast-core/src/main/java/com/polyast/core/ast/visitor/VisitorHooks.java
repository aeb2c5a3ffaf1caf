package com.polyast.core.ast.visitor;

import com.polyast.core.ast.Argument;
import com.polyast.core.ast.Attribute;
import com.polyast.core.ast.ClassDefinition;
import com.polyast.core.ast.Definition;
import com.polyast.core.ast.Directive;
import com.polyast.core.ast.Entity;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.FunctionDefinition;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.Type;

import java.util.List;
import java.util.function.Consumer;

/**
 * Per-category callbacks for {@link Visitors#make}.
 *
 * <p>Each hook receives the node, the continuation that performs the default
 * recursion into the node's children, and the visitor itself. Every default calls the
 * continuation; an override decides whether, and when, to recurse. Skipping the
 * continuation prunes the sub-tree.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<String> calls = new ArrayList<>();
 * Visitor visitor = Visitors.make(new VisitorHooks() {
 *     @Override
 *     public void expr(Expr expr, Consumer<Expr> k, Visitor v) {
 *         if (expr instanceof Expr.Call call && call.function() instanceof Expr.Id id) {
 *             calls.add(id.ident().name());
 *         }
 *         k.accept(expr);
 *     }
 * });
 * visitor.visit(Any.program(program));
 * }</pre>
 *
 * @since 1.0.0
 */
public interface VisitorHooks {

    default void expr(Expr expr, Consumer<Expr> k, Visitor visitor) {
        k.accept(expr);
    }

    default void stmt(Stmt stmt, Consumer<Stmt> k, Visitor visitor) {
        k.accept(stmt);
    }

    default void type(Type type, Consumer<Type> k, Visitor visitor) {
        k.accept(type);
    }

    default void pattern(Pattern pattern, Consumer<Pattern> k, Visitor visitor) {
        k.accept(pattern);
    }

    default void definition(Definition definition, Consumer<Definition> k, Visitor visitor) {
        k.accept(definition);
    }

    default void directive(Directive directive, Consumer<Directive> k, Visitor visitor) {
        k.accept(directive);
    }

    default void attribute(Attribute attribute, Consumer<Attribute> k, Visitor visitor) {
        k.accept(attribute);
    }

    default void parameter(Parameter parameter, Consumer<Parameter> k, Visitor visitor) {
        k.accept(parameter);
    }

    default void argument(Argument argument, Consumer<Argument> k, Visitor visitor) {
        k.accept(argument);
    }

    default void ident(Ident ident, Consumer<Ident> k, Visitor visitor) {
        k.accept(ident);
    }

    default void entity(Entity entity, Consumer<Entity> k, Visitor visitor) {
        k.accept(entity);
    }

    /** Fired for every statement sequence: program, block body, case body. */
    default void stmts(List<Stmt> stmts, Consumer<List<Stmt>> k, Visitor visitor) {
        k.accept(stmts);
    }

    default void functionDefinition(FunctionDefinition function, Consumer<FunctionDefinition> k, Visitor visitor) {
        k.accept(function);
    }

    default void classDefinition(ClassDefinition classDefinition, Consumer<ClassDefinition> k, Visitor visitor) {
        k.accept(classDefinition);
    }

    /** Fired for every token occurrence; tokens have no children. */
    default void token(Token token, Consumer<Token> k, Visitor visitor) {
        k.accept(token);
    }
}
