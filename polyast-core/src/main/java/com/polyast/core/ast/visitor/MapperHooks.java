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
import java.util.function.UnaryOperator;

/**
 * Per-category callbacks for {@link Mappers#make}.
 *
 * <p>Each hook receives the node, the continuation that rebuilds the node from its
 * mapped children, and the mapper. The default returns the continuation's result. An
 * override may return a different node of the same category; returning the input
 * unchanged without calling the continuation leaves the sub-tree untouched.
 *
 * @since 1.0.0
 */
public interface MapperHooks {

    default Expr expr(Expr expr, UnaryOperator<Expr> k, Mapper mapper) {
        return k.apply(expr);
    }

    default Stmt stmt(Stmt stmt, UnaryOperator<Stmt> k, Mapper mapper) {
        return k.apply(stmt);
    }

    default Type type(Type type, UnaryOperator<Type> k, Mapper mapper) {
        return k.apply(type);
    }

    default Pattern pattern(Pattern pattern, UnaryOperator<Pattern> k, Mapper mapper) {
        return k.apply(pattern);
    }

    default Definition definition(Definition definition, UnaryOperator<Definition> k, Mapper mapper) {
        return k.apply(definition);
    }

    default Directive directive(Directive directive, UnaryOperator<Directive> k, Mapper mapper) {
        return k.apply(directive);
    }

    default Attribute attribute(Attribute attribute, UnaryOperator<Attribute> k, Mapper mapper) {
        return k.apply(attribute);
    }

    default Parameter parameter(Parameter parameter, UnaryOperator<Parameter> k, Mapper mapper) {
        return k.apply(parameter);
    }

    default Argument argument(Argument argument, UnaryOperator<Argument> k, Mapper mapper) {
        return k.apply(argument);
    }

    default Ident ident(Ident ident, UnaryOperator<Ident> k, Mapper mapper) {
        return k.apply(ident);
    }

    default Entity entity(Entity entity, UnaryOperator<Entity> k, Mapper mapper) {
        return k.apply(entity);
    }

    default List<Stmt> stmts(List<Stmt> stmts, UnaryOperator<List<Stmt>> k, Mapper mapper) {
        return k.apply(stmts);
    }

    default FunctionDefinition functionDefinition(FunctionDefinition function,
                                                  UnaryOperator<FunctionDefinition> k, Mapper mapper) {
        return k.apply(function);
    }

    default ClassDefinition classDefinition(ClassDefinition classDefinition,
                                            UnaryOperator<ClassDefinition> k, Mapper mapper) {
        return k.apply(classDefinition);
    }

    /** Fired for every token occurrence; the continuation is the identity. */
    default Token token(Token token, UnaryOperator<Token> k, Mapper mapper) {
        return k.apply(token);
    }
}
