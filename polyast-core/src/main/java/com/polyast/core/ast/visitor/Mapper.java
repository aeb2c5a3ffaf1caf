package com.polyast.core.ast.visitor;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.Type;

/**
 * Compiled structure-preserving map returned by {@link Mappers#make}.
 *
 * <p>A mapper remembers which {@link com.polyast.core.ast.IdInfo} cells it has already
 * rebuilt, so cells shared inside one input stay shared in the output. The table is
 * reset at the start of every top-level {@link #map(Any)} call; the node-level methods
 * share it with the enclosing {@code map} call or, outside one, with the previous one.
 * It is not thread-safe.
 *
 * @since 1.0.0
 */
public interface Mapper {

    /**
     * Rebuilds the given node depth-first, applying the hooks.
     *
     * @param any entry node
     * @return rebuilt node of the same {@link Any} variant
     */
    Any map(Any any);

    Expr mapExpr(Expr expr);

    Stmt mapStmt(Stmt stmt);

    Type mapType(Type type);

    Token mapToken(Token token);
}
