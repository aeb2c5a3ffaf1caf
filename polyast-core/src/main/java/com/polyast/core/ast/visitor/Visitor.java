package com.polyast.core.ast.visitor;

import com.polyast.core.ast.Any;

/**
 * Compiled visitor returned by {@link Visitors#make}. Hooks receive it so they can
 * traverse sub-trees of their own choosing.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Visitor {

    /**
     * Walks the given node and everything below it, firing hooks pre-order.
     *
     * @param any entry node
     */
    void visit(Any any);
}
