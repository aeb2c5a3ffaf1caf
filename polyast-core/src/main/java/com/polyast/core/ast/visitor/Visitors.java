package com.polyast.core.ast.visitor;

/**
 * Factory for hook-based visitors.
 *
 * @since 1.0.0
 */
public final class Visitors {

    private static final VisitorHooks DEFAULT_HOOKS = new VisitorHooks() {
    };

    private Visitors() {
        // Utility class - no instantiation
    }

    /**
     * Hooks that only recurse.
     */
    public static VisitorHooks defaultHooks() {
        return DEFAULT_HOOKS;
    }

    /**
     * Compiles hooks into a visitor. The visitor is stateless and may be reused.
     *
     * @param hooks callbacks, usually an anonymous subclass of {@link VisitorHooks}
     * @return visitor entry point
     */
    public static Visitor make(VisitorHooks hooks) {
        return new GenericVisitor(hooks);
    }
}
