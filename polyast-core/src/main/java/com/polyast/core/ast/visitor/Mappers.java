package com.polyast.core.ast.visitor;

/**
 * Factory for hook-based structure-preserving maps.
 *
 * @since 1.0.0
 */
public final class Mappers {

    private Mappers() {
        // Utility class - no instantiation
    }

    /**
     * Compiles hooks into a fresh mapper.
     *
     * @param hooks callbacks, usually an anonymous subclass of {@link MapperHooks}
     * @return mapper entry point
     */
    public static Mapper make(MapperHooks hooks) {
        return new GenericMapper(hooks);
    }
}
