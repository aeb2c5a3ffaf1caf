package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Result of name resolution for an identifier occurrence.
 *
 * <p>Normalizers only fill this in when the language AST already carries a resolution
 * hint (Python names, Java method parameters); a later resolution pass is expected to
 * complete it through {@link IdInfo}.
 *
 * @param kind what the name refers to
 * @param sid scope-unique id, {@link #SID_TODO} until a resolver assigns one
 * @since 1.0.0
 */
public record ResolvedName(ResolvedKind kind, int sid) {

    /** Sentinel id for names not yet assigned by a resolver. */
    public static final int SID_TODO = -1;

    private static final AtomicInteger COUNTER = new AtomicInteger();

    public ResolvedName {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Hands out a fresh process-unique id.
     */
    public static int gensym() {
        return COUNTER.incrementAndGet();
    }

    public static ResolvedName unresolved(ResolvedKind kind) {
        return new ResolvedName(kind, SID_TODO);
    }

    /**
     * Closed set of resolution kinds.
     */
    public sealed interface ResolvedKind {
        record Global() implements ResolvedKind {}

        record Local() implements ResolvedKind {}

        record Param() implements ResolvedKind {}

        /** Variable captured from an enclosing function. */
        record EnclosedVar() implements ResolvedKind {}

        record ImportedEntity(List<Ident> dotted) implements ResolvedKind {
            public ImportedEntity {
                dotted = List.copyOf(dotted);
            }
        }

        record ImportedModule(ModuleName module) implements ResolvedKind {
            public ImportedModule {
                Objects.requireNonNull(module, "module must not be null");
            }
        }

        record TypeName() implements ResolvedKind {}

        record Macro() implements ResolvedKind {}

        record EnumConstant() implements ResolvedKind {}
    }
}
