package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Module reference used by imports: a dotted name ({@code java.util}) or a file path
 * ({@code "./utils"}, Python relative imports).
 *
 * @since 1.0.0
 */
public sealed interface ModuleName {

    record DottedName(List<Ident> parts) implements ModuleName {
        public DottedName {
            parts = List.copyOf(parts);
            if (parts.isEmpty()) {
                throw new IllegalArgumentException("dotted name must have at least one part");
            }
        }
    }

    record FileName(Wrap<String> path) implements ModuleName {
        public FileName {
            Objects.requireNonNull(path, "path must not be null");
        }
    }
}
