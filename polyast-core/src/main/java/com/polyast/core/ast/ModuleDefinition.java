package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Body of a module definition.
 *
 * @since 1.0.0
 */
public sealed interface ModuleDefinition {

    record ModuleAlias(Name name) implements ModuleDefinition {
        public ModuleAlias {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record ModuleStruct(Optional<List<Ident>> name, List<Stmt> items) implements ModuleDefinition {
        public ModuleStruct {
            name = name.map(List::copyOf);
            items = List.copyOf(items);
        }
    }

    record OtherModule(OtherModuleOp op, List<Any> payload) implements ModuleDefinition {
        public OtherModule {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum OtherModuleOp {
        /** Java 9 {@code module} declaration */
        JAVA_MODULE,
        TODO
    }
}
