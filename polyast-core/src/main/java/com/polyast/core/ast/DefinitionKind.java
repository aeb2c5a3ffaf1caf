package com.polyast.core.ast;

import java.util.Objects;

/**
 * What a {@link Definition} defines.
 *
 * @since 1.0.0
 */
public sealed interface DefinitionKind {

    /** Introduces a new scope for the parameters. */
    record FuncDef(FunctionDefinition function) implements DefinitionKind {
        public FuncDef {
            Objects.requireNonNull(function, "function must not be null");
        }
    }

    /** Introduces a new variable in the enclosing scope. */
    record VarDef(VariableDefinition variable) implements DefinitionKind {
        public VarDef {
            Objects.requireNonNull(variable, "variable must not be null");
        }
    }

    record TypeDef(TypeDefinition type) implements DefinitionKind {
        public TypeDef {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    record ClassDef(ClassDefinition classDefinition) implements DefinitionKind {
        public ClassDef {
            Objects.requireNonNull(classDefinition, "classDefinition must not be null");
        }
    }

    record ModuleDef(ModuleDefinition module) implements DefinitionKind {
        public ModuleDef {
            Objects.requireNonNull(module, "module must not be null");
        }
    }

    record MacroDef(MacroDefinition macro) implements DefinitionKind {
        public MacroDef {
            Objects.requireNonNull(macro, "macro must not be null");
        }
    }

    /** Declaration without body, e.g. a C prototype. */
    record Signature(Type type) implements DefinitionKind {
        public Signature {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** Python {@code global x} / {@code nonlocal x}: the name refers to an outer binding. */
    record UseOuterDecl(Token token) implements DefinitionKind {
        public UseOuterDecl {
            Objects.requireNonNull(token, "token must not be null");
        }
    }
}
