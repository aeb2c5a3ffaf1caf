package com.polyast.core.ast;

import java.util.List;

/**
 * Preprocessor-style macro.
 *
 * @param parameters macro parameters
 * @param body macro body, kept as loose fragments
 * @since 1.0.0
 */
public record MacroDefinition(List<Ident> parameters, List<Any> body) {

    public MacroDefinition {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }
}
