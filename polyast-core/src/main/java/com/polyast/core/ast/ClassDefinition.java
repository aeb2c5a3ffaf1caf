package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Class, interface or trait definition.
 *
 * @param kind what flavor of class this is, with its keyword token
 * @param extendsTypes superclasses (several for Python)
 * @param implementsTypes implemented interfaces
 * @param mixins mixed-in traits
 * @param body members
 * @since 1.0.0
 */
public record ClassDefinition(
    Wrap<ClassKind> kind,
    List<Type> extendsTypes,
    List<Type> implementsTypes,
    List<Type> mixins,
    Bracket<List<Field>> body
) {

    public ClassDefinition {
        Objects.requireNonNull(kind, "kind must not be null");
        extendsTypes = List.copyOf(extendsTypes);
        implementsTypes = List.copyOf(implementsTypes);
        mixins = List.copyOf(mixins);
        Objects.requireNonNull(body, "body must not be null");
        body = body.withValue(List.copyOf(body.value()));
    }

    public enum ClassKind {
        CLASS,
        INTERFACE,
        TRAIT,
        /** Java enum with members or constant bodies */
        ENUM,
        RECORD,
        /** Java {@code @interface} */
        ANNOTATION
    }
}
