package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Import, package and export declarations.
 *
 * @since 1.0.0
 */
public sealed interface Directive {

    /** {@code from m import x as y}, Java {@code import a.b.C}. */
    record ImportFrom(Token token, ModuleName module, Ident name, Optional<Ident> alias) implements Directive {
        public ImportFrom {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(alias, "alias must not be null");
        }
    }

    /** {@code import m as n}. */
    record ImportAs(Token token, ModuleName module, Optional<Ident> alias) implements Directive {
        public ImportAs {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(alias, "alias must not be null");
        }
    }

    /** {@code from m import *}, Java {@code import a.b.*}. */
    record ImportAll(Token token, ModuleName module, Token star) implements Directive {
        public ImportAll {
            Objects.requireNonNull(token, "token must not be null");
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(star, "star must not be null");
        }
    }

    record Package(Token token, List<Ident> name) implements Directive {
        public Package {
            Objects.requireNonNull(token, "token must not be null");
            name = List.copyOf(name);
        }
    }

    record PackageEnd(Token token) implements Directive {
        public PackageEnd {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    record OtherDirective(OtherDirectiveOp op, List<Any> payload) implements Directive {
        public OtherDirective {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    enum OtherDirectiveOp {
        EXPORT,
        IMPORT_CSS,
        /** Import executed for its side effects only, e.g. JavaScript {@code import "polyfill"} */
        IMPORT_EFFECT,
        /** Java {@code import static}; the payload holds the plain import */
        STATIC_IMPORT
    }
}
