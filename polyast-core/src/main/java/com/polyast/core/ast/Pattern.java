package com.polyast.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic pattern, used by catch clauses, for-each headers, switch cases and
 * destructuring assignments. Identifier patterns introduce new variables.
 *
 * @since 1.0.0
 */
public sealed interface Pattern {

    record PatLiteral(Literal literal) implements Pattern {
        public PatLiteral {
            Objects.requireNonNull(literal, "literal must not be null");
        }
    }

    record PatConstructor(Name name, List<Pattern> arguments) implements Pattern {
        public PatConstructor {
            Objects.requireNonNull(name, "name must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    record PatRecord(Bracket<List<FieldPattern>> fields) implements Pattern {
        public PatRecord {
            Objects.requireNonNull(fields, "fields must not be null");
            fields = fields.withValue(List.copyOf(fields.value()));
        }
    }

    record PatId(Ident ident, IdInfo info) implements Pattern {
        public PatId {
            Objects.requireNonNull(ident, "ident must not be null");
            Objects.requireNonNull(info, "info must not be null");
        }
    }

    record PatTuple(List<Pattern> elements) implements Pattern {
        public PatTuple {
            elements = List.copyOf(elements);
        }
    }

    record PatList(Bracket<List<Pattern>> elements) implements Pattern {
        public PatList {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = elements.withValue(List.copyOf(elements.value()));
        }
    }

    record PatKeyVal(Pattern key, Pattern value) implements Pattern {
        public PatKeyVal {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record PatUnderscore(Token token) implements Pattern {
        public PatUnderscore {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** Source-level alternative, e.g. OCaml {@code A | B}. */
    record PatDisj(Pattern left, Pattern right) implements Pattern {
        public PatDisj {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record PatTyped(Pattern pattern, Type type) implements Pattern {
        public PatTyped {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    record PatWhen(Pattern pattern, Expr guard) implements Pattern {
        public PatWhen {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(guard, "guard must not be null");
        }
    }

    record PatAs(Pattern pattern, Ident alias, IdInfo info) implements Pattern {
        public PatAs {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(alias, "alias must not be null");
            Objects.requireNonNull(info, "info must not be null");
        }
    }

    /** Type test without binding. */
    record PatType(Type type) implements Pattern {
        public PatType {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** Typed variable binding, e.g. the {@code Exception e} of a Java catch. */
    record PatVar(Type type, Optional<Ident> ident, IdInfo info) implements Pattern {
        public PatVar {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(ident, "ident must not be null");
            Objects.requireNonNull(info, "info must not be null");
        }
    }

    /** Pattern disjunction. */
    record DisjPat(Pattern left, Pattern right) implements Pattern {
        public DisjPat {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record OtherPat(OtherPatternOp op, List<Any> payload) implements Pattern {
        public OtherPat {
            Objects.requireNonNull(op, "op must not be null");
            payload = List.copyOf(payload);
        }
    }

    record FieldPattern(Name name, Pattern pattern) {
        public FieldPattern {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(pattern, "pattern must not be null");
        }
    }

    enum OtherPatternOp {
        /** Expression in pattern position that has no pattern counterpart */
        EXPR,
        /** Binding introduced by a declaration keyword, as in {@code for (var k in o)} */
        DECLARATION,
        TODO
    }
}
