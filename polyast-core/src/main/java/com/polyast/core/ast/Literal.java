package com.polyast.core.ast;

import java.util.Objects;

/**
 * Literal values. Numeric and string literals keep their source text.
 *
 * @since 1.0.0
 */
public sealed interface Literal {

    /**
     * Token of the literal.
     */
    Token token();

    record BoolLit(Wrap<Boolean> value) implements Literal {
        public BoolLit {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Token token() {
            return value.token();
        }
    }

    record IntLit(Wrap<String> value) implements Literal {
        public IntLit {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Token token() {
            return value.token();
        }
    }

    record FloatLit(Wrap<String> value) implements Literal {
        public FloatLit {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Token token() {
            return value.token();
        }
    }

    record CharLit(Wrap<String> value) implements Literal {
        public CharLit {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Token token() {
            return value.token();
        }
    }

    /** String literal; the value is the unquoted content. */
    record StringLit(Wrap<String> value) implements Literal {
        public StringLit {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Token token() {
            return value.token();
        }
    }

    record RegexpLit(Wrap<String> value) implements Literal {
        public RegexpLit {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Token token() {
            return value.token();
        }
    }

    /** {@code ()} or an absent value. */
    record UnitLit(Token token) implements Literal {
        public UnitLit {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** {@code null}, {@code None}. */
    record NullLit(Token token) implements Literal {
        public NullLit {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** JavaScript {@code undefined}. */
    record UndefinedLit(Token token) implements Literal {
        public UndefinedLit {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** Imaginary number, e.g. Python {@code 3j}. */
    record ImagLit(Wrap<String> value) implements Literal {
        public ImagLit {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Token token() {
            return value.token();
        }
    }
}
