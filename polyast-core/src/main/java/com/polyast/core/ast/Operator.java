package com.polyast.core.ast;

/**
 * Arithmetic, bitwise, logical and comparison operators shared by all languages.
 *
 * @since 1.0.0
 */
public enum Operator {
    PLUS,
    MINUS,
    MULT,
    DIV,
    MOD,
    POW,
    /** Python {@code //} */
    FLOOR_DIV,
    /** Python {@code @} */
    MAT_MULT,
    /** {@code <<} */
    LSL,
    /** {@code >>>} */
    LSR,
    /** {@code >>} */
    ASR,
    BIT_OR,
    BIT_XOR,
    BIT_AND,
    BIT_NOT,
    /** Go {@code &^} */
    BIT_CLEAR,
    AND,
    OR,
    XOR,
    NOT,
    EQ,
    NOT_EQ,
    /** JavaScript {@code ===}, Python {@code is} */
    PHYS_EQ,
    /** JavaScript {@code !==}, Python {@code is not} */
    NOT_PHYS_EQ,
    LT,
    LT_E,
    GT,
    GT_E,
    /** Three-way comparison */
    CMP;

    /**
     * Returns true for operators whose result is a boolean.
     */
    public boolean isBoolean() {
        return switch (this) {
            case AND, OR, XOR, NOT, EQ, NOT_EQ, PHYS_EQ, NOT_PHYS_EQ, LT, LT_E, GT, GT_E -> true;
            default -> false;
        };
    }
}
