package com.polyast.core.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Mutable annotation cell attached to an identifier occurrence.
 *
 * <p>This is the only mutable node of the generic AST. Later passes (name resolution,
 * typing, constant propagation) write into it and every holder of the same cell sees
 * the update. A cell is shared by reference; {@link com.polyast.core.ast.visitor.Mapper}
 * preserves that sharing when it rebuilds a tree.
 *
 * <p>Equality is structural over the three slots.
 *
 * @since 1.0.0
 */
public final class IdInfo {

    private ResolvedName resolved;
    private Type type;
    private Literal constLiteral;

    public IdInfo() {
    }

    public IdInfo(ResolvedName resolved, Type type, Literal constLiteral) {
        this.resolved = resolved;
        this.type = type;
        this.constLiteral = constLiteral;
    }

    /**
     * Creates a fresh cell with all slots empty.
     */
    public static IdInfo empty() {
        return new IdInfo();
    }

    public static IdInfo resolvedAs(ResolvedName resolved) {
        return new IdInfo(resolved, null, null);
    }

    public Optional<ResolvedName> resolved() {
        return Optional.ofNullable(resolved);
    }

    public void setResolved(ResolvedName resolved) {
        this.resolved = resolved;
    }

    public Optional<Type> type() {
        return Optional.ofNullable(type);
    }

    public void setType(Type type) {
        this.type = type;
    }

    public Optional<Literal> constLiteral() {
        return Optional.ofNullable(constLiteral);
    }

    public void setConstLiteral(Literal constLiteral) {
        this.constLiteral = constLiteral;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IdInfo other)) {
            return false;
        }
        return Objects.equals(resolved, other.resolved)
            && Objects.equals(type, other.type)
            && Objects.equals(constLiteral, other.constLiteral);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resolved, type, constLiteral);
    }

    @Override
    public String toString() {
        return "IdInfo[resolved=" + resolved + ", type=" + type + ", constLiteral=" + constLiteral + "]";
    }
}
