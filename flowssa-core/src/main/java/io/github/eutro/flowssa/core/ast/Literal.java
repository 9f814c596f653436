package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A constant value: {@code NULL} (null), a logical ({@link Boolean}), an integer ({@link Integer}),
 * a double ({@link Double}) or a character string ({@link String}).
 */
public final class Literal extends AstNode {
    @Nullable
    private final Object value;

    public Literal(@Nullable Object value) {
        if (value != null
                && !(value instanceof Boolean)
                && !(value instanceof Integer)
                && !(value instanceof Double)
                && !(value instanceof String)) {
            throw new IllegalArgumentException("unsupported literal type: " + value.getClass().getName());
        }
        this.value = value;
    }

    /**
     * Create a {@code NULL} literal.
     *
     * @return The literal.
     */
    public static Literal ofNull() {
        return new Literal(null);
    }

    public @Nullable Object getValue() {
        return value;
    }

    @Override
    public Kind kind() {
        return Kind.LITERAL;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public List<AstNode> children() {
        return Collections.emptyList();
    }

    @Override
    public Literal copy() {
        return new Literal(value);
    }

    @Override
    public String toString() {
        if (value == null) return "NULL";
        if (value instanceof Boolean) return (Boolean) value ? "TRUE" : "FALSE";
        if (value instanceof Integer) return value + "L";
        if (value instanceof String) return '"' + (String) value + '"';
        return value.toString();
    }
}
