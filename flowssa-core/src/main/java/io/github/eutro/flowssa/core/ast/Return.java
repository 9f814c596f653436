package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@code return(value)}.
 */
public final class Return extends AstNode {
    private final AstNode value;

    public Return(AstNode value) {
        this.value = adopt(value);
    }

    public @Nullable AstNode getValue() {
        return value;
    }

    @Override
    public Kind kind() {
        return Kind.RETURN;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public List<AstNode> children() {
        return present(value);
    }

    @Override
    public Return copy() {
        return new Return(copyOf(value));
    }

    @Override
    public String toString() {
        return "return(" + value + ")";
    }
}
