package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@code while (condition) body}, or {@code repeat body} when {@link #isRepeat()},
 * in which case there is no condition and the loop only exits through {@code break}.
 */
public final class While extends Loop {
    @Nullable
    private final AstNode condition;
    private final boolean repeat;

    public While(@Nullable AstNode condition, AstNode body, boolean repeat) {
        super(body);
        this.condition = adopt(condition);
        this.repeat = repeat;
    }

    public While(AstNode condition, AstNode body) {
        this(condition, body, false);
    }

    /**
     * Create a {@code repeat} loop.
     *
     * @param body The loop body.
     * @return The loop.
     */
    public static While repeat(AstNode body) {
        return new While(null, body, true);
    }

    public @Nullable AstNode getCondition() {
        return condition;
    }

    public boolean isRepeat() {
        return repeat;
    }

    @Override
    public Kind kind() {
        return Kind.WHILE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public List<AstNode> children() {
        return present(condition, getBody());
    }

    @Override
    public While copy() {
        return new While(copyOf(condition), copyOf(getBody()), repeat);
    }

    @Override
    public String toString() {
        return (repeat ? "repeat " : "while (" + condition + ") ") + getBody();
    }
}
