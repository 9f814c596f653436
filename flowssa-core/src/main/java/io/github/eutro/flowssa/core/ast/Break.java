package io.github.eutro.flowssa.core.ast;

import java.util.Collections;
import java.util.List;

/**
 * {@code break}, leaving the innermost loop.
 */
public final class Break extends AstNode {
    @Override
    public Kind kind() {
        return Kind.BREAK;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }

    @Override
    public List<AstNode> children() {
        return Collections.emptyList();
    }

    @Override
    public Break copy() {
        return new Break();
    }

    @Override
    public String toString() {
        return "break";
    }
}
