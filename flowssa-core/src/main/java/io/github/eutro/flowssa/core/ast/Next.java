package io.github.eutro.flowssa.core.ast;

import java.util.Collections;
import java.util.List;

/**
 * {@code next}, skipping to the next iteration of the innermost loop.
 */
public final class Next extends AstNode {
    @Override
    public Kind kind() {
        return Kind.NEXT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNext(this);
    }

    @Override
    public List<AstNode> children() {
        return Collections.emptyList();
    }

    @Override
    public Next copy() {
        return new Next();
    }

    @Override
    public String toString() {
        return "next";
    }
}
