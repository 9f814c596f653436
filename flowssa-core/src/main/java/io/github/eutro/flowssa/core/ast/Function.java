package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function definition, {@code function(params) body}.
 * <p>
 * Where a function definition appears inside another function, it is an opaque value
 * to the enclosing function's analyses; its own graph must be built separately.
 */
public final class Function extends AstNode {
    private final List<String> params;
    private AstNode body;

    public Function(List<String> params, AstNode body) {
        this.params = new ArrayList<>(params);
        this.body = adopt(body);
    }

    public List<String> getParams() {
        return Collections.unmodifiableList(params);
    }

    public @Nullable AstNode getBody() {
        return body;
    }

    public void setBody(AstNode body) {
        this.body = adopt(body);
    }

    @Override
    public Kind kind() {
        return Kind.FUNCTION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public List<AstNode> children() {
        return present(body);
    }

    @Override
    public Function copy() {
        return new Function(params, copyOf(body));
    }

    @Override
    public String toString() {
        return "function(" + String.join(", ", params) + ") " + body;
    }
}
