package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@code for (variable in iterable) body}. The iterable may be any expression.
 */
public final class For extends Loop {
    private final Symbol variable;
    private final AstNode iterable;

    public For(Symbol variable, AstNode iterable, AstNode body) {
        super(body);
        this.variable = adopt(variable);
        this.iterable = adopt(iterable);
    }

    public @Nullable Symbol getVariable() {
        return variable;
    }

    public @Nullable AstNode getIterable() {
        return iterable;
    }

    @Override
    public Kind kind() {
        return Kind.FOR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public List<AstNode> children() {
        return present(variable, iterable, getBody());
    }

    @Override
    public For copy() {
        return new For(copyOf(variable), copyOf(iterable), copyOf(getBody()));
    }

    @Override
    public String toString() {
        return "for (" + variable + " in " + iterable + ") " + getBody();
    }
}
