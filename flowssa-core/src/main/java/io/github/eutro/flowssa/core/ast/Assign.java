package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * An assignment {@code write = read}.
 */
public final class Assign extends AstNode {
    private Symbol write;
    private AstNode read;

    public Assign(Symbol write, AstNode read) {
        this.write = adopt(write);
        this.read = adopt(read);
    }

    public @Nullable Symbol getWrite() {
        return write;
    }

    public void setWrite(Symbol write) {
        this.write = adopt(write);
    }

    public @Nullable AstNode getRead() {
        return read;
    }

    public void setRead(AstNode read) {
        this.read = adopt(read);
    }

    @Override
    public Kind kind() {
        return Kind.ASSIGN;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public List<AstNode> children() {
        return present(write, read);
    }

    @Override
    public Assign copy() {
        return new Assign(copyOf(write), copyOf(read));
    }

    @Override
    public String toString() {
        return write + " = " + read;
    }
}
