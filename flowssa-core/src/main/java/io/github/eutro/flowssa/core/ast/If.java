package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A conditional, {@code if (condition) ifTrue else ifFalse}. The else arm is optional.
 */
public final class If extends AstNode {
    private AstNode condition;
    private AstNode ifTrue;
    @Nullable
    private AstNode ifFalse;

    public If(AstNode condition, AstNode ifTrue, @Nullable AstNode ifFalse) {
        this.condition = adopt(condition);
        this.ifTrue = adopt(ifTrue);
        this.ifFalse = adopt(ifFalse);
    }

    public If(AstNode condition, AstNode ifTrue) {
        this(condition, ifTrue, null);
    }

    public @Nullable AstNode getCondition() {
        return condition;
    }

    public @Nullable AstNode getTrue() {
        return ifTrue;
    }

    public void setTrue(AstNode ifTrue) {
        this.ifTrue = adopt(ifTrue);
    }

    public @Nullable AstNode getFalse() {
        return ifFalse;
    }

    public void setFalse(@Nullable AstNode ifFalse) {
        this.ifFalse = adopt(ifFalse);
    }

    @Override
    public Kind kind() {
        return Kind.IF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public List<AstNode> children() {
        return present(condition, ifTrue, ifFalse);
    }

    @Override
    public If copy() {
        return new If(copyOf(condition), copyOf(ifTrue), copyOf(ifFalse));
    }

    @Override
    public String toString() {
        return "if (" + condition + ") " + ifTrue + (ifFalse == null ? "" : " else " + ifFalse);
    }
}
