package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

/**
 * A looping construct, either a {@link For} or a {@link While}.
 */
public abstract class Loop extends AstNode {
    private AstNode body;

    protected Loop(AstNode body) {
        this.body = adopt(body);
    }

    public @Nullable AstNode getBody() {
        return body;
    }

    public void setBody(AstNode body) {
        this.body = adopt(body);
    }
}
