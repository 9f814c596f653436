package io.github.eutro.flowssa.core;

import io.github.eutro.flowssa.core.ast.AstNode;

/**
 * Thrown when an AST is not structurally well-formed, for example when a control node
 * is missing a required child, or a {@code break} appears outside of any loop.
 */
public class MalformedAstException extends FlowSsaException {
    private final transient AstNode node;

    public MalformedAstException(AstNode node, String message) {
        super(message + ": " + node);
        this.node = node;
    }

    /**
     * Create an exception for a missing child slot.
     *
     * @param node The node missing a child.
     * @param slot The name of the slot.
     * @return The exception.
     */
    public static MalformedAstException missing(AstNode node, String slot) {
        return new MalformedAstException(node, "missing " + slot + " of " + node.kind());
    }

    /**
     * Get the offending node.
     *
     * @return The node.
     */
    public AstNode getNode() {
        return node;
    }
}
