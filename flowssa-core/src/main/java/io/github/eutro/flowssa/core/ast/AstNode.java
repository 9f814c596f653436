package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A node of the abstract syntax tree.
 * <p>
 * Children are owned by their parent. The parent reference is a back-reference,
 * set when a node is attached as a child, and is only meant for ancestor queries.
 */
public abstract class AstNode {
    @Nullable
    private AstNode parent;

    /**
     * Get the kind of this node.
     *
     * @return The kind.
     */
    public abstract Kind kind();

    /**
     * Dispatch on the kind of this node.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(AstVisitor<R> visitor);

    /**
     * Get the present children of this node, in source order.
     *
     * @return The children.
     */
    public abstract List<AstNode> children();

    /**
     * Deep-copy this node. The copy has no parent.
     *
     * @return The copy.
     */
    public abstract AstNode copy();

    /**
     * Get the node this node is a child of.
     *
     * @return The parent, or null if this is a root.
     */
    public @Nullable AstNode getParent() {
        return parent;
    }

    /**
     * Get the ancestors of this node, nearest first.
     *
     * @return The ancestors.
     */
    public List<AstNode> ancestors() {
        List<AstNode> ancestors = new ArrayList<>();
        for (AstNode node = parent; node != null; node = node.parent) {
            ancestors.add(node);
        }
        return ancestors;
    }

    /**
     * Find the nearest ancestor of one of the given kinds.
     *
     * @param kinds The kinds to look for.
     * @return The ancestor, or null if there is none.
     */
    public @Nullable AstNode findAncestor(Kind... kinds) {
        List<Kind> kindList = Arrays.asList(kinds);
        for (AstNode node = parent; node != null; node = node.parent) {
            if (kindList.contains(node.kind())) return node;
        }
        return null;
    }

    /**
     * Attach {@code child} to this node.
     *
     * @param child The child, may be null.
     * @param <T>   The type of the child.
     * @return The child.
     */
    protected <T extends AstNode> T adopt(@Nullable T child) {
        if (child != null) {
            ((AstNode) child).parent = this;
        }
        return child;
    }

    /**
     * Copy a possibly absent node.
     *
     * @param node The node.
     * @param <T>  The type of the node.
     * @return The copy, or null.
     */
    @SuppressWarnings("unchecked")
    protected static <T extends AstNode> T copyOf(@Nullable T node) {
        return node == null ? null : (T) node.copy();
    }

    static List<AstNode> present(AstNode... nodes) {
        List<AstNode> ls = new ArrayList<>(nodes.length);
        for (AstNode node : nodes) {
            if (node != null) ls.add(node);
        }
        return ls;
    }
}
