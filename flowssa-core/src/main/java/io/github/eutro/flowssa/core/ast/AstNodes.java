package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Queries over AST nodes.
 */
public final class AstNodes {
    private AstNodes() {
    }

    /**
     * Collect the variables read by a statement or expression, in evaluation order.
     * <p>
     * The target of an assignment is not a read. Nested function definitions are opaque,
     * so nothing inside them is collected.
     *
     * @param node The node, may be null.
     * @return The symbols read.
     */
    public static List<Symbol> reads(@Nullable AstNode node) {
        List<Symbol> reads = new ArrayList<>();
        if (node != null) {
            collectReads(node, reads);
        }
        return reads;
    }

    private static void collectReads(AstNode node, List<Symbol> out) {
        switch (node.kind()) {
            case SYMBOL:
                out.add((Symbol) node);
                break;
            case ASSIGN: {
                AstNode read = ((Assign) node).getRead();
                if (read != null) collectReads(read, out);
                break;
            }
            case FUNCTION:
            case LITERAL:
                break;
            default:
                for (AstNode child : node.children()) {
                    collectReads(child, out);
                }
        }
    }

    /**
     * Find the first node in an expression that may only appear as a statement:
     * control flow or assignment. Nested function definitions are not searched.
     *
     * @param expr The expression.
     * @return The offending node, or null if the expression is a plain expression.
     */
    public static @Nullable AstNode findStatementOnly(AstNode expr) {
        if (expr.kind().isControlFlow() || expr.kind() == Kind.ASSIGN) return expr;
        if (expr.kind() == Kind.FUNCTION) return null;
        for (AstNode child : expr.children()) {
            AstNode found = findStatementOnly(child);
            if (found != null) return found;
        }
        return null;
    }
}
