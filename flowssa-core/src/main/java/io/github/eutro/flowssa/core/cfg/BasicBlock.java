package io.github.eutro.flowssa.core.cfg;

import io.github.eutro.flowssa.core.ast.AstNode;
import io.github.eutro.flowssa.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block: phi nodes, then a list of non-branching statements,
 * followed by exactly one {@link Terminator}.
 * <p>
 * Adding phis or statements through this block invalidates the live variable data of its graph.
 * Statements that are already in the block are mutable, and editing them invalidates nothing.
 */
public final class BasicBlock extends ExtHolder {
    private final ControlFlowGraph graph;
    private final int id;
    private final int depth;
    private final List<Phi> phis = new ArrayList<>();
    private final List<AstNode> body = new ArrayList<>();
    @Nullable
    private Terminator terminator;

    BasicBlock(ControlFlowGraph graph, int id, int depth) {
        this.graph = graph;
        this.id = id;
        this.depth = depth;
    }

    /**
     * Get the identifier of this block, unique and stable within its graph.
     *
     * @return The identifier.
     */
    public int getId() {
        return id;
    }

    /**
     * Get the structural nesting depth of the code this block was lowered from.
     *
     * @return The depth, 0 for the top level of a function.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Get the phi nodes of this block.
     *
     * @return An unmodifiable view of the phi nodes.
     */
    public List<Phi> getPhis() {
        return Collections.unmodifiableList(phis);
    }

    /**
     * Add a phi node to this block.
     *
     * @param phi The phi node.
     */
    public void addPhi(Phi phi) {
        phis.add(phi);
        graph.varsChanged();
    }

    /**
     * Find the phi node for a variable.
     *
     * @param base The base name of the variable.
     * @return The phi node, or null if there is none.
     */
    public @Nullable Phi getPhi(String base) {
        for (Phi phi : phis) {
            if (phi.getBase().equals(base)) return phi;
        }
        return null;
    }

    /**
     * Get the statements of this block.
     *
     * @return An unmodifiable view of the statements.
     */
    public List<AstNode> getBody() {
        return Collections.unmodifiableList(body);
    }

    /**
     * Append a statement to this block.
     *
     * @param statement The statement.
     */
    public void append(AstNode statement) {
        body.add(statement);
        graph.varsChanged();
    }

    public @Nullable Terminator getTerminator() {
        return terminator;
    }

    void setTerminator(@Nullable Terminator terminator) {
        this.terminator = terminator;
    }

    /**
     * Format this block as a jump target.
     *
     * @return The target string.
     */
    public String toTargetString() {
        return "%" + id;
    }

    BasicBlock copy(ControlFlowGraph into) {
        BasicBlock copy = new BasicBlock(into, id, depth);
        for (Phi phi : phis) {
            copy.phis.add(phi.copy());
        }
        for (AstNode node : body) {
            copy.body.add(node.copy());
        }
        copy.terminator = terminator == null ? null : terminator.copy();
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Phi phi : phis) {
            sb.append(' ').append(phi).append('\n');
        }
        for (AstNode node : body) {
            sb.append(' ').append(node).append('\n');
        }
        sb.append(' ').append(terminator);
        sb.append("\n}");
        return sb.toString();
    }
}
