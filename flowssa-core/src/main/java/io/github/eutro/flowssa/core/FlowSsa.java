package io.github.eutro.flowssa.core;

import io.github.eutro.flowssa.core.ast.AstNode;
import io.github.eutro.flowssa.core.ast.Function;
import io.github.eutro.flowssa.core.ast.Kind;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.DominanceFrontier;
import io.github.eutro.flowssa.core.cfg.DominatorTree;
import io.github.eutro.flowssa.core.passes.convert.AstToCfg;
import io.github.eutro.flowssa.core.passes.form.SSAify;
import io.github.eutro.flowssa.core.passes.meta.ComputeDomFrontier;
import io.github.eutro.flowssa.core.passes.meta.ComputeDoms;
import io.github.eutro.flowssa.core.passes.meta.LatticeValue;
import io.github.eutro.flowssa.core.passes.meta.PropagateConstants;

import java.util.Map;

/**
 * Entry points for the whole pipeline, from an AST to constants.
 *
 * <pre>{@code
 * ControlFlowGraph cfg = FlowSsa.buildCfg(function);
 * ControlFlowGraph ssa = FlowSsa.toSsa(cfg, false);
 * Map<String, LatticeValue> constants = FlowSsa.propagateConstants(ssa);
 * }</pre>
 */
public final class FlowSsa {
    private FlowSsa() {
    }

    /**
     * Lower a function into a control flow graph.
     *
     * @param function The function.
     * @return The graph.
     * @throws MalformedAstException If the function is not well-formed.
     */
    public static ControlFlowGraph buildCfg(Function function) {
        return AstToCfg.INSTANCE.run(function);
    }

    /**
     * Lower a function, or a function body with no parameters, into a control flow graph.
     *
     * @param node The function or body.
     * @return The graph.
     * @throws MalformedAstException If the node is not well-formed.
     */
    public static ControlFlowGraph buildCfg(AstNode node) {
        if (node.kind() == Kind.FUNCTION) {
            return buildCfg((Function) node);
        }
        return AstToCfg.INSTANCE.build(node);
    }

    /**
     * Compute the dominator tree of a graph.
     *
     * @param cfg The graph.
     * @return The dominator tree.
     * @throws IrreducibleGraphException If the graph is irreducible.
     */
    public static DominatorTree dominatorTree(ControlFlowGraph cfg) {
        return ComputeDoms.compute(cfg);
    }

    /**
     * Compute the dominance frontier of every reachable block of a graph.
     *
     * @param cfg  The graph.
     * @param tree The dominator tree of the graph.
     * @return The dominance frontier.
     */
    public static DominanceFrontier dominanceFrontier(ControlFlowGraph cfg, DominatorTree tree) {
        return ComputeDomFrontier.compute(cfg, tree);
    }

    /**
     * Convert a graph to SSA form.
     *
     * @param cfg     The graph.
     * @param inPlace Whether to convert {@code cfg} itself, rather than a copy of it.
     * @return The converted graph.
     * @throws UnresolvedNameException If a variable is read where it may not have been defined.
     */
    public static ControlFlowGraph toSsa(ControlFlowGraph cfg, boolean inPlace) {
        return SSAify.toSsa(cfg, inPlace);
    }

    /**
     * Find the constant value of every SSA name of a graph, with the default configuration.
     *
     * @param ssaCfg The graph, in SSA form.
     * @return The lattice value of every SSA name, by display name.
     */
    public static Map<String, LatticeValue> propagateConstants(ControlFlowGraph ssaCfg) {
        return PropagateConstants.INSTANCE.run(ssaCfg);
    }
}
