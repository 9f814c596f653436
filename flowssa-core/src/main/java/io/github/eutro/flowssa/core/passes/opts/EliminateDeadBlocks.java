package io.github.eutro.flowssa.core.passes.opts;

import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.passes.InPlaceIRPass;
import io.github.eutro.flowssa.core.util.GraphWalker;

import java.util.HashSet;

/**
 * A pass that removes any blocks unreachable from the entry block.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * An instance of this pass.
     */
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        cfg.retainBlocks(new HashSet<>(
                GraphWalker.blockWalker(cfg)
                        .preOrder()
                        .toList()));
    }
}
