package io.github.eutro.flowssa.core.passes.meta;

import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.DominanceFrontier;
import io.github.eutro.flowssa.core.cfg.DominatorTree;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes the {@link CommonExts#DOM_FRONTIER dominance frontier} of each reachable block.
 */
public class ComputeDomFrontier implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDomFrontier INSTANCE = new ComputeDomFrontier();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.DOMS);
        cfg.attachExt(CommonExts.DOM_FRONTIER, compute(cfg, cfg.getExtOrThrow(CommonExts.DOM_TREE)));
        ms.validate(MetadataState.DOM_FRONTIER);
    }

    /**
     * Compute the dominance frontier of a graph from its dominator tree, without attaching it.
     *
     * @param cfg  The graph.
     * @param tree The dominator tree of the graph.
     * @return The dominance frontier.
     */
    public static DominanceFrontier compute(ControlFlowGraph cfg, DominatorTree tree) {
        // Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
        Map<Integer, Set<Integer>> frontiers = new HashMap<>();
        for (int block : tree.getReversePostOrder()) {
            frontiers.put(block, new TreeSet<>());
        }
        for (int block : tree.getReversePostOrder()) {
            List<Integer> preds = new ArrayList<>();
            for (int pred : cfg.predecessors(block)) {
                if (tree.contains(pred)) preds.add(pred);
            }
            if (preds.size() >= 2) {
                int idom = tree.idom(block);
                for (int pred : preds) {
                    int runner = pred;
                    while (runner != idom) {
                        frontiers.get(runner).add(block);
                        int next = tree.idom(runner);
                        if (next == runner) break;
                        runner = next;
                    }
                }
            }
        }
        return new DominanceFrontier(frontiers);
    }
}
