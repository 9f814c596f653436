package io.github.eutro.flowssa.core.passes.meta;

import io.github.eutro.flowssa.core.IrreducibleGraphException;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.DominatorTree;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.passes.InPlaceIRPass;
import io.github.eutro.flowssa.core.util.GraphWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Computes the {@link CommonExts#DOM_TREE dominator tree} of a graph.
 * <p>
 * Only blocks reachable from the entry take part. The graph must be reducible,
 * otherwise an {@link IrreducibleGraphException} is thrown.
 */
public class ComputeDoms implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeDoms.class);

    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        cfg.attachExt(CommonExts.DOM_TREE, compute(cfg));
        cfg.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.DOMS);
    }

    /**
     * Compute the dominator tree of a graph, without attaching it.
     *
     * @param cfg The graph.
     * @return The dominator tree.
     * @throws IrreducibleGraphException If the graph is irreducible.
     */
    public static DominatorTree compute(ControlFlowGraph cfg) {
        // Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
        List<Integer> postOrder = GraphWalker.blockWalker(cfg).postOrder().toList();
        Map<Integer, Integer> poIndex = new HashMap<>();
        for (int i = 0; i < postOrder.size(); i++) {
            poIndex.put(postOrder.get(i), i);
        }
        List<Integer> rpo = new ArrayList<>(postOrder);
        Collections.reverse(rpo);

        int entry = cfg.getEntryId();
        Map<Integer, Integer> idoms = new HashMap<>();
        idoms.put(entry, entry);
        int iterations = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            iterations++;
            for (int block : rpo) {
                if (block == entry) continue;
                Integer newIdom = null;
                for (int pred : cfg.predecessors(block)) {
                    if (!idoms.containsKey(pred)) continue; // unprocessed or unreachable
                    newIdom = newIdom == null ? pred : intersect(idoms, poIndex, pred, newIdom);
                }
                if (newIdom != null && !newIdom.equals(idoms.get(block))) {
                    idoms.put(block, newIdom);
                    changed = true;
                }
            }
        }

        Map<Integer, Integer> ordered = new LinkedHashMap<>();
        for (int block : rpo) {
            ordered.put(block, idoms.get(block));
        }
        DominatorTree tree = new DominatorTree(entry, ordered, rpo);
        checkReducible(cfg, tree, poIndex);
        LOGGER.debug("dominators of {} reachable blocks converged after {} iterations", rpo.size(), iterations);
        return tree;
    }

    private static int intersect(Map<Integer, Integer> idoms, Map<Integer, Integer> poIndex, int a, int b) {
        int finger1 = a;
        int finger2 = b;
        while (finger1 != finger2) {
            while (poIndex.get(finger1) < poIndex.get(finger2)) {
                finger1 = idoms.get(finger1);
            }
            while (poIndex.get(finger2) < poIndex.get(finger1)) {
                finger2 = idoms.get(finger2);
            }
        }
        return finger1;
    }

    private static void checkReducible(ControlFlowGraph cfg, DominatorTree tree, Map<Integer, Integer> poIndex) {
        for (int block : tree.getReversePostOrder()) {
            for (int succ : cfg.successors(block)) {
                // a retreating edge in the depth-first order must be a back edge
                if (poIndex.get(succ) >= poIndex.get(block) && !tree.dominates(succ, block)) {
                    throw new IrreducibleGraphException(block, succ);
                }
            }
        }
    }
}
