package io.github.eutro.flowssa.core.ext;

import io.github.eutro.flowssa.core.cfg.BasicBlock;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.DominanceFrontier;
import io.github.eutro.flowssa.core.cfg.DominatorTree;
import io.github.eutro.flowssa.core.passes.meta.ComputeDomFrontier;
import io.github.eutro.flowssa.core.passes.meta.ComputeDoms;
import io.github.eutro.flowssa.core.passes.meta.ComputeLiveVars;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The {@link Ext}s attached to control flow graphs and their blocks.
 */
public class CommonExts {
    /**
     * Attached to a {@link ControlFlowGraph}. Tracks which derived facts are valid.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link ControlFlowGraph}.
     * The <a href="https://en.wikipedia.org/wiki/Dominator_(graph_theory)">dominator tree</a> of the graph.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<DominatorTree> DOM_TREE = Ext.create(DominatorTree.class, "DOM_TREE");

    /**
     * Attached to a {@link ControlFlowGraph}. The dominance frontier of every reachable block.
     * <p>
     * Computed by {@link ComputeDomFrontier}.
     */
    public static final Ext<DominanceFrontier> DOM_FRONTIER = Ext.create(DominanceFrontier.class, "DOM_FRONTIER");

    /**
     * Attached to a {@link BasicBlock}. Variable liveness of the block, by base name.
     * <p>
     * Computed by {@link ComputeLiveVars}.
     */
    public static final Ext<LiveData> LIVE_DATA = Ext.create(LiveData.class, "LIVE_DATA");

    /**
     * Liveness information of a single block.
     */
    public static class LiveData {
        /**
         * Names read in the block before any write to them in the same block.
         */
        public final Set<String> gen = new LinkedHashSet<>();
        /**
         * Names written in the block.
         */
        public final Set<String> kill = new LinkedHashSet<>();
        /**
         * Names live on entry to the block.
         */
        public final Set<String> liveIn = new LinkedHashSet<>();
        /**
         * Names live on exit from the block.
         */
        public final Set<String> liveOut = new LinkedHashSet<>();
    }
}
