package io.github.eutro.flowssa.core.passes.meta;

import io.github.eutro.flowssa.core.ast.Assign;
import io.github.eutro.flowssa.core.ast.AstNode;
import io.github.eutro.flowssa.core.ast.AstNodes;
import io.github.eutro.flowssa.core.ast.Kind;
import io.github.eutro.flowssa.core.ast.Symbol;
import io.github.eutro.flowssa.core.cfg.BasicBlock;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.Phi;
import io.github.eutro.flowssa.core.cfg.Terminator;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.CommonExts.LiveData;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes the {@link CommonExts#LIVE_DATA} for each block.
 * <p>
 * Variables are identified by their display names, so before SSA conversion this is liveness
 * by base name. Parameters are written at the start of the entry block, and the values
 * a phi reads are live out of the predecessor they flow in from.
 */
public class ComputeLiveVars implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : cfg.getBlocks()) {
            LiveData data = new LiveData();
            block.attachExt(CommonExts.LIVE_DATA, data);
            Set<String> used = data.gen;
            Set<String> assigned = data.kill;

            if (block.getId() == cfg.getEntryId()) {
                for (Symbol param : cfg.getParams()) {
                    assigned.add(param.getName());
                }
            }
            for (Phi phi : block.getPhis()) {
                assigned.add(phi.getWrite().getName());
            }
            for (AstNode statement : block.getBody()) {
                for (Symbol arg : AstNodes.reads(statement)) {
                    if (!assigned.contains(arg.getName())) used.add(arg.getName());
                }
                if (statement.kind() == Kind.ASSIGN) {
                    Symbol write = ((Assign) statement).getWrite();
                    if (write != null) assigned.add(write.getName());
                }
            }
            Terminator terminator = block.getTerminator();
            if (terminator != null) {
                for (Symbol arg : AstNodes.reads(terminator.expression())) {
                    if (!assigned.contains(arg.getName())) used.add(arg.getName());
                }
            }

            data.liveIn.addAll(data.gen);
        }

        for (BasicBlock block : cfg.getBlocks()) {
            for (Phi phi : block.getPhis()) {
                for (Map.Entry<Integer, Symbol> entry : phi.getIncoming().entrySet()) {
                    if (!cfg.contains(entry.getKey())) continue;
                    LiveData predData = cfg.get(entry.getKey()).getExtOrThrow(CommonExts.LIVE_DATA);
                    String name = entry.getValue().getName();
                    predData.liveOut.add(name);
                    if (!predData.kill.contains(name)) predData.liveIn.add(name);
                }
            }
        }

        Set<Integer> workQueue = new LinkedHashSet<>();
        List<BasicBlock> blocks = new ArrayList<>(cfg.getBlocks());
        for (ListIterator<BasicBlock> li = blocks.listIterator(blocks.size()); li.hasPrevious(); ) {
            workQueue.add(li.previous().getId());
        }
        while (!workQueue.isEmpty()) {
            Iterator<Integer> iterator = workQueue.iterator();
            int next = iterator.next();
            iterator.remove();
            LiveData data = cfg.get(next).getExtOrThrow(CommonExts.LIVE_DATA);
            boolean changed = false;
            for (int succ : cfg.successors(next)) {
                LiveData succData = cfg.get(succ).getExtOrThrow(CommonExts.LIVE_DATA);
                for (String varIn : succData.liveIn) {
                    if (data.liveOut.add(varIn)) {
                        if (!data.kill.contains(varIn)) {
                            changed |= data.liveIn.add(varIn);
                        }
                    }
                }
            }
            if (changed) {
                workQueue.addAll(cfg.predecessors(next));
            }
        }

        ms.validate(MetadataState.LIVE_DATA);
    }
}
