package io.github.eutro.flowssa.core.passes.meta;

import io.github.eutro.flowssa.core.ast.Assign;
import io.github.eutro.flowssa.core.ast.AstNode;
import io.github.eutro.flowssa.core.ast.AstNodes;
import io.github.eutro.flowssa.core.ast.Kind;
import io.github.eutro.flowssa.core.ast.Symbol;
import io.github.eutro.flowssa.core.cfg.*;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Checks the structural invariants of a graph, throwing {@link IllegalStateException} if any is broken.
 * <p>
 * Every graph must have a terminator on every block, targeting only blocks in the graph.
 * Graphs in SSA form must additionally define every display name exactly once, have phis whose
 * incoming edges are exactly their block's predecessors, and only read names whose definition
 * dominates the read.
 */
public class VerifyIntegrity implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        for (BasicBlock block : cfg.getBlocks()) {
            Terminator terminator = block.getTerminator();
            if (terminator == null) {
                throw new IllegalStateException("block " + block.toTargetString() + " has no terminator");
            }
            if (!new ArrayList<>(new LinkedHashSet<>(terminator.targets())).equals(cfg.successors(block.getId()))) {
                throw new IllegalStateException("edges of " + block.toTargetString()
                        + " do not match its terminator: " + terminator);
            }
        }

        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        if (ms.isValid(MetadataState.SSA_FORM)) {
            ms.ensureValid(cfg, MetadataState.DOMS);
            verifySsa(cfg, cfg.getExtOrThrow(CommonExts.DOM_TREE));
        }
    }

    private static class DefSite {
        final int block;
        final int index; // -2 for parameters, -1 for phis

        DefSite(int block, int index) {
            this.block = block;
            this.index = index;
        }
    }

    private static void verifySsa(ControlFlowGraph cfg, DominatorTree tree) {
        Map<String, DefSite> defs = new HashMap<>();
        for (Symbol param : cfg.getParams()) {
            define(defs, param, new DefSite(cfg.getEntryId(), -2));
        }
        for (BasicBlock block : cfg.getBlocks()) {
            for (Phi phi : block.getPhis()) {
                define(defs, phi.getWrite(), new DefSite(block.getId(), -1));
            }
            List<AstNode> body = block.getBody();
            for (int i = 0; i < body.size(); i++) {
                AstNode statement = body.get(i);
                if (statement.kind() == Kind.ASSIGN) {
                    Symbol write = ((Assign) statement).getWrite();
                    if (write != null) define(defs, write, new DefSite(block.getId(), i));
                }
            }
        }

        for (BasicBlock block : cfg.getBlocks()) {
            int id = block.getId();
            if (!tree.contains(id)) continue;
            Set<Integer> preds = new TreeSet<>(cfg.predecessors(id));
            for (Phi phi : block.getPhis()) {
                if (!phi.getIncoming().keySet().equals(preds)) {
                    throw new IllegalStateException("phi " + phi + " in " + block.toTargetString()
                            + " does not cover exactly its predecessors " + preds);
                }
                for (Map.Entry<Integer, Symbol> entry : phi.getIncoming().entrySet()) {
                    checkRead(defs, tree, entry.getValue(), entry.getKey(), Integer.MAX_VALUE);
                }
            }
            List<AstNode> body = block.getBody();
            for (int i = 0; i < body.size(); i++) {
                for (Symbol read : AstNodes.reads(body.get(i))) {
                    checkRead(defs, tree, read, id, i);
                }
            }
            Terminator terminator = Objects.requireNonNull(block.getTerminator());
            for (Symbol read : AstNodes.reads(terminator.expression())) {
                checkRead(defs, tree, read, id, Integer.MAX_VALUE);
            }
        }
    }

    private static void define(Map<String, DefSite> defs, Symbol write, DefSite site) {
        if (write.getSequence() == null) {
            throw new IllegalStateException("definition of " + write + " in %" + site.block + " was not renamed");
        }
        if (defs.put(write.getName(), site) != null) {
            throw new IllegalStateException(write.getName() + " is defined more than once");
        }
    }

    private static void checkRead(Map<String, DefSite> defs, DominatorTree tree, Symbol read, int block, int index) {
        DefSite def = defs.get(read.getName());
        if (def == null) {
            throw new IllegalStateException("read of undefined name " + read.getName() + " in %" + block);
        }
        boolean visible = def.block == block
                ? def.index < index
                : tree.contains(block) && tree.dominates(def.block, block);
        if (!visible) {
            throw new IllegalStateException("definition of " + read.getName() + " in %" + def.block
                    + " does not dominate its read in %" + block);
        }
    }
}
