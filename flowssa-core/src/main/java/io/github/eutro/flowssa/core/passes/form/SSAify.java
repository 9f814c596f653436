package io.github.eutro.flowssa.core.passes.form;

import io.github.eutro.flowssa.core.UnresolvedNameException;
import io.github.eutro.flowssa.core.ast.Assign;
import io.github.eutro.flowssa.core.ast.AstNode;
import io.github.eutro.flowssa.core.ast.AstNodes;
import io.github.eutro.flowssa.core.ast.Kind;
import io.github.eutro.flowssa.core.ast.Symbol;
import io.github.eutro.flowssa.core.cfg.*;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.CommonExts.LiveData;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.passes.InPlaceIRPass;
import io.github.eutro.flowssa.core.passes.meta.VerifyIntegrity;
import io.github.eutro.flowssa.core.util.Counter;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Converts a graph to SSA form, by inserting phi nodes at the dominance frontiers of definitions
 * and then renaming every variable occurrence so each display name is defined exactly once.
 * <p>
 * Phis are only placed where the variable is live, and parameters are defined on entry.
 * A read with no visible definition throws {@link UnresolvedNameException}.
 */
public class SSAify implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SSAify.class);

    /**
     * Whether to {@link VerifyIntegrity verify} every graph after conversion.
     */
    public static boolean VERIFY = System.getenv("FLOWSSA_VERIFY") != null || Boolean.getBoolean("flowssa.verify");

    /**
     * A singleton instance of this pass.
     */
    public static final SSAify INSTANCE = new SSAify();

    /**
     * Convert a graph to SSA form.
     *
     * @param cfg     The graph.
     * @param inPlace Whether to convert {@code cfg} itself, rather than a copy of it.
     * @return The converted graph, {@code cfg} if in place.
     */
    public static ControlFlowGraph toSsa(ControlFlowGraph cfg, boolean inPlace) {
        ControlFlowGraph target = inPlace ? cfg : cfg.copy();
        INSTANCE.runInPlace(target);
        return target;
    }

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        if (ms.isValid(MetadataState.SSA_FORM)) {
            throw new IllegalStateException("graph is already in SSA form");
        }
        ms.ensureValid(cfg, MetadataState.DOMS, MetadataState.DOM_FRONTIER, MetadataState.LIVE_DATA);
        DominatorTree tree = cfg.getExtOrThrow(CommonExts.DOM_TREE);
        DominanceFrontier frontier = cfg.getExtOrThrow(CommonExts.DOM_FRONTIER);

        int phiCount = insertPhis(cfg, tree, frontier);
        new Renamer(cfg, tree).run();

        for (BasicBlock block : cfg.getBlocks()) {
            // we've renamed all the variables, none of it is valid anymore
            block.removeExt(CommonExts.LIVE_DATA);
        }
        ms.varsChanged();
        ms.validate(MetadataState.SSA_FORM);
        LOGGER.debug("converted {} blocks to SSA form, inserting {} phis", cfg.size(), phiCount);

        if (VERIFY) {
            VerifyIntegrity.INSTANCE.runInPlace(cfg);
        }
    }

    private static int insertPhis(ControlFlowGraph cfg, DominatorTree tree, DominanceFrontier frontier) {
        Set<String> globals = new LinkedHashSet<>();
        Map<String, Set<Integer>> varKilledIn = new HashMap<>();
        for (BasicBlock block : cfg.getBlocks()) {
            if (!tree.contains(block.getId())) continue;
            LiveData data = block.getExtOrThrow(CommonExts.LIVE_DATA);
            globals.addAll(data.gen);
            for (String killed : data.kill) {
                varKilledIn.computeIfAbsent(killed, $ -> new TreeSet<>()).add(block.getId());
            }
        }

        int phiCount = 0;
        for (String global : globals) {
            List<Integer> workList = new ArrayList<>(varKilledIn.getOrDefault(global, Collections.emptySet()));
            while (!workList.isEmpty()) {
                int next = workList.remove(workList.size() - 1);
                for (int fBlockId : frontier.of(next)) {
                    BasicBlock fBlock = cfg.get(fBlockId);
                    LiveData liveData = fBlock.getExtOrThrow(CommonExts.LIVE_DATA);
                    if (liveData.liveIn.contains(global) && fBlock.getPhi(global) == null) {
                        fBlock.addPhi(new Phi(global));
                        phiCount++;
                        workList.add(fBlockId);
                    }
                }
            }
        }
        return phiCount;
    }

    /**
     * For each base name, the stack of sequence numbers of its visible definitions.
     */
    static class NameStack {
        private final Map<String, Deque<Integer>> stacks = new HashMap<>();
        private final Counter counter = new Counter();

        /**
         * Define a fresh name for {@code symbol}, make it visible, and rename the symbol to it.
         *
         * @param symbol The symbol being defined.
         * @return The base name pushed.
         */
        String define(Symbol symbol) {
            String base = symbol.getBase();
            int sequence = counter.increment(base);
            stacks.computeIfAbsent(base, $ -> new ArrayDeque<>()).push(sequence);
            symbol.setSequence(sequence);
            return base;
        }

        int top(String base, int block) {
            Deque<Integer> stack = stacks.get(base);
            if (stack == null || stack.isEmpty()) {
                throw new UnresolvedNameException(base, block);
            }
            return stack.peek();
        }

        void pop(String base) {
            stacks.get(base).pop();
        }
    }

    private static class Frame {
        final int block;
        final List<String> pushed = new ArrayList<>();
        @Nullable
        Iterator<Integer> children;

        Frame(int block) {
            this.block = block;
        }
    }

    private static class Renamer {
        final ControlFlowGraph cfg;
        final DominatorTree tree;
        final NameStack names = new NameStack();

        Renamer(ControlFlowGraph cfg, DominatorTree tree) {
            this.cfg = cfg;
            this.tree = tree;
        }

        void run() {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(cfg.getEntryId()));
            try {
                while (!stack.isEmpty()) {
                    Frame top = stack.peek();
                    if (top.children == null) {
                        top.children = tree.children(top.block).iterator();
                        rename(top);
                    }
                    if (top.children.hasNext()) {
                        stack.push(new Frame(top.children.next()));
                    } else {
                        stack.pop();
                        popAll(top);
                    }
                }
            } finally {
                while (!stack.isEmpty()) {
                    popAll(stack.pop());
                }
            }
        }

        private void popAll(Frame frame) {
            for (String base : frame.pushed) {
                names.pop(base);
            }
            frame.pushed.clear();
        }

        private void renameReads(AstNode node, int block) {
            for (Symbol read : AstNodes.reads(node)) {
                read.setSequence(names.top(read.getBase(), block));
            }
        }

        private void rename(Frame frame) {
            int id = frame.block;
            BasicBlock block = cfg.get(id);
            if (id == cfg.getEntryId()) {
                for (Symbol param : cfg.getParams()) {
                    frame.pushed.add(names.define(param));
                }
            }
            for (Phi phi : block.getPhis()) {
                frame.pushed.add(names.define(phi.getWrite()));
            }
            for (AstNode statement : block.getBody()) {
                renameReads(statement, id);
                if (statement.kind() == Kind.ASSIGN) {
                    Symbol write = ((Assign) statement).getWrite();
                    if (write != null) frame.pushed.add(names.define(write));
                }
            }
            Terminator terminator = block.getTerminator();
            if (terminator != null && terminator.expression() != null) {
                renameReads(terminator.expression(), id);
            }

            for (int succ : cfg.successors(id)) {
                for (Phi phi : cfg.get(succ).getPhis()) {
                    String base = phi.getBase();
                    phi.setIncoming(id, new Symbol(base, names.top(base, id)));
                }
            }
        }
    }
}
