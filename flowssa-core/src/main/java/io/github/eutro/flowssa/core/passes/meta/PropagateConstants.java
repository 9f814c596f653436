package io.github.eutro.flowssa.core.passes.meta;

import io.github.eutro.flowssa.core.ast.*;
import io.github.eutro.flowssa.core.cfg.BasicBlock;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.Phi;
import io.github.eutro.flowssa.core.cfg.Terminator;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.ops.ArithmeticOps;
import io.github.eutro.flowssa.core.passes.IRPass;
import io.github.eutro.flowssa.core.util.Pair;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Sparse constant propagation over a graph in SSA form.
 * <p>
 * The result maps the display name of every SSA definition (parameter, phi or assignment)
 * to its final {@link LatticeValue}, which is never {@link LatticeValue#UNKNOWN}.
 * <p>
 * In conditional mode (the default), only edges that may be taken are followed: a branch
 * on a constant condition only enables the matching edge, and phis only meet the values flowing
 * along enabled edges. Assignments are evaluated wherever they are.
 */
public class PropagateConstants implements IRPass<ControlFlowGraph, Map<String, LatticeValue>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropagateConstants.class);

    /**
     * An instance of this pass with the default configuration.
     */
    public static final PropagateConstants INSTANCE = builder().build();

    private final boolean conditional;
    @Nullable
    private final TransitionListener listener;

    private PropagateConstants(boolean conditional, @Nullable TransitionListener listener) {
        this.conditional = conditional;
        this.listener = listener;
    }

    /**
     * Start a {@link Builder} for configuring this pass.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public boolean isConditional() {
        return conditional;
    }

    /**
     * Observes every change of a lattice value during propagation.
     */
    @FunctionalInterface
    public interface TransitionListener {
        /**
         * Called when the value of a name changes.
         *
         * @param name The SSA display name.
         * @param from The old value.
         * @param to   The new value.
         */
        void onTransition(String name, LatticeValue from, LatticeValue to);
    }

    /**
     * A builder for a configured {@link PropagateConstants} pass.
     */
    public static class Builder {
        private boolean conditional = true;
        @Nullable
        private TransitionListener listener = null;

        /**
         * Set whether only executable edges are followed. Enabled by default.
         *
         * @param conditional Whether the analysis is conditional.
         * @return This builder, for convenience.
         */
        public Builder setConditional(boolean conditional) {
            this.conditional = conditional;
            return this;
        }

        /**
         * Set a listener to observe every lattice transition.
         *
         * @param listener The listener, or null for none.
         * @return This builder, for convenience.
         */
        public Builder setListener(@Nullable TransitionListener listener) {
            this.listener = listener;
            return this;
        }

        public PropagateConstants build() {
            return new PropagateConstants(conditional, listener);
        }
    }

    @Override
    public Map<String, LatticeValue> run(ControlFlowGraph cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        if (!ms.isValid(MetadataState.SSA_FORM)) {
            throw new IllegalStateException("constant propagation requires a graph in SSA form");
        }
        return new Propagation(cfg).run();
    }

    private static abstract class Def {
        final int block;

        Def(int block) {
            this.block = block;
        }
    }

    private static class AssignDef extends Def {
        final Assign assign;

        AssignDef(int block, Assign assign) {
            super(block);
            this.assign = assign;
        }
    }

    private static class PhiDef extends Def {
        final Phi phi;

        PhiDef(int block, Phi phi) {
            super(block);
            this.phi = phi;
        }
    }

    private class Propagation {
        private final ControlFlowGraph cfg;
        private final Map<String, LatticeValue> values = new LinkedHashMap<>();
        private final Map<String, Def> defs = new HashMap<>();
        private final Map<String, Set<Def>> phiAndAssignUses = new HashMap<>();
        private final Map<String, Set<Integer>> terminatorUses = new HashMap<>();

        private final Set<Integer> executableBlocks = new HashSet<>();
        private final Set<Pair<Integer, Integer>> executableEdges = new HashSet<>();
        private final Deque<Pair<Integer, Integer>> flowWork = new ArrayDeque<>();
        private final Deque<String> ssaWork = new ArrayDeque<>();
        private int steps = 0;

        Propagation(ControlFlowGraph cfg) {
            this.cfg = cfg;
        }

        Map<String, LatticeValue> run() {
            index();

            for (Symbol param : cfg.getParams()) {
                update(param.getName(), LatticeValue.NOT_CONSTANT);
            }
            if (conditional) {
                markBlockExecutable(cfg.getEntryId());
            } else {
                for (BasicBlock block : cfg.getBlocks()) {
                    executableBlocks.add(block.getId());
                    for (int succ : cfg.successors(block.getId())) {
                        executableEdges.add(Pair.of(block.getId(), succ));
                    }
                }
            }
            for (Def def : new ArrayList<>(defs.values())) {
                evaluate(def);
            }

            while (!flowWork.isEmpty() || !ssaWork.isEmpty()) {
                steps++;
                if (!flowWork.isEmpty()) {
                    Pair<Integer, Integer> edge = flowWork.pop();
                    if (!executableEdges.add(edge)) continue;
                    BasicBlock target = cfg.get(edge.right);
                    for (Phi phi : target.getPhis()) {
                        evaluate(defs.get(phi.getWrite().getName()));
                    }
                    markBlockExecutable(edge.right);
                } else {
                    String name = ssaWork.pop();
                    for (Def use : phiAndAssignUses.getOrDefault(name, Collections.emptySet())) {
                        evaluate(use);
                    }
                    if (conditional) {
                        for (int block : terminatorUses.getOrDefault(name, Collections.emptySet())) {
                            if (executableBlocks.contains(block)) visitTerminator(block);
                        }
                    }
                }
            }

            Map<String, LatticeValue> result = new LinkedHashMap<>();
            int constants = 0;
            for (Map.Entry<String, LatticeValue> entry : values.entrySet()) {
                LatticeValue value = entry.getValue();
                if (value.isUnknown()) value = LatticeValue.NOT_CONSTANT;
                if (value.isConstant()) constants++;
                result.put(entry.getKey(), value);
            }
            LOGGER.debug("propagated constants in {} steps: {} of {} names are constant",
                    steps, constants, result.size());
            return result;
        }

        private void index() {
            for (Symbol param : cfg.getParams()) {
                values.put(param.getName(), LatticeValue.UNKNOWN);
            }
            for (BasicBlock block : cfg.getBlocks()) {
                int id = block.getId();
                for (Phi phi : block.getPhis()) {
                    PhiDef def = new PhiDef(id, phi);
                    define(phi.getWrite(), def);
                    for (Symbol incoming : phi.getIncoming().values()) {
                        phiAndAssignUses.computeIfAbsent(incoming.getName(), $ -> new LinkedHashSet<>()).add(def);
                    }
                }
                for (AstNode statement : block.getBody()) {
                    if (statement.kind() != Kind.ASSIGN) continue;
                    Assign assign = (Assign) statement;
                    Symbol write = assign.getWrite();
                    if (write == null) continue;
                    AssignDef def = new AssignDef(id, assign);
                    define(write, def);
                    for (Symbol read : AstNodes.reads(assign)) {
                        phiAndAssignUses.computeIfAbsent(read.getName(), $ -> new LinkedHashSet<>()).add(def);
                    }
                }
                Terminator terminator = block.getTerminator();
                if (terminator != null) {
                    for (Symbol read : AstNodes.reads(terminator.expression())) {
                        terminatorUses.computeIfAbsent(read.getName(), $ -> new LinkedHashSet<>()).add(id);
                    }
                }
            }
        }

        private void define(Symbol write, Def def) {
            if (defs.put(write.getName(), def) != null) {
                throw new IllegalStateException(write.getName() + " is defined more than once");
            }
            values.put(write.getName(), LatticeValue.UNKNOWN);
        }

        private void markBlockExecutable(int block) {
            if (!executableBlocks.add(block)) return;
            visitTerminator(block);
        }

        private void visitTerminator(int block) {
            Terminator terminator = cfg.get(block).getTerminator();
            if (terminator == null) return;
            if (terminator instanceof Terminator.Branch || terminator instanceof Terminator.IterateBranch) {
                List<Integer> targets = terminator.targets();
                LatticeValue condition = eval(Objects.requireNonNull(terminator.expression()));
                if (condition.isUnknown()) return;
                Optional<Boolean> truth = condition.isConstant()
                        ? ArithmeticOps.truthiness(condition.getValue())
                        : Optional.empty();
                if (truth.isPresent()) {
                    flowWork.add(Pair.of(block, truth.get() ? targets.get(0) : targets.get(1)));
                    return;
                }
            }
            for (int target : terminator.targets()) {
                flowWork.add(Pair.of(block, target));
            }
        }

        private void evaluate(Def def) {
            LatticeValue newValue;
            String name;
            if (def instanceof PhiDef) {
                Phi phi = ((PhiDef) def).phi;
                name = phi.getWrite().getName();
                newValue = LatticeValue.UNKNOWN;
                for (Map.Entry<Integer, Symbol> entry : phi.getIncoming().entrySet()) {
                    if (!executableEdges.contains(Pair.of(entry.getKey(), def.block))) continue;
                    newValue = newValue.meet(lookup(entry.getValue()));
                }
            } else {
                Assign assign = ((AssignDef) def).assign;
                name = Objects.requireNonNull(assign.getWrite()).getName();
                AstNode read = assign.getRead();
                newValue = read == null ? LatticeValue.NOT_CONSTANT : eval(read);
            }
            update(name, newValue);
        }

        private LatticeValue lookup(Symbol symbol) {
            LatticeValue value = values.get(symbol.getName());
            return value == null ? LatticeValue.NOT_CONSTANT : value;
        }

        private LatticeValue eval(AstNode expr) {
            switch (expr.kind()) {
                case LITERAL:
                    return LatticeValue.constant(((Literal) expr).getValue());
                case SYMBOL:
                    return lookup((Symbol) expr);
                case CALL: {
                    Call call = (Call) expr;
                    if (!ArithmeticOps.isFoldable(call.getFn(), call.getArgs().size())) {
                        return LatticeValue.NOT_CONSTANT;
                    }
                    List<Object> args = new ArrayList<>();
                    boolean unknown = false;
                    for (AstNode arg : call.getArgs()) {
                        if (arg == null) return LatticeValue.NOT_CONSTANT;
                        LatticeValue argValue = eval(arg);
                        if (argValue.isNotConstant()) return LatticeValue.NOT_CONSTANT;
                        if (argValue.isUnknown()) {
                            unknown = true;
                        } else {
                            args.add(argValue.getValue());
                        }
                    }
                    if (unknown) return LatticeValue.UNKNOWN;
                    return ArithmeticOps.fold(call.getFn(), args)
                            .map(LatticeValue::constant)
                            .orElse(LatticeValue.NOT_CONSTANT);
                }
                default:
                    return LatticeValue.NOT_CONSTANT;
            }
        }

        private void update(String name, LatticeValue newValue) {
            LatticeValue oldValue = values.get(name);
            if (oldValue == null) oldValue = LatticeValue.UNKNOWN;
            if (oldValue.equals(newValue)) return;
            if (!oldValue.isBelowOrEqual(newValue)) {
                throw new IllegalStateException("lattice value of " + name + " moved backwards: "
                        + oldValue + " -> " + newValue);
            }
            values.put(name, newValue);
            LOGGER.trace("{}: {} -> {}", name, oldValue, newValue);
            if (listener != null) listener.onTransition(name, oldValue, newValue);
            ssaWork.add(name);
        }
    }
}
