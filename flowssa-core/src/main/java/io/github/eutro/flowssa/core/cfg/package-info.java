/**
 * The control flow graph representation.
 * <p>
 * A {@link io.github.eutro.flowssa.core.cfg.ControlFlowGraph} owns its
 * {@link io.github.eutro.flowssa.core.cfg.BasicBlock blocks}, which are referred to
 * by integer identifiers everywhere else: in terminators, in phi inputs, and in the
 * {@link io.github.eutro.flowssa.core.cfg.DominatorTree dominator tree} and
 * {@link io.github.eutro.flowssa.core.cfg.DominanceFrontier dominance frontier}.
 * <p>
 * After {@link io.github.eutro.flowssa.core.passes.form.SSAify SSA conversion}, every
 * symbol in the graph has a sequence number, and each display name {@code base#n}
 * is defined exactly once: by a parameter, a phi, or an assignment.
 */
package io.github.eutro.flowssa.core.cfg;
