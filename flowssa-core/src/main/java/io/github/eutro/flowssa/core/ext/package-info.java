/**
 * The ext API associates derived data with IR objects
 * (instances of {@link io.github.eutro.flowssa.core.ext.ExtContainer}).
 *
 * <pre>{@code
 * ControlFlowGraph cfg = AstToCfg.INSTANCE.run(function);
 * ComputeDoms.INSTANCE.run(cfg);
 * DominatorTree tree = cfg.getExtOrThrow(CommonExts.DOM_TREE);
 * }</pre>
 * <p>
 * Passes which need facts such as dominators or liveness read them from exts,
 * and the {@link io.github.eutro.flowssa.core.ext.MetadataState} of a graph
 * records which of them are currently valid, recomputing them on demand.
 */
package io.github.eutro.flowssa.core.ext;
