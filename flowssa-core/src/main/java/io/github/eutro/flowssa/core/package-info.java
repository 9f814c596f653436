/**
 * Builds control flow graphs from R-like ASTs, converts them to SSA form,
 * and propagates constants through them.
 * <p>
 * {@link io.github.eutro.flowssa.core.FlowSsa} runs the whole pipeline;
 * the individual steps are {@link io.github.eutro.flowssa.core.passes passes}.
 * All errors are {@link io.github.eutro.flowssa.core.FlowSsaException}s.
 */
package io.github.eutro.flowssa.core;
