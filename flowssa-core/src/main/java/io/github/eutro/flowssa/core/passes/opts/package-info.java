/**
 * Passes that simplify a control flow graph without changing what it computes.
 */
package io.github.eutro.flowssa.core.passes.opts;
