/**
 * Passes over the IR, and their composition.
 *
 * @see io.github.eutro.flowssa.core.passes.IRPass
 */
package io.github.eutro.flowssa.core.passes;
