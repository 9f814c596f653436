/**
 * Passes that convert the IR from one form to another.
 */
package io.github.eutro.flowssa.core.passes.convert;
