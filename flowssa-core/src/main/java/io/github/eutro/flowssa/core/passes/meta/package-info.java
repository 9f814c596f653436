/**
 * Passes that compute facts about the IR, without changing what it does.
 */
package io.github.eutro.flowssa.core.passes.meta;
