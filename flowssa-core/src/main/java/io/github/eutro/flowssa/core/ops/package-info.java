/**
 * Evaluation of R operators on constants.
 */
package io.github.eutro.flowssa.core.ops;
