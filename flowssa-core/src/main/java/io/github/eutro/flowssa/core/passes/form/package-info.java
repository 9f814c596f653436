/**
 * Passes that put the IR into a particular form, such as SSA form.
 */
package io.github.eutro.flowssa.core.passes.form;
