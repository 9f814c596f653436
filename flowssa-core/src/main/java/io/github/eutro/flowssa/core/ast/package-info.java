/**
 * The abstract syntax tree consumed by the control flow graph builder.
 * <p>
 * The node catalogue is closed: literals, symbols, assignments, calls, braces, conditionals,
 * loops, {@code break}/{@code next}/{@code return} and function definitions.
 * Parsing concrete syntax into these nodes happens elsewhere.
 */
package io.github.eutro.flowssa.core.ast;
