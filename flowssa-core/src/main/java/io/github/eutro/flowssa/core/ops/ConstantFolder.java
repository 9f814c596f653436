package io.github.eutro.flowssa.core.ops;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates a call on constant arguments.
 */
@FunctionalInterface
public interface ConstantFolder {
    /**
     * Evaluate the call.
     *
     * @param args The argument values, as {@link io.github.eutro.flowssa.core.ast.Literal} values.
     * @return The result, or empty if the call cannot be evaluated to a single constant.
     */
    Optional<Object> fold(List<Object> args);
}
