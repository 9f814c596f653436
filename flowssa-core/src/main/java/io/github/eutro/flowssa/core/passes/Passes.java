package io.github.eutro.flowssa.core.passes;

import io.github.eutro.flowssa.core.ast.Function;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.passes.convert.AstToCfg;
import io.github.eutro.flowssa.core.passes.form.InsertReturn;
import io.github.eutro.flowssa.core.passes.form.SSAify;
import io.github.eutro.flowssa.core.passes.meta.LatticeValue;
import io.github.eutro.flowssa.core.passes.meta.PropagateConstants;

import java.util.Map;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Make returns explicit, then lower a function into a graph in SSA form.
     * <p>
     * This modifies the function given.
     */
    public static final IRPass<Function, ControlFlowGraph> FUNCTION_TO_SSA =
            InsertReturn.INSTANCE
                    .then(AstToCfg.INSTANCE)
                    .then(SSAify.INSTANCE);

    /**
     * Lower a function into SSA form and find the constant values of its variables.
     */
    public static final IRPass<Function, Map<String, LatticeValue>> ANALYSE_CONSTANTS =
            FUNCTION_TO_SSA.then(PropagateConstants.INSTANCE);
}
