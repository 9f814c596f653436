package io.github.eutro.flowssa.core.cfg;

import io.github.eutro.flowssa.core.ast.AstNode;
import io.github.eutro.flowssa.core.ast.Symbol;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The control instruction ending a {@link BasicBlock}.
 * <p>
 * Terminators are installed with {@link ControlFlowGraph#setTerminator(int, Terminator)},
 * which keeps the edges of the graph equal to the {@link #targets() targets} of each terminator.
 */
public abstract class Terminator {
    /**
     * Get the identifiers of the blocks control may be transferred to, in order.
     *
     * @return The targets.
     */
    public abstract List<Integer> targets();

    /**
     * Get the expression this terminator evaluates, if any: a branch condition,
     * a loop iteration check or a returned value.
     *
     * @return The expression, or null.
     */
    public @Nullable AstNode expression() {
        return null;
    }

    /**
     * Deep-copy this terminator.
     *
     * @return The copy.
     */
    public abstract Terminator copy();

    /**
     * A two-way conditional branch.
     */
    public static final class Branch extends Terminator {
        public final AstNode condition;
        public final int ifTrue;
        public final int ifFalse;

        public Branch(AstNode condition, int ifTrue, int ifFalse) {
            this.condition = condition;
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        @Override
        public List<Integer> targets() {
            return Arrays.asList(ifTrue, ifFalse);
        }

        @Override
        public AstNode expression() {
            return condition;
        }

        @Override
        public Branch copy() {
            return new Branch(condition.copy(), ifTrue, ifFalse);
        }

        @Override
        public String toString() {
            return "branch " + condition + " -> %" + ifTrue + " %" + ifFalse;
        }
    }

    /**
     * An unconditional jump.
     */
    public static final class Jump extends Terminator {
        public final int target;

        public Jump(int target) {
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public Jump copy() {
            return new Jump(target);
        }

        @Override
        public String toString() {
            return "jump -> %" + target;
        }
    }

    /**
     * The branch at the head of a lowered {@code for} loop: continue into the body
     * while {@link #check} holds, otherwise leave through the exit.
     * <p>
     * It behaves exactly like a {@link Branch}; it is kept distinct so the loop can be
     * regenerated as a {@code for} loop rather than a {@code while} loop.
     */
    public static final class IterateBranch extends Terminator {
        public final AstNode check;
        /**
         * The loop variable, as written in the source. It is assigned at the start of the body.
         */
        public final Symbol variable;
        public final int body;
        public final int exit;

        public IterateBranch(AstNode check, Symbol variable, int body, int exit) {
            this.check = check;
            this.variable = variable;
            this.body = body;
            this.exit = exit;
        }

        @Override
        public List<Integer> targets() {
            return Arrays.asList(body, exit);
        }

        @Override
        public AstNode expression() {
            return check;
        }

        @Override
        public IterateBranch copy() {
            return new IterateBranch(check.copy(), variable.copy(), body, exit);
        }

        @Override
        public String toString() {
            return "iterate " + variable + " while " + check + " -> %" + body + " %" + exit;
        }
    }

    /**
     * Return from the function.
     */
    public static final class Return extends Terminator {
        public final AstNode value;

        public Return(AstNode value) {
            this.value = value;
        }

        @Override
        public List<Integer> targets() {
            return Collections.emptyList();
        }

        @Override
        public AstNode expression() {
            return value;
        }

        @Override
        public Return copy() {
            return new Return(value.copy());
        }

        @Override
        public String toString() {
            return "return " + value;
        }
    }

    /**
     * A {@code break}, jumping to the exit of the innermost loop.
     */
    public static final class Break extends Terminator {
        public final int target;

        public Break(int target) {
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public Break copy() {
            return new Break(target);
        }

        @Override
        public String toString() {
            return "break -> %" + target;
        }
    }

    /**
     * A {@code next}, jumping to the header of the innermost loop.
     */
    public static final class Next extends Terminator {
        public final int target;

        public Next(int target) {
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public Next copy() {
            return new Next(target);
        }

        @Override
        public String toString() {
            return "next -> %" + target;
        }
    }
}
