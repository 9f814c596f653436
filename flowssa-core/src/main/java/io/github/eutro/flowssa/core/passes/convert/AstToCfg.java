package io.github.eutro.flowssa.core.passes.convert;

import io.github.eutro.flowssa.core.MalformedAstException;
import io.github.eutro.flowssa.core.ast.*;
import io.github.eutro.flowssa.core.cfg.BasicBlock;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.Terminator;
import io.github.eutro.flowssa.core.passes.IRPass;
import io.github.eutro.flowssa.core.passes.opts.EliminateDeadBlocks;
import io.github.eutro.flowssa.core.util.Counter;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Lowers the body of a {@link Function} into a {@link ControlFlowGraph}.
 * <p>
 * Structured control flow becomes blocks and terminators: {@code if} becomes a branch to two arms
 * which meet again in a merge block if both fall through (otherwise lowering carries on from the
 * arm that does), loops get a header, a body and an exit block, and
 * {@code break}, {@code next} and {@code return} end their block. Code that can never run,
 * such as statements after a {@code break}, is not emitted. A body that falls off the end
 * returns {@code NULL}.
 * <p>
 * A {@code for (v in iterable)} loop evaluates the iterable once into a synthesized variable,
 * and counts iterations in another; the header increments the counter and ends in an
 * {@link Terminator.IterateBranch}, and the body starts by assigning the loop variable.
 * <p>
 * Statements are copied into the graph, so the AST given is left untouched.
 */
public class AstToCfg implements IRPass<Function, ControlFlowGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AstToCfg.class);

    /**
     * An instance of this pass with the default configuration.
     */
    public static final AstToCfg INSTANCE = builder().build();

    private final String syntheticPrefix;

    private AstToCfg(String syntheticPrefix) {
        this.syntheticPrefix = syntheticPrefix;
    }

    /**
     * Start a {@link Builder} for configuring this pass.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for a configured {@link AstToCfg} pass.
     */
    public static class Builder {
        private String syntheticPrefix = "._";

        /**
         * Set the prefix of the names of variables introduced when lowering {@code for} loops.
         * By default, {@code ._}, which cannot clash with an ordinary R variable name.
         *
         * @param syntheticPrefix The prefix.
         * @return This builder, for convenience.
         */
        public Builder setSyntheticPrefix(String syntheticPrefix) {
            if (syntheticPrefix.isEmpty()) throw new IllegalArgumentException("prefix must not be empty");
            this.syntheticPrefix = syntheticPrefix;
            return this;
        }

        public AstToCfg build() {
            return new AstToCfg(syntheticPrefix);
        }
    }

    public String getSyntheticPrefix() {
        return syntheticPrefix;
    }

    @Override
    public ControlFlowGraph run(Function function) {
        AstNode body = function.getBody();
        if (body == null) throw MalformedAstException.missing(function, "body");
        return build(function.getParams(), body);
    }

    /**
     * Lower a function body.
     *
     * @param params The parameters of the function.
     * @param body   The body.
     * @return The graph.
     * @throws MalformedAstException If the body is not well-formed.
     */
    public ControlFlowGraph build(List<String> params, AstNode body) {
        ControlFlowGraph cfg = new ControlFlowGraph(params);
        ConvertState state = new ConvertState(cfg);
        body.accept(state);
        if (state.current != null) {
            cfg.setTerminator(state.current.getId(), new Terminator.Return(Literal.ofNull()));
        }
        int built = cfg.size();
        EliminateDeadBlocks.INSTANCE.runInPlace(cfg);
        LOGGER.debug("built {} blocks, {} reachable", built, cfg.size());
        return cfg;
    }

    /**
     * Lower a function body with no parameters.
     *
     * @param body The body.
     * @return The graph.
     */
    public ControlFlowGraph build(AstNode body) {
        return build(Collections.emptyList(), body);
    }

    private static class LoopTargets {
        final int header;
        final int exit;

        LoopTargets(int header, int exit) {
            this.header = header;
            this.exit = exit;
        }
    }

    private class ConvertState implements AstVisitor<Void> {
        final ControlFlowGraph cfg;
        final Deque<LoopTargets> loops = new ArrayDeque<>();
        final Counter synthetics = new Counter();
        /**
         * The block statements are appended to, or null if the code here is unreachable.
         */
        @Nullable
        BasicBlock current;
        int depth = 0;

        ConvertState(ControlFlowGraph cfg) {
            this.cfg = cfg;
            current = cfg.getEntry();
        }

        private <T extends AstNode> T require(@Nullable T child, AstNode node, String slot) {
            if (child == null) throw MalformedAstException.missing(node, slot);
            return child;
        }

        private AstNode expression(@Nullable AstNode expr, AstNode node, String slot) {
            AstNode checked = require(expr, node, slot);
            AstNode bad = AstNodes.findStatementOnly(checked);
            if (bad != null) {
                throw new MalformedAstException(bad, bad.kind() + " in the " + slot + " of " + node.kind());
            }
            return checked.copy();
        }

        private BasicBlock current() {
            if (current == null) throw new IllegalStateException("emitting unreachable code");
            return current;
        }

        private void terminate(Terminator terminator) {
            cfg.setTerminator(current().getId(), terminator);
            current = null;
        }

        private String synthesize(String kind, String variable) {
            String name = syntheticPrefix + kind + "_" + variable;
            int n = synthetics.increment(name);
            return n == 1 ? name : name + "_" + n;
        }

        /**
         * Lower {@code node} starting in {@code start}.
         *
         * @return The block control falls through from, or null if it never does.
         */
        private @Nullable BasicBlock lowerRegion(AstNode node, BasicBlock start, int regionDepth) {
            int oldDepth = depth;
            current = start;
            depth = regionDepth;
            try {
                node.accept(this);
            } finally {
                depth = oldDepth;
            }
            BasicBlock end = current;
            current = null;
            return end;
        }

        private Void statement(AstNode node) {
            current().append(expression(node, node, "statement"));
            return null;
        }

        @Override
        public Void visitLiteral(Literal node) {
            return statement(node);
        }

        @Override
        public Void visitSymbol(Symbol node) {
            return statement(node);
        }

        @Override
        public Void visitCall(Call node) {
            return statement(node);
        }

        @Override
        public Void visitFunction(Function node) {
            return statement(node);
        }

        @Override
        public Void visitAssign(Assign node) {
            Symbol write = require(node.getWrite(), node, "target");
            AstNode read = expression(node.getRead(), node, "value");
            current().append(new Assign(write.copy(), read));
            return null;
        }

        @Override
        public Void visitBrace(Brace node) {
            for (AstNode statement : node.getBody()) {
                if (current == null) break; // the rest is unreachable
                require(statement, node, "statement").accept(this);
            }
            return null;
        }

        @Override
        public Void visitIf(If node) {
            AstNode condition = expression(node.getCondition(), node, "condition");
            AstNode ifTrue = require(node.getTrue(), node, "true arm");
            AstNode ifFalse = node.getFalse();

            BasicBlock trueBlock = cfg.newBlock(depth + 1);
            BasicBlock falseBlock = cfg.newBlock(depth + 1);
            terminate(new Terminator.Branch(condition, trueBlock.getId(), falseBlock.getId()));

            BasicBlock trueEnd = lowerRegion(ifTrue, trueBlock, depth + 1);
            BasicBlock falseEnd = ifFalse == null ? falseBlock : lowerRegion(ifFalse, falseBlock, depth + 1);
            if (trueEnd == null || falseEnd == null) {
                // at most one arm falls through, and the code after the if carries on from it
                current = trueEnd == null ? falseEnd : trueEnd;
                return null;
            }
            BasicBlock merge = cfg.newBlock(depth);
            cfg.setTerminator(trueEnd.getId(), new Terminator.Jump(merge.getId()));
            cfg.setTerminator(falseEnd.getId(), new Terminator.Jump(merge.getId()));
            current = merge;
            return null;
        }

        @Override
        public Void visitWhile(While node) {
            AstNode condition = node.isRepeat() ? null : expression(node.getCondition(), node, "condition");
            AstNode body = require(node.getBody(), node, "body");

            BasicBlock header = cfg.newBlock(depth + 1);
            BasicBlock bodyBlock = cfg.newBlock(depth + 1);
            BasicBlock exit = cfg.newBlock(depth);
            terminate(new Terminator.Jump(header.getId()));
            cfg.setTerminator(header.getId(), condition == null
                    ? new Terminator.Jump(bodyBlock.getId())
                    : new Terminator.Branch(condition, bodyBlock.getId(), exit.getId()));

            lowerLoopBody(body, bodyBlock, header, exit);
            return null;
        }

        @Override
        public Void visitFor(For node) {
            Symbol variable = require(node.getVariable(), node, "variable");
            AstNode iterable = expression(node.getIterable(), node, "iterable");
            AstNode body = require(node.getBody(), node, "body");

            String iter = synthesize("iter", variable.getBase());
            String counter = synthesize("counter", variable.getBase());
            BasicBlock pre = current();
            pre.append(new Assign(new Symbol(iter), iterable));
            pre.append(new Assign(new Symbol(counter), new Literal(0)));

            BasicBlock header = cfg.newBlock(depth + 1);
            BasicBlock bodyBlock = cfg.newBlock(depth + 1);
            BasicBlock exit = cfg.newBlock(depth);
            terminate(new Terminator.Jump(header.getId()));

            header.append(new Assign(new Symbol(counter),
                    new Call("+", new Symbol(counter), new Literal(1))));
            cfg.setTerminator(header.getId(), new Terminator.IterateBranch(
                    new Call("<=", new Symbol(counter), new Call("length", new Symbol(iter))),
                    variable.copy(),
                    bodyBlock.getId(),
                    exit.getId()));
            bodyBlock.append(new Assign(variable.copy(),
                    new Call("[[", new Symbol(iter), new Symbol(counter))));

            lowerLoopBody(body, bodyBlock, header, exit);
            return null;
        }

        private void lowerLoopBody(AstNode body, BasicBlock bodyBlock, BasicBlock header, BasicBlock exit) {
            loops.push(new LoopTargets(header.getId(), exit.getId()));
            BasicBlock bodyEnd;
            try {
                bodyEnd = lowerRegion(body, bodyBlock, depth + 1);
            } finally {
                loops.pop();
            }
            if (bodyEnd != null) {
                cfg.setTerminator(bodyEnd.getId(), new Terminator.Jump(header.getId()));
            }
            current = exit;
        }

        @Override
        public Void visitBreak(Break node) {
            LoopTargets loop = loops.peek();
            if (loop == null) throw new MalformedAstException(node, "break outside of a loop");
            terminate(new Terminator.Break(loop.exit));
            return null;
        }

        @Override
        public Void visitNext(Next node) {
            LoopTargets loop = loops.peek();
            if (loop == null) throw new MalformedAstException(node, "next outside of a loop");
            terminate(new Terminator.Next(loop.header));
            return null;
        }

        @Override
        public Void visitReturn(Return node) {
            AstNode value = node.getValue() == null ? Literal.ofNull() : expression(node.getValue(), node, "value");
            terminate(new Terminator.Return(value));
            return null;
        }
    }
}
