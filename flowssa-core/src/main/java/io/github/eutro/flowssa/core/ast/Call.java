package io.github.eutro.flowssa.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An application of a named function, including operators such as {@code +}.
 * <p>
 * The callee is referenced by name and is never renamed.
 */
public final class Call extends AstNode {
    private final String fn;
    private final List<AstNode> args;

    public Call(String fn, List<? extends AstNode> args) {
        this.fn = fn;
        this.args = new ArrayList<>(args.size());
        for (AstNode arg : args) {
            this.args.add(adopt(arg));
        }
    }

    public Call(String fn, AstNode... args) {
        this(fn, Arrays.asList(args));
    }

    /**
     * Get the name of the function called.
     *
     * @return The callee.
     */
    public String getFn() {
        return fn;
    }

    public List<AstNode> getArgs() {
        return Collections.unmodifiableList(args);
    }

    @Override
    public Kind kind() {
        return Kind.CALL;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public List<AstNode> children() {
        return present(args.toArray(new AstNode[0]));
    }

    @Override
    public Call copy() {
        List<AstNode> argsCopy = new ArrayList<>(args.size());
        for (AstNode arg : args) {
            argsCopy.add(copyOf(arg));
        }
        return new Call(fn, argsCopy);
    }

    @Override
    public String toString() {
        return fn + args.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
