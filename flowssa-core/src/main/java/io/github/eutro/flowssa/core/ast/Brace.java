package io.github.eutro.flowssa.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A sequence of expressions, {@code { a; b; c }}.
 */
public final class Brace extends AstNode {
    private final List<AstNode> body = new ArrayList<>();

    public Brace(List<? extends AstNode> body) {
        setBody(body);
    }

    public Brace(AstNode... body) {
        this(Arrays.asList(body));
    }

    public List<AstNode> getBody() {
        return Collections.unmodifiableList(body);
    }

    /**
     * Replace the contents of this brace.
     *
     * @param body The new contents.
     */
    public void setBody(List<? extends AstNode> body) {
        List<AstNode> newBody = new ArrayList<>(body);
        this.body.clear();
        for (AstNode node : newBody) {
            this.body.add(adopt(node));
        }
    }

    @Override
    public Kind kind() {
        return Kind.BRACE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBrace(this);
    }

    @Override
    public List<AstNode> children() {
        return present(body.toArray(new AstNode[0]));
    }

    @Override
    public Brace copy() {
        List<AstNode> bodyCopy = new ArrayList<>(body.size());
        for (AstNode node : body) {
            bodyCopy.add(copyOf(node));
        }
        return new Brace(bodyCopy);
    }

    @Override
    public String toString() {
        return body.stream()
                .map(String::valueOf)
                .collect(Collectors.joining("; ", "{ ", " }"));
    }
}
