package io.github.eutro.flowssa.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A variable reference.
 * <p>
 * SSA conversion renames symbols in place by giving them a sequence number.
 */
public final class Symbol extends AstNode {
    private final String base;
    @Nullable
    private Integer sequence;

    public Symbol(String base) {
        this(base, null);
    }

    public Symbol(String base, @Nullable Integer sequence) {
        this.base = base;
        this.sequence = sequence;
    }

    /**
     * Get the name of the variable, as written in the source.
     *
     * @return The base name.
     */
    public String getBase() {
        return base;
    }

    public @Nullable Integer getSequence() {
        return sequence;
    }

    public void setSequence(@Nullable Integer sequence) {
        this.sequence = sequence;
    }

    /**
     * Get the display name of this symbol: the base name if no sequence number is set,
     * otherwise {@code base#sequence}.
     *
     * @return The display name.
     */
    public String getName() {
        return sequence == null ? base : base + "#" + sequence;
    }

    @Override
    public Kind kind() {
        return Kind.SYMBOL;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public List<AstNode> children() {
        return Collections.emptyList();
    }

    @Override
    public Symbol copy() {
        return new Symbol(base, sequence);
    }

    @Override
    public String toString() {
        return getName();
    }
}
