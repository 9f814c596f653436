package io.github.eutro.flowssa.core.cfg;

import io.github.eutro.flowssa.core.ast.Symbol;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A phi node, merging the definitions of one variable that reach a block along different edges.
 */
public final class Phi {
    private final Symbol write;
    private final Map<Integer, Symbol> incoming = new TreeMap<>();

    /**
     * Create a phi for a variable, with a fresh write slot and no incoming values.
     *
     * @param base The base name of the variable.
     */
    public Phi(String base) {
        this.write = new Symbol(base);
    }

    private Phi(Symbol write) {
        this.write = write;
    }

    public String getBase() {
        return write.getBase();
    }

    /**
     * Get the symbol defined by this phi. Renaming gives it a sequence number.
     *
     * @return The written symbol.
     */
    public Symbol getWrite() {
        return write;
    }

    /**
     * Get the incoming values, by predecessor block identifier.
     *
     * @return The incoming values.
     */
    public Map<Integer, Symbol> getIncoming() {
        return Collections.unmodifiableMap(incoming);
    }

    /**
     * Set the value flowing in from a predecessor.
     *
     * @param pred  The predecessor block identifier.
     * @param value The symbol read along that edge.
     */
    public void setIncoming(int pred, Symbol value) {
        incoming.put(pred, value);
    }

    void removeIncoming(int pred) {
        incoming.remove(pred);
    }

    public Phi copy() {
        Phi copy = new Phi(write.copy());
        for (Map.Entry<Integer, Symbol> entry : incoming.entrySet()) {
            copy.incoming.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return write + " = phi" + incoming.entrySet().stream()
                .map(e -> "%" + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
