package io.github.eutro.flowssa.core;

/**
 * Thrown when a control flow graph is not reducible: it has a retreating edge
 * whose target does not dominate its source.
 */
public class IrreducibleGraphException extends FlowSsaException {
    private final int source;
    private final int target;

    public IrreducibleGraphException(int source, int target) {
        super("irreducible control flow: edge %" + source + " -> %" + target
                + " re-enters a loop that %" + target + " does not dominate");
        this.source = source;
        this.target = target;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }
}
