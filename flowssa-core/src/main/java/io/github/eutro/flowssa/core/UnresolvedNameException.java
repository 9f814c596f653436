package io.github.eutro.flowssa.core;

/**
 * Thrown by SSA renaming when a variable is read where no definition of it is visible.
 */
public class UnresolvedNameException extends FlowSsaException {
    private final String name;
    private final int block;

    public UnresolvedNameException(String name, int block) {
        super("no definition of " + name + " reaches %" + block);
        this.name = name;
        this.block = block;
    }

    /**
     * Get the base name of the variable.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the identifier of the block the read is in.
     *
     * @return The block.
     */
    public int getBlock() {
        return block;
    }
}
