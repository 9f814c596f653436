package io.github.eutro.flowssa.core.cfg;

import java.util.*;

/**
 * The dominator tree of the blocks of a {@link ControlFlowGraph} reachable from its entry.
 * <p>
 * A block {@code d} dominates {@code n} if every path from the entry to {@code n} passes through {@code d}.
 * The entry block is its own immediate dominator.
 */
public final class DominatorTree {
    private final int root;
    private final Map<Integer, Integer> idoms;
    private final List<Integer> reversePostOrder;
    private final Map<Integer, List<Integer>> children = new HashMap<>();

    /**
     * Construct a dominator tree.
     *
     * @param root             The entry block.
     * @param idoms            The immediate dominator of every reachable block, the root mapping to itself.
     * @param reversePostOrder The reachable blocks in reverse post-order.
     */
    public DominatorTree(int root, Map<Integer, Integer> idoms, List<Integer> reversePostOrder) {
        this.root = root;
        this.idoms = Collections.unmodifiableMap(new LinkedHashMap<>(idoms));
        this.reversePostOrder = Collections.unmodifiableList(new ArrayList<>(reversePostOrder));
        for (Integer block : idoms.keySet()) {
            children.put(block, new ArrayList<>());
        }
        for (Map.Entry<Integer, Integer> entry : idoms.entrySet()) {
            if (entry.getKey() != root) {
                children.get(entry.getValue()).add(entry.getKey());
            }
        }
        for (List<Integer> ls : children.values()) {
            Collections.sort(ls);
        }
    }

    public int getRoot() {
        return root;
    }

    /**
     * Whether the block was reachable, and so is in this tree.
     *
     * @param block The block.
     * @return Whether it is in the tree.
     */
    public boolean contains(int block) {
        return idoms.containsKey(block);
    }

    /**
     * Get the immediate dominator of a block.
     *
     * @param block The block.
     * @return Its immediate dominator, the block itself for the root.
     */
    public int idom(int block) {
        Integer idom = idoms.get(block);
        if (idom == null) throw new NoSuchElementException("block %" + block + " is not in the dominator tree");
        return idom;
    }

    /**
     * Get the blocks immediately dominated by a block, in ascending order.
     *
     * @param block The block.
     * @return The children.
     */
    public List<Integer> children(int block) {
        List<Integer> ls = children.get(block);
        if (ls == null) throw new NoSuchElementException("block %" + block + " is not in the dominator tree");
        return Collections.unmodifiableList(ls);
    }

    /**
     * Whether {@code a} dominates {@code b}. Every block dominates itself.
     *
     * @param a The potential dominator.
     * @param b The block.
     * @return Whether a dominates b.
     */
    public boolean dominates(int a, int b) {
        int runner = b;
        while (true) {
            if (runner == a) return true;
            int next = idom(runner);
            if (next == runner) return false;
            runner = next;
        }
    }

    public boolean strictlyDominates(int a, int b) {
        return a != b && dominates(a, b);
    }

    /**
     * Get the chain of dominators of a block, from the block itself up to the root.
     *
     * @param block The block.
     * @return The dominators.
     */
    public List<Integer> dominators(int block) {
        List<Integer> chain = new ArrayList<>();
        int runner = block;
        chain.add(runner);
        while (idom(runner) != runner) {
            runner = idom(runner);
            chain.add(runner);
        }
        return chain;
    }

    public List<Integer> getReversePostOrder() {
        return reversePostOrder;
    }

    /**
     * Get the tree as a map from each block to its immediate dominator.
     *
     * @return The map.
     */
    public Map<Integer, Integer> asMap() {
        return idoms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DominatorTree that = (DominatorTree) o;
        return root == that.root && idoms.equals(that.idoms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, idoms);
    }

    @Override
    public String toString() {
        return "DominatorTree" + new TreeMap<>(idoms);
    }
}
