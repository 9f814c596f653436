package io.github.eutro.flowssa.core.cfg;

import java.util.*;

/**
 * The dominance frontier of every reachable block of a {@link ControlFlowGraph}.
 * <p>
 * {@code b} is in {@code DF(n)} if {@code n} dominates a predecessor of {@code b}
 * but does not strictly dominate {@code b}.
 */
public final class DominanceFrontier {
    private final Map<Integer, Set<Integer>> frontiers;

    public DominanceFrontier(Map<Integer, ? extends Set<Integer>> frontiers) {
        Map<Integer, Set<Integer>> copy = new TreeMap<>();
        for (Map.Entry<Integer, ? extends Set<Integer>> entry : frontiers.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
        }
        this.frontiers = Collections.unmodifiableMap(copy);
    }

    /**
     * Get the dominance frontier of a block.
     *
     * @param block The block.
     * @return The frontier, in ascending order, empty for blocks not in the graph.
     */
    public Set<Integer> of(int block) {
        return frontiers.getOrDefault(block, Collections.emptySet());
    }

    public Map<Integer, Set<Integer>> asMap() {
        return frontiers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return frontiers.equals(((DominanceFrontier) o).frontiers);
    }

    @Override
    public int hashCode() {
        return frontiers.hashCode();
    }

    @Override
    public String toString() {
        return "DominanceFrontier" + frontiers;
    }
}
