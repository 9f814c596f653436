package io.github.eutro.flowssa.core.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Keeps a running count of how many times each name has been seen.
 */
public final class Counter {
    private final Map<String, Integer> counts = new HashMap<>();

    /**
     * Count another occurrence of {@code name}.
     *
     * @param name The name.
     * @return The number of times the name has now been seen, starting from 1.
     */
    public int increment(String name) {
        return counts.merge(name, 1, Integer::sum);
    }
}
