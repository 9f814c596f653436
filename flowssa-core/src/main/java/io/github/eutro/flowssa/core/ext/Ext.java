package io.github.eutro.flowssa.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key, which can be associated with a value (of type {@code T})
 * in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, so iteration over an {@link ExtHolder}
 * is deterministic within one run.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext with the given type and name.
     * <p>
     * Classes are not generic, so {@code R} may be a parameterised
     * subtype of the raw class given, e.g. {@code Ext<Set<BasicBlock>>}
     * created with {@code Set.class}.
     *
     * @param type The most specific superclass of the type of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
