package io.github.eutro.flowssa.core.ext;

import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.passes.IRPass;
import io.github.eutro.flowssa.core.passes.form.SSAify;
import io.github.eutro.flowssa.core.passes.meta.ComputeDomFrontier;
import io.github.eutro.flowssa.core.passes.meta.ComputeDoms;
import io.github.eutro.flowssa.core.passes.meta.ComputeLiveVars;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps track of the state of derived facts of a {@link ControlFlowGraph}, such as its dominators or its SSA-ness.
 */
public class MetadataState {
    /**
     * A kind of metadata whose presence can be checked on {@link MetadataState}.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return id;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata which also knows the passes that compute it.
     *
     * @param <T> The IR on which passes must be run to compute the metadata.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("pass is not in-place: " + pass);
                pass.run(t);
            }
        }
    }

    /**
     * Metadata that can be computed for control flow graphs.
     */
    public static final ComputableMetaKind<ControlFlowGraph>
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            DOM_FRONTIER = new ComputableMetaKind<>("DOM_FRONTIER", ComputeDomFrontier.INSTANCE),
            LIVE_DATA = new ComputableMetaKind<>("LIVE_DATA", ComputeLiveVars.INSTANCE);

    /**
     * Whether the graph is in SSA form. Set by {@link SSAify}, never computed on demand.
     */
    public static final MetaKind SSA_FORM = new MetaKind("SSA_FORM");

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Check whether the given metadata are valid, and compute those that are not.
     *
     * @param t     The thing that passes can be run on.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    /**
     * Mark the given metadata as valid.
     *
     * @param kinds The metadata kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    /**
     * Mark the given metadata as invalid.
     *
     * @param kinds The metadata kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Invalidate everything that depends on the edges of the graph.
     */
    public void graphChanged() {
        invalidate(DOMS, DOM_FRONTIER);
        varsChanged();
    }

    /**
     * Invalidate everything that depends on the variables of the graph.
     */
    public void varsChanged() {
        invalidate(LIVE_DATA);
    }
}
