package io.github.eutro.flowssa.core.cfg;

import io.github.eutro.flowssa.core.ast.Symbol;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.Ext;
import io.github.eutro.flowssa.core.ext.ExtHolder;
import io.github.eutro.flowssa.core.ext.MetadataState;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A control flow graph of {@link BasicBlock basic blocks}, for one function.
 * <p>
 * The graph owns its blocks. Edges are derived from terminators: the only way to change
 * the edges is {@link #setTerminator(int, Terminator)}, so the successors of a block are
 * always exactly the targets of its terminator.
 */
public final class ControlFlowGraph extends ExtHolder {
    private final List<Symbol> params = new ArrayList<>();
    private final SortedMap<Integer, BasicBlock> blocks = new TreeMap<>();
    private final Map<Integer, List<Integer>> succs = new HashMap<>();
    private final Map<Integer, Set<Integer>> preds = new HashMap<>();
    private final int entry;
    private int nextId = 0;

    /**
     * Create a graph with a fresh, empty entry block.
     *
     * @param params The names of the function's parameters, defined on entry.
     */
    public ControlFlowGraph(List<String> params) {
        for (String param : params) {
            this.params.add(new Symbol(param));
        }
        this.entry = newBlock(0).getId();
    }

    private ControlFlowGraph(ControlFlowGraph other) {
        for (Symbol param : other.params) {
            params.add(param.copy());
        }
        this.entry = other.entry;
        this.nextId = other.nextId;
        for (BasicBlock block : other.blocks.values()) {
            blocks.put(block.getId(), block.copy(this));
        }
        for (Map.Entry<Integer, List<Integer>> e : other.succs.entrySet()) {
            succs.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        for (Map.Entry<Integer, Set<Integer>> e : other.preds.entrySet()) {
            preds.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
        }
        if (other.metaState.isValid(MetadataState.SSA_FORM)) {
            metaState.validate(MetadataState.SSA_FORM);
        }
    }

    /**
     * Create a new, unterminated block in this graph.
     *
     * @param depth The structural nesting depth of the block.
     * @return The block.
     */
    public BasicBlock newBlock(int depth) {
        BasicBlock block = new BasicBlock(this, nextId++, depth);
        blocks.put(block.getId(), block);
        succs.put(block.getId(), new ArrayList<>());
        preds.put(block.getId(), new LinkedHashSet<>());
        return block;
    }

    /**
     * Get a block by identifier.
     *
     * @param id The identifier.
     * @return The block.
     * @throws NoSuchElementException If there is no such block.
     */
    public BasicBlock get(int id) {
        BasicBlock block = blocks.get(id);
        if (block == null) throw new NoSuchElementException("no block %" + id);
        return block;
    }

    public boolean contains(int id) {
        return blocks.containsKey(id);
    }

    public int getEntryId() {
        return entry;
    }

    public BasicBlock getEntry() {
        return get(entry);
    }

    /**
     * Get the parameters of the function, defined on entry before the entry block's statements.
     * SSA conversion renames them in place.
     *
     * @return The parameters.
     */
    public List<Symbol> getParams() {
        return Collections.unmodifiableList(params);
    }

    /**
     * Get all blocks, in identifier order.
     *
     * @return The blocks.
     */
    public Collection<BasicBlock> getBlocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public int size() {
        return blocks.size();
    }

    /**
     * Get the successors of a block, in terminator target order, without duplicates.
     *
     * @param id The block identifier.
     * @return The successors.
     */
    public List<Integer> successors(int id) {
        get(id);
        return Collections.unmodifiableList(succs.get(id));
    }

    /**
     * Get the predecessors of a block, in the order their edges were added.
     *
     * @param id The block identifier.
     * @return The predecessors.
     */
    public List<Integer> predecessors(int id) {
        get(id);
        return Collections.unmodifiableList(new ArrayList<>(preds.get(id)));
    }

    /**
     * Install the terminator of a block, replacing its outgoing edges with the terminator's targets.
     *
     * @param id         The block identifier.
     * @param terminator The terminator.
     */
    public void setTerminator(int id, Terminator terminator) {
        BasicBlock block = get(id);
        for (int target : terminator.targets()) {
            if (!blocks.containsKey(target)) {
                throw new IllegalArgumentException("terminator of %" + id + " targets missing block %" + target);
            }
        }
        for (int oldSucc : succs.get(id)) {
            preds.get(oldSucc).remove(id);
        }
        List<Integer> newSuccs = new ArrayList<>(new LinkedHashSet<>(terminator.targets()));
        succs.put(id, newSuccs);
        for (int succ : newSuccs) {
            preds.get(succ).add(id);
        }
        block.setTerminator(terminator);
        metaState.graphChanged();
    }

    /**
     * Remove every block not in {@code keep}, along with its edges and the phi inputs flowing from it.
     *
     * @param keep The identifiers of the blocks to keep. Must include the entry.
     * @return The number of blocks removed.
     */
    public int retainBlocks(Set<Integer> keep) {
        if (!keep.contains(entry)) throw new IllegalArgumentException("cannot remove the entry block");
        List<Integer> removed = new ArrayList<>();
        for (Integer id : blocks.keySet()) {
            if (!keep.contains(id)) removed.add(id);
        }
        for (int id : removed) {
            for (int succ : succs.remove(id)) {
                Set<Integer> succPreds = preds.get(succ);
                if (succPreds != null) succPreds.remove(id);
                BasicBlock succBlock = blocks.get(succ);
                if (succBlock != null) {
                    for (Phi phi : succBlock.getPhis()) {
                        phi.removeIncoming(id);
                    }
                }
            }
            preds.remove(id);
            blocks.remove(id);
        }
        if (!removed.isEmpty()) metaState.graphChanged();
        return removed.size();
    }

    /**
     * Deep-copy this graph: blocks, statements, phis, terminators and edges.
     * <p>
     * Derived facts other than SSA-ness are not copied, and are recomputed when needed.
     *
     * @return The copy.
     */
    public ControlFlowGraph copy() {
        return new ControlFlowGraph(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("function(");
        for (int i = 0; i < params.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(params.get(i));
        }
        sb.append(") {\n");
        for (BasicBlock block : blocks.values()) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    void varsChanged() {
        metaState.varsChanged();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            throw new UnsupportedOperationException("the metadata state of a graph cannot be removed");
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
