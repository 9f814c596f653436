package io.github.eutro.flowssa.test;

import io.github.eutro.flowssa.core.ast.Literal;
import io.github.eutro.flowssa.core.ast.Symbol;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.Terminator;

import java.util.*;

/**
 * Hand-built graphs, and brute-force facts about them.
 */
public class Graphs {
    /**
     * Build a graph with the given successors for each block, block 0 being the entry.
     */
    public static ControlFlowGraph fromEdges(int[][] succs) {
        ControlFlowGraph cfg = new ControlFlowGraph(Collections.emptyList());
        for (int i = 1; i < succs.length; i++) {
            cfg.newBlock(0);
        }
        for (int i = 0; i < succs.length; i++) {
            int[] ss = succs[i];
            Terminator terminator;
            switch (ss.length) {
                case 0:
                    terminator = new Terminator.Return(Literal.ofNull());
                    break;
                case 1:
                    terminator = new Terminator.Jump(ss[0]);
                    break;
                case 2:
                    terminator = new Terminator.Branch(new Symbol("c"), ss[0], ss[1]);
                    break;
                default:
                    throw new IllegalArgumentException();
            }
            cfg.setTerminator(i, terminator);
        }
        return cfg;
    }

    public static Set<Integer> reachable(ControlFlowGraph cfg, int avoiding) {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        if (cfg.getEntryId() != avoiding) {
            stack.push(cfg.getEntryId());
            seen.add(cfg.getEntryId());
        }
        while (!stack.isEmpty()) {
            for (int succ : cfg.successors(stack.pop())) {
                if (succ != avoiding && seen.add(succ)) stack.push(succ);
            }
        }
        return seen;
    }

    /**
     * The dominators of every reachable block: d dominates n if n cannot be reached without passing d.
     */
    public static Map<Integer, Set<Integer>> bruteDominators(ControlFlowGraph cfg) {
        Set<Integer> reachable = reachable(cfg, -1);
        Map<Integer, Set<Integer>> doms = new TreeMap<>();
        for (int n : reachable) {
            doms.put(n, new TreeSet<>(Collections.singleton(n)));
        }
        for (int d : reachable) {
            Set<Integer> without = reachable(cfg, d);
            for (int n : reachable) {
                if (!without.contains(n)) doms.get(n).add(d);
            }
        }
        return doms;
    }

    /**
     * The dominance frontier of every reachable block, straight from its definition.
     */
    public static Map<Integer, Set<Integer>> bruteFrontier(ControlFlowGraph cfg) {
        Map<Integer, Set<Integer>> doms = bruteDominators(cfg);
        Map<Integer, Set<Integer>> frontier = new TreeMap<>();
        for (int n : doms.keySet()) {
            Set<Integer> df = new TreeSet<>();
            for (int b : doms.keySet()) {
                boolean strictlyDominates = n != b && doms.get(b).contains(n);
                if (strictlyDominates) continue;
                for (int p : cfg.predecessors(b)) {
                    if (doms.containsKey(p) && doms.get(p).contains(n)) {
                        df.add(b);
                        break;
                    }
                }
            }
            frontier.put(n, df);
        }
        return frontier;
    }

    /**
     * Whether the reachable part of the graph is reducible, by T1/T2 reduction to a single node.
     */
    public static boolean isReducible(ControlFlowGraph cfg) {
        Set<Integer> reachable = reachable(cfg, -1);
        Map<Integer, Set<Integer>> succs = new HashMap<>();
        Map<Integer, Set<Integer>> preds = new HashMap<>();
        for (int n : reachable) {
            succs.put(n, new HashSet<>());
            preds.put(n, new HashSet<>());
        }
        for (int n : reachable) {
            for (int s : cfg.successors(n)) {
                succs.get(n).add(s);
                preds.get(s).add(n);
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int n : new ArrayList<>(succs.keySet())) {
                // T1: drop self loops
                if (succs.get(n).remove(n)) {
                    preds.get(n).remove(n);
                    changed = true;
                }
                // T2: fold a block with a single predecessor into it
                if (n != cfg.getEntryId() && preds.get(n).size() == 1) {
                    int p = preds.get(n).iterator().next();
                    for (int s : succs.get(n)) {
                        preds.get(s).remove(n);
                        preds.get(s).add(p);
                        succs.get(p).add(s);
                    }
                    succs.get(p).remove(n);
                    succs.remove(n);
                    preds.remove(n);
                    changed = true;
                }
            }
        }
        return succs.size() == 1;
    }
}
