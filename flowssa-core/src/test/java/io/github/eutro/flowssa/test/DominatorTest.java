package io.github.eutro.flowssa.test;

import io.github.eutro.flowssa.core.FlowSsa;
import io.github.eutro.flowssa.core.IrreducibleGraphException;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.DominanceFrontier;
import io.github.eutro.flowssa.core.cfg.DominatorTree;
import io.github.eutro.flowssa.core.cfg.Terminator;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.passes.meta.ComputeDomFrontier;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.flowssa.test.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class DominatorTest {
    static void checkAgainstBruteForce(ControlFlowGraph cfg) {
        DominatorTree tree = FlowSsa.dominatorTree(cfg);
        Map<Integer, Set<Integer>> expected = Graphs.bruteDominators(cfg);
        assertEquals(expected.keySet(), new TreeSet<>(tree.asMap().keySet()), "reachable blocks");
        for (int n : expected.keySet()) {
            assertEquals(expected.get(n), new TreeSet<>(tree.dominators(n)), "dominators of %" + n);
            for (int d : expected.keySet()) {
                assertEquals(expected.get(n).contains(d), tree.dominates(d, n), d + " dom " + n);
            }
        }

        DominanceFrontier frontier = FlowSsa.dominanceFrontier(cfg, tree);
        Map<Integer, Set<Integer>> expectedFrontier = Graphs.bruteFrontier(cfg);
        for (int n : expectedFrontier.keySet()) {
            assertEquals(expectedFrontier.get(n), frontier.of(n), "frontier of %" + n);
        }
    }

    @Test
    void testDiamond() {
        ControlFlowGraph cfg = Graphs.fromEdges(new int[][]{{1, 2}, {3}, {3}, {}});
        DominatorTree tree = FlowSsa.dominatorTree(cfg);
        assertEquals(0, tree.idom(0));
        assertEquals(0, tree.idom(1));
        assertEquals(0, tree.idom(2));
        assertEquals(0, tree.idom(3));
        assertEquals(Arrays.asList(1, 2, 3), tree.children(0));
        DominanceFrontier df = FlowSsa.dominanceFrontier(cfg, tree);
        assertEquals(Collections.singleton(3), df.of(1));
        assertEquals(Collections.singleton(3), df.of(2));
        assertTrue(df.of(0).isEmpty());
        checkAgainstBruteForce(cfg);
    }

    @Test
    void testLoop() {
        // 0 -> 1 (header) -> 2 (body) -> 1, 1 -> 3 (exit)
        ControlFlowGraph cfg = Graphs.fromEdges(new int[][]{{1}, {2, 3}, {1}, {}});
        DominatorTree tree = FlowSsa.dominatorTree(cfg);
        assertEquals(1, tree.idom(2));
        assertEquals(1, tree.idom(3));
        assertEquals(0, tree.getRoot());
        assertEquals(Arrays.asList(3, 1, 0), tree.dominators(3));
        assertTrue(tree.strictlyDominates(1, 2));
        assertFalse(tree.strictlyDominates(2, 2));
        DominanceFrontier df = FlowSsa.dominanceFrontier(cfg, tree);
        assertEquals(Collections.singleton(1), df.of(1));
        assertEquals(Collections.singleton(1), df.of(2));
        checkAgainstBruteForce(cfg);
    }

    @Test
    void testNestedLoopsWithEarlyExit() {
        ControlFlowGraph cfg = Graphs.fromEdges(new int[][]{
                {1},
                {2, 7}, // outer header
                {3, 6}, // inner header
                {4, 5},
                {7}, // break out of both
                {2},
                {1},
                {},
        });
        checkAgainstBruteForce(cfg);
    }

    @Test
    void testUnreachableBlocksExcluded() {
        ControlFlowGraph cfg = Graphs.fromEdges(new int[][]{{1}, {}, {1}});
        DominatorTree tree = FlowSsa.dominatorTree(cfg);
        assertTrue(tree.contains(1));
        assertFalse(tree.contains(2));
        checkAgainstBruteForce(cfg);
    }

    @Test
    void testIrreducible() {
        // two entries into the 1 <-> 2 cycle
        ControlFlowGraph cfg = Graphs.fromEdges(new int[][]{{1, 2}, {2}, {1}});
        IrreducibleGraphException e = assertThrows(IrreducibleGraphException.class, () -> FlowSsa.dominatorTree(cfg));
        assertTrue(Arrays.asList(1, 2).contains(e.getSource()));
        assertTrue(Arrays.asList(1, 2).contains(e.getTarget()));
    }

    @Test
    void testRandomGraphs() {
        Random random = new Random(0x5EED);
        int checked = 0;
        for (int round = 0; round < 500; round++) {
            int n = 2 + random.nextInt(8);
            int[][] succs = new int[n][];
            for (int i = 0; i < n; i++) {
                int count = random.nextInt(3);
                succs[i] = new int[count];
                for (int j = 0; j < count; j++) {
                    succs[i][j] = 1 + random.nextInt(n - 1);
                }
            }
            ControlFlowGraph cfg = Graphs.fromEdges(succs);
            if (Graphs.isReducible(cfg)) {
                checkAgainstBruteForce(cfg);
                checked++;
            } else {
                assertThrows(IrreducibleGraphException.class, () -> FlowSsa.dominatorTree(cfg),
                        () -> "graph should be irreducible:\n" + cfg);
            }
        }
        assertTrue(checked > 50, "too few reducible graphs: " + checked);
    }

    @Test
    void testBuiltGraphs() {
        checkAgainstBruteForce(FlowSsa.buildCfg(function(
                assign("x", lit(1)),
                while_(sym("c"), brace(
                        if_(sym("d"), break_()),
                        for_("i", sym("xs"), brace(
                                if_(sym("e"), next(), assign("x", sym("i"))))),
                        repeat(brace(if_(sym("f"), break_()))))),
                return_(sym("x")))));
    }

    @Test
    void testMetadataInvalidation() {
        ControlFlowGraph cfg = Graphs.fromEdges(new int[][]{{1, 2}, {3}, {3}, {}});
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ComputeDomFrontier.INSTANCE.run(cfg);
        assertTrue(ms.isValid(MetadataState.DOMS));
        assertTrue(ms.isValid(MetadataState.DOM_FRONTIER));
        assertEquals(Collections.singleton(3), cfg.getExtOrThrow(CommonExts.DOM_FRONTIER).of(1));

        cfg.setTerminator(1, new Terminator.Jump(2));
        assertFalse(ms.isValid(MetadataState.DOMS));
        assertFalse(ms.isValid(MetadataState.DOM_FRONTIER));
        ms.ensureValid(cfg, MetadataState.DOM_FRONTIER);
        assertEquals(Collections.singleton(2), cfg.getExtOrThrow(CommonExts.DOM_FRONTIER).of(1));
    }
}
