package io.github.eutro.flowssa.test;

import io.github.eutro.flowssa.core.FlowSsa;
import io.github.eutro.flowssa.core.UnresolvedNameException;
import io.github.eutro.flowssa.core.ast.*;
import io.github.eutro.flowssa.core.cfg.BasicBlock;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.cfg.Phi;
import io.github.eutro.flowssa.core.ext.CommonExts;
import io.github.eutro.flowssa.core.ext.MetadataState;
import io.github.eutro.flowssa.core.passes.form.SSAify;
import io.github.eutro.flowssa.core.passes.meta.ComputeLiveVars;
import io.github.eutro.flowssa.core.passes.meta.VerifyIntegrity;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.flowssa.test.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class SSAifyTest {
    static final Function NESTED = function(new String[]{"n"},
            assign("x", lit(0)),
            assign("i", lit(0)),
            while_(call("<", sym("i"), sym("n")), brace(
                    assign("j", lit(0)),
                    while_(call("<", sym("j"), sym("i")), brace(
                            if_(call("==", sym("j"), lit(3)),
                                    break_()),
                            if_(call(">", sym("x"), lit(100)),
                                    return_(sym("x"))),
                            assign("x", call("+", sym("x"), sym("j"))),
                            assign("j", call("+", sym("j"), lit(1))))),
                    assign("i", call("+", sym("i"), lit(1))))),
            for_("k", sym("n"), brace(
                    if_(call("==", sym("k"), lit(2)), next()),
                    assign("x", call("*", sym("x"), sym("k"))))),
            return_(sym("x")));

    static ControlFlowGraph ssa(Function function) {
        return FlowSsa.toSsa(FlowSsa.buildCfg(function), true);
    }

    static List<Symbol> definitions(ControlFlowGraph cfg) {
        List<Symbol> defs = new ArrayList<>(cfg.getParams());
        for (BasicBlock block : cfg.getBlocks()) {
            for (Phi phi : block.getPhis()) {
                defs.add(phi.getWrite());
            }
            for (AstNode statement : block.getBody()) {
                if (statement.kind() == Kind.ASSIGN) defs.add(((Assign) statement).getWrite());
            }
        }
        return defs;
    }

    @Test
    void testSingleDefinition() {
        ControlFlowGraph cfg = ssa(NESTED);
        Set<String> seen = new HashSet<>();
        for (Symbol def : definitions(cfg)) {
            assertNotNull(def.getSequence(), def.getBase());
            assertTrue(seen.add(def.getName()), def.getName() + " defined twice");
        }
        VerifyIntegrity.INSTANCE.run(cfg);
    }

    @Test
    void testPhiCompleteness() {
        ControlFlowGraph cfg = FlowSsa.buildCfg(NESTED);
        ComputeLiveVars.INSTANCE.run(cfg);
        Map<Integer, Set<String>> liveIn = new HashMap<>();
        for (BasicBlock block : cfg.getBlocks()) {
            liveIn.put(block.getId(), new HashSet<>(block.getExtOrThrow(CommonExts.LIVE_DATA).liveIn));
        }

        FlowSsa.toSsa(cfg, true);
        int phis = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            List<Integer> preds = cfg.predecessors(block.getId());
            if (preds.size() < 2) {
                assertTrue(block.getPhis().isEmpty(), "phi in a block without a join: " + block);
                continue;
            }
            for (Phi phi : block.getPhis()) {
                phis++;
                assertTrue(liveIn.get(block.getId()).contains(phi.getBase()), "dead phi " + phi);
                assertEquals(new TreeSet<>(preds), phi.getIncoming().keySet());
            }
        }
        assertTrue(phis > 0);
    }

    @Test
    void testParametersDefinedOnEntry() {
        ControlFlowGraph cfg = ssa(function(new String[]{"a"},
                assign("b", sym("a")),
                if_(sym("b"), assign("a", lit(1))),
                return_(sym("a"))));
        assertEquals("a#1", cfg.getParams().get(0).getName());
        Assign first = (Assign) cfg.getEntry().getBody().get(0);
        assertEquals("a#1", ((Symbol) first.getRead()).getName());
        VerifyIntegrity.INSTANCE.run(cfg);
    }

    @Test
    void testDefinitionInsideBlockBeforeRead() {
        // both arms assign x before the read after the if
        ControlFlowGraph cfg = ssa(function(new String[]{"c"},
                brace(
                        if_(sym("c"),
                                brace(assign("x", lit(1))),
                                brace(assign("x", lit(2)))),
                        assign("y", sym("x")))));
        BasicBlock merge = cfg.get(3);
        Phi phi = merge.getPhi("x");
        assertNotNull(phi);
        assertEquals(new TreeSet<>(Arrays.asList(1, 2)), phi.getIncoming().keySet());
        assertEquals("x#1", phi.getIncoming().get(1).getName());
        assertEquals("x#2", phi.getIncoming().get(2).getName());
        Assign y = (Assign) merge.getBody().get(0);
        assertEquals(phi.getWrite().getName(), ((Symbol) y.getRead()).getName());
    }

    @Test
    void testReadBeforeWriteInBlockIsGlobal() {
        ControlFlowGraph cfg = ssa(function(new String[]{"c"},
                assign("x", lit(1)),
                while_(sym("c"), brace(
                        assign("y", sym("x")),
                        assign("x", call("+", sym("y"), lit(1))))),
                return_(sym("x"))));
        BasicBlock header = cfg.get(1);
        Phi phi = header.getPhi("x");
        assertNotNull(phi);
        assertEquals("x#2", phi.getWrite().getName());
        assertEquals("x#1", phi.getIncoming().get(0).getName());
        assertEquals("x#3", phi.getIncoming().get(2).getName());
        assertNull(header.getPhi("y"), "y is not live into the header");
    }

    @Test
    void testNoPhiForDeadVariable() {
        ControlFlowGraph cfg = ssa(function(new String[]{"c"},
                if_(sym("c"), assign("x", lit(1)), assign("x", lit(2))),
                return_(lit(0))));
        for (BasicBlock block : cfg.getBlocks()) {
            assertTrue(block.getPhis().isEmpty());
        }
    }

    @Test
    void testUnresolvedName() {
        UnresolvedNameException e = assertThrows(UnresolvedNameException.class,
                () -> ssa(function(assign("y", sym("z")))));
        assertEquals("z", e.getName());
        assertEquals(0, e.getBlock());
    }

    @Test
    void testConditionallyUndefined() {
        // x is only defined on one path to the read
        assertThrows(UnresolvedNameException.class, () -> ssa(function(new String[]{"c"},
                if_(sym("c"), assign("x", lit(1))),
                return_(sym("x")))));
    }

    @Test
    void testFailedConversionLeavesOriginal() {
        ControlFlowGraph cfg = FlowSsa.buildCfg(function(
                assign("x", lit(1)),
                assign("y", sym("z"))));
        String before = cfg.toString();
        assertThrows(UnresolvedNameException.class, () -> FlowSsa.toSsa(cfg, false));
        assertEquals(before, cfg.toString());
        assertFalse(cfg.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.SSA_FORM));
    }

    @Test
    void testAlreadySsa() {
        ControlFlowGraph cfg = ssa(function(assign("x", lit(1))));
        assertThrows(IllegalStateException.class, () -> SSAify.INSTANCE.run(cfg));
        assertThrows(IllegalStateException.class, () -> FlowSsa.toSsa(cfg.copy(), true));
    }

    @Test
    void testInPlace() {
        ControlFlowGraph cfg = FlowSsa.buildCfg(NESTED);
        String before = cfg.toString();
        ControlFlowGraph copy = FlowSsa.toSsa(cfg, false);
        assertNotSame(cfg, copy);
        assertEquals(before, cfg.toString());
        ControlFlowGraph same = FlowSsa.toSsa(cfg, true);
        assertSame(cfg, same);
        assertEquals(copy.toString(), same.toString());
    }

    @Test
    void testCopyStability() {
        ControlFlowGraph cfg = FlowSsa.buildCfg(NESTED);
        ControlFlowGraph first = FlowSsa.toSsa(cfg.copy(), true);
        ControlFlowGraph second = FlowSsa.toSsa(cfg.copy(), true);
        assertEquals(first.size(), second.size());
        assertEquals(first.toString(), second.toString());
        assertEquals(FlowSsa.dominatorTree(first), FlowSsa.dominatorTree(second));
        assertEquals(FlowSsa.dominatorTree(cfg), FlowSsa.dominatorTree(first));
        assertEquals(FlowSsa.propagateConstants(first), FlowSsa.propagateConstants(second));
    }

    @Test
    void testAppendInvalidatesLiveness() {
        ControlFlowGraph cfg = FlowSsa.buildCfg(function(new String[]{"c"},
                if_(sym("c"), assign("x", lit(1)), assign("x", lit(2))),
                return_(lit(0))));
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.LIVE_DATA);
        BasicBlock merge = cfg.get(3);
        assertFalse(merge.getExtOrThrow(CommonExts.LIVE_DATA).liveIn.contains("x"));

        merge.append(new Call("print", new Symbol("x")));
        assertFalse(ms.isValid(MetadataState.LIVE_DATA));
        assertThrows(UnsupportedOperationException.class, () -> merge.getBody().add(new Symbol("x")));
        assertThrows(UnsupportedOperationException.class, () -> merge.getPhis().add(new Phi("x")));

        FlowSsa.toSsa(cfg, true);
        Phi phi = merge.getPhi("x");
        assertNotNull(phi);
        Call print = (Call) merge.getBody().get(0);
        assertEquals(phi.getWrite().getName(), print.getArgs().get(0).toString());
    }

    @Test
    void testVerifyFlag() {
        boolean old = SSAify.VERIFY;
        SSAify.VERIFY = true;
        try {
            assertDoesNotThrow(() -> ssa(NESTED));
        } finally {
            SSAify.VERIFY = old;
        }
    }

    @Test
    void testVerifyCatchesBrokenPhi() {
        ControlFlowGraph cfg = ssa(function(new String[]{"c"},
                if_(sym("c"), assign("x", lit(1)), assign("x", lit(2))),
                return_(sym("x"))));
        Phi phi = Objects.requireNonNull(cfg.get(3).getPhi("x"));
        phi.setIncoming(0, new Symbol("x", 1));
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.run(cfg));
    }
}
