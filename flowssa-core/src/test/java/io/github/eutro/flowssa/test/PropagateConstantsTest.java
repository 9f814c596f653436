package io.github.eutro.flowssa.test;

import io.github.eutro.flowssa.core.FlowSsa;
import io.github.eutro.flowssa.core.ast.Function;
import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;
import io.github.eutro.flowssa.core.passes.IRPass;
import io.github.eutro.flowssa.core.passes.Passes;
import io.github.eutro.flowssa.core.passes.meta.LatticeValue;
import io.github.eutro.flowssa.core.passes.meta.PropagateConstants;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.flowssa.test.Ast.*;
import static io.github.eutro.flowssa.test.ScenarioTest.NC;
import static io.github.eutro.flowssa.test.ScenarioTest.analyse;
import static io.github.eutro.flowssa.test.ScenarioTest.k;
import static org.junit.jupiter.api.Assertions.*;

public class PropagateConstantsTest {
    @Test
    void testIntegerOverflow() {
        Map<String, LatticeValue> values = analyse(function(
                assign("x", lit(Integer.MAX_VALUE)),
                assign("y", call("+", sym("x"), lit(1))),
                assign("z", call("-", call("-", lit(Integer.MAX_VALUE)), lit(1)))), true);
        assertEquals(k(Integer.MAX_VALUE), values.get("x#1"));
        assertEquals(NC, values.get("y#1"));
        assertEquals(NC, values.get("z#1"));
    }

    @Test
    void testIntegerArithmetic() {
        Map<String, LatticeValue> values = analyse(function(
                assign("a", call("%%", call("-", lit(5)), lit(3))),
                assign("b", call("%/%", lit(7), lit(0))),
                assign("c", call("+", lit(true), lit(true))),
                assign("d", call("/", lit(1), lit(2))),
                assign("e", call("%/%", call("-", lit(7)), lit(2)))), true);
        assertEquals(k(1), values.get("a#1"));
        assertEquals(NC, values.get("b#1"));
        assertEquals(k(2), values.get("c#1"));
        assertEquals(k(0.5), values.get("d#1"));
        assertEquals(k(-4), values.get("e#1"));
    }

    @Test
    void testStrings() {
        Map<String, LatticeValue> values = analyse(function(
                assign("s", lit("a")),
                assign("eq", call("==", sym("s"), lit("a"))),
                assign("lt", call("<", sym("s"), lit("b"))),
                assign("sum", call("+", sym("s"), lit(1)))), true);
        assertEquals(k("a"), values.get("s#1"));
        assertEquals(k(true), values.get("eq#1"));
        assertEquals(NC, values.get("lt#1"));
        assertEquals(NC, values.get("sum#1"));
    }

    @Test
    void testParametersNotConstant() {
        Map<String, LatticeValue> values = analyse(function(new String[]{"p", "q"},
                assign("x", call("+", sym("p"), lit(1))),
                assign("y", call("*", sym("q"), lit(0)))), true);
        assertEquals(NC, values.get("p#1"));
        assertEquals(NC, values.get("q#1"));
        assertEquals(NC, values.get("x#1"));
        assertEquals(NC, values.get("y#1"));
    }

    @Test
    void testUnfoldableCall() {
        Map<String, LatticeValue> values = analyse(function(
                assign("x", call("length", lit(1.0))),
                assign("y", call("+", lit(1.0), lit(2.0), lit(3.0)))), true);
        assertEquals(NC, values.get("x#1"));
        assertEquals(NC, values.get("y#1"));
    }

    @Test
    void testLoopNeverEntered() {
        Function f = function(
                assign("x", lit(1.0)),
                while_(lit(false), assign("x", lit(2.0))),
                assign("y", sym("x")));
        Map<String, LatticeValue> conditional = analyse(f, true);
        assertEquals(k(1.0), conditional.get("x#2"));
        assertEquals(k(2.0), conditional.get("x#3"));
        assertEquals(k(1.0), conditional.get("y#1"));

        Map<String, LatticeValue> plain = analyse(f, false);
        assertEquals(NC, plain.get("x#2"));
        assertEquals(k(2.0), plain.get("x#3"));
        assertEquals(NC, plain.get("y#1"));
    }

    @Test
    void testLoopInvariant() {
        // x is reassigned its own value, so it stays constant around the loop
        Map<String, LatticeValue> values = analyse(function(
                assign("x", lit(3.0)),
                assign("i", lit(0.0)),
                while_(call("<", sym("i"), lit(10.0)), brace(
                        assign("x", call("+", call("*", sym("x"), lit(1.0)), lit(0.0))),
                        assign("i", call("+", sym("i"), lit(1.0))))),
                assign("y", sym("x"))), true);
        assertEquals(k(3.0), values.get("y#1"));
        assertEquals(NC, values.get("i#2"));
    }

    @Test
    void testNonLogicalCondition() {
        Map<String, LatticeValue> values = analyse(function(
                if_(lit("yes"), assign("x", lit(1.0)), assign("x", lit(2.0))),
                assign("y", sym("x"))), true);
        assertEquals(NC, values.get("y#1"));
    }

    @Test
    void testNumericCondition() {
        Map<String, LatticeValue> values = analyse(function(
                if_(call("-", lit(2), lit(2)), assign("x", lit(1.0)), assign("x", lit(2.0))),
                assign("y", sym("x"))), true);
        assertEquals(k(2.0), values.get("y#1"));
    }

    @Test
    void testNegativeZeroCondition() {
        Map<String, LatticeValue> values = analyse(function(
                assign("z", lit(-0.0)),
                if_(call("<", sym("z"), lit(0.0)), assign("x", lit(1.0)), assign("x", lit(2.0))),
                assign("y", sym("x"))), true);
        assertEquals(k(2.0), values.get("y#1"));
    }

    @Test
    void testEarlyReturn() {
        Map<String, LatticeValue> values = analyse(function(
                assign("x", lit(1.0)),
                if_(call("==", sym("x"), lit(1.0)),
                        return_(sym("x"))),
                assign("x", lit(2.0)),
                assign("y", sym("x"))), true);
        assertEquals(k(1.0), values.get("x#1"));
        assertEquals(k(2.0), values.get("x#2"));
        assertEquals(k(2.0), values.get("y#1"));
    }

    @Test
    void testNeverUnknown() {
        Map<String, LatticeValue> values = analyse(SSAifyTest.NESTED, true);
        assertFalse(values.isEmpty());
        for (LatticeValue value : values.values()) {
            assertFalse(value.isUnknown());
        }
    }

    @Test
    void testMonotonic() {
        List<String> transitions = new ArrayList<>();
        Map<String, Integer> counts = new HashMap<>();
        PropagateConstants pass = PropagateConstants.builder()
                .setListener((name, from, to) -> {
                    assertNotEquals(from, to);
                    assertTrue(from.isBelowOrEqual(to), name + ": " + from + " -> " + to);
                    assertFalse(to.isUnknown());
                    transitions.add(name);
                    counts.merge(name, 1, Integer::sum);
                })
                .build();
        ControlFlowGraph ssa = FlowSsa.toSsa(FlowSsa.buildCfg(SSAifyTest.NESTED), true);
        Map<String, LatticeValue> values = pass.run(ssa);
        assertFalse(transitions.isEmpty());
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            assertTrue(entry.getValue() <= 2, entry.getKey() + " changed " + entry.getValue() + " times");
            assertTrue(values.containsKey(entry.getKey()));
        }
    }

    @Test
    void testRequiresSsa() {
        ControlFlowGraph cfg = FlowSsa.buildCfg(function(assign("x", lit(1.0))));
        assertThrows(IllegalStateException.class, () -> PropagateConstants.INSTANCE.run(cfg));
    }

    @Test
    void testPipeline() {
        Function f = function(assign("x", lit(1.0)), assign("y", call("+", sym("x"), lit(1.0))));
        ControlFlowGraph ssa = Passes.FUNCTION_TO_SSA.run(f.copy());
        assertEquals(FlowSsa.propagateConstants(ssa), Passes.ANALYSE_CONSTANTS.run(f.copy()));
        Map<String, LatticeValue> values = Passes.ANALYSE_CONSTANTS.run(f);
        assertEquals(k(1.0), values.get("x#1"));
        assertEquals(k(2.0), values.get("y#1"));
    }

    @Test
    void testChainReportsFailingPass() {
        IRPass<ControlFlowGraph, Object> failing = cfg -> {
            throw new IllegalStateException("analysis failed");
        };
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> Passes.FUNCTION_TO_SSA.then(failing).run(function(assign("x", lit(1.0)))));
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("running pass 3 in chain"));
    }

    @Test
    void testLattice() {
        LatticeValue one = k(1.0);
        assertEquals(one, LatticeValue.UNKNOWN.meet(one));
        assertEquals(one, one.meet(LatticeValue.UNKNOWN));
        assertEquals(one, one.meet(k(1.0)));
        assertEquals(NC, one.meet(k(2.0)));
        assertEquals(NC, one.meet(k(1)));
        assertEquals(NC, NC.meet(LatticeValue.UNKNOWN));
        assertTrue(LatticeValue.UNKNOWN.isBelowOrEqual(one));
        assertTrue(one.isBelowOrEqual(NC));
        assertFalse(NC.isBelowOrEqual(one));
        assertFalse(one.isBelowOrEqual(k(2.0)));
        assertThrows(java.util.NoSuchElementException.class, NC::getValue);
        assertNull(LatticeValue.constant(null).getValue());
        assertEquals(LatticeValue.State.CONSTANT, one.getState());
        assertEquals("Constant(1.0)", one.toString());
        assertEquals("Constant(2L)", k(2).toString());
    }
}
