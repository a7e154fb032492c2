package com.trading.calcgraph.node;

import com.trading.calcgraph.api.CalcContext;
import com.trading.calcgraph.api.NodeArgumentsException;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class NodeTest {

    // Nodes under test here never read other nodes
    private static final CalcContext NO_READS = new CalcContext() {
        @Override
        public <T> T evaluate(String name, Object... args) {
            throw new AssertionError("unexpected read of " + name);
        }
    };

    @Test
    public void testConstantIgnoresArguments() {
        ConstantNode<Double> rate = new ConstantNode<>("rate", 0.02);
        assertEquals(0.02, rate.compute(NO_READS, List.of()), 0.0);
        assertEquals(0.02, rate.compute(NO_READS, List.of(1, "x")), 0.0);
    }

    @Test
    public void testVariableUpdate() {
        VariableNode<String> type = new VariableNode<>("option type", "call");
        assertEquals("call", type.compute(NO_READS, List.of()));

        type.update("put");
        assertEquals("put", type.value());
        assertEquals("put", type.compute(NO_READS, List.of()));
    }

    @Test
    public void testVariableRejectsArguments() {
        VariableNode<String> type = new VariableNode<>("option type", "call");
        try {
            type.compute(NO_READS, List.of(1));
            fail("Expected NodeArgumentsException");
        } catch (NodeArgumentsException e) {
            assertTrue(e.getMessage().contains("option type"));
        }
    }

    @Test
    public void testFixedArityBodies() {
        CalcNode<Integer> add = CalcNode.<Integer, Integer, Integer>of("add", (g, a, b) -> a + b);
        CalcNode<String> join = CalcNode.<String, String, String, String>of("join",
                (g, a, b, c) -> a + b + c);

        assertEquals(Integer.valueOf(5), add.compute(NO_READS, List.of(2, 3)));
        assertEquals("xyz", join.compute(NO_READS, List.of("x", "y", "z")));
    }

    @Test
    public void testArityMismatch() {
        CalcNode<Integer> square = CalcNode.<Integer, Integer>of("square", (g, n) -> n * n);
        assertEquals(Integer.valueOf(16), square.compute(NO_READS, List.of(4)));

        try {
            square.compute(NO_READS, List.of());
            fail("Expected NodeArgumentsException");
        } catch (NodeArgumentsException e) {
            assertEquals("Node square takes 1 argument(s), got 0: []", e.getMessage());
        }
        try {
            square.compute(NO_READS, List.of(1, 2));
            fail("Expected NodeArgumentsException");
        } catch (NodeArgumentsException e) {
            assertTrue(e.getMessage().contains("got 2"));
        }
    }

    @Test(expected = NodeArgumentsException.class)
    public void testUnparameterizedBodyRejectsArguments() {
        CalcNode.<Integer>of("answer", g -> 42).compute(NO_READS, List.of(1));
    }

    @Test
    public void testVariadicBodySeesRawTuple() {
        CalcNode<Integer> count = new CalcNode<>("count", (g, args) -> args.size());
        assertEquals(Integer.valueOf(0), count.compute(NO_READS, List.of()));
        assertEquals(Integer.valueOf(3), count.compute(NO_READS, List.of(1, 2, 3)));
    }
}
