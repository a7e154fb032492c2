package com.trading.calcgraph.dsl;

import com.trading.calcgraph.api.DuplicateNodeException;
import com.trading.calcgraph.api.UnknownNodeException;
import com.trading.calcgraph.engine.CalcGraph;
import com.trading.calcgraph.node.VariableNode;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class GraphBuilderTest {

    @Test
    public void testBuildsWorkingGraph() {
        GraphBuilder b = GraphBuilder.create("builder");
        b.constant("spot", 100.0);
        VariableNode<Double> strike = b.variable("strike", 105.0);
        b.<Double>compute("moneyness", c -> c.<Double>evaluate("spot") / c.<Double>evaluate("strike"));
        b.<Integer, Double>compute("scaled", (c, n) -> n * c.<Double>evaluate("moneyness"));
        b.<Double, Double, Double>compute("sum2", (c, x, y) -> x + y);
        b.<Double, Double, Double, Double>compute("sum3", (c, x, y, z) -> x + y + z);
        b.computeN("argc", (c, args) -> args.size());

        assertSame(strike, b.getNode("strike"));

        CalcGraph graph = b.build();
        assertEquals("builder", graph.name());
        assertEquals(List.of("spot", "strike", "moneyness", "scaled", "sum2", "sum3", "argc"),
                List.copyOf(graph.nodeNames()));

        assertEquals(100.0 / 105.0, graph.<Double>evaluate("moneyness"), 1e-12);
        assertEquals(2 * 100.0 / 105.0, graph.<Double>evaluate("scaled", 2), 1e-12);
        assertEquals(3.0, graph.<Double>evaluate("sum2", 1.0, 2.0), 0.0);
        assertEquals(6.0, graph.<Double>evaluate("sum3", 1.0, 2.0, 3.0), 0.0);
        assertEquals(2, graph.<Integer>evaluate("argc", "a", "b").intValue());

        graph.setValue("strike", 100.0);
        assertEquals(1.0, graph.<Double>evaluate("moneyness"), 1e-12);
    }

    @Test
    public void testOverridesAppliedOnBuild() {
        GraphBuilder b = GraphBuilder.create("scenario");
        b.constant("vol", 0.1);
        b.<Integer, Integer>compute("square", (c, n) -> n * n);
        b.override("vol", 0.3);
        b.override("square", List.of(3), 100);

        CalcGraph graph = b.build();
        assertTrue(graph.isOverridden("vol"));
        assertEquals(0.3, graph.<Double>evaluate("vol"), 0.0);
        assertEquals(100, graph.<Integer>evaluate("square", 3).intValue());
        assertEquals(4, graph.<Integer>evaluate("square", 2).intValue());

        graph.removeOverride("vol");
        assertEquals(0.1, graph.<Double>evaluate("vol"), 0.0);
    }

    @Test
    public void testRejectedOverrideLeavesBuilderOpen() {
        GraphBuilder b = GraphBuilder.create("retry");
        b.constant("spot", 100.0);
        b.override("fwd", 101.0);
        try {
            b.build();
            fail("Expected UnknownNodeException");
        } catch (UnknownNodeException e) {
            assertEquals("fwd", e.nodeName());
        }

        b.<Double>compute("fwd", c -> c.<Double>evaluate("spot") * 1.01);
        CalcGraph graph = b.build();
        assertTrue(graph.isOverridden("fwd"));
        assertEquals(101.0, graph.<Double>evaluate("fwd"), 0.0);
    }

    @Test(expected = DuplicateNodeException.class)
    public void testDuplicateName() {
        GraphBuilder b = GraphBuilder.create("dup");
        b.constant("spot", 100.0);
        b.variable("spot", 101.0);
    }

    @Test(expected = IllegalStateException.class)
    public void testBuildTwice() {
        GraphBuilder b = GraphBuilder.create("twice");
        b.constant("spot", 100.0);
        b.build();
        b.build();
    }

    @Test(expected = IllegalStateException.class)
    public void testDefineAfterBuild() {
        GraphBuilder b = GraphBuilder.create("late");
        b.build();
        b.constant("spot", 100.0);
    }
}
