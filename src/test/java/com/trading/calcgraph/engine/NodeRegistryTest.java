package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.DuplicateNodeException;
import com.trading.calcgraph.api.UnknownNodeException;
import com.trading.calcgraph.node.ConstantNode;
import com.trading.calcgraph.node.VariableNode;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class NodeRegistryTest {

    @Test
    public void testRegisterAndLookup() {
        NodeRegistry registry = new NodeRegistry();
        ConstantNode<Double> rate = new ConstantNode<>("rate", 0.02);
        registry.register(rate);
        registry.register(new VariableNode<>("spot", 100.0));

        assertSame(rate, registry.lookup("rate"));
        assertTrue(registry.contains("spot"));
        assertFalse(registry.contains("vol"));
        assertEquals(2, registry.size());
        assertEquals(List.of("rate", "spot"), List.copyOf(registry.names()));
    }

    @Test
    public void testDuplicateKeepsFirstDefinition() {
        NodeRegistry registry = new NodeRegistry();
        ConstantNode<Double> first = new ConstantNode<>("rate", 0.02);
        registry.register(first);
        try {
            registry.register(new ConstantNode<>("rate", 0.05));
            fail("Expected DuplicateNodeException");
        } catch (DuplicateNodeException e) {
            assertTrue(e.getMessage().contains("rate"));
        }
        assertSame(first, registry.lookup("rate"));
    }

    @Test
    public void testUnknownName() {
        NodeRegistry registry = new NodeRegistry();
        try {
            registry.lookup("vol");
            fail("Expected UnknownNodeException");
        } catch (UnknownNodeException e) {
            assertEquals("vol", e.nodeName());
        }
    }
}
