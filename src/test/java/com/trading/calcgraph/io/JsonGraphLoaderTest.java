package com.trading.calcgraph.io;

import com.trading.calcgraph.api.NodeId;
import com.trading.calcgraph.api.UnknownNodeException;
import com.trading.calcgraph.engine.CalcGraph;
import com.trading.calcgraph.node.CalcNode;
import com.trading.calcgraph.node.ConstantNode;
import com.trading.calcgraph.node.VariableNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class JsonGraphLoaderTest {

    private static final String JSON = "{\n"
            + "  \"graph\": {\n"
            + "    \"name\": \"rates\",\n"
            + "    \"version\": \"2\",\n"
            + "    \"nodes\": [\n"
            + "      { \"name\": \"notional\", \"type\": \"constant\", \"value\": 1000000 },\n"
            + "      { \"name\": \"rate\", \"type\": \"VARIABLE\", \"value\": 0.05, \"description\": \"annual\" },\n"
            + "      { \"name\": \"currency\", \"type\": \"variable\", \"value\": \"USD\" }\n"
            + "    ],\n"
            + "    \"overrides\": [ { \"name\": \"rate\", \"value\": 0.07 } ]\n"
            + "  },\n"
            + "  \"comment\": \"ignored\"\n"
            + "}";

    private JsonGraphLoader loader;

    @Before
    public void setUp() {
        loader = new JsonGraphLoader();
    }

    @Test
    public void testCompile() throws IOException {
        GraphDefinition def = loader.parse(JSON);
        assertEquals("rates", def.getGraph().getName());
        assertEquals(3, def.getGraph().getNodes().size());

        CalcGraph graph = loader.compile(def);
        assertEquals("rates", graph.name());
        assertTrue(graph.node("notional") instanceof ConstantNode);
        assertTrue(graph.node("rate") instanceof VariableNode);

        Object notional = graph.evaluate("notional");
        assertEquals(Integer.valueOf(1000000), notional);
        assertEquals("USD", graph.evaluate("currency"));

        assertTrue(graph.isOverridden("rate"));
        assertEquals(0.07, graph.<Double>evaluate("rate"), 0.0);
        graph.removeOverride("rate");
        assertEquals(0.05, graph.<Double>evaluate("rate"), 0.0);
    }

    @Test
    public void testApplyToExistingGraphWithParameterizedOverride() throws IOException {
        CalcGraph graph = new CalcGraph("discounting");
        graph.register(CalcNode.<Integer, Double>of("discount factor",
                (g, years) -> Math.pow(1 + g.<Double>evaluate("rate"), -years)));

        loader.applyTo(graph, loader.parse("{ \"graph\": {"
                + "\"nodes\": [ { \"name\": \"rate\", \"type\": \"variable\", \"value\": 0.0 } ],"
                + "\"overrides\": [ { \"name\": \"discount factor\", \"args\": [ 2 ], \"value\": 0.5 } ] } }"));

        assertEquals(1.0, graph.<Double>evaluate("discount factor", 1), 1e-12);
        assertEquals(0.5, graph.<Double>evaluate("discount factor", 2), 0.0);
        assertTrue(graph.isOverridden("discount factor", 2));
        assertEquals(0.5, graph.overrideValue(NodeId.of("discount factor", 2)));
    }

    @Test
    public void testParseFile() throws IOException {
        Path file = Files.createTempFile("graph", ".json");
        try {
            Files.writeString(file, JSON);
            assertEquals("2", loader.parseFile(file).getGraph().getVersion());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void testParseResource() throws IOException {
        GraphDefinition def = loader.parseResource("black_scholes.json");
        List<GraphDefinition.NodeDef> nodes = def.getGraph().getNodes();
        assertEquals(6, nodes.size());
        assertEquals("vol", nodes.get(0).getName());
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        loader.parseResource("no_such_graph.json");
    }

    @Test(expected = IOException.class)
    public void testMalformedJson() throws IOException {
        loader.parse("{ \"graph\": ");
    }

    @Test
    public void testMissingGraphKey() throws IOException {
        try {
            loader.parse("{ \"nodes\": [] }");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Missing 'graph' key", e.getMessage());
        }
    }

    @Test
    public void testUnknownNodeType() throws IOException {
        GraphDefinition def = loader.parse(
                "{ \"graph\": { \"nodes\": [ { \"name\": \"x\", \"type\": \"calculated\", \"value\": 1 } ] } }");
        try {
            loader.compile(def);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Unknown NodeType: calculated", e.getMessage());
        }
    }

    @Test(expected = UnknownNodeException.class)
    public void testOverrideOfUndefinedNode() throws IOException {
        loader.compile(loader.parse("{ \"graph\": { \"overrides\": [ { \"name\": \"ghost\", \"value\": 1 } ] } }"));
    }
}
