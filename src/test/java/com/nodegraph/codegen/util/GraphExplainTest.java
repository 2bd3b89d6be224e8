package com.nodegraph.codegen.util;

import com.nodegraph.codegen.Fixtures;
import com.nodegraph.codegen.engine.ConnectionValidator;
import com.nodegraph.codegen.model.Graph;
import com.nodegraph.codegen.model.PortRef;
import com.nodegraph.codegen.registry.NodeCatalog;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private Graph graph;
    private GraphExplain explain;

    @Before
    public void setUp() {
        NodeCatalog catalog = Fixtures.catalog();
        graph = new Graph();
        graph.addNode(catalog, "flow", "entry", 0, 0);
        graph.addNode(catalog, "flow", "log", 100, 0);
        graph.addNode(catalog, "values", "constant", 0, 100).setValue(7);
        ConnectionValidator validator = new ConnectionValidator(graph);
        validator.connect(PortRef.output(0, 0), PortRef.input(1, 0));
        validator.connect(PortRef.output(2, 0), PortRef.input(1, 1));
        explain = new GraphExplain(graph);
    }

    @Test
    public void testMermaid() {
        String mermaid = explain.toMermaid();

        assertTrue(mermaid.startsWith("graph LR;\n"));
        assertTrue(mermaid.contains("  n0[\"Entry\"];\n"));
        assertTrue(mermaid.contains("  n2[\"Constant<br/><b>7</b>\"];\n"));
        // exec solid, data dotted
        assertTrue(mermaid.contains("  n0 -- \"next to exec\" --> n1;\n"));
        assertTrue(mermaid.contains("  n2 -. \"out to msg\" .-> n1;\n"));
    }

    @Test
    public void testDumpGraph() {
        String dump = explain.dumpGraph();

        assertTrue(dump.startsWith("Graph (3 nodes, 2 links):\n"));
        assertTrue(dump.contains("  [0] flow/entry -> next=>1.exec\n"));
        assertTrue(dump.contains("  [1] flow/log\n"));
        assertTrue(dump.contains("  [2] values/constant -> out=>1.msg\n"));
    }

    @Test
    public void testExplainNode() {
        String text = explain.explainNode(2);
        assertTrue(text.contains("Type: values/constant"));
        assertTrue(text.contains("Value (float): 7"));
        assertTrue(text.contains("Outputs (1): out:float"));

        assertEquals("Node 9: <missing>\n", explain.explainNode(9));
    }
}
