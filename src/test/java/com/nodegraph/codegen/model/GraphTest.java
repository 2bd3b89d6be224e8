package com.nodegraph.codegen.model;

import java.util.List;

import com.nodegraph.codegen.Fixtures;
import com.nodegraph.codegen.io.JsonCodec;
import com.nodegraph.codegen.registry.DefinitionNotFoundException;
import com.nodegraph.codegen.registry.NodeCatalog;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphTest {

    private NodeCatalog catalog;
    private Graph graph;

    @Before
    public void setUp() {
        catalog = Fixtures.catalog();
        graph = new Graph();
    }

    @Test
    public void testIdsAreNeverReused() {
        GraphNode a = graph.addNode(catalog, "flow", "entry", 0, 0);
        GraphNode b = graph.addNode(catalog, "flow", "done", 0, 0);
        assertEquals(0, a.getId());
        assertEquals(1, b.getId());

        graph.removeNode(1);
        GraphNode c = graph.addNode(catalog, "flow", "done", 0, 0);
        assertEquals(2, c.getId());
        assertEquals(2, graph.nodeCount());
    }

    @Test
    public void testUnknownTypeDoesNotConsumeId() {
        try {
            graph.addNode(catalog, "math", "divide", 0, 0);
            fail("Expected DefinitionNotFoundException");
        } catch (DefinitionNotFoundException e) {
            // expected
        }
        assertEquals(0, graph.nextNodeId());
        assertEquals(0, graph.nodeCount());
    }

    @Test
    public void testRemoveNodeCascadesLinks() {
        GraphNode entry = graph.addNode(catalog, "flow", "entry", 0, 0);
        GraphNode step = graph.addNode(catalog, "flow", "step", 0, 0);
        GraphNode done = graph.addNode(catalog, "flow", "done", 0, 0);
        graph.addLink(PortRef.output(entry.getId(), 0), PortRef.input(step.getId(), 0));
        GraphLink kept = graph.addLink(PortRef.output(entry.getId(), 0), PortRef.input(done.getId(), 0));
        graph.addLink(PortRef.output(step.getId(), 0), PortRef.input(done.getId(), 0));

        List<GraphLink> removed = graph.removeNode(step.getId());

        assertEquals(2, removed.size());
        assertEquals(List.of(kept), graph.links());
        assertNull(graph.node(step.getId()));
        assertTrue(graph.removeNode(42).isEmpty());
    }

    @Test
    public void testRestoreAdvancesSequences() {
        graph.restoreNode(7, catalog, "flow", "entry", 0, 0);
        graph.restoreNode(3, catalog, "flow", "done", 0, 0);
        assertEquals(8, graph.nextNodeId());

        graph.restoreLink(5, PortRef.output(7, 0), PortRef.input(3, 0));
        assertEquals(6, graph.nextLinkId());
        assertEquals(6, graph.addLink(PortRef.output(7, 0), PortRef.input(3, 0)).getId());

        // creation order, not id order
        assertEquals(7, graph.nodes().iterator().next().getId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRestoreDuplicateNode() {
        graph.restoreNode(1, catalog, "flow", "entry", 0, 0);
        graph.restoreNode(1, catalog, "flow", "done", 0, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRestoreDuplicateLink() {
        graph.restoreNode(0, catalog, "flow", "entry", 0, 0);
        graph.restoreNode(1, catalog, "flow", "done", 0, 0);
        graph.restoreLink(0, PortRef.output(0, 0), PortRef.input(1, 0));
        graph.restoreLink(0, PortRef.output(0, 0), PortRef.input(1, 0));
    }

    @Test
    public void testClearResetsCounters() {
        graph.addNode(catalog, "flow", "entry", 0, 0);
        graph.addNode(catalog, "flow", "done", 0, 0);
        graph.addLink(PortRef.output(0, 0), PortRef.input(1, 0));

        graph.clear();

        assertEquals(0, graph.nodeCount());
        assertEquals(0, graph.linkCount());
        assertEquals(0, graph.nextNodeId());
        assertEquals(0, graph.nextLinkId());
        assertEquals(0, graph.addNode(catalog, "flow", "done", 0, 0).getId());
    }

    @Test
    public void testLinkQueries() {
        graph.addNode(catalog, "flow", "entry", 0, 0);
        graph.addNode(catalog, "flow", "log", 0, 0);
        graph.addNode(catalog, "values", "constant", 0, 0);
        GraphLink exec = graph.addLink(PortRef.output(0, 0), PortRef.input(1, 0));
        GraphLink data = graph.addLink(PortRef.output(2, 0), PortRef.input(1, 1));

        assertEquals(List.of(exec, data), graph.linksInto(1));
        assertEquals(List.of(exec), graph.linksFrom(0));
        assertTrue(graph.linksFrom(1).isEmpty());
        assertSame(data, graph.link(data.getId()));
        assertNull(graph.link(99));

        data.setSelected(true);
        graph.node(1).setSelected(true);
        assertTrue(graph.link(data.getId()).isSelected());
        assertTrue(graph.node(1).isSelected());
        assertFalse(exec.isSelected());

        assertTrue(graph.removeLink(exec.getId()));
        assertFalse(graph.removeLink(exec.getId()));
        assertEquals(1, graph.linkCount());
    }

    @Test
    public void testPortResolution() {
        graph.addNode(catalog, "math", "add", 0, 0);
        assertEquals("B", graph.port(PortRef.input(0, 1)).getName());
        assertNull(graph.port(PortRef.input(0, 2)));
        assertNull(graph.port(PortRef.output(9, 0)));
    }

    @Test
    public void testTopmostNodeWins() {
        graph.addNode(catalog, "math", "add", 0, 0);
        GraphNode top = graph.addNode(catalog, "math", "add", 40, 20);

        assertSame(top, graph.nodeAt(50, 30));
        assertEquals(0, graph.nodeAt(5, 5).getId());
        assertNull(graph.nodeAt(500, 500));

        PortHit hit = graph.portAt(50, 60);
        assertEquals(top.getId(), hit.node().getId());
        assertNull(graph.portAt(300, 300));
    }

    @Test
    public void testRefreshPortsAfterRedefinition() {
        graph.addNode(catalog, "math", "add", 0, 0);
        graph.addNode(catalog, "math", "negate", 0, 0);

        catalog.merge(JsonCodec.readRegistry("""
                {
                  "nodeCategories": {
                    "math": {
                      "nodes": {
                        "add": {
                          "title": "Add",
                          "inputs": [ { "type": "int", "name": "A" }, { "type": "int", "name": "B" } ],
                          "outputs": [ { "type": "int", "name": "sum", "code": "add(${A}, ${B})" } ]
                        },
                        "negate": { "title": "Negate", "inputs": [], "outputs": [] }
                      }
                    }
                  }
                }
                """));

        assertEquals(1, graph.refreshPorts(catalog));
        GraphNode add = graph.node(0);
        assertEquals("int", add.getInputs().get(0).getKind());
        assertEquals("add(${A}, ${B})", add.getOutputs().get(0).getCode());
        // port count changed: left alone
        assertEquals(1, graph.node(1).getInputs().size());
    }
}
