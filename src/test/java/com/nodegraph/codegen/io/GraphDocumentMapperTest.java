package com.nodegraph.codegen.io;

import java.util.List;

import com.nodegraph.codegen.Fixtures;
import com.nodegraph.codegen.engine.ConnectionValidator;
import com.nodegraph.codegen.model.Graph;
import com.nodegraph.codegen.model.GraphLink;
import com.nodegraph.codegen.model.GraphNode;
import com.nodegraph.codegen.model.PortRef;
import com.nodegraph.codegen.registry.NodeCatalog;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphDocumentMapperTest {

    private NodeCatalog catalog;
    private Graph graph;

    @Before
    public void setUp() {
        catalog = Fixtures.catalog();
        graph = new Graph();
    }

    private LoadReport load(String json) {
        return GraphDocumentMapper.load(JsonCodec.readGraph(json), graph, catalog);
    }

    @Test
    public void testLoadRestoresNodesValuesAndLinks() {
        LoadReport report = load("""
                {
                  "version": "1.0",
                  "name": "sum",
                  "nodes": [
                    { "id": 0, "type": "constant", "category": "values", "x": 10, "y": 20, "value": 5 },
                    { "id": 4, "type": "constant", "category": "values", "x": 10, "y": 120, "value": 3 },
                    { "id": 2, "type": "add", "category": "math", "x": 200, "y": 60 }
                  ],
                  "connections": [
                    { "id": 0, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 2, "portIndex": 0, "portType": "input" } },
                    { "id": 3, "from": { "nodeId": 4, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 2, "portIndex": 1, "portType": "input" } }
                  ]
                }
                """);

        assertTrue(report.isClean());
        assertEquals(3, report.nodesLoaded());
        assertEquals(2, report.linksLoaded());
        assertEquals(5, graph.node(0).getValue());
        assertEquals(200, graph.node(2).getX(), 1e-9);
        // counters continue after the highest restored id
        assertEquals(5, graph.nextNodeId());
        assertEquals(4, graph.nextLinkId());
    }

    @Test
    public void testBadConnectionIsSkipped() {
        LoadReport report = load("""
                {
                  "nodes": [
                    { "id": 0, "type": "entry", "category": "flow", "x": 0, "y": 0 },
                    { "id": 1, "type": "done", "category": "flow", "x": 0, "y": 0 }
                  ],
                  "connections": [
                    { "id": 0, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 1, "portIndex": 0, "portType": "input" } },
                    { "id": 1, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 99, "portIndex": 0, "portType": "input" } },
                    { "id": 2, "from": { "nodeId": 0, "portIndex": 3, "portType": "output" },
                               "to": { "nodeId": 1, "portIndex": 0, "portType": "input" } },
                    { "id": 3, "from": { "nodeId": 0, "portIndex": 0, "portType": "sideways" },
                               "to": { "nodeId": 1, "portIndex": 0, "portType": "input" } },
                    { "id": 4, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 1, "portIndex": 0, "portType": "output" } },
                    { "id": 5, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" } }
                  ]
                }
                """);

        assertEquals(2, report.nodesLoaded());
        assertEquals(1, report.linksLoaded());
        assertEquals(5, report.skippedLinks().size());
        assertTrue(report.skippedLinks().get(0).contains("missing node 99"));
        assertTrue(report.skippedNodes().isEmpty());
        assertFalse(report.isClean());
        assertEquals(1, graph.links().get(0).getTo().nodeId());
    }

    @Test
    public void testUnknownNodeTypeIsSkipped() {
        LoadReport report = load("""
                {
                  "nodes": [
                    { "id": 0, "type": "entry", "category": "flow", "x": 0, "y": 0 },
                    { "id": 1, "type": "teleport", "category": "flow", "x": 0, "y": 0 },
                    { "id": 2, "type": "done", "category": "flow", "x": 0, "y": 0 },
                    { "id": 2, "type": "done", "category": "flow", "x": 5, "y": 5 }
                  ],
                  "connections": [
                    { "id": 0, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 1, "portIndex": 0, "portType": "input" } },
                    { "id": 1, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 2, "portIndex": 0, "portType": "input" } }
                  ]
                }
                """);

        assertEquals(2, report.nodesLoaded());
        assertEquals(2, report.skippedNodes().size());
        assertTrue(report.skippedNodes().get(0).contains("flow/teleport"));
        assertEquals(List.of(0, 2), graph.nodes().stream().map(GraphNode::getId).toList());
        // the duplicate is dropped, the first one wins
        assertEquals(0, graph.node(2).getX(), 1e-9);
        assertEquals(1, report.linksLoaded());
        assertEquals(1, report.skippedLinks().size());
    }

    @Test
    public void testNullEntriesAreSkipped() {
        graph.addNode(catalog, "math", "add", 0, 0);

        LoadReport report = load("""
                {
                  "nodes": [ null, { "id": 3, "type": "done", "category": "flow", "x": 0, "y": 0 } ],
                  "connections": [ null ]
                }
                """);

        assertEquals(1, report.nodesLoaded());
        assertEquals("done", graph.node(3).getType());
        assertEquals(1, graph.nodeCount());
        assertEquals(1, report.skippedNodes().size());
        assertEquals(1, report.skippedLinks().size());
        assertEquals(0, report.linksLoaded());
    }

    @Test
    public void testReversedConnectionIsNormalized() {
        load("""
                {
                  "nodes": [
                    { "id": 0, "type": "entry", "category": "flow", "x": 0, "y": 0 },
                    { "id": 1, "type": "done", "category": "flow", "x": 0, "y": 0 }
                  ],
                  "connections": [
                    { "id": 0, "from": { "nodeId": 1, "portIndex": 0, "portType": "input" },
                               "to": { "nodeId": 0, "portIndex": 0, "portType": "output" } }
                  ]
                }
                """);

        GraphLink link = graph.links().get(0);
        assertEquals(PortRef.output(0, 0), link.getFrom());
        assertEquals(PortRef.input(1, 0), link.getTo());
    }

    @Test
    public void testLoadValidatesConnections() {
        LoadReport report = load("""
                {
                  "nodes": [
                    { "id": 0, "type": "constant", "category": "values", "x": 0, "y": 0 },
                    { "id": 1, "type": "constant", "category": "values", "x": 0, "y": 0 },
                    { "id": 2, "type": "negate", "category": "math", "x": 0, "y": 0 },
                    { "id": 3, "type": "flag", "category": "values", "x": 0, "y": 0 },
                    { "id": 4, "type": "add", "category": "math", "x": 0, "y": 0 }
                  ],
                  "connections": [
                    { "id": 0, "from": { "nodeId": 0, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 2, "portIndex": 0, "portType": "input" } },
                    { "id": 1, "from": { "nodeId": 1, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 2, "portIndex": 0, "portType": "input" } },
                    { "id": 2, "from": { "nodeId": 3, "portIndex": 0, "portType": "output" },
                               "to": { "nodeId": 4, "portIndex": 0, "portType": "input" } }
                  ]
                }
                """);

        assertEquals(1, report.linksLoaded());
        assertEquals(List.of(1, 2), report.removedByValidation().stream().map(GraphLink::getId).toList());
        assertTrue(report.skippedLinks().isEmpty());
        assertEquals(0, graph.links().get(0).getId());
    }

    @Test
    public void testLoadReplacesExistingGraph() {
        graph.addNode(catalog, "math", "add", 0, 0);
        graph.addNode(catalog, "math", "add", 0, 0);
        graph.addNode(catalog, "math", "add", 0, 0);

        load("{ \"nodes\": [ { \"id\": 0, \"type\": \"done\", \"category\": \"flow\", \"x\": 0, \"y\": 0 } ] }");

        assertEquals(1, graph.nodeCount());
        assertEquals("done", graph.node(0).getType());
        assertEquals(1, graph.nextNodeId());
    }

    @Test
    public void testExport() {
        GraphNode c = graph.addNode(catalog, "values", "constant", 10, 20);
        GraphNode add = graph.addNode(catalog, "math", "add", 30, 40);
        c.setValue(2.5);
        new ConnectionValidator(graph).connect(PortRef.output(c.getId(), 0), PortRef.input(add.getId(), 1));

        GraphDocument doc = GraphDocumentMapper.export(graph);

        assertEquals("1.0", doc.getVersion());
        assertEquals(2, doc.getNodes().size());
        GraphDocument.NodeEntry first = doc.getNodes().get(0);
        assertEquals("constant", first.getType());
        assertEquals("values", first.getCategory());
        assertEquals(2.5, first.getValue());
        assertNull(doc.getNodes().get(1).getValue());

        GraphDocument.ConnectionEntry conn = doc.getConnections().get(0);
        assertEquals(new GraphDocument.Endpoint(0, 0, "output"), conn.getFrom());
        assertEquals(new GraphDocument.Endpoint(1, 1, "input"), conn.getTo());
    }

    @Test
    public void testRoundTripThroughJson() {
        GraphNode entry = graph.addNode(catalog, "flow", "entry", 0, 0);
        GraphNode log = graph.addNode(catalog, "flow", "log", 100, 0);
        GraphNode vector = graph.addNode(catalog, "values", "vector", 0, 100);
        vector.setValue(List.of(1, 2, 3));
        ConnectionValidator validator = new ConnectionValidator(graph);
        validator.connect(PortRef.output(entry.getId(), 0), PortRef.input(log.getId(), 0));
        validator.connect(PortRef.output(vector.getId(), 0), PortRef.input(log.getId(), 1));

        String json = JsonCodec.writeGraph(GraphDocumentMapper.export(graph));
        assertFalse(json.contains("\"value\" : null"));

        Graph copy = new Graph();
        LoadReport report = GraphDocumentMapper.load(JsonCodec.readGraph(json), copy, catalog);

        assertTrue(report.isClean());
        assertEquals(3, copy.nodeCount());
        assertEquals(2, copy.linkCount());
        assertEquals(List.of(1, 2, 3), copy.node(vector.getId()).getValue());
        assertEquals(100, copy.node(log.getId()).getX(), 1e-9);
        assertEquals(GraphDocumentMapper.export(graph), GraphDocumentMapper.export(copy));
    }
}
