package com.nodegraph.codegen.io;

import java.util.ArrayList;
import java.util.List;

import com.nodegraph.codegen.engine.ConnectionValidator;
import com.nodegraph.codegen.model.Graph;
import com.nodegraph.codegen.model.GraphLink;
import com.nodegraph.codegen.model.GraphNode;
import com.nodegraph.codegen.model.PortDirection;
import com.nodegraph.codegen.model.PortRef;
import com.nodegraph.codegen.registry.NodeCatalog;

import lombok.extern.log4j.Log4j2;

/**
 * Converts between a live {@link Graph} and its {@link GraphDocument} form.
 *
 * <p>
 * Loading is tolerant: a node whose type is not in the catalog, or a
 * connection pointing at a missing node or port index, is skipped with a
 * warning and the rest of the document still loads. Id sequences are advanced
 * past every restored id.
 */
@Log4j2
public final class GraphDocumentMapper {

    private GraphDocumentMapper() {
        // Utility class
    }

    /** Snapshot of the graph as a document. */
    public static GraphDocument export(Graph graph) {
        GraphDocument doc = new GraphDocument();
        doc.setVersion(GraphDocument.CURRENT_VERSION);
        for (GraphNode n : graph.nodes()) {
            doc.getNodes().add(new GraphDocument.NodeEntry(n.getId(), n.getType(), n.getCategory(), n.getX(), n.getY(),
                    n.hasValue() ? n.getValue() : null));
        }
        for (GraphLink l : graph.links()) {
            doc.getConnections().add(new GraphDocument.ConnectionEntry(l.getId(), endpoint(l.getFrom()),
                    endpoint(l.getTo())));
        }
        return doc;
    }

    private static GraphDocument.Endpoint endpoint(PortRef ref) {
        return new GraphDocument.Endpoint(ref.nodeId(), ref.index(), ref.direction().label());
    }

    /**
     * Replaces the content of {@code graph} with the document, then runs the
     * connection repair pass.
     */
    public static LoadReport load(GraphDocument doc, Graph graph, NodeCatalog catalog) {
        graph.clear();
        List<String> skippedNodes = new ArrayList<>();
        List<String> skippedLinks = new ArrayList<>();

        if (doc.getNodes() != null) {
            for (GraphDocument.NodeEntry e : doc.getNodes()) {
                if (e == null) {
                    skip(skippedNodes, "node entry: null");
                    continue;
                }
                try {
                    GraphNode node = graph.restoreNode(e.getId(), catalog, e.getCategory(), e.getType(), e.getX(),
                            e.getY());
                    if (e.getValue() != null && node.hasValue())
                        node.setValue(e.getValue());
                } catch (IllegalArgumentException ex) {
                    skip(skippedNodes, "node " + e.getId() + ": " + ex.getMessage());
                }
            }
        }

        if (doc.getConnections() != null) {
            for (GraphDocument.ConnectionEntry c : doc.getConnections()) {
                if (c == null) {
                    skip(skippedLinks, "connection entry: null");
                    continue;
                }
                String problem = restoreConnection(c, graph);
                if (problem != null)
                    skip(skippedLinks, "connection " + c.getId() + ": " + problem);
            }
        }

        List<GraphLink> removed = new ConnectionValidator(graph).validateConnections();
        if (!removed.isEmpty())
            log.warn("Removed {} invalid connection(s) after load: {}", removed.size(), removed);

        log.info("Loaded graph '{}': {} node(s), {} link(s), {} skipped",
                doc.getName() != null ? doc.getName() : "unnamed", graph.nodeCount(), graph.linkCount(),
                skippedNodes.size() + skippedLinks.size());
        return new LoadReport(graph.nodeCount(), graph.linkCount(), List.copyOf(skippedNodes),
                List.copyOf(skippedLinks), List.copyOf(removed));
    }

    /** Returns null on success, otherwise the reason the connection was skipped. */
    private static String restoreConnection(GraphDocument.ConnectionEntry c, Graph graph) {
        if (c.getFrom() == null || c.getTo() == null)
            return "missing endpoint";
        PortRef from, to;
        try {
            from = toRef(c.getFrom());
            to = toRef(c.getTo());
        } catch (IllegalArgumentException ex) {
            return ex.getMessage();
        }
        if (!graph.containsNode(from.nodeId()))
            return "references missing node " + from.nodeId();
        if (!graph.containsNode(to.nodeId()))
            return "references missing node " + to.nodeId();
        if (graph.port(from) == null)
            return "missing port " + from;
        if (graph.port(to) == null)
            return "missing port " + to;
        if (from.direction() == to.direction())
            return "both endpoints are " + from.direction().label() + "s";
        if (from.isInput()) {
            PortRef tmp = from;
            from = to;
            to = tmp;
        }
        try {
            graph.restoreLink(c.getId(), from, to);
        } catch (IllegalArgumentException ex) {
            return ex.getMessage();
        }
        return null;
    }

    private static PortRef toRef(GraphDocument.Endpoint e) {
        return new PortRef(e.getNodeId(), PortDirection.fromString(e.getPortType()), e.getPortIndex());
    }

    private static void skip(List<String> sink, String message) {
        log.warn("Skipping {}", message);
        sink.add(message);
    }
}
