package com.nodegraph.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import com.nodegraph.codegen.engine.CodeGenerator;
import com.nodegraph.codegen.engine.ConnectionValidator;
import com.nodegraph.codegen.io.GraphDocument;
import com.nodegraph.codegen.io.GraphDocumentMapper;
import com.nodegraph.codegen.io.JsonCodec;
import com.nodegraph.codegen.io.LoadReport;
import com.nodegraph.codegen.io.RegistryDefinition;
import com.nodegraph.codegen.model.Graph;
import com.nodegraph.codegen.model.GraphLink;
import com.nodegraph.codegen.model.GraphNode;
import com.nodegraph.codegen.model.PortRef;
import com.nodegraph.codegen.registry.NodeCatalog;
import com.nodegraph.codegen.util.GraphExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * A high-level wrapper that ties the node catalog, the graph, the connection
 * rules and the code generator together.
 * <p>
 * This class handles:
 * <ul>
 * <li>Merging registry documents into the catalog and resyncing existing
 * nodes</li>
 * <li>Creating, moving and deleting nodes and links</li>
 * <li>Loading and exporting saved graph documents</li>
 * <li>Generating code from the current graph</li>
 * </ul>
 * Every structural mutation is followed by the connection repair pass, so the
 * graph invariants hold between calls. Not thread-safe.
 */
public class CodeGraph {
    private static final Logger log = LogManager.getLogger(CodeGraph.class);

    private final NodeCatalog catalog = new NodeCatalog();
    private final Graph graph = new Graph();
    private final ConnectionValidator validator = new ConnectionValidator(graph);
    private final CodeGenerator generator;

    public CodeGraph() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the timestamp written into generated code headers
     */
    public CodeGraph(Clock clock) {
        this.generator = new CodeGenerator(graph, catalog, clock);
    }

    // ── Registry ────────────────────────────────────────────────────

    /**
     * Merges a registry into the catalog. Existing nodes pick up redefined
     * port kinds and templates; links that no longer fit are removed.
     */
    public CodeGraph addRegistry(RegistryDefinition registry) {
        catalog.merge(registry);
        int refreshed = graph.refreshPorts(catalog);
        if (refreshed > 0)
            log.debug("Refreshed ports of {} node(s) after registry merge", refreshed);
        revalidate("registry merge");
        return this;
    }

    /** Parses and merges a registry JSON document. */
    public CodeGraph addRegistry(String json) {
        return addRegistry(JsonCodec.readRegistry(json));
    }

    public CodeGraph addRegistry(Path path) throws IOException {
        return addRegistry(JsonCodec.readRegistry(path));
    }

    // ── Editing ─────────────────────────────────────────────────────

    /**
     * Places a new node of {@code category/type}.
     *
     * @throws com.nodegraph.codegen.registry.DefinitionNotFoundException
     *         if the catalog has no such type
     */
    public GraphNode addNode(String category, String type, double x, double y) {
        return graph.addNode(catalog, category, type, x, y);
    }

    /** Links two ports if the connection rules allow it. */
    public Optional<GraphLink> connect(PortRef a, PortRef b) {
        Optional<GraphLink> link = validator.connect(a, b);
        revalidate("connect");
        return link;
    }

    /** Deletes a node with all its links; returns false if it did not exist. */
    public boolean removeNode(int nodeId) {
        if (!graph.containsNode(nodeId))
            return false;
        graph.removeNode(nodeId);
        revalidate("node removal");
        return true;
    }

    public boolean removeLink(int linkId) {
        boolean removed = graph.removeLink(linkId);
        revalidate("link removal");
        return removed;
    }

    /** Moves a node; its ports follow. */
    public boolean moveNode(int nodeId, double x, double y) {
        GraphNode node = graph.node(nodeId);
        if (node == null)
            return false;
        node.moveTo(x, y);
        return true;
    }

    /** Drops every node and link and restarts id assignment. The catalog is kept. */
    public void clear() {
        graph.clear();
    }

    // ── Documents ───────────────────────────────────────────────────

    /** Replaces the current graph with a saved document. */
    public LoadReport loadGraph(GraphDocument doc) {
        return GraphDocumentMapper.load(doc, graph, catalog);
    }

    public LoadReport loadGraph(String json) {
        return loadGraph(JsonCodec.readGraph(json));
    }

    public LoadReport loadGraph(Path path) throws IOException {
        return loadGraph(JsonCodec.readGraph(path));
    }

    public GraphDocument exportGraph() {
        return GraphDocumentMapper.export(graph);
    }

    public String exportGraphJson() {
        return JsonCodec.writeGraph(exportGraph());
    }

    // ── Code generation ─────────────────────────────────────────────

    /**
     * Generates code for the current graph.
     *
     * @throws com.nodegraph.codegen.engine.NoEntryPointException
     *         if nothing in the graph can start execution
     */
    public String exportCode() {
        if (log.isDebugEnabled())
            log.debug("Generating code for:\n{}", new GraphExplain(graph).dumpGraph());
        return generator.generate();
    }

    public NodeCatalog getCatalog() {
        return catalog;
    }

    public Graph getGraph() {
        return graph;
    }

    public ConnectionValidator getValidator() {
        return validator;
    }

    public CodeGenerator getGenerator() {
        return generator;
    }

    private void revalidate(String cause) {
        List<GraphLink> removed = validator.validateConnections();
        if (!removed.isEmpty())
            log.warn("Removed {} invalid connection(s) after {}: {}", removed.size(), cause, removed);
    }
}
