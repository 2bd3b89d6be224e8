package com.nodegraph.codegen.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import com.nodegraph.codegen.io.RegistryDefinition.NodeTypeDef;
import com.nodegraph.codegen.registry.NodeCatalog;

import lombok.extern.log4j.Log4j2;

/**
 * The graph document: nodes keyed by stable id plus a flat list of links.
 *
 * <p>
 * Nodes are kept in creation order, which is also the order entry points are
 * discovered in during code generation. Links reference ports by
 * {@link PortRef}, so deleting a node is a scan over the link list rather than
 * a walk through object references.
 *
 * <p>
 * This class performs raw structural mutations only. Link legality is the job
 * of {@link com.nodegraph.codegen.engine.ConnectionValidator}; after any bulk
 * mutation, run its repair pass to restore the invariants. Not thread-safe.
 */
@Log4j2
public final class Graph {
    private final Map<Integer, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphLink> links = new ArrayList<>();
    private final IdSequence nodeIds = new IdSequence();
    private final IdSequence linkIds = new IdSequence();

    // ── Nodes ───────────────────────────────────────────────────────

    /**
     * Instantiates {@code category/type} at (x, y) under a fresh id.
     *
     * @throws com.nodegraph.codegen.registry.DefinitionNotFoundException
     *         if the catalog has no such entry; no id is consumed
     */
    public GraphNode addNode(NodeCatalog catalog, String category, String type, double x, double y) {
        catalog.require(category, type); // before next(): a miss must not burn an id
        GraphNode node = GraphNode.create(nodeIds.next(), x, y, category, type, catalog);
        nodes.put(node.getId(), node);
        return node;
    }

    /** Re-creates a node under a known id, e.g. from a saved document. */
    public GraphNode restoreNode(int id, NodeCatalog catalog, String category, String type, double x, double y) {
        if (nodes.containsKey(id))
            throw new IllegalArgumentException("Duplicate node id: " + id);
        GraphNode node = GraphNode.create(id, x, y, category, type, catalog);
        nodes.put(id, node);
        nodeIds.advancePast(id);
        return node;
    }

    /** Returns the node with {@code id}, or null. */
    public GraphNode node(int id) {
        return nodes.get(id);
    }

    public boolean containsNode(int id) {
        return nodes.containsKey(id);
    }

    /** All nodes in creation order. */
    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Deletes a node and every link touching any of its ports.
     *
     * @return the links removed by the cascade (empty if the node did not exist)
     */
    public List<GraphLink> removeNode(int id) {
        if (nodes.remove(id) == null)
            return List.of();
        List<GraphLink> removed = removeLinks(l -> l.touches(id));
        log.debug("Removed node {} and {} attached link(s)", id, removed.size());
        return removed;
    }

    /**
     * Refreshes every node's ports from the current catalog entries. Nodes whose
     * definition disappeared or whose port counts changed are left as they are.
     *
     * @return number of nodes refreshed
     */
    public int refreshPorts(NodeCatalog catalog) {
        int refreshed = 0;
        for (GraphNode n : nodes.values()) {
            NodeTypeDef def = catalog.find(n.getCategory(), n.getType());
            if (def != null && n.refreshPorts(def))
                refreshed++;
        }
        return refreshed;
    }

    // ── Ports ───────────────────────────────────────────────────────

    /** Resolves a port address, or returns null if the node or index is gone. */
    public Port port(PortRef ref) {
        GraphNode n = nodes.get(ref.nodeId());
        return n == null ? null : n.port(ref.direction(), ref.index());
    }

    /** Topmost node containing the point (the most recently created wins), or null. */
    public GraphNode nodeAt(double x, double y) {
        GraphNode hit = null;
        for (GraphNode n : nodes.values())
            if (n.containsPoint(x, y))
                hit = n;
        return hit;
    }

    /** Port under the point on any node, or null. */
    public PortHit portAt(double x, double y) {
        PortHit hit = null;
        for (GraphNode n : nodes.values()) {
            PortHit h = n.portAt(x, y);
            if (h != null)
                hit = h;
        }
        return hit;
    }

    // ── Links ───────────────────────────────────────────────────────

    /**
     * Appends a link without any legality check. Prefer
     * {@link com.nodegraph.codegen.engine.ConnectionValidator#connect}.
     */
    public GraphLink addLink(PortRef from, PortRef to) {
        GraphLink link = new GraphLink(linkIds.next(), from, to);
        links.add(link);
        return link;
    }

    /** Re-creates a link under a known id, e.g. from a saved document. */
    public GraphLink restoreLink(int id, PortRef from, PortRef to) {
        for (GraphLink l : links)
            if (l.getId() == id)
                throw new IllegalArgumentException("Duplicate link id: " + id);
        GraphLink link = new GraphLink(id, from, to);
        links.add(link);
        linkIds.advancePast(id);
        return link;
    }

    /** Links in insertion order. */
    public List<GraphLink> links() {
        return Collections.unmodifiableList(links);
    }

    public int linkCount() {
        return links.size();
    }

    public GraphLink link(int id) {
        for (GraphLink l : links)
            if (l.getId() == id)
                return l;
        return null;
    }

    public boolean removeLink(int id) {
        return !removeLinks(l -> l.getId() == id).isEmpty();
    }

    /** Removes every link matching {@code filter}, preserving the order of the rest. */
    public List<GraphLink> removeLinks(Predicate<GraphLink> filter) {
        List<GraphLink> removed = new ArrayList<>();
        Iterator<GraphLink> it = links.iterator();
        while (it.hasNext()) {
            GraphLink l = it.next();
            if (filter.test(l)) {
                removed.add(l);
                it.remove();
            }
        }
        return removed;
    }

    /** Links ending at any input of {@code nodeId}, in link order. */
    public List<GraphLink> linksInto(int nodeId) {
        List<GraphLink> result = new ArrayList<>();
        for (GraphLink l : links)
            if (l.getTo().nodeId() == nodeId)
                result.add(l);
        return result;
    }

    /** Links leaving any output of {@code nodeId}, in link order. */
    public List<GraphLink> linksFrom(int nodeId) {
        List<GraphLink> result = new ArrayList<>();
        for (GraphLink l : links)
            if (l.getFrom().nodeId() == nodeId)
                result.add(l);
        return result;
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /** Drops all nodes and links and restarts both id sequences at zero. */
    public void clear() {
        nodes.clear();
        links.clear();
        nodeIds.reset();
        linkIds.reset();
    }

    /** The id the next created node will get. */
    public int nextNodeId() {
        return nodeIds.peek();
    }

    /** The id the next created link will get. */
    public int nextLinkId() {
        return linkIds.peek();
    }
}
