package com.nodegraph.codegen.util;

import com.nodegraph.codegen.model.Graph;
import com.nodegraph.codegen.model.GraphLink;
import com.nodegraph.codegen.model.GraphNode;
import com.nodegraph.codegen.model.Port;
import com.nodegraph.codegen.model.PortRef;

/**
 * Diagnostic utility for inspecting a node graph.
 *
 * <p>
 * Produces human-readable renderings of the nodes and links: a plain text dump
 * and a Mermaid flowchart for embedding in Markdown.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and log output. Allocates
 * freely; do not call per frame.
 */
public final class GraphExplain {
    private final Graph graph;

    public GraphExplain(Graph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(int nodeId) {
        GraphNode node = graph.node(nodeId);
        if (node == null)
            return "Node " + nodeId + ": <missing>\n";
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.getId()).append(' ').append(node.getTitle()).append('\n')
                .append("  Type: ").append(node.getCategory()).append('/').append(node.getType()).append('\n')
                .append("  Position: (").append(node.getX()).append(", ").append(node.getY()).append(")\n");
        if (node.hasValue())
            sb.append("  Value (").append(node.getValueType().label()).append("): ").append(node.getValue())
                    .append('\n');
        appendPorts(sb, "Inputs", node.getInputs());
        appendPorts(sb, "Outputs", node.getOutputs());
        return sb.toString();
    }

    private static void appendPorts(StringBuilder sb, String label, java.util.List<Port> ports) {
        sb.append("  ").append(label).append(" (").append(ports.size()).append("): ");
        for (int i = 0; i < ports.size(); i++) {
            Port p = ports.get(i);
            sb.append(p.getName() != null ? p.getName() : "?").append(':').append(p.getKind());
            if (i < ports.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    /**
     * Dumps every node with its outgoing links in text format.
     */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ").append(graph.linkCount())
                .append(" links):\n");
        for (GraphNode node : graph.nodes()) {
            sb.append("  [").append(node.getId()).append("] ").append(node.getCategory()).append('/')
                    .append(node.getType());
            var out = graph.linksFrom(node.getId());
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < out.size(); j++) {
                    GraphLink l = out.get(j);
                    sb.append(portName(l.getFrom())).append("=>").append(l.getTo().nodeId()).append('.')
                            .append(portName(l.getTo()));
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS flowchart. Exec links are drawn solid, data links
     * dotted; each edge is labelled with the port names it joins.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        // 1. Declare nodes in creation order
        for (GraphNode node : graph.nodes()) {
            sb.append("  n").append(node.getId()).append("[\"").append(escape(node.getTitle()));
            if (node.hasValue() && node.getValue() != null)
                sb.append("<br/><b>").append(escape(String.valueOf(node.getValue()))).append("</b>");
            sb.append("\"];\n");
        }

        // 2. Then all edges, in link order
        for (GraphLink l : graph.links()) {
            Port from = graph.port(l.getFrom());
            boolean exec = from != null && from.isExec();
            String label = escape(portName(l.getFrom()) + " to " + portName(l.getTo()));
            sb.append("  n").append(l.getFrom().nodeId())
                    .append(exec ? " -- \"" : " -. \"").append(label).append(exec ? "\" --> " : "\" .-> ")
                    .append('n').append(l.getTo().nodeId()).append(";\n");
        }
        return sb.toString();
    }

    private String portName(PortRef ref) {
        Port p = graph.port(ref);
        if (p == null)
            return "?";
        return p.getName() != null ? p.getName() : p.getKind();
    }

    private static String escape(String text) {
        if (text == null)
            return "";
        return text.replace("\"", "#quot;");
    }
}
