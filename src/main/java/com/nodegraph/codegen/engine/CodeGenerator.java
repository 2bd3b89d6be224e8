package com.nodegraph.codegen.engine;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.nodegraph.codegen.io.RegistryDefinition.NodeTypeDef;
import com.nodegraph.codegen.io.RegistryDefinition.PortDef;
import com.nodegraph.codegen.model.Graph;
import com.nodegraph.codegen.model.GraphLink;
import com.nodegraph.codegen.model.GraphNode;
import com.nodegraph.codegen.model.Port;
import com.nodegraph.codegen.registry.NodeCatalog;
import com.nodegraph.codegen.registry.PortKinds;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a {@link Graph} into source text by expanding per-node code
 * templates.
 *
 * <h2>Algorithm</h2>
 * <ol>
 * <li><b>Entry discovery:</b> a node is an entry if its definition declares an
 * exec input and no exec link arrives at the node. No entries means there is
 * nothing to emit and generation fails.</li>
 * <li><b>Control flow:</b> starting from each entry, the exec input template of
 * a node is filled in: {@code ${value}}, then data inputs, then exec outputs
 * (recursively compiled and re-indented), then {@code ${nodeId}}. A visited set
 * shared across all entries makes every node expand at most once, so exec
 * cycles terminate.</li>
 * <li><b>Data flow:</b> a data input resolves to the producing output's
 * template, itself filled in from the producer's own inputs. This yields one
 * nested expression per chain of value nodes. Resolution tracks the outputs
 * currently being expanded and fails on re-entry instead of recursing
 * forever.</li>
 * </ol>
 *
 * <p>
 * Generation reads the graph only. Callers must not mutate the graph while a
 * {@link #generate()} call is running.
 */
@Log4j2
public final class CodeGenerator {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final Graph graph;
    private final NodeCatalog catalog;
    private final Clock clock;

    public CodeGenerator(Graph graph, NodeCatalog catalog) {
        this(graph, catalog, Clock.systemUTC());
    }

    public CodeGenerator(Graph graph, NodeCatalog catalog, Clock clock) {
        this.graph = graph;
        this.catalog = catalog;
        this.clock = clock;
    }

    /**
     * Generates the code of the whole graph: a timestamped header followed by
     * the non-empty output of each entry node, separated by blank lines.
     *
     * @throws NoEntryPointException          if no node qualifies as an entry
     * @throws CyclicDataDependencyException if data links form a cycle
     */
    public String generate() {
        List<GraphNode> entries = entryNodes();
        if (entries.isEmpty())
            throw new NoEntryPointException();

        Set<Integer> visited = new HashSet<>();
        List<String> parts = new ArrayList<>(entries.size());
        for (GraphNode entry : entries) {
            String code = compileNode(entry, visited);
            if (!code.isEmpty())
                parts.add(code);
        }

        String comment = catalog.codeGeneration().commentStyle();
        String header = comment + " Generated Code from Node Graph\n"
                + comment + " Generated on: " + TIMESTAMP.format(clock.instant()) + "\n\n";
        log.info("Generated code from {} entry node(s), {} node(s) expanded", entries.size(), visited.size());
        return header + String.join("\n\n", parts);
    }

    /** Nodes with a declared exec input and no incoming exec link, in node order. */
    public List<GraphNode> entryNodes() {
        List<GraphNode> entries = new ArrayList<>();
        for (GraphNode n : graph.nodes()) {
            if (execInputDef(n) == null)
                continue;
            boolean incoming = false;
            for (GraphLink l : graph.linksInto(n.getId())) {
                Port to = graph.port(l.getTo());
                if (to != null && to.isExec()) {
                    incoming = true;
                    break;
                }
            }
            if (!incoming)
                entries.add(n);
        }
        return entries;
    }

    /**
     * Expands one node along control flow. Returns an empty string if the node
     * was already expanded (visited) or its type has no exec input template.
     */
    public String compileNode(GraphNode node, Set<Integer> visited) {
        if (!visited.add(node.getId()))
            return "";

        PortDef execIn = execInputDef(node);
        if (execIn == null || execIn.getCode() == null)
            return "";
        log.debug("Compiling {}", node);

        String code = fillValue(execIn.getCode(), node);
        code = fillDataInputs(code, node, new LinkedHashSet<>());

        for (GraphLink l : graph.linksFrom(node.getId())) {
            Port from = graph.port(l.getFrom());
            GraphNode next = graph.node(l.getTo().nodeId());
            if (from == null || !from.isExec() || next == null || from.getName() == null)
                continue;
            String block = compileNode(next, visited);
            code = Placeholders.splice(code, from.getName(), block);
        }

        code = Placeholders.fill(code, Placeholders.NODE_ID, String.valueOf(node.getId()));
        return Placeholders.strip(code);
    }

    /**
     * Expression text of output {@code outputIndex} of {@code node}, with its
     * data inputs resolved recursively. Unresolved placeholders are left in
     * place; the enclosing {@link #compileNode} strips them.
     *
     * @throws CyclicDataDependencyException if data links form a cycle
     */
    public String outputCode(GraphNode node, int outputIndex) {
        Port port = node.getOutputs().get(outputIndex);
        return outputCode(node, port, new LinkedHashSet<>());
    }

    private String outputCode(GraphNode node, Port port, Set<String> resolving) {
        String key = node.getId() + "." + (port.getName() != null ? port.getName() : port.getKind());
        if (resolving.contains(key)) {
            List<String> path = new ArrayList<>();
            boolean onCycle = false;
            for (String k : resolving) {
                onCycle |= k.equals(key);
                if (onCycle)
                    path.add(k);
            }
            path.add(key);
            throw new CyclicDataDependencyException(path);
        }

        NodeTypeDef def = catalog.find(node.getCategory(), node.getType());
        if (def == null || def.getOutputs() == null)
            return "";
        PortDef outDef = null;
        for (PortDef o : def.getOutputs()) {
            if (Objects.equals(o.getName(), port.getName()) || Objects.equals(o.getType(), port.getKind())) {
                outDef = o;
                break;
            }
        }
        if (outDef == null || outDef.getCode() == null)
            return "";

        resolving.add(key);
        try {
            String code = fillValue(outDef.getCode(), node);
            code = fillDataInputs(code, node, resolving);
            return Placeholders.fill(code, Placeholders.NODE_ID, String.valueOf(node.getId()));
        } finally {
            resolving.remove(key);
        }
    }

    private String fillValue(String code, GraphNode node) {
        if (node.hasValue() && node.getValue() != null)
            return Placeholders.fill(code, Placeholders.VALUE, Placeholders.render(node.getValue()));
        return code;
    }

    /** Substitutes {@code ${inputName}} for every data link arriving at {@code node}. */
    private String fillDataInputs(String code, GraphNode node, Set<String> resolving) {
        for (GraphLink l : graph.linksInto(node.getId())) {
            Port to = graph.port(l.getTo());
            GraphNode producer = graph.node(l.getFrom().nodeId());
            Port producerPort = graph.port(l.getFrom());
            if (to == null || to.isExec() || to.getName() == null || producer == null || producerPort == null)
                continue;
            String value = outputCode(producer, producerPort, resolving);
            code = Placeholders.fill(code, to.getName(), value);
        }
        return code;
    }

    /** First exec input declared by the node's definition, implicit ports included. */
    private PortDef execInputDef(GraphNode node) {
        NodeTypeDef def = catalog.find(node.getCategory(), node.getType());
        if (def == null || def.getInputs() == null)
            return null;
        for (PortDef p : def.getInputs())
            if (PortKinds.isExec(p.getType()))
                return p;
        return null;
    }
}
