package com.nodegraph.codegen;

import com.nodegraph.codegen.io.JsonCodec;
import com.nodegraph.codegen.io.LoadReport;
import com.nodegraph.codegen.util.GraphExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads the bundled example registry and graph, then prints the generated
 * code.
 */
public class CodeGenDemo {
    private static final Logger log = LogManager.getLogger(CodeGenDemo.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting code generation demo...");

        // 1. Registry, then the saved graph
        var graph = new CodeGraph();
        graph.addRegistry(JsonCodec.readRegistryResource("/examples/core-nodes.json"));
        LoadReport report = graph.loadGraph(JsonCodec.readGraphResource("/examples/hello-graph.json"));
        log.info("Loaded {} nodes, {} links (clean: {})", report.nodesLoaded(), report.linksLoaded(),
                report.isClean());

        // 2. Topology for reference
        log.info("Graph:\n{}", new GraphExplain(graph.getGraph()).toMermaid());

        // 3. Code
        log.info("Generated code:\n{}", graph.exportCode());
    }
}
