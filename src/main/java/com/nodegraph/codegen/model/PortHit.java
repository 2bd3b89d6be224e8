package com.nodegraph.codegen.model;

/** Result of a port hit test: the port together with its address. */
public record PortHit(GraphNode node, PortDirection direction, int index, Port port) {

    public PortRef ref() {
        return new PortRef(node.getId(), direction, index);
    }
}
