package com.nodegraph.codegen.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Directed edge from an output port to an input port. Owned by the
 * {@link Graph}, not by either endpoint node.
 */
@Getter
public final class GraphLink {
    private final int id;
    private final PortRef from;
    private final PortRef to;
    @Setter
    private boolean selected;

    GraphLink(int id, PortRef from, PortRef to) {
        this.id = id;
        this.from = from;
        this.to = to;
    }

    /** True if either endpoint belongs to {@code nodeId}. */
    public boolean touches(int nodeId) {
        return from.nodeId() == nodeId || to.nodeId() == nodeId;
    }

    public boolean joins(PortRef a, PortRef b) {
        return from.equals(a) && to.equals(b);
    }

    @Override
    public String toString() {
        return "Link#" + id + "(" + from + " -> " + to + ")";
    }
}
