package com.nodegraph.codegen.model;

/**
 * Address of a port inside a {@link Graph}: owning node id, side and position
 * in that side's port list. Links hold these instead of object references, so
 * a deleted node leaves detectable (never dangling) references behind.
 */
public record PortRef(int nodeId, PortDirection direction, int index) {

    public static PortRef input(int nodeId, int index) {
        return new PortRef(nodeId, PortDirection.INPUT, index);
    }

    public static PortRef output(int nodeId, int index) {
        return new PortRef(nodeId, PortDirection.OUTPUT, index);
    }

    public boolean isInput() {
        return direction == PortDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PortDirection.OUTPUT;
    }

    @Override
    public String toString() {
        return nodeId + ":" + direction.label() + "[" + index + "]";
    }
}
