package com.nodegraph.codegen.engine;

import java.util.List;

/**
 * Thrown when resolving a value expression re-enters an output that is
 * already being resolved, i.e. data links form a cycle.
 */
public class CyclicDataDependencyException extends IllegalStateException {

    private final List<String> path;

    public CyclicDataDependencyException(List<String> path) {
        super("Cyclic data dependency: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /** The outputs on the cycle, starting and ending with the re-entered one. */
    public List<String> path() {
        return path;
    }
}
