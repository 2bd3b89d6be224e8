package com.nodegraph.codegen.engine;

/**
 * Thrown by {@link CodeGenerator#generate()} when no node has an unconnected
 * exec input, i.e. there is no root to start emitting from.
 */
public class NoEntryPointException extends IllegalStateException {

    public NoEntryPointException() {
        super("No entry point nodes (exec input without incoming exec).");
    }
}
