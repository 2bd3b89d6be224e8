package com.nodegraph.codegen.registry;

/**
 * Thrown when a node is instantiated from a (category, type) pair that no
 * loaded registry defines.
 */
public class DefinitionNotFoundException extends IllegalArgumentException {

    private final String category;
    private final String type;

    public DefinitionNotFoundException(String category, String type) {
        super("Node registry not loaded or node type not found: " + category + "/" + type);
        this.category = category;
        this.type = type;
    }

    public String category() {
        return category;
    }

    public String type() {
        return type;
    }
}
