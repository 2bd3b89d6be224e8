package com.nodegraph.codegen.model;

/** Type of the editable value slot a node definition may declare. */
public enum ValueType {
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    COLOR("color"),
    /** Three component vector, held as a list of numbers. */
    FLOAT3("float3");

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ValueType fromString(String text) {
        for (ValueType t : values()) {
            if (t.label.equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown value type: " + text);
    }
}
