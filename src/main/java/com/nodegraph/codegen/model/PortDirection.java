package com.nodegraph.codegen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Which side of a node a port sits on. */
public enum PortDirection {
    INPUT("input"),
    OUTPUT("output");

    private final String label;

    PortDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static PortDirection fromString(String text) {
        for (PortDirection d : values()) {
            if (d.label.equalsIgnoreCase(text)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown port direction: " + text);
    }
}
