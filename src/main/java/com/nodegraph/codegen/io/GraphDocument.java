package com.nodegraph.codegen.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a saved graph: node placements and the links between
 * their ports. Node types are referenced by (category, type) and resolved
 * against the catalog on load.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphDocument {
    public static final String CURRENT_VERSION = "1.0";

    private String version;
    private String name, description, author;
    private List<NodeEntry> nodes = new ArrayList<>();
    private List<ConnectionEntry> connections = new ArrayList<>();

    /** One placed node. {@code value} is omitted for nodes without a value slot. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeEntry {
        private int id;
        private String type, category;
        private double x, y;
        private Object value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionEntry {
        private int id;
        private Endpoint from;
        private Endpoint to;
    }

    /** A port address as stored on disk. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Endpoint {
        private int nodeId;
        private int portIndex;
        /** {@code "input"} or {@code "output"}; parsed on load so a bad value only drops its own link. */
        private String portType;
    }
}
