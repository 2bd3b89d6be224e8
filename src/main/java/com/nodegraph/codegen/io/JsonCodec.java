package com.nodegraph.codegen.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Jackson entry points for the two JSON documents this library exchanges: the
 * node registry ({@link RegistryDefinition}) and the saved graph
 * ({@link GraphDocument}).
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private JsonCodec() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // ── Registry ────────────────────────────────────────────────────

    /** Parses a registry document. */
    public static RegistryDefinition readRegistry(String json) {
        return read(json, RegistryDefinition.class, "registry");
    }

    public static RegistryDefinition readRegistry(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), RegistryDefinition.class);
    }

    /** Loads a registry bundled on the classpath, e.g. {@code "/examples/core-nodes.json"}. */
    public static RegistryDefinition readRegistryResource(String resource) throws IOException {
        try (InputStream in = open(resource)) {
            return MAPPER.readValue(in, RegistryDefinition.class);
        }
    }

    // ── Graph ───────────────────────────────────────────────────────

    public static GraphDocument readGraph(String json) {
        return read(json, GraphDocument.class, "graph");
    }

    public static GraphDocument readGraph(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), GraphDocument.class);
    }

    public static GraphDocument readGraphResource(String resource) throws IOException {
        try (InputStream in = open(resource)) {
            return MAPPER.readValue(in, GraphDocument.class);
        }
    }

    /** Pretty-printed graph document. */
    public static String writeGraph(GraphDocument doc) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph document", e);
        }
    }

    public static void writeGraph(GraphDocument doc, Path path) throws IOException {
        Files.writeString(path, writeGraph(doc));
    }

    /** Compact JSON text of an arbitrary value (lists, maps, arrays). */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value " + value, e);
        }
    }

    /**
     * Deep copy through the JSON tree model: the result shares no mutable state
     * with {@code value}. Null stays null.
     */
    public static <T> T copy(T value, Class<T> type) {
        if (value == null)
            return null;
        return MAPPER.convertValue(value, type);
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + what + " document: " + e.getOriginalMessage(), e);
        }
    }

    private static InputStream open(String resource) throws IOException {
        InputStream in = JsonCodec.class.getResourceAsStream(resource);
        if (in == null)
            throw new IOException("Resource not found: " + resource);
        return in;
    }
}
