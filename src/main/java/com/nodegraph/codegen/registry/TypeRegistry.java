package com.nodegraph.codegen.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.nodegraph.codegen.io.RegistryDefinition;

/**
 * Display metadata for port value types.
 *
 * <p>
 * Purely advisory: connection rules only look at kind strings and the two
 * reserved names in {@link PortKinds}. A kind with no entry here is still a
 * valid data kind, it just has no name or color to show.
 */
public final class TypeRegistry {

    /** Metadata of one registered type. */
    public record DataType(String name, String color) {
    }

    private final Map<String, DataType> types = new LinkedHashMap<>();

    /** Adds or overwrites entries, key by key. */
    public void merge(Map<String, RegistryDefinition.DataTypeDef> defs) {
        if (defs == null)
            return;
        for (Map.Entry<String, RegistryDefinition.DataTypeDef> e : defs.entrySet()) {
            RegistryDefinition.DataTypeDef d = e.getValue();
            types.put(e.getKey(), d == null ? new DataType(e.getKey(), null) : new DataType(d.getName(), d.getColor()));
        }
    }

    /** Returns the metadata for {@code kind}, or null when it was never registered. */
    public DataType get(String kind) {
        return types.get(kind);
    }

    public boolean isRegistered(String kind) {
        return types.containsKey(kind);
    }

    /** Display name, falling back to the kind string itself. */
    public String displayName(String kind) {
        DataType t = types.get(kind);
        return t != null && t.name() != null ? t.name() : kind;
    }

    public Map<String, DataType> all() {
        return Collections.unmodifiableMap(types);
    }

    public void clear() {
        types.clear();
    }
}
