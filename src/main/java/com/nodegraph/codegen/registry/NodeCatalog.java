package com.nodegraph.codegen.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.nodegraph.codegen.io.JsonCodec;
import com.nodegraph.codegen.io.RegistryDefinition;
import com.nodegraph.codegen.io.RegistryDefinition.CategoryDef;
import com.nodegraph.codegen.io.RegistryDefinition.NodeTypeDef;
import com.nodegraph.codegen.model.ValueType;

import lombok.extern.log4j.Log4j2;

/**
 * Lookup table of node type definitions keyed by category, then type.
 *
 * <p>
 * Populated by merging {@link RegistryDefinition} documents. Merging is
 * additive: an unknown category is added wholesale, a known one gets its node
 * entries added or overwritten. Nothing is ever removed except by
 * {@link #clear()}.
 */
@Log4j2
public final class NodeCatalog {
    static final String DEFAULT_CATEGORY = "default";
    static final String DEFAULT_CATEGORY_COLOR = "#808080";

    /** A category and its node types, in declaration order. Read-only outside the catalog. */
    public record Category(String color, Map<String, NodeTypeDef> nodes) {
        @Override
        public Map<String, NodeTypeDef> nodes() {
            return Collections.unmodifiableMap(nodes);
        }
    }

    private final Map<String, Category> categories = new LinkedHashMap<>();
    private final TypeRegistry types = new TypeRegistry();
    private CodeGenerationConfig codeGeneration = CodeGenerationConfig.DEFAULTS;
    private boolean loaded;

    /**
     * Merges a registry document into this catalog. Definitions are copied, so
     * later changes to {@code registry} do not reach the catalog. Entries with
     * an unusable value slot are skipped with a warning.
     */
    public NodeCatalog merge(RegistryDefinition registry) {
        if (registry == null)
            throw new IllegalArgumentException("registry must not be null");

        codeGeneration = codeGeneration.withOverrides(registry.getCodeGeneration());
        types.merge(registry.getDataTypes());

        int added = 0;
        if (registry.getNodeCategories() != null) {
            for (Map.Entry<String, CategoryDef> e : registry.getNodeCategories().entrySet()) {
                CategoryDef def = e.getValue();
                Category category = categories.computeIfAbsent(e.getKey(),
                        k -> new Category(def != null ? def.getColor() : null, new LinkedHashMap<>()));
                if (def == null || def.getNodes() == null)
                    continue;
                for (Map.Entry<String, NodeTypeDef> n : def.getNodes().entrySet())
                    if (put(category, e.getKey(), n.getKey(), n.getValue()))
                        added++;
            }
        }

        if (registry.getNodeTypes() != null) {
            for (Map.Entry<String, NodeTypeDef> e : registry.getNodeTypes().entrySet()) {
                NodeTypeDef def = e.getValue();
                String name = def != null && def.getCategory() != null ? def.getCategory() : DEFAULT_CATEGORY;
                Category category = categories.computeIfAbsent(name,
                        k -> new Category(DEFAULT_CATEGORY_COLOR, new LinkedHashMap<>()));
                if (put(category, name, e.getKey(), def))
                    added++;
            }
        }

        loaded = true;
        log.info("Merged registry: {} node type entries, {} categories total", added, categories.size());
        return this;
    }

    private static boolean put(Category category, String categoryName, String type, NodeTypeDef def) {
        if (def == null) {
            log.warn("Skipping node type {}/{}: empty definition", categoryName, type);
            return false;
        }
        if (def.getValue() != null) {
            try {
                ValueType.fromString(def.getValue().getType());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping node type {}/{}: {}", categoryName, type, e.getMessage());
                return false;
            }
        }
        category.nodes.put(type, JsonCodec.copy(def, NodeTypeDef.class));
        return true;
    }

    /** Returns the definition, or null when the pair is unknown. */
    public NodeTypeDef find(String category, String type) {
        Category c = categories.get(category);
        if (c == null)
            return null;
        return c.nodes().get(type);
    }

    /**
     * Returns the definition of {@code category/type}.
     *
     * @throws DefinitionNotFoundException if nothing is registered under it
     */
    public NodeTypeDef require(String category, String type) {
        NodeTypeDef def = loaded ? find(category, type) : null;
        if (def == null)
            throw new DefinitionNotFoundException(category, type);
        return def;
    }

    /** Node color, falling back to the category color. */
    public String colorOf(String category, String type) {
        NodeTypeDef def = find(category, type);
        if (def != null && def.getColor() != null)
            return def.getColor();
        Category c = categories.get(category);
        return c != null ? c.color() : null;
    }

    public Map<String, Category> categories() {
        return Collections.unmodifiableMap(categories);
    }

    public TypeRegistry types() {
        return types;
    }

    public CodeGenerationConfig codeGeneration() {
        return codeGeneration;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public void clear() {
        categories.clear();
        types.clear();
        codeGeneration = CodeGenerationConfig.DEFAULTS;
        loaded = false;
    }
}
