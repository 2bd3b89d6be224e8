package com.nodegraph.codegen.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a node registry document.
 *
 * <p>
 * A registry declares data types, node categories and the node types inside
 * them. Several registries can be merged into one
 * {@link com.nodegraph.codegen.registry.NodeCatalog}; later documents add to
 * or overwrite earlier ones but never delete entries.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RegistryDefinition {
    private String version;
    private CodeGenerationDef codeGeneration;
    private Map<String, DataTypeDef> dataTypes;
    private Map<String, CategoryDef> nodeCategories;
    /** Flat legacy layout; each entry is filed under its own category. */
    private Map<String, NodeTypeDef> nodeTypes;

    /** Settings for the emitted source text. Absent fields leave the current value. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CodeGenerationDef {
        private String language, indentation, variablePrefix, resultPrefix, commentStyle;
    }

    /** Display metadata of a port value type. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DataTypeDef {
        private String name, color;
    }

    /** A named group of node types. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CategoryDef {
        private String color;
        private Map<String, NodeTypeDef> nodes;
    }

    /** Prototype from which node instances are built. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeTypeDef {
        private String title, category, color, description;
        private List<PortDef> inputs;
        private List<PortDef> outputs;
        private ValueDef value;
        private StyleDef style;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class PortDef {
        private String type, name, code;
        private boolean implicit;
        private DynamicDef dynamic;
    }

    /** Naming hint for ports that grow at edit time; carried through for the UI. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DynamicDef {
        private String naming, delimiter;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ValueDef {
        private String type;
        // scalar, string or list (float3)
        @JsonProperty("default")
        private Object defaultValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StyleDef {
        private Integer minWidth;
    }
}
