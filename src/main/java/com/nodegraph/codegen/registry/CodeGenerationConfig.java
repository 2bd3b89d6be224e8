package com.nodegraph.codegen.registry;

import com.nodegraph.codegen.io.RegistryDefinition;

/**
 * Settings of the emitted text. Only {@code commentStyle} is consumed by the
 * generator itself (for the file header); the rest is forwarded to templates
 * authors and tooling.
 */
public record CodeGenerationConfig(String language, String indentation, String variablePrefix,
        String resultPrefix, String commentStyle) {

    public static final CodeGenerationConfig DEFAULTS = new CodeGenerationConfig("flex", "    ", "var_", "result_",
            "//");

    /** Field-wise merge: every non-null field of {@code def} replaces ours. */
    public CodeGenerationConfig withOverrides(RegistryDefinition.CodeGenerationDef def) {
        if (def == null)
            return this;
        return new CodeGenerationConfig(
                def.getLanguage() != null ? def.getLanguage() : language,
                def.getIndentation() != null ? def.getIndentation() : indentation,
                def.getVariablePrefix() != null ? def.getVariablePrefix() : variablePrefix,
                def.getResultPrefix() != null ? def.getResultPrefix() : resultPrefix,
                def.getCommentStyle() != null ? def.getCommentStyle() : commentStyle);
    }
}
