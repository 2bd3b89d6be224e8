package com.nodegraph.codegen.engine;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.nodegraph.codegen.io.JsonCodec;

/**
 * Text operations on {@code ${name}} placeholders inside code templates.
 */
final class Placeholders {
    static final String VALUE = "value";
    static final String NODE_ID = "nodeId";

    private static final Pattern UNRESOLVED_LINE = Pattern.compile("\\n[ \\t]*\\$\\{[^}]+\\}");
    private static final Pattern UNRESOLVED = Pattern.compile("\\$\\{[^}]+\\}");

    private Placeholders() {
    }

    static String token(String name) {
        return "${" + name + "}";
    }

    /** Replaces every occurrence of {@code ${name}} with {@code text}. */
    static String fill(String template, String name, String text) {
        return template.replace(token(name), text);
    }

    /**
     * Replaces every occurrence of {@code ${name}} with a multi-line block. Each
     * block line gets the whitespace that preceded the placeholder; a newline in
     * front of the placeholder is kept. An empty block removes the placeholder
     * together with that newline and indent.
     */
    static String splice(String template, String name, String block) {
        Pattern p = Pattern.compile("(\\n)?([\\t ]*)" + Pattern.quote(token(name)));
        Matcher m = p.matcher(template);
        return m.replaceAll(r -> {
            if (block.isEmpty())
                return "";
            String nl = r.group(1) != null ? r.group(1) : "";
            String indent = r.group(2);
            return Matcher.quoteReplacement(nl + indent + block.replace("\n", "\n" + indent));
        });
    }

    /** Drops placeholders nothing resolved, with their leading newline and indent if any. */
    static String strip(String template) {
        String s = UNRESOLVED_LINE.matcher(template).replaceAll("");
        return UNRESOLVED.matcher(s).replaceAll("");
    }

    /** Text form of a node value: structured values as JSON, scalars as plain text. */
    static String render(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value != null && value.getClass().isArray())
            return JsonCodec.toJson(value);
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d))
                return String.valueOf(d);
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
