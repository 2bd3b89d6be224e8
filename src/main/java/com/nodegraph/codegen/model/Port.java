package com.nodegraph.codegen.model;

import com.nodegraph.codegen.io.RegistryDefinition;
import com.nodegraph.codegen.registry.PortKinds;

import lombok.Getter;

/**
 * Per-instance copy of a port declared by a node type.
 *
 * <p>
 * The position is layout state derived by {@link GraphNode#updatePortPositions()};
 * it is not part of the port's identity.
 */
@Getter
public final class Port {

    /** Naming hint for ports that grow at edit time. Forwarded to the UI only. */
    public record Dynamic(String naming, String delimiter) {
    }

    private String kind;
    private String name;
    private String code;
    private Dynamic dynamic;
    private double x;
    private double y;

    Port(RegistryDefinition.PortDef def) {
        refresh(def);
    }

    /** Re-reads kind, name, template and naming hint from a (reloaded) definition. */
    void refresh(RegistryDefinition.PortDef def) {
        this.kind = def.getType();
        this.name = def.getName();
        this.code = def.getCode();
        this.dynamic = def.getDynamic() == null ? null
                : new Dynamic(def.getDynamic().getNaming(), def.getDynamic().getDelimiter());
    }

    void moveTo(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public boolean isExec() {
        return PortKinds.isExec(kind);
    }

    @Override
    public String toString() {
        return (name != null ? name : "?") + ":" + kind;
    }
}
