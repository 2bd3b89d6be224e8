package com.nodegraph.codegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.nodegraph.codegen.io.JsonCodec;
import com.nodegraph.codegen.io.RegistryDefinition.NodeTypeDef;
import com.nodegraph.codegen.io.RegistryDefinition.PortDef;
import com.nodegraph.codegen.registry.NodeCatalog;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * A node instance built from a catalog definition.
 *
 * <p>
 * The input and output port lists are fixed in count and order for the life of
 * the node: they are copied once from the definition, skipping ports marked
 * implicit. Layout follows a fixed rule: ports are stacked below the title
 * band, inputs flush left and outputs flush right.
 */
@Getter
public final class GraphNode {
    static final double DEFAULT_MIN_WIDTH = 80;
    static final double MIN_HEIGHT = 60;
    static final double TITLE_HEIGHT = 40;
    static final double PORT_SPACING = 25;
    static final double PORT_INSET = 10;
    static final double VALUE_ROW_HEIGHT = 30;
    static final double PORT_RADIUS = 8;

    private final int id;
    private final String category;
    private final String type;
    private final String title;
    private final String color;
    private final List<Port> inputs;
    private final List<Port> outputs;
    @Getter(AccessLevel.NONE)
    private final boolean hasValue;
    private final ValueType valueType;
    private Object value;
    private double x;
    private double y;
    private double width;
    private double height;
    @Setter
    private boolean selected;

    private GraphNode(int id, double x, double y, String category, String type, NodeTypeDef def, String color) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.category = category;
        this.type = type;
        this.title = def.getTitle();
        this.color = color;

        this.hasValue = def.getValue() != null;
        if (hasValue) {
            this.valueType = ValueType.fromString(def.getValue().getType());
            // each node owns its value; structured defaults must not be shared
            this.value = JsonCodec.copy(def.getValue().getDefaultValue(), Object.class);
        } else {
            this.valueType = null;
        }

        this.inputs = copyPorts(def.getInputs());
        this.outputs = copyPorts(def.getOutputs());

        Integer minWidth = def.getStyle() != null ? def.getStyle().getMinWidth() : null;
        this.width = minWidth != null && minWidth > 0 ? minWidth : DEFAULT_MIN_WIDTH;
        int maxPorts = Math.max(inputs.size(), outputs.size());
        this.height = Math.max(MIN_HEIGHT, TITLE_HEIGHT + maxPorts * PORT_SPACING);
        if (hasValue)
            this.height += VALUE_ROW_HEIGHT;

        updatePortPositions();
    }

    /**
     * Builds a node from the catalog entry {@code category/type}.
     *
     * @throws com.nodegraph.codegen.registry.DefinitionNotFoundException
     *         if the catalog has no such entry
     */
    static GraphNode create(int id, double x, double y, String category, String type, NodeCatalog catalog) {
        NodeTypeDef def = catalog.require(category, type);
        return new GraphNode(id, x, y, category, type, def, catalog.colorOf(category, type));
    }

    private static List<Port> copyPorts(List<PortDef> defs) {
        if (defs == null)
            return Collections.emptyList();
        List<Port> ports = new ArrayList<>(defs.size());
        for (PortDef d : defs)
            if (!d.isImplicit())
                ports.add(new Port(d));
        return Collections.unmodifiableList(ports);
    }

    /**
     * Re-reads port kinds, names and templates after a registry reload. Only
     * applied when the number of visible ports is unchanged.
     *
     * @return true if the ports were refreshed
     */
    boolean refreshPorts(NodeTypeDef def) {
        List<PortDef> in = visible(def.getInputs());
        List<PortDef> out = visible(def.getOutputs());
        if (in.size() != inputs.size() || out.size() != outputs.size())
            return false;
        for (int i = 0; i < in.size(); i++)
            inputs.get(i).refresh(in.get(i));
        for (int i = 0; i < out.size(); i++)
            outputs.get(i).refresh(out.get(i));
        return true;
    }

    private static List<PortDef> visible(List<PortDef> defs) {
        if (defs == null)
            return List.of();
        return defs.stream().filter(d -> !d.isImplicit()).toList();
    }

    /** Recomputes port positions from the node's origin and width. Idempotent. */
    public void updatePortPositions() {
        for (int i = 0; i < inputs.size(); i++)
            inputs.get(i).moveTo(x + PORT_INSET, y + TITLE_HEIGHT + i * PORT_SPACING);
        for (int i = 0; i < outputs.size(); i++)
            outputs.get(i).moveTo(x + width - PORT_INSET, y + TITLE_HEIGHT + i * PORT_SPACING);
    }

    public void moveTo(double x, double y) {
        this.x = x;
        this.y = y;
        updatePortPositions();
    }

    /** Resizes horizontally, e.g. after the renderer measured the title. */
    public void setWidth(double width) {
        this.width = width;
        updatePortPositions();
    }

    /** True if the definition declares a value slot. */
    public boolean hasValue() {
        return hasValue;
    }

    public void setValue(Object value) {
        if (!hasValue)
            throw new IllegalStateException("Node " + id + " (" + category + "/" + type + ") has no value slot");
        this.value = value;
    }

    public boolean containsPoint(double px, double py) {
        return px >= x && px <= x + width && py >= y && py <= y + height;
    }

    /** Returns the port within the hit radius of the point, inputs first, or null. */
    public PortHit portAt(double px, double py) {
        double r2 = PORT_RADIUS * PORT_RADIUS;
        for (int i = 0; i < inputs.size(); i++) {
            Port p = inputs.get(i);
            double dx = px - p.getX(), dy = py - p.getY();
            if (dx * dx + dy * dy <= r2)
                return new PortHit(this, PortDirection.INPUT, i, p);
        }
        for (int i = 0; i < outputs.size(); i++) {
            Port p = outputs.get(i);
            double dx = px - p.getX(), dy = py - p.getY();
            if (dx * dx + dy * dy <= r2)
                return new PortHit(this, PortDirection.OUTPUT, i, p);
        }
        return null;
    }

    public List<Port> ports(PortDirection direction) {
        return direction == PortDirection.INPUT ? inputs : outputs;
    }

    /** Port at {@code index} on the given side, or null when out of range. */
    public Port port(PortDirection direction, int index) {
        List<Port> ports = ports(direction);
        return index >= 0 && index < ports.size() ? ports.get(index) : null;
    }

    /** Number of exec outputs; the UI labels them only when there is more than one. */
    public int execOutputCount() {
        int n = 0;
        for (Port p : outputs)
            if (p.isExec())
                n++;
        return n;
    }

    @Override
    public String toString() {
        return "Node#" + id + "(" + category + "/" + type + ")";
    }
}
