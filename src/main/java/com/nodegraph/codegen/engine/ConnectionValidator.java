package com.nodegraph.codegen.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.nodegraph.codegen.model.Graph;
import com.nodegraph.codegen.model.GraphLink;
import com.nodegraph.codegen.model.Port;
import com.nodegraph.codegen.model.PortDirection;
import com.nodegraph.codegen.model.PortRef;
import com.nodegraph.codegen.registry.PortKinds;

import lombok.extern.log4j.Log4j2;

/**
 * Single source of truth for link legality.
 *
 * <p>
 * Invariants kept on the {@link Graph}:
 * <ol>
 * <li>No link joins two ports of the same node.</li>
 * <li>Every link goes from an output to an input.</li>
 * <li>Endpoint kinds satisfy {@link #typesCompatible(String, String)}.</li>
 * <li>A non-exec input has at most one incoming link.</li>
 * <li>An exec output has at most one outgoing link; exec inputs take any
 * number.</li>
 * <li>No two links join the same ordered pair of ports.</li>
 * </ol>
 * A rejected connection is reported as {@code false} / empty, never as an
 * exception.
 */
@Log4j2
public final class ConnectionValidator {
    private final Graph graph;

    public ConnectionValidator(Graph graph) {
        this.graph = graph;
    }

    /**
     * Kind compatibility of an output ({@code fromKind}) feeding an input
     * ({@code toKind}). Exec only pairs with exec. A {@code data} input accepts
     * any data producer, but a {@code data} producer cannot feed a specifically
     * typed input. Any other pair must match exactly.
     */
    public static boolean typesCompatible(String fromKind, String toKind) {
        boolean fromExec = PortKinds.isExec(fromKind);
        boolean toExec = PortKinds.isExec(toKind);
        if (fromExec && toExec)
            return true;
        if (fromExec || toExec)
            return false;
        if (fromKind != null && fromKind.equals(toKind))
            return true;
        // one-directional wildcard: data -> bool is refused, bool -> data accepted
        return PortKinds.isWildcard(toKind);
    }

    /**
     * Decides whether a link between the two ports may be created. Argument
     * order does not matter; the output side is identified from the
     * directions.
     */
    public boolean canConnect(PortRef a, PortRef b) {
        Port portA = graph.port(a);
        Port portB = graph.port(b);
        if (portA == null || portB == null)
            return false;
        if (a.nodeId() == b.nodeId())
            return false;
        if (a.direction() == b.direction())
            return false;

        PortRef out = a.isOutput() ? a : b;
        PortRef in = a.isOutput() ? b : a;
        Port outPort = a.isOutput() ? portA : portB;
        Port inPort = a.isOutput() ? portB : portA;

        if (!typesCompatible(outPort.getKind(), inPort.getKind()))
            return false;

        for (GraphLink l : graph.links()) {
            if (l.joins(out, in) || l.joins(in, out))
                return false;
        }

        if (!inPort.isExec()) {
            for (GraphLink l : graph.links())
                if (l.getTo().equals(in))
                    return false;
        }
        return true;
    }

    /**
     * Creates the link if {@link #canConnect} allows it. Connecting an exec
     * output that is already wired replaces its existing link.
     *
     * @return the new link, or empty if the connection was rejected
     */
    public Optional<GraphLink> connect(PortRef a, PortRef b) {
        if (!canConnect(a, b)) {
            log.debug("Rejected connection {} <-> {}", a, b);
            return Optional.empty();
        }
        PortRef out = a.isOutput() ? a : b;
        PortRef in = a.isOutput() ? b : a;

        if (graph.port(out).isExec()) {
            List<GraphLink> replaced = graph.removeLinks(l -> l.getFrom().equals(out));
            if (!replaced.isEmpty())
                log.debug("Exec output {} rewired, dropped {}", out, replaced);
        }
        return Optional.of(graph.addLink(out, in));
    }

    /**
     * Graph-wide repair pass. Drops links whose endpoints vanished, whose
     * directions or kinds no longer line up, and surplus links on exec outputs
     * and data inputs (the first link in link order is kept). Idempotent.
     *
     * @return the removed links, in their former link order
     */
    public List<GraphLink> validateConnections() {
        Set<GraphLink> invalid = new HashSet<>();
        Map<PortRef, List<GraphLink>> execOutputs = new LinkedHashMap<>();
        Map<PortRef, List<GraphLink>> dataInputs = new LinkedHashMap<>();

        for (GraphLink l : graph.links()) {
            Port from = graph.port(l.getFrom());
            Port to = graph.port(l.getTo());
            if (from == null || to == null
                    || l.getFrom().nodeId() == l.getTo().nodeId()
                    || l.getFrom().direction() != PortDirection.OUTPUT
                    || l.getTo().direction() != PortDirection.INPUT
                    || !typesCompatible(from.getKind(), to.getKind())) {
                invalid.add(l);
                continue;
            }
            if (from.isExec())
                execOutputs.computeIfAbsent(l.getFrom(), k -> new ArrayList<>()).add(l);
            if (!to.isExec())
                dataInputs.computeIfAbsent(l.getTo(), k -> new ArrayList<>()).add(l);
        }

        markSurplus(execOutputs, invalid);
        markSurplus(dataInputs, invalid);

        if (invalid.isEmpty())
            return List.of();
        return graph.removeLinks(invalid::contains);
    }

    private static void markSurplus(Map<PortRef, List<GraphLink>> groups, Set<GraphLink> invalid) {
        for (List<GraphLink> group : groups.values())
            for (int i = 1; i < group.size(); i++)
                invalid.add(group.get(i));
    }
}
