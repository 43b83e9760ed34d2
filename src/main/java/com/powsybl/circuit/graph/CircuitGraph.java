/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.circuit.net.NetKey;
import com.powsybl.circuit.net.NetRegistry;
import com.powsybl.commons.PowsyblException;
import org.jgrapht.Graph;
import org.jgrapht.graph.Pseudograph;

import java.util.*;

/**
 * Bipartite multigraph of component instances and canonical nets, edges being labeled with the
 * component terminal. Iteration orders are insertion orders.
 *
 * @author PowSyBl circuit topology team
 */
public class CircuitGraph {

    private Graph<CircuitVertex, TerminalEdge> graph = new Pseudograph<>(null, null, false);

    private final Map<String, ComponentNode> declaredComponents = new LinkedHashMap<>();

    private final List<ComponentNode> internalComponents = new ArrayList<>();

    private final Map<NetKey, NetNode> netNodes = new LinkedHashMap<>();

    public ComponentNode addComponent(ComponentNode component) {
        Objects.requireNonNull(component);
        if (component.isInternal()) {
            internalComponents.add(component);
        } else if (declaredComponents.putIfAbsent(component.getName(), component) != null) {
            throw new PowsyblException("Component '" + component.getName() + "' already exists in circuit graph");
        }
        graph.addVertex(component);
        return component;
    }

    public boolean hasComponent(String name) {
        return declaredComponents.containsKey(name);
    }

    /**
     * Declared component of the given name.
     */
    public Optional<ComponentNode> getComponent(String name) {
        return Optional.ofNullable(declaredComponents.get(name));
    }

    public ComponentNode getComponentOrThrow(String name) {
        return getComponent(name)
                .orElseThrow(() -> new PowsyblException("Component '" + name + "' not found in circuit graph"));
    }

    public Collection<ComponentNode> getDeclaredComponents() {
        return Collections.unmodifiableCollection(declaredComponents.values());
    }

    public List<ComponentNode> getInternalComponents() {
        return Collections.unmodifiableList(internalComponents);
    }

    /**
     * Declared components followed by internal ones.
     */
    public List<ComponentNode> getComponents() {
        List<ComponentNode> components = new ArrayList<>(declaredComponents.size() + internalComponents.size());
        components.addAll(declaredComponents.values());
        components.addAll(internalComponents);
        return components;
    }

    public NetNode getOrCreateNetNode(NetKey key) {
        return netNodes.computeIfAbsent(Objects.requireNonNull(key), k -> {
            NetNode netNode = new NetNode(k);
            graph.addVertex(netNode);
            return netNode;
        });
    }

    public Optional<NetNode> getNetNode(NetKey key) {
        return Optional.ofNullable(netNodes.get(key));
    }

    public Collection<NetNode> getNetNodes() {
        return Collections.unmodifiableCollection(netNodes.values());
    }

    public TerminalEdge addEdge(ComponentNode component, NetNode net, String terminal) {
        if (!graph.containsVertex(component)) {
            throw new PowsyblException("Component '" + component.getName() + "' is not part of the circuit graph");
        }
        if (!graph.containsVertex(net)) {
            throw new PowsyblException("Net '" + net.key().getName() + "' is not part of the circuit graph");
        }
        TerminalEdge edge = new TerminalEdge(terminal);
        graph.addEdge(component, net, edge);
        return edge;
    }

    /**
     * Edges incident to a vertex, in insertion order.
     */
    public List<TerminalEdge> getEdges(CircuitVertex vertex) {
        return new ArrayList<>(graph.edgesOf(vertex));
    }

    public NetNode getNet(TerminalEdge edge) {
        CircuitVertex source = graph.getEdgeSource(edge);
        return (NetNode) (source.getKind() == CircuitVertex.Kind.NET ? source : graph.getEdgeTarget(edge));
    }

    public ComponentNode getComponent(TerminalEdge edge) {
        CircuitVertex source = graph.getEdgeSource(edge);
        return (ComponentNode) (source.getKind() == CircuitVertex.Kind.COMPONENT ? source : graph.getEdgeTarget(edge));
    }

    public int getEdgeCount() {
        return graph.edgeSet().size();
    }

    public boolean isEmpty() {
        return graph.vertexSet().isEmpty();
    }

    /**
     * Moves every edge to the net node of the current representative of its net class, and drops the
     * net nodes of keys which are no longer representatives. Needed once all unions are done since an
     * edge added before a later union points to a stale representative.
     */
    public void canonicalize(NetRegistry registry) {
        Objects.requireNonNull(registry);
        record Wiring(ComponentNode component, String terminal, NetKey net) {
        }
        List<Wiring> wirings = new ArrayList<>();
        for (ComponentNode component : getComponents()) {
            for (TerminalEdge edge : graph.edgesOf(component)) {
                wirings.add(new Wiring(component, edge.getTerminal(), registry.find(getNet(edge).key())));
            }
        }
        List<NetKey> oldNets = new ArrayList<>(netNodes.keySet());

        graph = new Pseudograph<>(null, null, false);
        netNodes.clear();
        getComponents().forEach(graph::addVertex);
        for (NetKey oldNet : oldNets) {
            getOrCreateNetNode(registry.find(oldNet));
        }
        for (Wiring wiring : wirings) {
            addEdge(wiring.component(), getOrCreateNetNode(wiring.net()), wiring.terminal());
        }
    }
}
