/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import java.util.*;

/**
 * Nets a component is wired to, by terminal.
 *
 * @param terminalMap terminal to net, the first edge wins when a terminal is wired several times
 * @param connections every wiring in edge order, duplicates included
 *
 * @author PowSyBl circuit topology team
 */
public record ComponentConnectivity(Map<String, NetNode> terminalMap, List<TerminalNet> connections) {

    public record TerminalNet(String terminal, NetNode net) {
    }

    public ComponentConnectivity {
        terminalMap = Collections.unmodifiableMap(new LinkedHashMap<>(terminalMap));
        connections = List.copyOf(connections);
    }

    public static ComponentConnectivity of(CircuitGraph graph, ComponentNode component) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(component);
        Map<String, NetNode> terminalMap = new LinkedHashMap<>();
        List<TerminalNet> connections = new ArrayList<>();
        for (TerminalEdge edge : graph.getEdges(component)) {
            NetNode net = graph.getNet(edge);
            terminalMap.putIfAbsent(edge.getTerminal(), net);
            connections.add(new TerminalNet(edge.getTerminal(), net));
        }
        return new ComponentConnectivity(terminalMap, connections);
    }

    public Set<NetNode> getDistinctNets() {
        return new LinkedHashSet<>(terminalMap.values());
    }

    public boolean isEmpty() {
        return connections.isEmpty();
    }
}
