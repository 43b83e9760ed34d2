/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.circuit.CircuitTopologyParameters;
import com.powsybl.circuit.ast.Declaration;
import com.powsybl.circuit.ast.PathElement;
import com.powsybl.circuit.ast.SeriesConnection;
import com.powsybl.circuit.component.DefaultComponentDatabase;
import com.powsybl.circuit.net.NetKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl circuit topology team
 */
class ComponentConnectivityTest {

    @Test
    void testFirstWiringWins() {
        GraphBuildResult result = new CircuitGraphBuilder(new DefaultComponentDatabase(), new CircuitTopologyParameters())
                .build(List.of(new Declaration("R", "R1"),
                        SeriesConnection.of(PathElement.node("a"), PathElement.component("R1"), PathElement.node("b")),
                        SeriesConnection.of(PathElement.node("c"), PathElement.component("R1"), PathElement.node("d"))));
        CircuitGraph graph = result.graph();
        ComponentConnectivity connectivity = ComponentConnectivity.of(graph, graph.getComponentOrThrow("R1"));

        assertEquals(List.of(Terminals.T1_SERIES, Terminals.T2_SERIES), List.copyOf(connectivity.terminalMap().keySet()));
        assertEquals(NetKey.named("a"), connectivity.terminalMap().get(Terminals.T1_SERIES).key());
        assertEquals(NetKey.named("b"), connectivity.terminalMap().get(Terminals.T2_SERIES).key());
        assertEquals(List.of(Terminals.T1_SERIES, Terminals.T2_SERIES, Terminals.T1_SERIES, Terminals.T2_SERIES),
                connectivity.connections().stream().map(ComponentConnectivity.TerminalNet::terminal).toList());
        assertEquals(NetKey.named("d"), connectivity.connections().get(3).net().key());
        assertEquals(2, connectivity.getDistinctNets().size());
        assertFalse(connectivity.isEmpty());
    }

    @Test
    void testUnconnectedComponent() {
        CircuitGraph graph = new CircuitGraph();
        ComponentNode component = graph.addComponent(ComponentNode.declared("R1", "R", 0));
        ComponentConnectivity connectivity = ComponentConnectivity.of(graph, component);
        assertTrue(connectivity.isEmpty());
        assertTrue(connectivity.terminalMap().isEmpty());
        assertTrue(connectivity.getDistinctNets().isEmpty());
    }
}
