/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.analysis;

import com.powsybl.circuit.CircuitFactory;
import com.powsybl.circuit.CircuitTopologyParameters;
import com.powsybl.circuit.ast.*;
import com.powsybl.circuit.component.DefaultComponentDatabase;
import com.powsybl.circuit.graph.CircuitGraphBuilder;
import com.powsybl.circuit.graph.GraphBuildResult;
import com.powsybl.circuit.net.NetKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl circuit topology team
 */
class ShortCircuitDetectorTest {

    private final CircuitTopologyParameters parameters = new CircuitTopologyParameters();

    private List<ShortCircuit> detect(List<StructuralStatement> statements) {
        GraphBuildResult result = new CircuitGraphBuilder(new DefaultComponentDatabase(), parameters).build(statements);
        return new ShortCircuitDetector(parameters).detect(result.graph(), result.registry());
    }

    @Test
    void testComponentSelfShort() {
        List<ShortCircuit> shorts = detect(CircuitFactory.createShortedTransistor());
        assertEquals(List.of(new ComponentSelfShort("M1", "Nmos", List.of("D", "G"), NetKey.named("g"), NetKey.named("g"))), shorts);
        assertEquals(ShortCircuit.Type.COMPONENT_SELF_SHORT, shorts.get(0).getType());
    }

    @Test
    void testSeriesSelfShort() {
        List<ShortCircuit> shorts = detect(List.of(new Declaration("R", "R1"),
                SeriesConnection.of(PathElement.node("a"), PathElement.component("R1"), PathElement.node("a"))));
        assertEquals(List.of(new ComponentSelfShort("R1", "R", List.of("t1_series", "t2_series"), NetKey.named("a"), NetKey.named("a"))),
                shorts);
    }

    @Test
    void testSelfShortReportsPreferredName() {
        List<ShortCircuit> shorts = detect(List.of(new Declaration("Nmos", "M1"),
                new ComponentConnectionBlock("M1", List.of(TerminalConnection.of("S", "GND"), TerminalConnection.of("B", "GND"),
                        TerminalConnection.of("D", "sink"))),
                DirectAssignment.of("sink", "GND")));
        assertEquals(1, shorts.size());
        ComponentSelfShort selfShort = (ComponentSelfShort) shorts.get(0);
        assertEquals(List.of("B", "D", "S"), selfShort.terminals());
        assertEquals(NetKey.named("sink"), selfShort.net());
        assertEquals(NetKey.named("GND"), selfShort.canonicalNet());
    }

    @Test
    void testGlobalShort() {
        List<ShortCircuit> shorts = detect(List.of(DirectAssignment.of("VDD", "GND")));
        assertEquals(List.of(new GlobalShort(List.of("GND", "VDD"), NetKey.named("GND"))), shorts);
        assertEquals(NetKey.named("GND"), shorts.get(0).canonicalNet());
    }

    @Test
    void testTransitiveGlobalShort() {
        List<ShortCircuit> shorts = detect(List.of(DirectAssignment.of("VDD", "x"), DirectAssignment.of("x", "VSS")));
        assertEquals(List.of(new GlobalShort(List.of("VDD", "VSS"), NetKey.named("VDD"))), shorts);
    }

    @Test
    void testAllRailsShorted() {
        List<ShortCircuit> shorts = detect(List.of(DirectAssignment.of("VDD", "GND"), DirectAssignment.of("VCC", "GND"),
                DirectAssignment.of("VSS", "VCC")));
        List<List<String>> pairs = new ArrayList<>();
        for (ShortCircuit shortCircuit : shorts) {
            pairs.add(((GlobalShort) shortCircuit).nets());
            assertEquals(NetKey.named("GND"), shortCircuit.canonicalNet());
        }
        // checking order is VDD, GND, VSS, VCC
        assertEquals(List.of(List.of("GND", "VDD"), List.of("VDD", "VSS"), List.of("VCC", "VDD"),
                List.of("GND", "VSS"), List.of("GND", "VCC"), List.of("VCC", "VSS")), pairs);
    }

    @Test
    void testNoShort() {
        assertTrue(detect(CircuitFactory.createAmplifier()).isEmpty());
        assertTrue(detect(CircuitFactory.createSingleResistor()).isEmpty());
    }

    @Test
    void testEmptyCircuit() {
        GraphBuildResult result = new CircuitGraphBuilder(new DefaultComponentDatabase(), parameters).build(List.of());
        List<ShortCircuit> shorts = new ShortCircuitDetector(parameters).detect(result.graph(), result.registry());
        assertTrue(shorts.isEmpty());
        // detection does not register rails
        assertTrue(result.registry().isEmpty());
        assertEquals("No topological short circuits detected.", ShortCircuitReport.format(shorts));
    }

    @Test
    void testReport() {
        List<ShortCircuit> shorts = new ArrayList<>(detect(CircuitFactory.createShortedTransistor()));
        shorts.addAll(detect(List.of(DirectAssignment.of("VDD", "GND"))));
        assertEquals("Detected Topological Short Circuits:\n"
                        + "  - Component Short: 'M1' (Type: Nmos) has terminals [D, G] connected to the same net 'g' (canonical: 'g').\n"
                        + "  - Global Short: Key nets [GND, VDD] are connected together. (Canonical net: 'GND')",
                ShortCircuitReport.format(shorts));
    }
}
