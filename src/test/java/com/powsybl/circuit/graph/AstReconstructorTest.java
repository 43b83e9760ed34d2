/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.circuit.CircuitFactory;
import com.powsybl.circuit.CircuitTopologyParameters;
import com.powsybl.circuit.ast.*;
import com.powsybl.circuit.component.DefaultComponentDatabase;
import com.powsybl.circuit.net.NetKey;
import com.powsybl.circuit.net.NetNameResolver;
import com.powsybl.circuit.net.NetRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl circuit topology team
 */
class AstReconstructorTest {

    private CircuitGraphBuilder builder;

    private AstReconstructor reconstructor;

    @BeforeEach
    void setUp() {
        DefaultComponentDatabase database = new DefaultComponentDatabase();
        CircuitTopologyParameters parameters = new CircuitTopologyParameters();
        builder = new CircuitGraphBuilder(database, parameters);
        reconstructor = new AstReconstructor(database, parameters);
    }

    private List<StructuralStatement> reconstruct(List<StructuralStatement> statements) {
        GraphBuildResult result = builder.build(statements);
        assertTrue(result.diagnostics().isEmpty());
        return reconstructor.reconstruct(result.graph(), result.registry());
    }

    private static String normalizeTerminal(String terminal) {
        return switch (terminal) {
            case Terminals.T1_SERIES, Terminals.PAR_T1 -> "path1";
            case Terminals.T2_SERIES, Terminals.PAR_T2 -> "path2";
            default -> terminal;
        };
    }

    /**
     * Wiring of a component with series and parallel labels merged and implicit nets anonymized.
     */
    private static Map<String, String> getNormalizedWiring(CircuitGraph graph, NetRegistry registry, ComponentNode component) {
        Map<String, String> wiring = new TreeMap<>();
        ComponentConnectivity.of(graph, component).terminalMap().forEach((terminal, net) -> {
            NetKey name = NetNameResolver.getPreferredName(net.key(), registry, Set.of("GND", "VDD"), true);
            wiring.put(normalizeTerminal(terminal), name.isImplicit() ? "<implicit>" : name.getName());
        });
        return wiring;
    }

    private static Map<String, String> describe(GraphBuildResult result) {
        Map<String, String> description = new TreeMap<>();
        CircuitGraph graph = result.graph();
        for (ComponentNode component : graph.getComponents()) {
            description.put(component.getName(), component.getType() + " " + component.getPolarity().map(Polarity::getToken).orElse("")
                    + component.getExpression().orElse("") + component.getNoiseId().orElse("")
                    + component.getDirection().map(CurrentDirection::getToken).orElse("")
                    + " " + getNormalizedWiring(graph, result.registry(), component));
        }
        return description;
    }

    @Test
    void testParallelResistors() {
        assertEquals(List.of(new Declaration("R", "R1"),
                        new Declaration("R", "R2"),
                        SeriesConnection.of(PathElement.node("A"),
                                PathElement.parallel(ParallelElement.component("R1"), ParallelElement.component("R2")),
                                PathElement.node("B"))),
                reconstruct(CircuitFactory.createParallelResistors()));
    }

    @Test
    void testSingleResistor() {
        assertEquals(List.of(new Declaration("R", "R1"),
                        SeriesConnection.of(PathElement.node("in"), PathElement.component("R1"), PathElement.node("GND"))),
                reconstruct(CircuitFactory.createSingleResistor()));
    }

    @Test
    void testEmptyGraph() {
        assertTrue(reconstruct(List.of()).isEmpty());
    }

    @Test
    void testMultiTerminalBlock() {
        List<StructuralStatement> statements = reconstruct(List.of(new Declaration("Nmos", "M1"),
                new ComponentConnectionBlock("M1", List.of(TerminalConnection.of("D", "d"), TerminalConnection.of("G", "g"),
                        TerminalConnection.of("S", "GND"), TerminalConnection.of("B", "GND")))));
        assertEquals(List.of(new Declaration("Nmos", "M1"),
                new ComponentConnectionBlock("M1", List.of(TerminalConnection.of("G", "g"), TerminalConnection.of("D", "d"),
                        TerminalConnection.of("S", "GND"), TerminalConnection.of("B", "GND"))),
                DirectAssignment.of("M1.B", "GND"),
                DirectAssignment.of("M1.S", "GND"),
                DirectAssignment.of("M1.D", "d"),
                DirectAssignment.of("M1.G", "g")), statements);
    }

    @Test
    void testComponentSpanningThreeNets() {
        List<StructuralStatement> statements = reconstruct(List.of(new Declaration("R", "R1"),
                new ComponentConnectionBlock("R1", List.of(TerminalConnection.of("z", "c"), TerminalConnection.of("x", "a"),
                        TerminalConnection.of("y", "b")))));
        assertEquals(new ComponentConnectionBlock("R1", List.of(TerminalConnection.of("x", "a"), TerminalConnection.of("y", "b"),
                TerminalConnection.of("z", "c"))), statements.get(1));
        assertEquals(5, statements.size());
    }

    @Test
    void testNonPathTerminalsFallBackToBlock() {
        assertEquals(List.of(new Declaration("R", "R1"),
                        new ComponentConnectionBlock("R1", List.of(TerminalConnection.of("a", "n1"), TerminalConnection.of("b", "n2"))),
                        DirectAssignment.of("R1.a", "n1"),
                        DirectAssignment.of("R1.b", "n2")),
                reconstruct(List.of(new Declaration("R", "R1"),
                        new ComponentConnectionBlock("R1", List.of(TerminalConnection.of("b", "n2"), TerminalConnection.of("a", "n1"))))));
    }

    @Test
    void testSelfShortedResistor() {
        assertEquals(List.of(new Declaration("R", "R1"),
                        SeriesConnection.of(PathElement.node("a"), PathElement.component("R1"), PathElement.node("a"))),
                reconstruct(List.of(new Declaration("R", "R1"),
                        SeriesConnection.of(PathElement.node("a"), PathElement.component("R1"), PathElement.node("a")))));
    }

    @Test
    void testSourceKeepsPolarity() {
        List<StructuralStatement> input = List.of(new Declaration("V", "V1"),
                SeriesConnection.of(PathElement.node("a"), PathElement.source("V1", Polarity.POS_NEG), PathElement.node("b")));
        assertEquals(input, reconstruct(input));
    }

    @Test
    void testSourceWiredByBlock() {
        assertEquals(List.of(new Declaration("V", "V1"),
                        SeriesConnection.of(PathElement.node("n"), PathElement.source("V1", Polarity.NEG_POS), PathElement.node("p")),
                        DirectAssignment.of("V1.neg", "n"),
                        DirectAssignment.of("V1.pos", "p")),
                reconstruct(List.of(new Declaration("V", "V1"),
                        new ComponentConnectionBlock("V1", List.of(TerminalConnection.of("pos", "p"), TerminalConnection.of("neg", "n"))))));
    }

    @Test
    void testBehavioralElements() {
        assertEquals(List.of(SeriesConnection.of(PathElement.node("a"),
                        PathElement.parallel(ParallelElement.controlledSource("gm*v1", CurrentDirection.FORWARD)),
                        PathElement.node("b"))),
                reconstruct(List.of(SeriesConnection.of(PathElement.node("a"),
                        PathElement.parallel(ParallelElement.controlledSource("gm*v1", CurrentDirection.FORWARD)),
                        PathElement.node("b")))));

        assertEquals(List.of(new Declaration("R", "R1"),
                        SeriesConnection.of(PathElement.node("a"),
                                PathElement.parallel(ParallelElement.component("R1"),
                                        ParallelElement.controlledSource("gm*v", CurrentDirection.FORWARD),
                                        ParallelElement.noiseSource("n1", CurrentDirection.BACKWARD)),
                                PathElement.node("b"))),
                reconstruct(List.of(new Declaration("R", "R1"),
                        SeriesConnection.of(PathElement.node("a"),
                                PathElement.parallel(ParallelElement.noiseSource("n1", CurrentDirection.BACKWARD),
                                        ParallelElement.controlledSource("gm*v", CurrentDirection.FORWARD),
                                        ParallelElement.component("R1")),
                                PathElement.node("b")))));
    }

    @Test
    void testBehavioralElementKeepsItsOrientation() {
        List<StructuralStatement> input = List.of(new Declaration("R", "R1"),
                SeriesConnection.of(PathElement.node("b"), PathElement.component("R1"), PathElement.node("a")),
                SeriesConnection.of(PathElement.node("a"),
                        PathElement.parallel(ParallelElement.controlledSource("gm*v", CurrentDirection.FORWARD)),
                        PathElement.node("b")));
        List<StructuralStatement> statements = reconstruct(input);
        assertEquals(input, statements);

        GraphBuildResult rebuilt = builder.build(statements);
        ComponentNode source = rebuilt.graph().getInternalComponents().get(0);
        Map<String, NetNode> terminalMap = ComponentConnectivity.of(rebuilt.graph(), source).terminalMap();
        assertEquals(NetKey.named("a"), terminalMap.get(Terminals.PAR_T1).key());
        assertEquals(NetKey.named("b"), terminalMap.get(Terminals.PAR_T2).key());
        assertEquals(Optional.of(CurrentDirection.FORWARD), source.getDirection());
    }

    @Test
    void testOppositeBehavioralElements() {
        List<StructuralStatement> input = List.of(
                SeriesConnection.of(PathElement.node("a"),
                        PathElement.parallel(ParallelElement.controlledSource("gm*v", CurrentDirection.FORWARD)),
                        PathElement.node("b")),
                SeriesConnection.of(PathElement.node("b"),
                        PathElement.parallel(ParallelElement.noiseSource("n1", CurrentDirection.BACKWARD)),
                        PathElement.node("a")));
        assertEquals(input, reconstruct(input));
    }

    @Test
    void testAmplifier() {
        List<StructuralStatement> statements = reconstruct(CircuitFactory.createAmplifier());
        List<StructuralStatement> expected = List.of(
                new Declaration("C", "C1"),
                new Declaration("Nmos", "M1"),
                new Declaration("R", "R2"),
                new Declaration("R", "R3"),
                new Declaration("R", "Rd"),
                new Declaration("R", "Rs"),
                new Declaration("V", "Vsupply"),
                new ComponentConnectionBlock("M1", List.of(TerminalConnection.of("G", "in"), TerminalConnection.of("D", "out"),
                        TerminalConnection.of("S", "src"), TerminalConnection.of("B", "GND"))),
                SeriesConnection.of(PathElement.node("GND"), PathElement.source("Vsupply", Polarity.NEG_POS), PathElement.node("VDD")),
                SeriesConnection.of(PathElement.node(NetKey.implicit(0)), PathElement.component("R3"), PathElement.node("GND")),
                SeriesConnection.of(PathElement.node("out"),
                        PathElement.parallel(ParallelElement.component("C1"), ParallelElement.controlledSource("gm*vgs", CurrentDirection.FORWARD)),
                        PathElement.node("GND")),
                SeriesConnection.of(PathElement.node("src"), PathElement.component("Rs"), PathElement.node("GND")),
                SeriesConnection.of(PathElement.node("VDD"), PathElement.component("Rd"), PathElement.node("out")),
                SeriesConnection.of(PathElement.node("in"), PathElement.component("R2"), PathElement.node(NetKey.implicit(0))),
                DirectAssignment.of("M1.B", "GND"),
                DirectAssignment.of("M1.G", "in"),
                DirectAssignment.of("M1.D", "out"),
                DirectAssignment.of("M1.S", "src"));
        assertEquals(expected, statements);
    }

    @Test
    void testDeterminism() {
        GraphBuildResult result = builder.build(CircuitFactory.createAmplifier());
        List<StructuralStatement> statements1 = reconstructor.reconstruct(result.graph(), result.registry());
        List<StructuralStatement> statements2 = reconstructor.reconstruct(result.graph(), result.registry());
        assertEquals(statements1, statements2);
        assertEquals(StatementWriter.write(statements1), StatementWriter.write(statements2));

        List<StructuralStatement> reversed = new ArrayList<>(CircuitFactory.createAmplifier());
        Collections.reverse(reversed);
        assertEquals(statements1, reconstruct(reversed));
    }

    @Test
    void testRoundTrip() {
        GraphBuildResult result1 = builder.build(CircuitFactory.createAmplifier());
        List<StructuralStatement> statements = reconstructor.reconstruct(result1.graph(), result1.registry());
        GraphBuildResult result2 = builder.build(statements);
        assertTrue(result2.diagnostics().isEmpty());
        assertEquals(describe(result1), describe(result2));
        assertEquals(result1.graph().getNetNodes().size(), result2.graph().getNetNodes().size());
    }
}
