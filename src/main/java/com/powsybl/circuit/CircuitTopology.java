/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit;

import com.powsybl.circuit.analysis.CircuitGraphValidator;
import com.powsybl.circuit.analysis.ShortCircuit;
import com.powsybl.circuit.analysis.ShortCircuitDetector;
import com.powsybl.circuit.analysis.ShortCircuitReport;
import com.powsybl.circuit.ast.StructuralStatement;
import com.powsybl.circuit.component.ComponentDatabase;
import com.powsybl.circuit.component.DefaultComponentDatabase;
import com.powsybl.circuit.flat.FlatNetlist;
import com.powsybl.circuit.flat.NetlistFlattener;
import com.powsybl.circuit.graph.*;
import com.powsybl.circuit.net.NetKey;
import com.powsybl.circuit.net.NetNameResolver;
import com.powsybl.circuit.net.NetRegistry;
import com.powsybl.circuit.util.Diagnostic;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the circuit topology algorithms. Every call works on fresh objects: nothing is kept
 * between two calls.
 * <pre>
 *     CircuitTopology topology = CircuitTopology.create();
 *     GraphBuildResult result = topology.astToGraph(statements);
 *     List&lt;ShortCircuit&gt; shorts = topology.detectShortCircuits(result.graph(), result.registry());
 *     System.out.println(CircuitTopology.formatShortCircuitReport(shorts));
 * </pre>
 *
 * @author PowSyBl circuit topology team
 */
public class CircuitTopology {

    private final ComponentDatabase componentDatabase;

    private final CircuitTopologyParameters parameters;

    public CircuitTopology(ComponentDatabase componentDatabase, CircuitTopologyParameters parameters) {
        this.componentDatabase = Objects.requireNonNull(componentDatabase);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public static CircuitTopology create() {
        return new CircuitTopology(new DefaultComponentDatabase(), new CircuitTopologyParameters());
    }

    public ComponentDatabase getComponentDatabase() {
        return componentDatabase;
    }

    public CircuitTopologyParameters getParameters() {
        return parameters;
    }

    public GraphBuildResult astToGraph(List<? extends StructuralStatement> statements) {
        return new CircuitGraphBuilder(componentDatabase, parameters).build(statements);
    }

    public List<StructuralStatement> graphToStructuredAst(CircuitGraph graph, NetRegistry registry) {
        return new AstReconstructor(componentDatabase, parameters).reconstruct(graph, registry);
    }

    public static ComponentConnectivity getComponentConnectivity(CircuitGraph graph, String componentName) {
        Objects.requireNonNull(graph);
        return ComponentConnectivity.of(graph, graph.getComponentOrThrow(componentName));
    }

    public NetKey getPreferredNetName(NetKey canonicalNet, NetRegistry registry) {
        return NetNameResolver.getPreferredName(canonicalNet, registry, parameters.getSignificantNets(), false);
    }

    public static NetKey getPreferredNetName(NetKey canonicalNet, NetRegistry registry, Set<String> knownRails, boolean allowImplicit) {
        return NetNameResolver.getPreferredName(canonicalNet, registry, knownRails, allowImplicit);
    }

    public List<ShortCircuit> detectShortCircuits(CircuitGraph graph, NetRegistry registry) {
        return new ShortCircuitDetector(parameters).detect(graph, registry);
    }

    public static String formatShortCircuitReport(List<? extends ShortCircuit> shorts) {
        return ShortCircuitReport.format(shorts);
    }

    public List<Diagnostic> validate(CircuitGraph graph) {
        return new CircuitGraphValidator(componentDatabase).validate(graph);
    }

    public FlatNetlist flatten(CircuitGraph graph, NetRegistry registry) {
        return new NetlistFlattener(componentDatabase, parameters).flatten(graph, registry);
    }

    public List<StructuralStatement> unflatten(FlatNetlist netlist) {
        return new NetlistFlattener(componentDatabase, parameters).toStructuredStatements(netlist);
    }
}
