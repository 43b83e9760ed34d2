/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.flat;

import com.powsybl.circuit.CircuitTopologyParameters;
import com.powsybl.circuit.ast.StructuralStatement;
import com.powsybl.circuit.component.ComponentDatabase;
import com.powsybl.circuit.graph.*;
import com.powsybl.circuit.net.NetKey;
import com.powsybl.circuit.net.NetRegistry;
import com.powsybl.circuit.util.DiagnosticType;
import com.powsybl.circuit.util.Diagnostics;
import com.powsybl.commons.PowsyblException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Converts a circuit graph to a flat netlist and back.
 *
 * @author PowSyBl circuit topology team
 */
public class NetlistFlattener {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetlistFlattener.class);

    private final ComponentDatabase componentDatabase;

    private final CircuitTopologyParameters parameters;

    public NetlistFlattener(ComponentDatabase componentDatabase, CircuitTopologyParameters parameters) {
        this.componentDatabase = Objects.requireNonNull(componentDatabase);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public FlatNetlist flatten(CircuitGraph graph, NetRegistry registry) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(registry);
        List<FlatComponent> components = new ArrayList<>();
        List<PinConnection> pins = new ArrayList<>();
        for (ComponentNode component : graph.getComponents()) {
            components.add(new FlatComponent(component.getName(), component.getType(), component.isInternal(),
                    component.getPolarity().orElse(null), component.getExpression().orElse(null),
                    component.getNoiseId().orElse(null), component.getDirection().orElse(null)));
            Set<ComponentConnectivity.TerminalNet> distinctConnections = new LinkedHashSet<>(ComponentConnectivity.of(graph, component).connections());
            for (ComponentConnectivity.TerminalNet connection : distinctConnections) {
                pins.add(new PinConnection(component.getName(), component.isInternal(), connection.terminal(), connection.net().key()));
            }
        }
        List<NetAlias> aliases = new ArrayList<>();
        for (NetKey key : registry.getKeys()) {
            NetKey canonical = registry.find(key);
            if (!canonical.equals(key)) {
                aliases.add(new NetAlias(key, canonical));
            }
        }
        return new FlatNetlist(components, pins, aliases);
    }

    public GraphBuildResult toGraph(FlatNetlist netlist) {
        Objects.requireNonNull(netlist);
        CircuitGraph graph = new CircuitGraph();
        NetRegistry registry = new NetRegistry(parameters.getPreferredRails());
        Diagnostics diagnostics = new Diagnostics(LOGGER);

        Map<String, ComponentNode> internalComponents = new HashMap<>();
        for (FlatComponent component : netlist.components()) {
            if (component.internal()) {
                internalComponents.put(component.name(), graph.addComponent(createInternalComponent(component)));
            } else if (graph.hasComponent(component.name())) {
                diagnostics.add(DiagnosticType.DUPLICATE_DECLARATION, 0, "Component '" + component.name() + "' is listed twice");
            } else {
                ComponentNode node = graph.addComponent(ComponentNode.declared(component.name(), component.type(), 0));
                component.getPolarity().ifPresent(node::setPolarity);
            }
        }

        for (PinConnection pin : netlist.pins()) {
            registry.add(pin.net());
        }
        for (NetAlias alias : netlist.aliases()) {
            registry.union(alias.source(), alias.canonical());
        }

        for (PinConnection pin : netlist.pins()) {
            ComponentNode component = pin.internal() ? internalComponents.get(pin.component()) : graph.getComponent(pin.component()).orElse(null);
            if (component == null) {
                diagnostics.add(DiagnosticType.UNDECLARED_COMPONENT_REFERENCE, 0,
                        "Pin '" + pin.terminal() + "' refers to unknown component '" + pin.component() + "'");
            } else if (pin.terminal().isEmpty()) {
                diagnostics.add(DiagnosticType.MISSING_TERMINAL_LABEL, 0,
                        "Pin of component '" + pin.component() + "' on net '" + pin.net().getName() + "' has no terminal");
            } else {
                graph.addEdge(component, graph.getOrCreateNetNode(registry.find(pin.net())), pin.terminal());
            }
        }
        return new GraphBuildResult(graph, registry, diagnostics.getList(), 0);
    }

    public List<StructuralStatement> toStructuredStatements(FlatNetlist netlist) {
        GraphBuildResult result = toGraph(netlist);
        return new AstReconstructor(componentDatabase, parameters).reconstruct(result.graph(), result.registry());
    }

    private static ComponentNode createInternalComponent(FlatComponent component) {
        return switch (component.type()) {
            case ComponentDatabase.CONTROLLED_SOURCE_TYPE -> ComponentNode.controlledSource(component.name(),
                    component.expression(), component.direction(), 0);
            case ComponentDatabase.NOISE_SOURCE_TYPE -> ComponentNode.noiseSource(component.name(),
                    component.noiseId(), component.direction(), 0);
            default -> throw new PowsyblException("Internal component '" + component.name() + "' has unsupported type '" + component.type() + "'");
        };
    }
}
