/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.analysis;

import com.powsybl.circuit.component.ComponentDatabase;
import com.powsybl.circuit.graph.CircuitGraph;
import com.powsybl.circuit.graph.ComponentConnectivity;
import com.powsybl.circuit.graph.ComponentNode;
import com.powsybl.circuit.graph.NetNode;
import com.powsybl.circuit.util.Diagnostic;
import com.powsybl.circuit.util.DiagnosticType;
import com.powsybl.circuit.util.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Checks the wiring of declared components against the component database. Internal components are
 * not checked: the graph builder always wires them with exactly two terminals.
 *
 * @author PowSyBl circuit topology team
 */
public class CircuitGraphValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitGraphValidator.class);

    private final ComponentDatabase componentDatabase;

    public CircuitGraphValidator(ComponentDatabase componentDatabase) {
        this.componentDatabase = Objects.requireNonNull(componentDatabase);
    }

    public List<Diagnostic> validate(CircuitGraph graph) {
        Objects.requireNonNull(graph);
        Diagnostics diagnostics = new Diagnostics(LOGGER);
        for (ComponentNode component : graph.getDeclaredComponents()) {
            validate(graph, component, diagnostics);
        }
        return diagnostics.getList();
    }

    private void validate(CircuitGraph graph, ComponentNode component, Diagnostics diagnostics) {
        OptionalInt arity = componentDatabase.getArity(component.getType());
        if (arity.isEmpty()) {
            diagnostics.add(DiagnosticType.UNKNOWN_COMPONENT_TYPE, component.getLine(),
                    "Component '" + component.getName() + "' has unknown type '" + component.getType() + "'");
            return;
        }
        ComponentConnectivity connectivity = ComponentConnectivity.of(graph, component);
        int connectedTerminalCount = connectivity.terminalMap().size();
        if (connectedTerminalCount > arity.getAsInt()) {
            diagnostics.add(DiagnosticType.ARITY_EXCEEDED, component.getLine(),
                    "Component '" + component.getName() + "' (type '" + component.getType() + "') has " + connectedTerminalCount
                            + " distinct terminals connected, exceeding its arity of " + arity.getAsInt());
        } else if (connectedTerminalCount > 0 && connectedTerminalCount < arity.getAsInt()) {
            diagnostics.add(DiagnosticType.NOT_FULLY_CONNECTED, component.getLine(),
                    "Component '" + component.getName() + "' (type '" + component.getType() + "') has only " + connectedTerminalCount
                            + " distinct terminals connected, expected " + arity.getAsInt());
        }

        Map<String, Set<NetNode>> netsByTerminal = new LinkedHashMap<>();
        for (ComponentConnectivity.TerminalNet connection : connectivity.connections()) {
            netsByTerminal.computeIfAbsent(connection.terminal(), k -> new LinkedHashSet<>()).add(connection.net());
        }
        netsByTerminal.forEach((terminal, nets) -> {
            if (nets.size() > 1) {
                diagnostics.add(DiagnosticType.DUPLICATE_TERMINAL_WIRING, component.getLine(),
                        "Terminal '" + terminal + "' of component '" + component.getName() + "' is wired to " + nets.size()
                                + " different nets: " + nets.stream().map(net -> net.key().getName()).toList());
            }
        });
    }
}
