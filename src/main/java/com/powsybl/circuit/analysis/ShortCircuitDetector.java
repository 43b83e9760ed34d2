/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.analysis;

import com.powsybl.circuit.CircuitTopologyParameters;
import com.powsybl.circuit.graph.CircuitGraph;
import com.powsybl.circuit.graph.ComponentConnectivity;
import com.powsybl.circuit.graph.ComponentNode;
import com.powsybl.circuit.graph.NetNode;
import com.powsybl.circuit.net.NetKey;
import com.powsybl.circuit.net.NetNameResolver;
import com.powsybl.circuit.net.NetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Finds components wired to themselves and well-known rails merged together. Self shorts come first, in
 * component order, then global shorts in rail pair checking order.
 *
 * @author PowSyBl circuit topology team
 */
public class ShortCircuitDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ShortCircuitDetector.class);

    private final CircuitTopologyParameters parameters;

    public ShortCircuitDetector(CircuitTopologyParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public List<ShortCircuit> detect(CircuitGraph graph, NetRegistry registry) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(registry);
        List<ShortCircuit> shorts = new ArrayList<>();
        for (ComponentNode component : graph.getComponents()) {
            detectSelfShorts(graph, registry, component, shorts);
        }
        detectGlobalShorts(registry, shorts);
        LOGGER.debug("{} short circuits detected", shorts.size());
        return shorts;
    }

    private void detectSelfShorts(CircuitGraph graph, NetRegistry registry, ComponentNode component, List<ShortCircuit> shorts) {
        Map<NetNode, Set<String>> terminalsByNet = new LinkedHashMap<>();
        ComponentConnectivity.of(graph, component).terminalMap()
                .forEach((terminal, net) -> terminalsByNet.computeIfAbsent(net, k -> new TreeSet<>()).add(terminal));
        terminalsByNet.forEach((net, terminals) -> {
            if (terminals.size() > 1) {
                NetKey netName = NetNameResolver.getPreferredName(net.key(), registry, parameters.getSignificantNets(), true);
                shorts.add(new ComponentSelfShort(component.getName(), component.getType(), new ArrayList<>(terminals), netName, net.key()));
            }
        });
    }

    private void detectGlobalShorts(NetRegistry registry, List<ShortCircuit> shorts) {
        // rails never mentioned are ignored, looking them up would register them
        List<NetKey> rails = parameters.getWellKnownRails().stream()
                .map(NetKey::named)
                .filter(registry::contains)
                .collect(Collectors.toList());
        for (int i = 0; i < rails.size(); i++) {
            for (int j = i + 1; j < rails.size(); j++) {
                NetKey canonicalNet = registry.find(rails.get(i));
                if (canonicalNet.equals(registry.find(rails.get(j)))) {
                    List<String> nets = new ArrayList<>(List.of(rails.get(i).getName(), rails.get(j).getName()));
                    Collections.sort(nets);
                    shorts.add(new GlobalShort(nets, canonicalNet));
                }
            }
        }
    }
}
