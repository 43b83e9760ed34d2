/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.circuit.CircuitTopologyParameters;
import com.powsybl.circuit.ast.*;
import com.powsybl.circuit.component.ComponentDatabase;
import com.powsybl.circuit.net.NetKey;
import com.powsybl.circuit.net.NetNameResolver;
import com.powsybl.circuit.net.NetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Rebuilds structural statements from a circuit graph and its net registry, re-deriving the series and
 * parallel structure which is not explicit in the graph. Statements come in this order:
 * <ol>
 *     <li>declarations of non internal components, sorted by name,</li>
 *     <li>connection blocks of multi-terminal components and of components spanning more than two nets,</li>
 *     <li>one series connection per net pair, holding a single component or a parallel block, a second
 *     one for behavioral elements wired against the orientation of the first, plus one series connection
 *     per source,</li>
 *     <li>connection blocks of the remaining wired components, whose terminals are not path-like,</li>
 *     <li>net aliases.</li>
 * </ol>
 * Sources are never merged into a parallel block, even when they share their net pair with other
 * components: a parallel element has no polarity, so each source keeps its own {@code (a) -- V1 (-+) -- (b)}
 * path. The output only depends on the graph and registry content, never on hash ordering.
 *
 * @author PowSyBl circuit topology team
 */
public class AstReconstructor {

    private static final Logger LOGGER = LoggerFactory.getLogger(AstReconstructor.class);

    private static final Comparator<NetNode> NET_NODE_COMPARATOR = Comparator.comparing(NetNode::key, NetKey.COMPARATOR);

    private static final Comparator<ComponentNode> NAME_COMPARATOR = Comparator.comparing(ComponentNode::getName);

    private final ComponentDatabase componentDatabase;

    private final CircuitTopologyParameters parameters;

    /**
     * A component which can be written as an element of a series path between two nets.
     *
     * @param first net of the first terminal of the pair, negative terminal for sources
     * @param second net of the second terminal of the pair, positive terminal for sources
     */
    private record PathMember(ComponentNode component, NetNode first, NetNode second, boolean source) {

        ParallelElement toParallelElement() {
            return switch (component.getType()) {
                case ComponentDatabase.CONTROLLED_SOURCE_TYPE -> component.isInternal()
                        ? ParallelElement.controlledSource(component.getExpression().orElseThrow(), component.getDirection().orElseThrow())
                        : ParallelElement.component(component.getName());
                case ComponentDatabase.NOISE_SOURCE_TYPE -> component.isInternal()
                        ? ParallelElement.noiseSource(component.getNoiseId().orElseThrow(), component.getDirection().orElseThrow())
                        : ParallelElement.component(component.getName());
                default -> ParallelElement.component(component.getName());
            };
        }
    }

    private static final Comparator<ParallelElement> PARALLEL_ELEMENT_COMPARATOR = Comparator.comparing(ParallelElement::getType)
            .thenComparing(ParallelElement::getIdentifier)
            .thenComparing(AstReconstructor::getDirectionToken);

    private record NetPair(NetNode net1, NetNode net2) {

        static NetPair of(NetNode a, NetNode b) {
            return NET_NODE_COMPARATOR.compare(a, b) <= 0 ? new NetPair(a, b) : new NetPair(b, a);
        }
    }

    private static final Comparator<NetPair> NET_PAIR_COMPARATOR = Comparator.comparing(NetPair::net1, NET_NODE_COMPARATOR)
            .thenComparing(NetPair::net2, NET_NODE_COMPARATOR);

    public AstReconstructor(ComponentDatabase componentDatabase, CircuitTopologyParameters parameters) {
        this.componentDatabase = Objects.requireNonNull(componentDatabase);
        this.parameters = Objects.requireNonNull(parameters);
    }

    private static String getDirectionToken(ParallelElement element) {
        return switch (element.getType()) {
            case COMPONENT -> "";
            case CONTROLLED_SOURCE -> ((ParallelElement.ControlledSource) element).direction().getToken();
            case NOISE_SOURCE -> ((ParallelElement.NoiseSource) element).direction().getToken();
        };
    }

    public List<StructuralStatement> reconstruct(CircuitGraph graph, NetRegistry registry) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(registry);

        List<StructuralStatement> statements = new ArrayList<>();
        Set<ComponentNode> represented = new HashSet<>();

        List<ComponentNode> declaredComponents = new ArrayList<>(graph.getDeclaredComponents());
        declaredComponents.sort(NAME_COMPARATOR);
        for (ComponentNode component : declaredComponents) {
            statements.add(new Declaration(component.getType(), component.getName()));
        }

        for (ComponentNode component : declaredComponents) {
            ComponentConnectivity connectivity = ComponentConnectivity.of(graph, component);
            if (!connectivity.isEmpty()
                    && (componentDatabase.isMultiTerminal(component.getType()) || connectivity.getDistinctNets().size() > 2)) {
                statements.add(createConnectionBlock(component, connectivity, registry));
                represented.add(component);
            }
        }

        List<ComponentNode> internalComponents = new ArrayList<>(graph.getInternalComponents());
        internalComponents.sort(NAME_COMPARATOR);
        List<ComponentNode> pathCandidates = new ArrayList<>(declaredComponents);
        pathCandidates.addAll(internalComponents);
        addSeriesConnections(graph, registry, pathCandidates, represented, statements);

        // wired components with no path-like terminals, written as blocks so that no wiring is lost
        for (ComponentNode component : declaredComponents) {
            ComponentConnectivity connectivity = ComponentConnectivity.of(graph, component);
            if (!represented.contains(component) && !connectivity.isEmpty()) {
                LOGGER.debug("Component '{}' cannot be written in a series path, using a connection block", component.getName());
                statements.add(createConnectionBlock(component, connectivity, registry));
                represented.add(component);
            }
        }

        addDirectAssignments(registry, statements);

        LOGGER.debug("{} statements reconstructed from {} components and {} nets",
                statements.size(), graph.getComponents().size(), graph.getNetNodes().size());
        return statements;
    }

    private NetKey getNetName(NetNode net, NetRegistry registry) {
        return NetNameResolver.getPreferredName(net.key(), registry, parameters.getSignificantNets(), true);
    }

    private ComponentConnectionBlock createConnectionBlock(ComponentNode component, ComponentConnectivity connectivity, NetRegistry registry) {
        Map<String, NetNode> terminalMap = connectivity.terminalMap();
        List<String> preferredOrder = componentDatabase.getPreferredTerminalOrder(component.getType());
        List<String> terminals = new ArrayList<>();
        for (String terminal : preferredOrder) {
            if (terminalMap.containsKey(terminal)) {
                terminals.add(terminal);
            }
        }
        terminalMap.keySet().stream()
                .filter(terminal -> !preferredOrder.contains(terminal))
                .sorted()
                .forEach(terminals::add);
        List<TerminalConnection> connections = new ArrayList<>(terminals.size());
        for (String terminal : terminals) {
            connections.add(new TerminalConnection(terminal, getNetName(terminalMap.get(terminal), registry)));
        }
        return new ComponentConnectionBlock(component.getName(), connections);
    }

    /**
     * Path view of a component, empty if its terminals are not the pos/neg pair of a source or series and
     * parallel pair terminals consistently wired to two nets.
     */
    private static Optional<PathMember> toPathMember(ComponentNode component, ComponentConnectivity connectivity) {
        Map<String, NetNode> terminalMap = connectivity.terminalMap();
        if (terminalMap.size() == 2 && terminalMap.containsKey(Terminals.POS) && terminalMap.containsKey(Terminals.NEG)) {
            return Optional.of(new PathMember(component, terminalMap.get(Terminals.NEG), terminalMap.get(Terminals.POS), true));
        }
        if (terminalMap.isEmpty() || !Terminals.TWO_TERMINAL_PATH.containsAll(terminalMap.keySet())) {
            return Optional.empty();
        }
        Set<NetNode> firstNets = new LinkedHashSet<>();
        Set<NetNode> secondNets = new LinkedHashSet<>();
        for (ComponentConnectivity.TerminalNet connection : connectivity.connections()) {
            (Terminals.isFirstOfPair(connection.terminal()) ? firstNets : secondNets).add(connection.net());
        }
        if (firstNets.size() != 1 || secondNets.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(new PathMember(component, firstNets.iterator().next(), secondNets.iterator().next(), false));
    }

    private void addSeriesConnections(CircuitGraph graph, NetRegistry registry, List<ComponentNode> candidates,
                                      Set<ComponentNode> represented, List<StructuralStatement> statements) {
        Map<NetPair, List<PathMember>> membersByNetPair = new TreeMap<>(NET_PAIR_COMPARATOR);
        for (ComponentNode component : candidates) {
            if (represented.contains(component) || componentDatabase.isMultiTerminal(component.getType())) {
                continue;
            }
            toPathMember(component, ComponentConnectivity.of(graph, component))
                    .ifPresent(member -> membersByNetPair.computeIfAbsent(NetPair.of(member.first(), member.second()), k -> new ArrayList<>())
                            .add(member));
        }

        for (List<PathMember> members : membersByNetPair.values()) {
            List<PathMember> others = new ArrayList<>();
            List<PathMember> sources = new ArrayList<>();
            for (PathMember member : members) {
                (member.source() ? sources : others).add(member);
            }
            if (!others.isEmpty()) {
                addParallelConnections(others, registry, statements);
            }
            // a parallel block cannot hold a polarized source, each one gets its own path
            for (PathMember source : sources) {
                statements.add(createSourceConnection(source, registry));
            }
            members.forEach(member -> represented.add(member.component()));
        }
    }

    /**
     * Writes the members sharing a net pair, oriented from the first net of the first member after sorting.
     * Behavioral members wired the other way round go to a second path, oriented from their own first
     * net, so that their direction keeps applying to the same terminals.
     */
    private void addParallelConnections(List<PathMember> members, NetRegistry registry, List<StructuralStatement> statements) {
        List<PathMember> sortedMembers = new ArrayList<>(members);
        sortedMembers.sort(Comparator.comparing(PathMember::toParallelElement, PARALLEL_ELEMENT_COMPARATOR));
        PathMember head = sortedMembers.get(0);
        List<PathMember> aligned = new ArrayList<>();
        List<PathMember> reversed = new ArrayList<>();
        for (PathMember member : sortedMembers) {
            (member.component().isInternal() && !member.first().equals(head.first()) ? reversed : aligned).add(member);
        }
        statements.add(createSeriesConnection(aligned, head.first(), head.second(), registry));
        if (!reversed.isEmpty()) {
            statements.add(createSeriesConnection(reversed, head.second(), head.first(), registry));
        }
    }

    private SeriesConnection createSeriesConnection(List<PathMember> sortedMembers, NetNode from, NetNode to, NetRegistry registry) {
        PathMember head = sortedMembers.get(0);
        PathElement element;
        if (sortedMembers.size() == 1 && !head.component().isInternal()) {
            element = PathElement.component(head.component().getName());
        } else {
            // behavioral elements only exist inside parallel blocks
            element = new PathElement.ParallelBlock(sortedMembers.stream().map(PathMember::toParallelElement).toList());
        }
        return SeriesConnection.of(PathElement.node(getNetName(from, registry)),
                element,
                PathElement.node(getNetName(to, registry)));
    }

    private SeriesConnection createSourceConnection(PathMember source, NetRegistry registry) {
        Polarity polarity = source.component().getPolarity().orElse(Polarity.NEG_POS);
        NetNode before = polarity == Polarity.NEG_POS ? source.first() : source.second();
        NetNode after = polarity == Polarity.NEG_POS ? source.second() : source.first();
        return SeriesConnection.of(PathElement.node(getNetName(before, registry)),
                PathElement.source(source.component().getName(), polarity),
                PathElement.node(getNetName(after, registry)));
    }

    private void addDirectAssignments(NetRegistry registry, List<StructuralStatement> statements) {
        Set<Set<NetKey>> emittedPairs = new HashSet<>();
        List<NetKey> representatives = new ArrayList<>(registry.getRepresentatives());
        representatives.sort(NetKey.COMPARATOR);
        for (NetKey representative : representatives) {
            List<NetKey> members = new ArrayList<>(registry.members(representative));
            if (members.size() <= 1) {
                continue;
            }
            members.sort(NetKey.COMPARATOR);
            NetKey target = registry.isPreferredRail(representative)
                    ? representative
                    : NetNameResolver.getPreferredName(representative, registry, parameters.getSignificantNets(), true);
            for (NetKey member : members) {
                if (member.equals(target) || member.isImplicit() && !target.isImplicit()) {
                    continue;
                }
                if (emittedPairs.add(Set.of(member, target))) {
                    statements.add(new DirectAssignment(member, target, 0));
                }
            }
        }
    }
}
