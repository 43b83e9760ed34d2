/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.google.common.base.Stopwatch;
import com.powsybl.circuit.CircuitTopologyParameters;
import com.powsybl.circuit.ast.*;
import com.powsybl.circuit.component.ComponentDatabase;
import com.powsybl.circuit.net.NetKey;
import com.powsybl.circuit.net.NetRegistry;
import com.powsybl.circuit.util.DiagnosticType;
import com.powsybl.circuit.util.Diagnostics;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.mutable.MutableInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Builds the circuit graph and the net registry from structural statements.
 * <p>
 * A first pass creates the declared components and registers every explicitly named net, so that
 * equivalence classes do not depend on statement order. A second pass unions nets and adds edges.
 * Malformed input never aborts the build: the offending part is skipped and a diagnostic recorded.
 *
 * @author PowSyBl circuit topology team
 */
public class CircuitGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitGraphBuilder.class);

    private static final String INTERNAL_CONTROLLED_SOURCE_PREFIX = "_internal_cs_";
    private static final String INTERNAL_NOISE_SOURCE_PREFIX = "_internal_ns_";

    private final ComponentDatabase componentDatabase;

    private final CircuitTopologyParameters parameters;

    private static final class BuildContext {

        private final CircuitGraph graph = new CircuitGraph();

        private final NetRegistry registry;

        private final Diagnostics diagnostics = new Diagnostics(LOGGER);

        /**
         * Next free implicit net index.
         */
        private final MutableInt implicitNetIndex = new MutableInt();

        private final MutableInt implicitNetCount = new MutableInt();

        private final MutableInt internalComponentCount = new MutableInt();

        private BuildContext(NetRegistry registry) {
            this.registry = registry;
        }
    }

    public CircuitGraphBuilder(ComponentDatabase componentDatabase, CircuitTopologyParameters parameters) {
        this.componentDatabase = Objects.requireNonNull(componentDatabase);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public GraphBuildResult build(List<? extends StructuralStatement> statements) {
        Objects.requireNonNull(statements);
        Stopwatch stopwatch = Stopwatch.createStarted();

        BuildContext context = new BuildContext(new NetRegistry(parameters.getPreferredRails()));

        for (StructuralStatement statement : statements) {
            register(statement, context);
        }

        for (StructuralStatement statement : statements) {
            switch (statement.getType()) {
                case DECLARATION -> {
                    // components created by first pass
                }
                case COMPONENT_CONNECTION_BLOCK -> addConnectionBlock((ComponentConnectionBlock) statement, context);
                case DIRECT_ASSIGNMENT -> addDirectAssignment((DirectAssignment) statement, context);
                case SERIES_CONNECTION -> addSeriesConnection((SeriesConnection) statement, context);
            }
        }

        context.graph.canonicalize(context.registry);

        stopwatch.stop();
        LOGGER.info("Circuit graph built in {} ms: {} components, {} nets, {} edges, {} net names, {} diagnostics",
                stopwatch.elapsed(TimeUnit.MILLISECONDS), context.graph.getComponents().size(), context.graph.getNetNodes().size(),
                context.graph.getEdgeCount(), context.registry.size(), context.diagnostics.getList().size());

        return new GraphBuildResult(context.graph, context.registry, context.diagnostics.getList(), context.implicitNetCount.intValue());
    }

    private void register(StructuralStatement statement, BuildContext context) {
        switch (statement.getType()) {
            case DECLARATION -> declare((Declaration) statement, context);
            case COMPONENT_CONNECTION_BLOCK -> {
                ComponentConnectionBlock block = (ComponentConnectionBlock) statement;
                for (TerminalConnection connection : block.connections()) {
                    registerNet(connection.net(), context);
                    if (StringUtils.isNotEmpty(connection.terminal())) {
                        registerNet(NetKey.deviceTerminal(block.componentName(), connection.terminal()), context);
                    }
                }
            }
            case DIRECT_ASSIGNMENT -> {
                DirectAssignment assignment = (DirectAssignment) statement;
                registerNet(assignment.source(), context);
                registerNet(assignment.target(), context);
            }
            case SERIES_CONNECTION -> {
                for (PathElement element : ((SeriesConnection) statement).path()) {
                    if (element.getType() == PathElement.Type.NODE) {
                        registerNet(((PathElement.Node) element).net(), context);
                    }
                }
            }
        }
    }

    private void declare(Declaration declaration, BuildContext context) {
        String name = declaration.instanceName();
        if (context.graph.hasComponent(name)) {
            context.diagnostics.add(DiagnosticType.DUPLICATE_DECLARATION, declaration.line(),
                    "Component '" + name + "' is already declared, declaration ignored");
            return;
        }
        if (componentDatabase.getArity(declaration.componentType()).isEmpty()) {
            context.diagnostics.add(DiagnosticType.UNKNOWN_COMPONENT_TYPE, declaration.line(),
                    "Component '" + name + "' has unknown type '" + declaration.componentType() + "'");
        }
        context.graph.addComponent(ComponentNode.declared(name, declaration.componentType(), declaration.line()));
    }

    private static void registerNet(NetKey key, BuildContext context) {
        context.registry.add(key);
        // an input name in implicit form, named or not, reserves its index
        int index = key instanceof NetKey.Implicit implicit
                ? implicit.index()
                : NetKey.getImplicitIndex(key.getName()).orElse(-1);
        if (index >= context.implicitNetIndex.intValue()) {
            context.implicitNetIndex.setValue(index + 1);
        }
    }

    private void addConnectionBlock(ComponentConnectionBlock block, BuildContext context) {
        Optional<ComponentNode> component = context.graph.getComponent(block.componentName());
        if (component.isEmpty()) {
            context.diagnostics.add(DiagnosticType.UNDECLARED_COMPONENT_REFERENCE, block.line(),
                    "Component '" + block.componentName() + "' of connection block is not declared, block skipped");
            return;
        }
        for (TerminalConnection connection : block.connections()) {
            if (StringUtils.isEmpty(connection.terminal())) {
                context.diagnostics.add(DiagnosticType.MISSING_TERMINAL_LABEL, block.line(),
                        "Connection of component '" + block.componentName() + "' to net '" + connection.net().getName() + "' has no terminal");
                continue;
            }
            context.registry.union(NetKey.deviceTerminal(block.componentName(), connection.terminal()), connection.net());
            NetNode net = context.graph.getOrCreateNetNode(context.registry.find(connection.net()));
            context.graph.addEdge(component.get(), net, connection.terminal());
            connectDeviceTerminal(connection.net(), net, block.line(), context);
        }
    }

    private void addDirectAssignment(DirectAssignment assignment, BuildContext context) {
        context.registry.union(assignment.source(), assignment.target());
        NetNode net = context.graph.getOrCreateNetNode(context.registry.find(assignment.source()));
        connectDeviceTerminal(assignment.source(), net, assignment.line(), context);
        connectDeviceTerminal(assignment.target(), net, assignment.line(), context);
    }

    /**
     * Wires the component named by a device terminal net, if the net is one.
     */
    private static void connectDeviceTerminal(NetKey key, NetNode net, int line, BuildContext context) {
        if (key instanceof NetKey.DeviceTerminal deviceTerminal) {
            Optional<ComponentNode> component = context.graph.getComponent(deviceTerminal.component());
            if (component.isPresent()) {
                context.graph.addEdge(component.get(), net, deviceTerminal.terminal());
            } else {
                context.diagnostics.add(DiagnosticType.UNDECLARED_COMPONENT_REFERENCE, line,
                        "Net '" + key.getName() + "' refers to undeclared component '" + deviceTerminal.component() + "'");
            }
        }
    }

    private void addSeriesConnection(SeriesConnection series, BuildContext context) {
        List<PathElement> path = series.path();
        if (path.isEmpty() || path.get(0).getType() != PathElement.Type.NODE) {
            context.diagnostics.add(DiagnosticType.MALFORMED_SERIES_PATH, series.line(),
                    path.isEmpty() ? "Series path is empty" : "Series path does not start with a node");
            return;
        }
        NetNode current = null;
        for (int i = 0; i < path.size(); i++) {
            PathElement element = path.get(i);
            switch (element.getType()) {
                case NODE -> current = attachNode((PathElement.Node) element, series.line(), context);
                case NAMED_CURRENT -> LOGGER.trace("Named current {} ignored for topology", element);
                case ERROR -> context.diagnostics.add(DiagnosticType.MALFORMED_SERIES_PATH, series.line(),
                        "Unreadable path element skipped: " + ((PathElement.Error) element).message());
                case COMPONENT, SOURCE, PARALLEL_BLOCK -> {
                    NetNode next = findNextAttachPoint(path, i, context);
                    addTwoTerminalElement(element, current, next, series.line(), context);
                    current = next;
                }
            }
        }
    }

    private static NetNode attachNode(PathElement.Node node, int line, BuildContext context) {
        NetNode net = context.graph.getOrCreateNetNode(context.registry.find(node.net()));
        connectDeviceTerminal(node.net(), net, line, context);
        return net;
    }

    /**
     * Net following the element at the given index: the next explicit node, named currents and unreadable
     * elements being skipped, or else a new implicit net.
     */
    private static NetNode findNextAttachPoint(List<PathElement> path, int index, BuildContext context) {
        for (int j = index + 1; j < path.size(); j++) {
            PathElement element = path.get(j);
            if (element.getType() == PathElement.Type.NODE) {
                return context.graph.getOrCreateNetNode(context.registry.find(((PathElement.Node) element).net()));
            }
            if (element.getType() != PathElement.Type.NAMED_CURRENT && element.getType() != PathElement.Type.ERROR) {
                break;
            }
        }
        NetKey implicitNet = NetKey.implicit(context.implicitNetIndex.getAndIncrement());
        context.implicitNetCount.increment();
        context.registry.add(implicitNet);
        return context.graph.getOrCreateNetNode(implicitNet);
    }

    private void addTwoTerminalElement(PathElement element, NetNode current, NetNode next, int line, BuildContext context) {
        switch (element.getType()) {
            case COMPONENT -> {
                String name = ((PathElement.Component) element).name();
                findComponent(name, line, context).ifPresent(component -> {
                    context.graph.addEdge(component, current, Terminals.T1_SERIES);
                    context.graph.addEdge(component, next, Terminals.T2_SERIES);
                });
            }
            case SOURCE -> {
                PathElement.Source source = (PathElement.Source) element;
                findComponent(source.name(), line, context).ifPresent(component -> {
                    component.setPolarity(source.polarity());
                    boolean negativeFirst = source.polarity() == Polarity.NEG_POS;
                    context.graph.addEdge(component, current, negativeFirst ? Terminals.NEG : Terminals.POS);
                    context.graph.addEdge(component, next, negativeFirst ? Terminals.POS : Terminals.NEG);
                });
            }
            case PARALLEL_BLOCK -> addParallelBlock((PathElement.ParallelBlock) element, current, next, line, context);
            default -> throw new IllegalStateException("Not a two terminal path element: " + element.getType());
        }
    }

    private void addParallelBlock(PathElement.ParallelBlock block, NetNode current, NetNode next, int line, BuildContext context) {
        if (block.elements().isEmpty()) {
            context.diagnostics.add(DiagnosticType.MALFORMED_SERIES_PATH, line, "Parallel block is empty");
            return;
        }
        for (ParallelElement element : block.elements()) {
            Optional<ComponentNode> component = switch (element.getType()) {
                case COMPONENT -> findComponent(element.getIdentifier(), line, context);
                case CONTROLLED_SOURCE -> Optional.of(context.graph.addComponent(ComponentNode.controlledSource(
                        INTERNAL_CONTROLLED_SOURCE_PREFIX + context.internalComponentCount.getAndIncrement(),
                        element.getIdentifier(), ((ParallelElement.ControlledSource) element).direction(), line)));
                case NOISE_SOURCE -> Optional.of(context.graph.addComponent(ComponentNode.noiseSource(
                        INTERNAL_NOISE_SOURCE_PREFIX + context.internalComponentCount.getAndIncrement(),
                        element.getIdentifier(), ((ParallelElement.NoiseSource) element).direction(), line)));
            };
            component.ifPresent(c -> {
                context.graph.addEdge(c, current, Terminals.PAR_T1);
                context.graph.addEdge(c, next, Terminals.PAR_T2);
            });
        }
    }

    private static Optional<ComponentNode> findComponent(String name, int line, BuildContext context) {
        Optional<ComponentNode> component = context.graph.getComponent(name);
        if (component.isEmpty()) {
            context.diagnostics.add(DiagnosticType.UNDECLARED_COMPONENT_REFERENCE, line,
                    "Component '" + name + "' of series path is not declared, skipped");
        }
        return component;
    }
}
