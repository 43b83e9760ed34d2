/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders statements in the circuit description language, one line per statement.
 *
 * @author PowSyBl circuit topology team
 */
public final class StatementWriter {

    private static final String SERIES_SEPARATOR = " -- ";

    private StatementWriter() {
    }

    public static String write(List<? extends StructuralStatement> statements) {
        return statements.stream()
                .map(StatementWriter::write)
                .collect(Collectors.joining("\n"));
    }

    public static String write(StructuralStatement statement) {
        return switch (statement.getType()) {
            case DECLARATION -> {
                Declaration declaration = (Declaration) statement;
                yield declaration.componentType() + " " + declaration.instanceName();
            }
            case COMPONENT_CONNECTION_BLOCK -> {
                ComponentConnectionBlock block = (ComponentConnectionBlock) statement;
                yield block.componentName() + " { " + block.connections().stream()
                        .map(c -> c.terminal() + ":(" + c.net().getName() + ")")
                        .collect(Collectors.joining(", ")) + " }";
            }
            case SERIES_CONNECTION -> ((SeriesConnection) statement).path().stream()
                    .map(StatementWriter::write)
                    .collect(Collectors.joining(SERIES_SEPARATOR));
            case DIRECT_ASSIGNMENT -> {
                DirectAssignment assignment = (DirectAssignment) statement;
                yield "(" + assignment.source().getName() + "):(" + assignment.target().getName() + ")";
            }
        };
    }

    public static String write(PathElement element) {
        return switch (element.getType()) {
            case NODE -> "(" + ((PathElement.Node) element).net().getName() + ")";
            case COMPONENT -> ((PathElement.Component) element).name();
            case SOURCE -> {
                PathElement.Source source = (PathElement.Source) element;
                yield source.name() + " (" + source.polarity().getToken() + ")";
            }
            case PARALLEL_BLOCK -> "[ " + ((PathElement.ParallelBlock) element).elements().stream()
                    .map(StatementWriter::write)
                    .collect(Collectors.joining(" || ")) + " ]";
            case NAMED_CURRENT -> {
                PathElement.NamedCurrent current = (PathElement.NamedCurrent) element;
                yield current.direction().getToken() + current.name();
            }
            case ERROR -> "<error: " + ((PathElement.Error) element).message() + ">";
        };
    }

    public static String write(ParallelElement element) {
        return switch (element.getType()) {
            case COMPONENT -> element.getIdentifier();
            case CONTROLLED_SOURCE -> element.getIdentifier() + " (" + ((ParallelElement.ControlledSource) element).direction().getToken() + ")";
            case NOISE_SOURCE -> element.getIdentifier() + " (" + ((ParallelElement.NoiseSource) element).direction().getToken() + ")";
        };
    }
}
