/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.circuit.ast.CurrentDirection;
import com.powsybl.circuit.ast.Polarity;
import com.powsybl.circuit.component.ComponentDatabase;

import java.util.Objects;
import java.util.Optional;

/**
 * A declared component instance, or an internal one created for a behavioral element of a parallel
 * block. Identity semantic: two nodes are never merged even if they share a name.
 *
 * @author PowSyBl circuit topology team
 */
public final class ComponentNode implements CircuitVertex {

    private final String name;

    private final String type;

    private final boolean internal;

    private final int line;

    private Polarity polarity;

    private final String expression;

    private final String noiseId;

    private final CurrentDirection direction;

    private ComponentNode(String name, String type, boolean internal, int line, String expression, String noiseId,
                          CurrentDirection direction) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.internal = internal;
        this.line = line;
        this.expression = expression;
        this.noiseId = noiseId;
        this.direction = direction;
    }

    public static ComponentNode declared(String name, String type, int line) {
        return new ComponentNode(name, type, false, line, null, null, null);
    }

    public static ComponentNode controlledSource(String name, String expression, CurrentDirection direction, int line) {
        return new ComponentNode(name, ComponentDatabase.CONTROLLED_SOURCE_TYPE, true, line,
                Objects.requireNonNull(expression), null, Objects.requireNonNull(direction));
    }

    public static ComponentNode noiseSource(String name, String noiseId, CurrentDirection direction, int line) {
        return new ComponentNode(name, ComponentDatabase.NOISE_SOURCE_TYPE, true, line,
                null, Objects.requireNonNull(noiseId), Objects.requireNonNull(direction));
    }

    @Override
    public Kind getKind() {
        return Kind.COMPONENT;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isInternal() {
        return internal;
    }

    public int getLine() {
        return line;
    }

    /**
     * Polarity the source had in the last series path it appeared in.
     */
    public Optional<Polarity> getPolarity() {
        return Optional.ofNullable(polarity);
    }

    public void setPolarity(Polarity polarity) {
        this.polarity = Objects.requireNonNull(polarity);
    }

    public Optional<String> getExpression() {
        return Optional.ofNullable(expression);
    }

    public Optional<String> getNoiseId() {
        return Optional.ofNullable(noiseId);
    }

    public Optional<CurrentDirection> getDirection() {
        return Optional.ofNullable(direction);
    }

    @Override
    public String toString() {
        return "ComponentNode(" + name + ", " + type + ")";
    }
}
