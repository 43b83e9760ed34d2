/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import java.util.Objects;

/**
 * An element of a parallel block: a declared component or a behavioral source that only exists
 * inside the block.
 *
 * @author PowSyBl circuit topology team
 */
public interface ParallelElement {

    enum Type {
        COMPONENT,
        CONTROLLED_SOURCE,
        NOISE_SOURCE
    }

    Type getType();

    /**
     * Component name, controlled source expression or noise source id.
     */
    String getIdentifier();

    record Component(String name) implements ParallelElement {

        public Component {
            Objects.requireNonNull(name);
        }

        @Override
        public Type getType() {
            return Type.COMPONENT;
        }

        @Override
        public String getIdentifier() {
            return name;
        }
    }

    /**
     * {@code gm*v1 (->)}
     */
    record ControlledSource(String expression, CurrentDirection direction) implements ParallelElement {

        public ControlledSource {
            Objects.requireNonNull(expression);
            Objects.requireNonNull(direction);
        }

        @Override
        public Type getType() {
            return Type.CONTROLLED_SOURCE;
        }

        @Override
        public String getIdentifier() {
            return expression;
        }
    }

    /**
     * {@code noise_r1 (<-)}
     */
    record NoiseSource(String id, CurrentDirection direction) implements ParallelElement {

        public NoiseSource {
            Objects.requireNonNull(id);
            Objects.requireNonNull(direction);
        }

        @Override
        public Type getType() {
            return Type.NOISE_SOURCE;
        }

        @Override
        public String getIdentifier() {
            return id;
        }
    }

    static ParallelElement component(String name) {
        return new Component(name);
    }

    static ParallelElement controlledSource(String expression, CurrentDirection direction) {
        return new ControlledSource(expression, direction);
    }

    static ParallelElement noiseSource(String id, CurrentDirection direction) {
        return new NoiseSource(id, direction);
    }
}
