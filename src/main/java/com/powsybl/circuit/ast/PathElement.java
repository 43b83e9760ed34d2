/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import com.powsybl.circuit.net.NetKey;

import java.util.List;
import java.util.Objects;

/**
 * An element of a series path.
 *
 * @author PowSyBl circuit topology team
 */
public interface PathElement {

    enum Type {
        NODE,
        COMPONENT,
        SOURCE,
        PARALLEL_BLOCK,
        NAMED_CURRENT,
        ERROR
    }

    Type getType();

    /**
     * {@code (net)}
     */
    record Node(NetKey net) implements PathElement {

        public Node {
            Objects.requireNonNull(net);
        }

        @Override
        public Type getType() {
            return Type.NODE;
        }
    }

    record Component(String name) implements PathElement {

        public Component {
            Objects.requireNonNull(name);
        }

        @Override
        public Type getType() {
            return Type.COMPONENT;
        }
    }

    /**
     * {@code V1 (-+)}
     */
    record Source(String name, Polarity polarity) implements PathElement {

        public Source {
            Objects.requireNonNull(name);
            Objects.requireNonNull(polarity);
        }

        @Override
        public Type getType() {
            return Type.SOURCE;
        }
    }

    /**
     * {@code [ R1 || C1 || gm*v1 (->) ]}
     */
    record ParallelBlock(List<ParallelElement> elements) implements PathElement {

        public ParallelBlock {
            elements = List.copyOf(elements);
        }

        @Override
        public Type getType() {
            return Type.PARALLEL_BLOCK;
        }
    }

    /**
     * {@code ->I_bias}: names the current flowing along the path, no electrical effect.
     */
    record NamedCurrent(CurrentDirection direction, String name) implements PathElement {

        public NamedCurrent {
            Objects.requireNonNull(direction);
            Objects.requireNonNull(name);
        }

        @Override
        public Type getType() {
            return Type.NAMED_CURRENT;
        }
    }

    /**
     * Placeholder left by the parser for an element it could not read.
     */
    record Error(String message) implements PathElement {

        public Error {
            Objects.requireNonNull(message);
        }

        @Override
        public Type getType() {
            return Type.ERROR;
        }
    }

    static PathElement node(String net) {
        return new Node(NetKey.parse(net));
    }

    static PathElement node(NetKey net) {
        return new Node(net);
    }

    static PathElement component(String name) {
        return new Component(name);
    }

    static PathElement source(String name, Polarity polarity) {
        return new Source(name, polarity);
    }

    static PathElement parallel(ParallelElement... elements) {
        return new ParallelBlock(List.of(elements));
    }

    static PathElement namedCurrent(CurrentDirection direction, String name) {
        return new NamedCurrent(direction, name);
    }
}
