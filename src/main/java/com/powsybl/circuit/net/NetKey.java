/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.net;

import com.powsybl.commons.PowsyblException;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Identifier of an electrical net. A net is either named by the user, qualified by a device terminal
 * ({@code M1.G}) or synthesized by the graph builder where a series path has no explicit node.
 *
 * @author PowSyBl circuit topology team
 */
public interface NetKey {

    enum Kind {
        NAMED,
        DEVICE_TERMINAL,
        IMPLICIT
    }

    String IMPLICIT_PREFIX = "_implicit_";

    /**
     * Total order: display name, then kind.
     */
    Comparator<NetKey> COMPARATOR = Comparator.comparing(NetKey::getName)
            .thenComparing(NetKey::getKind);

    /**
     * Human preference order: shorter names first, then alphabetical.
     */
    Comparator<NetKey> DISPLAY_ORDER = Comparator.<NetKey>comparingInt(key -> key.getName().length())
            .thenComparing(COMPARATOR);

    Kind getKind();

    /**
     * Name as written in the circuit language.
     */
    String getName();

    default boolean isImplicit() {
        return getKind() == Kind.IMPLICIT;
    }

    record Named(String name) implements NetKey {

        public Named {
            if (StringUtils.isEmpty(name)) {
                throw new PowsyblException("Net name is empty");
            }
        }

        @Override
        public Kind getKind() {
            return Kind.NAMED;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record DeviceTerminal(String component, String terminal) implements NetKey {

        public DeviceTerminal {
            if (StringUtils.isEmpty(component) || StringUtils.isEmpty(terminal)) {
                throw new PowsyblException("Device terminal net needs a component and a terminal: '" + component + "." + terminal + "'");
            }
        }

        @Override
        public Kind getKind() {
            return Kind.DEVICE_TERMINAL;
        }

        @Override
        public String getName() {
            return component + "." + terminal;
        }

        @Override
        public String toString() {
            return getName();
        }
    }

    record Implicit(int index) implements NetKey {

        public Implicit {
            if (index < 0) {
                throw new PowsyblException("Invalid implicit net index: " + index);
            }
        }

        @Override
        public Kind getKind() {
            return Kind.IMPLICIT;
        }

        @Override
        public String getName() {
            return IMPLICIT_PREFIX + index;
        }

        @Override
        public String toString() {
            return getName();
        }
    }

    static NetKey named(String name) {
        return new Named(name);
    }

    static NetKey deviceTerminal(String component, String terminal) {
        return new DeviceTerminal(component, terminal);
    }

    static NetKey implicit(int index) {
        return new Implicit(index);
    }

    /**
     * Index of a name written the way implicit nets are displayed ({@code _implicit_3}), empty for any
     * other name, leading zeros included.
     */
    static OptionalInt getImplicitIndex(String name) {
        Objects.requireNonNull(name);
        if (!name.startsWith(IMPLICIT_PREFIX)) {
            return OptionalInt.empty();
        }
        String suffix = name.substring(IMPLICIT_PREFIX.length());
        if (!StringUtils.isNumeric(suffix) || suffix.length() > 9) {
            return OptionalInt.empty();
        }
        int index = Integer.parseInt(suffix);
        return String.valueOf(index).equals(suffix) ? OptionalInt.of(index) : OptionalInt.empty();
    }

    /**
     * Converts a net name as produced by a text parser: {@code Comp.Term} is a device terminal,
     * {@code _implicit_N} an implicit net, anything else a user named net.
     */
    static NetKey parse(String name) {
        Objects.requireNonNull(name);
        OptionalInt implicitIndex = getImplicitIndex(name);
        if (implicitIndex.isPresent()) {
            return new Implicit(implicitIndex.getAsInt());
        }
        int dot = name.indexOf('.');
        if (dot > 0 && dot < name.length() - 1) {
            return new DeviceTerminal(name.substring(0, dot), name.substring(dot + 1));
        }
        return new Named(name);
    }
}
