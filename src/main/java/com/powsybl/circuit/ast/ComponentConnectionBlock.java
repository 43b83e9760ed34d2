/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code M1 { G:(g), D:(d), S:(GND) }}: wires terminals of a multi-terminal component.
 *
 * @author PowSyBl circuit topology team
 */
public record ComponentConnectionBlock(String componentName, List<TerminalConnection> connections, int line) implements StructuralStatement {

    public ComponentConnectionBlock {
        Objects.requireNonNull(componentName);
        connections = List.copyOf(connections);
    }

    public ComponentConnectionBlock(String componentName, List<TerminalConnection> connections) {
        this(componentName, connections, 0);
    }

    @Override
    public Type getType() {
        return Type.COMPONENT_CONNECTION_BLOCK;
    }
}
