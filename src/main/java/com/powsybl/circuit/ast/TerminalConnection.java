/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import com.powsybl.circuit.net.NetKey;

import java.util.Objects;

/**
 * {@code G:(net)} entry of a component connection block.
 *
 * @author PowSyBl circuit topology team
 */
public record TerminalConnection(String terminal, NetKey net) {

    public TerminalConnection {
        Objects.requireNonNull(terminal);
        Objects.requireNonNull(net);
    }

    public static TerminalConnection of(String terminal, String net) {
        return new TerminalConnection(terminal, NetKey.parse(net));
    }
}
