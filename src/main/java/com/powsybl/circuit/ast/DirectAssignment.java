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
 * {@code (M1.S):(GND)}: declares two net names electrically equivalent.
 *
 * @author PowSyBl circuit topology team
 */
public record DirectAssignment(NetKey source, NetKey target, int line) implements StructuralStatement {

    public DirectAssignment {
        Objects.requireNonNull(source);
        Objects.requireNonNull(target);
    }

    public static DirectAssignment of(String source, String target) {
        return new DirectAssignment(NetKey.parse(source), NetKey.parse(target), 0);
    }

    @Override
    public Type getType() {
        return Type.DIRECT_ASSIGNMENT;
    }
}
