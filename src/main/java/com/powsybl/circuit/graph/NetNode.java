/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.circuit.net.NetKey;

import java.util.Objects;

/**
 * Graph vertex of the canonical representative of a net equivalence class.
 *
 * @author PowSyBl circuit topology team
 */
public record NetNode(NetKey key) implements CircuitVertex {

    public NetNode {
        Objects.requireNonNull(key);
    }

    @Override
    public Kind getKind() {
        return Kind.NET;
    }

    @Override
    public String toString() {
        return "NetNode(" + key.getName() + ")";
    }
}
