/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.analysis;

import com.powsybl.circuit.net.NetKey;

import java.util.List;
import java.util.Objects;

/**
 * @param nets the two shorted rail names, sorted
 *
 * @author PowSyBl circuit topology team
 */
public record GlobalShort(List<String> nets, NetKey canonicalNet) implements ShortCircuit {

    public GlobalShort {
        nets = List.copyOf(nets);
        Objects.requireNonNull(canonicalNet);
    }

    @Override
    public Type getType() {
        return Type.GLOBAL_SHORT;
    }
}
