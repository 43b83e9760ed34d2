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
 * @param terminals shorted terminals, sorted and without duplicates
 * @param net preferred display name of the shorted net
 *
 * @author PowSyBl circuit topology team
 */
public record ComponentSelfShort(String component, String componentType, List<String> terminals, NetKey net,
                                 NetKey canonicalNet) implements ShortCircuit {

    public ComponentSelfShort {
        Objects.requireNonNull(component);
        Objects.requireNonNull(componentType);
        terminals = List.copyOf(terminals);
        Objects.requireNonNull(net);
        Objects.requireNonNull(canonicalNet);
    }

    @Override
    public Type getType() {
        return Type.COMPONENT_SELF_SHORT;
    }
}
