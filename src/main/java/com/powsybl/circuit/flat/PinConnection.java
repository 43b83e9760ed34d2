/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.flat;

import com.powsybl.circuit.net.NetKey;

import java.util.Objects;

/**
 * Terminal of a component wired to a canonical net.
 *
 * @param internal whether the component is an internal one, internal and declared names being separate namespaces
 *
 * @author PowSyBl circuit topology team
 */
public record PinConnection(String component, boolean internal, String terminal, NetKey net) {

    public PinConnection {
        Objects.requireNonNull(component);
        Objects.requireNonNull(terminal);
        Objects.requireNonNull(net);
    }

    public static PinConnection of(String component, String terminal, String net) {
        return new PinConnection(component, false, terminal, NetKey.parse(net));
    }
}
