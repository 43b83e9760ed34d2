/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.flat;

import java.util.List;

/**
 * Circuit as plain lists: components, one pin connection per wired terminal, and net aliases. No
 * series or parallel structure.
 *
 * @author PowSyBl circuit topology team
 */
public record FlatNetlist(List<FlatComponent> components, List<PinConnection> pins, List<NetAlias> aliases) {

    public FlatNetlist {
        components = List.copyOf(components);
        pins = List.copyOf(pins);
        aliases = List.copyOf(aliases);
    }
}
