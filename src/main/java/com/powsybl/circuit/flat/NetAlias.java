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
 * A net name and the canonical net it belongs to.
 *
 * @author PowSyBl circuit topology team
 */
public record NetAlias(NetKey source, NetKey canonical) {

    public NetAlias {
        Objects.requireNonNull(source);
        Objects.requireNonNull(canonical);
    }
}
