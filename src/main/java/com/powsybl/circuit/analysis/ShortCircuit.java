/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.analysis;

import com.powsybl.circuit.net.NetKey;

/**
 * A topological short circuit.
 *
 * @author PowSyBl circuit topology team
 */
public interface ShortCircuit {

    enum Type {
        /**
         * Several terminals of one component wired to the same net.
         */
        COMPONENT_SELF_SHORT,
        /**
         * Two well-known rails unified into one net.
         */
        GLOBAL_SHORT
    }

    Type getType();

    NetKey canonicalNet();
}
