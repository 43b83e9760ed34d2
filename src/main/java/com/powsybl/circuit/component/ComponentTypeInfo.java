/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.component;

import java.util.List;
import java.util.Objects;

/**
 * @param terminals terminal names in preferred order, empty when terminals are named by position in a path
 * @param multiTerminal whether the type is wired through connection blocks
 * @param behavioral whether the type only exists as an internal element of parallel blocks
 *
 * @author PowSyBl circuit topology team
 */
public record ComponentTypeInfo(String type, int arity, List<String> terminals, boolean multiTerminal, boolean behavioral) {

    public ComponentTypeInfo {
        Objects.requireNonNull(type);
        terminals = List.copyOf(terminals);
    }
}
