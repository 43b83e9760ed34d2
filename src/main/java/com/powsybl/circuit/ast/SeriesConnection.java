/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import java.util.List;

/**
 * {@code (in) -- R1 -- [ C1 || R2 ] -- (GND)}: a chain of nodes and components.
 *
 * @author PowSyBl circuit topology team
 */
public record SeriesConnection(List<PathElement> path, int line) implements StructuralStatement {

    public SeriesConnection {
        path = List.copyOf(path);
    }

    public static SeriesConnection of(PathElement... path) {
        return new SeriesConnection(List.of(path), 0);
    }

    @Override
    public Type getType() {
        return Type.SERIES_CONNECTION;
    }
}
