/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

/**
 * Vertex of the circuit graph: a component instance or a canonical net. The two kinds are distinct
 * classes so that a component and a net sharing a name never collide.
 *
 * @author PowSyBl circuit topology team
 */
public interface CircuitVertex {

    enum Kind {
        COMPONENT,
        NET
    }

    Kind getKind();
}
