/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

/**
 * A statement of the circuit description language.
 *
 * @author PowSyBl circuit topology team
 */
public interface StructuralStatement {

    enum Type {
        DECLARATION,
        COMPONENT_CONNECTION_BLOCK,
        SERIES_CONNECTION,
        DIRECT_ASSIGNMENT
    }

    Type getType();

    /**
     * Source line, 0 for synthesized statements.
     */
    int line();
}
