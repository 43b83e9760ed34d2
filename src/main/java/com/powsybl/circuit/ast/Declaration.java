/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import java.util.Objects;

/**
 * {@code R R1}: declares component instance {@code R1} of type {@code R}.
 *
 * @author PowSyBl circuit topology team
 */
public record Declaration(String componentType, String instanceName, int line) implements StructuralStatement {

    public Declaration {
        Objects.requireNonNull(componentType);
        Objects.requireNonNull(instanceName);
    }

    public Declaration(String componentType, String instanceName) {
        this(componentType, instanceName, 0);
    }

    @Override
    public Type getType() {
        return Type.DECLARATION;
    }
}
