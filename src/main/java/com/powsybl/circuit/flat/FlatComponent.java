/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.flat;

import com.powsybl.circuit.ast.CurrentDirection;
import com.powsybl.circuit.ast.Polarity;

import java.util.Objects;
import java.util.Optional;

/**
 * A component of a flat netlist with the attributes the graph stores on it. Attributes which do not
 * apply to the component are null.
 *
 * @author PowSyBl circuit topology team
 */
public record FlatComponent(String name, String type, boolean internal, Polarity polarity, String expression,
                            String noiseId, CurrentDirection direction) {

    public FlatComponent {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
    }

    public static FlatComponent declared(String name, String type) {
        return new FlatComponent(name, type, false, null, null, null, null);
    }

    public Optional<Polarity> getPolarity() {
        return Optional.ofNullable(polarity);
    }
}
