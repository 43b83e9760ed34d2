/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Human readable rendering of detected short circuits.
 *
 * @author PowSyBl circuit topology team
 */
public final class ShortCircuitReport {

    public static final String NO_SHORT_CIRCUIT = "No topological short circuits detected.";

    public static final String HEADER = "Detected Topological Short Circuits:";

    private ShortCircuitReport() {
    }

    public static String format(List<? extends ShortCircuit> shorts) {
        if (shorts.isEmpty()) {
            return NO_SHORT_CIRCUIT;
        }
        List<String> lines = new ArrayList<>(shorts.size() + 1);
        lines.add(HEADER);
        for (ShortCircuit shortCircuit : shorts) {
            lines.add(formatLine(shortCircuit));
        }
        return String.join("\n", lines);
    }

    private static String formatLine(ShortCircuit shortCircuit) {
        return switch (shortCircuit.getType()) {
            case COMPONENT_SELF_SHORT -> {
                ComponentSelfShort selfShort = (ComponentSelfShort) shortCircuit;
                yield "  - Component Short: '" + selfShort.component() + "' (Type: " + selfShort.componentType()
                        + ") has terminals " + selfShort.terminals() + " connected to the same net '" + selfShort.net().getName()
                        + "' (canonical: '" + selfShort.canonicalNet().getName() + "').";
            }
            case GLOBAL_SHORT -> {
                GlobalShort globalShort = (GlobalShort) shortCircuit;
                yield "  - Global Short: Key nets " + globalShort.nets() + " are connected together. (Canonical net: '"
                        + globalShort.canonicalNet().getName() + "')";
            }
        };
    }
}
