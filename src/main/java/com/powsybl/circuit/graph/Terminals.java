/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import java.util.Set;

/**
 * Terminal labels given by the graph builder to components wired through series paths.
 *
 * @author PowSyBl circuit topology team
 */
public final class Terminals {

    public static final String T1_SERIES = "t1_series";
    public static final String T2_SERIES = "t2_series";
    public static final String PAR_T1 = "par_t1";
    public static final String PAR_T2 = "par_t2";
    public static final String POS = "pos";
    public static final String NEG = "neg";

    public static final Set<String> TWO_TERMINAL_PATH = Set.of(T1_SERIES, T2_SERIES, PAR_T1, PAR_T2);

    private Terminals() {
    }

    /**
     * Whether the label is the first terminal of a series or parallel pair.
     */
    public static boolean isFirstOfPair(String terminal) {
        return T1_SERIES.equals(terminal) || PAR_T1.equals(terminal);
    }
}
