/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.commons.PowsyblException;
import org.apache.commons.lang3.StringUtils;

/**
 * Edge between a component and a net, labeled with the component terminal. Edges have identity
 * semantic: the same terminal may be wired several times.
 *
 * @author PowSyBl circuit topology team
 */
public final class TerminalEdge {

    private final String terminal;

    TerminalEdge(String terminal) {
        if (StringUtils.isEmpty(terminal)) {
            throw new PowsyblException("Terminal edge label is empty");
        }
        this.terminal = terminal;
    }

    public String getTerminal() {
        return terminal;
    }

    @Override
    public String toString() {
        return "TerminalEdge(" + terminal + ")";
    }
}
