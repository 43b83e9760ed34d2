/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.graph;

import com.powsybl.circuit.net.NetRegistry;
import com.powsybl.circuit.util.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * @param implicitNetCount number of implicit nets synthesized while walking series paths
 *
 * @author PowSyBl circuit topology team
 */
public record GraphBuildResult(CircuitGraph graph, NetRegistry registry, List<Diagnostic> diagnostics, int implicitNetCount) {

    public GraphBuildResult {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(registry);
        diagnostics = List.copyOf(diagnostics);
    }
}
