/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.util;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates diagnostics and mirrors each of them to a logger.
 *
 * @author PowSyBl circuit topology team
 */
public final class Diagnostics {

    private final Logger logger;

    private final List<Diagnostic> list = new ArrayList<>();

    public Diagnostics(Logger logger) {
        this.logger = Objects.requireNonNull(logger);
    }

    public void add(DiagnosticType type, int line, String message) {
        Diagnostic diagnostic = new Diagnostic(type, line, message);
        logger.warn("{}", diagnostic);
        list.add(diagnostic);
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    public List<Diagnostic> getList() {
        return Collections.unmodifiableList(list);
    }
}
