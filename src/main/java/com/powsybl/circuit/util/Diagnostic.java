/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.util;

import java.util.Objects;

/**
 * A non fatal problem attached to a source line (0 when the line is unknown or synthesized).
 *
 * @author PowSyBl circuit topology team
 */
public record Diagnostic(DiagnosticType type, int line, String message) {

    public Diagnostic {
        Objects.requireNonNull(type);
        Objects.requireNonNull(message);
    }

    @Override
    public String toString() {
        return (line > 0 ? "L" + line + ": " : "") + type + ": " + message;
    }
}
