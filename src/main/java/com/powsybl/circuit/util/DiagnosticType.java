/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.util;

/**
 * Kinds of problems found while building or validating a circuit graph.
 *
 * @author PowSyBl circuit topology team
 */
public enum DiagnosticType {
    UNDECLARED_COMPONENT_REFERENCE,
    MISSING_TERMINAL_LABEL,
    MALFORMED_SERIES_PATH,
    DUPLICATE_DECLARATION,
    UNKNOWN_COMPONENT_TYPE,
    ARITY_EXCEEDED,
    NOT_FULLY_CONNECTED,
    DUPLICATE_TERMINAL_WIRING
}
