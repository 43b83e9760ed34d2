/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.ast;

import com.powsybl.commons.PowsyblException;

/**
 * Direction of a named current or of a behavioral source.
 *
 * @author PowSyBl circuit topology team
 */
public enum CurrentDirection {
    FORWARD("->"),
    BACKWARD("<-");

    private final String token;

    CurrentDirection(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static CurrentDirection fromToken(String token) {
        for (CurrentDirection direction : values()) {
            if (direction.token.equals(token)) {
                return direction;
            }
        }
        throw new PowsyblException("Unknown direction token: '" + token + "'");
    }
}
