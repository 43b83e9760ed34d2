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
 * Orientation of a source inside a series path, relative to the walking direction.
 *
 * @author PowSyBl circuit topology team
 */
public enum Polarity {
    /**
     * Negative terminal on the preceding net, positive terminal on the following one.
     */
    NEG_POS("-+"),
    /**
     * Positive terminal on the preceding net, negative terminal on the following one.
     */
    POS_NEG("+-");

    private final String token;

    Polarity(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public Polarity reverse() {
        return this == NEG_POS ? POS_NEG : NEG_POS;
    }

    public static Polarity fromToken(String token) {
        for (Polarity polarity : values()) {
            if (polarity.token.equals(token)) {
                return polarity;
            }
        }
        throw new PowsyblException("Unknown polarity token: '" + token + "'");
    }
}
