/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl circuit topology team
 */
class CircuitTopologyParametersTest {

    @Test
    void testDefaults() {
        CircuitTopologyParameters parameters = new CircuitTopologyParameters();
        assertEquals(List.of("GND", "VDD"), parameters.getPreferredRails());
        assertEquals(List.of("VDD", "GND", "VSS", "VCC"), parameters.getWellKnownRails());
        assertEquals(Set.of("GND", "VDD"), parameters.getSignificantNets());
        assertEquals("CircuitTopologyParameters(preferredRails=[GND, VDD], wellKnownRails=[VDD, GND, VSS, VCC], significantNets="
                + parameters.getSignificantNets() + ")", parameters.toString());
    }

    @Test
    void testSetters() {
        CircuitTopologyParameters parameters = new CircuitTopologyParameters()
                .setPreferredRails(List.of("VSS"))
                .setWellKnownRails(List.of("VSS", "VEE"))
                .setSignificantNets(Set.of("VSS"));
        assertEquals(List.of("VSS"), parameters.getPreferredRails());
        assertEquals(List.of("VSS", "VEE"), parameters.getWellKnownRails());
        assertEquals(Set.of("VSS"), parameters.getSignificantNets());
    }

    @Test
    void testInvalidRails() {
        CircuitTopologyParameters parameters = new CircuitTopologyParameters();
        List<String> empty = List.of("GND", "");
        PowsyblException e = assertThrows(PowsyblException.class, () -> parameters.setPreferredRails(empty));
        assertEquals("Empty name in preferred rails", e.getMessage());
        List<String> dotted = List.of("M1.G");
        e = assertThrows(PowsyblException.class, () -> parameters.setWellKnownRails(dotted));
        assertEquals("Rail name 'M1.G' in well known rails cannot be a device terminal", e.getMessage());
        List<String> twice = List.of("GND", "GND");
        e = assertThrows(PowsyblException.class, () -> parameters.setPreferredRails(twice));
        assertEquals("Rail name 'GND' appears twice in preferred rails", e.getMessage());
    }
}
