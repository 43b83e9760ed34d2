/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.net;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl circuit topology team
 */
class NetKeyTest {

    @Test
    void testParse() {
        assertEquals(new NetKey.Named("in"), NetKey.parse("in"));
        assertEquals(new NetKey.DeviceTerminal("M1", "G"), NetKey.parse("M1.G"));
        assertEquals(NetKey.Kind.NAMED, NetKey.parse(".x").getKind());
        assertEquals(NetKey.Kind.NAMED, NetKey.parse("x.").getKind());
    }

    @Test
    void testParseImplicit() {
        assertEquals(NetKey.implicit(0), NetKey.parse("_implicit_0"));
        assertEquals(NetKey.implicit(12), NetKey.parse("_implicit_12"));
        assertEquals(NetKey.named("_implicit_012"), NetKey.parse("_implicit_012"));
        assertEquals(NetKey.named("_implicit_"), NetKey.parse("_implicit_"));
        assertEquals(NetKey.named("_implicit_x"), NetKey.parse("_implicit_x"));
        assertEquals(NetKey.named("_implicit_99999999999"), NetKey.parse("_implicit_99999999999"));
        assertEquals(NetKey.Kind.DEVICE_TERMINAL, NetKey.parse("_implicit_0.p").getKind());
        assertEquals(OptionalInt.of(7), NetKey.getImplicitIndex("_implicit_7"));
        assertEquals(OptionalInt.empty(), NetKey.getImplicitIndex("in"));
    }

    @Test
    void testNames() {
        assertEquals("GND", NetKey.named("GND").getName());
        assertEquals("M1.D", NetKey.deviceTerminal("M1", "D").getName());
        assertEquals("_implicit_3", NetKey.implicit(3).getName());
        assertEquals("_implicit_3", NetKey.implicit(3).toString());
        assertTrue(NetKey.implicit(0).isImplicit());
        assertFalse(NetKey.named("_implicit_0").isImplicit());
    }

    @Test
    void testInvalidKeys() {
        PowsyblException e = assertThrows(PowsyblException.class, () -> NetKey.named(""));
        assertEquals("Net name is empty", e.getMessage());
        assertThrows(PowsyblException.class, () -> NetKey.deviceTerminal("M1", ""));
        assertThrows(PowsyblException.class, () -> NetKey.implicit(-1));
    }

    @Test
    void testDisplayOrder() {
        List<NetKey> keys = new ArrayList<>(List.of(NetKey.named("out"), NetKey.deviceTerminal("M1", "D"),
                NetKey.named("b"), NetKey.named("a"), NetKey.implicit(0)));
        keys.sort(NetKey.DISPLAY_ORDER);
        assertEquals(List.of(NetKey.named("a"), NetKey.named("b"), NetKey.named("out"), NetKey.deviceTerminal("M1", "D"),
                NetKey.implicit(0)), keys);
    }

    @Test
    void testComparatorSeparatesKindsWithSameName() {
        NetKey named = NetKey.named("M1.G");
        NetKey terminal = NetKey.deviceTerminal("M1", "G");
        assertNotEquals(named, terminal);
        assertTrue(NetKey.COMPARATOR.compare(named, terminal) < 0);
    }
}
