/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.component;

import com.powsybl.commons.PowsyblException;

import java.util.*;

/**
 * In memory component database pre-filled with the usual passive, source, transistor and amplifier
 * types. More types can be registered.
 *
 * @author PowSyBl circuit topology team
 */
public class DefaultComponentDatabase implements ComponentDatabase {

    private final Map<String, ComponentTypeInfo> types = new LinkedHashMap<>();

    public DefaultComponentDatabase() {
        register(new ComponentTypeInfo("R", 2, List.of(), false, false));
        register(new ComponentTypeInfo("C", 2, List.of(), false, false));
        register(new ComponentTypeInfo("L", 2, List.of(), false, false));
        register(new ComponentTypeInfo("Nmos", 4, List.of("G", "D", "S", "B"), true, false));
        register(new ComponentTypeInfo("Pmos", 4, List.of("G", "D", "S", "B"), true, false));
        register(new ComponentTypeInfo("V", 2, List.of("pos", "neg"), false, false));
        register(new ComponentTypeInfo("I", 2, List.of("pos", "neg"), false, false));
        // supply pins are optional so they are listed for ordering only
        register(new ComponentTypeInfo("Opamp", 3, List.of("IN+", "IN-", "OUT", "V+", "V-"), true, false));
        register(new ComponentTypeInfo(CONTROLLED_SOURCE_TYPE, 2, List.of("par_t1", "par_t2"), false, true));
        register(new ComponentTypeInfo(NOISE_SOURCE_TYPE, 2, List.of("par_t1", "par_t2"), false, true));
    }

    public final DefaultComponentDatabase register(ComponentTypeInfo info) {
        Objects.requireNonNull(info);
        if (info.arity() <= 0) {
            throw new PowsyblException("Component type '" + info.type() + "' has an invalid arity: " + info.arity());
        }
        types.put(info.type(), info);
        return this;
    }

    public Optional<ComponentTypeInfo> getTypeInfo(String componentType) {
        return Optional.ofNullable(types.get(componentType));
    }

    public Set<String> getTypes() {
        return Collections.unmodifiableSet(types.keySet());
    }

    @Override
    public OptionalInt getArity(String componentType) {
        ComponentTypeInfo info = types.get(componentType);
        return info != null ? OptionalInt.of(info.arity()) : OptionalInt.empty();
    }

    @Override
    public boolean isMultiTerminal(String componentType) {
        return getTypeInfo(componentType).map(ComponentTypeInfo::multiTerminal).orElse(false);
    }

    @Override
    public List<String> getPreferredTerminalOrder(String componentType) {
        return getTypeInfo(componentType).map(ComponentTypeInfo::terminals).orElse(Collections.emptyList());
    }
}
