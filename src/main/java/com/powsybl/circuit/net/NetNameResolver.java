/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.net;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Picks the most readable name of an equivalence class of nets. Candidates are looked for in this
 * order, each tier sorted by {@link NetKey#DISPLAY_ORDER}:
 * <ol>
 *     <li>user names which are not known rails,</li>
 *     <li>known rails,</li>
 *     <li>device terminals,</li>
 *     <li>any other non implicit key,</li>
 *     <li>the canonical key itself.</li>
 * </ol>
 *
 * @author PowSyBl circuit topology team
 */
public final class NetNameResolver {

    private NetNameResolver() {
    }

    /**
     * @param allowImplicit whether an implicit name is acceptable; the last tier is only reached for
     *                      classes made of implicit keys, which have no other name, so the canonical
     *                      key is returned in both cases
     */
    public static NetKey getPreferredName(NetKey canonicalNet, NetRegistry registry, Set<String> knownRails, boolean allowImplicit) {
        Objects.requireNonNull(canonicalNet);
        Objects.requireNonNull(registry);
        Objects.requireNonNull(knownRails);
        Set<NetKey> members = registry.members(canonicalNet);
        if (members.isEmpty()) {
            return canonicalNet;
        }
        Predicate<NetKey> isKnownRail = key -> key.getKind() == NetKey.Kind.NAMED && knownRails.contains(key.getName());
        return first(members, key -> key.getKind() == NetKey.Kind.NAMED && !isKnownRail.test(key))
                .or(() -> first(members, isKnownRail))
                .or(() -> first(members, key -> key.getKind() == NetKey.Kind.DEVICE_TERMINAL))
                .or(() -> first(members, key -> !key.isImplicit()))
                .orElse(canonicalNet);
    }

    private static Optional<NetKey> first(Collection<NetKey> members, Predicate<NetKey> filter) {
        return members.stream()
                .filter(filter)
                .min(NetKey.DISPLAY_ORDER);
    }
}
