/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.net;

import com.powsybl.circuit.CircuitTopologyParameters;

import java.util.*;

/**
 * Equivalence classes of net keys. Each class has one canonical representative, always a preferred
 * rail (GND, VDD by default) when the class contains one.
 *
 * @author PowSyBl circuit topology team
 */
public class NetRegistry {

    private final NetUnionFind unionFind;

    private final Set<NetKey> keys = new LinkedHashSet<>();

    public NetRegistry() {
        this(CircuitTopologyParameters.PREFERRED_RAILS_DEFAULT_VALUE);
    }

    /**
     * @param preferredRails rail names favored as representatives, highest priority first
     */
    public NetRegistry(List<String> preferredRails) {
        this.unionFind = new NetUnionFind(preferredRails);
    }

    /**
     * @return true if the key was not yet known
     */
    public boolean add(NetKey key) {
        Objects.requireNonNull(key);
        if (keys.add(key)) {
            unionFind.addElement(key);
            return true;
        }
        return false;
    }

    public boolean contains(NetKey key) {
        return keys.contains(key);
    }

    /**
     * Canonical representative of the class of the given key, the key being added if unknown.
     */
    public NetKey find(NetKey key) {
        add(key);
        return unionFind.find(key);
    }

    /**
     * @return true if two distinct classes have been merged
     */
    public boolean union(NetKey key1, NetKey key2) {
        add(key1);
        add(key2);
        return unionFind.merge(key1, key2);
    }

    public boolean isPreferredRail(NetKey key) {
        return unionFind.isPreferredRail(key);
    }

    /**
     * Priority of a preferred rail, 0 being the highest, -1 for keys which are not preferred rails.
     */
    public int getRailRank(NetKey key) {
        return unionFind.getRailRank(key);
    }

    /**
     * Members of the class of the given key, in registration order. Empty for an unknown key.
     */
    public Set<NetKey> members(NetKey key) {
        if (!contains(key)) {
            return Collections.emptySet();
        }
        NetKey representative = unionFind.find(key);
        Set<NetKey> members = new LinkedHashSet<>();
        for (NetKey other : keys) {
            if (unionFind.find(other).equals(representative)) {
                members.add(other);
            }
        }
        return members;
    }

    /**
     * Registered keys in registration order.
     */
    public Set<NetKey> getKeys() {
        return Collections.unmodifiableSet(keys);
    }

    public Set<NetKey> getRepresentatives() {
        Set<NetKey> representatives = new LinkedHashSet<>();
        for (NetKey key : keys) {
            representatives.add(unionFind.find(key));
        }
        return representatives;
    }

    public int getClassCount() {
        return unionFind.numberOfSets();
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }
}
