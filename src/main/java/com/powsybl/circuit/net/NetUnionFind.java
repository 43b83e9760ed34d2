/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.net;

import org.jgrapht.alg.util.UnionFind;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Union-find over net keys where the representative of a merged set is chosen by rail priority
 * instead of by rank.
 * <ul>
 *     <li>if exactly one root is a preferred rail, it wins,</li>
 *     <li>if both roots are preferred rails, the one listed first wins,</li>
 *     <li>otherwise the root of the second element wins.</li>
 * </ul>
 *
 * @author PowSyBl circuit topology team
 */
class NetUnionFind extends UnionFind<NetKey> {

    private final List<String> preferredRails;

    NetUnionFind(List<String> preferredRails) {
        super(Collections.emptySet());
        this.preferredRails = List.copyOf(Objects.requireNonNull(preferredRails));
    }

    int getRailRank(NetKey key) {
        if (key.getKind() != NetKey.Kind.NAMED) {
            return -1;
        }
        return preferredRails.indexOf(key.getName());
    }

    boolean isPreferredRail(NetKey key) {
        return getRailRank(key) >= 0;
    }

    @Override
    public void union(NetKey key1, NetKey key2) {
        merge(key1, key2);
    }

    /**
     * @return true if two distinct sets have been merged
     */
    boolean merge(NetKey key1, NetKey key2) {
        NetKey root1 = find(key1);
        NetKey root2 = find(key2);
        if (root1.equals(root2)) {
            return false;
        }
        int rank1 = getRailRank(root1);
        int rank2 = getRailRank(root2);
        NetKey winner;
        if (rank1 >= 0 && rank2 >= 0) {
            winner = rank1 < rank2 ? root1 : root2;
        } else if (rank1 >= 0) {
            winner = root1;
        } else {
            winner = root2;
        }
        NetKey loser = winner == root1 ? root2 : root1;
        getParentMap().put(loser, winner);
        return true;
    }

    @Override
    public int numberOfSets() {
        return (int) getParentMap().entrySet().stream()
                .filter(e -> e.getKey().equals(e.getValue()))
                .count();
    }
}
