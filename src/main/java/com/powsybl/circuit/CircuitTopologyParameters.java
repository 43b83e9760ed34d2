/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit;

import com.powsybl.commons.PowsyblException;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * Tuning of the circuit topology algorithms.
 *
 * @author PowSyBl circuit topology team
 */
public class CircuitTopologyParameters {

    /**
     * Rails favored as canonical net representatives, highest priority first.
     */
    public static final List<String> PREFERRED_RAILS_DEFAULT_VALUE = List.of("GND", "VDD");

    /**
     * Rails checked pairwise by the short circuit detector, in checking order.
     */
    public static final List<String> WELL_KNOWN_RAILS_DEFAULT_VALUE = List.of("VDD", "GND", "VSS", "VCC");

    /**
     * Nets the naming resolver ranks after plain user names.
     */
    public static final Set<String> SIGNIFICANT_NETS_DEFAULT_VALUE = Set.of("GND", "VDD");

    private List<String> preferredRails = PREFERRED_RAILS_DEFAULT_VALUE;

    private List<String> wellKnownRails = WELL_KNOWN_RAILS_DEFAULT_VALUE;

    private Set<String> significantNets = SIGNIFICANT_NETS_DEFAULT_VALUE;

    private static List<String> checkRailNames(List<String> names, String what) {
        Objects.requireNonNull(names);
        Set<String> unique = new HashSet<>();
        for (String name : names) {
            if (StringUtils.isEmpty(name)) {
                throw new PowsyblException("Empty name in " + what);
            }
            if (name.indexOf('.') >= 0) {
                throw new PowsyblException("Rail name '" + name + "' in " + what + " cannot be a device terminal");
            }
            if (!unique.add(name)) {
                throw new PowsyblException("Rail name '" + name + "' appears twice in " + what);
            }
        }
        return List.copyOf(names);
    }

    public List<String> getPreferredRails() {
        return preferredRails;
    }

    public CircuitTopologyParameters setPreferredRails(List<String> preferredRails) {
        this.preferredRails = checkRailNames(preferredRails, "preferred rails");
        return this;
    }

    public List<String> getWellKnownRails() {
        return wellKnownRails;
    }

    public CircuitTopologyParameters setWellKnownRails(List<String> wellKnownRails) {
        this.wellKnownRails = checkRailNames(wellKnownRails, "well known rails");
        return this;
    }

    public Set<String> getSignificantNets() {
        return significantNets;
    }

    public CircuitTopologyParameters setSignificantNets(Set<String> significantNets) {
        this.significantNets = Set.copyOf(checkRailNames(new ArrayList<>(Objects.requireNonNull(significantNets)), "significant nets"));
        return this;
    }

    @Override
    public String toString() {
        return "CircuitTopologyParameters(" +
                "preferredRails=" + preferredRails +
                ", wellKnownRails=" + wellKnownRails +
                ", significantNets=" + significantNets +
                ')';
    }
}
