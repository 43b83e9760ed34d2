/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuit.component;

import java.util.List;
import java.util.OptionalInt;

/**
 * Metadata about component types: arity and terminal naming conventions.
 *
 * @author PowSyBl circuit topology team
 */
public interface ComponentDatabase {

    /**
     * Type of the internal components created for controlled sources of parallel blocks.
     */
    String CONTROLLED_SOURCE_TYPE = "controlled_source";

    /**
     * Type of the internal components created for noise sources of parallel blocks.
     */
    String NOISE_SOURCE_TYPE = "noise_source";

    /**
     * Number of terminals of the type, empty if the type is unknown.
     */
    OptionalInt getArity(String componentType);

    /**
     * Whether components of this type are described by connection blocks rather than series paths.
     */
    boolean isMultiTerminal(String componentType);

    /**
     * Terminal order used when writing a connection block, possibly empty.
     */
    List<String> getPreferredTerminalOrder(String componentType);
}
