/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Geodiversity.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.geodiversity.common;

/**
 * Classification of the conditions a geodiversity run can report. Fatal kinds abort a run before any attribute
 * table is mutated; recoverable kinds are aggregated and reported once the run completes.
 *
 * @author hal.hildebrand
 */
public enum ErrorKind {
    /**
     * Empty zone set, missing required input or an invalid metric/option combination
     */
    CONFIGURATION(true),
    /**
     * The grid and the feature layer share no area, or declare different coordinate references
     */
    SPATIAL_MISMATCH(true),
    /**
     * An input lives in a container format that cannot carry the engine's guarantees
     */
    FORMAT_REJECTED(true),
    /**
     * A feature carries a missing or non-discrete category value
     */
    CATEGORY_DOMAIN(false),
    /**
     * A zone does not hold enough samples for the requested metric
     */
    SPARSE_ZONE(false),
    /**
     * An intermediate artifact could not be released
     */
    RESOURCE_CLEANUP(false),
    /**
     * The run was interrupted from outside
     */
    INTERRUPTED(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
