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
package com.hellblazer.geodiversity.engine.metric;

/**
 * Running state of one metric for one zone. Created on the first contribution a zone receives.
 *
 * @author hal.hildebrand
 */
public abstract class ZoneAccumulator {

    private boolean sawNoData;

    /**
     * Number of contributions folded in so far
     */
    public abstract long sampleCount();

    /**
     * Record that a NoData cell fell in the zone
     */
    public void markNoData() {
        sawNoData = true;
    }

    public boolean sawNoData() {
        return sawNoData;
    }
}
