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
 * Streaming mean and sum of squared deviations (Welford). Stable under large constant offsets, where the naive
 * E[x^2] - E[x]^2 form cancels catastrophically.
 *
 * @author hal.hildebrand
 */
public class MomentAccumulator extends ZoneAccumulator {

    private long   count;
    private double mean;
    private double m2;

    public void add(double value) {
        count++;
        var delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    public double getMean() {
        return count == 0 ? Double.NaN : mean;
    }

    /**
     * Sum of squared deviations from the mean
     */
    public double getM2() {
        return m2;
    }

    @Override
    public long sampleCount() {
        return count;
    }
}
