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
 * Compensated running sum of an extensive measure
 *
 * @author hal.hildebrand
 */
public class SumAccumulator extends ZoneAccumulator {

    private double sum;
    private double compensation;
    private long   samples;

    public void add(double value) {
        var y = value - compensation;
        var t = sum + y;
        compensation = (t - sum) - y;
        sum = t;
        samples++;
    }

    public double getSum() {
        return sum;
    }

    @Override
    public long sampleCount() {
        return samples;
    }
}
