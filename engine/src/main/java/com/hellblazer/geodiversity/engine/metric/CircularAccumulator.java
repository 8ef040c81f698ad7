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

import javax.vecmath.Vector2d;

/**
 * Resultant of the unit vectors of angular samples
 *
 * @author hal.hildebrand
 */
public class CircularAccumulator extends ZoneAccumulator {

    private final Vector2d resultant = new Vector2d();
    private       long     count;

    /**
     * @param radians the angle in radians
     */
    public void add(double radians) {
        resultant.x += Math.cos(radians);
        resultant.y += Math.sin(radians);
        count++;
    }

    public Vector2d getResultant() {
        return new Vector2d(resultant);
    }

    /**
     * Length of the mean unit vector, clamped to [0, 1]
     */
    public double meanResultantLength() {
        if (count == 0) {
            return Double.NaN;
        }
        return Math.max(0.0, Math.min(1.0, resultant.length() / count));
    }

    @Override
    public long sampleCount() {
        return count;
    }
}
