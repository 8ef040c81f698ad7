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
 * Reductions of finished accumulators into index values. Pure functions; NaN means no data.
 *
 * @author hal.hildebrand
 */
public final class MetricCalculator {

    private MetricCalculator() {
    }

    /**
     * A_Ne and P_Ne
     */
    public static double count(CountAccumulator accumulator) {
        return accumulator == null ? 0.0 : accumulator.getCount();
    }

    /**
     * A_Nc and P_Nc: the number of distinct categories
     */
    public static double richness(CategorySetAccumulator accumulator) {
        return accumulator == null ? Double.NaN : accumulator.getCategories().size();
    }

    /**
     * A_SHDI and P_Hu: Shannon entropy -sum(p ln p) of the category weights
     */
    public static double shannon(CategoryWeightAccumulator accumulator) {
        if (accumulator == null) {
            return Double.NaN;
        }
        return shannon(accumulator.getWeights().values().stream().mapToDouble(Double::doubleValue).toArray());
    }

    public static double shannon(double... weights) {
        double total = 0.0;
        for (double w : weights) {
            if (w > 0) {
                total += w;
            }
        }
        if (total <= 0.0) {
            return Double.NaN;
        }
        double h = 0.0;
        for (double w : weights) {
            if (w > 0) {
                var p = w / total;
                h -= p * Math.log(p);
            }
        }
        // rounding can leave -0.0 or a hair below zero for a single category
        return Math.max(0.0, h);
    }

    /**
     * L_Tl
     */
    public static double totalLength(SumAccumulator accumulator) {
        return accumulator == null ? Double.NaN : accumulator.getSum();
    }

    /**
     * R_SD: population standard deviation
     */
    public static double standardDeviation(MomentAccumulator accumulator) {
        if (accumulator == null || accumulator.sampleCount() == 0) {
            return Double.NaN;
        }
        return Math.sqrt(Math.max(0.0, accumulator.getM2() / accumulator.sampleCount()));
    }

    /**
     * R_SDc: circular standard deviation sqrt(-2 ln R) in radians, where R is the mean resultant length. Infinite
     * when the directions cancel exactly.
     */
    public static double circularStandardDeviation(CircularAccumulator accumulator) {
        if (accumulator == null || accumulator.sampleCount() == 0) {
            return Double.NaN;
        }
        return circularStandardDeviation(accumulator.meanResultantLength());
    }

    public static double circularStandardDeviation(double meanResultantLength) {
        if (Double.isNaN(meanResultantLength)) {
            return Double.NaN;
        }
        if (meanResultantLength <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        if (meanResultantLength >= 1.0) {
            return 0.0;
        }
        return Math.sqrt(-2.0 * Math.log(meanResultantLength));
    }

    /**
     * R_M: sum over scales of the mean within-window elevation range, divided by the square root of the zone area so
     * that the index does not grow with zone size
     *
     * @return the relief index, NaN without samples or for a zone of no area
     */
    public static double relief(ReliefAccumulator accumulator) {
        if (accumulator == null || accumulator.sampleCount() == 0 || !(accumulator.getArea() > 0.0)) {
            return Double.NaN;
        }
        double total = 0.0;
        for (int scale = 0; scale < accumulator.getScales(); scale++) {
            var range = accumulator.meanRange(scale);
            if (!Double.isNaN(range)) {
                total += range;
            }
        }
        return total / Math.sqrt(accumulator.getArea());
    }
}
