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

import org.locationtech.jts.geom.Envelope;

import java.util.Arrays;

/**
 * Elevation extremes over the finest window partition of a zone. The zone's bounding box is split into
 * 2^(scales-1) x 2^(scales-1) windows; each window keeps the minimum, maximum and number of samples falling in it, and
 * coarser scales are derived by merging blocks of windows. The zone's area is kept to scale the relief to a
 * dimensionless index.
 *
 * @author hal.hildebrand
 */
public class ReliefAccumulator extends ZoneAccumulator {

    private final Envelope extent;
    private final double   area;
    private final int      scales;
    private final int      side;
    private final double[] min;
    private final double[] max;
    private final long[]   counts;
    private       long     total;

    public ReliefAccumulator(Envelope extent, int scales) {
        this(extent, extent.getArea(), scales);
    }

    /**
     * @param extent the zone's bounding box, partitioned into windows
     * @param area   the zone's area, which is smaller than its extent for irregular zones
     * @param scales number of window scales
     */
    public ReliefAccumulator(Envelope extent, double area, int scales) {
        if (scales < 1) {
            throw new IllegalArgumentException("At least one scale required: " + scales);
        }
        this.extent = new Envelope(extent);
        this.area = area;
        this.scales = scales;
        this.side = 1 << (scales - 1);
        this.min = new double[side * side];
        this.max = new double[side * side];
        this.counts = new long[side * side];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
    }

    public void add(double x, double y, double elevation) {
        var window = index(column(x), row(y));
        min[window] = Math.min(min[window], elevation);
        max[window] = Math.max(max[window], elevation);
        counts[window]++;
        total++;
    }

    public double getArea() {
        return area;
    }

    public int getScales() {
        return scales;
    }

    /**
     * Mean elevation range over the windows of one scale that hold samples
     *
     * @param scale 0 for the whole zone, up to scales - 1 for the finest windows
     * @return the mean range, NaN if no window holds a sample
     */
    public double meanRange(int scale) {
        if (scale < 0 || scale >= scales) {
            throw new IllegalArgumentException("Scale out of range: " + scale);
        }
        var windows = 1 << scale;
        var block = side / windows;
        double sum = 0.0;
        int occupied = 0;
        for (int wr = 0; wr < windows; wr++) {
            for (int wc = 0; wc < windows; wc++) {
                var lo = Double.POSITIVE_INFINITY;
                var hi = Double.NEGATIVE_INFINITY;
                long n = 0;
                for (int r = wr * block; r < (wr + 1) * block; r++) {
                    for (int c = wc * block; c < (wc + 1) * block; c++) {
                        var i = index(c, r);
                        if (counts[i] > 0) {
                            lo = Math.min(lo, min[i]);
                            hi = Math.max(hi, max[i]);
                            n += counts[i];
                        }
                    }
                }
                if (n > 0) {
                    sum += hi - lo;
                    occupied++;
                }
            }
        }
        return occupied == 0 ? Double.NaN : sum / occupied;
    }

    @Override
    public long sampleCount() {
        return total;
    }

    private int column(double x) {
        return clamp((int) Math.floor((x - extent.getMinX()) / extent.getWidth() * side));
    }

    private int row(double y) {
        return clamp((int) Math.floor((y - extent.getMinY()) / extent.getHeight() * side));
    }

    private int clamp(int i) {
        return Math.max(0, Math.min(side - 1, i));
    }

    private int index(int column, int row) {
        return row * side + column;
    }
}
