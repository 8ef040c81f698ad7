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

import com.hellblazer.geodiversity.engine.host.RasterSample;
import com.hellblazer.geodiversity.engine.zone.Zone;

/**
 * Accumulation and reduction rule of a raster metric
 *
 * @param <A> the accumulator the metric folds cell values into
 * @author hal.hildebrand
 */
public abstract class RasterMetric<A extends ZoneAccumulator> {

    private final MetricCode code;

    protected RasterMetric(MetricCode code) {
        this.code = code;
    }

    /**
     * @param code         the raster metric
     * @param inputUnit    unit of angular cell values, used by R_SDc
     * @param outputUnit   unit of the circular dispersion written back, used by R_SDc
     * @param reliefScales number of window scales, used by R_M
     */
    public static RasterMetric<?> of(MetricCode code, AngleUnit inputUnit, AngleUnit outputUnit, int reliefScales) {
        switch (code) {
            case R_SD:
                return new Dispersion();
            case R_SDC:
                return new CircularDispersion(inputUnit, outputUnit);
            case R_M:
                return new Relief(reliefScales);
            default:
                throw new IllegalArgumentException(code.getCode() + " is not computed from a raster");
        }
    }

    /**
     * Mean of cell values, used for the slope mask of R_SDc
     */
    public static RasterMetric<MomentAccumulator> mean() {
        return new RasterMetric<>(MetricCode.R_SD) {
            @Override
            public MomentAccumulator newAccumulator(Zone zone) {
                return new MomentAccumulator();
            }

            @Override
            public void accumulate(MomentAccumulator accumulator, RasterSample sample) {
                accumulator.add(sample.value());
            }

            @Override
            public double reduce(MomentAccumulator accumulator) {
                return accumulator == null ? Double.NaN : accumulator.getMean();
            }
        };
    }

    public MetricCode getCode() {
        return code;
    }

    public abstract A newAccumulator(Zone zone);

    public abstract void accumulate(A accumulator, RasterSample sample);

    /**
     * @param accumulator the zone's state, null if no valid cell fell into the zone
     */
    public abstract double reduce(A accumulator);

    private static final class Dispersion extends RasterMetric<MomentAccumulator> {
        private Dispersion() {
            super(MetricCode.R_SD);
        }

        @Override
        public MomentAccumulator newAccumulator(Zone zone) {
            return new MomentAccumulator();
        }

        @Override
        public void accumulate(MomentAccumulator accumulator, RasterSample sample) {
            accumulator.add(sample.value());
        }

        @Override
        public double reduce(MomentAccumulator accumulator) {
            return MetricCalculator.standardDeviation(accumulator);
        }
    }

    private static final class CircularDispersion extends RasterMetric<CircularAccumulator> {
        private final AngleUnit inputUnit;
        private final AngleUnit outputUnit;

        private CircularDispersion(AngleUnit inputUnit, AngleUnit outputUnit) {
            super(MetricCode.R_SDC);
            this.inputUnit = inputUnit;
            this.outputUnit = outputUnit;
        }

        @Override
        public CircularAccumulator newAccumulator(Zone zone) {
            return new CircularAccumulator();
        }

        @Override
        public void accumulate(CircularAccumulator accumulator, RasterSample sample) {
            accumulator.add(inputUnit.toRadians(sample.value()));
        }

        @Override
        public double reduce(CircularAccumulator accumulator) {
            var radians = MetricCalculator.circularStandardDeviation(accumulator);
            return Double.isFinite(radians) ? outputUnit.fromRadians(radians) : radians;
        }
    }

    private static final class Relief extends RasterMetric<ReliefAccumulator> {
        private final int scales;

        private Relief(int scales) {
            super(MetricCode.R_M);
            this.scales = scales;
        }

        @Override
        public ReliefAccumulator newAccumulator(Zone zone) {
            return new ReliefAccumulator(zone.getExtent(), zone.getGeometry().getArea(), scales);
        }

        @Override
        public void accumulate(ReliefAccumulator accumulator, RasterSample sample) {
            accumulator.add(sample.x(), sample.y(), sample.value());
        }

        @Override
        public double reduce(ReliefAccumulator accumulator) {
            return MetricCalculator.relief(accumulator);
        }
    }
}
