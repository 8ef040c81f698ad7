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

import com.hellblazer.geodiversity.common.CategoryCode;
import com.hellblazer.geodiversity.engine.feature.AssignmentRule;
import com.hellblazer.geodiversity.engine.zone.Zone;

/**
 * Accumulation and reduction rule of a vector metric
 *
 * @param <A> the accumulator the metric folds contributions into
 * @author hal.hildebrand
 */
public abstract class FeatureMetric<A extends ZoneAccumulator> {

    private final MetricCode     code;
    private final AssignmentRule rule;

    protected FeatureMetric(MetricCode code, AssignmentRule rule) {
        this.code = code;
        this.rule = rule;
    }

    public static FeatureMetric<?> of(MetricCode code) {
        switch (code) {
            case A_NE:
                return new ElementCount(code, AssignmentRule.SINGLE_PARTS);
            case P_NE:
                return new ElementCount(code, AssignmentRule.POINT);
            case A_NC:
                return new CategoryRichness(code, AssignmentRule.PRESENCE);
            case P_NC:
                return new CategoryRichness(code, AssignmentRule.POINT);
            case A_SHDI:
                return new CategoryEntropy(code, AssignmentRule.AREA);
            case P_HU:
                return new CategoryEntropy(code, AssignmentRule.POINT);
            case L_TL:
                return new TotalLength(code);
            default:
                throw new IllegalArgumentException(code.getCode() + " is not computed from vector features");
        }
    }

    public MetricCode getCode() {
        return code;
    }

    public AssignmentRule getRule() {
        return rule;
    }

    public abstract A newAccumulator(Zone zone);

    /**
     * @param category the feature's category, null for metrics that ignore categories
     * @param weight   the feature's share in the zone, as measured by the assignment rule
     */
    public abstract void accumulate(A accumulator, CategoryCode category, double weight);

    /**
     * @param accumulator the zone's state, null if nothing fell into the zone
     */
    public abstract double reduce(A accumulator);

    private static final class ElementCount extends FeatureMetric<CountAccumulator> {
        private ElementCount(MetricCode code, AssignmentRule rule) {
            super(code, rule);
        }

        @Override
        public CountAccumulator newAccumulator(Zone zone) {
            return new CountAccumulator();
        }

        @Override
        public void accumulate(CountAccumulator accumulator, CategoryCode category, double weight) {
            accumulator.add(Math.round(weight));
        }

        @Override
        public double reduce(CountAccumulator accumulator) {
            return MetricCalculator.count(accumulator);
        }
    }

    private static final class CategoryRichness extends FeatureMetric<CategorySetAccumulator> {
        private CategoryRichness(MetricCode code, AssignmentRule rule) {
            super(code, rule);
        }

        @Override
        public CategorySetAccumulator newAccumulator(Zone zone) {
            return new CategorySetAccumulator();
        }

        @Override
        public void accumulate(CategorySetAccumulator accumulator, CategoryCode category, double weight) {
            accumulator.add(category);
        }

        @Override
        public double reduce(CategorySetAccumulator accumulator) {
            return MetricCalculator.richness(accumulator);
        }
    }

    private static final class CategoryEntropy extends FeatureMetric<CategoryWeightAccumulator> {
        private CategoryEntropy(MetricCode code, AssignmentRule rule) {
            super(code, rule);
        }

        @Override
        public CategoryWeightAccumulator newAccumulator(Zone zone) {
            return new CategoryWeightAccumulator();
        }

        @Override
        public void accumulate(CategoryWeightAccumulator accumulator, CategoryCode category, double weight) {
            accumulator.add(category, weight);
        }

        @Override
        public double reduce(CategoryWeightAccumulator accumulator) {
            return MetricCalculator.shannon(accumulator);
        }
    }

    private static final class TotalLength extends FeatureMetric<SumAccumulator> {
        private TotalLength(MetricCode code) {
            super(code, AssignmentRule.LENGTH);
        }

        @Override
        public SumAccumulator newAccumulator(Zone zone) {
            return new SumAccumulator();
        }

        @Override
        public void accumulate(SumAccumulator accumulator, CategoryCode category, double weight) {
            accumulator.add(weight);
        }

        @Override
        public double reduce(SumAccumulator accumulator) {
            return MetricCalculator.totalLength(accumulator);
        }
    }
}
