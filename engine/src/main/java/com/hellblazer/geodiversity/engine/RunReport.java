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
package com.hellblazer.geodiversity.engine;

import com.hellblazer.geodiversity.engine.metric.MetricCode;
import com.hellblazer.geodiversity.engine.output.FieldPlan;
import com.hellblazer.geodiversity.engine.validation.ExtentRelation;
import com.hellblazer.geodiversity.resource.ResourceCleanupException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a completed run: the values written and everything recoverable that happened on the way
 *
 * @author hal.hildebrand
 */
public final class RunReport {

    private final MetricCode                     metric;
    private final FieldPlan                      fields;
    private final Map<Long, Double>              results;
    private final ExtentRelation                 extentRelation;
    private final long                           read;
    private final long                           assigned;
    private final long                           dropped;
    private final Map<SkipReason, Long>          skipped;
    private final List<SparseZoneWarning>        sparseZones;
    private final List<ResourceCleanupException> cleanupFailures;

    public RunReport(MetricCode metric, FieldPlan fields, Map<Long, Double> results, ExtentRelation extentRelation,
                     RunDiagnostics diagnostics, List<ResourceCleanupException> cleanupFailures) {
        this.metric = metric;
        this.fields = fields;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.extentRelation = extentRelation;
        this.read = diagnostics.getRead();
        this.assigned = diagnostics.getAssigned();
        this.dropped = diagnostics.getDropped();
        var skips = new EnumMap<SkipReason, Long>(SkipReason.class);
        skips.putAll(diagnostics.getSkipped());
        this.skipped = Collections.unmodifiableMap(skips);
        this.sparseZones = List.copyOf(diagnostics.getSparseZones());
        this.cleanupFailures = List.copyOf(cleanupFailures);
    }

    public MetricCode getMetric() {
        return metric;
    }

    public FieldPlan getFields() {
        return fields;
    }

    /**
     * The fields written, the metric field first
     */
    public List<String> getFieldNames() {
        var names = new ArrayList<String>(2);
        names.add(fields.field());
        if (fields.companion() != null) {
            names.add(fields.companion());
        }
        return names;
    }

    /**
     * Value per zone in ascending zone id order, NaN for no data
     */
    public Map<Long, Double> getResults() {
        return results;
    }

    public double getResult(long zoneId) {
        return results.getOrDefault(zoneId, Double.NaN);
    }

    public ExtentRelation getExtentRelation() {
        return extentRelation;
    }

    public long getRead() {
        return read;
    }

    public long getAssigned() {
        return assigned;
    }

    public long getDropped() {
        return dropped;
    }

    public long getSkipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0L);
    }

    public Map<SkipReason, Long> getSkipped() {
        return skipped;
    }

    public List<SparseZoneWarning> getSparseZones() {
        return sparseZones;
    }

    public List<ResourceCleanupException> getCleanupFailures() {
        return cleanupFailures;
    }

    @Override
    public String toString() {
        return String.format("RunReport[%s -> %s, zones=%d, extent=%s, read=%d, assigned=%d, dropped=%d, skipped=%s, "
                             + "sparse=%d, cleanupFailures=%d]", metric.getCode(), getFieldNames(), results.size(),
                             extentRelation, read, assigned, dropped, skipped, sparseZones.size(),
                             cleanupFailures.size());
    }
}
