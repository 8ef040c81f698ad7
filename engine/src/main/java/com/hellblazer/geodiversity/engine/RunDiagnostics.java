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

import com.hellblazer.geodiversity.common.CategoryDomainException;
import com.hellblazer.geodiversity.engine.metric.MetricCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Recoverable conditions met during one run, aggregated for the run report rather than raised one by one. Confined
 * to the run's thread.
 *
 * @author hal.hildebrand
 */
public class RunDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(RunDiagnostics.class);

    private final MetricCode              metric;
    private final Map<SkipReason, Long>   skipped      = new EnumMap<>(SkipReason.class);
    private final List<SparseZoneWarning> sparseZones  = new ArrayList<>();
    private       long                    read;
    private       long                    assigned;
    private       long                    dropped;

    public RunDiagnostics(MetricCode metric) {
        this.metric = metric;
    }

    public void read() {
        read++;
    }

    public void assigned() {
        assigned++;
    }

    /**
     * The input fell outside every zone
     */
    public void dropped() {
        dropped++;
    }

    public void skipped(SkipReason reason) {
        skipped.merge(reason, 1L, Long::sum);
    }

    public void rejected(long fid, CategoryDomainException e) {
        skipped(SkipReason.CATEGORY_DOMAIN);
        log.debug("Feature {} skipped: {}", fid, e.getMessage());
    }

    public void sparse(long zoneId, long samples, int required) {
        var warning = new SparseZoneWarning(zoneId, metric, samples, required);
        sparseZones.add(warning);
        log.debug("Sparse {}", warning);
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
        return Collections.unmodifiableMap(skipped);
    }

    public List<SparseZoneWarning> getSparseZones() {
        return Collections.unmodifiableList(sparseZones);
    }

    /**
     * Log the aggregated warnings once, at the end of the streaming pass
     */
    public void summarize() {
        var rejected = getSkipped(SkipReason.CATEGORY_DOMAIN);
        if (rejected > 0) {
            log.warn("{}: {} features skipped for missing or non-discrete category values", metric.getCode(),
                     rejected);
        }
        var nullGeometry = getSkipped(SkipReason.NULL_GEOMETRY);
        if (nullGeometry > 0) {
            log.warn("{}: {} features skipped for missing geometry", metric.getCode(), nullGeometry);
        }
        if (!sparseZones.isEmpty()) {
            log.warn("{}: {} zones held too few samples and received no data", metric.getCode(), sparseZones.size());
        }
        log.info("{}: read {}, assigned {}, outside grid {}, skipped {}", metric.getCode(), read, assigned, dropped,
                 skipped);
    }
}
