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
package com.hellblazer.geodiversity.engine.output;

import com.hellblazer.geodiversity.engine.host.AttributeTable;
import com.hellblazer.geodiversity.engine.metric.MetricCode;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Derivation and collision resolution of output field names. A default name is the first characters of the source
 * layer name, upper-cased, joined to the metric suffix, e.g. {@code GEO_SHDI} for Shannon diversity of a layer named
 * "geology".
 * <p>
 * A companion is the field name plus {@code _MM}. When that would exceed the maximum length, the field name is cut
 * short and tagged with a digest of the whole name, so long names sharing a prefix keep distinct companions.
 *
 * @author hal.hildebrand
 */
public final class FieldNames {
    public static final String COMPANION_SUFFIX       = "_MM";
    public static final String COMPANION_ALIAS_PREFIX = "Std_";

    private final int maxLength;
    private final int prefixLength;

    public FieldNames(int maxLength, int prefixLength) {
        this.maxLength = maxLength;
        this.prefixLength = prefixLength;
    }

    /**
     * Replace characters a geodatabase field name cannot hold and bound the length
     */
    public String sanitize(String raw) {
        var cleaned = raw == null ? "" : raw.trim().replaceAll("[^A-Za-z0-9_]", "_");
        if (cleaned.isEmpty() || !Character.isLetter(cleaned.charAt(0))) {
            cleaned = "F" + cleaned;
        }
        return truncate(cleaned, maxLength);
    }

    public String prefix(String layerName) {
        var cleaned = layerName.trim().replaceAll("[^A-Za-z0-9_]", "_").toUpperCase(Locale.ROOT);
        return cleaned.length() <= prefixLength ? cleaned : cleaned.substring(0, prefixLength);
    }

    public String defaultName(String layerName, MetricCode metric) {
        return sanitize(prefix(layerName) + "_" + metric.getSuffix());
    }

    public String alias(String layerName, MetricCode metric) {
        return prefix(layerName) + "_" + metric.getCode();
    }

    public String companion(String field) {
        if (field.length() + COMPANION_SUFFIX.length() <= maxLength) {
            return field + COMPANION_SUFFIX;
        }
        var room = maxLength - COMPANION_SUFFIX.length();
        var stem = Math.max(1, room - 5);
        var digits = Math.min(4, room - stem - 1);
        return field.substring(0, stem) + "_" + digest(field, digits) + COMPANION_SUFFIX;
    }

    /**
     * Choose the names to write. With {@code overwrite} the requested name is used as is; otherwise a numeric suffix
     * is appended until neither the field nor its companion exists in the table.
     *
     * @param table         the target table
     * @param requested     the sanitized base name
     * @param alias         the display alias
     * @param overwrite     reuse existing fields of the requested name
     * @param withCompanion whether a standardized companion is written too
     */
    public FieldPlan resolve(AttributeTable table, String requested, String alias, boolean overwrite,
                             boolean withCompanion) {
        if (overwrite || isFree(table, requested, withCompanion)) {
            var existing = table.hasField(requested);
            return new FieldPlan(requested, alias, withCompanion ? companion(table, requested, alias, existing) : null,
                                 existing);
        }
        for (int n = 1; ; n++) {
            var tail = "_" + n;
            var candidate = truncate(requested, maxLength - tail.length()) + tail;
            if (isFree(table, candidate, withCompanion)) {
                return new FieldPlan(candidate, alias + tail, withCompanion ? companion(candidate) : null, false);
            }
        }
    }

    /**
     * The companion of an overwritten field. A new field passes over companion names another field already holds. A
     * rerun takes the companion it wrote before, found by its alias, falling back to the plain companion name.
     */
    private String companion(AttributeTable table, String field, String alias, boolean rerun) {
        var companionAlias = COMPANION_ALIAS_PREFIX + alias;
        var first = companion(field);
        var stem = first.substring(0, first.length() - COMPANION_SUFFIX.length());
        for (int n = 0; ; n++) {
            var tail = n == 0 ? "" : "_" + n;
            var candidate = n == 0 ? first
                                   : truncate(stem, maxLength - COMPANION_SUFFIX.length() - tail.length()) + tail
                                     + COMPANION_SUFFIX;
            var held = table.field(candidate);
            if (held.isEmpty()) {
                return rerun ? first : candidate;
            }
            if (rerun && companionAlias.equalsIgnoreCase(held.get().alias())) {
                return candidate;
            }
        }
    }

    private boolean isFree(AttributeTable table, String field, boolean withCompanion) {
        return !table.hasField(field) && (!withCompanion || !table.hasField(companion(field)));
    }

    private static String digest(String field, int digits) {
        var crc = new CRC32();
        crc.update(field.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
        var hex = String.format("%08X", crc.getValue());
        return hex.substring(hex.length() - digits);
    }

    private static String truncate(String s, int length) {
        return s.length() <= length ? s : s.substring(0, length);
    }
}
