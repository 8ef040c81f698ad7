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
package com.hellblazer.geodiversity.common;

import java.util.Objects;

/**
 * Opaque, data-defined category label. The category domain of a landscape layer is whatever codes its attribute table
 * holds, so codes are modeled as comparable keys rather than an enumeration. Integral numbers and non-blank strings
 * are accepted; numeric codes order before textual ones.
 *
 * @author hal.hildebrand
 */
public final class CategoryCode implements Comparable<CategoryCode> {

    /** Largest magnitude at which every integer is exactly representable as a double: 2^53 */
    private static final double EXACT_INTEGER_LIMIT = 9007199254740992.0;

    private final Long   numeric;
    private final String label;

    private CategoryCode(Long numeric, String label) {
        this.numeric = numeric;
        this.label = label;
    }

    /**
     * Convert a raw attribute value into a category code.
     *
     * @param value the attribute value read from the feature
     * @return the category code
     * @throws CategoryDomainException if the value is missing, blank, fractional, non-finite, beyond 2^53 in
     *                                 magnitude or of an unsupported type
     */
    public static CategoryCode of(Object value) {
        if (value == null) {
            throw new CategoryDomainException("Missing category value", null);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new CategoryCode(((Number) value).longValue(), null);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d) || d != Math.rint(d)) {
                throw new CategoryDomainException("Non-integer category value: " + value, value);
            }
            if (Math.abs(d) > EXACT_INTEGER_LIMIT) {
                throw new CategoryDomainException("Category value outside the exact integer range: " + value, value);
            }
            return new CategoryCode((long) d, null);
        }
        if (value instanceof String s) {
            var trimmed = s.trim();
            if (trimmed.isEmpty()) {
                throw new CategoryDomainException("Blank category value", value);
            }
            return new CategoryCode(null, trimmed);
        }
        throw new CategoryDomainException("Unsupported category type: " + value.getClass().getSimpleName(), value);
    }

    public static CategoryCode of(long code) {
        return new CategoryCode(code, null);
    }

    public boolean isNumeric() {
        return numeric != null;
    }

    @Override
    public int compareTo(CategoryCode other) {
        if (isNumeric() && other.isNumeric()) {
            return Long.compare(numeric, other.numeric);
        }
        if (isNumeric() != other.isNumeric()) {
            return isNumeric() ? -1 : 1;
        }
        return label.compareTo(other.label);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CategoryCode other)) {
            return false;
        }
        return Objects.equals(numeric, other.numeric) && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numeric, label);
    }

    @Override
    public String toString() {
        return isNumeric() ? numeric.toString() : label;
    }
}
