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

/**
 * A feature carries a missing or non-discrete category value where a categorical metric requires one. Recoverable:
 * the offending feature is skipped and counted, the run continues.
 *
 * @author hal.hildebrand
 */
public class CategoryDomainException extends RuntimeException {

    private final Object rejectedValue;

    public CategoryDomainException(String message, Object rejectedValue) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    public ErrorKind getKind() {
        return ErrorKind.CATEGORY_DOMAIN;
    }

    /**
     * @return the raw attribute value that was rejected, possibly null
     */
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
