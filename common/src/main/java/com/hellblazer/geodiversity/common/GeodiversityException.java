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
 * Base of the fatal errors a geodiversity run can raise. Every subtype is detected before the zone attribute table
 * is touched, so catching one of these guarantees that no partial output was written.
 *
 * @author hal.hildebrand
 */
public sealed class GeodiversityException extends Exception
permits ConfigurationException, SpatialMismatchException, FormatRejectedException {

    private final ErrorKind kind;

    protected GeodiversityException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GeodiversityException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
