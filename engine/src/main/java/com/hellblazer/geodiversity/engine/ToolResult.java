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

import com.hellblazer.geodiversity.common.ErrorKind;

import java.util.List;
import java.util.Optional;

/**
 * What a toolbox operation returns: the written field names and run report on success, or the error kind and message
 * on failure
 *
 * @author hal.hildebrand
 */
public final class ToolResult {

    private final RunReport report;
    private final ErrorKind error;
    private final String    message;

    private ToolResult(RunReport report, ErrorKind error, String message) {
        this.report = report;
        this.error = error;
        this.message = message;
    }

    public static ToolResult success(RunReport report) {
        return new ToolResult(report, null, null);
    }

    public static ToolResult failure(ErrorKind error, String message) {
        return new ToolResult(null, error, message);
    }

    public boolean isSuccess() {
        return report != null;
    }

    public List<String> getFieldNames() {
        return report == null ? List.of() : report.getFieldNames();
    }

    public Optional<RunReport> getReport() {
        return Optional.ofNullable(report);
    }

    public Optional<ErrorKind> getError() {
        return Optional.ofNullable(error);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ToolResult[success " + getFieldNames() + "]" : "ToolResult[" + error + ": " + message
                                                                               + "]";
    }
}
