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

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hellblazer.geodiversity.resource.TemporaryWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON staging of computed results inside a run's temporary workspace. NaN and infinite values are written as the
 * bare JSON tokens and read back as such.
 *
 * @author hal.hildebrand
 */
public final class StagingTable {
    private static final Logger       log    = LoggerFactory.getLogger(StagingTable.class);
    private static final ObjectMapper MAPPER = JsonMapper.builder()
                                                         .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                                                         .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                                                         .build();

    private StagingTable() {
    }

    /**
     * Stage a result set
     *
     * @return the staged file
     */
    public static Path write(TemporaryWorkspace workspace, StagedResult result) throws IOException {
        var file = workspace.resolve(result.metric().getCode() + "-staged.json");
        try (var out = Files.newOutputStream(file)) {
            MAPPER.writeValue(out, result);
        }
        log.debug("Staged {} results for {} in {}", result.results().size(), result.metric().getCode(), file);
        return file;
    }

    public static StagedResult read(Path file) throws IOException {
        try (var in = Files.newInputStream(file)) {
            return MAPPER.readValue(in, StagedResult.class);
        }
    }
}
