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

/**
 * Names chosen for the fields of one commit
 *
 * @param field       the metric field
 * @param alias       display alias of the metric field
 * @param companion   the standardized companion field, null when standardization is off
 * @param overwriting true if existing fields of these names are overwritten
 * @author hal.hildebrand
 */
public record FieldPlan(String field, String alias, String companion, boolean overwriting) {

    public String companionAlias() {
        return companion == null ? null : FieldNames.COMPANION_ALIAS_PREFIX + alias;
    }
}
