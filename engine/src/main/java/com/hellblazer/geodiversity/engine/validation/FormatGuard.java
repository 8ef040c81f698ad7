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
package com.hellblazer.geodiversity.engine.validation;

import com.hellblazer.geodiversity.common.FormatRejectedException;
import com.hellblazer.geodiversity.engine.host.ContainerFormat;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;

/**
 * Rejects layers stored outside transactional geodatabase containers
 *
 * @author hal.hildebrand
 */
public final class FormatGuard {

    private FormatGuard() {
    }

    public static void check(LayerDescriptor... layers) throws FormatRejectedException {
        for (LayerDescriptor layer : layers) {
            var format = layer.effectiveFormat();
            if (format == null) {
                throw new FormatRejectedException("Container format of " + layer.name() + " is unknown");
            }
            if (!format.isTransactional()) {
                throw new FormatRejectedException(
                "Layer " + layer.name() + " is stored as " + describe(format, layer)
                + "; move it into a geodatabase before computing geodiversity");
            }
        }
    }

    private static String describe(ContainerFormat format, LayerDescriptor layer) {
        return layer.path() == null ? format.name() : format.name() + " (" + layer.path() + ")";
    }
}
