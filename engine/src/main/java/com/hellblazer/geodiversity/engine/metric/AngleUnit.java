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
package com.hellblazer.geodiversity.engine.metric;

/**
 * Unit of angular raster values and of the circular dispersion written back
 *
 * @author hal.hildebrand
 */
public enum AngleUnit {
    DEGREES {
        @Override
        public double toRadians(double angle) {
            return Math.toRadians(angle);
        }

        @Override
        public double fromRadians(double radians) {
            return Math.toDegrees(radians);
        }
    },
    RADIANS {
        @Override
        public double toRadians(double angle) {
            return angle;
        }

        @Override
        public double fromRadians(double radians) {
            return radians;
        }
    };

    public abstract double toRadians(double angle);

    public abstract double fromRadians(double radians);
}
