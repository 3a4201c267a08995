/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Astrolabe.
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
package com.hellblazer.astrolabe.wcs;

/**
 * Pixel origin convention. {@link #DATA} indexes pixels from 0 as image arrays do, {@link #FITS} indexes them from 1
 * as traditional FITS headers do.
 *
 * @author hal.hildebrand
 */
public enum PixelConvention {
    DATA(0),
    FITS(1);

    private final int origin;

    PixelConvention(int origin) {
        this.origin = origin;
    }

    public int getOrigin() {
        return origin;
    }

    /**
     * Re-express a single pixel ordinate given in this convention in the target convention.
     */
    public double convert(double value, PixelConvention target) {
        return value - origin + target.origin;
    }
}
