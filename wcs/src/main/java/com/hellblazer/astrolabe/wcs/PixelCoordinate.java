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
 * A position on the image. The pixel convention is never stored; every operation taking or returning a pixel
 * coordinate states which {@link PixelConvention} applies.
 *
 * @author hal.hildebrand
 */
public record PixelCoordinate(double x, double y) {

    public static PixelCoordinate of(double x, double y) {
        return new PixelCoordinate(x, y);
    }

    /**
     * Re-express this position, given in {@code from}, in the {@code to} convention.
     */
    public PixelCoordinate convert(PixelConvention from, PixelConvention to) {
        if (from == to) {
            return this;
        }
        return new PixelCoordinate(from.convert(x, to), from.convert(y, to));
    }

    public PixelCoordinate shift(double dx, double dy) {
        return new PixelCoordinate(x + dx, y + dy);
    }

    public double[] values() {
        return new double[] { x, y };
    }
}
