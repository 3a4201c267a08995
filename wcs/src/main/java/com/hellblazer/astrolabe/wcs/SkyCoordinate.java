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

import java.util.Objects;

/**
 * A longitude/latitude pair in degrees, interpreted under the coordinate system it carries.
 *
 * @author hal.hildebrand
 */
public record SkyCoordinate(double longitude, double latitude, CoordinateSystem system) {

    public SkyCoordinate {
        Objects.requireNonNull(system, "Sky coordinate requires a coordinate system");
    }

    public static SkyCoordinate of(double longitude, double latitude, CoordinateSystem system) {
        return new SkyCoordinate(longitude, latitude, system);
    }

    /**
     * Same position tagged with another system, used when a native engine reports values in a frame it was told to
     * convert to.
     */
    public SkyCoordinate withSystem(CoordinateSystem other) {
        return new SkyCoordinate(longitude, latitude, other);
    }
}
