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
package com.hellblazer.astrolabe.wcs.classify;

import com.hellblazer.astrolabe.wcs.CoordinateSystem;

/**
 * The names a native engine uses for coordinate systems.
 *
 * @author hal.hildebrand
 */
public enum FrameVocabulary {
    /**
     * Frames named after their reference standard: icrs, fk5, fk4, galactic, ecliptic.
     */
    EQUATORIAL {
        @Override
        public String nameOf(CoordinateSystem system) {
            return system.getName();
        }
    },
    /**
     * Equatorial frames named after their epoch: j2000 for FK5, b1950 for FK4.
     */
    EPOCH {
        @Override
        public String nameOf(CoordinateSystem system) {
            return switch (system) {
                case FK5 -> "j2000";
                case FK4 -> "b1950";
                default -> system.getName();
            };
        }
    };

    public abstract String nameOf(CoordinateSystem system);

    /**
     * Resolve a name in this vocabulary. Aliases are shared by all vocabularies so this never depends on the
     * receiver; it exists so callers read symmetrically with {@link #nameOf(CoordinateSystem)}.
     */
    public CoordinateSystem systemOf(String name) {
        return CoordinateSystem.fromName(name);
    }
}
