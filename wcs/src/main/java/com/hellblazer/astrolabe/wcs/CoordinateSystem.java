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

import java.util.Locale;

/**
 * Closed set of celestial coordinate systems an engine may report or convert to.
 * <p>
 * {@link #RAW} means the system could not be determined and no usable transform exists yet. Some engines name the
 * equatorial frames after their epochs ({@code j2000} for FK5, {@code b1950} for FK4); those names are accepted as
 * aliases by {@link #fromName(String)}.
 *
 * @author hal.hildebrand
 */
public enum CoordinateSystem {
    RAW("raw"),
    ICRS("icrs"),
    FK5("fk5", "j2000"),
    FK4("fk4", "b1950"),
    GALACTIC("galactic"),
    ECLIPTIC("ecliptic");

    private final String   name;
    private final String[] aliases;

    CoordinateSystem(String name, String... aliases) {
        this.name = name;
        this.aliases = aliases;
    }

    /**
     * Resolve a system from its tag or one of its aliases, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the name matches no system
     */
    public static CoordinateSystem fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Coordinate system name cannot be null");
        }
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var system : values()) {
            if (system.name.equals(normalized)) {
                return system;
            }
            for (var alias : system.aliases) {
                if (alias.equals(normalized)) {
                    return system;
                }
            }
        }
        throw new IllegalArgumentException("Unknown coordinate system: '" + name + "'");
    }

    /**
     * The canonical lower case tag, e.g. {@code "fk5"}.
     */
    public String getName() {
        return name;
    }

    /**
     * True for the frames whose longitude is a right ascension.
     */
    public boolean isEquatorial() {
        return this == ICRS || this == FK5 || this == FK4;
    }
}
