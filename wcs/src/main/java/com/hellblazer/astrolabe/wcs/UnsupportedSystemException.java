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
 * The requested coordinate system is not in the support set of the engine.
 *
 * @author hal.hildebrand
 */
public class UnsupportedSystemException extends WcsException {

    private final CoordinateSystem system;

    public UnsupportedSystemException(CoordinateSystem system, String kind) {
        super("No such coordinate system available: '" + system.getName() + "' (engine " + kind + ")");
        this.system = system;
    }

    public CoordinateSystem getSystem() {
        return system;
    }
}
