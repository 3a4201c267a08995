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
package com.hellblazer.astrolabe.wcs.backend;

/**
 * A transform opened by a native WCS library for one header. Units and pixel origin are whatever the library uses;
 * the adapter owning the projection knows them.
 *
 * @author hal.hildebrand
 */
public interface NativeProjection extends AutoCloseable {

    /**
     * Pixel vector to world vector.
     */
    double[] toWorld(double[] pixel) throws NativeWcsException;

    /**
     * World vector to pixel vector.
     */
    double[] toPixel(double[] world) throws NativeWcsException;

    /**
     * Free the native structure. The default does nothing.
     */
    @Override
    default void close() {
    }
}
