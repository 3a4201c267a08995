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

import com.hellblazer.astrolabe.wcs.Metadata;

/**
 * Service provider interface implemented by a binding to a native WCS library.
 * <p>
 * Bindings register an implementation in
 * {@code META-INF/services/com.hellblazer.astrolabe.wcs.backend.NativeWcsLibrary}. {@link #getName()} must match the
 * {@link WcsBackend#getName() name} of the backend whose conventions the binding follows.
 *
 * @author hal.hildebrand
 */
public interface NativeWcsLibrary {

    String getName();

    /**
     * Check that the shared library can be loaded on this system, see {@link NativeLibraryProbe}.
     */
    boolean isAvailable();

    /**
     * Build a projection from a header.
     *
     * @param auxiliary optional library specific input, may be null
     */
    NativeProjection open(Metadata header, Object auxiliary) throws NativeWcsException;

    /**
     * Open a converter between two frames named in the library's vocabulary.
     */
    NativeFrameConverter converter(String fromFrame, String toFrame) throws NativeWcsException;
}
