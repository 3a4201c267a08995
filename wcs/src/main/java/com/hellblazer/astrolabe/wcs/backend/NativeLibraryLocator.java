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

import java.util.Map;
import java.util.Optional;

/**
 * Finds the native binding for a backend, if one is installed.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface NativeLibraryLocator {

    Optional<NativeWcsLibrary> locate(WcsBackend backend);

    /**
     * A locator that finds nothing, so only the fallback engine is ever selected.
     */
    static NativeLibraryLocator none() {
        return backend -> Optional.empty();
    }

    /**
     * A locator over a fixed set of bindings.
     */
    static NativeLibraryLocator of(Map<WcsBackend, NativeWcsLibrary> libraries) {
        var copy = Map.copyOf(libraries);
        return backend -> Optional.ofNullable(copy.get(backend));
    }
}
