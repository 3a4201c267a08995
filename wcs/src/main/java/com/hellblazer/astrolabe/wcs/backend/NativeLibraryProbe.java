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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Presence check for shared libraries, for use by {@link NativeWcsLibrary#isAvailable()} implementations.
 * Results are cached per library name; a library that loaded stays loaded for the life of the JVM.
 *
 * @author hal.hildebrand
 */
public final class NativeLibraryProbe {
    private static final Logger log = LoggerFactory.getLogger(NativeLibraryProbe.class);

    private static final Map<String, Boolean> probed = new ConcurrentHashMap<>();

    private NativeLibraryProbe() {
    }

    /**
     * @param libraryName platform independent name, as given to {@link System#loadLibrary(String)}
     * @return true if the library is loaded or could be loaded now
     */
    public static boolean isLoadable(String libraryName) {
        return probed.computeIfAbsent(libraryName, NativeLibraryProbe::tryLoad);
    }

    private static boolean tryLoad(String libraryName) {
        try {
            System.loadLibrary(libraryName);
            log.info("Loaded native library {}", libraryName);
            return true;
        } catch (UnsatisfiedLinkError | SecurityException e) {
            log.debug("Native library {} not available: {}", libraryName, e.getMessage());
            return false;
        }
    }
}
