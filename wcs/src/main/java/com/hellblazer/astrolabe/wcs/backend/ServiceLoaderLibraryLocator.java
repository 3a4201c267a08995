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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Locates native bindings registered with {@link ServiceLoader}. Providers are discovered once, on first lookup.
 *
 * @author hal.hildebrand
 */
public class ServiceLoaderLibraryLocator implements NativeLibraryLocator {
    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderLibraryLocator.class);

    private final ClassLoader            classLoader;
    private volatile List<NativeWcsLibrary> providers;

    public ServiceLoaderLibraryLocator() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderLibraryLocator(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Optional<NativeWcsLibrary> locate(WcsBackend backend) {
        return getProviders().stream().filter(library -> backend.getName().equalsIgnoreCase(library.getName()))
                             .findFirst();
    }

    private List<NativeWcsLibrary> getProviders() {
        if (providers == null) {
            synchronized (this) {
                if (providers == null) {
                    providers = discover();
                }
            }
        }
        return providers;
    }

    private List<NativeWcsLibrary> discover() {
        var found = new ArrayList<NativeWcsLibrary>();
        var iterator = ServiceLoader.load(NativeWcsLibrary.class, classLoader).iterator();
        while (true) {
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                var library = iterator.next();
                log.debug("Discovered native WCS binding: {}", library.getName());
                found.add(library);
            } catch (ServiceConfigurationError e) {
                log.warn("Skipping native WCS binding that failed to load: {}", e.getMessage());
            }
        }
        return List.copyOf(found);
    }
}
