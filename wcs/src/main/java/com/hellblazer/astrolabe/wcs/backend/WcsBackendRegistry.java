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

import com.hellblazer.astrolabe.wcs.CoordinateSystem;
import com.hellblazer.astrolabe.wcs.WcsEngine;
import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;
import com.hellblazer.astrolabe.wcs.fallback.BareBonesWcsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Selects which backend constructs {@link WcsEngine}s.
 * <p>
 * Backends are probed in preference order and the first whose native binding is installed and loadable becomes
 * active; with none available the {@link WcsBackend#BAREBONES} engine is used. The active selection is a single
 * immutable {@link ActiveBackend} swapped atomically, so a switch is never observed half done. Engines already created
 * keep the binding they were created with.
 * <p>
 * Switching backends while other threads create engines must be serialized by the host application.
 *
 * @author hal.hildebrand
 */
public class WcsBackendRegistry {
    private static final Logger log = LoggerFactory.getLogger(WcsBackendRegistry.class);

    private static volatile WcsBackendRegistry defaultRegistry;
    private static final    Object             lock = new Object();

    private final NativeLibraryLocator            locator;
    private final ClassificationPolicy            policyOverride;
    private final AtomicReference<ActiveBackend> active = new AtomicReference<>();

    /**
     * Create a registry and probe the default preference order.
     */
    public WcsBackendRegistry(NativeLibraryLocator locator) {
        this(locator, null);
        probe();
    }

    private WcsBackendRegistry(NativeLibraryLocator locator, ClassificationPolicy policyOverride) {
        this.locator = Objects.requireNonNull(locator);
        this.policyOverride = policyOverride;
    }

    /**
     * Create a registry from a configuration: probe its preference order, then apply its forced backend, if any.
     *
     * @throws UnavailableBackendException if a backend is forced in strict mode and is not available
     */
    public static WcsBackendRegistry create(WcsConfiguration configuration, NativeLibraryLocator locator)
    throws UnavailableBackendException {
        var registry = new WcsBackendRegistry(locator, configuration.getClassificationPolicy().orElse(null));
        registry.probe(configuration.getPreferenceOrder());
        var forced = configuration.getForcedBackend();
        if (forced.isPresent()) {
            registry.use(forced.get(), configuration.getSelectionMode());
        }
        return registry;
    }

    /**
     * The process wide registry, probing {@link java.util.ServiceLoader} registered bindings on first use.
     */
    public static WcsBackendRegistry getDefault() {
        if (defaultRegistry == null) {
            synchronized (lock) {
                if (defaultRegistry == null) {
                    defaultRegistry = new WcsBackendRegistry(new ServiceLoaderLibraryLocator());
                    log.info("Initialized default WCS backend: {}", defaultRegistry.getActive().getName());
                }
            }
        }
        return defaultRegistry;
    }

    /**
     * Replace the process wide registry (host applications and tests).
     */
    public static void setDefault(WcsBackendRegistry registry) {
        synchronized (lock) {
            defaultRegistry = registry;
            if (registry != null) {
                log.info("Set default WCS backend registry: {}", registry.getActive().getName());
            }
        }
    }

    public ActiveBackend probe() {
        return probe(WcsConfiguration.DEFAULT_PREFERENCE);
    }

    /**
     * Activate the first available backend of the given order, or the fallback engine if none is.
     */
    public ActiveBackend probe(List<WcsBackend> preferenceOrder) {
        for (var backend : preferenceOrder) {
            if (!backend.isNative()) {
                continue;
            }
            var library = availableLibrary(backend);
            if (library.isPresent()) {
                log.info("Native WCS backend {} available", backend.getName());
                return activate(backend, library.get());
            }
        }
        log.info("No native WCS backend available, using {}", WcsBackend.BAREBONES.getName());
        return activate(WcsBackend.BAREBONES, null);
    }

    /**
     * Force a backend. In {@link SelectionMode#LENIENT} mode an unavailable backend leaves the current selection
     * unchanged and returns false.
     *
     * @return true if the backend is now active
     * @throws UnavailableBackendException if the backend is unavailable in {@link SelectionMode#STRICT} mode
     */
    public boolean use(WcsBackend backend, SelectionMode mode) throws UnavailableBackendException {
        if (!backend.isNative()) {
            activate(backend, null);
            return true;
        }
        var library = availableLibrary(backend);
        if (library.isEmpty()) {
            return unavailable("WCS backend '" + backend.getName() + "' is not available", mode);
        }
        activate(backend, library.get());
        return true;
    }

    /**
     * Force a backend by name, see {@link #use(WcsBackend, SelectionMode)}. Unknown names count as unavailable.
     */
    public boolean use(String name, SelectionMode mode) throws UnavailableBackendException {
        var backend = WcsBackend.fromName(name);
        if (backend.isEmpty()) {
            return unavailable("Unknown WCS backend '" + name + "'", mode);
        }
        return use(backend.get(), mode);
    }

    public boolean isAvailable(WcsBackend backend) {
        return !backend.isNative() || availableLibrary(backend).isPresent();
    }

    public ActiveBackend getActive() {
        return active.get();
    }

    public Set<CoordinateSystem> getSupportedSystems() {
        return getActive().supportedSystems();
    }

    /**
     * Construct an unbound engine with the active backend.
     */
    public WcsEngine createEngine(Logger logger) {
        return getActive().createEngine(logger);
    }

    public WcsEngine createEngine() {
        return getActive().createEngine();
    }

    private boolean unavailable(String message, SelectionMode mode) throws UnavailableBackendException {
        if (mode == SelectionMode.STRICT) {
            throw new UnavailableBackendException(message);
        }
        log.warn("{}, keeping {}", message, getActive().getName());
        return false;
    }

    private Optional<NativeWcsLibrary> availableLibrary(WcsBackend backend) {
        try {
            var library = locator.locate(backend);
            if (library.isPresent() && library.get().isAvailable()) {
                return library;
            }
        } catch (RuntimeException | LinkageError e) {
            log.debug("Native WCS backend {} not available: {}", backend.getName(), e.getMessage());
        }
        return Optional.empty();
    }

    private ActiveBackend activate(WcsBackend backend, NativeWcsLibrary library) {
        var policy = policyOverride != null ? policyOverride : backend.getDefaultPolicy();
        WcsEngineFactory factory = switch (backend) {
            case WCSLIB -> logger -> new WcslibWcsEngine(library, policy, logger);
            case AST -> logger -> new AstWcsEngine(library, policy, logger);
            case WCSTOOLS -> logger -> new WcstoolsWcsEngine(library, policy, logger);
            case BAREBONES -> logger -> new BareBonesWcsEngine(policy, logger);
        };
        var selected = new ActiveBackend(backend, backend.getSupportedSystems(), policy, factory);
        active.set(selected);
        log.debug("Active WCS backend: {} supporting {}", backend.getName(), selected.supportedSystems());
        return selected;
    }
}
