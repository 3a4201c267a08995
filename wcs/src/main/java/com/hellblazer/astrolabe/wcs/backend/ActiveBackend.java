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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of a selected backend: which family, the systems it supports, the classification policy its
 * engines use, and how to construct them. Components that create engines can take this value directly instead of
 * consulting a registry.
 *
 * @author hal.hildebrand
 */
public record ActiveBackend(WcsBackend backend, Set<CoordinateSystem> supportedSystems, ClassificationPolicy policy,
                            WcsEngineFactory factory) {

    public ActiveBackend {
        Objects.requireNonNull(backend);
        Objects.requireNonNull(policy);
        Objects.requireNonNull(factory);
        supportedSystems = Set.copyOf(supportedSystems);
    }

    public WcsEngine createEngine(Logger logger) {
        return factory.create(logger);
    }

    public WcsEngine createEngine() {
        return factory.create(LoggerFactory.getLogger(WcsEngine.class));
    }

    public String getName() {
        return backend.getName();
    }
}
