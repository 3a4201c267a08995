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
import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.hellblazer.astrolabe.wcs.CoordinateSystem.*;

/**
 * The engine families a registry can select from.
 *
 * @author hal.hildebrand
 */
public enum WcsBackend {
    /** WCSLIB style binding: 1-based pixels, degrees, full dimensional world vectors. */
    WCSLIB("wcslib", EnumSet.of(ICRS, FK5, FK4, GALACTIC, ECLIPTIC), ICRS, ClassificationPolicy.STANDARD),
    /** Starlink AST style binding: 1-based pixels, radians, frame sets converted through ICRS. */
    AST("ast", EnumSet.of(ICRS, FK5, FK4, GALACTIC, ECLIPTIC), ICRS, ClassificationPolicy.STANDARD),
    /** wcstools style binding: 0-based pixels, degrees, epoch named frames. */
    WCSTOOLS("wcstools", EnumSet.of(FK5, FK4, GALACTIC), FK5, ClassificationPolicy.EPOCH),
    /** The in-process tangent plane engine, always available. */
    BAREBONES("barebones", EnumSet.of(FK5), FK5, ClassificationPolicy.STANDARD);

    private final String                name;
    private final Set<CoordinateSystem> supportedSystems;
    private final CoordinateSystem      defaultTarget;
    private final ClassificationPolicy  defaultPolicy;

    WcsBackend(String name, Set<CoordinateSystem> supportedSystems, CoordinateSystem defaultTarget,
               ClassificationPolicy defaultPolicy) {
        this.name = name;
        this.supportedSystems = Collections.unmodifiableSet(supportedSystems);
        this.defaultTarget = defaultTarget;
        this.defaultPolicy = defaultPolicy;
    }

    public static Optional<WcsBackend> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var backend : values()) {
            if (backend.name.equals(normalized)) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }

    public String getName() {
        return name;
    }

    public Set<CoordinateSystem> getSupportedSystems() {
        return supportedSystems;
    }

    public CoordinateSystem getDefaultTarget() {
        return defaultTarget;
    }

    public ClassificationPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public boolean isNative() {
        return this != BAREBONES;
    }
}
