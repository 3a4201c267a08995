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

import java.util.Optional;

/**
 * Outcome of {@link WcsEngine#load(Metadata)}. A failed load carries the reason and, where one exists, the exception
 * that caused it.
 *
 * @author hal.hildebrand
 */
public record LoadResult(EngineState state, String reason, Throwable cause) {

    private static final LoadResult UNBOUND = new LoadResult(EngineState.UNBOUND, "No metadata loaded", null);
    private static final LoadResult BOUND   = new LoadResult(EngineState.BOUND, null, null);

    public static LoadResult unbound() {
        return UNBOUND;
    }

    public static LoadResult bound() {
        return BOUND;
    }

    public static LoadResult failed(String reason, Throwable cause) {
        return new LoadResult(EngineState.BROKEN, reason, cause);
    }

    public boolean isBound() {
        return state == EngineState.BOUND;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }
}
