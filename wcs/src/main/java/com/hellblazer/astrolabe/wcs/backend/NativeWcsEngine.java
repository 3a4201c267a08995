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

import com.hellblazer.astrolabe.wcs.AbstractWcsEngine;
import com.hellblazer.astrolabe.wcs.ComputationFailureException;
import com.hellblazer.astrolabe.wcs.CoordinateSystem;
import com.hellblazer.astrolabe.wcs.Metadata;
import com.hellblazer.astrolabe.wcs.PixelConvention;
import com.hellblazer.astrolabe.wcs.SkyCoordinate;
import com.hellblazer.astrolabe.wcs.WcsException;
import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;
import org.slf4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Base for engines whose transforms come from a {@link NativeWcsLibrary}. Owns the opened {@link NativeProjection},
 * the angle unit and frame naming of the binding, and turns native failures into
 * {@link ComputationFailureException}.
 *
 * @author hal.hildebrand
 */
public abstract class NativeWcsEngine extends AbstractWcsEngine {

    /**
     * A call into the native library.
     */
    @FunctionalInterface
    protected interface NativeCall<T> {
        T call() throws NativeWcsException;
    }

    protected final NativeWcsLibrary library;

    private NativeProjection projection;

    protected NativeWcsEngine(WcsBackend backend, PixelConvention nativeConvention, NativeWcsLibrary library,
                              ClassificationPolicy policy, Logger logger) {
        super(backend.getName(), backend.getSupportedSystems(), backend.getDefaultTarget(), nativeConvention, policy,
              logger);
        this.library = Objects.requireNonNull(library);
    }

    @Override
    protected final void bind(Metadata header, CoordinateSystem system, Object auxiliary) throws Exception {
        projection = library.open(header, auxiliary);
        prepare(header, system);
    }

    /**
     * Backend specific preparation after the projection is open.
     */
    protected void prepare(Metadata header, CoordinateSystem system) throws NativeWcsException {
    }

    @Override
    protected Optional<SkyCoordinate> convertSystem(SkyCoordinate sky, CoordinateSystem target) throws WcsException {
        var from = frameName(sky.system());
        var to = frameName(target);
        var converted = call("system conversion " + from + " -> " + to, () -> {
            var converter = library.converter(from, to);
            return converter.convert(toNativeAngle(sky.longitude()), toNativeAngle(sky.latitude()));
        });
        return Optional.of(new SkyCoordinate(fromNativeAngle(converted[0]), fromNativeAngle(converted[1]), target));
    }

    @Override
    protected void release() {
        if (projection != null) {
            projection.close();
            projection = null;
        }
    }

    protected NativeProjection getProjection() {
        return projection;
    }

    /**
     * Name of a system in the binding's vocabulary.
     */
    protected String frameName(CoordinateSystem system) {
        return policy.getVocabulary().nameOf(system);
    }

    /**
     * Degrees to the binding's angle unit. Identity unless overridden.
     */
    protected double toNativeAngle(double degrees) {
        return degrees;
    }

    /**
     * The binding's angle unit to degrees. Identity unless overridden.
     */
    protected double fromNativeAngle(double value) {
        return value;
    }

    protected <T> T call(String operation, NativeCall<T> call) throws ComputationFailureException {
        try {
            return call.call();
        } catch (NativeWcsException | RuntimeException e) {
            logger.error("Error calculating {}: {}", operation, e.getMessage());
            throw new ComputationFailureException("Error calculating " + operation + ": " + e.getMessage(), e);
        }
    }

    /**
     * World vector of {ra, dec} followed by {@code extraAxes} zeros.
     */
    protected static double[] worldVector(double lon, double lat, int extraAxes) {
        var world = new double[2 + extraAxes];
        world[0] = lon;
        world[1] = lat;
        return world;
    }
}
