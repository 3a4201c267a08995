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
package com.hellblazer.astrolabe.wcs.fallback;

import com.hellblazer.astrolabe.wcs.AbstractWcsEngine;
import com.hellblazer.astrolabe.wcs.CoordinateSystem;
import com.hellblazer.astrolabe.wcs.Metadata;
import com.hellblazer.astrolabe.wcs.PixelConvention;
import com.hellblazer.astrolabe.wcs.PixelCoordinate;
import com.hellblazer.astrolabe.wcs.SkyCoordinate;
import com.hellblazer.astrolabe.wcs.WcsException;
import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;
import org.slf4j.Logger;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Self contained engine used when no native WCS library is available. Assumes degrees and a TAN-like projection
 * close enough to the reference pixel for the linear approximation of {@link TangentPlaneProjection} to hold.
 * <p>
 * It cannot convert between coordinate systems: {@link #pixelToSystem} answers only for the system detected at load
 * time and is empty for every other supported target. Targets outside {@link #SUPPORTED_SYSTEMS} are rejected.
 *
 * @author hal.hildebrand
 */
public class BareBonesWcsEngine extends AbstractWcsEngine {

    public static final String                KIND              = "barebones";
    public static final Set<CoordinateSystem> SUPPORTED_SYSTEMS = EnumSet.of(CoordinateSystem.FK5);

    private TangentPlaneProjection projection;

    public BareBonesWcsEngine(Logger logger) {
        this(ClassificationPolicy.STANDARD, logger);
    }

    public BareBonesWcsEngine(ClassificationPolicy policy, Logger logger) {
        super(KIND, SUPPORTED_SYSTEMS, CoordinateSystem.FK5, PixelConvention.FITS, policy, logger);
    }

    @Override
    protected void bind(Metadata header, CoordinateSystem system, Object auxiliary) throws WcsException {
        projection = TangentPlaneProjection.fromMetadata(header);
    }

    @Override
    protected SkyCoordinate project(PixelCoordinate nativePixel) {
        var sky = projection.toSky(nativePixel.x(), nativePixel.y());
        return new SkyCoordinate(sky[0], sky[1], getCoordinateSystem());
    }

    @Override
    protected PixelCoordinate deproject(double ra, double dec, int extraAxes) throws WcsException {
        var pixel = projection.toPixel(ra, dec);
        return new PixelCoordinate(pixel[0], pixel[1]);
    }

    @Override
    public Optional<SkyCoordinate> pixelToSystem(PixelCoordinate pixel, CoordinateSystem target,
                                                 PixelConvention convention) throws WcsException {
        requireBound();
        requireSupported(target);
        if (target != getCoordinateSystem()) {
            logger.debug("No coordinate system conversion available from {} to {}", getCoordinateSystem(), target);
            return Optional.empty();
        }
        return Optional.of(pixelToSky(pixel, convention));
    }

    @Override
    protected Optional<SkyCoordinate> convertSystem(SkyCoordinate sky, CoordinateSystem target) {
        return Optional.empty();
    }

    @Override
    protected void release() {
        projection = null;
    }

    /**
     * The loaded projection, empty unless bound.
     */
    public Optional<TangentPlaneProjection> getProjection() {
        return Optional.ofNullable(projection);
    }
}
