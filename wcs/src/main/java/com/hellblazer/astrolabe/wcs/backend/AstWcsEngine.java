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
import com.hellblazer.astrolabe.wcs.Metadata;
import com.hellblazer.astrolabe.wcs.PixelConvention;
import com.hellblazer.astrolabe.wcs.PixelCoordinate;
import com.hellblazer.astrolabe.wcs.SkyCoordinate;
import com.hellblazer.astrolabe.wcs.WcsException;
import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;
import org.slf4j.Logger;

import java.util.Locale;

/**
 * Adapter for Starlink AST style bindings. The library indexes pixels from 1 and works in radians. Sky positions are
 * reported in ICRS: at load time a converter from the header's frame to ICRS is opened, and its reverse is used when
 * going from sky to pixel.
 *
 * @author hal.hildebrand
 */
public class AstWcsEngine extends NativeWcsEngine {

    static final String REFERENCE_FRAME = "ICRS";

    private NativeFrameConverter toReference;
    private NativeFrameConverter fromReference;

    public AstWcsEngine(NativeWcsLibrary library, Logger logger) {
        this(library, WcsBackend.AST.getDefaultPolicy(), logger);
    }

    public AstWcsEngine(NativeWcsLibrary library, ClassificationPolicy policy, Logger logger) {
        super(WcsBackend.AST, PixelConvention.FITS, library, policy, logger);
    }

    @Override
    protected void prepare(Metadata header, CoordinateSystem system) throws NativeWcsException {
        var headerFrame = frameName(system);
        toReference = library.converter(headerFrame, REFERENCE_FRAME);
        fromReference = library.converter(REFERENCE_FRAME, headerFrame);
    }

    @Override
    protected SkyCoordinate project(PixelCoordinate nativePixel) throws WcsException {
        var icrs = call("pixel to sky", () -> {
            var world = getProjection().toWorld(nativePixel.values());
            return toReference.convert(world[0], world[1]);
        });
        return new SkyCoordinate(fromNativeAngle(icrs[0]), fromNativeAngle(icrs[1]), CoordinateSystem.ICRS);
    }

    @Override
    protected PixelCoordinate deproject(double ra, double dec, int extraAxes) throws WcsException {
        var pixel = call("sky to pixel", () -> {
            var world = fromReference.convert(toNativeAngle(ra), toNativeAngle(dec));
            return getProjection().toPixel(worldVector(world[0], world[1], extraAxes));
        });
        return new PixelCoordinate(pixel[0], pixel[1]);
    }

    @Override
    protected String frameName(CoordinateSystem system) {
        return super.frameName(system).toUpperCase(Locale.ROOT);
    }

    @Override
    protected double toNativeAngle(double degrees) {
        return Math.toRadians(degrees);
    }

    @Override
    protected double fromNativeAngle(double value) {
        return Math.toDegrees(value);
    }

    @Override
    protected void release() {
        super.release();
        toReference = null;
        fromReference = null;
    }
}
