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
import com.hellblazer.astrolabe.wcs.PixelConvention;
import com.hellblazer.astrolabe.wcs.PixelCoordinate;
import com.hellblazer.astrolabe.wcs.SkyCoordinate;
import com.hellblazer.astrolabe.wcs.WcsException;
import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;
import org.slf4j.Logger;

import java.util.Locale;

/**
 * Adapter for wcstools style bindings. The library indexes pixels from 0, works in degrees, names equatorial frames
 * by epoch ({@code J2000}, {@code B1950}) and only ever takes the two celestial ordinates, so extra axes are not
 * forwarded.
 *
 * @author hal.hildebrand
 */
public class WcstoolsWcsEngine extends NativeWcsEngine {

    public WcstoolsWcsEngine(NativeWcsLibrary library, Logger logger) {
        this(library, WcsBackend.WCSTOOLS.getDefaultPolicy(), logger);
    }

    public WcstoolsWcsEngine(NativeWcsLibrary library, ClassificationPolicy policy, Logger logger) {
        super(WcsBackend.WCSTOOLS, PixelConvention.DATA, library, policy, logger);
    }

    @Override
    protected SkyCoordinate project(PixelCoordinate nativePixel) throws WcsException {
        var world = call("pixel to sky", () -> getProjection().toWorld(nativePixel.values()));
        return new SkyCoordinate(world[0], world[1], getCoordinateSystem());
    }

    @Override
    protected PixelCoordinate deproject(double ra, double dec, int extraAxes) throws WcsException {
        var pixel = call("sky to pixel", () -> getProjection().toPixel(new double[] { ra, dec }));
        return new PixelCoordinate(pixel[0], pixel[1]);
    }

    @Override
    protected String frameName(CoordinateSystem system) {
        return super.frameName(system).toUpperCase(Locale.ROOT);
    }
}
