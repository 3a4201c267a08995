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

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Uniform contract over the engines that map image pixels to sky coordinates and back.
 * <p>
 * An engine is bound to one metadata snapshot by {@link #load(Metadata)}. Pixel coordinates are always exchanged in
 * the convention the caller names; each engine converts to the origin its own math or native library expects.
 *
 * @author hal.hildebrand
 */
public interface WcsEngine extends AutoCloseable {

    /**
     * Bind a metadata snapshot. Failures to build a usable transform do not throw; they leave the engine
     * {@link EngineState#BROKEN} and are described by the returned result.
     */
    default LoadResult load(Metadata metadata) {
        return load(metadata, null);
    }

    /**
     * Bind a metadata snapshot together with an auxiliary object passed through to a native library, such as an open
     * file holding distortion tables. May be null.
     */
    LoadResult load(Metadata metadata, Object auxiliary);

    /**
     * Map a pixel position to a sky position in the system the engine reports.
     *
     * @throws UnboundEngineException      if no usable transform is loaded
     * @throws ComputationFailureException if the native library fails
     */
    SkyCoordinate pixelToSky(PixelCoordinate pixel, PixelConvention convention) throws WcsException;

    default PixelCoordinate skyToPixel(double ra, double dec, PixelConvention convention) throws WcsException {
        return skyToPixel(ra, dec, convention, 0);
    }

    /**
     * Map a sky position to a pixel position.
     *
     * @param extraAxes number of zero valued world ordinates appended after the two celestial ones, for images with
     *                  more than two axes
     * @throws UnboundEngineException      if no usable transform is loaded
     * @throws SingularTransformException  if the linear part of the transform cannot be inverted
     * @throws ComputationFailureException if the native library fails
     */
    PixelCoordinate skyToPixel(double ra, double dec, PixelConvention convention, int extraAxes) throws WcsException;

    default Optional<SkyCoordinate> pixelToSystem(PixelCoordinate pixel, PixelConvention convention)
    throws WcsException {
        return pixelToSystem(pixel, getDefaultTargetSystem(), convention);
    }

    /**
     * Map a pixel position to a sky position expressed in the requested system. An empty result means the engine has
     * no way to convert between systems.
     *
     * @throws UnboundEngineException      if no usable transform is loaded or the image system is undetermined
     * @throws UnsupportedSystemException  if the image system or the target is outside the engine's support set
     * @throws ComputationFailureException if the native library fails
     */
    Optional<SkyCoordinate> pixelToSystem(PixelCoordinate pixel, CoordinateSystem target, PixelConvention convention)
    throws WcsException;

    /**
     * System detected at load time, {@link CoordinateSystem#RAW} before a successful load.
     */
    CoordinateSystem getCoordinateSystem();

    CoordinateSystem getDefaultTargetSystem();

    Set<CoordinateSystem> getSupportedSystems();

    EngineState getState();

    LoadResult getLoadResult();

    /**
     * Short name of the engine family, e.g. {@code wcslib} or {@code barebones}.
     */
    String getKind();

    /**
     * The engine's private normalized snapshot, empty before load.
     */
    Metadata getMetadata();

    default Optional<Object> getKeyword(String key) {
        return getMetadata().get(key);
    }

    /**
     * The requested keywords that are present, in request order.
     */
    Map<String, Object> getKeywords(String... keys);

    /**
     * Release any native resources. The engine returns to {@link EngineState#UNBOUND}.
     */
    @Override
    void close();
}
