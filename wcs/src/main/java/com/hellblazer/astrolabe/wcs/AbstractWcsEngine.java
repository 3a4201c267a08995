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

import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;
import com.hellblazer.astrolabe.wcs.classify.SystemClassifier;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Common lifecycle and pixel convention handling for all engines.
 * <p>
 * Subclasses implement {@link #bind}, {@link #project} and {@link #deproject} in their own pixel convention
 * ({@link #getNativeConvention()}); conversion from and to the caller's convention happens only here.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractWcsEngine implements WcsEngine {

    protected final Logger               logger;
    protected final ClassificationPolicy policy;

    private final String                kind;
    private final Set<CoordinateSystem> supportedSystems;
    private final CoordinateSystem      defaultTarget;
    private final PixelConvention       nativeConvention;

    private Metadata         metadata   = Metadata.empty();
    private CoordinateSystem coordsys   = CoordinateSystem.RAW;
    private LoadResult       loadResult = LoadResult.unbound();

    protected AbstractWcsEngine(String kind, Set<CoordinateSystem> supportedSystems, CoordinateSystem defaultTarget,
                                PixelConvention nativeConvention, ClassificationPolicy policy, Logger logger) {
        this.kind = Objects.requireNonNull(kind);
        this.supportedSystems = Collections.unmodifiableSet(EnumSet.copyOf(supportedSystems));
        this.defaultTarget = Objects.requireNonNull(defaultTarget);
        this.nativeConvention = Objects.requireNonNull(nativeConvention);
        this.policy = Objects.requireNonNull(policy);
        this.logger = Objects.requireNonNull(logger);
    }

    @Override
    public final LoadResult load(Metadata header, Object auxiliary) {
        Objects.requireNonNull(header, "Metadata cannot be null");
        release();
        metadata = MetadataNormalizer.normalize(header);
        var system = SystemClassifier.classify(metadata, policy);
        coordsys = CoordinateSystem.RAW;
        loadResult = LoadResult.unbound();
        try {
            bind(metadata, system, auxiliary);
            coordsys = system;
            loadResult = LoadResult.bound();
        } catch (Exception e) {
            fail(e);
        } catch (LinkageError e) {
            // linkage failures still reach the caller
            fail(e);
            throw e;
        }
        return loadResult;
    }

    private void fail(Throwable cause) {
        logger.error("Error making WCS object: {}", cause.getMessage());
        release();
        coordsys = CoordinateSystem.RAW;
        loadResult = LoadResult.failed(cause.getMessage(), cause);
    }

    @Override
    public final SkyCoordinate pixelToSky(PixelCoordinate pixel, PixelConvention convention) throws WcsException {
        requireBound();
        return project(pixel.convert(convention, nativeConvention));
    }

    @Override
    public final PixelCoordinate skyToPixel(double ra, double dec, PixelConvention convention, int extraAxes)
    throws WcsException {
        if (extraAxes < 0) {
            throw new IllegalArgumentException("Extra axis count cannot be negative: " + extraAxes);
        }
        requireBound();
        return deproject(ra, dec, extraAxes).convert(nativeConvention, convention);
    }

    @Override
    public Optional<SkyCoordinate> pixelToSystem(PixelCoordinate pixel, CoordinateSystem target,
                                                 PixelConvention convention) throws WcsException {
        requireBound();
        if (coordsys == CoordinateSystem.RAW) {
            throw new UnboundEngineException("No usable WCS");
        }
        requireSupported(coordsys);
        requireSupported(target);

        var sky = pixelToSky(pixel, convention);
        logger.debug("ra, dec = {}, {}", sky.longitude(), sky.latitude());
        if (sky.system() == target) {
            return Optional.of(sky);
        }
        return convertSystem(sky, target);
    }

    @Override
    public CoordinateSystem getCoordinateSystem() {
        return coordsys;
    }

    @Override
    public CoordinateSystem getDefaultTargetSystem() {
        return defaultTarget;
    }

    @Override
    public Set<CoordinateSystem> getSupportedSystems() {
        return supportedSystems;
    }

    @Override
    public EngineState getState() {
        return loadResult.state();
    }

    @Override
    public LoadResult getLoadResult() {
        return loadResult;
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public Metadata getMetadata() {
        return metadata;
    }

    @Override
    public Map<String, Object> getKeywords(String... keys) {
        var result = new LinkedHashMap<String, Object>();
        for (var key : keys) {
            metadata.get(key).ifPresent(value -> result.put(key, value));
        }
        return result;
    }

    @Override
    public void close() {
        release();
        metadata = Metadata.empty();
        coordsys = CoordinateSystem.RAW;
        loadResult = LoadResult.unbound();
    }

    public PixelConvention getNativeConvention() {
        return nativeConvention;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{kind=" + kind + ", state=" + getState() + ", system=" + coordsys + '}';
    }

    /**
     * Prepare the transform for a normalized snapshot. Any exception marks the engine broken.
     *
     * @param system the system the classifier detected for this snapshot
     */
    protected abstract void bind(Metadata header, CoordinateSystem system, Object auxiliary) throws Exception;

    /**
     * Pixel to sky, pixel given in the native convention.
     */
    protected abstract SkyCoordinate project(PixelCoordinate nativePixel) throws WcsException;

    /**
     * Sky to pixel, result in the native convention.
     */
    protected abstract PixelCoordinate deproject(double ra, double dec, int extraAxes) throws WcsException;

    /**
     * Re-express a sky position in another system; empty when the engine cannot convert.
     */
    protected abstract Optional<SkyCoordinate> convertSystem(SkyCoordinate sky, CoordinateSystem target)
    throws WcsException;

    /**
     * Release native resources held for the current snapshot. Called before every load and on close.
     */
    protected void release() {
    }

    protected void requireBound() throws UnboundEngineException {
        if (!loadResult.isBound()) {
            var reason = loadResult.getReason().map(r -> ": " + r).orElse("");
            throw new UnboundEngineException("No usable WCS" + reason);
        }
    }

    protected void requireSupported(CoordinateSystem system) throws UnsupportedSystemException {
        if (!supportedSystems.contains(system)) {
            throw new UnsupportedSystemException(system, kind);
        }
    }
}
