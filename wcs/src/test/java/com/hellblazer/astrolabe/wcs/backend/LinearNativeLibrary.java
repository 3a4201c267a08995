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

import com.hellblazer.astrolabe.wcs.Metadata;
import com.hellblazer.astrolabe.wcs.WcsLoadException;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory stand in for a native WCS library: a diagonal linear projection with a configurable pixel origin and
 * angle unit. Frame conversions shift the longitude by {@link #FRAME_OFFSET} degrees, positive when the source frame
 * name sorts before the target, so that conversions are observable and invertible.
 */
class LinearNativeLibrary implements NativeWcsLibrary {

    static final double FRAME_OFFSET = 10.0;

    final String       name;
    final int          origin;
    final boolean      radians;
    final List<String> conversions = new ArrayList<>();

    boolean            available = true;
    NativeWcsException openFailure;
    double[]           lastPixel;
    double[]           lastWorld;
    Object             lastAuxiliary;
    int                closed;

    LinearNativeLibrary(String name, int origin, boolean radians) {
        this.name = name;
        this.origin = origin;
        this.radians = radians;
    }

    static LinearNativeLibrary wcslib() {
        return new LinearNativeLibrary("wcslib", 1, false);
    }

    static LinearNativeLibrary ast() {
        return new LinearNativeLibrary("ast", 1, true);
    }

    static LinearNativeLibrary wcstools() {
        return new LinearNativeLibrary("wcstools", 0, false);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public NativeProjection open(Metadata header, Object auxiliary) throws NativeWcsException {
        if (openFailure != null) {
            throw openFailure;
        }
        lastAuxiliary = auxiliary;
        try {
            var crpix1 = header.getDouble("CRPIX1");
            var crpix2 = header.getDouble("CRPIX2");
            var crval1 = header.getDouble("CRVAL1");
            var crval2 = header.getDouble("CRVAL2");
            var cd11 = header.getDouble("CD1_1");
            var cd22 = header.getDouble("CD2_2");
            return new NativeProjection() {
                @Override
                public double[] toWorld(double[] pixel) {
                    lastPixel = pixel.clone();
                    var lon = crval1 + cd11 * (pixel[0] - origin + 1 - crpix1);
                    var lat = crval2 + cd22 * (pixel[1] - origin + 1 - crpix2);
                    return new double[] { toNative(lon), toNative(lat) };
                }

                @Override
                public double[] toPixel(double[] world) {
                    lastWorld = world.clone();
                    var x = crpix1 + (fromNative(world[0]) - crval1) / cd11;
                    var y = crpix2 + (fromNative(world[1]) - crval2) / cd22;
                    return new double[] { x - 1 + origin, y - 1 + origin };
                }

                @Override
                public void close() {
                    closed++;
                }
            };
        } catch (WcsLoadException e) {
            throw new NativeWcsException(e.getMessage(), e);
        }
    }

    @Override
    public NativeFrameConverter converter(String fromFrame, String toFrame) {
        conversions.add(fromFrame + "->" + toFrame);
        var offset = fromFrame.equals(toFrame) ? 0.0 : fromFrame.compareTo(toFrame) < 0 ? FRAME_OFFSET : -FRAME_OFFSET;
        return (lon, lat) -> new double[] { lon + toNative(offset), lat };
    }

    private double toNative(double degrees) {
        return radians ? Math.toRadians(degrees) : degrees;
    }

    private double fromNative(double value) {
        return radians ? Math.toDegrees(value) : value;
    }
}
