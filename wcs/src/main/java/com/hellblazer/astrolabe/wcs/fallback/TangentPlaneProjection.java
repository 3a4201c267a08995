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

import com.hellblazer.astrolabe.wcs.Metadata;
import com.hellblazer.astrolabe.wcs.SingularTransformException;
import com.hellblazer.astrolabe.wcs.WcsLoadException;

import java.util.Objects;

/**
 * Local tangent-plane approximation of a celestial WCS: a reference pixel, the sky position at that pixel and a CD
 * matrix, with right ascension offsets scaled by {@code 1 / cos(dec0)}.
 * <p>
 * Pixels are 1-based (FITS convention) throughout.
 * <pre>
 * ra  = (cd11 * dx + cd12 * dy) / cos(crval2) + crval1
 * dec =  cd21 * dx + cd22 * dy + crval2
 * </pre>
 * where {@code dx = x - crpix1} and {@code dy = y - crpix2}.
 *
 * @author hal.hildebrand
 */
public final class TangentPlaneProjection {

    private final double   crpix1;
    private final double   crpix2;
    private final double   crval1;
    private final double   crval2;
    private final CdMatrix cd;
    private final double   cosDec0;

    /**
     * @throws IllegalArgumentException if crval1 is outside [0, 360) or crval2 outside [-90, 90]
     */
    public TangentPlaneProjection(double crpix1, double crpix2, double crval1, double crval2, CdMatrix cd) {
        if (!(crval1 >= 0.0 && crval1 < 360.0)) {
            throw new IllegalArgumentException("CRVAL1 out of range: " + crval1);
        }
        if (!(crval2 >= -90.0 && crval2 <= 90.0)) {
            throw new IllegalArgumentException("CRVAL2 out of range: " + crval2);
        }
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.cd = Objects.requireNonNull(cd);
        this.cosDec0 = Math.cos(Math.toRadians(crval2));
    }

    /**
     * Build from {@code CRPIXi}, {@code CRVALi} and the CD (or PC/CDELT) keywords.
     *
     * @throws WcsLoadException if a keyword is missing, not numeric, or a reference value is out of range
     */
    public static TangentPlaneProjection fromMetadata(Metadata header) throws WcsLoadException {
        var crpix1 = header.getDouble("CRPIX1");
        var crpix2 = header.getDouble("CRPIX2");
        var crval1 = header.getDouble("CRVAL1");
        var crval2 = header.getDouble("CRVAL2");
        var cd = CdMatrix.fromMetadata(header);
        try {
            return new TangentPlaneProjection(crpix1, crpix2, crval1, crval2, cd);
        } catch (IllegalArgumentException e) {
            throw new WcsLoadException(e.getMessage(), e);
        }
    }

    /**
     * Pixel (1-based) to {ra, dec} in degrees.
     */
    public double[] toSky(double x, double y) {
        var dx = x - crpix1;
        var dy = y - crpix2;
        var ra = (cd.cd11() * dx + cd.cd12() * dy) / cosDec0 + crval1;
        var dec = cd.cd21() * dx + cd.cd22() * dy + crval2;
        return new double[] { ra, dec };
    }

    /**
     * {ra, dec} in degrees to pixel (1-based). The right ascension is first wrapped into the half circle either side
     * of {@code crval1}.
     *
     * @throws SingularTransformException if the CD matrix determinant is zero
     */
    public double[] toPixel(double ra, double dec) throws SingularTransformException {
        var det = cd.determinant();
        if (det == 0.0) {
            throw new SingularTransformException("WCS Matrix Error: CD matrix is singular, check values");
        }

        if (ra - crval1 > 180.0) {
            ra -= 360.0;
        } else if (ra - crval1 < -180.0) {
            ra += 360.0;
        }

        var dra = ra - crval1;
        var ddec = dec - crval2;
        var x = (cd.cd22() * cosDec0 * dra - cd.cd12() * ddec) / det + crpix1;
        var y = (cd.cd11() * ddec - cd.cd21() * cosDec0 * dra) / det + crpix2;
        return new double[] { x, y };
    }

    public double[] getReferencePixel() {
        return new double[] { crpix1, crpix2 };
    }

    public double[] getReferenceSky() {
        return new double[] { crval1, crval2 };
    }

    public CdMatrix getCdMatrix() {
        return cd;
    }

    @Override
    public String toString() {
        return "TangentPlaneProjection{" + "crpix=[" + crpix1 + ", " + crpix2 + "], crval=[" + crval1 + ", " + crval2
        + "], cd=" + cd + '}';
    }
}
