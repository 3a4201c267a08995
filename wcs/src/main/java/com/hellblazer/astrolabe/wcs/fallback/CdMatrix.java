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
import com.hellblazer.astrolabe.wcs.WcsLoadException;

/**
 * The 2x2 linear part of a FITS WCS, in degrees per pixel.
 * <p>
 * Represents the matrix
 * <pre>
 * | cd11 cd12 |
 * | cd21 cd22 |
 * </pre>
 * read from {@code CDi_j} keywords or rebuilt from a {@code PCi_j} matrix scaled row-wise by {@code CDELTi}.
 *
 * @author hal.hildebrand
 */
public record CdMatrix(double cd11, double cd12, double cd21, double cd22) {

    private static final String[] CD_KEYWORDS        = { "CD1_1", "CD1_2", "CD2_1", "CD2_2" };
    private static final String[] PC_KEYWORDS        = { "PC1_1", "PC1_2", "PC2_1", "PC2_2" };
    private static final String[] LEGACY_PC_KEYWORDS = { "PC001001", "PC001002", "PC002001", "PC002002" };

    /**
     * Read the matrix from a header. The complete {@code CDi_j} set wins; otherwise {@code CDELT1}/{@code CDELT2} are
     * required and the {@code PCi_j} set is tried before the legacy {@code PC00i00j} set.
     *
     * @throws WcsLoadException if no complete keyword set is present
     */
    public static CdMatrix fromMetadata(Metadata header) throws WcsLoadException {
        if (hasAll(header, CD_KEYWORDS)) {
            return read(header, CD_KEYWORDS, 1.0, 1.0);
        }
        var cdelt1 = header.getDouble("CDELT1");
        var cdelt2 = header.getDouble("CDELT2");
        if (hasAll(header, PC_KEYWORDS)) {
            return read(header, PC_KEYWORDS, cdelt1, cdelt2);
        }
        return read(header, LEGACY_PC_KEYWORDS, cdelt1, cdelt2);
    }

    private static boolean hasAll(Metadata header, String[] keys) {
        for (var key : keys) {
            if (!header.contains(key)) {
                return false;
            }
        }
        return true;
    }

    private static CdMatrix read(Metadata header, String[] keys, double scale1, double scale2)
    throws WcsLoadException {
        return new CdMatrix(header.getDouble(keys[0]) * scale1, header.getDouble(keys[1]) * scale1,
                            header.getDouble(keys[2]) * scale2, header.getDouble(keys[3]) * scale2);
    }

    public double determinant() {
        return cd11 * cd22 - cd12 * cd21;
    }

    /**
     * Exactly zero determinant. The matrix has no inverse.
     */
    public boolean isSingular() {
        return determinant() == 0.0;
    }

    public double[][] toArray() {
        return new double[][] { { cd11, cd12 }, { cd21, cd22 } };
    }
}
