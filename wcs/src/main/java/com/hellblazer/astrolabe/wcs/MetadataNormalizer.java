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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites header values that strict WCS engines reject although FITS writers commonly emit them.
 * <p>
 * Currently this fixes axis units spelled {@code degree} (in any case) to the standard {@code deg}. All other keywords
 * pass through unchanged and absent keywords stay absent.
 *
 * @author hal.hildebrand
 */
public final class MetadataNormalizer {
    private static final Logger log = LoggerFactory.getLogger(MetadataNormalizer.class);

    static final String[] UNIT_KEYWORDS = { "CUNIT1", "CUNIT2" };

    private MetadataNormalizer() {
    }

    public static Metadata normalize(Metadata metadata) {
        var result = metadata;
        for (var key : UNIT_KEYWORDS) {
            var unit = metadata.get(key);
            if (unit.isPresent() && unit.get() instanceof String text && "degree".equalsIgnoreCase(text)) {
                log.debug("Rewriting {} = '{}' to 'deg'", key, text);
                result = result.with(key, "deg");
            }
        }
        return result;
    }
}
