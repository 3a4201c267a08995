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
package com.hellblazer.astrolabe.wcs.classify;

import com.hellblazer.astrolabe.wcs.CoordinateSystem;
import com.hellblazer.astrolabe.wcs.Metadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Infers the celestial coordinate system of an image from its projection type and reference frame keywords.
 * <p>
 * Classification is advisory and never throws: when nothing can be determined the result is
 * {@link CoordinateSystem#RAW} (no {@code CTYPE1}) or the policy's default system (unrecognized projection).
 *
 * @author hal.hildebrand
 */
public final class SystemClassifier {
    private static final Logger log = LoggerFactory.getLogger(SystemClassifier.class);

    public static final String CTYPE1   = "CTYPE1";
    public static final String RADECSYS = "RADECSYS";
    public static final String RADESYS  = "RADESYS";
    public static final String EQUINOX  = "EQUINOX";
    public static final String CUNIT1   = "CUNIT1";

    private static final Pattern GALACTIC_LONGITUDE = Pattern.compile("^GLON-.*$");
    private static final Pattern ECLIPTIC_LONGITUDE = Pattern.compile("^ELON-.*$");
    private static final Pattern RIGHT_ASCENSION    = Pattern.compile("^RA---.*$");
    private static final Pattern DEGREES            = Pattern.compile("^deg\\s*$");

    private SystemClassifier() {
    }

    /**
     * Classify with the {@link ClassificationPolicy#STANDARD} policy.
     */
    public static CoordinateSystem classify(Metadata metadata) {
        return classify(metadata, ClassificationPolicy.STANDARD);
    }

    public static CoordinateSystem classify(Metadata metadata, ClassificationPolicy policy) {
        var ctype = metadata.getString(CTYPE1);
        if (ctype.isEmpty()) {
            return CoordinateSystem.RAW;
        }
        var projection = ctype.get().trim().toUpperCase(Locale.ROOT);

        if (GALACTIC_LONGITUDE.matcher(projection).matches()) {
            return CoordinateSystem.GALACTIC;
        }
        if (policy.recognizesEcliptic() && ECLIPTIC_LONGITUDE.matcher(projection).matches()) {
            return CoordinateSystem.ECLIPTIC;
        }
        if (RIGHT_ASCENSION.matcher(projection).matches()) {
            return equatorialFrame(metadata, policy);
        }
        log.debug("Unrecognized projection type '{}', assuming {}", projection, policy.getDefaultSystem());
        return policy.getDefaultSystem();
    }

    /**
     * Advisory unit code of the first axis. Only degrees are understood, so every value, including an absent one,
     * reports {@code degree}.
     */
    public static String classifyUnits(Metadata metadata) {
        var unit = metadata.getString(CUNIT1).orElse("deg");
        if (!DEGREES.matcher(unit).matches()) {
            log.debug("Don't understand units '{}', assuming degree", unit);
        }
        return "degree";
    }

    private static CoordinateSystem equatorialFrame(Metadata metadata, ClassificationPolicy policy) {
        // RADESYS defaults to ICRS unless EQUINOX is given alone, in which case FK5 is assumed
        var frame = metadata.getString(RADECSYS)
                            .or(() -> metadata.getString(RADESYS))
                            .orElseGet(() -> metadata.contains(EQUINOX) ? "FK5" : "ICRS")
                            .trim()
                            .toUpperCase(Locale.ROOT);

        if ("FK4".equals(frame)) {
            return CoordinateSystem.FK4;
        }
        if (policy.collapsesModernFrames() || "FK5".equals(frame)) {
            return CoordinateSystem.FK5;
        }
        if (!"ICRS".equals(frame)) {
            log.debug("Unrecognized reference frame '{}', assuming ICRS", frame);
        }
        return CoordinateSystem.ICRS;
    }
}
