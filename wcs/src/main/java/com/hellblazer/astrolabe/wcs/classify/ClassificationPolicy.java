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

/**
 * How {@link SystemClassifier} resolves the cases where engines historically disagreed.
 * <p>
 * The two policies differ in whether ecliptic longitudes are recognized, whether the equatorial frame named by the
 * header is kept or collapsed to the modern frame, and which system is returned when no projection pattern matches.
 *
 * @author hal.hildebrand
 */
public enum ClassificationPolicy {
    /**
     * Recognizes galactic, ecliptic and equatorial projections, keeps the named frame and defaults to ICRS.
     */
    STANDARD(true, false, CoordinateSystem.ICRS, FrameVocabulary.EQUATORIAL),
    /**
     * Recognizes galactic and equatorial projections only, reports FK4 or FK5 (b1950 / j2000) and defaults to FK5.
     */
    EPOCH(false, true, CoordinateSystem.FK5, FrameVocabulary.EPOCH);

    private final boolean          recognizesEcliptic;
    private final boolean          collapsesModernFrames;
    private final CoordinateSystem defaultSystem;
    private final FrameVocabulary  vocabulary;

    ClassificationPolicy(boolean recognizesEcliptic, boolean collapsesModernFrames, CoordinateSystem defaultSystem,
                         FrameVocabulary vocabulary) {
        this.recognizesEcliptic = recognizesEcliptic;
        this.collapsesModernFrames = collapsesModernFrames;
        this.defaultSystem = defaultSystem;
        this.vocabulary = vocabulary;
    }

    public boolean recognizesEcliptic() {
        return recognizesEcliptic;
    }

    /**
     * When true every equatorial frame other than FK4 is reported as FK5.
     */
    public boolean collapsesModernFrames() {
        return collapsesModernFrames;
    }

    /**
     * System reported when the projection type matches no known pattern.
     */
    public CoordinateSystem getDefaultSystem() {
        return defaultSystem;
    }

    public FrameVocabulary getVocabulary() {
        return vocabulary;
    }
}
