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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SystemClassifier under both classification policies.
 *
 * @author hal.hildebrand
 */
public class SystemClassifierTest {

    @Test
    @DisplayName("No projection type means raw pixels")
    void testMissingCtypeIsRaw() {
        assertEquals(CoordinateSystem.RAW, SystemClassifier.classify(Metadata.empty()));
        assertEquals(CoordinateSystem.RAW,
                     SystemClassifier.classify(Metadata.of("RADESYS", "FK5"), ClassificationPolicy.EPOCH));
    }

    @ParameterizedTest(name = "{0} / {1} / {2} -> {3}")
    @CsvSource({ "RA---TAN, FK4, , FK4", "RA---TAN, FK5, , FK5", "RA---TAN, ICRS, , ICRS", "RA---TAN, , , ICRS",
                 "RA---TAN, , 2000, FK5", "RA---TAN, GAPPT, , ICRS", "RA---SIN, fk4, , FK4",
                 "GLON-TAN, FK4, , GALACTIC", "GLON-CAR, , , GALACTIC", "ELON-TAN, , , ECLIPTIC", "LINEAR, , , ICRS" })
    void testStandardPolicy(String ctype, String radesys, String equinox, CoordinateSystem expected) {
        assertEquals(expected, SystemClassifier.classify(header(ctype, radesys, equinox)));
    }

    @ParameterizedTest(name = "{0} / {1} / {2} -> {3}")
    @CsvSource({ "RA---TAN, FK4, , FK4", "RA---TAN, FK5, , FK5", "RA---TAN, ICRS, , FK5", "RA---TAN, , , FK5",
                 "RA---TAN, , 1950, FK5", "GLON-TAN, , , GALACTIC", "ELON-TAN, , , FK5", "LINEAR, , , FK5" })
    void testEpochPolicy(String ctype, String radesys, String equinox, CoordinateSystem expected) {
        assertEquals(expected, SystemClassifier.classify(header(ctype, radesys, equinox), ClassificationPolicy.EPOCH));
    }

    @Test
    void testRadecsysTakesPrecedence() {
        var header = Metadata.of("CTYPE1", "RA---TAN", "RADECSYS", "FK4", "RADESYS", "ICRS");
        assertEquals(CoordinateSystem.FK4, SystemClassifier.classify(header));
    }

    @Test
    void testEquinoxDoesNotOverrideNamedFrame() {
        var header = Metadata.of("CTYPE1", "RA---TAN", "RADESYS", "ICRS", "EQUINOX", 2000.0);
        assertEquals(CoordinateSystem.ICRS, SystemClassifier.classify(header));
    }

    @Test
    void testProjectionTypeIsMatchedWithoutRegardToCase() {
        assertEquals(CoordinateSystem.GALACTIC, SystemClassifier.classify(Metadata.of("CTYPE1", "glon-tan")));
    }

    @Test
    void testUnitsAlwaysReportDegrees() {
        assertEquals("degree", SystemClassifier.classifyUnits(Metadata.empty()));
        assertEquals("degree", SystemClassifier.classifyUnits(Metadata.of("CUNIT1", "deg")));
        assertEquals("degree", SystemClassifier.classifyUnits(Metadata.of("CUNIT1", "arcsec")));
    }

    @Test
    void testVocabularies() {
        assertEquals("j2000", ClassificationPolicy.EPOCH.getVocabulary().nameOf(CoordinateSystem.FK5));
        assertEquals("b1950", ClassificationPolicy.EPOCH.getVocabulary().nameOf(CoordinateSystem.FK4));
        assertEquals("galactic", ClassificationPolicy.EPOCH.getVocabulary().nameOf(CoordinateSystem.GALACTIC));
        assertEquals("fk5", ClassificationPolicy.STANDARD.getVocabulary().nameOf(CoordinateSystem.FK5));
        assertEquals(CoordinateSystem.FK4, FrameVocabulary.EPOCH.systemOf("B1950"));
    }

    private static Metadata header(String ctype, String radesys, String equinox) {
        var header = Metadata.of("CTYPE1", ctype);
        if (radesys != null) {
            header = header.with("RADESYS", radesys);
        }
        if (equinox != null) {
            header = header.with("EQUINOX", Double.parseDouble(equinox));
        }
        return header;
    }
}
