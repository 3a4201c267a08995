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
import com.hellblazer.astrolabe.wcs.MetadataNormalizer;
import net.jqwik.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property tests for SystemClassifier over generated headers.
 *
 * @author hal.hildebrand
 */
class SystemClassifierPropertyTest {

    @Property
    @Label("Classification is a pure function of the header")
    void classificationIsRepeatable(@ForAll("headers") Metadata header, @ForAll ClassificationPolicy policy) {
        var first = SystemClassifier.classify(header, policy);
        assertEquals(first, SystemClassifier.classify(header, policy));
        assertEquals(first, SystemClassifier.classify(Metadata.of(header.asMap()), policy));
    }

    @Property
    @Label("Normalization never changes the classification")
    void normalizationPreservesClassification(@ForAll("headers") Metadata header,
                                              @ForAll ClassificationPolicy policy) {
        assertEquals(SystemClassifier.classify(header, policy),
                     SystemClassifier.classify(MetadataNormalizer.normalize(header), policy));
    }

    @Property
    @Label("Epoch policy only reports epoch frames, galactic or raw")
    void epochPolicyRange(@ForAll("headers") Metadata header) {
        var system = SystemClassifier.classify(header, ClassificationPolicy.EPOCH);
        assertTrue(system == CoordinateSystem.FK5 || system == CoordinateSystem.FK4
                   || system == CoordinateSystem.GALACTIC || system == CoordinateSystem.RAW, system::toString);
    }

    @Provide
    Arbitrary<Metadata> headers() {
        var ctype = Arbitraries.of("RA---TAN", "RA---SIN", "GLON-TAN", "ELON-TAN", "LINEAR", "DEC--TAN", "")
                               .injectNull(0.1);
        var frame = Arbitraries.of("FK4", "FK5", "ICRS", "GAPPT", "fk5").injectNull(0.4);
        var equinox = Arbitraries.of(1950.0, 2000.0).injectNull(0.5);
        var unit = Arbitraries.of("deg", "degree", "DEGREE", "arcsec").injectNull(0.5);
        return Combinators.combine(ctype, frame, equinox, unit).as((c, f, e, u) -> {
            var header = Metadata.empty();
            if (c != null) {
                header = header.with("CTYPE1", c);
            }
            if (f != null) {
                header = header.with("RADESYS", f);
            }
            if (e != null) {
                header = header.with("EQUINOX", e);
            }
            if (u != null) {
                header = header.with("CUNIT1", u);
            }
            return header;
        });
    }
}
