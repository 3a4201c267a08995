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

import com.hellblazer.astrolabe.wcs.ComputationFailureException;
import com.hellblazer.astrolabe.wcs.CoordinateSystem;
import com.hellblazer.astrolabe.wcs.EngineState;
import com.hellblazer.astrolabe.wcs.Metadata;
import com.hellblazer.astrolabe.wcs.PixelConvention;
import com.hellblazer.astrolabe.wcs.PixelCoordinate;
import com.hellblazer.astrolabe.wcs.UnboundEngineException;
import com.hellblazer.astrolabe.wcs.UnsupportedSystemException;
import com.hellblazer.astrolabe.wcs.WcsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the native backed adapters, run against an in-memory linear binding.
 *
 * @author hal.hildebrand
 */
public class NativeWcsEngineTest {
    private static final Logger log = LoggerFactory.getLogger(NativeWcsEngineTest.class);

    static Metadata header(String radesys) {
        var header = Metadata.of("NAXIS", 2, "CTYPE1", "RA---TAN", "CTYPE2", "DEC--TAN", "CRPIX1", 50.0, "CRPIX2", 50.0,
                                 "CRVAL1", 180.0, "CRVAL2", 0.0, "CD1_1", -0.001, "CD1_2", 0.0, "CD2_1", 0.0, "CD2_2",
                                 0.001);
        return radesys == null ? header : header.with("RADESYS", radesys);
    }

    @Nested
    @DisplayName("wcslib adapter")
    class Wcslib {
        private final LinearNativeLibrary library = LinearNativeLibrary.wcslib();
        private final WcslibWcsEngine     engine  = new WcslibWcsEngine(library, log);

        @Test
        void testPixelOriginIsNormalized() throws WcsException {
            engine.load(header("FK5"));

            var sky = engine.pixelToSky(PixelCoordinate.of(49, 49), PixelConvention.DATA);
            assertArrayEquals(new double[] { 50.0, 50.0 }, library.lastPixel);
            assertEquals(180.0, sky.longitude(), 1e-12);
            assertEquals(0.0, sky.latitude(), 1e-12);
            assertEquals(CoordinateSystem.FK5, sky.system());

            var pixel = engine.skyToPixel(180.0, 0.0, PixelConvention.DATA);
            assertEquals(49.0, pixel.x(), 1e-9);
            assertEquals(49.0, pixel.y(), 1e-9);
        }

        @Test
        void testExtraAxesExtendWorldVector() throws WcsException {
            engine.load(header("FK5"));

            engine.skyToPixel(180.0, 0.0, PixelConvention.FITS, 2);
            assertArrayEquals(new double[] { 180.0, 0.0, 0.0, 0.0 }, library.lastWorld);
            engine.skyToPixel(180.0, 0.0, PixelConvention.FITS);
            assertEquals(2, library.lastWorld.length);
        }

        @Test
        void testSystemConversion() throws WcsException {
            engine.load(header("FK5"));

            var galactic = engine.pixelToSystem(PixelCoordinate.of(50, 50), CoordinateSystem.GALACTIC,
                                                PixelConvention.FITS).orElseThrow();
            assertEquals(CoordinateSystem.GALACTIC, galactic.system());
            assertEquals(180.0 + LinearNativeLibrary.FRAME_OFFSET, galactic.longitude(), 1e-12);
            assertEquals(List.of("fk5->galactic"), library.conversions);

            var same = engine.pixelToSystem(PixelCoordinate.of(50, 50), CoordinateSystem.FK5, PixelConvention.FITS)
                             .orElseThrow();
            assertEquals(180.0, same.longitude(), 1e-12);
            assertEquals(1, library.conversions.size());
        }

        @Test
        void testDefaultTargetIsIcrs() throws WcsException {
            engine.load(header("FK4"));

            var icrs = engine.pixelToSystem(PixelCoordinate.of(50, 50), PixelConvention.FITS).orElseThrow();
            assertEquals(CoordinateSystem.ICRS, icrs.system());
            assertEquals(List.of("fk4->icrs"), library.conversions);
        }

        @Test
        void testRawImageHasNoUsableWcs() throws WcsException {
            var header = Metadata.of("CRPIX1", 1, "CRPIX2", 1, "CRVAL1", 0, "CRVAL2", 0, "CD1_1", 1, "CD2_2", 1);
            assertTrue(engine.load(header).isBound());
            assertEquals(CoordinateSystem.RAW, engine.getCoordinateSystem());

            assertNotNull(engine.pixelToSky(PixelCoordinate.of(1, 1), PixelConvention.FITS));
            assertThrows(UnboundEngineException.class,
                         () -> engine.pixelToSystem(PixelCoordinate.of(1, 1), PixelConvention.FITS));
        }

        @Test
        void testAuxiliaryIsPassedThrough() {
            var auxiliary = new Object();
            engine.load(header("FK5"), auxiliary);
            assertSame(auxiliary, library.lastAuxiliary);
        }

        @Test
        void testReloadAndCloseReleaseProjection() {
            engine.load(header("FK5"));
            engine.load(header("ICRS"));
            assertEquals(1, library.closed);
            assertEquals(CoordinateSystem.ICRS, engine.getCoordinateSystem());

            engine.close();
            assertEquals(2, library.closed);
            assertEquals(EngineState.UNBOUND, engine.getState());
        }

        @Test
        void testOpenFailureBreaksEngine() {
            library.openFailure = new NativeWcsException("wcsset error 3: linear transformation matrix is singular");

            var result = engine.load(header("FK5"));

            assertEquals(EngineState.BROKEN, result.state());
            assertEquals(CoordinateSystem.RAW, engine.getCoordinateSystem());
            assertSame(library.openFailure, result.getCause().orElseThrow());
        }
    }

    @Nested
    @DisplayName("AST adapter")
    class Ast {
        private final LinearNativeLibrary library = LinearNativeLibrary.ast();
        private final AstWcsEngine        engine  = new AstWcsEngine(library, log);

        @Test
        void testResultsAreIcrsDegrees() throws WcsException {
            engine.load(header("FK5"));

            var sky = engine.pixelToSky(PixelCoordinate.of(50, 50), PixelConvention.FITS);
            assertEquals(CoordinateSystem.ICRS, sky.system());
            assertEquals(180.0 + LinearNativeLibrary.FRAME_OFFSET, sky.longitude(), 1e-9);
            assertEquals(0.0, sky.latitude(), 1e-9);
            assertEquals(List.of("FK5->ICRS", "ICRS->FK5"), library.conversions);
        }

        @Test
        void testSkyToPixelInvertsReferenceConversion() throws WcsException {
            engine.load(header("FK5"));

            var pixel = engine.skyToPixel(180.0 + LinearNativeLibrary.FRAME_OFFSET, 0.0, PixelConvention.FITS, 1);
            assertEquals(50.0, pixel.x(), 1e-9);
            assertEquals(50.0, pixel.y(), 1e-9);
            assertEquals(3, library.lastWorld.length);
            assertEquals(Math.toRadians(180.0), library.lastWorld[0], 1e-12);
        }

        @Test
        void testConversionFromReference() throws WcsException {
            engine.load(header("ICRS"));

            var fk4 = engine.pixelToSystem(PixelCoordinate.of(50, 50), CoordinateSystem.FK4, PixelConvention.FITS)
                            .orElseThrow();
            assertEquals(CoordinateSystem.FK4, fk4.system());
            assertEquals(180.0 - LinearNativeLibrary.FRAME_OFFSET, fk4.longitude(), 1e-9);
        }
    }

    @Nested
    @DisplayName("wcstools adapter")
    class Wcstools {
        private final LinearNativeLibrary library = LinearNativeLibrary.wcstools();
        private final WcstoolsWcsEngine   engine  = new WcstoolsWcsEngine(library, log);

        @Test
        void testZeroBasedNativePixels() throws WcsException {
            engine.load(header("FK5"));

            var sky = engine.pixelToSky(PixelCoordinate.of(50, 50), PixelConvention.FITS);
            assertArrayEquals(new double[] { 49.0, 49.0 }, library.lastPixel);
            assertEquals(180.0, sky.longitude(), 1e-12);

            var pixel = engine.skyToPixel(180.0, 0.0, PixelConvention.FITS, 3);
            assertEquals(50.0, pixel.x(), 1e-9);
            assertEquals(2, library.lastWorld.length);
        }

        @Test
        void testEpochClassification() {
            engine.load(header("ICRS"));
            assertEquals(CoordinateSystem.FK5, engine.getCoordinateSystem());

            engine.load(header(null).with("CTYPE1", "ELON-TAN"));
            assertEquals(CoordinateSystem.FK5, engine.getCoordinateSystem());
        }

        @Test
        void testEpochFrameNames() throws WcsException {
            engine.load(header("FK5"));

            var fk4 = engine.pixelToSystem(PixelCoordinate.of(50, 50), CoordinateSystem.FK4, PixelConvention.FITS)
                            .orElseThrow();
            assertEquals(180.0 - LinearNativeLibrary.FRAME_OFFSET, fk4.longitude(), 1e-12);
            assertEquals(List.of("J2000->B1950"), library.conversions);
        }

        @Test
        void testIcrsIsNotSupported() {
            engine.load(header("FK5"));

            var error = assertThrows(UnsupportedSystemException.class,
                                     () -> engine.pixelToSystem(PixelCoordinate.of(50, 50), CoordinateSystem.ICRS,
                                                                PixelConvention.FITS));
            assertEquals(CoordinateSystem.ICRS, error.getSystem());
            assertTrue(library.conversions.isEmpty());
        }
    }

    @Nested
    @DisplayName("native failures")
    class Failures {
        private final NativeWcsLibrary library    = mock(NativeWcsLibrary.class);
        private final NativeProjection projection = mock(NativeProjection.class);

        @Test
        void testComputationFailure() throws Exception {
            when(library.open(any(), any())).thenReturn(projection);
            when(projection.toWorld(any())).thenThrow(new NativeWcsException("pixel out of bounds"));
            when(projection.toPixel(any())).thenThrow(new IllegalStateException("null wcsprm"));

            var engine = new WcslibWcsEngine(library, log);
            assertTrue(engine.load(header("FK5")).isBound());

            var error = assertThrows(ComputationFailureException.class,
                                     () -> engine.pixelToSky(PixelCoordinate.of(1, 1), PixelConvention.FITS));
            assertTrue(error.getMessage().contains("pixel out of bounds"));
            assertInstanceOf(NativeWcsException.class, error.getCause());

            var inverse = assertThrows(ComputationFailureException.class,
                                       () -> engine.skyToPixel(180.0, 0.0, PixelConvention.FITS));
            assertInstanceOf(IllegalStateException.class, inverse.getCause());
            assertEquals(EngineState.BOUND, engine.getState());

            engine.close();
            verify(projection).close();
        }

        @Test
        void testConverterFailure() throws Exception {
            when(library.open(any(), any())).thenReturn(projection);
            when(projection.toWorld(any())).thenReturn(new double[] { 180.0, 0.0 });
            when(library.converter("fk5", "galactic")).thenThrow(new NativeWcsException("no such frame"));

            var engine = new WcslibWcsEngine(library, log);
            engine.load(header("FK5"));

            assertThrows(ComputationFailureException.class,
                         () -> engine.pixelToSystem(PixelCoordinate.of(1, 1), CoordinateSystem.GALACTIC,
                                                    PixelConvention.FITS));
        }

        @Test
        void testLinkageErrorsPropagate() throws Exception {
            when(library.open(any(), any())).thenThrow(new UnsatisfiedLinkError("libwcs.so: cannot open file"));

            var engine = new WcslibWcsEngine(library, log);
            assertThrows(UnsatisfiedLinkError.class, () -> engine.load(header("FK5")));
            assertEquals(EngineState.BROKEN, engine.getState());
        }

        @Test
        void testLinkageErrorOnReloadLeavesNothingBound() throws Exception {
            when(library.open(any(), any())).thenReturn(projection)
                                             .thenThrow(new UnsatisfiedLinkError("libwcs.so: cannot open file"));

            var engine = new WcslibWcsEngine(library, log);
            assertTrue(engine.load(header("FK5")).isBound());
            assertThrows(UnsatisfiedLinkError.class, () -> engine.load(header("FK4")));

            assertEquals(EngineState.BROKEN, engine.getState());
            assertEquals(CoordinateSystem.RAW, engine.getCoordinateSystem());
            assertInstanceOf(UnsatisfiedLinkError.class, engine.getLoadResult().getCause().orElseThrow());
            assertThrows(UnboundEngineException.class,
                         () -> engine.pixelToSky(PixelCoordinate.of(1, 1), PixelConvention.FITS));
            verify(projection).close();
        }

        @Test
        void testAstPreparationFailureBreaksEngine() throws Exception {
            when(library.open(any(), any())).thenReturn(projection);
            when(library.converter(anyString(), anyString())).thenThrow(new NativeWcsException("astGetFrame failed"));

            var engine = new AstWcsEngine(library, log);
            var result = engine.load(header("FK5"));

            assertEquals(EngineState.BROKEN, result.state());
            assertEquals("astGetFrame failed", result.getReason().orElseThrow());
            verify(projection).close();

            engine.close();
            verifyNoMoreInteractions(projection);
        }
    }
}
