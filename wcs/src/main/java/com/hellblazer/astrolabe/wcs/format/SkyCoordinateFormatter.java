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
package com.hellblazer.astrolabe.wcs.format;

import com.hellblazer.astrolabe.wcs.SkyCoordinate;

import java.util.Locale;

/**
 * Renders sky coordinates for read-outs.
 * <p>
 * In sexagesimal form equatorial longitudes are shown as hours ({@code HH:MM:SS.sss}) and every other longitude as
 * degrees ({@code DDD:MM:SS.ss}); latitudes are signed degrees ({@code +DD:MM:SS.ss}). Rounding is done on the
 * smallest displayed unit so a value never shows 60 seconds.
 *
 * @author hal.hildebrand
 */
public final class SkyCoordinateFormatter {

    private SkyCoordinateFormatter() {
    }

    /**
     * Longitude, latitude and system label separated by spaces, e.g. {@code 12:00:00.000 +45:30:00.00 (icrs)}.
     */
    public static String format(SkyCoordinate sky, DisplayType type) {
        return formatLongitude(sky, type) + " " + formatLatitude(sky, type) + " (" + sky.system().getName() + ")";
    }

    public static String formatLongitude(SkyCoordinate sky, DisplayType type) {
        var longitude = normalizeLongitude(sky.longitude());
        if (type == DisplayType.DEGREES) {
            return String.format(Locale.ROOT, "%.6f", longitude);
        }
        if (sky.system().isEquatorial()) {
            return hours(longitude / 15.0);
        }
        return sexagesimal(longitude, 3, false);
    }

    public static String formatLatitude(SkyCoordinate sky, DisplayType type) {
        if (type == DisplayType.DEGREES) {
            return String.format(Locale.ROOT, "%+.6f", sky.latitude());
        }
        return sexagesimal(sky.latitude(), 2, true);
    }

    /**
     * Hours to {@code HH:MM:SS.sss}, wrapping 24h to 0h.
     */
    static String hours(double hours) {
        var millis = Math.round(hours * 3_600_000.0) % (24L * 3_600_000L);
        var h = millis / 3_600_000L;
        var m = (millis / 60_000L) % 60;
        var s = (millis % 60_000L) / 1000.0;
        return String.format(Locale.ROOT, "%02d:%02d:%06.3f", h, m, s);
    }

    /**
     * Degrees to {@code [+-]D:MM:SS.ss}, degrees padded to {@code width} digits.
     */
    static String sexagesimal(double degrees, int width, boolean signed) {
        var negative = degrees < 0;
        var centis = Math.round(Math.abs(degrees) * 360_000.0);
        var d = centis / 360_000L;
        var m = (centis / 6_000L) % 60;
        var s = (centis % 6_000L) / 100.0;
        var sign = negative && centis != 0 ? "-" : signed ? "+" : "";
        return String.format(Locale.ROOT, "%s%0" + width + "d:%02d:%05.2f", sign, d, m, s);
    }

    private static double normalizeLongitude(double longitude) {
        var wrapped = longitude % 360.0;
        return wrapped < 0 ? wrapped + 360.0 : wrapped;
    }
}
