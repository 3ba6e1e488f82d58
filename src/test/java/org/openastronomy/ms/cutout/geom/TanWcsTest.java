/*
 * Copyright (C) 2020 University of Dundee & Open Microscopy Environment.
 * All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package org.openastronomy.ms.cutout.geom;

import java.util.stream.Stream;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Check the gnomonic projection between sky and pixel coordinates.
 */
public class TanWcsTest {

    private static final TanWcs WCS = TanWcs.northUp(new SkyPoint(37.644598, 0.104625), new PixelPoint(2047.5, 2047.5), 0.2);

    /**
     * Check that the reference point projects onto the reference pixel.
     */
    @Test
    public void testReferencePoint() {
        final PixelPoint pixel = WCS.skyToPixel(new SkyPoint(37.644598, 0.104625));
        Assertions.assertEquals(2047.5, pixel.getX(), 1e-9);
        Assertions.assertEquals(2047.5, pixel.getY(), 1e-9);
    }

    /**
     * Check that east is to the left and north is up.
     */
    @Test
    public void testOrientation() {
        final PixelPoint east = WCS.skyToPixel(new SkyPoint(37.644598 + Angles.toDegrees(2), 0.104625));
        Assertions.assertEquals(2047.5 - 10, east.getX(), 1e-3);
        final PixelPoint north = WCS.skyToPixel(new SkyPoint(37.644598, 0.104625 + Angles.toDegrees(2)));
        Assertions.assertEquals(2047.5 + 10, north.getY(), 1e-3);
    }

    /**
     * @return pixel positions for {@link #testRoundTrip(double, double)}
     */
    private static Stream<Arguments> providePixels() {
        return Stream.of(Arguments.of(0, 0), Arguments.of(4095, 0), Arguments.of(4095, 4095), Arguments.of(-300.25, 1200.75));
    }

    /**
     * Check that converting a pixel position to the sky and back recovers it.
     * @param x a pixel column
     * @param y a pixel row
     */
    @ParameterizedTest
    @MethodSource("providePixels")
    public void testRoundTrip(double x, double y) {
        final PixelPoint pixel = WCS.skyToPixel(WCS.pixelToSky(new PixelPoint(x, y)));
        Assertions.assertEquals(x, pixel.getX(), 1e-6);
        Assertions.assertEquals(y, pixel.getY(), 1e-6);
    }

    /**
     * Check that positions across zero right ascension project continuously.
     */
    @Test
    public void testWrapAtZero() {
        final TanWcs wcs = TanWcs.northUp(new SkyPoint(0, 0), new PixelPoint(0, 0), 1);
        Assertions.assertEquals(3600, wcs.skyToPixel(new SkyPoint(359, 0)).getX(), 1);
        Assertions.assertEquals(359.5, wcs.pixelToSky(new PixelPoint(1800, 0)).getRa(), 1e-3);
    }

    /**
     * Check that positions behind the tangent plane do not project.
     */
    @Test
    public void testBehindPlane() {
        Assertions.assertFalse(WCS.skyToPixel(new SkyPoint(217.644598, -0.104625)).isFinite());
    }

    /**
     * Check the pixel scale and that a transform survives conversion to JSON and back.
     */
    @Test
    public void testScaleAndJson() {
        Assertions.assertEquals(0.2, WCS.getPixelScale().getAsDouble(), 1e-9);
        final JsonObject json = new JsonObject(WCS.toJson().encode());
        final TanWcs copy = TanWcs.fromJson(json);
        final SkyPoint sky = new SkyPoint(37.6, 0.1);
        Assertions.assertEquals(WCS.skyToPixel(sky), copy.skyToPixel(sky));
        final JsonObject partial = new JsonObject().put("crpix", new JsonArray().add(1).add(2));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TanWcs.fromJson(partial));
    }
}
