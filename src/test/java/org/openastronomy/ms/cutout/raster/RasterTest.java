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

package org.openastronomy.ms.cutout.raster;

import org.openastronomy.ms.cutout.geom.PixelBox;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Check the pixel and mask handling of rasters.
 */
public class RasterTest {

    private static final int BAD = MaskPlane.BAD.getBitMask();
    private static final int EDGE = MaskPlane.EDGE.getBitMask();
    private static final int NO_DATA = MaskPlane.NO_DATA.getBitMask();

    /**
     * Construct a raster with every pixel set from its position.
     * @param bounds the bounds of the raster
     * @param mask the mask word for every pixel
     * @return a new raster
     */
    private static Raster filled(PixelBox bounds, int mask) {
        final Raster raster = new Raster(bounds, null);
        for (int y = bounds.getY(); y < bounds.getEndY(); y++) {
            for (int x = bounds.getX(); x < bounds.getEndX(); x++) {
                raster.setPixel(x, y, x * 1000 + y, mask);
            }
        }
        return raster;
    }

    /**
     * Check the mask plane bits.
     */
    @Test
    public void testMaskPlanes() {
        Assertions.assertEquals(1, BAD);
        Assertions.assertEquals(16, EDGE);
        Assertions.assertEquals(256, NO_DATA);
        Assertions.assertEquals(17, MaskPlane.bitMaskOf(MaskPlane.BAD, MaskPlane.EDGE));
    }

    /**
     * Check that a new raster has no data.
     */
    @Test
    public void testNewRasterEmpty() {
        final Raster raster = new Raster(new PixelBox(-5, 10, 4, 3), null);
        Assertions.assertEquals(12, raster.countEmpty());
        Assertions.assertTrue(raster.isEmpty(-5, 10));
        Assertions.assertTrue(raster.isEmpty(-2, 12));
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> raster.getPixel(-1, 10));
        raster.setPixel(-4, 11, 3.5f, 0);
        Assertions.assertEquals(3.5f, raster.getPixel(-4, 11));
        Assertions.assertEquals(11, raster.countEmpty());
    }

    /**
     * Check that pixel and mask arrays must match the bounds.
     */
    @Test
    public void testArraySizes() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new Raster(new PixelBox(0, 0, 2, 2), null, new float[4], new int[3]));
    }

    /**
     * Check that cropping keeps the parent frame.
     */
    @Test
    public void testCrop() {
        final Raster raster = filled(new PixelBox(100, 200, 20, 10), 0);
        final Raster crop = raster.crop(new PixelBox(105, 203, 4, 5));
        Assertions.assertEquals(new PixelBox(105, 203, 4, 5), crop.getBounds());
        Assertions.assertEquals(105 * 1000 + 203, crop.getPixel(105, 203));
        Assertions.assertEquals(108 * 1000 + 207, crop.getPixel(108, 207));
        Assertions.assertEquals(0, crop.countEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> raster.crop(new PixelBox(99, 200, 5, 5)));
        final Raster empty = raster.crop(new PixelBox(110, 205, 0, 0));
        Assertions.assertEquals(0, empty.getWidth());
        Assertions.assertEquals(0, empty.countEmpty());
    }

    /**
     * Check that blitting copies only the overlap.
     */
    @Test
    public void testBlit() {
        final Raster destination = new Raster(new PixelBox(0, 0, 10, 10), null);
        final Raster source = filled(new PixelBox(5, 5, 10, 10), BAD);
        Assertions.assertEquals(25, destination.blit(source));
        Assertions.assertEquals(75, destination.countEmpty());
        Assertions.assertEquals(9 * 1000 + 9, destination.getPixel(9, 9));
        Assertions.assertEquals(BAD, destination.getMask(5, 5));
        Assertions.assertTrue(destination.isEmpty(4, 4));
        Assertions.assertEquals(0, destination.blit(filled(new PixelBox(20, 20, 2, 2), 0)));
    }

    /**
     * Check that good pixels replace missing or flagged pixels but not good ones.
     */
    @Test
    public void testCopyGoodPixels() {
        final int flags = MaskPlane.bitMaskOf(MaskPlane.BAD, MaskPlane.EDGE);
        final Raster destination = new Raster(new PixelBox(0, 0, 4, 1), null);
        destination.setPixel(1, 0, 1, EDGE);
        destination.setPixel(2, 0, 2, 0);
        destination.setPixel(3, 0, 3, BAD);
        final Raster source = new Raster(new PixelBox(0, 0, 4, 1), null);
        source.setPixel(0, 0, 10, 0);
        source.setPixel(1, 0, 11, 0);
        source.setPixel(2, 0, 12, 0);
        source.setPixel(3, 0, 13, EDGE);
        Assertions.assertEquals(2, destination.copyGoodPixels(source, flags));
        Assertions.assertEquals(10, destination.getPixel(0, 0));
        Assertions.assertEquals(11, destination.getPixel(1, 0));
        Assertions.assertEquals(0, destination.getMask(1, 0));
        Assertions.assertEquals(2, destination.getPixel(2, 0));
        Assertions.assertEquals(3, destination.getPixel(3, 0));
        Assertions.assertEquals(BAD, destination.getMask(3, 0));
        /* missing source pixels never overwrite */
        final Raster missing = new Raster(new PixelBox(0, 0, 4, 1), null);
        Assertions.assertEquals(0, destination.copyGoodPixels(missing, flags));
        Assertions.assertEquals(0, destination.countEmpty());
    }

    /**
     * Check that pixels outside an outline are marked as having no data without losing their other flags.
     */
    @Test
    public void testMaskOutside() {
        final Raster raster = filled(new PixelBox(0, 0, 3, 3), BAD);
        raster.maskOutside((x, y) -> x == 1 && y == 1);
        Assertions.assertEquals(8, raster.countEmpty());
        Assertions.assertFalse(raster.isEmpty(1, 1));
        Assertions.assertEquals(BAD | NO_DATA, raster.getMask(0, 0));
        Assertions.assertEquals(0 * 1000 + 0, raster.getPixel(0, 0));
    }
}
