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

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import io.vertx.core.buffer.Buffer;

import org.openastronomy.ms.cutout.geom.PixelBox;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Check the binary encoding of rasters.
 */
public class DeflateRasterEncoderTest {

    /**
     * Inflate the given compressed data.
     * @param compressed compressed data
     * @param size the size of the uncompressed data
     * @return the uncompressed data
     * @throws DataFormatException if the data could not be inflated
     */
    private static ByteBuffer inflate(byte[] compressed, int size) throws DataFormatException {
        final Inflater inflater = new Inflater();
        inflater.setInput(compressed);
        /* room to spare so that the end of the stream is reached */
        final byte[] uncompressed = new byte[size + 64];
        final int inflated = inflater.inflate(uncompressed);
        Assertions.assertTrue(inflater.finished());
        inflater.end();
        Assertions.assertEquals(size, inflated);
        return ByteBuffer.wrap(uncompressed, 0, size);
    }

    /**
     * Check that the encoded raster holds the pixels then the mask words, row by row.
     * @throws DataFormatException unexpected
     */
    @Test
    public void testEncoding() throws DataFormatException {
        final PixelBox bounds = new PixelBox(7, -3, 3, 2);
        final Raster raster = new Raster(bounds, null);
        raster.setPixel(7, -3, 1.5f, 0);
        raster.setPixel(9, -3, -2f, MaskPlane.BAD.getBitMask());
        raster.setPixel(8, -2, 1e6f, MaskPlane.EDGE.getBitMask());
        final DeflateRasterEncoder encoder = new DeflateRasterEncoder(9);
        final Buffer encoded = encoder.encode(raster);
        final ByteBuffer decoded = inflate(encoded.getBytes(), 6 * (Float.BYTES + Integer.BYTES));
        final float[] pixels = new float[6];
        final int[] mask = new int[6];
        decoded.asFloatBuffer().get(pixels);
        decoded.position(6 * Float.BYTES);
        decoded.asIntBuffer().get(mask);
        Assertions.assertArrayEquals(new float[] {1.5f, 0, -2f, 0, 1e6f, 0}, pixels);
        final int noData = MaskPlane.NO_DATA.getBitMask();
        Assertions.assertArrayEquals(new int[] {0, noData, MaskPlane.BAD.getBitMask(), noData, MaskPlane.EDGE.getBitMask(), noData},
                mask);
    }

    /**
     * Check that the response headers describe the raster's position.
     */
    @Test
    public void testDescription() {
        final DeflateRasterEncoder encoder = new DeflateRasterEncoder(6);
        final Map<String, String> headers = encoder.describe(new Raster(new PixelBox(-10, 20, 30, 40), null));
        Assertions.assertEquals("-10,20,30,40", headers.get(DeflateRasterEncoder.HEADER_BOUNDS));
        Assertions.assertTrue(headers.containsKey(DeflateRasterEncoder.HEADER_LAYOUT));
        Assertions.assertEquals("application/octet-stream", encoder.getContentType());
    }

    /**
     * Check that an empty raster encodes as an empty stream.
     * @throws DataFormatException unexpected
     */
    @Test
    public void testEmpty() throws DataFormatException {
        final Buffer encoded = new DeflateRasterEncoder(1).encode(new Raster(new PixelBox(0, 0, 0, 0), null));
        Assertions.assertTrue(encoded.length() > 0);
        inflate(encoded.getBytes(), 0);
    }
}
