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
import java.util.zip.Deflater;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import io.vertx.core.buffer.Buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes a raster as zlib-compressed big-endian 32-bit floating-point pixel values, row by row from the lowest row,
 * followed by one big-endian 32-bit mask word per pixel in the same order.
 * The raster's position and size are given in headers.
 */
public class DeflateRasterEncoder implements RasterEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeflateRasterEncoder.class);

    public static final String HEADER_BOUNDS = "X-Cutout-Bounds";
    public static final String HEADER_LAYOUT = "X-Cutout-Layout";

    private final int deflateLevel;

    /**
     * @param deflateLevel the zlib compression level to use
     */
    public DeflateRasterEncoder(int deflateLevel) {
        this.deflateLevel = deflateLevel;
    }

    @Override
    public String getContentType() {
        return "application/octet-stream";
    }

    @Override
    public Map<String, String> describe(Raster raster) {
        final String bounds = Joiner.on(',').join(raster.getBounds().getX(), raster.getBounds().getY(),
                raster.getWidth(), raster.getHeight());
        return ImmutableMap.of(HEADER_BOUNDS, bounds, HEADER_LAYOUT, "float32>,int32>;zlib");
    }

    @Override
    public Buffer encode(Raster raster) {
        final int count = raster.pixels.length;
        final ByteBuffer uncompressed = ByteBuffer.allocate(count * (Float.BYTES + Integer.BYTES));
        uncompressed.asFloatBuffer().put(raster.pixels);
        uncompressed.position(count * Float.BYTES);
        uncompressed.asIntBuffer().put(raster.mask);
        final Buffer compressed = compress(uncompressed.array());
        LOGGER.debug("encoded {} as {} bytes", raster, compressed.length());
        return compressed;
    }

    /**
     * Compress the given byte array.
     * @param uncompressed a byte array
     * @return the compressed bytes
     */
    private Buffer compress(byte[] uncompressed) {
        final Deflater deflater = new Deflater(deflateLevel);
        deflater.setInput(uncompressed);
        deflater.finish();
        final Buffer compressed = Buffer.buffer(Math.max(64, uncompressed.length / 4));
        final byte[] batch = new byte[8192];
        int batchSize;
        do {
            batchSize = deflater.deflate(batch);
            compressed.appendBytes(batch, 0, batchSize);
        } while (!deflater.finished());
        deflater.end();
        return compressed;
    }
}
