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

import java.util.Arrays;
import java.util.function.BiPredicate;

import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.SkyWcs;

/**
 * Single-precision pixel values with a mask plane, positioned in the pixel frame of a parent image.
 * Pixel coordinates used by the accessors are parent-frame coordinates.
 * Not thread-safe while being written.
 */
public class Raster {

    private static final int NO_DATA = MaskPlane.NO_DATA.getBitMask();

    private final PixelBox bounds;
    private final SkyWcs wcs;

    final float[] pixels;
    final int[] mask;

    /**
     * Construct a new raster in which every pixel is marked as having no data.
     * @param bounds the extent of the raster in the parent frame
     * @param wcs the transform of the parent frame, may be {@code null}
     */
    public Raster(PixelBox bounds, SkyWcs wcs) {
        this.bounds = bounds;
        this.wcs = wcs;
        final int size = Math.toIntExact(bounds.getArea());
        this.pixels = new float[size];
        this.mask = new int[size];
        Arrays.fill(mask, NO_DATA);
    }

    /**
     * Construct a new raster over existing data, which the raster then owns.
     * @param bounds the extent of the raster in the parent frame
     * @param wcs the transform of the parent frame, may be {@code null}
     * @param pixels the pixel values, row by row from the lowest row
     * @param mask the mask words, in the same order as the pixels
     */
    public Raster(PixelBox bounds, SkyWcs wcs, float[] pixels, int[] mask) {
        if (pixels.length != bounds.getArea() || mask.length != bounds.getArea()) {
            throw new IllegalArgumentException("raster of " + bounds + " needs " + bounds.getArea() + " pixels and mask words");
        }
        this.bounds = bounds;
        this.wcs = wcs;
        this.pixels = pixels;
        this.mask = mask;
    }

    /**
     * @return the extent of this raster in the parent frame
     */
    public PixelBox getBounds() {
        return bounds;
    }

    /**
     * @return the transform of the parent frame, may be {@code null}
     */
    public SkyWcs getWcs() {
        return wcs;
    }

    public int getWidth() {
        return bounds.getWidth();
    }

    public int getHeight() {
        return bounds.getHeight();
    }

    private int indexOf(int x, int y) {
        if (!bounds.contains(x, y)) {
            throw new IndexOutOfBoundsException("pixel (" + x + ", " + y + ") lies outside " + bounds);
        }
        return (y - bounds.getY()) * bounds.getWidth() + (x - bounds.getX());
    }

    public float getPixel(int x, int y) {
        return pixels[indexOf(x, y)];
    }

    public int getMask(int x, int y) {
        return mask[indexOf(x, y)];
    }

    /**
     * Set a pixel's value and mask word.
     * @param x a parent-frame column
     * @param y a parent-frame row
     * @param value the pixel value
     * @param maskWord the mask word
     */
    public void setPixel(int x, int y, float value, int maskWord) {
        final int index = indexOf(x, y);
        pixels[index] = value;
        mask[index] = maskWord;
    }

    /**
     * @param x a parent-frame column
     * @param y a parent-frame row
     * @return if the pixel is marked as having no data
     */
    public boolean isEmpty(int x, int y) {
        return (getMask(x, y) & NO_DATA) != 0;
    }

    /**
     * @return how many pixels are marked as having no data
     */
    public int countEmpty() {
        int count = 0;
        for (final int word : mask) {
            if ((word & NO_DATA) != 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Copy part of this raster. The copy keeps the parent-frame position and transform.
     * @param box the part to copy, must lie within this raster's bounds
     * @return a new raster
     */
    public Raster crop(PixelBox box) {
        if (!bounds.contains(box)) {
            throw new IllegalArgumentException("crop " + box + " exceeds raster " + bounds);
        }
        if (box.isEmpty()) {
            return new Raster(box, wcs, new float[0], new int[0]);
        }
        final int width = box.getWidth();
        final float[] croppedPixels = new float[Math.toIntExact(box.getArea())];
        final int[] croppedMask = new int[croppedPixels.length];
        for (int row = 0; row < box.getHeight(); row++) {
            final int from = indexOf(box.getX(), box.getY() + row);
            System.arraycopy(pixels, from, croppedPixels, row * width, width);
            System.arraycopy(mask, from, croppedMask, row * width, width);
        }
        return new Raster(box, wcs, croppedPixels, croppedMask);
    }

    /**
     * Copy the pixels of another raster in the same frame over this one where they overlap.
     * @param source the raster to copy from
     * @return how many pixels were copied
     */
    public long blit(Raster source) {
        final PixelBox overlap = bounds.intersection(source.bounds);
        if (overlap.isEmpty()) {
            return 0;
        }
        final int width = overlap.getWidth();
        for (int row = overlap.getY(); row < overlap.getEndY(); row++) {
            final int from = source.indexOf(overlap.getX(), row);
            final int to = indexOf(overlap.getX(), row);
            System.arraycopy(source.pixels, from, pixels, to, width);
            System.arraycopy(source.mask, from, mask, to, width);
        }
        return overlap.getArea();
    }

    /**
     * Fill this raster's empty or flagged pixels from another raster in the same frame.
     * A destination pixel is replaced if it has no data, or if it has any of the given flags while the source pixel has none.
     * Source pixels that have no data are never copied.
     * @param source the raster to copy from
     * @param flags the mask bits that mark a pixel as replaceable
     * @return how many pixels were copied
     */
    public long copyGoodPixels(Raster source, int flags) {
        final PixelBox overlap = bounds.intersection(source.bounds);
        long copied = 0;
        for (int y = overlap.getY(); y < overlap.getEndY(); y++) {
            for (int x = overlap.getX(); x < overlap.getEndX(); x++) {
                final int from = source.indexOf(x, y);
                final int sourceMask = source.mask[from];
                if ((sourceMask & NO_DATA) != 0) {
                    continue;
                }
                final int to = indexOf(x, y);
                final int destinationMask = mask[to];
                if ((destinationMask & NO_DATA) != 0 || ((destinationMask & flags) != 0 && (sourceMask & flags) == 0)) {
                    pixels[to] = source.pixels[from];
                    mask[to] = sourceMask;
                    copied++;
                }
            }
        }
        return copied;
    }

    /**
     * Mark as having no data every pixel that the given region does not include.
     * @param isInside reports if a parent-frame pixel lies within the region
     */
    public void maskOutside(BiPredicate<Integer, Integer> isInside) {
        for (int y = bounds.getY(); y < bounds.getEndY(); y++) {
            for (int x = bounds.getX(); x < bounds.getEndX(); x++) {
                if (!isInside.test(x, y)) {
                    mask[indexOf(x, y)] |= NO_DATA;
                }
            }
        }
    }

    @Override
    public String toString() {
        return "raster " + bounds;
    }
}
