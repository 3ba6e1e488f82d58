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

package org.openastronomy.ms.cutout.getimage;

import java.util.OptionalDouble;
import java.util.function.BiPredicate;

import org.openastronomy.ms.cutout.error.CutoutTooLargeException;
import org.openastronomy.ms.cutout.error.OutOfBoundsException;
import org.openastronomy.ms.cutout.error.PixelScaleException;
import org.openastronomy.ms.cutout.error.WcsMissingException;
import org.openastronomy.ms.cutout.geom.Angles;
import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.SkyWcs;
import org.openastronomy.ms.cutout.mask.RegionMask;
import org.openastronomy.ms.cutout.raster.Raster;
import org.openastronomy.ms.cutout.region.RegionDescriptor;
import org.openastronomy.ms.cutout.region.ShapeKind;
import org.openastronomy.ms.cutout.region.SizeUnit;
import org.openastronomy.ms.cutout.store.Tile;
import org.openastronomy.ms.cutout.store.TileMetadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a sky region into the box of pixels that it covers in one tile, and extracts those pixels.
 */
public class CutoutResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(CutoutResolver.class);

    private final double maximumArea;

    /**
     * @param maximumArea the largest region that may be requested, in square degrees
     */
    public CutoutResolver(double maximumArea) {
        this.maximumArea = maximumArea;
    }

    /**
     * Find how many pixels of a frame span one arcsecond.
     * Uses the transform's own pixel scale if it has one, otherwise estimates from the sky separation
     * of the first and last pixels on the diagonal of the given bounds.
     * @param wcs the transform of the frame
     * @param bounds the extent of the frame
     * @param declination the declination at which to correct right ascension differences, in degrees
     * @return the pixels per arcsecond, positive and finite
     * @throws PixelScaleException if the scale is zero or not finite
     */
    static double getPixelsPerArcsec(SkyWcs wcs, PixelBox bounds, double declination) {
        final OptionalDouble pixelScale = wcs.getPixelScale();
        final double pixelsPerArcsec;
        if (pixelScale.isPresent()) {
            pixelsPerArcsec = 1 / pixelScale.getAsDouble();
        } else {
            final SkyPoint first = wcs.pixelToSky(new PixelPoint(bounds.getX(), bounds.getY()));
            final SkyPoint last = wcs.pixelToSky(new PixelPoint(bounds.getEndX() - 1, bounds.getEndY() - 1));
            final double skyDistance = Angles.planarSeparationArcsec(first, last, declination);
            final double pixelDistance = Math.hypot(bounds.getWidth(), bounds.getHeight());
            pixelsPerArcsec = pixelDistance / skyDistance;
            LOGGER.debug("estimated {} pixels per arcsecond from corners {} and {}", pixelsPerArcsec, first, last);
        }
        if (!(Double.isFinite(pixelsPerArcsec) && pixelsPerArcsec > 0)) {
            throw new PixelScaleException("cannot determine pixel scale, have " + pixelsPerArcsec + " pixels per arcsecond");
        }
        return pixelsPerArcsec;
    }

    /**
     * Find the box of the given size centered on a pixel position.
     * @param center the central position
     * @param width the width in pixels
     * @param height the height in pixels
     * @return the box
     */
    static PixelBox boxAround(PixelPoint center, double width, double height) {
        return new PixelBox((int) Math.floor(center.getX() - width / 2), (int) Math.floor(center.getY() - height / 2),
                (int) Math.floor(width), (int) Math.floor(height));
    }

    /**
     * Find the square of side {@code 2r+1} centered on the pixel that contains a position.
     * @param center the central position
     * @param radius the radius in whole pixels
     * @return the box
     */
    static PixelBox boxAroundCircle(PixelPoint center, int radius) {
        return new PixelBox((int) Math.floor(center.getX()) - radius, (int) Math.floor(center.getY()) - radius,
                2 * radius + 1, 2 * radius + 1);
    }

    /**
     * @param metadata a tile's metadata
     * @return the tile's transform
     * @throws WcsMissingException if the tile has no transform
     */
    static SkyWcs requireWcs(TileMetadata metadata) {
        final SkyWcs wcs = metadata.getWcs();
        if (wcs == null) {
            throw new WcsMissingException("no coordinate transform for " + metadata.getReference());
        }
        return wcs;
    }

    void checkArea(RegionDescriptor region, double width, double height, double pixelsPerArcsec) {
        final double pixelsPerDegree = Angles.toArcsec(pixelsPerArcsec);
        final double area = (width / pixelsPerDegree) * (height / pixelsPerDegree);
        if (area > maximumArea || width > Integer.MAX_VALUE || height > Integer.MAX_VALUE) {
            LOGGER.debug("rejecting {} of area {} square degrees", region, area);
            throw new CutoutTooLargeException(area, maximumArea);
        }
    }

    /**
     * Find the pixels of a tile that a region covers.
     * @param region a region of the sky
     * @param metadata the tile's metadata
     * @return the covered pixels, clipped to the tile's bounds
     * @throws OutOfBoundsException if the region does not overlap the tile
     */
    public PixelBox resolveCutout(RegionDescriptor region, TileMetadata metadata) {
        final SkyWcs wcs = requireWcs(metadata);
        final PixelBox bounds = metadata.getBounds();
        final PixelPoint center = wcs.skyToPixel(region.getCenter());
        if (!center.isFinite()) {
            throw new OutOfBoundsException("region center " + region.getCenter() + " does not project onto " + metadata.getReference());
        }
        final double pixelsPerArcsec = getPixelsPerArcsec(wcs, bounds, region.getCenter().getDec());
        final PixelBox box;
        if (region.getKind() == ShapeKind.CIRCLE) {
            final double radius = region.getCircleRadiusPixels(pixelsPerArcsec);
            checkArea(region, 2 * radius + 1, 2 * radius + 1, pixelsPerArcsec);
            /* narrowed only once the side is known to fit */
            box = boxAroundCircle(center, (int) radius);
        } else {
            final double width, height;
            if (region.getUnit() == SizeUnit.PIXEL) {
                width = region.getWidth();
                height = region.getHeight();
            } else {
                width = region.getUnit().toArcsec(region.getWidth()) * pixelsPerArcsec;
                height = region.getUnit().toArcsec(region.getHeight()) * pixelsPerArcsec;
            }
            checkArea(region, width, height, pixelsPerArcsec);
            box = boxAround(center, width, height);
        }
        if (!box.overlaps(bounds)) {
            throw new OutOfBoundsException("region " + box + " lies outside " + metadata.getReference() + " " + bounds);
        }
        final PixelBox clipped = box.intersection(bounds);
        LOGGER.debug("{} covers {} of {}", region, clipped, metadata.getReference());
        return clipped;
    }

    /**
     * Extract the pixels of a tile that a region covers, marking those outside the region's outline as having no data.
     * @param region a region of the sky
     * @param tile the tile
     * @return the extracted pixels, positioned in the tile's frame
     */
    public Raster cutout(RegionDescriptor region, Tile tile) {
        final PixelBox box = resolveCutout(region, tile.getMetadata());
        final Raster raster = tile.getRaster().crop(box);
        final SkyWcs wcs = tile.getMetadata().getWcs();
        applyMask(region, raster, getPixelsPerArcsec(wcs, tile.getMetadata().getBounds(), region.getCenter().getDec()));
        return raster;
    }

    /**
     * Mark the pixels of a raster outside a region's outline as having no data.
     * Does nothing for regions that fill their box.
     * @param region a region of the sky
     * @param raster a raster with a transform
     * @param pixelsPerArcsec the pixel scale of the raster's frame
     */
    static void applyMask(RegionDescriptor region, Raster raster, double pixelsPerArcsec) {
        if (raster.getBounds().isEmpty() || (region.getKind() != ShapeKind.CIRCLE && region.getKind() != ShapeKind.POLYGON)) {
            return;
        }
        final RegionMask mask = region.getMask(pixelsPerArcsec);
        final BiPredicate<Integer, Integer> isInside = mask.getMaskReader(raster.getWcs());
        if (isInside == null) {
            LOGGER.warn("outline of {} does not project onto {}", region, raster);
        } else {
            raster.maskOutside(isInside);
        }
    }
}
