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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.google.common.collect.ImmutableList;

import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.SkyWcs;
import org.openastronomy.ms.cutout.locate.PatchInfo;
import org.openastronomy.ms.cutout.locate.SkyMap;
import org.openastronomy.ms.cutout.locate.TractInfo;
import org.openastronomy.ms.cutout.locate.TractPatches;
import org.openastronomy.ms.cutout.raster.MaskPlane;
import org.openastronomy.ms.cutout.raster.Raster;
import org.openastronomy.ms.cutout.region.RegionDescriptor;
import org.openastronomy.ms.cutout.region.ShapeKind;
import org.openastronomy.ms.cutout.region.SizeUnit;
import org.openastronomy.ms.cutout.store.Tile;
import org.openastronomy.ms.cutout.store.TileReference;
import org.openastronomy.ms.cutout.store.TileStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a region of the sky from the patches of every tract of a sky map that it touches.
 * The result is in the pixel frame of the tract that contains the region's center.
 * Where tracts overlap, earlier tracts take priority, later tracts filling only pixels that are empty or flagged.
 */
public class MosaicStitcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(MosaicStitcher.class);

    private static final int REPLACEABLE = MaskPlane.bitMaskOf(MaskPlane.BAD, MaskPlane.EDGE);

    private final SkyMap skyMap;
    private final TileStore patchStore;
    private final CutoutResolver resolver;
    private final Warper warper;
    private final ExecutorService executor;

    /**
     * Construct a new mosaic stitcher.
     * @param skyMap the tessellation of the sky
     * @param patchStore the store of the patches, keyed by tract, patch and filter
     * @param resolver for pixel scale and area checks
     * @param warper for resampling tracts onto the reference frame
     * @param executor for assembling tracts in parallel, or {@code null} to assemble them in turn
     */
    public MosaicStitcher(SkyMap skyMap, TileStore patchStore, CutoutResolver resolver, Warper warper,
            ExecutorService executor) {
        this.skyMap = skyMap;
        this.patchStore = patchStore;
        this.resolver = resolver;
        this.warper = warper;
        this.executor = executor;
    }

    /**
     * Find the box that a region covers in a tract's frame.
     * Angular sizes take the box spanned by the projections of the region's sky corners;
     * pixel sizes take the box of that size centered on the projected center.
     * @param region a region of the sky
     * @param tract the tract providing the frame
     * @return the covered box, not clipped to the tract
     */
    PixelBox getDestinationBox(RegionDescriptor region, TractInfo tract) {
        final SkyWcs wcs = tract.getWcs();
        final SkyPoint center = region.getCenter();
        final PixelPoint centerPixel = wcs.skyToPixel(center);
        if (!centerPixel.isFinite()) {
            throw new ImageNotFoundException("region center " + center + " does not project onto " + tract);
        }
        final double pixelsPerArcsec = CutoutResolver.getPixelsPerArcsec(wcs, tract.getBounds(), center.getDec());
        if (region.getUnit() == SizeUnit.PIXEL) {
            resolver.checkArea(region, region.getWidth(), region.getHeight(), pixelsPerArcsec);
            return CutoutResolver.boxAround(centerPixel, region.getWidth(), region.getHeight());
        }
        final double halfWidth = region.getUnit().toArcsec(region.getWidth()) / 2;
        final double halfHeight = region.getUnit().toArcsec(region.getHeight()) / 2;
        resolver.checkArea(region, 2 * halfWidth * pixelsPerArcsec, 2 * halfHeight * pixelsPerArcsec, pixelsPerArcsec);
        final double halfRa = halfWidth / 3600 / Math.cos(Math.toRadians(center.getDec()));
        final double halfDec = halfHeight / 3600;
        final PixelPoint lowerLeft = wcs.skyToPixel(new SkyPoint(center.getRa() - halfRa, center.getDec() - halfDec));
        final PixelPoint upperRight = wcs.skyToPixel(new SkyPoint(center.getRa() + halfRa, center.getDec() + halfDec));
        if (!(lowerLeft.isFinite() && upperRight.isFinite())) {
            throw new ImageNotFoundException("region " + region + " does not project onto " + tract);
        }
        return PixelBox.spanning(lowerLeft.roundX(), lowerLeft.roundY(), upperRight.roundX(), upperRight.roundY());
    }

    /**
     * Copy a tract's patches into one raster spanning them all. Missing patches are left without data.
     * @param tractPatches the tract and the patches to copy
     * @param filter the filter band
     * @param cancellation checked before each patch
     * @return the assembled tract
     * @throws IOException if a patch could not be read
     */
    private Raster assembleTract(TractPatches tractPatches, String filter, Cancellation cancellation) throws IOException {
        final TractInfo tract = tractPatches.getTract();
        PixelBox union = new PixelBox(0, 0, 0, 0);
        for (final PatchInfo patch : tractPatches.getPatches()) {
            union = union.union(patch.getBounds());
        }
        final Raster raster = new Raster(union, tract.getWcs());
        for (final PatchInfo patch : tractPatches.getPatches()) {
            cancellation.check();
            final TileReference reference = TileReference.forPatch(tract.getId(), patch.getIndexX(), patch.getIndexY(), filter);
            final Tile tile;
            try {
                tile = patchStore.getTile(reference);
            } catch (ImageNotFoundException infe) {
                LOGGER.warn("no data for {} of {} in filter {}", patch, tract, filter);
                continue;
            }
            raster.blit(tile.getRaster());
        }
        LOGGER.debug("assembled {} from {} patches over {}", tract, tractPatches.getPatches().size(), union);
        return raster;
    }

    /**
     * Assemble every tract, in parallel if an executor is available.
     * @param tractPatchList the tracts with their patches
     * @param filter the filter band
     * @param cancellation checked before each patch
     * @return the assembled tracts, in the same order
     * @throws IOException if a patch could not be read
     */
    private List<Raster> assembleTracts(List<TractPatches> tractPatchList, String filter, Cancellation cancellation)
            throws IOException {
        final ImmutableList.Builder<Raster> rasters = ImmutableList.builder();
        if (executor == null || tractPatchList.size() < 2) {
            for (final TractPatches tractPatches : tractPatchList) {
                rasters.add(assembleTract(tractPatches, filter, cancellation));
            }
            return rasters.build();
        }
        final List<Future<Raster>> futures = new ArrayList<>(tractPatchList.size());
        for (final TractPatches tractPatches : tractPatchList) {
            futures.add(executor.submit(() -> assembleTract(tractPatches, filter, cancellation)));
        }
        boolean isComplete = false;
        try {
            for (final Future<Raster> future : futures) {
                rasters.add(future.get());
            }
            isComplete = true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while assembling tracts");
        } catch (ExecutionException ee) {
            final Throwable cause = ee.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException("failed to assemble tract", cause);
        } finally {
            if (!isComplete) {
                for (final Future<Raster> future : futures) {
                    future.cancel(true);
                }
            }
        }
        return rasters.build();
    }

    /**
     * Find the box in which a tract's raster holds the reference box.
     * Negative coordinates are clamped to zero.
     * @param tract a tract other than the reference tract
     * @param lowerLeft the lower-left sky corner of the reference box
     * @param upperRight the upper-right sky corner of the reference box
     * @return the box in the tract's frame, or {@code null} if the corners do not project onto it
     */
    static PixelBox getTractBox(TractInfo tract, SkyPoint lowerLeft, SkyPoint upperRight) {
        final PixelPoint lowerLeftPixel = tract.getWcs().skyToPixel(lowerLeft);
        final PixelPoint upperRightPixel = tract.getWcs().skyToPixel(upperRight);
        if (!(lowerLeftPixel.isFinite() && upperRightPixel.isFinite())) {
            LOGGER.warn("reference box does not project onto {}", tract);
            return null;
        }
        final int llX = Math.max(0, lowerLeftPixel.roundX());
        final int llY = Math.max(0, lowerLeftPixel.roundY());
        int urX = upperRightPixel.roundX();
        int urY = upperRightPixel.roundY();
        if (urX < 0 || urY < 0) {
            LOGGER.warn("upper-right corner ({}, {}) of reference box is outside {}", urX, urY, tract);
            urX = Math.max(0, urX);
            urY = Math.max(0, urY);
        }
        return PixelBox.spanning(llX, llY, urX, urY);
    }

    /**
     * Assemble a region of the sky from a sky map's patches.
     * @param region a region of the sky
     * @param filter the filter band
     * @param cancellation checked between units of work
     * @return the region's pixels in the frame of the tract containing its center
     * @throws IOException if a patch could not be read
     * @throws ImageNotFoundException if no tract covers the region
     * @throws CancellationException if the operation was cancelled
     */
    public Raster stitch(RegionDescriptor region, String filter, Cancellation cancellation) throws IOException {
        if (filter == null || filter.isEmpty()) {
            throw new RequestParseException("mosaic requires a filter");
        }
        final TractInfo reference = skyMap.findTract(region.getCenter());
        final SkyWcs referenceWcs = reference.getWcs();
        final PixelBox destinationBox = getDestinationBox(region, reference);
        final List<SkyPoint> corners = new ArrayList<>(4);
        for (final PixelPoint corner : destinationBox.getCorners()) {
            corners.add(referenceWcs.pixelToSky(corner));
        }
        final List<TractPatches> tractPatchList = skyMap.findTractPatchList(corners);
        if (tractPatchList.isEmpty()) {
            throw new ImageNotFoundException("no tract covers " + region);
        }
        LOGGER.debug("{} in filter {} touches {} tracts, reference is {}", region, filter, tractPatchList.size(), reference);
        final List<Raster> tractRasters = assembleTracts(tractPatchList, filter, cancellation);
        final List<Raster> crops = new ArrayList<>(tractRasters.size());
        for (int index = 0; index < tractPatchList.size(); index++) {
            cancellation.check();
            final TractInfo tract = tractPatchList.get(index).getTract();
            final Raster tractRaster = tractRasters.get(index);
            final PixelBox box;
            if (tract.getId() == reference.getId()) {
                box = destinationBox;
            } else {
                box = getTractBox(tract, corners.get(0), corners.get(2));
                if (box == null) {
                    continue;
                }
            }
            crops.add(tractRaster.crop(box.intersection(tractRaster.getBounds())));
        }
        final double pixelsPerArcsec = CutoutResolver.getPixelsPerArcsec(referenceWcs, reference.getBounds(),
                region.getCenter().getDec());
        final Raster result;
        if (crops.size() == 1) {
            result = crops.get(0);
        } else {
            result = new Raster(destinationBox, referenceWcs);
            for (final Raster crop : crops) {
                cancellation.check();
                final Raster warped = warper.warp(crop, referenceWcs, destinationBox, cancellation);
                final long copied = result.copyGoodPixels(warped, REPLACEABLE);
                LOGGER.debug("copied {} pixels from {}", copied, crop);
            }
        }
        if (region.getKind() == ShapeKind.CIRCLE || region.getKind() == ShapeKind.POLYGON) {
            CutoutResolver.applyMask(region, result, pixelsPerArcsec);
        }
        return result;
    }
}
