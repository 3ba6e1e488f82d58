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

import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.locate.SpatialLocator;
import org.openastronomy.ms.cutout.raster.Raster;
import org.openastronomy.ms.cutout.region.RegionDescriptor;
import org.openastronomy.ms.cutout.region.ShapeParser;
import org.openastronomy.ms.cutout.store.ScienceIdScheme;
import org.openastronomy.ms.cutout.store.Tile;
import org.openastronomy.ms.cutout.store.TileReference;
import org.openastronomy.ms.cutout.store.TileStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The image operations available on one dataset: whole tiles and cutouts, located by position, by key or by science id,
 * and mosaics across a sky map.
 */
public class ImageGetter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageGetter.class);

    private final String dataset;
    private final TileStore store;
    private final SpatialLocator locator;
    private final ScienceIdScheme scienceIdScheme;
    private final CutoutResolver resolver;
    private final String skyMapName;
    private final MosaicStitcher stitcher;

    /**
     * Construct a new image getter.
     * @param dataset the name of the dataset
     * @param store the dataset's tiles
     * @param locator the dataset's spatial index
     * @param scienceIdScheme how the dataset's science ids are packed, or {@code null} if it has none
     * @param resolver for cutouts from single tiles
     * @param skyMapName the name of the dataset's sky map, or {@code null} if it has none
     * @param stitcher for mosaics across the sky map, or {@code null} if the dataset has none
     */
    public ImageGetter(String dataset, TileStore store, SpatialLocator locator, ScienceIdScheme scienceIdScheme,
            CutoutResolver resolver, String skyMapName, MosaicStitcher stitcher) {
        this.dataset = dataset;
        this.store = store;
        this.locator = locator;
        this.scienceIdScheme = scienceIdScheme;
        this.resolver = resolver;
        this.skyMapName = skyMapName;
        this.stitcher = stitcher;
    }

    /**
     * @return the name of the dataset
     */
    public String getDataset() {
        return dataset;
    }

    private TileReference findNearest(SkyPoint center, String filter) {
        final TileReference reference = locator.nearestTileContaining(center, filter).orElse(null);
        if (reference == null) {
            throw new ImageNotFoundException("no image in " + dataset + " contains " + center
                    + (filter == null ? "" : " in filter " + filter));
        }
        LOGGER.debug("nearest image to {} in {} is {}", center, dataset, reference);
        return reference;
    }

    private TileReference fromScienceId(long scienceId) {
        if (scienceIdScheme == null) {
            throw new RequestParseException("dataset " + dataset + " does not support science ids");
        }
        return scienceIdScheme.toTileReference(scienceId);
    }

    /**
     * @param center a position on the sky
     * @param filter the filter band, or {@code null} for any
     * @return the whole of the image containing the position whose center is nearest to it
     * @throws IOException if the image could not be read
     */
    public Raster fullNearest(SkyPoint center, String filter) throws IOException {
        return store.getTile(findNearest(center, filter)).getRaster();
    }

    /**
     * @param reference an image's key
     * @return the whole of the image
     * @throws IOException if the image could not be read
     */
    public Raster fullFromDataId(TileReference reference) throws IOException {
        return store.getTile(reference).getRaster();
    }

    /**
     * @param scienceId an image's science id
     * @return the whole of the image
     * @throws IOException if the image could not be read
     */
    public Raster fullFromScienceId(long scienceId) throws IOException {
        return fullFromDataId(fromScienceId(scienceId));
    }

    /**
     * @param region a region of the sky
     * @param filter the filter band, or {@code null} for any
     * @return the region cut from the image containing its center whose center is nearest to it
     * @throws IOException if the image could not be read
     */
    public Raster cutoutFromNearest(RegionDescriptor region, String filter) throws IOException {
        return getCutout(region, findNearest(region.getCenter(), filter));
    }

    /**
     * @param region a region of the sky
     * @param reference an image's key
     * @return the region cut from the image
     * @throws IOException if the image could not be read
     */
    public Raster getCutout(RegionDescriptor region, TileReference reference) throws IOException {
        final Tile tile = store.getTile(reference);
        final Raster cutout = resolver.cutout(region, tile);
        LOGGER.debug("cut {} from {}", cutout, reference);
        return cutout;
    }

    /**
     * @param region a region of the sky
     * @param scienceId an image's science id
     * @return the region cut from the image
     * @throws IOException if the image could not be read
     */
    public Raster cutoutFromScienceId(RegionDescriptor region, long scienceId) throws IOException {
        return getCutout(region, fromScienceId(scienceId));
    }

    /**
     * @param region a region of the sky
     * @param filter the filter band
     * @param cancellation for abandoning the mosaic
     * @return the region assembled from the sky map's patches
     * @throws IOException if a patch could not be read
     */
    public Raster getMosaic(RegionDescriptor region, String filter, Cancellation cancellation) throws IOException {
        if (stitcher == null) {
            throw new ImageNotFoundException("dataset " + dataset + " has no sky map");
        }
        return stitcher.stitch(region, filter, cancellation);
    }

    /**
     * @param skyMap the name of the sky map to use
     * @param region a region of the sky
     * @param filter the filter band
     * @param cancellation for abandoning the mosaic
     * @return the region assembled from the sky map's patches
     * @throws IOException if a patch could not be read
     */
    public Raster cutoutFromSkyMap(String skyMap, RegionDescriptor region, String filter, Cancellation cancellation)
            throws IOException {
        if (skyMapName == null || !skyMapName.equals(skyMap)) {
            throw new ImageNotFoundException("dataset " + dataset + " has no sky map " + skyMap);
        }
        return getMosaic(region, filter, cancellation);
    }

    /**
     * @param position a region descriptor such as {@code CIRCLE ra dec radius}
     * @param filter the filter band, or {@code null} for any
     * @param reference an image's key, or {@code null} to use the image nearest to the region's center
     * @return the region cut from the image
     * @throws IOException if the image could not be read
     */
    public Raster cutoutFromPos(String position, String filter, TileReference reference) throws IOException {
        final RegionDescriptor region = ShapeParser.parse(position);
        return reference == null ? cutoutFromNearest(region, filter) : getCutout(region, reference);
    }
}
