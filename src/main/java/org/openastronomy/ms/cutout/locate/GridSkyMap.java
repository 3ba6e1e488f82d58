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

package org.openastronomy.ms.cutout.locate;

import java.util.List;

import com.google.common.collect.ImmutableList;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.geom.Angles;
import org.openastronomy.ms.cutout.geom.PixelBox;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.geom.TanWcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A sky map whose tracts are each divided into a regular grid of equally sized patches.
 * Tracts are searched in the order in which they were given.
 */
public class GridSkyMap implements SkyMap {

    private static final Logger LOGGER = LoggerFactory.getLogger(GridSkyMap.class);

    /* A tract with its patch grid. */
    private static class GridTract {

        final TractInfo tract;
        final SkyPoint center;
        final List<PatchInfo> patches;

        GridTract(TractInfo tract, int patchWidth, int patchHeight) {
            this.tract = tract;
            this.center = tract.getWcs().pixelToSky(tract.getBounds().getCenter());
            final PixelBox bounds = tract.getBounds();
            final ImmutableList.Builder<PatchInfo> patches = ImmutableList.builder();
            for (int indexY = 0; bounds.getY() + indexY * patchHeight < bounds.getEndY(); indexY++) {
                for (int indexX = 0; bounds.getX() + indexX * patchWidth < bounds.getEndX(); indexX++) {
                    final int x = bounds.getX() + indexX * patchWidth;
                    final int y = bounds.getY() + indexY * patchHeight;
                    final PixelBox patch = new PixelBox(x, y,
                            Math.min(patchWidth, bounds.getEndX() - x), Math.min(patchHeight, bounds.getEndY() - y));
                    patches.add(new PatchInfo(indexX, indexY, patch));
                }
            }
            this.patches = patches.build();
        }
    }

    private final List<GridTract> tracts;

    /**
     * Construct a sky map in which every tract has the same patch size.
     * @param tracts the tracts of the sky map
     * @param patchWidth the width of each patch in pixels
     * @param patchHeight the height of each patch in pixels
     */
    public GridSkyMap(List<TractInfo> tracts, int patchWidth, int patchHeight) {
        if (patchWidth < 1 || patchHeight < 1) {
            throw new IllegalArgumentException("patches must be at least one pixel in size");
        }
        final ImmutableList.Builder<GridTract> gridTracts = ImmutableList.builder();
        for (final TractInfo tract : tracts) {
            gridTracts.add(new GridTract(tract, patchWidth, patchHeight));
        }
        this.tracts = gridTracts.build();
        LOGGER.info("sky map has {} tracts with patches of {}×{} pixels", this.tracts.size(), patchWidth, patchHeight);
    }

    /**
     * Read a sky map from its JSON form, {@code {"patchSize": [width, height], "tracts": [{"id", "wcs", "bbox"}, ...]}}.
     * @param json a JSON object
     * @return a new sky map
     */
    public static GridSkyMap fromJson(JsonObject json) {
        final JsonArray patchSize = json.getJsonArray("patchSize");
        final JsonArray tractsJson = json.getJsonArray("tracts");
        if (patchSize == null || patchSize.size() != 2 || tractsJson == null) {
            throw new IllegalArgumentException("sky map requires patchSize[2] and tracts");
        }
        final ImmutableList.Builder<TractInfo> tracts = ImmutableList.builder();
        for (int index = 0; index < tractsJson.size(); index++) {
            final JsonObject tractJson = tractsJson.getJsonObject(index);
            final JsonObject bbox = tractJson.getJsonObject("bbox");
            if (bbox == null || tractJson.getJsonObject("wcs") == null || tractJson.getInteger("id") == null) {
                throw new IllegalArgumentException("tract requires id, wcs and bbox");
            }
            final PixelBox bounds = new PixelBox(bbox.getInteger("x", 0), bbox.getInteger("y", 0),
                    bbox.getInteger("width"), bbox.getInteger("height"));
            tracts.add(new TractInfo(tractJson.getInteger("id"), TanWcs.fromJson(tractJson.getJsonObject("wcs")), bounds));
        }
        return new GridSkyMap(tracts.build(), patchSize.getInteger(0), patchSize.getInteger(1));
    }

    @Override
    public TractInfo findTract(SkyPoint point) {
        TractInfo nearest = null;
        double nearestDistance = Double.POSITIVE_INFINITY;
        for (final GridTract gridTract : tracts) {
            final TractInfo tract = gridTract.tract;
            if (!tract.getBounds().contains(tract.getWcs().skyToPixel(point))) {
                continue;
            }
            final double distance = Angles.planarSeparationArcsec(point, gridTract.center, point.getDec());
            if (distance < nearestDistance) {
                nearest = tract;
                nearestDistance = distance;
            }
        }
        if (nearest == null) {
            throw new ImageNotFoundException("no tract contains " + point);
        }
        return nearest;
    }

    @Override
    public List<TractPatches> findTractPatchList(List<SkyPoint> corners) {
        final ImmutableList.Builder<TractPatches> found = ImmutableList.builder();
        for (final GridTract gridTract : tracts) {
            final TractInfo tract = gridTract.tract;
            double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
            double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
            boolean isProjected = true;
            for (final SkyPoint corner : corners) {
                final PixelPoint pixel = tract.getWcs().skyToPixel(corner);
                if (!pixel.isFinite()) {
                    isProjected = false;
                    break;
                }
                minX = Math.min(minX, pixel.getX());
                minY = Math.min(minY, pixel.getY());
                maxX = Math.max(maxX, pixel.getX());
                maxY = Math.max(maxY, pixel.getY());
            }
            if (!isProjected) {
                continue;
            }
            final PixelBox region = PixelBox.spanning((int) Math.floor(minX + 0.5), (int) Math.floor(minY + 0.5),
                    (int) Math.floor(maxX + 0.5), (int) Math.floor(maxY + 0.5));
            if (!region.overlaps(tract.getBounds())) {
                continue;
            }
            final ImmutableList.Builder<PatchInfo> patches = ImmutableList.builder();
            for (final PatchInfo patch : gridTract.patches) {
                if (patch.getBounds().overlaps(region)) {
                    patches.add(patch);
                }
            }
            final TractPatches tractPatches = new TractPatches(tract, patches.build());
            LOGGER.debug("{} overlaps region at {} in {} patches", tract, region, tractPatches.getPatches().size());
            found.add(tractPatches);
        }
        return found.build();
    }
}
