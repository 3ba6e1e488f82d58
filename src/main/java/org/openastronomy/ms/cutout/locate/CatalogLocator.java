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

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import org.openastronomy.ms.cutout.geom.Angles;
import org.openastronomy.ms.cutout.geom.PixelPoint;
import org.openastronomy.ms.cutout.geom.SkyPoint;
import org.openastronomy.ms.cutout.store.TileMetadata;
import org.openastronomy.ms.cutout.store.TileReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in-memory catalog of tile footprints searched exhaustively.
 * Among the tiles containing a point the one whose center is at the least squared coordinate distance wins.
 */
public class CatalogLocator implements SpatialLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogLocator.class);

    /* A tile footprint with its center computed once. */
    private static class Entry {

        final TileMetadata metadata;
        final SkyPoint center;

        Entry(TileMetadata metadata) {
            this.metadata = metadata;
            this.center = metadata.getCenter();
        }
    }

    private final List<Entry> entries;

    /**
     * @param tiles the tiles to catalog, those without a coordinate transform are ignored
     */
    public CatalogLocator(Collection<TileMetadata> tiles) {
        final ImmutableList.Builder<Entry> entries = ImmutableList.builder();
        int ignored = 0;
        for (final TileMetadata tile : tiles) {
            if (tile.getWcs() == null) {
                ignored++;
            } else {
                entries.add(new Entry(tile));
            }
        }
        this.entries = entries.build();
        if (ignored > 0) {
            LOGGER.warn("ignored {} tiles that have no coordinate transform", ignored);
        }
        LOGGER.info("cataloged {} tiles", this.entries.size());
    }

    private static double squaredDistance(SkyPoint from, SkyPoint to) {
        final double deltaRa = Angles.keepWithin180(from.getRa(), to.getRa()) - from.getRa();
        final double deltaDec = to.getDec() - from.getDec();
        return deltaRa * deltaRa + deltaDec * deltaDec;
    }

    @Override
    public Optional<TileReference> nearestTileContaining(SkyPoint point, String filter) {
        Entry nearest = null;
        double nearestDistance = Double.POSITIVE_INFINITY;
        for (final Entry entry : entries) {
            if (filter != null && !filter.equals(entry.metadata.getFilter())) {
                continue;
            }
            final PixelPoint pixel = entry.metadata.getWcs().skyToPixel(point);
            if (!entry.metadata.getBounds().contains(pixel)) {
                continue;
            }
            final double distance = squaredDistance(point, entry.center);
            if (distance < nearestDistance) {
                nearest = entry;
                nearestDistance = distance;
            }
        }
        if (nearest == null) {
            LOGGER.debug("no tile contains {} in filter {}", point, filter);
            return Optional.empty();
        }
        return Optional.of(nearest.metadata.getReference());
    }
}
